package org.hwir.ir;

import org.hwir.compiler.IHasSourcePositionRange;
import org.hwir.compiler.errors.SourcePosition;
import org.hwir.compiler.errors.SourcePositionRange;

import javax.annotation.Nullable;

/** Source location attached to an IR node, as produced by the front-end
 * that generated the circuit. */
public class SourceInfo implements IHasSourcePositionRange {
    @Nullable
    public final String file;
    public final SourcePositionRange range;

    public static final SourceInfo EMPTY = new SourceInfo(null, SourcePositionRange.INVALID);

    public SourceInfo(@Nullable String file, SourcePositionRange range) {
        this.file = file;
        this.range = range;
    }

    public SourceInfo(String file, int line, int column) {
        this(file, new SourcePositionRange(
                new SourcePosition(line, column), new SourcePosition(line, column)));
    }

    public boolean isEmpty() {
        return this.file == null && !this.range.isValid();
    }

    @Override
    public SourcePositionRange getPositionRange() {
        return this.range;
    }

    @Override
    public String toString() {
        if (this.isEmpty())
            return "";
        return "@[" + (this.file != null ? this.file + " " : "") + this.range.start + "]";
    }
}
