package org.hwir.compiler;

import org.hwir.compiler.errors.SourcePositionRange;

public interface IHasSourcePositionRange {
    SourcePositionRange getPositionRange();
}
