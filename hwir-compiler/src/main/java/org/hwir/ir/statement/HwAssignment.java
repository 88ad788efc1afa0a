package org.hwir.ir.statement;

import org.hwir.ir.IHwInnerNode;
import org.hwir.ir.SourceInfo;
import org.hwir.ir.expression.HwExpression;

/** A statement driving {@code destination} with the value of {@code source}. */
public abstract class HwAssignment extends HwStatement {
    public final HwExpression destination;
    public final HwExpression source;

    protected HwAssignment(SourceInfo info, HwExpression destination, HwExpression source) {
        super(info);
        this.destination = destination;
        this.source = source;
    }

    /** The same kind of assignment with new children. */
    public abstract HwAssignment replace(HwExpression destination, HwExpression source);

    @Override
    public boolean sameFields(IHwInnerNode other) {
        HwAssignment o = other.as(HwAssignment.class);
        if (o == null)
            return false;
        return this.getClass() == o.getClass() &&
                this.destination == o.destination &&
                this.source == o.source;
    }
}
