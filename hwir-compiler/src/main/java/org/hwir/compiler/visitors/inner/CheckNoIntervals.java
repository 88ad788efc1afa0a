package org.hwir.compiler.visitors.inner;

import org.hwir.compiler.HwCompiler;
import org.hwir.compiler.visitors.VisitDecision;
import org.hwir.ir.HwPort;
import org.hwir.ir.expression.HwPrimOpExpression;
import org.hwir.ir.type.HwTypeInterval;

/** Checks that no interval types and no interval operations are left. */
public class CheckNoIntervals extends InnerVisitor {
    public CheckNoIntervals(HwCompiler compiler) {
        super(compiler);
    }

    @Override
    public VisitDecision preorder(HwPort port) {
        if (port.type.containsInterval())
            throw port.error("Port " + port.name + " still has an interval type: " + port.type);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(HwTypeInterval type) {
        throw type.error("Interval type left after lowering: " + type);
    }

    @Override
    public VisitDecision preorder(HwPrimOpExpression expression) {
        if (expression.op.isIntervalSpecific())
            throw expression.error("Interval operation left after lowering: " + expression);
        return VisitDecision.CONTINUE;
    }
}
