package org.hwir.compiler.visitors.inner;

import org.hwir.compiler.HwCompiler;
import org.hwir.compiler.visitors.VisitDecision;
import org.hwir.ir.expression.HwExpression;
import org.hwir.ir.expression.HwMuxExpression;
import org.hwir.ir.expression.HwPrimOp;
import org.hwir.ir.expression.HwPrimOpExpression;
import org.hwir.ir.statement.HwAssignment;
import org.hwir.ir.statement.HwStatement;
import org.hwir.ir.type.HwType;
import org.hwir.ir.type.HwTypeInterval;
import org.hwir.util.Linq;

import java.util.List;

/**
 * Inserts binary point adjustments (incp and decp) so that:
 * - the interval-typed operands of additions, subtractions, comparisons,
 *   clip and wrap all have the same binary point, the largest among them,
 * - both branches of an interval-typed mux have the same binary point,
 * - a value assigned to an interval-typed destination has the binary point of the destination.
 * setp operations are replaced by the corresponding adjustment.
 * Multiplication is not aligned: the points of the operands add up. */
public class AlignBinaryPoints extends InnerRewriteVisitor {
    public AlignBinaryPoints(HwCompiler compiler) {
        super(compiler, false);
    }

    /** Rescale an interval-typed expression to have the 'desired' binary point.
     * Returns the expression itself if it already has this point. */
    public static HwExpression fixBP(int desired, HwExpression expression) {
        HwTypeInterval type = expression.type.as(HwTypeInterval.class);
        if (type == null)
            throw expression.error("Cannot change the binary point of " + expression +
                    " with non-interval type " + expression.type);
        if (!type.hasKnownPoint())
            throw expression.error("Binary point of " + expression + " is unknown");
        int current = type.getPoint();
        if (desired == current)
            return expression;
        HwPrimOp op = desired > current ? HwPrimOp.INCP : HwPrimOp.DECP;
        int amount = Math.abs(desired - current);
        return new HwPrimOpExpression(expression.getSourceInfo(), type.withPoint(desired),
                op, Linq.list(expression), Linq.list(amount));
    }

    static int maxPoint(List<HwExpression> expressions) {
        int result = 0;
        for (HwExpression expression: expressions)
            result = Math.max(result, expression.getIntervalType().getPoint());
        return result;
    }

    @Override
    public VisitDecision preorder(HwPrimOpExpression expression) {
        this.push(expression);
        HwType type = this.transform(expression.type);
        List<HwExpression> operands = this.transformExpressions(expression.operands);
        this.pop(expression);

        HwExpression result;
        if (expression.op == HwPrimOp.SETP) {
            result = fixBP(expression.constant(0), operands.get(0));
        } else {
            if (expression.op.requiresAlignedPoints() &&
                    Linq.all(operands, o -> o.type.isInterval())) {
                int point = maxPoint(operands);
                operands = Linq.map(operands, o -> fixBP(point, o));
            }
            result = new HwPrimOpExpression(expression.getSourceInfo(), type,
                    expression.op, operands, expression.constants);
        }
        this.map(expression, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(HwMuxExpression expression) {
        this.push(expression);
        HwType type = this.transform(expression.type);
        HwExpression condition = this.transform(expression.condition);
        HwExpression positive = this.transform(expression.positive);
        HwExpression negative = this.transform(expression.negative);
        this.pop(expression);
        if (type.isInterval()) {
            int point = maxPoint(Linq.list(positive, negative));
            positive = fixBP(point, positive);
            negative = fixBP(point, negative);
        }
        HwExpression result = new HwMuxExpression(expression.getSourceInfo(), type,
                condition, positive, negative);
        this.map(expression, result);
        return VisitDecision.STOP;
    }

    @Override
    protected VisitDecision assignment(HwAssignment statement) {
        this.push(statement);
        HwExpression destination = this.transform(statement.destination);
        HwExpression source = this.transform(statement.source);
        this.pop(statement);
        HwTypeInterval type = destination.type.as(HwTypeInterval.class);
        if (type != null)
            source = fixBP(type.getPoint(), source);
        HwStatement result = statement.replace(destination, source);
        this.map(statement, result);
        return VisitDecision.STOP;
    }
}
