package org.hwir.compiler.visitors.inner;

import org.hwir.compiler.HwCompiler;
import org.hwir.compiler.visitors.VisitDecision;
import org.hwir.ir.expression.HwExpression;
import org.hwir.ir.expression.HwMuxExpression;
import org.hwir.ir.expression.HwPrimOp;
import org.hwir.ir.expression.HwPrimOpExpression;
import org.hwir.ir.expression.literal.HwSIntLiteral;
import org.hwir.ir.type.HwType;
import org.hwir.ir.type.HwTypeInteger;
import org.hwir.ir.type.HwTypeInterval;
import org.hwir.ir.type.HwTypeUnknown;
import org.hwir.util.Linq;

import java.math.BigInteger;
import java.util.List;

/**
 * Replaces interval types with signed integer types, and interval
 * operations with integer operations.  Expects the binary points to have
 * been aligned by {@link AlignBinaryPoints}.  Decisions are made using
 * the types of the operands before lowering.  The nodes synthesized
 * have an unknown type, which is recomputed by {@link InferTypes}. */
public class LowerIntervals extends InnerRewriteVisitor {
    public LowerIntervals(HwCompiler compiler) {
        super(compiler, false);
    }

    /** Width of the signed integer representing values of an interval type. */
    public static int loweredWidth(HwTypeInterval type) {
        if (!type.hasKnownBounds())
            throw type.error("Cannot lower interval type with an open bound " + type);
        int intrinsic = type.intrinsicWidth();
        int point = type.getPoint();
        return intrinsic > point ? intrinsic : point + 1;
    }

    public static HwTypeInteger lowerType(HwTypeInterval type) {
        return new HwTypeInteger(type.getSourceInfo(), loweredWidth(type), true);
    }

    static HwExpression literal(BigInteger value) {
        return new HwSIntLiteral(value);
    }

    static HwExpression apply(HwPrimOp op, HwExpression... operands) {
        return HwPrimOpExpression.create(op, operands);
    }

    static HwExpression mux(HwExpression condition, HwExpression positive, HwExpression negative) {
        return new HwMuxExpression(condition, positive, negative);
    }

    /** Lower asInterval(operand); 'lowered' is the operand after lowering. */
    public static HwExpression lowerAsInterval(HwExpression operand, HwExpression lowered) {
        HwTypeInteger type = operand.type.as(HwTypeInteger.class);
        if (type != null && !type.signed) {
            // Zero-extend before reinterpreting, so the value stays non-negative
            int width = type.width + 1;
            HwExpression pad = new HwPrimOpExpression(lowered.getSourceInfo(), HwTypeInteger.uint(width),
                    HwPrimOp.PAD, Linq.list(lowered), Linq.list(width));
            return apply(HwPrimOp.AS_SINT, pad);
        }
        return apply(HwPrimOp.AS_SINT, lowered);
    }

    /** Lower clip(a, b): saturate 'a' to the range of the result type of 'clip'.
     * 'a' is the first operand after lowering. */
    public static HwExpression lowerClip(HwPrimOpExpression clip, HwExpression a) {
        HwTypeInterval result = clip.getIntervalType();
        HwTypeInterval input = clip.operand(0).getIntervalType();
        BigInteger lo = result.adjustedLower();
        BigInteger hi = result.adjustedUpper();
        ClipStrategy strategy = ClipStrategy.choose(lo, hi, input.adjustedLower(), input.adjustedUpper());
        return switch (strategy) {
            case PASS_THROUGH -> a;
            case CLAMP_LOW -> mux(apply(HwPrimOp.LT, a, literal(lo)), literal(lo), a);
            case CLAMP_HIGH -> mux(apply(HwPrimOp.GT, a, literal(hi)), literal(hi), a);
            case CLAMP_BOTH -> mux(apply(HwPrimOp.GT, a, literal(hi)), literal(hi),
                    mux(apply(HwPrimOp.LT, a, literal(lo)), literal(lo), a));
        };
    }

    /** Lower wrap(a, b): wrap 'a' around the range described by the type of 'b'.
     * 'a' is the first operand after lowering. */
    public static HwExpression lowerWrap(HwPrimOpExpression wrap, HwExpression a) {
        HwExpression b = wrap.operand(1);
        BigInteger wrapLo;
        BigInteger wrapHi;
        if (b.type.is(HwTypeInteger.class)) {
            HwTypeInteger integer = b.type.to(HwTypeInteger.class);
            if (integer.signed) {
                HwExpression bits = new HwPrimOpExpression(a.getSourceInfo(), HwTypeUnknown.INSTANCE,
                        HwPrimOp.BITS, Linq.list(a), Linq.list(integer.width - 1, 0));
                return apply(HwPrimOp.AS_SINT, bits);
            }
            wrapLo = BigInteger.ZERO;
            wrapHi = BigInteger.ONE.shiftLeft(integer.width).subtract(BigInteger.ONE);
        } else if (b.type.is(HwTypeInterval.class)) {
            HwTypeInterval interval = b.type.to(HwTypeInterval.class);
            wrapLo = interval.adjustedLower();
            wrapHi = interval.adjustedUpper();
        } else {
            throw b.error("Illegal type for the range of a wrap operation: " + b.type);
        }

        HwTypeInterval input = wrap.operand(0).getIntervalType();
        BigInteger period = wrapHi.subtract(wrapLo).add(BigInteger.ONE);
        WrapStrategy strategy = WrapStrategy.choose(wrapLo, wrapHi, input.adjustedLower(), input.adjustedUpper());
        return switch (strategy) {
            case PASS_THROUGH -> a;
            case CORRECT_LOW -> mux(apply(HwPrimOp.LT, a, literal(wrapLo)),
                    apply(HwPrimOp.ADD, a, literal(period)), a);
            case CORRECT_HIGH -> mux(apply(HwPrimOp.GT, a, literal(wrapHi)),
                    apply(HwPrimOp.SUB, a, literal(period)), a);
            case CORRECT_BOTH -> mux(apply(HwPrimOp.GT, a, literal(wrapHi)),
                    apply(HwPrimOp.SUB, a, literal(period)),
                    mux(apply(HwPrimOp.LT, a, literal(wrapLo)),
                            apply(HwPrimOp.ADD, a, literal(period)), a));
            case GENERIC -> {
                // rem truncates towards zero; negative remainders are moved up by one period
                HwExpression rem = apply(HwPrimOp.REM,
                        apply(HwPrimOp.SUB, a, literal(wrapLo)), literal(period));
                HwExpression floorMod = mux(apply(HwPrimOp.LT, rem, literal(BigInteger.ZERO)),
                        apply(HwPrimOp.ADD, rem, literal(period)), rem);
                yield apply(HwPrimOp.ADD, floorMod, literal(wrapLo));
            }
        };
    }

    @Override
    public VisitDecision preorder(HwTypeInterval type) {
        this.map(type, lowerType(type));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(HwPrimOpExpression expression) {
        this.push(expression);
        HwType type = this.transform(expression.type);
        List<HwExpression> operands = this.transformExpressions(expression.operands);
        this.pop(expression);

        HwExpression result = switch (expression.op) {
            case AS_INTERVAL -> lowerAsInterval(expression.operand(0), operands.get(0));
            case INCP -> new HwPrimOpExpression(expression.getSourceInfo(), type,
                    HwPrimOp.SHL, operands, expression.constants);
            case DECP -> new HwPrimOpExpression(expression.getSourceInfo(), type,
                    HwPrimOp.SHR, operands, expression.constants);
            case CLIP -> lowerClip(expression, operands.get(0));
            case WRAP -> lowerWrap(expression, operands.get(0));
            case SETP -> throw expression.error("Binary points must be aligned before lowering " + expression);
            case ADD, SUB, MUL, DIV, REM, LT, LEQ, GT, GEQ, EQ, NEQ, PAD, AS_UINT, AS_SINT,
                    SHL, SHR, CVT, NEG, NOT, AND, OR, XOR, BITS, CAT ->
                    new HwPrimOpExpression(expression.getSourceInfo(), type,
                            expression.op, operands, expression.constants);
        };
        this.map(expression, result);
        return VisitDecision.STOP;
    }
}
