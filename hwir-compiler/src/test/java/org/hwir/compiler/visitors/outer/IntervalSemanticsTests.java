package org.hwir.compiler.visitors.outer;

import org.hwir.compiler.BaseLoweringTests;
import org.hwir.ir.HwPort;
import org.hwir.ir.expression.HwExpression;
import org.hwir.ir.expression.HwPrimOp;
import org.hwir.ir.type.HwType;
import org.hwir.ir.type.HwTypeInteger;
import org.hwir.ir.type.HwTypeInterval;
import org.hwir.util.Linq;
import org.junit.Assert;
import org.junit.Test;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/** Evaluates lowered clip and wrap operations on every value of the input range. */
public class IntervalSemanticsTests extends BaseLoweringTests {
    static HwExpression lowered(HwPrimOp op, HwType aType, HwType bType, HwTypeInterval result) {
        HwPort a = HwPort.input("a", aType);
        HwPort b = HwPort.input("b", bType);
        return source(lower(connection(Linq.list(a, b), result, op(result, op, ref(a), ref(b)))), 0);
    }

    static BigInteger run(HwExpression expression, BigInteger a) {
        Map<String, BigInteger> environment = new HashMap<>();
        environment.put("a", a);
        return evaluate(expression, environment);
    }

    static void checkClip(HwTypeInterval input, HwTypeInterval range) {
        HwExpression clip = lowered(HwPrimOp.CLIP, input, range, range);
        BigInteger lo = range.adjustedLower();
        BigInteger hi = range.adjustedUpper();
        for (BigInteger v = input.adjustedLower(); v.compareTo(input.adjustedUpper()) <= 0; v = v.add(BigInteger.ONE)) {
            Assert.assertEquals("clip of " + v + " with " + clip, clamp(v, lo, hi), run(clip, v));
        }
    }

    static void checkWrap(HwTypeInterval input, HwTypeInterval range) {
        HwExpression wrap = lowered(HwPrimOp.WRAP, input, range, range);
        BigInteger lo = range.adjustedLower();
        BigInteger hi = range.adjustedUpper();
        for (BigInteger v = input.adjustedLower(); v.compareTo(input.adjustedUpper()) <= 0; v = v.add(BigInteger.ONE)) {
            Assert.assertEquals("wrap of " + v + " with " + wrap, floorMod(v, lo, hi), run(wrap, v));
        }
    }

    @Test
    public void clipPassThrough() {
        checkClip(interval("-1", "1", 2), interval("-2", "2", 2));
    }

    @Test
    public void clipBothSides() {
        checkClip(interval("-2", "2", 2), interval("-1", "1", 2));
        checkClip(interval("-1.75", "1.5", 2), interval("-0.5", "0.75", 2));
    }

    @Test
    public void clipOneSide() {
        checkClip(interval("-4", "1", 0), interval("-2", "2", 0));
        checkClip(interval("-1", "4", 0), interval("-2", "2", 0));
        checkClip(interval("-20", "-3", 0), interval("-10", "-5", 0));
        checkClip(interval("3", "20", 1), interval("5", "10", 1));
    }

    @Test
    public void clipAlignsInput() {
        // The input is rescaled to the binary point of the range before clipping
        HwTypeInterval range = interval("-1", "1", 1);
        HwExpression clip = lowered(HwPrimOp.CLIP, interval("-4", "4", 0), range, range);
        for (long v = -4; v <= 4; v++) {
            BigInteger expected = clamp(BigInteger.valueOf(2 * v), BigInteger.valueOf(-2), BigInteger.valueOf(2));
            Assert.assertEquals(expected, run(clip, BigInteger.valueOf(v)));
        }
    }

    @Test
    public void wrapPassThrough() {
        checkWrap(interval("2", "5", 0), interval("0", "7", 0));
    }

    @Test
    public void wrapSingleCorrection() {
        checkWrap(interval("-3", "5", 0), interval("0", "7", 0));
        checkWrap(interval("-7", "7", 0), interval("0", "7", 0));
        checkWrap(interval("2", "12", 0), interval("0", "7", 0));
        checkWrap(interval("0", "14", 0), interval("0", "7", 0));
        checkWrap(interval("-5", "12", 0), interval("0", "7", 0));
    }

    @Test
    public void wrapNegativeRange() {
        checkWrap(interval("-9", "-1", 0), interval("-6", "-3", 0));
        checkWrap(interval("-30", "10", 0), interval("-5", "-2", 0));
        checkWrap(interval("-2", "1.75", 2), interval("-1", "0.5", 2));
    }

    @Test
    public void wrapGeneric() {
        checkWrap(interval("-20", "30", 0), interval("0", "7", 0));
        checkWrap(interval("-8", "15", 0), interval("0", "7", 0));
        checkWrap(interval("-40", "40", 0), interval("3", "5", 0));
        checkWrap(interval("-50", "50", 1), interval("-1.5", "2", 1));
    }

    @Test
    public void wrapUnsignedRange() {
        HwExpression wrap = lowered(HwPrimOp.WRAP, interval("-20", "30", 0),
                HwTypeInteger.uint(3), interval("0", "7", 0));
        for (long v = -20; v <= 30; v++)
            Assert.assertEquals(BigInteger.valueOf(Math.floorMod(v, 8)), run(wrap, BigInteger.valueOf(v)));
    }

    @Test
    public void wrapSignedRange() {
        HwExpression wrap = lowered(HwPrimOp.WRAP, interval("-20", "20", 0),
                HwTypeInteger.sint(4), interval("-8", "7", 0));
        for (long v = -20; v <= 20; v++) {
            BigInteger expected = floorMod(BigInteger.valueOf(v), BigInteger.valueOf(-8), BigInteger.valueOf(7));
            Assert.assertEquals(expected, run(wrap, BigInteger.valueOf(v)));
        }
    }

    @Test
    public void castUnsigned() {
        HwPort u = HwPort.input("u", HwTypeInteger.uint(4));
        HwTypeInterval result = interval("0", "15", 0);
        HwExpression cast = source(lower(connection(Linq.list(u), result,
                op(result, HwPrimOp.AS_INTERVAL, ref(u)))), 0);
        for (long v = 0; v < 16; v++) {
            Map<String, BigInteger> environment = new HashMap<>();
            environment.put("u", BigInteger.valueOf(v));
            // Values with the top bit set stay positive
            Assert.assertEquals(BigInteger.valueOf(v), evaluate(cast, environment));
        }
    }
}
