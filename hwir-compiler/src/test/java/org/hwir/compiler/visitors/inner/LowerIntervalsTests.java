package org.hwir.compiler.visitors.inner;

import org.hwir.compiler.BaseLoweringTests;
import org.hwir.compiler.errors.InternalCompilerError;
import org.hwir.ir.HwCircuit;
import org.hwir.ir.HwPort;
import org.hwir.ir.expression.HwExpression;
import org.hwir.ir.expression.HwPrimOp;
import org.hwir.ir.expression.HwPrimOpExpression;
import org.hwir.ir.expression.HwReference;
import org.hwir.ir.type.HwType;
import org.hwir.ir.type.HwTypeClock;
import org.hwir.ir.type.HwTypeInteger;
import org.hwir.ir.type.HwTypeInterval;
import org.hwir.ir.type.IntervalBound;
import org.hwir.util.Linq;
import org.junit.Assert;
import org.junit.Test;

public class LowerIntervalsTests extends BaseLoweringTests {
    /** Lower the connection of 'op(a, b)' to an output of the result type; returns the lowered source. */
    static HwExpression lowerBinary(HwPrimOp op, HwType aType, HwType bType, HwTypeInterval result) {
        HwPort a = HwPort.input("a", aType);
        HwPort b = HwPort.input("b", bType);
        HwExpression expression = op(result, op, ref(a), ref(b));
        HwCircuit lowered = lower(connection(Linq.list(a, b), result, expression));
        return source(lowered, 0);
    }

    static HwExpression lowerClip(HwTypeInterval input, HwTypeInterval range) {
        return lowerBinary(HwPrimOp.CLIP, input, range, range);
    }

    static HwExpression lowerWrap(HwTypeInterval input, HwType range, HwTypeInterval result) {
        return lowerBinary(HwPrimOp.WRAP, input, range, result);
    }

    @Test
    public void loweredWidth() {
        Assert.assertEquals(5, LowerIntervals.loweredWidth(interval("-2", "2", 2)));
        Assert.assertEquals(5, LowerIntervals.loweredWidth(interval("-1.5", "2.25", 2)));
        Assert.assertEquals(5, LowerIntervals.loweredWidth(interval("0", "15", 0)));
        Assert.assertEquals(1, LowerIntervals.loweredWidth(interval("-1", "0", 0)));
        // The binary point needs one more bit than the range
        Assert.assertEquals(5, LowerIntervals.loweredWidth(interval("0", "0.25", 4)));
    }

    @Test
    public void lowerType() {
        HwTypeInteger type = LowerIntervals.lowerType(interval("-4", "4", 0));
        Assert.assertTrue(type.sameType(HwTypeInteger.sint(4)));
    }

    @Test
    public void openBoundIsFatal() {
        HwTypeInterval open = new HwTypeInterval(IntervalBound.OPEN, IntervalBound.known(3), 0);
        try {
            LowerIntervals.lowerType(open);
            Assert.fail();
        } catch (InternalCompilerError e) {
            Assert.assertTrue(e.getMessage().contains("open bound"));
        }
    }

    @Test
    public void saturateBothSides() {
        // [-2, 2] with 2 fractional bits clipped to [-1, 1]
        HwTypeInterval input = interval("-2", "2", 2);
        HwTypeInterval range = interval("-1", "1", 2);
        HwExpression lowered = lowerClip(input, range);
        Assert.assertEquals("mux(gt(a, 4), 4, mux(lt(a, -4), -4, a))", lowered.toString());
    }

    @Test
    public void saturateOneSide() {
        Assert.assertEquals("mux(lt(a, -2), -2, a)",
                lowerClip(interval("-4", "1", 0), interval("-2", "2", 0)).toString());
        Assert.assertEquals("mux(gt(a, 2), 2, a)",
                lowerClip(interval("-1", "4", 0), interval("-2", "2", 0)).toString());
    }

    @Test
    public void saturatePassThrough() {
        HwPrimOpExpression clip = op(interval("-2", "2", 2), HwPrimOp.CLIP,
                new HwReference("a", interval("-1", "1", 2)),
                new HwReference("b", interval("-2", "2", 2)));
        HwExpression a = new HwReference("a", HwTypeInteger.sint(4));
        Assert.assertSame(a, LowerIntervals.lowerClip(clip, a));
    }

    @Test
    public void wrapPassThrough() {
        HwPrimOpExpression wrap = op(interval("0", "7", 0), HwPrimOp.WRAP,
                new HwReference("a", interval("2", "5", 0)),
                new HwReference("b", interval("0", "7", 0)));
        HwExpression a = new HwReference("a", HwTypeInteger.sint(4));
        Assert.assertSame(a, LowerIntervals.lowerWrap(wrap, a));
    }

    @Test
    public void wrapCorrections() {
        HwTypeInterval range = interval("0", "7", 0);
        Assert.assertEquals("mux(lt(a, 0), add(a, 8), a)",
                lowerWrap(interval("-3", "5", 0), range, range).toString());
        Assert.assertEquals("mux(gt(a, 7), sub(a, 8), a)",
                lowerWrap(interval("2", "12", 0), range, range).toString());
        Assert.assertEquals("mux(gt(a, 7), sub(a, 8), mux(lt(a, 0), add(a, 8), a))",
                lowerWrap(interval("-5", "12", 0), range, range).toString());
    }

    @Test
    public void wrapGeneric() {
        HwTypeInterval range = interval("0", "7", 0);
        String rem = "rem(sub(a, 0), 8)";
        Assert.assertEquals("add(mux(lt(" + rem + ", 0), add(" + rem + ", 8), " + rem + "), 0)",
                lowerWrap(interval("-20", "30", 0), range, range).toString());
    }

    @Test
    public void wrapUnsignedRange() {
        String rem = "rem(sub(a, 0), 8)";
        Assert.assertEquals("add(mux(lt(" + rem + ", 0), add(" + rem + ", 8), " + rem + "), 0)",
                lowerWrap(interval("-20", "30", 0), HwTypeInteger.uint(3), interval("0", "7", 0)).toString());
    }

    @Test
    public void wrapSignedRange() {
        HwExpression lowered = lowerWrap(interval("-20", "20", 0), HwTypeInteger.sint(4), interval("-8", "7", 0));
        Assert.assertEquals("asSInt(bits(a, 3, 0))", lowered.toString());
        Assert.assertTrue(lowered.type.sameType(HwTypeInteger.sint(4)));
    }

    @Test(expected = InternalCompilerError.class)
    public void wrapIllegalRange() {
        HwPrimOpExpression wrap = op(interval("0", "7", 0), HwPrimOp.WRAP,
                new HwReference("a", interval("2", "5", 0)),
                new HwReference("b", new HwTypeClock()));
        LowerIntervals.lowerWrap(wrap, new HwReference("a", HwTypeInteger.sint(4)));
    }

    @Test
    public void castUnsignedToInterval() {
        HwPort u = HwPort.input("u", HwTypeInteger.uint(4));
        HwTypeInterval result = interval("0", "15", 0);
        HwExpression cast = op(result, HwPrimOp.AS_INTERVAL, ref(u));
        HwExpression lowered = source(lower(connection(Linq.list(u), result, cast)), 0);
        Assert.assertEquals("asSInt(pad(u, 5))", lowered.toString());
        Assert.assertTrue(lowered.type.sameType(HwTypeInteger.sint(5)));
    }

    @Test
    public void castSignedToInterval() {
        HwPort s = HwPort.input("s", HwTypeInteger.sint(4));
        HwTypeInterval result = interval("-8", "7", 0);
        HwExpression cast = op(result, HwPrimOp.AS_INTERVAL, ref(s));
        HwExpression lowered = source(lower(connection(Linq.list(s), result, cast)), 0);
        Assert.assertEquals("asSInt(s)", lowered.toString());
    }

    @Test
    public void rescaleBecomesShift() {
        HwExpression lowered = lowerBinary(HwPrimOp.ADD, interval("-4", "4", 1),
                interval("-1", "1", 3), interval("-5", "5", 3));
        Assert.assertEquals("add(shl(a, 2), b)", lowered.toString());

        HwPort a = HwPort.input("a", interval("-1", "1", 3));
        HwTypeInterval result = interval("-1", "1", 1);
        HwExpression setp = new HwPrimOpExpression(result, HwPrimOp.SETP, Linq.list(ref(a)), Linq.list(1));
        HwExpression down = source(lower(connection(Linq.list(a), result, setp)), 0);
        Assert.assertEquals("shr(a, 2)", down.toString());
    }

    @Test(expected = InternalCompilerError.class)
    public void unalignedSetPointIsFatal() {
        HwExpression setp = new HwPrimOpExpression(interval("-1", "1", 1), HwPrimOp.SETP,
                Linq.list(new HwReference("a", interval("-1", "1", 3))), Linq.list(1));
        new LowerIntervals(testCompiler()).apply(setp);
    }

    @Test
    public void lowerPortTypes() {
        HwPort a = HwPort.input("a", interval("-2", "2", 2));
        HwPort b = HwPort.input("b", interval("-1", "1", 2));
        HwTypeInterval range = interval("-1", "1", 2);
        HwCircuit lowered = lower(connection(Linq.list(a, b), range,
                op(range, HwPrimOp.CLIP, ref(a), ref(b))));
        Assert.assertTrue(top(lowered).getPort("a").type.sameType(HwTypeInteger.sint(5)));
        Assert.assertTrue(top(lowered).getPort("b").type.sameType(HwTypeInteger.sint(4)));
        Assert.assertTrue(top(lowered).getPort("out").type.sameType(HwTypeInteger.sint(4)));
    }
}
