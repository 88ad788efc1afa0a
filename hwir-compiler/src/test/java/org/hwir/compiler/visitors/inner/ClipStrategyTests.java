package org.hwir.compiler.visitors.inner;

import org.junit.Assert;
import org.junit.Test;

import java.math.BigInteger;

public class ClipStrategyTests {
    static ClipStrategy choose(long lo, long hi, long inLo, long inHi) {
        return ClipStrategy.choose(BigInteger.valueOf(lo), BigInteger.valueOf(hi),
                BigInteger.valueOf(inLo), BigInteger.valueOf(inHi));
    }

    @Test
    public void inputInsideRange() {
        Assert.assertEquals(ClipStrategy.PASS_THROUGH, choose(-4, 4, -2, 2));
        Assert.assertEquals(ClipStrategy.PASS_THROUGH, choose(-4, 4, -4, 4));
        Assert.assertEquals(ClipStrategy.PASS_THROUGH, choose(0, 0, 0, 0));
    }

    @Test
    public void inputBelowRange() {
        Assert.assertEquals(ClipStrategy.CLAMP_LOW, choose(-4, 4, -8, 4));
        Assert.assertEquals(ClipStrategy.CLAMP_LOW, choose(2, 10, -100, 3));
    }

    @Test
    public void inputAboveRange() {
        Assert.assertEquals(ClipStrategy.CLAMP_HIGH, choose(-4, 4, -4, 8));
        Assert.assertEquals(ClipStrategy.CLAMP_HIGH, choose(-10, -2, -3, 100));
    }

    @Test
    public void inputAroundRange() {
        Assert.assertEquals(ClipStrategy.CLAMP_BOTH, choose(-4, 4, -8, 8));
        Assert.assertEquals(ClipStrategy.CLAMP_BOTH, choose(-4, 4, -5, 5));
    }
}
