package org.hwir.compiler.visitors.inner;

import org.junit.Assert;
import org.junit.Test;

import java.math.BigInteger;

public class WrapStrategyTests {
    static WrapStrategy choose(long wrapLo, long wrapHi, long inLo, long inHi) {
        return WrapStrategy.choose(BigInteger.valueOf(wrapLo), BigInteger.valueOf(wrapHi),
                BigInteger.valueOf(inLo), BigInteger.valueOf(inHi));
    }

    @Test
    public void passThrough() {
        Assert.assertEquals(WrapStrategy.PASS_THROUGH, choose(0, 7, 2, 5));
        Assert.assertEquals(WrapStrategy.PASS_THROUGH, choose(0, 7, 0, 7));
        Assert.assertEquals(WrapStrategy.PASS_THROUGH, choose(-8, -1, -6, -2));
    }

    @Test
    public void correctLow() {
        Assert.assertEquals(WrapStrategy.CORRECT_LOW, choose(0, 7, -3, 5));
        // Exactly one period below
        Assert.assertEquals(WrapStrategy.CORRECT_LOW, choose(0, 7, -7, 7));
        Assert.assertEquals(WrapStrategy.GENERIC, choose(0, 7, -8, 7));
    }

    @Test
    public void correctHigh() {
        Assert.assertEquals(WrapStrategy.CORRECT_HIGH, choose(0, 7, 2, 12));
        Assert.assertEquals(WrapStrategy.CORRECT_HIGH, choose(0, 7, 0, 14));
        Assert.assertEquals(WrapStrategy.GENERIC, choose(0, 7, 0, 15));
    }

    @Test
    public void correctBoth() {
        Assert.assertEquals(WrapStrategy.CORRECT_BOTH, choose(0, 7, -5, 12));
        Assert.assertEquals(WrapStrategy.CORRECT_BOTH, choose(-6, -3, -9, -1));
    }

    @Test
    public void generic() {
        Assert.assertEquals(WrapStrategy.GENERIC, choose(0, 7, -20, 30));
        Assert.assertEquals(WrapStrategy.GENERIC, choose(-5, -2, -30, 10));
        Assert.assertEquals(WrapStrategy.GENERIC, choose(0, 7, -8, 15));
    }

    @Test
    public void passThroughHasPriority() {
        // A single point range contains only itself
        Assert.assertEquals(WrapStrategy.PASS_THROUGH, choose(3, 3, 3, 3));
    }
}
