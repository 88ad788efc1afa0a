package org.hwir.compiler.visitors.inner;

import java.math.BigInteger;

/** Code generated for a clip operation, chosen by comparing the
 * range of the input with the range of the result.  All bounds are
 * adjusted to the common binary point. */
public enum ClipStrategy {
    /** The input range is contained in the result range. */
    PASS_THROUGH,
    /** Only values below the lower bound need to be clamped. */
    CLAMP_LOW,
    /** Only values above the upper bound need to be clamped. */
    CLAMP_HIGH,
    CLAMP_BOTH;

    public static ClipStrategy choose(BigInteger lo, BigInteger hi, BigInteger inLo, BigInteger inHi) {
        boolean highOk = hi.compareTo(inHi) >= 0;
        boolean lowOk = lo.compareTo(inLo) <= 0;
        if (highOk && lowOk)
            return PASS_THROUGH;
        if (highOk)
            return CLAMP_LOW;
        if (lowOk)
            return CLAMP_HIGH;
        return CLAMP_BOTH;
    }
}
