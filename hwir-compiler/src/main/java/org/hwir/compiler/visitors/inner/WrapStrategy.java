package org.hwir.compiler.visitors.inner;

import java.math.BigInteger;

/** Code generated for a wrap operation into the range [wrapLo, wrapHi]
 * of an input in the range [inLo, inHi].  When every input is at most one
 * period of the wrap range away from it, a single addition or subtraction
 * of the period suffices. */
public enum WrapStrategy {
    PASS_THROUGH,
    /** Inputs below wrapLo are corrected by adding the period. */
    CORRECT_LOW,
    /** Inputs above wrapHi are corrected by subtracting the period. */
    CORRECT_HIGH,
    CORRECT_BOTH,
    /** Floor modulo reduction, for inputs which may be several periods away. */
    GENERIC;

    public static WrapStrategy choose(BigInteger wrapLo, BigInteger wrapHi, BigInteger inLo, BigInteger inHi) {
        BigInteger range = wrapHi.subtract(wrapLo);
        boolean p1 = wrapHi.compareTo(inHi) >= 0;
        boolean p2 = wrapLo.compareTo(inLo) <= 0;
        boolean p3 = inHi.subtract(range).compareTo(wrapHi) <= 0;
        boolean p4 = inLo.add(range).compareTo(wrapLo) >= 0;
        if (p1 && p2)
            return PASS_THROUGH;
        if (p1 && p4)
            return CORRECT_LOW;
        if (p2 && p3)
            return CORRECT_HIGH;
        if (!p1 && !p2 && p3 && p4)
            return CORRECT_BOTH;
        return GENERIC;
    }
}
