package org.hwir.ir.type;

import org.hwir.compiler.errors.CompilationError;
import org.hwir.compiler.errors.InternalCompilerError;
import org.hwir.util.Utilities;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

/** One end of the range of an interval type: either a known
 * exact value, or an open bound that has not been resolved yet. */
public abstract class IntervalBound {
    public static final IntervalBound OPEN = new Open();

    public static IntervalBound known(BigDecimal value) {
        return new Known(value);
    }

    public static IntervalBound known(long value) {
        return new Known(BigDecimal.valueOf(value));
    }

    public static IntervalBound known(String value) {
        return new Known(new BigDecimal(value));
    }

    public abstract boolean isKnown();

    /** The exact value of a known bound. */
    public abstract BigDecimal getValue();

    /** The integer encoding of this bound with the specified number of
     * fractional bits: floor(value * 2^point). */
    public BigInteger adjusted(int point) {
        BigDecimal scale = new BigDecimal(BigInteger.ONE.shiftLeft(point));
        return this.getValue()
                .multiply(scale)
                .setScale(0, RoundingMode.FLOOR)
                .toBigInteger();
    }

    public abstract boolean same(IntervalBound other);

    /** Representation used in JSON files; "?" stands for an open bound. */
    public abstract String toJsonString();

    public static IntervalBound fromJsonString(String value) {
        if (value.equals("?"))
            return OPEN;
        try {
            return known(value);
        } catch (NumberFormatException ex) {
            throw new CompilationError("Malformed interval bound " + Utilities.singleQuote(value), ex);
        }
    }

    static final class Known extends IntervalBound {
        final BigDecimal value;

        Known(BigDecimal value) {
            this.value = value;
        }

        @Override
        public boolean isKnown() {
            return true;
        }

        @Override
        public BigDecimal getValue() {
            return this.value;
        }

        @Override
        public boolean same(IntervalBound other) {
            return other.isKnown() && this.value.compareTo(other.getValue()) == 0;
        }

        @Override
        public String toJsonString() {
            return this.value.toPlainString();
        }

        @Override
        public String toString() {
            return this.value.stripTrailingZeros().toPlainString();
        }
    }

    static final class Open extends IntervalBound {
        @Override
        public boolean isKnown() {
            return false;
        }

        @Override
        public BigDecimal getValue() {
            throw new InternalCompilerError("Value of open interval bound");
        }

        @Override
        public boolean same(IntervalBound other) {
            return !other.isKnown();
        }

        @Override
        public String toJsonString() {
            return "?";
        }

        @Override
        public String toString() {
            return "?";
        }
    }
}
