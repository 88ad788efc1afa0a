package org.hwir.ir.expression;

import org.hwir.compiler.errors.InternalCompilerError;
import org.hwir.util.Utilities;

/** Primitive operations of the IR.  Each operation takes a fixed
 * number of expression operands and integer constants. */
public enum HwPrimOp {
    ADD("add", 2, 0),
    SUB("sub", 2, 0),
    MUL("mul", 2, 0),
    DIV("div", 2, 0),
    REM("rem", 2, 0),
    LT("lt", 2, 0),
    LEQ("leq", 2, 0),
    GT("gt", 2, 0),
    GEQ("geq", 2, 0),
    EQ("eq", 2, 0),
    NEQ("neq", 2, 0),
    PAD("pad", 1, 1),
    AS_UINT("asUInt", 1, 0),
    AS_SINT("asSInt", 1, 0),
    SHL("shl", 1, 1),
    SHR("shr", 1, 1),
    CVT("cvt", 1, 0),
    NEG("neg", 1, 0),
    NOT("not", 1, 0),
    AND("and", 2, 0),
    OR("or", 2, 0),
    XOR("xor", 2, 0),
    BITS("bits", 1, 2),
    CAT("cat", 2, 0),
    // Operations on interval types
    AS_INTERVAL("asInterval", 1, 0),
    // Increase the binary point, shifting the representation left
    INCP("incp", 1, 1),
    // Decrease the binary point, shifting the representation right
    DECP("decp", 1, 1),
    SETP("setp", 1, 1),
    CLIP("clip", 2, 0),
    WRAP("wrap", 2, 0);

    public final String text;
    public final int operandCount;
    public final int constantCount;

    HwPrimOp(String text, int operandCount, int constantCount) {
        this.text = text;
        this.operandCount = operandCount;
        this.constantCount = constantCount;
    }

    @Override
    public String toString() {
        return this.text;
    }

    public boolean isComparison() {
        return this == LT || this == LEQ || this == GT ||
                this == GEQ || this == EQ || this == NEQ;
    }

    /** Operations which only apply to interval-typed values. */
    public boolean isIntervalSpecific() {
        return this == AS_INTERVAL || this == INCP || this == DECP ||
                this == SETP || this == CLIP || this == WRAP;
    }

    /** Operations whose interval-typed operands must have the same binary point. */
    public boolean requiresAlignedPoints() {
        return this == ADD || this == SUB || this.isComparison() ||
                this == WRAP || this == CLIP;
    }

    public static HwPrimOp fromText(String text) {
        for (HwPrimOp op: HwPrimOp.values())
            if (op.text.equals(text))
                return op;
        throw new InternalCompilerError("Unknown primitive operation " + Utilities.singleQuote(text));
    }
}
