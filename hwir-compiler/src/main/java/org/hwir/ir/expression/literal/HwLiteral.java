package org.hwir.ir.expression.literal;

import org.hwir.compiler.errors.CompilationError;
import org.hwir.ir.IHwInnerNode;
import org.hwir.ir.SourceInfo;
import org.hwir.ir.expression.HwExpression;
import org.hwir.ir.type.HwTypeInteger;
import org.hwir.util.IIndentStream;
import org.hwir.util.Utilities;

import java.math.BigInteger;

/** An integer constant with an explicit width. */
public abstract class HwLiteral extends HwExpression {
    public final BigInteger value;

    protected HwLiteral(SourceInfo info, HwTypeInteger type, BigInteger value) {
        super(info, type);
        this.value = value;
    }

    static BigInteger parseValue(String value) {
        try {
            return new BigInteger(value);
        } catch (NumberFormatException ex) {
            throw new CompilationError("Malformed literal value " + Utilities.singleQuote(value), ex);
        }
    }

    public HwTypeInteger getIntegerType() {
        return this.type.to(HwTypeInteger.class);
    }

    public int getWidth() {
        return this.getIntegerType().width;
    }

    @Override
    public boolean sameFields(IHwInnerNode other) {
        HwLiteral o = other.as(HwLiteral.class);
        if (o == null)
            return false;
        return this.getClass() == o.getClass() &&
                this.value.equals(o.value) &&
                this.type == o.type;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.value.toString());
    }
}
