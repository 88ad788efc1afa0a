package org.hwir.ir.expression.literal;

import com.fasterxml.jackson.databind.JsonNode;
import org.hwir.compiler.backend.JsonDecoder;
import org.hwir.compiler.visitors.inner.InnerVisitor;
import org.hwir.ir.SourceInfo;
import org.hwir.ir.type.HwType;
import org.hwir.ir.type.HwTypeInteger;
import org.hwir.util.Utilities;

import java.math.BigInteger;

public final class HwSIntLiteral extends HwLiteral {
    public HwSIntLiteral(SourceInfo info, BigInteger value, int width) {
        super(info, HwTypeInteger.sint(width), value);
        if (minimumWidth(value) > width)
            throw this.error("Literal " + value + " does not fit in " + width + " bits");
    }

    public HwSIntLiteral(BigInteger value, int width) {
        this(SourceInfo.EMPTY, value, width);
    }

    /** A literal with the smallest two's complement width that can hold the value. */
    public HwSIntLiteral(BigInteger value) {
        this(value, minimumWidth(value));
    }

    public HwSIntLiteral(long value) {
        this(BigInteger.valueOf(value));
    }

    public static int minimumWidth(BigInteger value) {
        return value.bitLength() + 1;
    }

    @Override
    public HwSIntLiteral withType(HwType type) {
        HwTypeInteger integer = type.to(HwTypeInteger.class);
        if (!integer.signed)
            throw this.error("Signed literal with unsigned type " + type);
        if (integer.width == this.getWidth())
            return this;
        return new HwSIntLiteral(this.sourceInfo, this.value, integer.width);
    }

    @Override
    public void accept(InnerVisitor visitor) {
        if (visitor.preorder(this).stop()) return;
        visitor.push(this);
        visitor.property("type");
        this.type.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @SuppressWarnings("unused")
    public static HwSIntLiteral fromJson(JsonNode node, JsonDecoder decoder) {
        BigInteger value = parseValue(Utilities.getStringProperty(node, "value"));
        int width = getJsonType(node, decoder).to(HwTypeInteger.class).width;
        return new HwSIntLiteral(value, width);
    }
}
