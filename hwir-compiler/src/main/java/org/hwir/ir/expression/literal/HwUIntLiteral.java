package org.hwir.ir.expression.literal;

import com.fasterxml.jackson.databind.JsonNode;
import org.hwir.compiler.backend.JsonDecoder;
import org.hwir.compiler.visitors.inner.InnerVisitor;
import org.hwir.ir.SourceInfo;
import org.hwir.ir.type.HwType;
import org.hwir.ir.type.HwTypeInteger;
import org.hwir.util.Utilities;

import java.math.BigInteger;

public final class HwUIntLiteral extends HwLiteral {
    public HwUIntLiteral(SourceInfo info, BigInteger value, int width) {
        super(info, HwTypeInteger.uint(width), value);
        if (value.signum() < 0)
            throw this.error("Negative unsigned literal " + value);
        if (value.bitLength() > width)
            throw this.error("Literal " + value + " does not fit in " + width + " bits");
    }

    public HwUIntLiteral(BigInteger value, int width) {
        this(SourceInfo.EMPTY, value, width);
    }

    /** A literal with the smallest width that can hold the value. */
    public HwUIntLiteral(BigInteger value) {
        this(value, minimumWidth(value));
    }

    public HwUIntLiteral(long value) {
        this(BigInteger.valueOf(value));
    }

    public static int minimumWidth(BigInteger value) {
        return Math.max(value.bitLength(), 1);
    }

    @Override
    public HwUIntLiteral withType(HwType type) {
        HwTypeInteger integer = type.to(HwTypeInteger.class);
        if (integer.signed)
            throw this.error("Unsigned literal with signed type " + type);
        if (integer.width == this.getWidth())
            return this;
        return new HwUIntLiteral(this.sourceInfo, this.value, integer.width);
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
    public static HwUIntLiteral fromJson(JsonNode node, JsonDecoder decoder) {
        BigInteger value = parseValue(Utilities.getStringProperty(node, "value"));
        int width = getJsonType(node, decoder).to(HwTypeInteger.class).width;
        return new HwUIntLiteral(value, width);
    }
}
