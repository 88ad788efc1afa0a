package org.hwir.ir.type;

import com.fasterxml.jackson.databind.JsonNode;
import org.hwir.compiler.backend.JsonDecoder;
import org.hwir.compiler.visitors.VisitDecision;
import org.hwir.compiler.visitors.inner.InnerVisitor;
import org.hwir.ir.SourceInfo;
import org.hwir.util.IIndentStream;
import org.hwir.util.Utilities;

import java.util.Objects;

/** A two's complement signed (SInt) or unsigned (UInt) integer of a fixed width. */
public class HwTypeInteger extends HwType {
    public final int width;
    public final boolean signed;

    public HwTypeInteger(SourceInfo info, int width, boolean signed) {
        super(info);
        this.width = width;
        this.signed = signed;
        if (width <= 0)
            throw this.error("Integer type with non-positive width " + width);
    }

    public HwTypeInteger(int width, boolean signed) {
        this(SourceInfo.EMPTY, width, signed);
    }

    public static HwTypeInteger uint(int width) {
        return new HwTypeInteger(width, false);
    }

    public static HwTypeInteger sint(int width) {
        return new HwTypeInteger(width, true);
    }

    public HwTypeInteger withWidth(int width) {
        if (width == this.width)
            return this;
        return new HwTypeInteger(this.sourceInfo, width, this.signed);
    }

    public HwTypeInteger withSigned(boolean signed) {
        if (signed == this.signed)
            return this;
        return new HwTypeInteger(this.sourceInfo, this.width, signed);
    }

    @Override
    public boolean sameType(HwType other) {
        HwTypeInteger o = other.as(HwTypeInteger.class);
        if (o == null)
            return false;
        return this.width == o.width && this.signed == o.signed;
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.width, this.signed);
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.signed ? "SInt" : "UInt")
                .append("<")
                .append(this.width)
                .append(">");
    }

    @SuppressWarnings("unused")
    public static HwTypeInteger fromJson(JsonNode node, JsonDecoder decoder) {
        int width = Utilities.getIntProperty(node, "width");
        boolean signed = Utilities.getBooleanProperty(node, "signed");
        return new HwTypeInteger(width, signed);
    }
}
