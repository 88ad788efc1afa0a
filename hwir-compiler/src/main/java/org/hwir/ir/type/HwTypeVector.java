package org.hwir.ir.type;

import com.fasterxml.jackson.databind.JsonNode;
import org.hwir.compiler.backend.JsonDecoder;
import org.hwir.compiler.visitors.VisitDecision;
import org.hwir.compiler.visitors.inner.InnerVisitor;
import org.hwir.ir.SourceInfo;
import org.hwir.util.IIndentStream;
import org.hwir.util.Utilities;

import java.util.Objects;

/** A fixed-size array of elements of the same type. */
public class HwTypeVector extends HwType {
    public final HwType elementType;
    public final int size;

    public HwTypeVector(SourceInfo info, HwType elementType, int size) {
        super(info);
        this.elementType = elementType;
        this.size = size;
    }

    public HwTypeVector(HwType elementType, int size) {
        this(SourceInfo.EMPTY, elementType, size);
    }

    @Override
    public boolean containsInterval() {
        return this.elementType.containsInterval();
    }

    @Override
    public boolean sameType(HwType other) {
        HwTypeVector o = other.as(HwTypeVector.class);
        if (o == null)
            return false;
        return this.size == o.size && this.elementType.sameType(o.elementType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.size, this.elementType.hashCode());
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.property("elementType");
        this.elementType.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.elementType)
                .append("[")
                .append(this.size)
                .append("]");
    }

    @SuppressWarnings("unused")
    public static HwTypeVector fromJson(JsonNode node, JsonDecoder decoder) {
        HwType elementType = HwType.fromJsonType(node, "elementType", decoder);
        int size = Utilities.getIntProperty(node, "size");
        return new HwTypeVector(elementType, size);
    }
}
