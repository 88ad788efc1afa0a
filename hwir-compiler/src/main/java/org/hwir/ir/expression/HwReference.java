package org.hwir.ir.expression;

import com.fasterxml.jackson.databind.JsonNode;
import org.hwir.compiler.backend.JsonDecoder;
import org.hwir.compiler.visitors.VisitDecision;
import org.hwir.compiler.visitors.inner.InnerVisitor;
import org.hwir.ir.IHwInnerNode;
import org.hwir.ir.SourceInfo;
import org.hwir.ir.type.HwType;
import org.hwir.util.IIndentStream;
import org.hwir.util.Utilities;

/** Reference to a port, wire, register, or node by name. */
public final class HwReference extends HwExpression {
    public final String name;

    public HwReference(SourceInfo info, String name, HwType type) {
        super(info, type);
        this.name = name;
    }

    public HwReference(String name, HwType type) {
        this(SourceInfo.EMPTY, name, type);
    }

    @Override
    public HwReference withType(HwType type) {
        if (type == this.type)
            return this;
        return new HwReference(this.sourceInfo, this.name, type);
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.property("type");
        this.type.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IHwInnerNode other) {
        HwReference o = other.as(HwReference.class);
        if (o == null)
            return false;
        return this.name.equals(o.name) &&
                this.type == o.type;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.name);
    }

    @SuppressWarnings("unused")
    public static HwReference fromJson(JsonNode node, JsonDecoder decoder) {
        HwType type = getJsonType(node, decoder);
        String name = Utilities.getStringProperty(node, "name");
        return new HwReference(name, type);
    }
}
