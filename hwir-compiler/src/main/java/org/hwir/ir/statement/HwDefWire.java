package org.hwir.ir.statement;

import com.fasterxml.jackson.databind.JsonNode;
import org.hwir.compiler.backend.JsonDecoder;
import org.hwir.compiler.visitors.VisitDecision;
import org.hwir.compiler.visitors.inner.InnerVisitor;
import org.hwir.ir.IHwInnerNode;
import org.hwir.ir.SourceInfo;
import org.hwir.ir.type.HwType;
import org.hwir.util.IIndentStream;
import org.hwir.util.Utilities;

public final class HwDefWire extends HwDeclaration {
    public final HwType type;

    public HwDefWire(SourceInfo info, String name, HwType type) {
        super(info, name);
        this.type = type;
    }

    public HwDefWire(String name, HwType type) {
        this(SourceInfo.EMPTY, name, type);
    }

    @Override
    public HwType getType() {
        return this.type;
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
        HwDefWire o = other.as(HwDefWire.class);
        if (o == null)
            return false;
        return this.name.equals(o.name) &&
                this.type == o.type;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("wire ")
                .append(this.name)
                .append(" : ")
                .append(this.type);
    }

    @SuppressWarnings("unused")
    public static HwDefWire fromJson(JsonNode node, JsonDecoder decoder) {
        String name = Utilities.getStringProperty(node, "name");
        HwType type = HwType.fromJsonType(node, "type", decoder);
        return new HwDefWire(name, type);
    }
}
