package org.hwir.ir;

import com.fasterxml.jackson.databind.JsonNode;
import org.hwir.compiler.backend.JsonDecoder;
import org.hwir.compiler.visitors.VisitDecision;
import org.hwir.compiler.visitors.inner.InnerVisitor;
import org.hwir.ir.type.HwType;
import org.hwir.util.IIndentStream;
import org.hwir.util.Utilities;

/** A module port. */
public final class HwPort extends HwNode implements IHwInnerNode, IHasType {
    public final String name;
    public final Direction direction;
    public final HwType type;

    public HwPort(SourceInfo info, String name, Direction direction, HwType type) {
        super(info);
        this.name = name;
        this.direction = direction;
        this.type = type;
    }

    public HwPort(String name, Direction direction, HwType type) {
        this(SourceInfo.EMPTY, name, direction, type);
    }

    public static HwPort input(String name, HwType type) {
        return new HwPort(name, Direction.INPUT, type);
    }

    public static HwPort output(String name, HwType type) {
        return new HwPort(name, Direction.OUTPUT, type);
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
        HwPort o = other.as(HwPort.class);
        if (o == null)
            return false;
        return this.name.equals(o.name) &&
                this.direction == o.direction &&
                this.type == o.type;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.direction.text)
                .append(" ")
                .append(this.name)
                .append(" : ")
                .append(this.type);
    }

    @SuppressWarnings("unused")
    public static HwPort fromJson(JsonNode node, JsonDecoder decoder) {
        String name = Utilities.getStringProperty(node, "name");
        Direction direction = Direction.fromText(Utilities.getStringProperty(node, "direction"));
        HwType type = HwType.fromJsonType(node, "type", decoder);
        return new HwPort(name, direction, type);
    }
}
