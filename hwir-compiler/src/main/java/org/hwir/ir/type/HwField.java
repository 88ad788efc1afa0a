package org.hwir.ir.type;

import com.fasterxml.jackson.databind.JsonNode;
import org.hwir.compiler.backend.JsonDecoder;
import org.hwir.compiler.visitors.VisitDecision;
import org.hwir.compiler.visitors.inner.InnerVisitor;
import org.hwir.ir.HwNode;
import org.hwir.ir.IHwInnerNode;
import org.hwir.ir.SourceInfo;
import org.hwir.util.IIndentStream;
import org.hwir.util.Utilities;

/** A named field of a {@link HwTypeBundle}.  A flipped field flows
 * in the opposite direction of the bundle. */
public class HwField extends HwNode implements IHwInnerNode {
    public final String name;
    public final boolean flipped;
    public final HwType type;

    public HwField(SourceInfo info, String name, boolean flipped, HwType type) {
        super(info);
        this.name = name;
        this.flipped = flipped;
        this.type = type;
    }

    public HwField(String name, boolean flipped, HwType type) {
        this(SourceInfo.EMPTY, name, flipped, type);
    }

    public HwField withType(HwType type) {
        if (type == this.type)
            return this;
        return new HwField(this.sourceInfo, this.name, this.flipped, type);
    }

    public boolean sameField(HwField other) {
        return this.name.equals(other.name) &&
                this.flipped == other.flipped &&
                this.type.sameType(other.type);
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
        HwField o = other.as(HwField.class);
        if (o == null)
            return false;
        return this.name.equals(o.name) &&
                this.flipped == o.flipped &&
                this.type == o.type;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        if (this.flipped)
            builder.append("flip ");
        return builder.append(this.name)
                .append(" : ")
                .append(this.type);
    }

    @SuppressWarnings("unused")
    public static HwField fromJson(JsonNode node, JsonDecoder decoder) {
        String name = Utilities.getStringProperty(node, "name");
        boolean flipped = Utilities.getBooleanProperty(node, "flipped");
        HwType type = HwType.fromJsonType(node, "type", decoder);
        return new HwField(name, flipped, type);
    }
}
