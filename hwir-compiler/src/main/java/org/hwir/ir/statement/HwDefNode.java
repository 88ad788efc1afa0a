package org.hwir.ir.statement;

import com.fasterxml.jackson.databind.JsonNode;
import org.hwir.compiler.backend.JsonDecoder;
import org.hwir.compiler.visitors.VisitDecision;
import org.hwir.compiler.visitors.inner.InnerVisitor;
import org.hwir.ir.IHwInnerNode;
import org.hwir.ir.SourceInfo;
import org.hwir.ir.expression.HwExpression;
import org.hwir.ir.type.HwType;
import org.hwir.util.IIndentStream;
import org.hwir.util.Utilities;

/** Gives a name to the value of an expression.  The type of the node is the type of the value. */
public final class HwDefNode extends HwDeclaration {
    public final HwExpression value;

    public HwDefNode(SourceInfo info, String name, HwExpression value) {
        super(info, name);
        this.value = value;
    }

    public HwDefNode(String name, HwExpression value) {
        this(SourceInfo.EMPTY, name, value);
    }

    @Override
    public HwType getType() {
        return this.value.getType();
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.property("value");
        this.value.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IHwInnerNode other) {
        HwDefNode o = other.as(HwDefNode.class);
        if (o == null)
            return false;
        return this.name.equals(o.name) &&
                this.value == o.value;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("node ")
                .append(this.name)
                .append(" = ")
                .append(this.value);
    }

    @SuppressWarnings("unused")
    public static HwDefNode fromJson(JsonNode node, JsonDecoder decoder) {
        String name = Utilities.getStringProperty(node, "name");
        HwExpression value = fromJsonInner(node, "value", decoder, HwExpression.class);
        return new HwDefNode(name, value);
    }
}
