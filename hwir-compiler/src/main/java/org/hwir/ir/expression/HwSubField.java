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

/** Access to a field of a bundle-typed expression. */
public final class HwSubField extends HwExpression {
    public final HwExpression expression;
    public final String name;

    public HwSubField(SourceInfo info, HwExpression expression, String name, HwType type) {
        super(info, type);
        this.expression = expression;
        this.name = name;
    }

    public HwSubField(HwExpression expression, String name, HwType type) {
        this(SourceInfo.EMPTY, expression, name, type);
    }

    @Override
    public HwSubField withType(HwType type) {
        if (type == this.type)
            return this;
        return new HwSubField(this.sourceInfo, this.expression, this.name, type);
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.property("type");
        this.type.accept(visitor);
        visitor.property("expression");
        this.expression.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IHwInnerNode other) {
        HwSubField o = other.as(HwSubField.class);
        if (o == null)
            return false;
        return this.expression == o.expression &&
                this.name.equals(o.name) &&
                this.type == o.type;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.expression)
                .append(".")
                .append(this.name);
    }

    @SuppressWarnings("unused")
    public static HwSubField fromJson(JsonNode node, JsonDecoder decoder) {
        HwType type = getJsonType(node, decoder);
        HwExpression expression = fromJsonInner(node, "expression", decoder, HwExpression.class);
        String name = Utilities.getStringProperty(node, "name");
        return new HwSubField(expression, name, type);
    }
}
