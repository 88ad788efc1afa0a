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

/** Access to an element of a vector-typed expression with a constant index. */
public final class HwSubIndex extends HwExpression {
    public final HwExpression expression;
    public final int index;

    public HwSubIndex(SourceInfo info, HwExpression expression, int index, HwType type) {
        super(info, type);
        this.expression = expression;
        this.index = index;
    }

    public HwSubIndex(HwExpression expression, int index, HwType type) {
        this(SourceInfo.EMPTY, expression, index, type);
    }

    @Override
    public HwSubIndex withType(HwType type) {
        if (type == this.type)
            return this;
        return new HwSubIndex(this.sourceInfo, this.expression, this.index, type);
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
        HwSubIndex o = other.as(HwSubIndex.class);
        if (o == null)
            return false;
        return this.expression == o.expression &&
                this.index == o.index &&
                this.type == o.type;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.expression)
                .append("[")
                .append(this.index)
                .append("]");
    }

    @SuppressWarnings("unused")
    public static HwSubIndex fromJson(JsonNode node, JsonDecoder decoder) {
        HwType type = getJsonType(node, decoder);
        HwExpression expression = fromJsonInner(node, "expression", decoder, HwExpression.class);
        int index = Utilities.getIntProperty(node, "index");
        return new HwSubIndex(expression, index, type);
    }
}
