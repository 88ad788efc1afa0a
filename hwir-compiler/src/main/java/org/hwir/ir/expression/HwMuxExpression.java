package org.hwir.ir.expression;

import com.fasterxml.jackson.databind.JsonNode;
import org.hwir.compiler.backend.JsonDecoder;
import org.hwir.compiler.visitors.VisitDecision;
import org.hwir.compiler.visitors.inner.InnerVisitor;
import org.hwir.ir.IHwInnerNode;
import org.hwir.ir.SourceInfo;
import org.hwir.ir.type.HwType;
import org.hwir.ir.type.HwTypeUnknown;
import org.hwir.util.IIndentStream;

/** Selects one of two values depending on a one-bit condition. */
public final class HwMuxExpression extends HwExpression {
    public final HwExpression condition;
    public final HwExpression positive;
    public final HwExpression negative;

    public HwMuxExpression(SourceInfo info, HwType type, HwExpression condition,
                           HwExpression positive, HwExpression negative) {
        super(info, type);
        this.condition = condition;
        this.positive = positive;
        this.negative = negative;
    }

    public HwMuxExpression(HwExpression condition, HwExpression positive, HwExpression negative) {
        this(SourceInfo.EMPTY, HwTypeUnknown.INSTANCE, condition, positive, negative);
    }

    @Override
    public HwMuxExpression withType(HwType type) {
        if (type == this.type)
            return this;
        return new HwMuxExpression(this.sourceInfo, type, this.condition, this.positive, this.negative);
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.property("type");
        this.type.accept(visitor);
        visitor.property("condition");
        this.condition.accept(visitor);
        visitor.property("positive");
        this.positive.accept(visitor);
        visitor.property("negative");
        this.negative.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IHwInnerNode other) {
        HwMuxExpression o = other.as(HwMuxExpression.class);
        if (o == null)
            return false;
        return this.type == o.type &&
                this.condition == o.condition &&
                this.positive == o.positive &&
                this.negative == o.negative;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("mux(")
                .append(this.condition)
                .append(", ")
                .append(this.positive)
                .append(", ")
                .append(this.negative)
                .append(")");
    }

    @SuppressWarnings("unused")
    public static HwMuxExpression fromJson(JsonNode node, JsonDecoder decoder) {
        HwType type = getJsonType(node, decoder);
        HwExpression condition = fromJsonInner(node, "condition", decoder, HwExpression.class);
        HwExpression positive = fromJsonInner(node, "positive", decoder, HwExpression.class);
        HwExpression negative = fromJsonInner(node, "negative", decoder, HwExpression.class);
        return new HwMuxExpression(SourceInfo.EMPTY, type, condition, positive, negative);
    }
}
