package org.hwir.ir.statement;

import com.fasterxml.jackson.databind.JsonNode;
import org.hwir.compiler.backend.JsonDecoder;
import org.hwir.compiler.visitors.VisitDecision;
import org.hwir.compiler.visitors.inner.InnerVisitor;
import org.hwir.ir.IHwInnerNode;
import org.hwir.ir.SourceInfo;
import org.hwir.ir.expression.HwExpression;
import org.hwir.util.IIndentStream;

/** Statements whose connections take effect depending on a one-bit predicate. */
public final class HwConditionally extends HwStatement {
    public final HwExpression predicate;
    public final HwStatement positive;
    public final HwStatement negative;

    public HwConditionally(SourceInfo info, HwExpression predicate,
                           HwStatement positive, HwStatement negative) {
        super(info);
        this.predicate = predicate;
        this.positive = positive;
        this.negative = negative;
    }

    public HwConditionally(HwExpression predicate, HwStatement positive, HwStatement negative) {
        this(SourceInfo.EMPTY, predicate, positive, negative);
    }

    public HwConditionally(HwExpression predicate, HwStatement positive) {
        this(predicate, positive, new HwSkip());
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.property("predicate");
        this.predicate.accept(visitor);
        visitor.property("positive");
        this.positive.accept(visitor);
        visitor.property("negative");
        this.negative.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IHwInnerNode other) {
        HwConditionally o = other.as(HwConditionally.class);
        if (o == null)
            return false;
        return this.predicate == o.predicate &&
                this.positive == o.positive &&
                this.negative == o.negative;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("when ")
                .append(this.predicate)
                .append(" ")
                .append(this.positive);
        if (!this.negative.is(HwSkip.class))
            builder.append(" else ")
                    .append(this.negative);
        return builder;
    }

    @SuppressWarnings("unused")
    public static HwConditionally fromJson(JsonNode node, JsonDecoder decoder) {
        HwExpression predicate = fromJsonInner(node, "predicate", decoder, HwExpression.class);
        HwStatement positive = fromJsonInner(node, "positive", decoder, HwStatement.class);
        HwStatement negative = fromJsonInner(node, "negative", decoder, HwStatement.class);
        return new HwConditionally(predicate, positive, negative);
    }
}
