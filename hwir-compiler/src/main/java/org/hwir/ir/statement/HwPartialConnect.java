package org.hwir.ir.statement;

import com.fasterxml.jackson.databind.JsonNode;
import org.hwir.compiler.backend.JsonDecoder;
import org.hwir.compiler.visitors.VisitDecision;
import org.hwir.compiler.visitors.inner.InnerVisitor;
import org.hwir.ir.SourceInfo;
import org.hwir.ir.expression.HwExpression;
import org.hwir.util.IIndentStream;

/** Connection of the fields that the destination and source have in common. */
public final class HwPartialConnect extends HwAssignment {
    public HwPartialConnect(SourceInfo info, HwExpression destination, HwExpression source) {
        super(info, destination, source);
    }

    public HwPartialConnect(HwExpression destination, HwExpression source) {
        this(SourceInfo.EMPTY, destination, source);
    }

    @Override
    public HwPartialConnect replace(HwExpression destination, HwExpression source) {
        return new HwPartialConnect(this.sourceInfo, destination, source);
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.property("destination");
        this.destination.accept(visitor);
        visitor.property("source");
        this.source.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.destination)
                .append(" <- ")
                .append(this.source);
    }

    @SuppressWarnings("unused")
    public static HwPartialConnect fromJson(JsonNode node, JsonDecoder decoder) {
        HwExpression destination = fromJsonInner(node, "destination", decoder, HwExpression.class);
        HwExpression source = fromJsonInner(node, "source", decoder, HwExpression.class);
        return new HwPartialConnect(destination, source);
    }
}
