package org.hwir.ir.statement;

import com.fasterxml.jackson.databind.JsonNode;
import org.hwir.compiler.backend.JsonDecoder;
import org.hwir.compiler.visitors.VisitDecision;
import org.hwir.compiler.visitors.inner.InnerVisitor;
import org.hwir.ir.IHwInnerNode;
import org.hwir.ir.SourceInfo;
import org.hwir.util.IIndentStream;

/** Empty statement. */
public final class HwSkip extends HwStatement {
    public HwSkip(SourceInfo info) {
        super(info);
    }

    public HwSkip() {
        this(SourceInfo.EMPTY);
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IHwInnerNode other) {
        return other.is(HwSkip.class);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("skip");
    }

    @SuppressWarnings("unused")
    public static HwSkip fromJson(JsonNode node, JsonDecoder decoder) {
        return new HwSkip();
    }
}
