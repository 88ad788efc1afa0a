package org.hwir.ir.type;

import com.fasterxml.jackson.databind.JsonNode;
import org.hwir.compiler.backend.JsonDecoder;
import org.hwir.compiler.visitors.VisitDecision;
import org.hwir.compiler.visitors.inner.InnerVisitor;
import org.hwir.ir.SourceInfo;
import org.hwir.util.IIndentStream;

public class HwTypeClock extends HwType {
    public HwTypeClock(SourceInfo info) {
        super(info);
    }

    public HwTypeClock() {
        this(SourceInfo.EMPTY);
    }

    @Override
    public boolean sameType(HwType other) {
        return other.is(HwTypeClock.class);
    }

    @Override
    public int hashCode() {
        return 7;
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
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("Clock");
    }

    @SuppressWarnings("unused")
    public static HwTypeClock fromJson(JsonNode node, JsonDecoder decoder) {
        return new HwTypeClock();
    }
}
