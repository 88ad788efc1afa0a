package org.hwir.ir.type;

import com.fasterxml.jackson.databind.JsonNode;
import org.hwir.compiler.backend.JsonDecoder;
import org.hwir.compiler.visitors.VisitDecision;
import org.hwir.compiler.visitors.inner.InnerVisitor;
import org.hwir.ir.SourceInfo;
import org.hwir.util.IIndentStream;

/** Type of an expression that has not been inferred yet.
 * Expressions synthesized by lowering passes carry this type
 * until type inference runs. */
public class HwTypeUnknown extends HwType {
    public static final HwTypeUnknown INSTANCE = new HwTypeUnknown();

    private HwTypeUnknown() {
        super(SourceInfo.EMPTY);
    }

    @Override
    public boolean sameType(HwType other) {
        return other.is(HwTypeUnknown.class);
    }

    @Override
    public int hashCode() {
        return 11;
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
        return builder.append("?");
    }

    @SuppressWarnings("unused")
    public static HwTypeUnknown fromJson(JsonNode node, JsonDecoder decoder) {
        return INSTANCE;
    }
}
