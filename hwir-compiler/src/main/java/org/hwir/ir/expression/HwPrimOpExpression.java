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
import org.hwir.util.Linq;
import org.hwir.util.Utilities;

import java.util.List;

/** Application of a primitive operation to operands and integer constants. */
public final class HwPrimOpExpression extends HwExpression {
    public final HwPrimOp op;
    public final List<HwExpression> operands;
    public final List<Integer> constants;

    public HwPrimOpExpression(SourceInfo info, HwType type, HwPrimOp op,
                              List<HwExpression> operands, List<Integer> constants) {
        super(info, type);
        this.op = op;
        this.operands = operands;
        this.constants = constants;
        if (operands.size() != op.operandCount)
            throw this.error("Operation " + op + " expects " + op.operandCount +
                    " operands, got " + operands.size());
        if (constants.size() != op.constantCount)
            throw this.error("Operation " + op + " expects " + op.constantCount +
                    " constants, got " + constants.size());
    }

    public HwPrimOpExpression(HwType type, HwPrimOp op, List<HwExpression> operands, List<Integer> constants) {
        this(SourceInfo.EMPTY, type, op, operands, constants);
    }

    /** An operation without constants whose type will be inferred later. */
    public static HwPrimOpExpression create(HwPrimOp op, HwExpression... operands) {
        return new HwPrimOpExpression(HwTypeUnknown.INSTANCE, op, Linq.list(operands), Linq.list());
    }

    public HwExpression operand(int index) {
        return this.operands.get(index);
    }

    public int constant(int index) {
        return this.constants.get(index);
    }

    @Override
    public HwPrimOpExpression withType(HwType type) {
        if (type == this.type)
            return this;
        return new HwPrimOpExpression(this.sourceInfo, type, this.op, this.operands, this.constants);
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.property("type");
        this.type.accept(visitor);
        visitor.startArrayProperty("operands");
        int index = 0;
        for (HwExpression operand: this.operands) {
            visitor.propertyIndex(index);
            index++;
            operand.accept(visitor);
        }
        visitor.endArrayProperty("operands");
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IHwInnerNode other) {
        HwPrimOpExpression o = other.as(HwPrimOpExpression.class);
        if (o == null)
            return false;
        return this.op == o.op &&
                this.type == o.type &&
                Linq.same(this.operands, o.operands) &&
                this.constants.equals(o.constants);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append(this.op.text)
                .append("(")
                .joinI(", ", this.operands);
        for (int constant: this.constants)
            builder.append(", ").append(constant);
        return builder.append(")");
    }

    @SuppressWarnings("unused")
    public static HwPrimOpExpression fromJson(JsonNode node, JsonDecoder decoder) {
        HwType type = getJsonType(node, decoder);
        HwPrimOp op = HwPrimOp.fromText(Utilities.getStringProperty(node, "op"));
        List<HwExpression> operands = fromJsonInnerList(node, "operands", decoder, HwExpression.class);
        JsonNode constants = Utilities.getProperty(node, "constants");
        List<Integer> values = Linq.list(Linq.map(constants.elements(), JsonNode::asInt));
        return new HwPrimOpExpression(type, op, operands, values);
    }
}
