package org.hwir.compiler.visitors.inner;

import org.hwir.compiler.HwCompiler;
import org.hwir.compiler.visitors.VisitDecision;
import org.hwir.ir.HwModuleBase;
import org.hwir.ir.HwPort;
import org.hwir.ir.IHwInnerNode;
import org.hwir.ir.expression.HwExpression;
import org.hwir.ir.expression.HwMuxExpression;
import org.hwir.ir.expression.HwPrimOpExpression;
import org.hwir.ir.expression.HwReference;
import org.hwir.ir.expression.HwSubField;
import org.hwir.ir.expression.HwSubIndex;
import org.hwir.ir.statement.HwDeclaration;
import org.hwir.ir.statement.HwDefNode;
import org.hwir.ir.statement.HwDefRegister;
import org.hwir.ir.statement.HwDefWire;
import org.hwir.ir.type.HwField;
import org.hwir.ir.type.HwType;
import org.hwir.ir.type.HwTypeBundle;
import org.hwir.ir.type.HwTypeInteger;
import org.hwir.ir.type.HwTypeInterval;
import org.hwir.ir.type.HwTypeVector;
import org.hwir.util.Logger;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Recomputes the type of every expression of a module, bottom-up,
 * starting from the declared types of ports, wires and registers.
 * The type of a node is the type of its value.  Interval types must
 * have been removed before this pass runs. */
public class InferTypes extends InnerRewriteVisitor {
    /** Types of the names declared in the current module. */
    final Map<String, HwType> scope;

    public InferTypes(HwCompiler compiler) {
        super(compiler, false);
        this.scope = new HashMap<>();
    }

    @Override
    public void setModuleContext(HwModuleBase module) {
        super.setModuleContext(module);
        this.scope.clear();
    }

    void declare(String name, HwType type) {
        Logger.INSTANCE.belowLevel(this, 2)
                .append("Declaring ")
                .append(name)
                .append(" : ")
                .append(type)
                .newline();
        this.scope.put(name, type);
    }

    /** Reuse the existing type object when the computed type is the same. */
    static HwType keep(HwType existing, HwType computed) {
        if (existing.sameType(computed))
            return existing;
        return computed;
    }

    static HwTypeInteger integer(HwExpression expression) {
        HwTypeInteger result = expression.type.as(HwTypeInteger.class);
        if (result == null)
            throw expression.error("Expected an integer-typed operand, found " +
                    expression + " : " + expression.type);
        return result;
    }

    /** Result type of a primitive operation applied to operands with known types. */
    public static HwType resultType(HwPrimOpExpression expression, List<HwExpression> operands) {
        if (expression.op.isIntervalSpecific())
            throw expression.error("Interval operation reached type inference: " + expression);
        HwTypeInteger first = integer(operands.get(0));
        int w1 = first.width;
        return switch (expression.op) {
            case ADD, SUB -> first.withWidth(Math.max(w1, integer(operands.get(1)).width) + 1);
            case MUL -> first.withWidth(w1 + integer(operands.get(1)).width);
            case DIV -> first.signed ? first.withWidth(w1 + 1) : first;
            case REM -> first.withWidth(Math.min(w1, integer(operands.get(1)).width));
            case LT, LEQ, GT, GEQ, EQ, NEQ -> HwTypeInteger.uint(1);
            case PAD -> first.withWidth(Math.max(w1, expression.constant(0)));
            case AS_UINT -> first.withSigned(false);
            case AS_SINT -> first.withSigned(true);
            case SHL -> first.withWidth(w1 + expression.constant(0));
            case SHR -> first.withWidth(Math.max(w1 - expression.constant(0), 1));
            case CVT -> first.signed ? first : HwTypeInteger.sint(w1 + 1);
            case NEG -> HwTypeInteger.sint(w1 + 1);
            case NOT -> HwTypeInteger.uint(w1);
            case AND, OR, XOR -> HwTypeInteger.uint(Math.max(w1, integer(operands.get(1)).width));
            case BITS -> {
                int hi = expression.constant(0);
                int lo = expression.constant(1);
                if (hi < lo || hi >= w1 || lo < 0)
                    throw expression.error("Illegal bit range [" + hi + ", " + lo +
                            "] for operand of width " + w1);
                yield HwTypeInteger.uint(hi - lo + 1);
            }
            case CAT -> HwTypeInteger.uint(w1 + integer(operands.get(1)).width);
            case AS_INTERVAL, INCP, DECP, SETP, CLIP, WRAP ->
                    throw expression.error("Interval operation reached type inference: " + expression);
        };
    }

    @Override
    public VisitDecision preorder(HwTypeInterval type) {
        throw type.error("Interval type reached type inference: " + type);
    }

    @Override
    public VisitDecision preorder(HwPort port) {
        super.preorder(port);
        HwPort result = this.getResult().to(HwPort.class);
        this.declare(result.name, result.type);
        return VisitDecision.STOP;
    }

    VisitDecision declared(VisitDecision decision) {
        HwDeclaration result = this.getResult().to(HwDeclaration.class);
        this.declare(result.name, result.getType());
        return decision;
    }

    @Override
    public VisitDecision preorder(HwDefWire wire) {
        return this.declared(super.preorder(wire));
    }

    @Override
    public VisitDecision preorder(HwDefRegister register) {
        // The reset value may refer to the register itself
        this.declare(register.name, register.type);
        return this.declared(super.preorder(register));
    }

    @Override
    public VisitDecision preorder(HwDefNode node) {
        return this.declared(super.preorder(node));
    }

    @Override
    public VisitDecision preorder(HwReference reference) {
        HwType type = this.scope.get(reference.name);
        if (type == null)
            throw reference.error("Reference to undeclared name " + reference.name);
        this.map(reference, reference.withType(keep(reference.type, type)));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(HwSubField expression) {
        this.push(expression);
        HwExpression source = this.transform(expression.expression);
        this.pop(expression);
        HwTypeBundle bundle = source.type.as(HwTypeBundle.class);
        if (bundle == null)
            throw expression.error("Field access to non-bundle " + source + " : " + source.type);
        HwField field = bundle.getField(expression.name);
        if (field == null)
            throw expression.error("Bundle " + source.type + " has no field " + expression.name);
        IHwInnerNode result = new HwSubField(expression.getSourceInfo(), source, expression.name,
                keep(expression.type, field.type));
        this.map(expression, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(HwSubIndex expression) {
        this.push(expression);
        HwExpression source = this.transform(expression.expression);
        this.pop(expression);
        HwTypeVector vector = source.type.as(HwTypeVector.class);
        if (vector == null)
            throw expression.error("Indexing non-vector " + source + " : " + source.type);
        if (expression.index < 0 || expression.index >= vector.size)
            throw expression.error("Index " + expression.index + " out of bounds for " + vector);
        IHwInnerNode result = new HwSubIndex(expression.getSourceInfo(), source, expression.index,
                keep(expression.type, vector.elementType));
        this.map(expression, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(HwPrimOpExpression expression) {
        this.push(expression);
        List<HwExpression> operands = this.transformExpressions(expression.operands);
        this.pop(expression);
        HwType type = keep(expression.type, resultType(expression, operands));
        IHwInnerNode result = new HwPrimOpExpression(expression.getSourceInfo(), type,
                expression.op, operands, expression.constants);
        this.map(expression, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(HwMuxExpression expression) {
        this.push(expression);
        HwExpression condition = this.transform(expression.condition);
        HwExpression positive = this.transform(expression.positive);
        HwExpression negative = this.transform(expression.negative);
        this.pop(expression);
        HwType type;
        if (positive.type.sameType(negative.type)) {
            type = positive.type;
        } else {
            HwTypeInteger left = integer(positive);
            HwTypeInteger right = integer(negative);
            if (left.signed != right.signed)
                throw expression.error("Mux branches have different signedness: " +
                        left + " and " + right);
            type = left.withWidth(Math.max(left.width, right.width));
        }
        IHwInnerNode result = new HwMuxExpression(expression.getSourceInfo(),
                keep(expression.type, type), condition, positive, negative);
        this.map(expression, result);
        return VisitDecision.STOP;
    }
}
