package org.hwir.compiler.visitors.inner;

import org.hwir.compiler.BaseLoweringTests;
import org.hwir.compiler.errors.InternalCompilerError;
import org.hwir.ir.HwCircuit;
import org.hwir.ir.HwPort;
import org.hwir.ir.SourceInfo;
import org.hwir.ir.expression.HwExpression;
import org.hwir.ir.expression.HwMuxExpression;
import org.hwir.ir.expression.HwPrimOp;
import org.hwir.ir.expression.HwPrimOpExpression;
import org.hwir.ir.expression.HwReference;
import org.hwir.ir.expression.HwSubField;
import org.hwir.ir.expression.HwSubIndex;
import org.hwir.ir.expression.literal.HwUIntLiteral;
import org.hwir.ir.statement.HwConnect;
import org.hwir.ir.statement.HwDefNode;
import org.hwir.ir.statement.HwDefRegister;
import org.hwir.ir.statement.HwDefWire;
import org.hwir.ir.type.HwField;
import org.hwir.ir.type.HwType;
import org.hwir.ir.type.HwTypeBundle;
import org.hwir.ir.type.HwTypeClock;
import org.hwir.ir.type.HwTypeInteger;
import org.hwir.ir.type.HwTypeUnknown;
import org.hwir.ir.type.HwTypeVector;
import org.hwir.util.Linq;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;
import java.util.Objects;

public class InferTypesTests extends BaseLoweringTests {
    static final HwReference S4 = new HwReference("s4", HwTypeInteger.sint(4));
    static final HwReference S6 = new HwReference("s6", HwTypeInteger.sint(6));
    static final HwReference U4 = new HwReference("u4", HwTypeInteger.uint(4));
    static final HwReference U6 = new HwReference("u6", HwTypeInteger.uint(6));

    static HwType resultType(HwPrimOp op, List<Integer> constants, HwExpression... operands) {
        HwPrimOpExpression expression = new HwPrimOpExpression(HwTypeUnknown.INSTANCE, op,
                Linq.list(operands), constants);
        return InferTypes.resultType(expression, expression.operands);
    }

    static HwType resultType(HwPrimOp op, HwExpression... operands) {
        return resultType(op, Linq.list(), operands);
    }

    static void check(HwType expected, HwType actual) {
        Assert.assertTrue("Expected " + expected + " got " + actual, expected.sameType(actual));
    }

    static HwCircuit infer(HwCircuit circuit) {
        return new InferTypes(testCompiler()).circuitRewriter().apply(circuit);
    }

    @Test
    public void arithmeticWidths() {
        check(HwTypeInteger.sint(7), resultType(HwPrimOp.ADD, S4, S6));
        check(HwTypeInteger.sint(7), resultType(HwPrimOp.SUB, S6, S4));
        check(HwTypeInteger.uint(7), resultType(HwPrimOp.ADD, U6, U4));
        check(HwTypeInteger.sint(10), resultType(HwPrimOp.MUL, S4, S6));
        check(HwTypeInteger.sint(5), resultType(HwPrimOp.DIV, S4, S6));
        check(HwTypeInteger.uint(4), resultType(HwPrimOp.DIV, U4, U6));
        check(HwTypeInteger.sint(4), resultType(HwPrimOp.REM, S6, S4));
        check(HwTypeInteger.sint(5), resultType(HwPrimOp.NEG, U4));
    }

    @Test
    public void comparisonWidths() {
        for (HwPrimOp op: Linq.list(HwPrimOp.LT, HwPrimOp.LEQ, HwPrimOp.GT,
                HwPrimOp.GEQ, HwPrimOp.EQ, HwPrimOp.NEQ))
            check(HwTypeInteger.uint(1), resultType(op, S4, S6));
    }

    @Test
    public void conversionWidths() {
        check(HwTypeInteger.sint(8), resultType(HwPrimOp.PAD, Linq.list(8), S4));
        check(HwTypeInteger.sint(4), resultType(HwPrimOp.PAD, Linq.list(2), S4));
        check(HwTypeInteger.uint(4), resultType(HwPrimOp.AS_UINT, S4));
        check(HwTypeInteger.sint(4), resultType(HwPrimOp.AS_SINT, U4));
        check(HwTypeInteger.sint(5), resultType(HwPrimOp.CVT, U4));
        check(HwTypeInteger.sint(4), resultType(HwPrimOp.CVT, S4));
    }

    @Test
    public void bitWidths() {
        check(HwTypeInteger.sint(7), resultType(HwPrimOp.SHL, Linq.list(3), S4));
        check(HwTypeInteger.sint(1), resultType(HwPrimOp.SHR, Linq.list(3), S4));
        check(HwTypeInteger.sint(1), resultType(HwPrimOp.SHR, Linq.list(10), S4));
        check(HwTypeInteger.uint(2), resultType(HwPrimOp.BITS, Linq.list(2, 1), S4));
        check(HwTypeInteger.uint(10), resultType(HwPrimOp.CAT, S4, U6));
        check(HwTypeInteger.uint(6), resultType(HwPrimOp.AND, S4, U6));
        check(HwTypeInteger.uint(4), resultType(HwPrimOp.NOT, S4));
    }

    @Test(expected = InternalCompilerError.class)
    public void illegalBitRange() {
        resultType(HwPrimOp.BITS, Linq.list(4, 0), S4);
    }

    @Test(expected = InternalCompilerError.class)
    public void intervalOperation() {
        resultType(HwPrimOp.CLIP, S4, S6);
    }

    @Test
    public void inferDeclarations() {
        HwPort p = HwPort.input("p", HwTypeInteger.sint(4));
        HwPort out = HwPort.output("out", HwTypeInteger.sint(16));
        HwDefWire wire = new HwDefWire("w", HwTypeInteger.sint(8));
        HwExpression add = HwPrimOpExpression.create(HwPrimOp.ADD,
                new HwReference("p", HwTypeUnknown.INSTANCE), new HwReference("w", HwTypeUnknown.INSTANCE));
        HwDefNode node = new HwDefNode("n", add);
        HwConnect connect = new HwConnect(ref(out), new HwReference("n", HwTypeUnknown.INSTANCE));
        HwCircuit result = infer(circuit(Linq.list(p, out), wire, node, connect));

        HwDefNode inferred = statement(result, 1).to(HwDefNode.class);
        check(HwTypeInteger.sint(9), inferred.getType());
        check(HwTypeInteger.sint(9), source(result, 2).type);
    }

    @Test
    public void inferMux() {
        HwPort c = HwPort.input("c", HwTypeInteger.uint(1));
        HwPort a = HwPort.input("a", HwTypeInteger.sint(3));
        HwPort b = HwPort.input("b", HwTypeInteger.sint(7));
        HwPort out = HwPort.output("out", HwTypeInteger.sint(7));
        HwExpression mux = new HwMuxExpression(ref(c), ref(a), ref(b));
        HwCircuit result = infer(circuit(Linq.list(c, a, b, out), new HwConnect(ref(out), mux)));
        check(HwTypeInteger.sint(7), source(result, 0).type);
    }

    @Test(expected = InternalCompilerError.class)
    public void muxSignednessMismatch() {
        HwPort c = HwPort.input("c", HwTypeInteger.uint(1));
        HwPort a = HwPort.input("a", HwTypeInteger.sint(3));
        HwPort b = HwPort.input("b", HwTypeInteger.uint(3));
        HwPort out = HwPort.output("out", HwTypeInteger.sint(7));
        HwExpression mux = new HwMuxExpression(ref(c), ref(a), ref(b));
        infer(circuit(Linq.list(c, a, b, out), new HwConnect(ref(out), mux)));
    }

    @Test
    public void inferAggregates() {
        HwTypeBundle bundle = new HwTypeBundle(
                new HwField("f", false, HwTypeInteger.uint(3)),
                new HwField("g", true, HwTypeInteger.sint(2)));
        HwPort p = HwPort.input("p", bundle);
        HwPort v = HwPort.input("v", new HwTypeVector(HwTypeInteger.sint(5), 4));
        HwPort o1 = HwPort.output("o1", HwTypeInteger.uint(3));
        HwPort o2 = HwPort.output("o2", HwTypeInteger.sint(5));
        HwExpression field = new HwSubField(ref(p), "f", HwTypeUnknown.INSTANCE);
        HwExpression element = new HwSubIndex(ref(v), 2, HwTypeUnknown.INSTANCE);
        HwCircuit result = infer(circuit(Linq.list(p, v, o1, o2),
                new HwConnect(ref(o1), field),
                new HwConnect(ref(o2), element)));
        check(HwTypeInteger.uint(3), source(result, 0).type);
        check(HwTypeInteger.sint(5), source(result, 1).type);
    }

    @Test
    public void registerResetToItself() {
        HwPort clock = HwPort.input("clock", new HwTypeClock());
        HwPort reset = HwPort.input("reset", HwTypeInteger.uint(1));
        HwPort out = HwPort.output("out", HwTypeInteger.sint(4));
        HwDefRegister r = new HwDefRegister("r", HwTypeInteger.sint(4), ref(clock), ref(reset),
                new HwReference("r", HwTypeUnknown.INSTANCE));
        HwCircuit result = infer(circuit(Linq.list(clock, reset, out), r,
                new HwConnect(ref(out), new HwReference("r", HwTypeUnknown.INSTANCE))));
        HwDefRegister inferred = statement(result, 0).to(HwDefRegister.class);
        check(HwTypeInteger.sint(4), Objects.requireNonNull(inferred.init).type);
        check(HwTypeInteger.sint(4), source(result, 1).type);
    }

    @Test(expected = InternalCompilerError.class)
    public void indexOutOfBounds() {
        HwPort v = HwPort.input("v", new HwTypeVector(HwTypeInteger.sint(5), 4));
        HwPort out = HwPort.output("out", HwTypeInteger.sint(5));
        HwExpression element = new HwSubIndex(ref(v), 4, HwTypeUnknown.INSTANCE);
        infer(circuit(Linq.list(v, out), new HwConnect(ref(out), element)));
    }

    @Test
    public void undeclaredName() {
        HwPort out = HwPort.output("out", HwTypeInteger.sint(5));
        try {
            infer(circuit(Linq.list(out), new HwConnect(ref(out), new HwReference("missing", HwTypeUnknown.INSTANCE))));
            Assert.fail();
        } catch (InternalCompilerError e) {
            Assert.assertTrue(e.getMessage().contains("missing"));
        }
    }

    @Test(expected = InternalCompilerError.class)
    public void intervalTypeRejected() {
        HwPort a = HwPort.input("a", interval("0", "1", 0));
        infer(circuit(Linq.list(a)));
    }

    @Test
    public void typedCircuitUnchanged() {
        HwPort a = HwPort.input("a", HwTypeInteger.uint(4));
        HwPort out = HwPort.output("out", HwTypeInteger.uint(5));
        HwExpression add = new HwPrimOpExpression(SourceInfo.EMPTY, HwTypeInteger.uint(5), HwPrimOp.ADD,
                Linq.list(ref(a), new HwUIntLiteral(1)), Linq.list());
        HwCircuit circuit = circuit(Linq.list(a, out), new HwConnect(ref(out), add));
        Assert.assertSame(circuit, infer(circuit));
    }
}
