package org.hwir.compiler;

import org.hwir.ir.HwCircuit;
import org.hwir.ir.HwExtModule;
import org.hwir.ir.HwModule;
import org.hwir.ir.HwPort;
import org.hwir.ir.expression.HwExpression;
import org.hwir.ir.expression.HwPrimOp;
import org.hwir.ir.expression.HwPrimOpExpression;
import org.hwir.ir.expression.HwReference;
import org.hwir.ir.statement.HwAssignment;
import org.hwir.ir.statement.HwBlock;
import org.hwir.ir.statement.HwConditionally;
import org.hwir.ir.statement.HwConnect;
import org.hwir.ir.statement.HwDefNode;
import org.hwir.ir.statement.HwDefRegister;
import org.hwir.ir.statement.HwDefWire;
import org.hwir.ir.statement.HwPartialConnect;
import org.hwir.ir.statement.HwStatement;
import org.hwir.ir.type.HwType;
import org.hwir.ir.type.HwTypeClock;
import org.hwir.ir.type.HwTypeInteger;
import org.hwir.ir.type.HwTypeInterval;
import org.hwir.util.Linq;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Helpers for building small circuits and lowering them. */
public abstract class BaseLoweringTests {
    public static final String TOP = "Top";

    public static HwCompiler testCompiler() {
        CompilerOptions options = new CompilerOptions();
        options.loweringOptions.throwOnError = true;
        return new HwCompiler(options);
    }

    public static HwTypeInterval interval(String lower, String upper, int point) {
        return new HwTypeInterval(lower, upper, point);
    }

    public static HwReference ref(HwPort port) {
        return new HwReference(port.name, port.type);
    }

    /** An interval operation whose result type is given explicitly. */
    public static HwPrimOpExpression op(HwType type, HwPrimOp op, HwExpression... operands) {
        return new HwPrimOpExpression(type, op, Linq.list(operands), Linq.list());
    }

    public static HwCircuit circuit(List<HwPort> ports, HwStatement... statements) {
        return new HwCircuit(new HwModule(TOP, ports, new HwBlock(statements)));
    }

    /** A circuit which connects 'expression' to an output port named 'out' of type 'outType'. */
    public static HwCircuit connection(List<HwPort> inputs, HwType outType, HwExpression expression) {
        HwPort out = HwPort.output("out", outType);
        List<HwPort> ports = Linq.list(inputs.iterator());
        ports.add(out);
        return circuit(ports, new HwConnect(ref(out), expression));
    }

    /** A circuit using intervals in ports, wires, registers, nodes and an external module. */
    public static HwCircuit intervalCircuit() {
        HwTypeInterval range = interval("-1", "1", 2);
        HwPort clock = HwPort.input("clock", new HwTypeClock());
        HwPort a = HwPort.input("a", interval("-2", "2", 2));
        HwPort b = HwPort.input("b", range);
        HwPort c = HwPort.input("c", HwTypeInteger.uint(1));
        HwPort out = HwPort.output("out", range);

        HwDefWire w = new HwDefWire("w", interval("-2", "2", 1));
        HwDefRegister r = new HwDefRegister("r", range, ref(clock));
        HwDefNode n = new HwDefNode("n", op(range, HwPrimOp.CLIP, ref(a), ref(b)));
        HwReference wRef = new HwReference("w", w.type);
        HwReference rRef = new HwReference("r", r.type);
        HwReference nRef = new HwReference("n", range);
        HwConditionally when = new HwConditionally(ref(c),
                new HwConnect(rRef, nRef),
                new HwConnect(rRef, ref(b)));
        HwModule top = new HwModule(TOP, Linq.list(clock, a, b, c, out), new HwBlock(
                w, r,
                new HwConnect(wRef, ref(a)),
                n, when,
                new HwPartialConnect(ref(out), rRef)));
        HwExtModule ext = new HwExtModule("Ext", Linq.list(HwPort.input("x", interval("0", "3", 0))));
        return new HwCircuit(top, ext);
    }

    public static HwCircuit lower(HwCircuit circuit) {
        return testCompiler().lowerIntervals(circuit);
    }

    public static HwModule top(HwCircuit circuit) {
        return Objects.requireNonNull(circuit.getModule(TOP)).to(HwModule.class);
    }

    public static HwStatement statement(HwCircuit circuit, int index) {
        return top(circuit).body.statements.get(index);
    }

    /** The source of the assignment at position 'index' in the top module. */
    public static HwExpression source(HwCircuit circuit, int index) {
        return statement(circuit, index).to(HwAssignment.class).source;
    }

    public static BigInteger evaluate(HwExpression expression, Map<String, BigInteger> environment) {
        ExpressionEvaluator evaluator = new ExpressionEvaluator(testCompiler(), environment);
        return evaluator.evaluate(expression);
    }

    public static BigInteger floorMod(BigInteger value, BigInteger lower, BigInteger upper) {
        BigInteger period = upper.subtract(lower).add(BigInteger.ONE);
        return value.subtract(lower).mod(period).add(lower);
    }

    public static BigInteger clamp(BigInteger value, BigInteger lower, BigInteger upper) {
        return value.max(lower).min(upper);
    }
}
