package org.hwir.compiler.visitors.outer;

import org.hwir.compiler.BaseLoweringTests;
import org.hwir.compiler.CompilerOptions;
import org.hwir.compiler.HwCompiler;
import org.hwir.compiler.errors.InternalCompilerError;
import org.hwir.compiler.visitors.inner.CheckNoIntervals;
import org.hwir.ir.HwCircuit;
import org.hwir.ir.HwExtModule;
import org.hwir.ir.HwModule;
import org.hwir.ir.HwPort;
import org.hwir.ir.expression.HwExpression;
import org.hwir.ir.expression.HwPrimOp;
import org.hwir.ir.expression.HwPrimOpExpression;
import org.hwir.ir.expression.HwReference;
import org.hwir.ir.expression.literal.HwUIntLiteral;
import org.hwir.ir.statement.HwConditionally;
import org.hwir.ir.statement.HwConnect;
import org.hwir.ir.statement.HwDefNode;
import org.hwir.ir.statement.HwDefRegister;
import org.hwir.ir.statement.HwDefWire;
import org.hwir.ir.type.HwField;
import org.hwir.ir.type.HwTypeBundle;
import org.hwir.ir.type.HwTypeClock;
import org.hwir.ir.type.HwTypeInteger;
import org.hwir.ir.type.HwTypeVector;
import org.hwir.util.Linq;
import org.junit.Assert;
import org.junit.Test;

import java.math.BigInteger;
import java.util.Objects;

public class RemoveIntervalsTests extends BaseLoweringTests {
    static HwCircuit integerCircuit() {
        HwPort a = HwPort.input("a", HwTypeInteger.uint(4));
        HwPort out = HwPort.output("out", HwTypeInteger.uint(4));
        HwExpression and = new HwPrimOpExpression(HwTypeInteger.uint(4), HwPrimOp.AND,
                Linq.list(ref(a), new HwUIntLiteral(BigInteger.valueOf(3), 4)), Linq.list());
        return circuit(Linq.list(a, out), new HwConnect(ref(out), and));
    }

    @Test
    public void lowerEverything() {
        HwCircuit lowered = lower(intervalCircuit());
        HwModule top = top(lowered);
        Assert.assertTrue(top.getPort("a").type.sameType(HwTypeInteger.sint(5)));
        Assert.assertTrue(top.getPort("clock").type.sameType(new HwTypeClock()));
        Assert.assertTrue(statement(lowered, 0).to(HwDefWire.class).type.sameType(HwTypeInteger.sint(4)));
        Assert.assertTrue(statement(lowered, 1).to(HwDefRegister.class).type.sameType(HwTypeInteger.sint(4)));
        // The wire has fewer fractional bits than the port
        Assert.assertEquals("shr(a, 1)", source(lowered, 2).toString());
        HwDefNode node = statement(lowered, 3).to(HwDefNode.class);
        Assert.assertEquals("mux(gt(a, 4), 4, mux(lt(a, -4), -4, a))", node.value.toString());
        HwConditionally when = statement(lowered, 4).to(HwConditionally.class);
        HwExpression n = when.positive.to(HwConnect.class).source;
        Assert.assertTrue(n.type.sameType(node.getType()));

        HwExtModule ext = Objects.requireNonNull(lowered.getModule("Ext")).to(HwExtModule.class);
        Assert.assertTrue(ext.getPort("x").type.sameType(HwTypeInteger.sint(3)));

        CheckNoIntervals check = new CheckNoIntervals(testCompiler());
        Assert.assertSame(lowered, check.circuitRewriter().apply(lowered));
    }

    @Test
    public void aggregatePorts() {
        HwTypeBundle bundle = new HwTypeBundle(
                new HwField("f", false, interval("-2", "2", 1)),
                new HwField("g", true, HwTypeInteger.uint(3)));
        HwPort p = HwPort.input("p", bundle);
        HwPort v = HwPort.input("v", new HwTypeVector(interval("0", "3", 0), 2));
        Assert.assertTrue(p.type.containsInterval());
        Assert.assertTrue(v.type.containsInterval());

        HwModule top = top(lower(circuit(Linq.list(p, v))));
        HwTypeBundle lowered = top.getPort("p").type.to(HwTypeBundle.class);
        Assert.assertFalse(lowered.containsInterval());
        Assert.assertTrue(Objects.requireNonNull(lowered.getField("f")).type.sameType(HwTypeInteger.sint(4)));
        Assert.assertTrue(Objects.requireNonNull(lowered.getField("g")).flipped);
        Assert.assertTrue(top.getPort("v").type.sameType(new HwTypeVector(HwTypeInteger.sint(3), 2)));
    }

    @Test
    public void registerInitializedToItself() {
        HwPort clock = HwPort.input("clock", new HwTypeClock());
        HwPort reset = HwPort.input("reset", HwTypeInteger.uint(1));
        HwPort out = HwPort.output("out", interval("-1", "1", 2));
        HwDefRegister r = new HwDefRegister("r", interval("-1", "1", 2), ref(clock), ref(reset),
                new HwReference("r", interval("-1", "1", 2)));
        HwCircuit lowered = lower(circuit(Linq.list(clock, reset, out), r,
                new HwConnect(ref(out), new HwReference("r", r.type))));
        HwDefRegister register = statement(lowered, 0).to(HwDefRegister.class);
        Assert.assertTrue(register.type.sameType(HwTypeInteger.sint(4)));
        Assert.assertTrue(Objects.requireNonNull(register.init).type.sameType(HwTypeInteger.sint(4)));
        Assert.assertTrue(top(lowered).getPort("out").type.sameType(HwTypeInteger.sint(4)));
    }

    @Test
    public void checkNamesPort() {
        CheckNoIntervals check = new CheckNoIntervals(testCompiler());
        try {
            check.circuitRewriter().apply(intervalCircuit());
            Assert.fail();
        } catch (InternalCompilerError e) {
            Assert.assertTrue(e.getMessage().contains("Port a"));
        }
    }

    @Test(expected = InternalCompilerError.class)
    public void checkFindsIntervals() {
        CheckNoIntervals check = new CheckNoIntervals(testCompiler());
        check.circuitRewriter().apply(intervalCircuit());
    }

    @Test
    public void intervalFreeCircuitUnchanged() {
        HwCircuit circuit = integerCircuit();
        Assert.assertSame(circuit, lower(circuit));
    }

    @Test
    public void alignOnly() {
        CompilerOptions options = new CompilerOptions();
        options.loweringOptions.alignOnly = true;
        HwCompiler compiler = new HwCompiler(options);
        HwCircuit aligned = compiler.lowerIntervals(intervalCircuit());
        Assert.assertEquals("decp(a, 1)", source(aligned, 2).toString());
        Assert.assertTrue(top(aligned).getPort("a").type.isInterval());
    }

    @Test
    public void skipInference() {
        CompilerOptions options = new CompilerOptions();
        options.loweringOptions.skipInference = true;
        HwCompiler compiler = new HwCompiler(options);
        HwCircuit lowered = compiler.lowerIntervals(intervalCircuit());
        HwDefNode node = statement(lowered, 3).to(HwDefNode.class);
        Assert.assertTrue(node.value.type.isUnknown());
        Assert.assertFalse(top(lowered).getPort("a").type.isInterval());
    }

    @Test
    public void lowerIsIdempotent() {
        HwCircuit lowered = lower(intervalCircuit());
        Assert.assertSame(lowered, lower(lowered));
    }
}
