package org.hwir.compiler.backend;

import org.hwir.compiler.BaseLoweringTests;
import org.hwir.compiler.HwCompiler;
import org.hwir.compiler.errors.CompilationError;
import org.hwir.ir.HwCircuit;
import org.hwir.ir.HwPort;
import org.hwir.ir.SourceInfo;
import org.hwir.ir.expression.HwExpression;
import org.hwir.ir.expression.HwMuxExpression;
import org.hwir.ir.expression.HwReference;
import org.hwir.ir.statement.HwConnect;
import org.hwir.ir.type.HwTypeInteger;
import org.hwir.ir.type.HwTypeInterval;
import org.hwir.ir.type.IntervalBound;
import org.hwir.util.Linq;
import org.junit.Assert;
import org.junit.Test;

import java.math.BigDecimal;

public class JsonTests extends BaseLoweringTests {
    static HwCircuit roundTrip(HwCircuit circuit) {
        HwCompiler compiler = testCompiler();
        String json = compiler.toJson(circuit);
        return compiler.fromJson(json);
    }

    @Test
    public void intervalCircuitRoundTrip() {
        HwCircuit circuit = intervalCircuit();
        HwCircuit decoded = roundTrip(circuit);
        Assert.assertEquals(circuit.toString(), decoded.toString());
        Assert.assertEquals(lower(circuit).toString(), lower(decoded).toString());
    }

    @Test
    public void loweredCircuitRoundTrip() {
        HwCircuit lowered = lower(intervalCircuit());
        HwCircuit decoded = roundTrip(lowered);
        Assert.assertEquals(lowered.toString(), decoded.toString());
        Assert.assertTrue(source(decoded, 2).type.sameType(source(lowered, 2).type));
    }

    @Test
    public void intervalBounds() {
        HwTypeInterval open = new HwTypeInterval(IntervalBound.OPEN, IntervalBound.known("2.5"), null);
        HwCircuit circuit = circuit(Linq.list(HwPort.input("a", open),
                HwPort.input("b", interval("-0.125", "3", 3))));
        HwCircuit decoded = roundTrip(circuit);

        HwTypeInterval a = top(decoded).getPort("a").type.to(HwTypeInterval.class);
        Assert.assertFalse(a.lower.isKnown());
        Assert.assertEquals(0, a.upper.getValue().compareTo(new BigDecimal("2.5")));
        Assert.assertFalse(a.hasKnownPoint());
        HwTypeInterval b = top(decoded).getPort("b").type.to(HwTypeInterval.class);
        Assert.assertTrue(b.sameType(interval("-0.125", "3", 3)));
    }

    @Test
    public void sharedNodes() {
        HwPort c = HwPort.input("c", HwTypeInteger.uint(1));
        HwPort out = HwPort.output("out", HwTypeInteger.uint(4));
        HwReference x = new HwReference("x", HwTypeInteger.uint(4));
        HwExpression mux = new HwMuxExpression(SourceInfo.EMPTY, HwTypeInteger.uint(4), ref(c), x, x);
        HwCircuit decoded = roundTrip(circuit(Linq.list(c, out), new HwConnect(ref(out), mux)));
        HwMuxExpression result = source(decoded, 0).to(HwMuxExpression.class);
        Assert.assertSame(result.positive, result.negative);
    }

    @Test
    public void malformedJson() {
        try {
            testCompiler().fromJson("{ \"class\": ");
            Assert.fail();
        } catch (CompilationError e) {
            Assert.assertTrue(e.getMessage().contains("Could not parse circuit"));
        }
    }

    @Test
    public void unknownClass() {
        try {
            testCompiler().fromJson("{ \"id\": 0, \"class\": \"HwNoSuchNode\" }");
            Assert.fail();
        } catch (CompilationError e) {
            Assert.assertTrue(e.getMessage().contains("HwNoSuchNode"));
        }
    }
}
