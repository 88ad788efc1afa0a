package org.hwir;

import org.hwir.compiler.BaseLoweringTests;
import org.hwir.compiler.HwCompiler;
import org.hwir.compiler.errors.CompilerMessages;
import org.hwir.compiler.visitors.inner.CheckNoIntervals;
import org.hwir.ir.HwCircuit;
import org.hwir.ir.HwPort;
import org.hwir.ir.expression.HwExpression;
import org.hwir.ir.expression.HwPrimOp;
import org.hwir.ir.expression.literal.HwUIntLiteral;
import org.hwir.ir.type.HwTypeInteger;
import org.hwir.util.Linq;
import org.hwir.util.Utilities;
import org.junit.Assert;
import org.junit.Test;

import java.io.File;
import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;

public class CompilerMainTests extends BaseLoweringTests {
    static Path writeCircuit(HwCircuit circuit) throws IOException {
        File file = File.createTempFile("circuit", ".json");
        file.deleteOnExit();
        Utilities.writeFile(file.toPath(), testCompiler().toJson(circuit));
        return file.toPath();
    }

    static Path outputFile() throws IOException {
        File file = File.createTempFile("lowered", ".json");
        file.deleteOnExit();
        return file.toPath();
    }

    @Test
    public void lowerFile() throws IOException {
        Path input = writeCircuit(intervalCircuit());
        Path output = outputFile();
        CompilerMessages messages = CompilerMain.execute("-o", output.toString(), input.toString());
        Assert.assertEquals(messages.toString(), 0, messages.exitCode);

        HwCompiler compiler = testCompiler();
        HwCircuit lowered = compiler.fromJson(Utilities.readFile(output));
        new CheckNoIntervals(compiler).circuitRewriter().apply(lowered);
        Assert.assertEquals(lower(intervalCircuit()).toString(), lowered.toString());
    }

    @Test
    public void textOutput() throws IOException {
        Path input = writeCircuit(intervalCircuit());
        Path output = outputFile();
        CompilerMessages messages = CompilerMain.execute("--text", "-o", output.toString(), input.toString());
        Assert.assertEquals(0, messages.exitCode);
        String text = Utilities.readFile(output);
        Assert.assertTrue(text.contains("circuit Top"));
        Assert.assertTrue(text.contains("shr(a, 1)"));
        Assert.assertFalse(text.contains("Interval"));
    }

    @Test
    public void alignOnly() throws IOException {
        Path input = writeCircuit(intervalCircuit());
        Path output = outputFile();
        CompilerMessages messages = CompilerMain.execute("--alignOnly", "--text",
                "-o", output.toString(), input.toString());
        Assert.assertEquals(0, messages.exitCode);
        String text = Utilities.readFile(output);
        Assert.assertTrue(text.contains("decp(a, 1)"));
        Assert.assertTrue(text.contains("Interval"));
    }

    @Test
    public void missingInput() {
        CompilerMessages messages = CompilerMain.execute("/no/such/directory/circuit.json");
        Assert.assertEquals(1, messages.exitCode);
        Assert.assertTrue(messages.toString().contains("Error reading file"));
    }

    @Test
    public void malformedInput() throws IOException {
        File file = File.createTempFile("broken", ".json");
        file.deleteOnExit();
        Files.writeString(file.toPath(), "{ \"class\": ");
        CompilerMessages messages = CompilerMain.execute(file.toString());
        Assert.assertEquals(1, messages.exitCode);
        Assert.assertEquals(1, messages.errorCount());
        Assert.assertTrue(messages.toString().contains("Could not parse circuit"));
    }

    @Test
    public void malformedBoundInInput() throws IOException {
        String json = testCompiler().toJson(intervalCircuit());
        Assert.assertTrue(json.contains("\"-2\""));
        File file = File.createTempFile("bound", ".json");
        file.deleteOnExit();
        Files.writeString(file.toPath(), json.replace("\"-2\"", "\"abc\""));
        CompilerMessages messages = CompilerMain.execute(file.toString());
        Assert.assertEquals(1, messages.exitCode);
        Assert.assertTrue(messages.toString().contains("Malformed interval bound 'abc'"));
    }

    @Test
    public void malformedLiteralInInput() throws IOException {
        HwPort a = HwPort.input("a", HwTypeInteger.uint(4));
        HwExpression and = op(HwTypeInteger.uint(4), HwPrimOp.AND,
                ref(a), new HwUIntLiteral(BigInteger.valueOf(3), 4));
        String json = testCompiler().toJson(connection(Linq.list(a), HwTypeInteger.uint(4), and));
        File file = File.createTempFile("literal", ".json");
        file.deleteOnExit();
        Files.writeString(file.toPath(), json.replace("\"3\"", "\"x3\""));
        CompilerMessages messages = CompilerMain.execute(file.toString());
        Assert.assertEquals(1, messages.exitCode);
        Assert.assertTrue(messages.toString().contains("Malformed literal value 'x3'"));
    }

    @Test
    public void badOptions() {
        Assert.assertEquals(1, CompilerMain.execute("--noSuchOption").exitCode);
        Assert.assertEquals(1, CompilerMain.execute("-TInferTypes=high").exitCode);
        Assert.assertEquals(1, CompilerMain.execute("-TNoSuchPass=1").exitCode);
        Assert.assertEquals(1, CompilerMain.execute("--help").exitCode);
    }
}
