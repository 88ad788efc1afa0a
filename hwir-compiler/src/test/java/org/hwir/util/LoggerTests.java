package org.hwir.util;

import org.hwir.compiler.BaseLoweringTests;
import org.hwir.compiler.errors.CompilationError;
import org.hwir.compiler.visitors.inner.InferTypes;
import org.hwir.compiler.visitors.inner.LowerIntervals;
import org.junit.Assert;
import org.junit.Test;

public class LoggerTests extends BaseLoweringTests {
    @Test
    public void rewritesAreLogged() {
        StringBuilder builder = new StringBuilder();
        Appendable save = Logger.INSTANCE.setDebugStream(builder);
        int lowerLevel = Logger.INSTANCE.setLoggingLevel(LowerIntervals.class, 1);
        int inferLevel = Logger.INSTANCE.setLoggingLevel("InferTypes", 2);
        try {
            lower(intervalCircuit());
        } finally {
            Logger.INSTANCE.setLoggingLevel(LowerIntervals.class, lowerLevel);
            Logger.INSTANCE.setLoggingLevel(InferTypes.class, inferLevel);
            Logger.INSTANCE.setDebugStream(save);
        }
        String log = builder.toString();
        Assert.assertTrue(log.contains("LowerIntervals"));
        Assert.assertTrue(log.contains("Declaring clock"));
    }

    @Test
    public void silentByDefault() {
        StringBuilder builder = new StringBuilder();
        Appendable save = Logger.INSTANCE.setDebugStream(builder);
        try {
            lower(intervalCircuit());
        } finally {
            Logger.INSTANCE.setDebugStream(save);
        }
        Assert.assertEquals("", builder.toString());
    }

    @Test(expected = CompilationError.class)
    public void unknownClass() {
        Logger.INSTANCE.setLoggingLevel("NoSuchPass", 1);
    }
}
