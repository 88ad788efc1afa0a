package org.hwir.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.Assert;
import org.junit.Test;

public class JsonStreamTests {
    @Test
    public void nestedObject() throws Exception {
        JsonStream stream = new JsonStream(new IndentStreamBuilder());
        stream.beginObject();
        stream.label("name").append("a \"quoted\" name");
        stream.label("values");
        stream.beginArray();
        stream.append(1);
        stream.append(true);
        stream.endArray();
        stream.endObject();

        JsonNode node = new ObjectMapper().readTree(stream.toString());
        Assert.assertEquals("a \"quoted\" name", node.get("name").asText());
        Assert.assertEquals(1, node.get("values").get(0).asInt());
        Assert.assertTrue(node.get("values").get(1).asBoolean());
    }

    @Test
    public void labelOutsideObject() {
        JsonStream stream = new JsonStream(new IndentStreamBuilder());
        stream.beginArray();
        try {
            stream.label("x");
            Assert.fail();
        } catch (RuntimeException e) {
            Assert.assertEquals("Adding label but not within JsonObject", e.getMessage());
        }
    }

    @Test
    public void valueWithoutLabel() {
        JsonStream stream = new JsonStream(new IndentStreamBuilder());
        stream.beginObject();
        try {
            stream.append(3);
            Assert.fail();
        } catch (RuntimeException e) {
            Assert.assertEquals("Missing label", e.getMessage());
        }
    }
}
