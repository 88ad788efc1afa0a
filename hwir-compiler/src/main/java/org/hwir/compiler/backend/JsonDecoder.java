/*
 * Copyright 2022 VMware, Inc.
 * SPDX-License-Identifier: MIT
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package org.hwir.compiler.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.hwir.compiler.errors.CompilationError;
import org.hwir.ir.IHwInnerNode;
import org.hwir.ir.IHwNode;
import org.hwir.ir.IHwOuterNode;
import org.hwir.util.Utilities;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Deserialize data serialized by either {@link ToJsonOuterVisitor}
 * or {@link ToJsonInnerVisitor}. */
public class JsonDecoder {
    static class Cache<T extends IHwNode> {
        Map<Long, IHwNode> decoded;

        Cache() {
            this.decoded = new HashMap<>();
        }

        public <S extends T> S lookup(Long id, Class<S> tClass) {
            if (this.decoded.containsKey(id))
                return this.decoded.get(id).to(tClass);
            throw new CompilationError("Could not find node with id " + id);
        }

        public void cache(Long originalId, IHwNode result) {
            Utilities.putNew(this.decoded, originalId, result);
        }
    }

    final Cache<IHwInnerNode> inner;
    final Cache<IHwOuterNode> outer;

    public JsonDecoder() {
        this.inner = new Cache<>();
        this.outer = new Cache<>();
    }

    static final String OUTER_ROOT = "org.hwir.ir";
    static final List<String> OUTER_PACKAGES = List.of("");
    static final String INNER_ROOT = "org.hwir.ir";
    static final List<String> INNER_PACKAGES = Arrays.asList(
            "", "expression", "expression.literal", "statement", "type");

    static Class<?> getClass(String simpleName, boolean outer) {
        String root;
        List<String> toTry;
        if (outer) {
            root = OUTER_ROOT;
            toTry = OUTER_PACKAGES;
        } else {
            root = INNER_ROOT;
            toTry = INNER_PACKAGES;
        }
        for (String cls : toTry) {
            String className = root;
            if (!cls.isEmpty())
                className += "." + cls;
            className += "." + simpleName;
            try {
                return Class.forName(className);
            } catch (ClassNotFoundException ignored) {
            }
        }
        throw new CompilationError("Class " + Utilities.singleQuote(simpleName) + " not found");
    }

    IHwNode decode(JsonNode node, boolean outer) {
        if (!node.isObject())
            throw new CompilationError("Expected a JSON object, found " + Utilities.toDepth(node, 1));
        ObjectNode object = (ObjectNode) node;
        JsonNode nodeProp = object.get("node");
        if (nodeProp != null) {
            Long id = nodeProp.asLong();
            if (outer)
                return this.outer.lookup(id, IHwOuterNode.class);
            else
                return this.inner.lookup(id, IHwInnerNode.class);
        }
        Long originalId = Utilities.getLongProperty(node, "id");
        JsonNode cls = object.get("class");
        if (cls == null)
            throw new CompilationError("Node does not have 'class' field: " + Utilities.toDepth(node, 1));
        Class<?> clazz = getClass(cls.asText(), outer);
        try {
            Method method = clazz.getMethod("fromJson", JsonNode.class, JsonDecoder.class);
            // Check if the method is static
            boolean isStatic = Modifier.isStatic(method.getModifiers());
            if (!isStatic)
                throw new CompilationError(cls + ".fromJson is not static");
            IHwNode result = (IHwNode) method.invoke(null, node, this);
            if (outer)
                this.outer.cache(originalId, result);
            else
                this.inner.cache(originalId, result);
            return result;
        } catch (InvocationTargetException e) {
            if (e.getCause() instanceof RuntimeException runtime)
                throw runtime;
            throw new CompilationError("Could not decode " + cls, e);
        } catch (NoSuchMethodException | IllegalAccessException e) {
            throw new CompilationError("Could not decode " + cls, e);
        }
    }

    public <T extends IHwOuterNode> T decodeOuter(JsonNode node, Class<T> clazz) {
        return this.decode(node, true).to(clazz);
    }

    public <T extends IHwInnerNode> T decodeInner(JsonNode node, Class<T> clazz) {
        IHwNode result = this.decode(node, false);
        return result.to(clazz);
    }
}
