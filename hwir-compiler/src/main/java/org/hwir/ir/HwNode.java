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

package org.hwir.ir;

import com.fasterxml.jackson.databind.JsonNode;
import org.hwir.compiler.backend.JsonDecoder;
import org.hwir.util.IndentStreamBuilder;
import org.hwir.util.Linq;
import org.hwir.util.Utilities;

import java.util.List;

/** Base class for all IR nodes. */
public abstract class HwNode implements IHwNode {
    public static long innerId = 0;
    public static long outerId = 0;
    public final long id;

    /** Where in the source this node comes from. */
    protected final SourceInfo sourceInfo;

    protected HwNode(SourceInfo sourceInfo) {
        this.sourceInfo = sourceInfo;
        if (this.is(IHwInnerNode.class))
            this.id = innerId++;
        else
            this.id = outerId++;
    }

    @Override
    public SourceInfo getSourceInfo() {
        return this.sourceInfo;
    }

    @Override
    public long getId() {
        return this.id;
    }

    @Override
    public String toString() {
        IndentStreamBuilder stream = new IndentStreamBuilder();
        this.toString(stream);
        return stream.toString();
    }

    public static <T extends IHwInnerNode> T fromJsonInner(
            JsonNode node, String property, JsonDecoder decoder, Class<T> clazz) {
        JsonNode prop = Utilities.getProperty(node, property);
        return decoder.decodeInner(prop, clazz);
    }

    public static <T extends IHwInnerNode> List<T> fromJsonInnerList(
            JsonNode node, String property, JsonDecoder decoder, Class<T> clazz) {
        JsonNode prop = Utilities.getProperty(node, property);
        Utilities.enforce(prop.isArray(), "Node is not an array " + Utilities.toDepth(prop, 1));
        return Linq.list(Linq.map(prop.elements(), e -> decoder.decodeInner(e, clazz)));
    }

    public static <T extends IHwOuterNode> List<T> fromJsonOuterList(
            JsonNode node, String property, JsonDecoder decoder, Class<T> clazz) {
        JsonNode prop = Utilities.getProperty(node, property);
        Utilities.enforce(prop.isArray(), "Node is not an array " + Utilities.toDepth(prop, 1));
        return Linq.list(Linq.map(prop.elements(), e -> decoder.decodeOuter(e, clazz)));
    }
}
