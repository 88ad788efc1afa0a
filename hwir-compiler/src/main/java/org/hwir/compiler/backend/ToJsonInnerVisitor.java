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

import org.hwir.compiler.HwCompiler;
import org.hwir.compiler.visitors.VisitDecision;
import org.hwir.compiler.visitors.inner.InnerVisitor;
import org.hwir.ir.HwPort;
import org.hwir.ir.IHwInnerNode;
import org.hwir.ir.expression.HwPrimOpExpression;
import org.hwir.ir.expression.HwReference;
import org.hwir.ir.expression.HwSubField;
import org.hwir.ir.expression.HwSubIndex;
import org.hwir.ir.expression.literal.HwLiteral;
import org.hwir.ir.statement.HwDeclaration;
import org.hwir.ir.type.HwField;
import org.hwir.ir.type.HwTypeInteger;
import org.hwir.ir.type.HwTypeInterval;
import org.hwir.ir.type.HwTypeVector;
import org.hwir.util.JsonStream;

import java.util.HashSet;
import java.util.Set;

/** Serializes an inner node as a JSON string.
 * Since this visitor calls the visit methods for InnerVisitor, it should generally
 * only handle fields which are not visited by InnerVisitor, i.e., the ones which are not HwNode objects. */
public class ToJsonInnerVisitor extends InnerVisitor {
    public final JsonStream stream;
    final int verbosity;
    final Set<Long> serialized;

    public ToJsonInnerVisitor(HwCompiler compiler, JsonStream stream, int verbosity) {
        super(compiler);
        this.stream = stream;
        this.verbosity = verbosity;
        this.serialized = new HashSet<>();
    }

    boolean checkDone(IHwInnerNode node, boolean silent) {
        if (this.serialized.contains(node.getId())) {
            if (silent)
                return true;
            this.stream.beginObject()
                    .label("node")
                    .append(node.getId())
                    .endObject();
            return true;
        }
        return false;
    }

    @Override
    public void startArrayProperty(String property) {
        this.stream.label(property).beginArray();
    }

    @Override
    public void endArrayProperty(String property) {
        this.stream.endArray();
    }

    @Override
    public void property(String name) {
        this.stream.label(name);
    }

    @Override
    public void push(IHwInnerNode node) {
        if (!this.checkDone(node, true)) {
            this.stream.appendClass(node);
            this.property("id");
            this.stream.append(node.getId());
            this.serialized.add(node.getId());
        }
        super.push(node);
    }

    @Override
    public VisitDecision preorder(IHwInnerNode node) {
        if (this.checkDone(node, false))
            return VisitDecision.STOP;
        this.stream.beginObject();
        return VisitDecision.CONTINUE;
    }

    @Override
    public void postorder(IHwInnerNode node) {
        this.stream.endObject();
    }

    @Override
    public void postorder(HwTypeInteger node) {
        this.property("width");
        this.stream.append(node.width);
        this.property("signed");
        this.stream.append(node.signed);
        super.postorder(node);
    }

    @Override
    public void postorder(HwTypeInterval node) {
        this.property("lower");
        this.stream.append(node.lower.toJsonString());
        this.property("upper");
        this.stream.append(node.upper.toJsonString());
        this.property("point");
        if (node.point != null)
            this.stream.append(node.point);
        else
            this.stream.appendNull();
        super.postorder(node);
    }

    @Override
    public void postorder(HwTypeVector node) {
        this.property("size");
        this.stream.append(node.size);
        super.postorder(node);
    }

    @Override
    public void postorder(HwField node) {
        this.property("name");
        this.stream.append(node.name);
        this.property("flipped");
        this.stream.append(node.flipped);
        super.postorder(node);
    }

    @Override
    public void postorder(HwPort node) {
        this.property("name");
        this.stream.append(node.name);
        this.property("direction");
        this.stream.append(node.direction.text);
        super.postorder(node);
    }

    @Override
    public void postorder(HwPrimOpExpression node) {
        this.property("op");
        this.stream.append(node.op.text);
        this.property("constants");
        this.stream.beginArray();
        for (int constant: node.constants)
            this.stream.append(constant);
        this.stream.endArray();
        super.postorder(node);
    }

    @Override
    public void postorder(HwReference node) {
        this.property("name");
        this.stream.append(node.name);
        super.postorder(node);
    }

    @Override
    public void postorder(HwSubField node) {
        this.property("name");
        this.stream.append(node.name);
        super.postorder(node);
    }

    @Override
    public void postorder(HwSubIndex node) {
        this.property("index");
        this.stream.append(node.index);
        super.postorder(node);
    }

    @Override
    public void postorder(HwLiteral node) {
        this.property("value");
        this.stream.append(node.value.toString());
        super.postorder(node);
    }

    @Override
    public void postorder(HwDeclaration node) {
        this.property("name");
        this.stream.append(node.name);
        super.postorder(node);
    }
}
