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
import org.hwir.compiler.visitors.outer.CircuitVisitor;
import org.hwir.ir.HwCircuit;
import org.hwir.ir.HwModule;
import org.hwir.ir.HwModuleBase;
import org.hwir.ir.HwPort;
import org.hwir.ir.IHwOuterNode;
import org.hwir.util.IndentStream;
import org.hwir.util.JsonStream;

import java.util.HashSet;
import java.util.Set;

/** Serializes an outer node as a JSON string */
public class ToJsonOuterVisitor extends CircuitVisitor {
    public final JsonStream stream;
    final int verbosity;
    final Set<Long> serialized;
    final ToJsonInnerVisitor innerVisitor;

    public ToJsonOuterVisitor(HwCompiler compiler, int verbosity, ToJsonInnerVisitor innerVisitor) {
        super(compiler);
        this.stream = innerVisitor.stream;
        this.verbosity = verbosity;
        this.serialized = new HashSet<>();
        this.innerVisitor = innerVisitor;
    }

    public static ToJsonOuterVisitor create(HwCompiler compiler, int verbosity) {
        IndentStream stream = new IndentStream(new StringBuilder());
        stream.setIndentAmount(1);
        JsonStream json = new JsonStream(stream);
        ToJsonInnerVisitor inner = new ToJsonInnerVisitor(compiler, json, 1);
        return new ToJsonOuterVisitor(compiler, verbosity, inner);
    }

    @Override
    public void endArrayProperty(String property) {
        this.stream.endArray();
    }

    @Override
    public void startArrayProperty(String property) {
        this.label(property);
        this.stream.beginArray();
    }

    @Override
    public void label(String name) {
        this.property(name);
    }

    public void property(String name) {
        this.stream.label(name);
    }

    @SuppressWarnings("SameParameterValue")
    boolean checkDone(IHwOuterNode node, boolean silent) {
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
    public VisitDecision preorder(IHwOuterNode node) {
        if (!this.checkDone(node, false)) {
            this.stream.beginObject().appendClass(node);
            this.property("id");
            this.stream.append(node.getId());
            this.serialized.add(node.getId());
            return VisitDecision.CONTINUE;
        }
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(HwModuleBase module) {
        if (this.preorder(module.to(IHwOuterNode.class)).stop())
            return VisitDecision.STOP;
        this.property("name");
        this.stream.append(module.name);
        this.innerVisitor.setModuleContext(module);
        this.startArrayProperty("ports");
        for (HwPort port: module.ports)
            port.accept(this.innerVisitor);
        this.endArrayProperty("ports");
        return VisitDecision.CONTINUE;
    }

    @Override
    public VisitDecision preorder(HwModule module) {
        if (this.preorder((HwModuleBase) module).stop())
            return VisitDecision.STOP;
        this.property("body");
        module.body.accept(this.innerVisitor);
        return VisitDecision.CONTINUE;
    }

    @Override
    public void postorder(HwModuleBase module) {
        this.stream.endObject();
    }

    @Override
    public VisitDecision preorder(HwCircuit circuit) {
        if (this.preorder(circuit.to(IHwOuterNode.class)).stop())
            return VisitDecision.STOP;
        this.property("main");
        this.stream.append(circuit.main);
        return VisitDecision.CONTINUE;
    }

    @Override
    public void postorder(HwCircuit circuit) {
        this.stream.endObject();
    }

    public String getJsonString() {
        return this.stream.toString();
    }
}
