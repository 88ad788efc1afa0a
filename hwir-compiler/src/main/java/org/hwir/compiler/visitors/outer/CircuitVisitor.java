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

package org.hwir.compiler.visitors.outer;

import org.hwir.compiler.HwCompiler;
import org.hwir.compiler.ICompilerComponent;
import org.hwir.compiler.errors.InternalCompilerError;
import org.hwir.compiler.visitors.VisitDecision;
import org.hwir.ir.HwCircuit;
import org.hwir.ir.HwExtModule;
import org.hwir.ir.HwModule;
import org.hwir.ir.HwModuleBase;
import org.hwir.ir.IHwOuterNode;
import org.hwir.util.ICastable;
import org.hwir.util.IHasId;
import org.hwir.util.IWritesLogs;
import org.hwir.util.Utilities;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

/** Depth-first traversal of an IHwOuterNode hierarchy. */
@SuppressWarnings({"SameReturnValue", "BooleanMethodIsAlwaysInverted"})
public abstract class CircuitVisitor
        implements CircuitTransform, IWritesLogs, IHasId, ICompilerComponent, ICastable {
    final long id;
    static long crtId = 0;

    @Nullable
    protected HwCircuit circuit = null;
    public final HwCompiler compiler;
    /** Circuit or module currently being visited. */
    protected final List<IHwOuterNode> context;

    public CircuitVisitor(HwCompiler compiler) {
        this.id = crtId++;
        this.compiler = compiler;
        this.context = new ArrayList<>();
    }

    @Override
    public HwCompiler compiler() {
        return this.compiler;
    }

    @Override
    public long getId() {
        return this.id;
    }

    /** Property of a node that is being visited */
    public void label(String property) {}

    /** Property that has an array of values */
    public void startArrayProperty(String property) {}

    /** End a property that has an array of values */
    public void endArrayProperty(String property) {}

    /** Index of a property that has an array or list value */
    @SuppressWarnings("unused")
    public void propertyIndex(int index) {}

    /** Override to initialize before visiting any node. */
    public void startVisit(IHwOuterNode node) {
        if (node.is(HwCircuit.class))
            this.setCircuit(node.to(HwCircuit.class));
    }

    /** Override to finish after visiting all nodes. */
    public void endVisit() {
        this.circuit = null;
    }

    /** Returns by default the input circuit unmodified. */
    @Override
    public HwCircuit apply(HwCircuit node) {
        this.startVisit(node);
        node.accept(this);
        this.endVisit();
        return node;
    }

    public void push(IHwOuterNode node) {
        this.context.add(node);
    }

    public void pop(IHwOuterNode node) {
        IHwOuterNode last = Utilities.removeLast(this.context);
        if (node != last)
            throw new InternalCompilerError("Corrupted visitor context: popping " + node
                    + " instead of " + last, node);
    }

    public void setCircuit(HwCircuit circuit) {
        if (this.circuit != null)
            throw new InternalCompilerError("Circuit is already set", circuit);
        this.circuit = circuit;
    }

    /************************* PREORDER *****************************/

    public VisitDecision preorder(IHwOuterNode ignoredNode) { return VisitDecision.CONTINUE; }

    public VisitDecision preorder(HwCircuit circuit) {
        return this.preorder((IHwOuterNode) circuit);
    }

    public VisitDecision preorder(HwModuleBase module) {
        return this.preorder((IHwOuterNode) module);
    }

    public VisitDecision preorder(HwModule module) {
        return this.preorder((HwModuleBase) module);
    }

    public VisitDecision preorder(HwExtModule module) {
        return this.preorder((HwModuleBase) module);
    }

    /************************* POSTORDER *****************************/

    public void postorder(IHwOuterNode ignoredNode) {}

    public void postorder(HwCircuit circuit) {
        this.postorder((IHwOuterNode) circuit);
    }

    public void postorder(HwModuleBase module) {
        this.postorder((IHwOuterNode) module);
    }

    public void postorder(HwModule module) {
        this.postorder((HwModuleBase) module);
    }

    public void postorder(HwExtModule module) {
        this.postorder((HwModuleBase) module);
    }

    @Override
    public String toString() {
        return this.id + " " + this.getClass().getSimpleName();
    }

    @Override
    public String getName() {
        return this.getClass().getSimpleName();
    }
}
