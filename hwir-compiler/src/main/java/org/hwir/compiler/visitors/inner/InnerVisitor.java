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

package org.hwir.compiler.visitors.inner;

import org.hwir.compiler.HwCompiler;
import org.hwir.compiler.ICompilerComponent;
import org.hwir.compiler.errors.InternalCompilerError;
import org.hwir.compiler.visitors.VisitDecision;
import org.hwir.compiler.visitors.outer.CircuitRewriter;
import org.hwir.ir.HwModuleBase;
import org.hwir.ir.HwPort;
import org.hwir.ir.IHwInnerNode;
import org.hwir.ir.expression.HwExpression;
import org.hwir.ir.expression.HwMuxExpression;
import org.hwir.ir.expression.HwPrimOpExpression;
import org.hwir.ir.expression.HwReference;
import org.hwir.ir.expression.HwSubField;
import org.hwir.ir.expression.HwSubIndex;
import org.hwir.ir.expression.literal.HwLiteral;
import org.hwir.ir.expression.literal.HwSIntLiteral;
import org.hwir.ir.expression.literal.HwUIntLiteral;
import org.hwir.ir.statement.HwAssignment;
import org.hwir.ir.statement.HwBlock;
import org.hwir.ir.statement.HwConditionally;
import org.hwir.ir.statement.HwConnect;
import org.hwir.ir.statement.HwDeclaration;
import org.hwir.ir.statement.HwDefNode;
import org.hwir.ir.statement.HwDefRegister;
import org.hwir.ir.statement.HwDefWire;
import org.hwir.ir.statement.HwPartialConnect;
import org.hwir.ir.statement.HwSkip;
import org.hwir.ir.statement.HwStatement;
import org.hwir.ir.type.HwField;
import org.hwir.ir.type.HwType;
import org.hwir.ir.type.HwTypeBundle;
import org.hwir.ir.type.HwTypeClock;
import org.hwir.ir.type.HwTypeInteger;
import org.hwir.ir.type.HwTypeInterval;
import org.hwir.ir.type.HwTypeUnknown;
import org.hwir.ir.type.HwTypeVector;
import org.hwir.util.IHasId;
import org.hwir.util.IWritesLogs;
import org.hwir.util.Logger;
import org.hwir.util.Utilities;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

/** Depth-first traversal of an IHwInnerNode hierarchy. */
@SuppressWarnings({"SameReturnValue, EmptyMethod", "unused"})
public abstract class InnerVisitor implements IRTransform, IWritesLogs, IHasId, ICompilerComponent {
    final long id;
    static long crtId = 0;
    public final HwCompiler compiler;
    protected final List<IHwInnerNode> context;
    /** Module containing the nodes currently visited, if known. */
    @Nullable
    protected HwModuleBase module;

    public InnerVisitor(HwCompiler compiler) {
        this.id = crtId++;
        this.compiler = compiler;
        this.context = new ArrayList<>();
        this.module = null;
    }

    @Override
    public HwCompiler compiler() {
        return this.compiler;
    }

    @Override
    public long getId() {
        return this.id;
    }

    @Override
    public void setModuleContext(HwModuleBase module) {
        this.module = module;
    }

    public void push(IHwInnerNode node) {
        this.context.add(node);
    }

    public void pop(IHwInnerNode node) {
        IHwInnerNode last = Utilities.removeLast(this.context);
        if (node != last)
            throw new InternalCompilerError("Corrupted visitor context: popping " + node
                    + " instead of " + last, node);
    }

    /** Property of a node that is being visited */
    public void property(String property) {}

    /** Property that has an array of values */
    public void startArrayProperty(String property) {}

    /** End a property that has an array of values */
    public void endArrayProperty(String property) {}

    /** Index of a property that has an array or list value */
    public void propertyIndex(int index) {}

    /** Override to initialize before visiting any node. */
    public void startVisit(IHwInnerNode node) {
        Logger.INSTANCE.belowLevel(this, 4)
                .append("Starting ")
                .appendSupplier(this::toString)
                .append(" at ")
                .append(node);
    }

    /** Override to finish after visiting all nodes. */
    public void endVisit() {}

    /************************* PREORDER *****************************/

    // preorder methods return 'true' when normal traversal is desired,
    // and 'false' when the traversal should stop right away at the current node.
    public VisitDecision preorder(IHwInnerNode ignored) {
        return VisitDecision.CONTINUE;
    }

    public VisitDecision preorder(HwType node) {
        return this.preorder((IHwInnerNode) node);
    }

    public VisitDecision preorder(HwTypeInteger node) {
        return this.preorder((HwType) node);
    }

    public VisitDecision preorder(HwTypeInterval node) {
        return this.preorder((HwType) node);
    }

    public VisitDecision preorder(HwTypeClock node) {
        return this.preorder((HwType) node);
    }

    public VisitDecision preorder(HwTypeUnknown node) {
        return this.preorder((HwType) node);
    }

    public VisitDecision preorder(HwTypeBundle node) {
        return this.preorder((HwType) node);
    }

    public VisitDecision preorder(HwTypeVector node) {
        return this.preorder((HwType) node);
    }

    public VisitDecision preorder(HwField node) {
        return this.preorder((IHwInnerNode) node);
    }

    public VisitDecision preorder(HwPort node) {
        return this.preorder((IHwInnerNode) node);
    }

    public VisitDecision preorder(HwExpression node) {
        return this.preorder((IHwInnerNode) node);
    }

    public VisitDecision preorder(HwPrimOpExpression node) {
        return this.preorder((HwExpression) node);
    }

    public VisitDecision preorder(HwMuxExpression node) {
        return this.preorder((HwExpression) node);
    }

    public VisitDecision preorder(HwReference node) {
        return this.preorder((HwExpression) node);
    }

    public VisitDecision preorder(HwSubField node) {
        return this.preorder((HwExpression) node);
    }

    public VisitDecision preorder(HwSubIndex node) {
        return this.preorder((HwExpression) node);
    }

    public VisitDecision preorder(HwLiteral node) {
        return this.preorder((HwExpression) node);
    }

    public VisitDecision preorder(HwUIntLiteral node) {
        return this.preorder((HwLiteral) node);
    }

    public VisitDecision preorder(HwSIntLiteral node) {
        return this.preorder((HwLiteral) node);
    }

    public VisitDecision preorder(HwStatement node) {
        return this.preorder((IHwInnerNode) node);
    }

    public VisitDecision preorder(HwBlock node) {
        return this.preorder((HwStatement) node);
    }

    public VisitDecision preorder(HwSkip node) {
        return this.preorder((HwStatement) node);
    }

    public VisitDecision preorder(HwConditionally node) {
        return this.preorder((HwStatement) node);
    }

    public VisitDecision preorder(HwDeclaration node) {
        return this.preorder((HwStatement) node);
    }

    public VisitDecision preorder(HwDefWire node) {
        return this.preorder((HwDeclaration) node);
    }

    public VisitDecision preorder(HwDefRegister node) {
        return this.preorder((HwDeclaration) node);
    }

    public VisitDecision preorder(HwDefNode node) {
        return this.preorder((HwDeclaration) node);
    }

    public VisitDecision preorder(HwAssignment node) {
        return this.preorder((HwStatement) node);
    }

    public VisitDecision preorder(HwConnect node) {
        return this.preorder((HwAssignment) node);
    }

    public VisitDecision preorder(HwPartialConnect node) {
        return this.preorder((HwAssignment) node);
    }

    /************************* POSTORDER *****************************/

    public void postorder(IHwInnerNode ignored) {}

    public void postorder(HwType node) {
        this.postorder((IHwInnerNode) node);
    }

    public void postorder(HwTypeInteger node) {
        this.postorder((HwType) node);
    }

    public void postorder(HwTypeInterval node) {
        this.postorder((HwType) node);
    }

    public void postorder(HwTypeClock node) {
        this.postorder((HwType) node);
    }

    public void postorder(HwTypeUnknown node) {
        this.postorder((HwType) node);
    }

    public void postorder(HwTypeBundle node) {
        this.postorder((HwType) node);
    }

    public void postorder(HwTypeVector node) {
        this.postorder((HwType) node);
    }

    public void postorder(HwField node) {
        this.postorder((IHwInnerNode) node);
    }

    public void postorder(HwPort node) {
        this.postorder((IHwInnerNode) node);
    }

    public void postorder(HwExpression node) {
        this.postorder((IHwInnerNode) node);
    }

    public void postorder(HwPrimOpExpression node) {
        this.postorder((HwExpression) node);
    }

    public void postorder(HwMuxExpression node) {
        this.postorder((HwExpression) node);
    }

    public void postorder(HwReference node) {
        this.postorder((HwExpression) node);
    }

    public void postorder(HwSubField node) {
        this.postorder((HwExpression) node);
    }

    public void postorder(HwSubIndex node) {
        this.postorder((HwExpression) node);
    }

    public void postorder(HwLiteral node) {
        this.postorder((HwExpression) node);
    }

    public void postorder(HwUIntLiteral node) {
        this.postorder((HwLiteral) node);
    }

    public void postorder(HwSIntLiteral node) {
        this.postorder((HwLiteral) node);
    }

    public void postorder(HwStatement node) {
        this.postorder((IHwInnerNode) node);
    }

    public void postorder(HwBlock node) {
        this.postorder((HwStatement) node);
    }

    public void postorder(HwSkip node) {
        this.postorder((HwStatement) node);
    }

    public void postorder(HwConditionally node) {
        this.postorder((HwStatement) node);
    }

    public void postorder(HwDeclaration node) {
        this.postorder((HwStatement) node);
    }

    public void postorder(HwDefWire node) {
        this.postorder((HwDeclaration) node);
    }

    public void postorder(HwDefRegister node) {
        this.postorder((HwDeclaration) node);
    }

    public void postorder(HwDefNode node) {
        this.postorder((HwDeclaration) node);
    }

    public void postorder(HwAssignment node) {
        this.postorder((HwStatement) node);
    }

    public void postorder(HwConnect node) {
        this.postorder((HwAssignment) node);
    }

    public void postorder(HwPartialConnect node) {
        this.postorder((HwAssignment) node);
    }

    @Override
    public String toString() {
        return this.id + " " + this.getClass().getSimpleName();
    }

    @Override
    public IHwInnerNode apply(IHwInnerNode node) {
        this.startVisit(node);
        node.accept(this);
        this.endVisit();
        return node;
    }

    /** Given a visitor for inner nodes returns a visitor
     * that applies it to every module of a circuit. */
    public CircuitRewriter circuitRewriter() {
        return new CircuitRewriter(this.compiler, this);
    }
}
