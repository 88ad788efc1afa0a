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
import org.hwir.compiler.visitors.VisitDecision;
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
import org.hwir.util.IWritesLogs;
import org.hwir.util.Linq;
import org.hwir.util.Logger;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/**
 * Base class for Inner visitors which rewrite expressions, types, and statements.
 * This class recurses over the structure of expressions, types, and statements
 * and if any fields have changed builds a new version of the object.  Classes
 * that extend this should override the preorder methods and ignore the postorder
 * methods. */
public abstract class InnerRewriteVisitor
        extends InnerVisitor
        implements IWritesLogs {
    protected final boolean force;

    protected InnerRewriteVisitor(HwCompiler compiler, boolean force) {
        super(compiler);
        this.force = force;
    }

    /** Result produced by the last preorder invocation. */
    @Nullable
    protected IHwInnerNode lastResult;

    IHwInnerNode getResult() {
        return Objects.requireNonNull(this.lastResult);
    }

    @Override
    public IHwInnerNode apply(IHwInnerNode node) {
        this.startVisit(node);
        node.accept(this);
        this.endVisit();
        return this.getResult();
    }

    /**
     * Replace the 'old' IR node with the 'newOp' IR node if
     * any of its fields differs. */
    protected void map(IHwInnerNode old, IHwInnerNode newOp) {
        if ((old == newOp) || (!this.force && old.sameFields(newOp))) {
            // Ignore new op.
            this.lastResult = old;
            return;
        }

        Logger.INSTANCE.belowLevel(this, 1)
                .appendSupplier(this::toString)
                .append(":")
                .appendSupplier(old::toString)
                .append(" -> ")
                .appendSupplier(newOp::toString)
                .newline();
        this.lastResult = newOp;
    }

    @Override
    public VisitDecision preorder(IHwInnerNode node) {
        this.map(node, node);
        return VisitDecision.STOP;
    }

    protected HwExpression getResultExpression() {
        IHwInnerNode result = this.getResult();
        return result.to(HwExpression.class);
    }

    protected HwType getResultType() { return this.getResult().to(HwType.class); }

    @Nullable
    protected HwExpression transformN(@Nullable HwExpression expression) {
        if (expression == null)
            return null;
        return this.transform(expression);
    }

    protected HwExpression transform(HwExpression expression) {
        expression.accept(this);
        return this.getResultExpression();
    }

    protected List<HwExpression> transformExpressions(List<HwExpression> expressions) {
        return Linq.map(expressions, e -> this.transform(e));
    }

    protected HwStatement transform(HwStatement statement) {
        statement.accept(this);
        return this.getResult().to(HwStatement.class);
    }

    protected HwType transform(HwType type) {
        type.accept(this);
        return this.getResultType();
    }

    protected HwPort transform(HwPort port) {
        port.accept(this);
        return this.getResult().to(HwPort.class);
    }

    /////////////////////// Types ////////////////////////////////

    @Override
    public VisitDecision preorder(HwTypeInteger type) {
        this.map(type, type);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(HwTypeInterval type) {
        this.map(type, type);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(HwTypeClock type) {
        this.map(type, type);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(HwTypeUnknown type) {
        this.map(type, type);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(HwField field) {
        this.push(field);
        HwType type = this.transform(field.type);
        this.pop(field);
        HwField result = field.withType(type);
        this.map(field, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(HwTypeBundle type) {
        this.push(type);
        List<HwField> fields = Linq.map(type.fields, f -> {
            f.accept(this);
            return this.getResult().to(HwField.class);
        });
        this.pop(type);
        HwType result = new HwTypeBundle(type.getSourceInfo(), fields);
        this.map(type, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(HwTypeVector type) {
        this.push(type);
        HwType elementType = this.transform(type.elementType);
        this.pop(type);
        HwType result = new HwTypeVector(type.getSourceInfo(), elementType, type.size);
        this.map(type, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(HwPort port) {
        this.push(port);
        HwType type = this.transform(port.type);
        this.pop(port);
        HwPort result = new HwPort(port.getSourceInfo(), port.name, port.direction, type);
        this.map(port, result);
        return VisitDecision.STOP;
    }

    /////////////////////// Expressions ////////////////////////////////

    @Override
    public VisitDecision preorder(HwPrimOpExpression expression) {
        this.push(expression);
        HwType type = this.transform(expression.type);
        List<HwExpression> operands = this.transformExpressions(expression.operands);
        this.pop(expression);
        HwExpression result = new HwPrimOpExpression(expression.getSourceInfo(), type,
                expression.op, operands, expression.constants);
        this.map(expression, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(HwMuxExpression expression) {
        this.push(expression);
        HwType type = this.transform(expression.type);
        HwExpression condition = this.transform(expression.condition);
        HwExpression positive = this.transform(expression.positive);
        HwExpression negative = this.transform(expression.negative);
        this.pop(expression);
        HwExpression result = new HwMuxExpression(expression.getSourceInfo(), type,
                condition, positive, negative);
        this.map(expression, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(HwReference expression) {
        this.push(expression);
        HwType type = this.transform(expression.type);
        this.pop(expression);
        HwExpression result = expression.withType(type);
        this.map(expression, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(HwSubField expression) {
        this.push(expression);
        HwType type = this.transform(expression.type);
        HwExpression source = this.transform(expression.expression);
        this.pop(expression);
        HwExpression result = new HwSubField(expression.getSourceInfo(), source, expression.name, type);
        this.map(expression, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(HwSubIndex expression) {
        this.push(expression);
        HwType type = this.transform(expression.type);
        HwExpression source = this.transform(expression.expression);
        this.pop(expression);
        HwExpression result = new HwSubIndex(expression.getSourceInfo(), source, expression.index, type);
        this.map(expression, result);
        return VisitDecision.STOP;
    }

    protected VisitDecision literal(HwLiteral literal) {
        this.push(literal);
        HwType type = this.transform(literal.type);
        this.pop(literal);
        HwExpression result = literal.withType(type);
        this.map(literal, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(HwUIntLiteral literal) {
        return this.literal(literal);
    }

    @Override
    public VisitDecision preorder(HwSIntLiteral literal) {
        return this.literal(literal);
    }

    /////////////////////// Statements ////////////////////////////////

    @Override
    public VisitDecision preorder(HwBlock block) {
        this.push(block);
        List<HwStatement> statements = Linq.map(block.statements, s -> this.transform(s));
        this.pop(block);
        HwStatement result = new HwBlock(block.getSourceInfo(), statements);
        this.map(block, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(HwSkip skip) {
        this.map(skip, skip);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(HwConditionally statement) {
        this.push(statement);
        HwExpression predicate = this.transform(statement.predicate);
        HwStatement positive = this.transform(statement.positive);
        HwStatement negative = this.transform(statement.negative);
        this.pop(statement);
        HwStatement result = new HwConditionally(statement.getSourceInfo(), predicate, positive, negative);
        this.map(statement, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(HwDefWire wire) {
        this.push(wire);
        HwType type = this.transform(wire.type);
        this.pop(wire);
        HwStatement result = new HwDefWire(wire.getSourceInfo(), wire.name, type);
        this.map(wire, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(HwDefRegister register) {
        this.push(register);
        HwType type = this.transform(register.type);
        HwExpression clock = this.transform(register.clock);
        HwExpression reset = this.transformN(register.reset);
        HwExpression init = this.transformN(register.init);
        this.pop(register);
        HwStatement result = new HwDefRegister(register.getSourceInfo(), register.name,
                type, clock, reset, init);
        this.map(register, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(HwDefNode node) {
        this.push(node);
        HwExpression value = this.transform(node.value);
        this.pop(node);
        HwStatement result = new HwDefNode(node.getSourceInfo(), node.name, value);
        this.map(node, result);
        return VisitDecision.STOP;
    }

    protected VisitDecision assignment(HwAssignment statement) {
        this.push(statement);
        HwExpression destination = this.transform(statement.destination);
        HwExpression source = this.transform(statement.source);
        this.pop(statement);
        HwStatement result = statement.replace(destination, source);
        this.map(statement, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(HwConnect statement) {
        return this.assignment(statement);
    }

    @Override
    public VisitDecision preorder(HwPartialConnect statement) {
        return this.assignment(statement);
    }
}
