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

package org.hwir.compiler.errors;

import org.hwir.ir.IHwNode;
import org.hwir.ir.SourceInfo;

import javax.annotation.Nullable;

/** Signals a bug in the compiler or in the passes that ran before it:
 * some expected invariant of the IR doesn't hold.  These errors are
 * never recovered from. */
public final class InternalCompilerError extends BaseCompilerException {
    @Nullable
    public final IHwNode hwNode;

    InternalCompilerError(String message, SourceInfo node, @Nullable IHwNode hwNode) {
        super(message, node);
        this.hwNode = hwNode;
    }

    public InternalCompilerError(String message, SourceInfo node) {
        this(message, node, null);
    }

    public InternalCompilerError(String message) {
        this(message, SourceInfo.EMPTY, null);
    }

    public InternalCompilerError(String message, IHwNode node) {
        this(message, node.getSourceInfo(), node);
    }

    @Override
    public SourcePositionRange getPositionRange() {
        if (this.hwNode != null)
            return this.hwNode.getSourceInfo().getPositionRange();
        return this.sourceInfo.getPositionRange();
    }

    @Override
    public String getErrorKind() {
        return "Compiler error";
    }
}
