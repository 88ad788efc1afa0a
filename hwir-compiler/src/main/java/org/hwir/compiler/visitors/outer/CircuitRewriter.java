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
import org.hwir.compiler.visitors.VisitDecision;
import org.hwir.compiler.visitors.inner.IRTransform;
import org.hwir.ir.HwCircuit;
import org.hwir.ir.HwExtModule;
import org.hwir.ir.HwModule;
import org.hwir.ir.HwModuleBase;
import org.hwir.ir.HwPort;
import org.hwir.ir.statement.HwBlock;
import org.hwir.util.Linq;
import org.hwir.util.Logger;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Applies a function (this.transform) to the ports and to the body of
 * every module of a circuit.  The ports of a module are transformed
 * before its body; the transform is told about each module before
 * any of its nodes is visited. */
public class CircuitRewriter extends CircuitVisitor {
    public final IRTransform transform;
    final List<HwModuleBase> modules;
    @Nullable
    HwCircuit result;

    public CircuitRewriter(HwCompiler compiler, IRTransform transform) {
        super(compiler);
        this.transform = transform;
        this.modules = new ArrayList<>();
        this.result = null;
    }

    HwPort transform(HwPort port) {
        return this.transform.apply(port).to(HwPort.class);
    }

    void map(HwModuleBase old, HwModuleBase module) {
        if (old != module)
            Logger.INSTANCE.belowLevel(this, 1)
                    .appendSupplier(this::toString)
                    .append(" rewrote module ")
                    .append(old.name)
                    .newline();
        this.modules.add(module);
    }

    @Override
    public VisitDecision preorder(HwCircuit circuit) {
        this.modules.clear();
        this.result = null;
        return VisitDecision.CONTINUE;
    }

    @Override
    public void postorder(HwModule module) {
        this.transform.setModuleContext(module);
        List<HwPort> ports = Linq.map(module.ports, this::transform);
        HwBlock body = this.transform.apply(module.body).to(HwBlock.class);
        this.map(module, module.replace(ports, body));
    }

    @Override
    public void postorder(HwExtModule module) {
        this.transform.setModuleContext(module);
        List<HwPort> ports = Linq.map(module.ports, this::transform);
        this.map(module, module.replace(ports));
    }

    @Override
    public void postorder(HwCircuit circuit) {
        this.result = circuit.replace(new ArrayList<>(this.modules));
    }

    @Override
    public HwCircuit apply(HwCircuit circuit) {
        this.startVisit(circuit);
        circuit.accept(this);
        this.endVisit();
        return Objects.requireNonNull(this.result);
    }

    @Override
    public String toString() {
        return super.toString() + "(" + this.transform + ")";
    }

    @Override
    public String getName() {
        return this.transform.getClass().getSimpleName();
    }
}
