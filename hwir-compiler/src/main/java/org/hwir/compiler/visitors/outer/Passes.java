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
import org.hwir.ir.HwCircuit;
import org.hwir.ir.HwNode;
import org.hwir.util.IWritesLogs;
import org.hwir.util.Linq;
import org.hwir.util.Logger;

import java.util.ArrayList;
import java.util.List;

/** A sequence of circuit transforms applied in order. */
public class Passes implements IWritesLogs, CircuitTransform, ICompilerComponent {
    final HwCompiler compiler;
    public final List<CircuitTransform> passes;
    final long id;
    final String name;

    public Passes(String name, HwCompiler compiler, CircuitTransform... passes) {
        this(name, compiler, new ArrayList<>(Linq.list(passes)));
    }

    public Passes(String name, HwCompiler compiler, List<CircuitTransform> passes) {
        this.compiler = compiler;
        this.passes = passes;
        this.id = CircuitVisitor.crtId++;
        this.name = name;
    }

    @Override
    public HwCompiler compiler() {
        return this.compiler;
    }

    public void add(CircuitTransform pass) {
        this.passes.add(pass);
    }

    @Override
    public HwCircuit apply(HwCircuit circuit) {
        long begin = System.currentTimeMillis();
        Logger.INSTANCE.belowLevel(this, 2)
                .append(this.toString())
                .append(" starting ")
                .append(this.passes.size())
                .append(" passes")
                .increase();
        for (CircuitTransform pass: this.passes) {
            long start = System.currentTimeMillis();
            long startId = HwNode.innerId;
            circuit = pass.apply(circuit);
            long endId = HwNode.innerId;
            long end = System.currentTimeMillis();
            Logger.INSTANCE.belowLevel(this, 1)
                    .append(pass.getName())
                    .append(" took ")
                    .append(end - start)
                    .append("ms, created ")
                    .append(String.format("%,d", endId - startId))
                    .append(" nodes")
                    .newline();
        }
        long finish = System.currentTimeMillis();
        Logger.INSTANCE.belowLevel(this, 1)
                .decrease()
                .append(this.toString())
                .append(" took ")
                .append(finish - begin)
                .append("ms.")
                .newline();
        return circuit;
    }

    @Override
    public String toString() {
        return this.id +
                " " +
                this.name +
                "[" + this.passes.size() + "]";
    }

    @Override
    public String getName() {
        return this.name;
    }
}
