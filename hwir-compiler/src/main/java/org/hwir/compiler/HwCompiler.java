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

package org.hwir.compiler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.hwir.compiler.backend.JsonDecoder;
import org.hwir.compiler.backend.ToJsonOuterVisitor;
import org.hwir.compiler.errors.CompilationError;
import org.hwir.compiler.errors.CompilerMessages;
import org.hwir.compiler.errors.SourcePositionRange;
import org.hwir.compiler.visitors.outer.RemoveIntervals;
import org.hwir.ir.HwCircuit;
import org.hwir.util.IWritesLogs;
import org.hwir.util.Logger;

/** Entry point of the library: lowers interval types and operations
 * out of a circuit. */
public class HwCompiler implements IErrorReporter, IWritesLogs, ICompilerComponent {
    public final CompilerOptions options;
    public final CompilerMessages messages;

    public HwCompiler(CompilerOptions options) {
        this.options = options;
        // Setting this first allows errors to be reported
        this.messages = new CompilerMessages(this);
    }

    @Override
    public HwCompiler compiler() {
        return this;
    }

    /** Run the interval lowering passes on a circuit.
     * Internal errors are not caught and propagate to the caller. */
    public HwCircuit lowerIntervals(HwCircuit circuit) {
        Logger.INSTANCE.belowLevel(this, 1)
                .append("Lowering intervals in circuit ")
                .append(circuit.main)
                .newline();
        RemoveIntervals pass = new RemoveIntervals(this);
        return pass.apply(circuit);
    }

    /** Decode a circuit serialized by {@link #toJson}. */
    public HwCircuit fromJson(String json) {
        ObjectMapper mapper = new ObjectMapper();
        JsonNode node;
        try {
            node = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new CompilationError("Could not parse circuit: " + e.getOriginalMessage(), e);
        }
        JsonDecoder decoder = new JsonDecoder();
        return decoder.decodeOuter(node, HwCircuit.class);
    }

    public String toJson(HwCircuit circuit) {
        ToJsonOuterVisitor visitor = ToJsonOuterVisitor.create(this, this.options.ioOptions.verbosity);
        visitor.apply(circuit);
        return visitor.getJsonString();
    }

    @Override
    public void reportProblem(SourcePositionRange range, boolean warning,
                              String errorType, String message) {
        this.messages.reportProblem(range, warning, errorType, message);
        if (!warning && this.options.loweringOptions.throwOnError) {
            System.err.println(this.messages);
            throw new CompilationError("Error during compilation");
        }
    }

    @Override
    public boolean hasErrors() {
        return this.messages.exitCode != 0;
    }
}
