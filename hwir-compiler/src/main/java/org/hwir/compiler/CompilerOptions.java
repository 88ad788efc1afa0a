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

import com.beust.jcommander.DynamicParameter;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;
import org.hwir.compiler.errors.SourcePositionRange;
import org.hwir.util.IDiff;
import org.hwir.util.IValidate;
import org.hwir.util.Utilities;

import javax.annotation.Nullable;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/** Command-line options for the interval lowering compiler */
@SuppressWarnings("CanBeFinal")
// These fields cannot be final, since JCommander writes them through reflection.
public class CompilerOptions implements IDiff<CompilerOptions>, IValidate {
    /** Options which select the passes that are run. */
    @SuppressWarnings("CanBeFinal")
    public static class Lowering implements IDiff<Lowering>, IValidate {
        @Parameter(names = "--alignOnly",
                description = "Stop after aligning binary points; do not lower interval types")
        public boolean alignOnly = false;
        @Parameter(names = "--noInfer",
                description = "Do not re-infer expression types after lowering")
        public boolean skipInference = false;
        @Parameter(names = "--noCheck",
                description = "Do not check that the lowered circuit is free of interval types")
        public boolean skipValidation = false;
        /** Useful for development */
        public boolean throwOnError = false;

        public boolean same(Lowering other) {
            return this.alignOnly == other.alignOnly &&
                    this.skipInference == other.skipInference &&
                    this.skipValidation == other.skipValidation;
        }

        @Override
        public String toString() {
            return "Lowering{" +
                    "\n\talignOnly=" + this.alignOnly +
                    ",\n\tskipInference=" + this.skipInference +
                    ",\n\tskipValidation=" + this.skipValidation +
                    ",\n\tthrowOnError=" + this.throwOnError +
                    '}';
        }

        @Override
        public boolean validate(IErrorReporter reporter) {
            if (this.alignOnly && this.skipInference) {
                reporter.reportWarning(SourcePositionRange.INVALID, "Redundant options",
                        "--noInfer has no effect when --alignOnly is given");
            }
            return true;
        }

        @Override
        public String diff(Lowering other) {
            if (this.same(other))
                return "";
            StringBuilder result = new StringBuilder();
            result.append("Lowering{");
            if (this.alignOnly != other.alignOnly)
                result.append("alignOnly=")
                        .append(this.alignOnly)
                        .append("!=")
                        .append(other.alignOnly)
                        .append(System.lineSeparator());
            if (this.skipInference != other.skipInference)
                result.append(", skipInference=")
                        .append(this.skipInference)
                        .append("!=")
                        .append(other.skipInference)
                        .append(System.lineSeparator());
            if (this.skipValidation != other.skipValidation)
                result.append(", skipValidation=")
                        .append(this.skipValidation)
                        .append("!=")
                        .append(other.skipValidation)
                        .append(System.lineSeparator());
            result.append("}")
                    .append(System.lineSeparator());
            return result.toString();
        }
    }

    /** Options related to input and output. */
    @SuppressWarnings("CanBeFinal")
    public static class IO implements IDiff<IO>, IValidate {
        @DynamicParameter(names = "-T",
                description = "Specify logging level for a class (can be repeated)")
        public Map<String, String> loggingLevel = new HashMap<>();
        @Parameter(names = "-o", description = "Output file; stdout if not specified")
        public String outputFile = "";
        @Parameter(names = "--text", description = "Emit the lowered circuit as text instead of JSON")
        public boolean emitText = false;
        @Parameter(names = {"--je", "-je"}, description = "Emit error messages as a JSON array to the error output")
        public boolean emitJsonErrors = false;
        @Parameter(names = "-q", description = "Quiet: do not print warnings")
        public boolean quiet = false;
        @Parameter(description = "Input circuit file in JSON format; stdin if not specified")
        @Nullable
        public String inputFile = null;
        @Parameter(names = "-v", description = "Output verbosity")
        public int verbosity = 0;

        public boolean same(IO other) {
            return this.emitText == other.emitText &&
                    this.emitJsonErrors == other.emitJsonErrors &&
                    this.quiet == other.quiet &&
                    this.verbosity == other.verbosity &&
                    this.outputFile.equals(other.outputFile) &&
                    Objects.equals(this.inputFile, other.inputFile);
        }

        @Override
        public boolean validate(IErrorReporter reporter) {
            for (Map.Entry<String, String> entry: this.loggingLevel.entrySet()) {
                try {
                    Integer.parseInt(entry.getValue());
                } catch (NumberFormatException ex) {
                    reporter.reportError(SourcePositionRange.INVALID, "Invalid options",
                            "-T option must be followed by 'class=number'; could not parse " + entry);
                    return false;
                }
            }
            return true;
        }

        @Override
        public String toString() {
            return "IO{" +
                    "\n\tloggingLevel=" + this.loggingLevel +
                    ",\n\toutputFile=" + Utilities.singleQuote(this.outputFile) +
                    ",\n\tinputFile=" + Utilities.singleQuote(this.inputFile) +
                    ",\n\temitText=" + this.emitText +
                    ",\n\temitJsonErrors=" + this.emitJsonErrors +
                    ",\n\tquiet=" + this.quiet +
                    ",\n\tverbosity=" + this.verbosity +
                    '}';
        }

        @Override
        public String diff(IO other) {
            if (this.same(other))
                return "";
            return "IO{" + this + "!=" + other + "}" + System.lineSeparator();
        }
    }

    @Parameter(names = {"-h", "--help", "-?"}, help = true, description = "Show this message and exit")
    public boolean help;
    @ParametersDelegate
    public IO ioOptions = new IO();
    @ParametersDelegate
    public Lowering loweringOptions = new Lowering();

    @Override
    public String diff(CompilerOptions other) {
        return this.loweringOptions.diff(other.loweringOptions) +
                this.ioOptions.diff(other.ioOptions);
    }

    @Override
    public String toString() {
        return "CompilerOptions{" +
                "\nhelp=" + this.help +
                ",\nioOptions=" + this.ioOptions +
                ",\nloweringOptions=" + this.loweringOptions +
                "\n}";
    }

    @Override
    public boolean validate(IErrorReporter reporter) {
        return this.ioOptions.validate(reporter) &&
                this.loweringOptions.validate(reporter);
    }
}
