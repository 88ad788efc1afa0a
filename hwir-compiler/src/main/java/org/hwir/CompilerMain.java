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

package org.hwir;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import org.hwir.compiler.CompilerOptions;
import org.hwir.compiler.HwCompiler;
import org.hwir.compiler.errors.BaseCompilerException;
import org.hwir.compiler.errors.CompilationError;
import org.hwir.compiler.errors.CompilerMessages;
import org.hwir.compiler.errors.SourcePositionRange;
import org.hwir.ir.HwCircuit;
import org.hwir.util.IndentStreamBuilder;
import org.hwir.util.Logger;
import org.hwir.util.Utilities;

import javax.annotation.Nullable;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Map;

/** Main entry point of the interval lowering compiler. */
public class CompilerMain {
    final CompilerOptions options;

    CompilerMain() {
        this.options = new CompilerOptions();
    }

    void usage(JCommander commander) {
        // JCommander mistakenly prints this as default value
        // if it manages to parse it partially.
        this.options.ioOptions.loggingLevel.clear();
        commander.usage();
    }

    int parseOptions(String[] argv) {
        JCommander commander = JCommander.newBuilder()
                .addObject(this.options)
                .build();
        commander.setProgramName("hwir-lower");
        try {
            commander.parse(argv);
        } catch (ParameterException ex) {
            System.err.println(ex.getMessage());
            return 1;
        }
        if (this.options.help) {
            this.usage(commander);
            return 1;
        }

        for (Map.Entry<String, String> entry: this.options.ioOptions.loggingLevel.entrySet()) {
            try {
                int level = Integer.parseInt(entry.getValue());
                Logger.INSTANCE.setLoggingLevel(entry.getKey(), level);
            } catch (NumberFormatException ex) {
                System.err.println("-T option must be followed by 'class=number'; could not parse " + entry);
                return 1;
            } catch (CompilationError ex) {
                System.err.println(ex.getMessage());
                return 1;
            }
        }
        return 0;
    }

    PrintStream getOutputStream() throws IOException {
        PrintStream outputStream;
        String outputFile = this.options.ioOptions.outputFile;
        if (outputFile.isEmpty()) {
            outputStream = System.out;
        } else {
            outputStream = new PrintStream(Files.newOutputStream(Paths.get(outputFile)),
                    false, StandardCharsets.UTF_8);
        }
        return outputStream;
    }

    String readInput(@Nullable String inputFile) throws IOException {
        if (inputFile == null) {
            ByteArrayOutputStream bytes = new ByteArrayOutputStream();
            InputStream input = System.in;
            input.transferTo(bytes);
            return bytes.toString(StandardCharsets.UTF_8);
        } else {
            return Utilities.readFile(Paths.get(inputFile));
        }
    }

    /** Run compiler, return the messages produced. */
    CompilerMessages run() {
        HwCompiler compiler = new HwCompiler(this.options);
        if (!this.options.validate(compiler))
            return compiler.messages;

        String json;
        try {
            json = this.readInput(this.options.ioOptions.inputFile);
        } catch (IOException e) {
            compiler.reportError(SourcePositionRange.INVALID,
                    "Error reading file",
                    Utilities.singleQuote(this.options.ioOptions.inputFile) + " " + e.getMessage());
            return compiler.messages;
        }
        if (this.options.ioOptions.verbosity >= 1)
            System.out.println(this.options);

        HwCircuit result;
        try {
            HwCircuit circuit = compiler.fromJson(json);
            result = compiler.lowerIntervals(circuit);
        } catch (BaseCompilerException e) {
            compiler.messages.reportError(e);
            if (this.options.loweringOptions.throwOnError)
                throw e;
            return compiler.messages;
        }

        if (compiler.hasErrors())
            return compiler.messages;

        String output;
        if (this.options.ioOptions.emitText) {
            IndentStreamBuilder builder = new IndentStreamBuilder();
            result.toString(builder);
            output = builder.toString();
        } else {
            output = compiler.toJson(result);
        }
        try {
            PrintStream stream = this.getOutputStream();
            stream.println(output);
            if (stream != System.out)
                stream.close();
        } catch (IOException e) {
            compiler.reportError(SourcePositionRange.INVALID,
                    "Error writing to output file", e.getMessage());
        }
        return compiler.messages;
    }

    public static CompilerMessages execute(String... argv) {
        CompilerMain main = new CompilerMain();
        int exitCode = main.parseOptions(argv);
        if (exitCode != 0) {
            // return empty messages
            CompilerMessages result = new CompilerMessages(new HwCompiler(new CompilerOptions()));
            result.setExitCode(exitCode);
            return result;
        }
        return main.run();
    }

    public static void main(String[] argv) {
        CompilerMessages messages = execute(argv);
        messages.show(System.err);
        System.exit(messages.exitCode);
    }
}
