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

package org.lqc.queryCompiler;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.lqc.queryCompiler.compiler.CompilerOptions;
import org.lqc.queryCompiler.compiler.QueryCompiler;
import org.lqc.queryCompiler.compiler.backend.JsonDecoder;
import org.lqc.queryCompiler.compiler.backend.ToJsonInnerVisitor;
import org.lqc.queryCompiler.compiler.errors.BaseCompilerException;
import org.lqc.queryCompiler.compiler.errors.CompilationError;
import org.lqc.queryCompiler.compiler.errors.CompilerMessages;
import org.lqc.queryCompiler.ir.LQNode;
import org.lqc.queryCompiler.ir.expression.LQExpression;
import org.lqc.util.Logger;
import org.lqc.util.Utilities;

import javax.annotation.Nullable;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

/** Main entry point of the query compiler.
 * Reads a rewrite request {@code {"tree": ..., "originals": [...], "replacements": [...]}}
 * and writes the rewritten tree. */
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
        commander.setProgramName("query-compiler");
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
            } catch (BaseCompilerException ex) {
                System.err.println(ex.getMessage());
                return 1;
            }
        }
        return 0;
    }

    PrintStream getOutputStream() throws IOException {
        String outputFile = this.options.ioOptions.outputFile;
        if (outputFile.isEmpty())
            return System.out;
        return new PrintStream(Files.newOutputStream(Paths.get(outputFile)), true, StandardCharsets.UTF_8);
    }

    InputStream getInputFile(@Nullable String inputFile) throws IOException {
        if (inputFile == null)
            return System.in;
        return Files.newInputStream(Paths.get(inputFile));
    }

    static void requireProperty(JsonNode request, String property, boolean array) {
        JsonNode value = request.get(property);
        if (value == null || value.isNull())
            throw new CompilationError("Rewrite request has no " + Utilities.singleQuote(property));
        if (array && !value.isArray())
            throw new CompilationError("Rewrite request property " + Utilities.singleQuote(property) +
                    " must be an array");
    }

    /** Run compiler, return the messages produced. */
    CompilerMessages run() {
        QueryCompiler compiler = new QueryCompiler(this.options);
        if (!this.options.validate(compiler))
            return compiler.messages;
        if (this.options.ioOptions.verbosity >= 1)
            System.out.println(this.options);

        JsonNode request;
        try (InputStream input = this.getInputFile(this.options.ioOptions.inputFile)) {
            ObjectMapper mapper = Utilities.deterministicObjectMapper();
            request = mapper.readTree(input);
        } catch (JsonProcessingException e) {
            compiler.reportError("Error parsing input", e.getOriginalMessage());
            return compiler.messages;
        } catch (IOException e) {
            compiler.reportError("Error reading file",
                    Utilities.singleQuote(this.options.ioOptions.inputFile) + " " + e.getMessage());
            return compiler.messages;
        }

        LQExpression tree;
        List<LQExpression> originals;
        List<LQExpression> replacements;
        try {
            if (request == null || !request.isObject())
                throw new CompilationError(
                        "Rewrite request must be a JSON object");
            requireProperty(request, "tree", false);
            requireProperty(request, "originals", true);
            requireProperty(request, "replacements", true);
            JsonDecoder decoder = new JsonDecoder();
            tree = LQNode.fromJsonInner(request, "tree", decoder, LQExpression.class);
            originals = LQNode.fromJsonInnerList(request, "originals", decoder, LQExpression.class);
            replacements = LQNode.fromJsonInnerList(request, "replacements", decoder, LQExpression.class);
        } catch (BaseCompilerException ex) {
            if (this.options.languageOptions.throwOnError)
                throw ex;
            compiler.messages.reportError(ex);
            return compiler.messages;
        }
        if (originals.size() != replacements.size()) {
            compiler.reportError("Invalid input", "Request has " + originals.size() +
                    " originals but " + replacements.size() + " replacements");
            return compiler.messages;
        }

        if (originals.isEmpty())
            compiler.reportWarning("Empty request", "No expressions to replace");

        LQExpression result = compiler.rewrite(tree, originals, replacements);
        if (result == null || compiler.hasErrors())
            return compiler.messages;

        try {
            PrintStream stream = this.getOutputStream();
            if (this.options.ioOptions.emitJson)
                stream.println(ToJsonInnerVisitor.toJsonString(compiler, result, this.options.ioOptions.verbosity));
            else
                stream.println(result);
            if (stream != System.out)
                stream.close();
        } catch (IOException e) {
            compiler.reportError("Error writing to output file", e.getMessage());
        }
        return compiler.messages;
    }

    public static CompilerMessages execute(String... argv) {
        CompilerMain main = new CompilerMain();
        int exitCode = main.parseOptions(argv);
        if (exitCode != 0) {
            // return empty messages
            CompilerMessages result = new CompilerMessages(new QueryCompiler(new CompilerOptions()));
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
