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

package org.lqc.queryCompiler.compiler;

import com.beust.jcommander.DynamicParameter;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;
import org.lqc.util.Utilities;

import javax.annotation.Nullable;
import java.util.HashMap;
import java.util.Map;

/** Command-line options for the query compiler. */
@SuppressWarnings("CanBeFinal")
// These fields cannot be final, since JCommander writes them through reflection.
public class CompilerOptions {
    /** Options controlling the rewrites performed. */
    @SuppressWarnings("CanBeFinal")
    public static class Language {
        @Parameter(names = "--noConditionalMemberPushdown",
                description = "Do not push member accesses into the non-null branch of a conditional")
        public boolean noConditionalMemberPushdown = false;
        @Parameter(names = "--inline",
                description = "Inline invocations of lambda expressions before replacing")
        public boolean inlineLambdas = false;
        /** Useful for development: rethrow exceptions instead of reporting them. */
        public boolean throwOnError = false;

        @Override
        public String toString() {
            return "Language{" +
                    "\n\tnoConditionalMemberPushdown=" + this.noConditionalMemberPushdown +
                    ",\n\tinlineLambdas=" + this.inlineLambdas +
                    ",\n\tthrowOnError=" + this.throwOnError +
                    '}';
        }
    }

    /** Options related to input and output. */
    @SuppressWarnings("CanBeFinal")
    public static class IO {
        @DynamicParameter(names = "-T",
                description = "Specify logging level for a class (can be repeated)")
        public Map<String, String> loggingLevel = new HashMap<>();
        @Parameter(names = "-o", description = "Output file; stdout if not specified")
        public String outputFile = "";
        @Parameter(names = "--json", description = "Emit the rewritten tree as JSON instead of text")
        public boolean emitJson = false;
        @Parameter(names = {"--je", "-je"}, description = "Emit error messages as a JSON array")
        public boolean emitJsonErrors = false;
        @Parameter(names = "-q", description = "Quiet: do not print warnings")
        public boolean quiet = false;
        @Parameter(names = "-v", description = "Output verbosity")
        public int verbosity = 0;
        @Parameter(description = "Input file containing a JSON rewrite request; stdin if not specified")
        @Nullable
        public String inputFile = null;

        @Override
        public String toString() {
            return "IO{" +
                    "\n\toutputFile=" + Utilities.singleQuote(this.outputFile) +
                    ",\n\temitJson=" + this.emitJson +
                    ",\n\temitJsonErrors=" + this.emitJsonErrors +
                    ",\n\tquiet=" + this.quiet +
                    ",\n\tverbosity=" + this.verbosity +
                    ",\n\tinputFile=" + Utilities.singleQuote(this.inputFile) +
                    '}';
        }
    }

    @Parameter(names = {"-h", "--help", "-?"}, help = true, description = "Show this message and exit")
    public boolean help;
    @ParametersDelegate
    public IO ioOptions = new IO();
    @ParametersDelegate
    public Language languageOptions = new Language();

    public CompilerOptions() {}

    public static CompilerOptions getDefault() {
        return new CompilerOptions();
    }

    /** Check option combinations that JCommander cannot check.
     * @return false if an error was reported. */
    public boolean validate(IErrorReporter reporter) {
        if (this.ioOptions.verbosity < 0) {
            reporter.reportError("Invalid options", "Verbosity cannot be negative");
            return false;
        }
        return true;
    }

    @Override
    public String toString() {
        return "CompilerOptions{" +
                "\nhelp=" + this.help +
                ",\nioOptions=" + this.ioOptions +
                ",\nlanguageOptions=" + this.languageOptions +
                "\n}";
    }
}
