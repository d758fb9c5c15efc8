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

import org.lqc.queryCompiler.compiler.errors.BaseCompilerException;
import org.lqc.queryCompiler.compiler.errors.CompilerMessages;
import org.lqc.queryCompiler.compiler.visitors.inner.BetaReduction;
import org.lqc.queryCompiler.compiler.visitors.inner.ReplacingExpressionVisitor;
import org.lqc.queryCompiler.ir.expression.LQExpression;
import org.lqc.util.IWritesLogs;
import org.lqc.util.Logger;

import javax.annotation.Nullable;
import java.util.List;

/** Holds the options and the messages of one compilation,
 * and runs the rewrites requested. */
public class QueryCompiler implements IWritesLogs, IErrorReporter {
    public final CompilerOptions options;
    public final CompilerMessages messages;

    public QueryCompiler(CompilerOptions options) {
        this.options = options;
        this.messages = new CompilerMessages(this);
    }

    public QueryCompiler() {
        this(CompilerOptions.getDefault());
    }

    @Override
    public void reportProblem(boolean warning, String errorType, String message) {
        this.messages.reportProblem(warning, errorType, message);
    }

    @Override
    public boolean hasErrors() {
        return this.messages.exitCode != 0;
    }

    /** Replace every original by the corresponding replacement in the tree,
     * after inlining lambda invocations if the options request it.
     * @return The rewritten tree, or null if an error was reported. */
    @Nullable
    public LQExpression rewrite(LQExpression tree,
                                List<LQExpression> originals,
                                List<LQExpression> replacements) {
        try {
            LQExpression result = tree;
            if (this.options.languageOptions.inlineLambdas) {
                BetaReduction reduction = new BetaReduction(this);
                result = reduction.apply(result).to(LQExpression.class);
            }
            ReplacingExpressionVisitor visitor = new ReplacingExpressionVisitor(this, originals, replacements);
            LQExpression rewritten = visitor.visit(result);
            Logger.INSTANCE.belowLevel(this, 1)
                    .append("Rewrote ")
                    .appendSupplier(tree::toString)
                    .newline()
                    .append("into ")
                    .appendSupplier(() -> String.valueOf(rewritten))
                    .newline();
            return rewritten;
        } catch (BaseCompilerException ex) {
            if (this.options.languageOptions.throwOnError)
                throw ex;
            this.messages.reportError(ex);
            return null;
        }
    }
}
