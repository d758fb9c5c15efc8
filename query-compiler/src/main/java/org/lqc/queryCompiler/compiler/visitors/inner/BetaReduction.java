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

package org.lqc.queryCompiler.compiler.visitors.inner;

import org.lqc.queryCompiler.compiler.QueryCompiler;
import org.lqc.queryCompiler.compiler.visitors.VisitDecision;
import org.lqc.queryCompiler.ir.expression.LQExpression;
import org.lqc.queryCompiler.ir.expression.LQInvocationExpression;
import org.lqc.queryCompiler.ir.expression.LQLambdaExpression;

import java.util.List;

/** Replaces every invocation of a lambda expression with the lambda body,
 * where the parameters are replaced by the arguments.
 * Parameter names are assumed to be unique within a tree. */
public class BetaReduction extends InnerRewriteVisitor {
    public BetaReduction(QueryCompiler compiler) {
        super(compiler);
    }

    @Override
    public VisitDecision preorder(LQInvocationExpression expression) {
        this.push(expression);
        LQExpression function = this.transform(expression.function);
        List<LQExpression> arguments = this.transform(expression.arguments);
        this.pop(expression);

        LQLambdaExpression lambda = function.as(LQLambdaExpression.class);
        if (lambda == null) {
            this.map(expression, new LQInvocationExpression(function, arguments));
            return VisitDecision.STOP;
        }

        ReplacingExpressionVisitor replace = new ReplacingExpressionVisitor(
                this.compiler, lambda.parameters, arguments);
        LQExpression body = replace.apply(lambda.body).to(LQExpression.class);
        // The arguments may have been lambdas which are now invoked in the body.
        LQExpression result = this.transform(body);
        this.map(expression, result);
        return VisitDecision.STOP;
    }
}
