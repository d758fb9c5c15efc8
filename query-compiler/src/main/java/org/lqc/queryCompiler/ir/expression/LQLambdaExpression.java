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

package org.lqc.queryCompiler.ir.expression;

import com.fasterxml.jackson.databind.JsonNode;
import org.lqc.queryCompiler.compiler.QueryCompiler;
import org.lqc.queryCompiler.compiler.backend.JsonDecoder;
import org.lqc.queryCompiler.compiler.errors.InternalCompilerError;
import org.lqc.queryCompiler.compiler.visitors.VisitDecision;
import org.lqc.queryCompiler.compiler.visitors.inner.BetaReduction;
import org.lqc.queryCompiler.compiler.visitors.inner.EquivalenceContext;
import org.lqc.queryCompiler.compiler.visitors.inner.InnerVisitor;
import org.lqc.queryCompiler.ir.ILQNode;
import org.lqc.queryCompiler.ir.type.derived.LQTypeFunction;
import org.lqc.util.IIndentStream;
import org.lqc.util.Linq;

import javax.annotation.CheckReturnValue;
import java.util.List;

/** A function {@code (p0, p1) => body}. */
public final class LQLambdaExpression extends LQExpression {
    public final LQExpression body;
    public final List<LQParameterExpression> parameters;

    public LQLambdaExpression(LQExpression body, List<LQParameterExpression> parameters) {
        super(new LQTypeFunction(body.getType(), Linq.map(parameters, LQExpression::getType)));
        this.body = body;
        this.parameters = List.copyOf(parameters);
    }

    public LQLambdaExpression(LQExpression body, LQParameterExpression... parameters) {
        this(body, List.of(parameters));
    }

    public LQInvocationExpression call(LQExpression... arguments) {
        if (arguments.length != this.parameters.size())
            throw new InternalCompilerError("Received " + arguments.length +
                    " arguments, but need " + this.parameters.size(), this);
        return new LQInvocationExpression(this, List.of(arguments));
    }

    /** The body of this lambda with the parameters replaced by the arguments. */
    @CheckReturnValue
    public LQExpression inline(QueryCompiler compiler, LQExpression... arguments) {
        BetaReduction reduction = new BetaReduction(compiler);
        return reduction.apply(this.call(arguments)).to(LQExpression.class);
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.startArrayProperty("parameters");
        int index = 0;
        for (LQParameterExpression parameter: this.parameters) {
            visitor.propertyIndex(index++);
            parameter.accept(visitor);
        }
        visitor.endArrayProperty("parameters");
        visitor.property("body");
        this.body.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(ILQNode other) {
        LQLambdaExpression o = other.as(LQLambdaExpression.class);
        if (o == null)
            return false;
        return this.body == o.body && Linq.same(this.parameters, o.parameters);
    }

    @Override
    public boolean equivalent(EquivalenceContext context, LQExpression other) {
        LQLambdaExpression o = other.as(LQLambdaExpression.class);
        if (o == null)
            return false;
        if (this.parameters.size() != o.parameters.size())
            return false;
        EquivalenceContext newContext = context.clone();
        for (int i = 0; i < this.parameters.size(); i++) {
            LQParameterExpression left = this.parameters.get(i);
            LQParameterExpression right = o.parameters.get(i);
            if (!left.getType().sameType(right.getType()))
                return false;
            newContext.bind(left, right);
        }
        return newContext.equivalent(this.body, o.body);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("(");
        boolean first = true;
        for (LQParameterExpression parameter: this.parameters) {
            if (!first)
                builder.append(", ");
            first = false;
            builder.append(parameter);
        }
        return builder.append(") => ")
                .append(this.body);
    }

    @SuppressWarnings("unused")
    public static LQLambdaExpression fromJson(JsonNode node, JsonDecoder decoder) {
        List<LQParameterExpression> parameters = fromJsonInnerList(
                node, "parameters", decoder, LQParameterExpression.class);
        LQExpression body = fromJsonInner(node, "body", decoder, LQExpression.class);
        return new LQLambdaExpression(body, parameters);
    }
}
