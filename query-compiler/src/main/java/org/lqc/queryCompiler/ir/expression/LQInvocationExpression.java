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
import org.lqc.queryCompiler.compiler.backend.JsonDecoder;
import org.lqc.queryCompiler.compiler.visitors.VisitDecision;
import org.lqc.queryCompiler.compiler.visitors.inner.EquivalenceContext;
import org.lqc.queryCompiler.compiler.visitors.inner.InnerVisitor;
import org.lqc.queryCompiler.ir.ILQNode;
import org.lqc.queryCompiler.ir.type.derived.LQTypeFunction;
import org.lqc.util.IIndentStream;
import org.lqc.util.Linq;
import org.lqc.util.Utilities;

import java.util.List;

/** Application of a function-valued expression to arguments. */
public final class LQInvocationExpression extends LQExpression {
    public final LQExpression function;
    public final List<LQExpression> arguments;

    public LQInvocationExpression(LQExpression function, List<LQExpression> arguments) {
        super(function.getType().to(LQTypeFunction.class,
                "Invoking an expression that is not a function: " + function).resultType);
        this.function = function;
        this.arguments = List.copyOf(arguments);
        LQTypeFunction type = function.getType().to(LQTypeFunction.class);
        Utilities.enforce(type.parameterTypes.size() == this.arguments.size(),
                "Function with " + type.parameterTypes.size() + " parameters invoked with " +
                        this.arguments.size() + " arguments");
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.property("function");
        this.function.accept(visitor);
        visitor.startArrayProperty("arguments");
        int index = 0;
        for (LQExpression argument: this.arguments) {
            visitor.propertyIndex(index++);
            argument.accept(visitor);
        }
        visitor.endArrayProperty("arguments");
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(ILQNode other) {
        LQInvocationExpression o = other.as(LQInvocationExpression.class);
        if (o == null)
            return false;
        return this.function == o.function && Linq.same(this.arguments, o.arguments);
    }

    @Override
    public boolean equivalent(EquivalenceContext context, LQExpression other) {
        LQInvocationExpression o = other.as(LQInvocationExpression.class);
        if (o == null)
            return false;
        return context.equivalent(this.function, o.function) &&
                context.equivalent(this.arguments, o.arguments);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("Invoke(")
                .append(this.function);
        for (LQExpression argument: this.arguments)
            builder.append(", ").append(argument);
        return builder.append(")");
    }

    @SuppressWarnings("unused")
    public static LQInvocationExpression fromJson(JsonNode node, JsonDecoder decoder) {
        LQExpression function = fromJsonInner(node, "function", decoder, LQExpression.class);
        List<LQExpression> arguments = fromJsonInnerList(node, "arguments", decoder, LQExpression.class);
        return new LQInvocationExpression(function, arguments);
    }
}
