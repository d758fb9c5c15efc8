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
import org.lqc.queryCompiler.ir.LQMember;
import org.lqc.util.IIndentStream;

/** Reads a member of the value produced by an expression. */
public final class LQMemberExpression extends LQExpression {
    public final LQExpression expression;
    public final LQMember member;

    public LQMemberExpression(LQExpression expression, LQMember member) {
        super(member.type);
        this.expression = expression;
        this.member = member;
    }

    /** The same member read from a different expression.
     * @return this if the expression is unchanged. */
    public LQMemberExpression update(LQExpression expression) {
        if (expression == this.expression)
            return this;
        return new LQMemberExpression(expression, this.member);
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.property("expression");
        this.expression.accept(visitor);
        visitor.property("member");
        this.member.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(ILQNode other) {
        LQMemberExpression o = other.as(LQMemberExpression.class);
        if (o == null)
            return false;
        return this.expression == o.expression && this.member == o.member;
    }

    @Override
    public boolean equivalent(EquivalenceContext context, LQExpression other) {
        LQMemberExpression o = other.as(LQMemberExpression.class);
        if (o == null)
            return false;
        return this.member.equals(o.member) &&
                context.equivalent(this.expression, o.expression);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.expression)
                .append(".")
                .append(this.member.name);
    }

    @SuppressWarnings("unused")
    public static LQMemberExpression fromJson(JsonNode node, JsonDecoder decoder) {
        LQExpression expression = fromJsonInner(node, "expression", decoder, LQExpression.class);
        LQMember member = fromJsonInner(node, "member", decoder, LQMember.class);
        return new LQMemberExpression(expression, member);
    }
}
