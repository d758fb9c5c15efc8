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
import org.lqc.queryCompiler.ir.LQNode;
import org.lqc.util.IIndentStream;

/** A binding {@code Member = expression} inside a {@link LQMemberInitExpression}. */
public final class LQMemberAssignment extends LQNode {
    public final LQMember member;
    public final LQExpression expression;

    public LQMemberAssignment(LQMember member, LQExpression expression) {
        this.member = member;
        this.expression = expression;
    }

    public LQMemberAssignment update(LQExpression expression) {
        if (expression == this.expression)
            return this;
        return new LQMemberAssignment(this.member, expression);
    }

    public boolean equivalent(EquivalenceContext context, LQMemberAssignment other) {
        return this.member.equals(other.member) &&
                context.equivalent(this.expression, other.expression);
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.property("member");
        this.member.accept(visitor);
        visitor.property("expression");
        this.expression.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(ILQNode other) {
        LQMemberAssignment o = other.as(LQMemberAssignment.class);
        if (o == null)
            return false;
        return this.member == o.member && this.expression == o.expression;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.member.name)
                .append(" = ")
                .append(this.expression);
    }

    @SuppressWarnings("unused")
    public static LQMemberAssignment fromJson(JsonNode node, JsonDecoder decoder) {
        LQMember member = fromJsonInner(node, "member", decoder, LQMember.class);
        LQExpression expression = fromJsonInner(node, "expression", decoder, LQExpression.class);
        return new LQMemberAssignment(member, expression);
    }
}
