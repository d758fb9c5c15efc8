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
import org.lqc.util.Linq;
import org.lqc.util.Utilities;

import javax.annotation.Nullable;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/** Construction of an object followed by member initialization:
 * {@code new Dto { A = x, B = y }}. */
public final class LQMemberInitExpression extends LQExpression {
    public final LQNewExpression newExpression;
    public final List<LQMemberAssignment> bindings;

    public LQMemberInitExpression(LQNewExpression newExpression, List<LQMemberAssignment> bindings) {
        super(newExpression.getType());
        this.newExpression = newExpression;
        this.bindings = List.copyOf(bindings);
        Set<LQMember> bound = new HashSet<>();
        for (LQMemberAssignment binding: this.bindings)
            Utilities.enforce(bound.add(binding.member),
                    "Member " + binding.member + " is initialized twice");
    }

    public LQMemberInitExpression(LQNewExpression newExpression, LQMemberAssignment... bindings) {
        this(newExpression, List.of(bindings));
    }

    /** @return The single binding that satisfies the predicate, or null if there is none or more than one. */
    @Nullable
    LQMemberAssignment singleBinding(Predicate<LQMemberAssignment> predicate) {
        List<LQMemberAssignment> found = Linq.where(this.bindings, predicate);
        if (found.size() != 1)
            return null;
        return found.get(0);
    }

    /** @return The single binding of the specified member, or null. */
    @Nullable
    public LQMemberAssignment getBinding(LQMember member) {
        return this.singleBinding(b -> b.member.equals(member));
    }

    /** @return The single binding of a member with the specified name, or null. */
    @Nullable
    public LQMemberAssignment getBinding(String memberName) {
        return this.singleBinding(b -> b.member.name.equals(memberName));
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.property("newExpression");
        this.newExpression.accept(visitor);
        visitor.startArrayProperty("bindings");
        int index = 0;
        for (LQMemberAssignment binding: this.bindings) {
            visitor.propertyIndex(index++);
            binding.accept(visitor);
        }
        visitor.endArrayProperty("bindings");
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(ILQNode other) {
        LQMemberInitExpression o = other.as(LQMemberInitExpression.class);
        if (o == null)
            return false;
        return this.newExpression == o.newExpression &&
                Linq.same(this.bindings, o.bindings);
    }

    @Override
    public boolean equivalent(EquivalenceContext context, LQExpression other) {
        LQMemberInitExpression o = other.as(LQMemberInitExpression.class);
        if (o == null)
            return false;
        if (this.bindings.size() != o.bindings.size())
            return false;
        if (!context.equivalent(this.newExpression, o.newExpression))
            return false;
        for (int i = 0; i < this.bindings.size(); i++)
            if (!this.bindings.get(i).equivalent(context, o.bindings.get(i)))
                return false;
        return true;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append(this.newExpression)
                .append(" { ");
        boolean first = true;
        for (LQMemberAssignment binding: this.bindings) {
            if (!first)
                builder.append(", ");
            first = false;
            builder.append(binding);
        }
        return builder.append(" }");
    }

    @SuppressWarnings("unused")
    public static LQMemberInitExpression fromJson(JsonNode node, JsonDecoder decoder) {
        LQNewExpression newExpression = fromJsonInner(node, "newExpression", decoder, LQNewExpression.class);
        List<LQMemberAssignment> bindings = fromJsonInnerList(node, "bindings", decoder, LQMemberAssignment.class);
        return new LQMemberInitExpression(newExpression, bindings);
    }
}
