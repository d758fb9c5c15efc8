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
import org.lqc.queryCompiler.ir.type.derived.LQTypeStruct;
import org.lqc.util.IIndentStream;
import org.lqc.util.Linq;
import org.lqc.util.Utilities;

import javax.annotation.Nullable;
import java.util.List;

/** Construction of an object through its constructor.
 * For anonymous types the list of members names the member
 * initialized by each positional argument. */
public final class LQNewExpression extends LQExpression {
    public final List<LQExpression> arguments;
    @Nullable
    public final List<LQMember> members;

    public LQNewExpression(LQTypeStruct type, List<LQExpression> arguments, @Nullable List<LQMember> members) {
        super(type);
        this.arguments = List.copyOf(arguments);
        this.members = members == null ? null : List.copyOf(members);
        if (this.members != null)
            Utilities.enforce(this.members.size() == this.arguments.size(),
                    "Constructor of " + type + " has " + this.arguments.size() +
                            " arguments but " + this.members.size() + " members");
    }

    /** A constructor call without arguments. */
    public LQNewExpression(LQTypeStruct type) {
        this(type, List.of(), null);
    }

    /** Anonymous object construction initializing every field of the type in order. */
    public static LQNewExpression anonymous(LQTypeStruct type, LQExpression... arguments) {
        return new LQNewExpression(type, List.of(arguments), type.members());
    }

    public LQTypeStruct getStructType() {
        return this.type.to(LQTypeStruct.class);
    }

    /** @return The index of the member with the specified name, or -1. */
    public int indexOfMember(String name) {
        if (this.members == null)
            return -1;
        for (int i = 0; i < this.members.size(); i++)
            if (this.members.get(i).name.equals(name))
                return i;
        return -1;
    }

    /** @return The index of the specified member, or -1. */
    public int indexOfMember(LQMember member) {
        if (this.members == null)
            return -1;
        return this.members.indexOf(member);
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.property("type");
        this.type.accept(visitor);
        visitor.startArrayProperty("arguments");
        int index = 0;
        for (LQExpression argument: this.arguments) {
            visitor.propertyIndex(index++);
            argument.accept(visitor);
        }
        visitor.endArrayProperty("arguments");
        if (this.members != null) {
            visitor.startArrayProperty("members");
            index = 0;
            for (LQMember member: this.members) {
                visitor.propertyIndex(index++);
                member.accept(visitor);
            }
            visitor.endArrayProperty("members");
        }
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(ILQNode other) {
        LQNewExpression o = other.as(LQNewExpression.class);
        if (o == null)
            return false;
        return this.type == o.type &&
                Linq.same(this.arguments, o.arguments) &&
                this.members == o.members;
    }

    @Override
    public boolean equivalent(EquivalenceContext context, LQExpression other) {
        LQNewExpression o = other.as(LQNewExpression.class);
        if (o == null)
            return false;
        if (this.members == null) {
            if (o.members != null)
                return false;
        } else if (!this.members.equals(o.members)) {
            return false;
        }
        return this.type.sameType(o.type) &&
                context.equivalent(this.arguments, o.arguments);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("new ").append(this.type);
        if (this.arguments.isEmpty() && this.members == null)
            return builder;
        builder.append("(");
        for (int i = 0; i < this.arguments.size(); i++) {
            if (i > 0)
                builder.append(", ");
            if (this.members != null)
                builder.append(this.members.get(i).name).append(" = ");
            builder.append(this.arguments.get(i));
        }
        return builder.append(")");
    }

    @SuppressWarnings("unused")
    public static LQNewExpression fromJson(JsonNode node, JsonDecoder decoder) {
        LQTypeStruct type = fromJsonInner(node, "type", decoder, LQTypeStruct.class);
        List<LQExpression> arguments = fromJsonInnerList(node, "arguments", decoder, LQExpression.class);
        List<LQMember> members = null;
        if (node.has("members"))
            members = fromJsonInnerList(node, "members", decoder, LQMember.class);
        return new LQNewExpression(type, arguments, members);
    }
}
