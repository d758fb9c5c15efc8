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
import org.lqc.queryCompiler.compiler.errors.InternalCompilerError;
import org.lqc.queryCompiler.compiler.visitors.VisitDecision;
import org.lqc.queryCompiler.compiler.visitors.inner.EquivalenceContext;
import org.lqc.queryCompiler.compiler.visitors.inner.InnerVisitor;
import org.lqc.queryCompiler.ir.ILQNode;
import org.lqc.queryCompiler.ir.type.LQType;
import org.lqc.util.IIndentStream;

/** The expression {@code test ? ifTrue : ifFalse}. */
public final class LQConditionalExpression extends LQExpression {
    public final LQExpression test;
    public final LQExpression ifTrue;
    public final LQExpression ifFalse;

    public LQConditionalExpression(LQExpression test, LQExpression ifTrue, LQExpression ifFalse, LQType type) {
        super(type);
        this.test = test;
        this.ifTrue = ifTrue;
        this.ifFalse = ifFalse;
        if (!test.isBoolean())
            throw new InternalCompilerError("Expected a non-nullable boolean test, got " + test.getType(), this);
        this.checkBranch(ifTrue);
        this.checkBranch(ifFalse);
    }

    /** A conditional whose type is the type of the branch that is not a null constant. */
    public LQConditionalExpression(LQExpression test, LQExpression ifTrue, LQExpression ifFalse) {
        this(test, ifTrue, ifFalse, ifTrue.isNullConstant() ? ifFalse.getType() : ifTrue.getType());
    }

    void checkBranch(LQExpression branch) {
        if (branch.getType().sameType(this.type))
            return;
        if (branch.isNullConstant() && this.type.mayBeNull)
            return;
        throw new InternalCompilerError("Mismatched types in conditional expression: branch " +
                branch + " has type " + branch.getType() + " instead of " + this.type, this);
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.property("type");
        this.type.accept(visitor);
        visitor.property("test");
        this.test.accept(visitor);
        visitor.property("ifTrue");
        this.ifTrue.accept(visitor);
        visitor.property("ifFalse");
        this.ifFalse.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(ILQNode other) {
        LQConditionalExpression o = other.as(LQConditionalExpression.class);
        if (o == null)
            return false;
        return this.test == o.test &&
                this.ifTrue == o.ifTrue &&
                this.ifFalse == o.ifFalse &&
                this.type == o.type;
    }

    @Override
    public boolean equivalent(EquivalenceContext context, LQExpression other) {
        LQConditionalExpression o = other.as(LQConditionalExpression.class);
        if (o == null)
            return false;
        return this.type.sameType(o.type) &&
                context.equivalent(this.test, o.test) &&
                context.equivalent(this.ifTrue, o.ifTrue) &&
                context.equivalent(this.ifFalse, o.ifFalse);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("(")
                .append(this.test)
                .append(" ? ")
                .append(this.ifTrue)
                .append(" : ")
                .append(this.ifFalse)
                .append(")");
    }

    @SuppressWarnings("unused")
    public static LQConditionalExpression fromJson(JsonNode node, JsonDecoder decoder) {
        LQType type = getJsonType(node, decoder);
        LQExpression test = fromJsonInner(node, "test", decoder, LQExpression.class);
        LQExpression ifTrue = fromJsonInner(node, "ifTrue", decoder, LQExpression.class);
        LQExpression ifFalse = fromJsonInner(node, "ifFalse", decoder, LQExpression.class);
        return new LQConditionalExpression(test, ifTrue, ifFalse, type);
    }
}
