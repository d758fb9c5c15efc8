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
import org.lqc.queryCompiler.ir.type.LQType;
import org.lqc.queryCompiler.ir.type.primitive.LQTypeBaseType;
import org.lqc.util.IIndentStream;
import org.lqc.util.Utilities;

public final class LQBinaryExpression extends LQExpression {
    public final LQOpcode opcode;
    public final LQExpression left;
    public final LQExpression right;

    public LQBinaryExpression(LQOpcode opcode, LQExpression left, LQExpression right, LQType type) {
        super(type);
        this.opcode = opcode;
        this.left = left;
        this.right = right;
        if (opcode.isComparison)
            Utilities.enforce(type.sameType(LQTypeBaseType.BOOL),
                    "Comparison " + opcode + " must produce a boolean, not " + type);
    }

    /** Comparisons produce booleans; the other operations produce the type of the left operand. */
    public LQBinaryExpression(LQOpcode opcode, LQExpression left, LQExpression right) {
        this(opcode, left, right, opcode.isComparison ? LQTypeBaseType.BOOL : left.getType());
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.property("type");
        this.type.accept(visitor);
        visitor.property("left");
        this.left.accept(visitor);
        visitor.property("right");
        this.right.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(ILQNode other) {
        LQBinaryExpression o = other.as(LQBinaryExpression.class);
        if (o == null)
            return false;
        return this.opcode == o.opcode &&
                this.left == o.left &&
                this.right == o.right &&
                this.type == o.type;
    }

    @Override
    public boolean equivalent(EquivalenceContext context, LQExpression other) {
        LQBinaryExpression o = other.as(LQBinaryExpression.class);
        if (o == null)
            return false;
        return this.opcode == o.opcode &&
                this.type.sameType(o.type) &&
                context.equivalent(this.left, o.left) &&
                context.equivalent(this.right, o.right);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("(")
                .append(this.left)
                .append(" ")
                .append(this.opcode.toString())
                .append(" ")
                .append(this.right)
                .append(")");
    }

    @SuppressWarnings("unused")
    public static LQBinaryExpression fromJson(JsonNode node, JsonDecoder decoder) {
        LQType type = getJsonType(node, decoder);
        LQOpcode opcode = LQOpcode.valueOf(Utilities.getStringProperty(node, "opcode"));
        LQExpression left = fromJsonInner(node, "left", decoder, LQExpression.class);
        LQExpression right = fromJsonInner(node, "right", decoder, LQExpression.class);
        return new LQBinaryExpression(opcode, left, right, type);
    }
}
