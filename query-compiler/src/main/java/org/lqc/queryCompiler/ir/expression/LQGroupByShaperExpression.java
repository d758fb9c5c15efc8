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
import org.lqc.queryCompiler.ir.type.derived.LQTypeGrouping;
import org.lqc.util.IIndentStream;

/** Stands for one group of a GROUP BY: the computation of its key,
 * and the shape of its elements. */
public final class LQGroupByShaperExpression extends LQExpression {
    /** Name of the member that reads the key of a group. */
    public static final String KEY = "Key";

    public final LQExpression keySelector;
    public final LQExpression elementSelector;

    public LQGroupByShaperExpression(LQExpression keySelector, LQExpression elementSelector) {
        super(new LQTypeGrouping(keySelector.getType(), elementSelector.getType()));
        this.keySelector = keySelector;
        this.elementSelector = elementSelector;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.property("keySelector");
        this.keySelector.accept(visitor);
        visitor.property("elementSelector");
        this.elementSelector.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(ILQNode other) {
        LQGroupByShaperExpression o = other.as(LQGroupByShaperExpression.class);
        if (o == null)
            return false;
        return this.keySelector == o.keySelector && this.elementSelector == o.elementSelector;
    }

    @Override
    public boolean equivalent(EquivalenceContext context, LQExpression other) {
        LQGroupByShaperExpression o = other.as(LQGroupByShaperExpression.class);
        if (o == null)
            return false;
        return context.equivalent(this.keySelector, o.keySelector) &&
                context.equivalent(this.elementSelector, o.elementSelector);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("GroupByShaper(key: ")
                .append(this.keySelector)
                .append(", element: ")
                .append(this.elementSelector)
                .append(")");
    }

    @SuppressWarnings("unused")
    public static LQGroupByShaperExpression fromJson(JsonNode node, JsonDecoder decoder) {
        LQExpression keySelector = fromJsonInner(node, "keySelector", decoder, LQExpression.class);
        LQExpression elementSelector = fromJsonInner(node, "elementSelector", decoder, LQExpression.class);
        return new LQGroupByShaperExpression(keySelector, elementSelector);
    }
}
