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
import org.lqc.util.IIndentStream;
import org.lqc.util.Utilities;

/** A named placeholder, such as the parameter of a lambda or the input of a query. */
public final class LQParameterExpression extends LQExpression {
    public final String name;

    public LQParameterExpression(String name, LQType type) {
        super(type);
        Utilities.enforce(!name.isEmpty(), "Empty parameter name");
        this.name = name;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.property("type");
        this.type.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(ILQNode other) {
        LQParameterExpression o = other.as(LQParameterExpression.class);
        if (o == null)
            return false;
        return this.name.equals(o.name) && this.type == o.type;
    }

    @Override
    public boolean equivalent(EquivalenceContext context, LQExpression other) {
        LQParameterExpression o = other.as(LQParameterExpression.class);
        if (o == null)
            return false;
        return context.equivalentParameters(this, o);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.name);
    }

    @SuppressWarnings("unused")
    public static LQParameterExpression fromJson(JsonNode node, JsonDecoder decoder) {
        LQType type = getJsonType(node, decoder);
        String name = Utilities.getStringProperty(node, "name");
        return new LQParameterExpression(name, type);
    }
}
