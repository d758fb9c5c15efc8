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
import org.lqc.queryCompiler.ir.LQMethod;
import org.lqc.queryCompiler.ir.type.LQType;
import org.lqc.queryCompiler.ir.type.primitive.LQTypeBaseType;
import org.lqc.util.IIndentStream;
import org.lqc.util.Linq;

import javax.annotation.Nullable;
import java.util.List;

/** Call of a static method (no instance) or of an instance method. */
public final class LQMethodCallExpression extends LQExpression {
    @Nullable
    public final LQExpression instance;
    public final LQMethod method;
    public final List<LQExpression> arguments;

    public LQMethodCallExpression(@Nullable LQExpression instance, LQMethod method,
                                  List<LQExpression> arguments, LQType type) {
        super(type);
        this.instance = instance;
        this.method = method;
        this.arguments = List.copyOf(arguments);
    }

    /** The accessor call {@code EF.Property(entity, "propertyName")} producing a value of the specified type. */
    public static LQMethodCallExpression property(LQExpression entity, String propertyName, LQType type) {
        return new LQMethodCallExpression(null, LQMethod.PROPERTY,
                List.of(entity, new LQConstantExpression(propertyName)), type);
    }

    /** Arguments of an accessor call. */
    public record PropertyArguments(LQExpression entity, String propertyName) {}

    /** @return The entity and the property name if this is an accessor call
     * with a literal property name, null otherwise. */
    @Nullable
    public PropertyArguments tryGetPropertyArguments() {
        if (this.instance != null ||
                !this.method.equals(LQMethod.PROPERTY) ||
                this.arguments.size() != 2)
            return null;
        LQConstantExpression name = this.arguments.get(1).as(LQConstantExpression.class);
        if (name == null ||
                name.value == null ||
                !name.getType().sameType(LQTypeBaseType.STRING))
            return null;
        return new PropertyArguments(this.arguments.get(0), (String) name.value);
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.property("type");
        this.type.accept(visitor);
        if (this.instance != null) {
            visitor.property("instance");
            this.instance.accept(visitor);
        }
        visitor.property("method");
        this.method.accept(visitor);
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
        LQMethodCallExpression o = other.as(LQMethodCallExpression.class);
        if (o == null)
            return false;
        return this.instance == o.instance &&
                this.method == o.method &&
                Linq.same(this.arguments, o.arguments) &&
                this.type == o.type;
    }

    @Override
    public boolean equivalent(EquivalenceContext context, LQExpression other) {
        LQMethodCallExpression o = other.as(LQMethodCallExpression.class);
        if (o == null)
            return false;
        return this.method.equals(o.method) &&
                this.type.sameType(o.type) &&
                context.equivalent(this.instance, o.instance) &&
                context.equivalent(this.arguments, o.arguments);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        if (this.instance != null)
            builder.append(this.instance).append(".").append(this.method.name);
        else
            builder.append(this.method);
        builder.append("(");
        boolean first = true;
        for (LQExpression argument: this.arguments) {
            if (!first)
                builder.append(", ");
            first = false;
            builder.append(argument);
        }
        return builder.append(")");
    }

    @SuppressWarnings("unused")
    public static LQMethodCallExpression fromJson(JsonNode node, JsonDecoder decoder) {
        LQType type = getJsonType(node, decoder);
        LQExpression instance = null;
        if (node.has("instance"))
            instance = fromJsonInner(node, "instance", decoder, LQExpression.class);
        LQMethod method = fromJsonInner(node, "method", decoder, LQMethod.class);
        List<LQExpression> arguments = fromJsonInnerList(node, "arguments", decoder, LQExpression.class);
        return new LQMethodCallExpression(instance, method, arguments, type);
    }
}
