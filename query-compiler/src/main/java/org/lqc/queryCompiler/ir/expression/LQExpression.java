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
import org.lqc.queryCompiler.compiler.visitors.inner.EquivalenceContext;
import org.lqc.queryCompiler.ir.LQMember;
import org.lqc.queryCompiler.ir.LQNode;
import org.lqc.queryCompiler.ir.type.LQType;
import org.lqc.queryCompiler.ir.type.primitive.LQTypeBaseType;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nullable;

/** Base class for all expressions. */
public abstract class LQExpression extends LQNode {
    public final LQType type;

    protected LQExpression(LQType type) {
        this.type = type;
    }

    public LQType getType() {
        return this.type;
    }

    /** Check expressions for equivalence in a specified context.
     * @param context Maps the parameters of enclosing lambdas.
     * @param other   Expression to compare against.
     * @return True if this expression is equivalent with 'other' in the specified context. */
    public abstract boolean equivalent(EquivalenceContext context, LQExpression other);

    /** Check expressions for structural equivalence. */
    public boolean equivalent(LQExpression other) {
        return EquivalenceContext.equiv(this, other);
    }

    /** True if this is a constant with a null value, possibly wrapped in conversions. */
    public boolean isNullConstant() {
        LQConstantExpression constant = this.unwrapTypeConversion().expression()
                .as(LQConstantExpression.class);
        return constant != null && constant.isNull();
    }

    /** Result of {@link #unwrapTypeConversion()}. */
    public record UnwrappedConversion(LQExpression expression, @Nullable LQType convertedType) {}

    /** Strip all the conversions wrapped around this expression.
     * @return The innermost expression, and the type of the outermost conversion,
     *         which is null if this expression is not a conversion. */
    public UnwrappedConversion unwrapTypeConversion() {
        LQType convertedType = null;
        LQExpression expression = this;
        while (expression.is(LQConvertExpression.class)) {
            LQConvertExpression convert = expression.to(LQConvertExpression.class);
            if (convertedType == null)
                convertedType = convert.type;
            expression = convert.source;
        }
        return new UnwrappedConversion(expression, convertedType);
    }

    /** A conversion of this expression to the specified type.
     * The conversion is created even if the types are the same. */
    @CheckReturnValue
    public LQConvertExpression convert(LQType to) {
        return new LQConvertExpression(this, to);
    }

    /** Read a member of the value of this expression. */
    @CheckReturnValue
    public LQMemberExpression member(LQMember member) {
        return new LQMemberExpression(this, member);
    }

    @CheckReturnValue
    public LQBinaryExpression binary(LQOpcode opcode, LQExpression right) {
        return new LQBinaryExpression(opcode, this, right);
    }

    public boolean isBoolean() {
        return this.type.is(LQTypeBaseType.class) &&
                this.type.sameType(LQTypeBaseType.BOOL);
    }

    public static LQType getJsonType(JsonNode node, JsonDecoder decoder) {
        return fromJsonInner(node, "type", decoder, LQType.class);
    }
}
