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
import org.lqc.queryCompiler.compiler.errors.CompilationError;
import org.lqc.queryCompiler.compiler.errors.InternalCompilerError;
import org.lqc.queryCompiler.compiler.visitors.VisitDecision;
import org.lqc.queryCompiler.compiler.visitors.inner.EquivalenceContext;
import org.lqc.queryCompiler.compiler.visitors.inner.InnerVisitor;
import org.lqc.queryCompiler.ir.ILQNode;
import org.lqc.queryCompiler.ir.type.LQType;
import org.lqc.queryCompiler.ir.type.LQTypeCode;
import org.lqc.queryCompiler.ir.type.primitive.LQTypeBaseType;
import org.lqc.util.IIndentStream;
import org.lqc.util.Utilities;

import javax.annotation.Nullable;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.Objects;

/** A literal value of a given type; the value may be null. */
public final class LQConstantExpression extends LQExpression {
    @Nullable
    public final Object value;

    public LQConstantExpression(LQType type, @Nullable Object value) {
        super(type);
        this.value = value;
        if (value == null) {
            Utilities.enforce(type.mayBeNull, "Null constant with non-nullable type " + type);
        } else {
            Utilities.enforce(type.is(LQTypeBaseType.class),
                    "Constant of type " + type + " must be null");
            Class<?> expected = javaClass(type.code);
            if (!expected.isInstance(value))
                throw new InternalCompilerError("Constant of type " + type + " has a value of class "
                        + value.getClass().getSimpleName());
        }
    }

    public LQConstantExpression(boolean value) {
        this(LQTypeBaseType.BOOL, value);
    }

    public LQConstantExpression(int value) {
        this(LQTypeBaseType.INT32, value);
    }

    public LQConstantExpression(long value) {
        this(LQTypeBaseType.INT64, value);
    }

    public LQConstantExpression(String value) {
        this(LQTypeBaseType.STRING, value);
    }

    /** The null value of the specified type. */
    public static LQConstantExpression nullOf(LQType type) {
        return new LQConstantExpression(type, null);
    }

    static Class<?> javaClass(LQTypeCode code) {
        switch (code) {
            case BOOL:
                return Boolean.class;
            case INT32:
                return Integer.class;
            case INT64:
                return Long.class;
            case DOUBLE:
                return Double.class;
            case DECIMAL:
                return BigDecimal.class;
            case DATE:
                return LocalDate.class;
            case TIMESTAMP:
                return LocalDateTime.class;
            case STRING:
                return String.class;
            default:
                throw new InternalCompilerError("No constants of kind " + code);
        }
    }

    public boolean isNull() {
        return this.value == null;
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
        LQConstantExpression o = other.as(LQConstantExpression.class);
        if (o == null)
            return false;
        return this.type == o.type && Objects.equals(this.value, o.value);
    }

    @Override
    public boolean equivalent(EquivalenceContext context, LQExpression other) {
        LQConstantExpression o = other.as(LQConstantExpression.class);
        if (o == null)
            return false;
        return this.type.sameType(o.type) && Objects.equals(this.value, o.value);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        if (this.value == null)
            return builder.append("null");
        if (this.value instanceof String)
            return builder.append(Utilities.doubleQuote((String) this.value));
        return builder.append(this.value.toString());
    }

    /** The value as a string that {@link #fromJson} can parse back. */
    @Nullable
    public String valueAsString() {
        return this.value == null ? null : this.value.toString();
    }

    static Object parseValue(LQTypeCode code, String text) {
        try {
            switch (code) {
                case BOOL:
                    return Boolean.parseBoolean(text);
                case INT32:
                    return Integer.parseInt(text);
                case INT64:
                    return Long.parseLong(text);
                case DOUBLE:
                    return Double.parseDouble(text);
                case DECIMAL:
                    return new BigDecimal(text);
                case DATE:
                    return LocalDate.parse(text);
                case TIMESTAMP:
                    return LocalDateTime.parse(text);
                case STRING:
                    return text;
                default:
                    throw new CompilationError("No constants of kind " + code);
            }
        } catch (NumberFormatException | DateTimeParseException ex) {
            throw new CompilationError("Cannot parse " + Utilities.singleQuote(text) + " as " + code, ex);
        }
    }

    @SuppressWarnings("unused")
    public static LQConstantExpression fromJson(JsonNode node, JsonDecoder decoder) {
        LQType type = getJsonType(node, decoder);
        Object value = null;
        if (node.has("value"))
            value = parseValue(type.code, Utilities.getStringProperty(node, "value"));
        return new LQConstantExpression(type, value);
    }
}
