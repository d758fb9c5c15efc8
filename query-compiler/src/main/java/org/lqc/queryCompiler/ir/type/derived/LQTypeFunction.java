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

package org.lqc.queryCompiler.ir.type.derived;

import com.fasterxml.jackson.databind.JsonNode;
import org.lqc.queryCompiler.compiler.backend.JsonDecoder;
import org.lqc.queryCompiler.compiler.visitors.VisitDecision;
import org.lqc.queryCompiler.compiler.visitors.inner.InnerVisitor;
import org.lqc.queryCompiler.ir.type.LQType;
import org.lqc.queryCompiler.ir.type.LQTypeCode;
import org.lqc.util.IIndentStream;

import java.util.List;
import java.util.Objects;

/** The type of a lambda expression. */
public class LQTypeFunction extends LQType {
    public final LQType resultType;
    public final List<LQType> parameterTypes;

    public LQTypeFunction(LQType resultType, List<LQType> parameterTypes) {
        super(LQTypeCode.FUNCTION, true);
        this.resultType = resultType;
        this.parameterTypes = List.copyOf(parameterTypes);
    }

    @Override
    public boolean sameType(LQType other) {
        LQTypeFunction type = other.as(LQTypeFunction.class);
        if (type == null)
            return false;
        return this.resultType.sameType(type.resultType) &&
                LQType.sameTypes(this.parameterTypes, type.parameterTypes);
    }

    @Override
    public LQType withMayBeNull(boolean mayBeNull) {
        return this;
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), this.resultType.hashCode(), this.parameterTypes.size());
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.property("resultType");
        this.resultType.accept(visitor);
        visitor.startArrayProperty("parameterTypes");
        int index = 0;
        for (LQType type: this.parameterTypes) {
            visitor.propertyIndex(index++);
            type.accept(visitor);
        }
        visitor.endArrayProperty("parameterTypes");
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append(this.code.shortName).append("<");
        for (LQType type: this.parameterTypes)
            builder.append(type).append(", ");
        return builder.append(this.resultType).append(">");
    }

    @SuppressWarnings("unused")
    public static LQTypeFunction fromJson(JsonNode node, JsonDecoder decoder) {
        LQType resultType = fromJsonInner(node, "resultType", decoder, LQType.class);
        List<LQType> parameterTypes = fromJsonInnerList(node, "parameterTypes", decoder, LQType.class);
        return new LQTypeFunction(resultType, parameterTypes);
    }
}
