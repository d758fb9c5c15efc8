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

import java.util.Objects;

/** The type of a group produced by a GROUP BY: a key and a sequence of elements. */
public class LQTypeGrouping extends LQType {
    public final LQType keyType;
    public final LQType elementType;

    public LQTypeGrouping(LQType keyType, LQType elementType) {
        super(LQTypeCode.GROUPING, true);
        this.keyType = keyType;
        this.elementType = elementType;
    }

    @Override
    public boolean sameType(LQType other) {
        LQTypeGrouping type = other.as(LQTypeGrouping.class);
        if (type == null)
            return false;
        return this.keyType.sameType(type.keyType) &&
                this.elementType.sameType(type.elementType);
    }

    @Override
    public LQType withMayBeNull(boolean mayBeNull) {
        return this;
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), this.keyType.hashCode(), this.elementType.hashCode());
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.property("keyType");
        this.keyType.accept(visitor);
        visitor.property("elementType");
        this.elementType.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.code.shortName)
                .append("<")
                .append(this.keyType)
                .append(", ")
                .append(this.elementType)
                .append(">");
    }

    @SuppressWarnings("unused")
    public static LQTypeGrouping fromJson(JsonNode node, JsonDecoder decoder) {
        LQType keyType = fromJsonInner(node, "keyType", decoder, LQType.class);
        LQType elementType = fromJsonInner(node, "elementType", decoder, LQType.class);
        return new LQTypeGrouping(keyType, elementType);
    }
}
