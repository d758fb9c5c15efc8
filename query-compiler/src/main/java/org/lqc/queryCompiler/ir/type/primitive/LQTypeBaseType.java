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

package org.lqc.queryCompiler.ir.type.primitive;

import com.fasterxml.jackson.databind.JsonNode;
import org.lqc.queryCompiler.compiler.backend.JsonDecoder;
import org.lqc.queryCompiler.compiler.visitors.VisitDecision;
import org.lqc.queryCompiler.compiler.visitors.inner.InnerVisitor;
import org.lqc.queryCompiler.ir.type.LQType;
import org.lqc.queryCompiler.ir.type.LQTypeCode;
import org.lqc.util.IIndentStream;
import org.lqc.util.Utilities;

import java.util.EnumMap;
import java.util.Map;

/** Scalar types: the value kinds and strings. */
public class LQTypeBaseType extends LQType {
    static final Map<LQTypeCode, LQTypeBaseType> INSTANCES = new EnumMap<>(LQTypeCode.class);
    static final Map<LQTypeCode, LQTypeBaseType> NULLABLE_INSTANCES = new EnumMap<>(LQTypeCode.class);

    LQTypeBaseType(LQTypeCode code, boolean mayBeNull) {
        super(code, mayBeNull);
        Utilities.enforce(code.isValueKind || code == LQTypeCode.STRING,
                "Not a base type " + code);
    }

    public static LQTypeBaseType create(LQTypeCode code, boolean mayBeNull) {
        Map<LQTypeCode, LQTypeBaseType> map = mayBeNull || !code.isValueKind
                ? NULLABLE_INSTANCES : INSTANCES;
        return map.computeIfAbsent(code, c -> new LQTypeBaseType(c, mayBeNull));
    }

    public static final LQTypeBaseType BOOL = create(LQTypeCode.BOOL, false);
    public static final LQTypeBaseType INT32 = create(LQTypeCode.INT32, false);
    public static final LQTypeBaseType INT64 = create(LQTypeCode.INT64, false);
    public static final LQTypeBaseType DOUBLE = create(LQTypeCode.DOUBLE, false);
    public static final LQTypeBaseType STRING = create(LQTypeCode.STRING, true);

    public String shortName() {
        return this.code.shortName;
    }

    @Override
    public boolean sameType(LQType other) {
        if (!this.sameNullability(other))
            return false;
        return other.is(LQTypeBaseType.class) && this.code == other.code;
    }

    @Override
    public LQTypeBaseType withMayBeNull(boolean mayBeNull) {
        if (this.mayBeNull == mayBeNull || !this.code.isValueKind)
            return this;
        return create(this.code, mayBeNull);
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.shortName())
                .append(this.mayBeNull && this.code.isValueKind ? "?" : "");
    }

    @SuppressWarnings("unused")
    public static LQTypeBaseType fromJson(JsonNode node, JsonDecoder decoder) {
        boolean mayBeNull = LQType.fromJsonMayBeNull(node);
        LQTypeCode code = LQTypeCode.valueOf(Utilities.getStringProperty(node, "code"));
        return create(code, mayBeNull);
    }
}
