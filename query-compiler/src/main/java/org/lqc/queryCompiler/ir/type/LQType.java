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

package org.lqc.queryCompiler.ir.type;

import com.fasterxml.jackson.databind.JsonNode;
import org.lqc.queryCompiler.ir.ILQNode;
import org.lqc.queryCompiler.ir.LQNode;
import org.lqc.util.Utilities;

import java.util.List;
import java.util.Objects;

/** Base class for all types.  Types are compared by value. */
public abstract class LQType extends LQNode {
    public final LQTypeCode code;
    /** True if this type admits null values.  Always true for reference kinds. */
    public final boolean mayBeNull;

    protected LQType(LQTypeCode code, boolean mayBeNull) {
        this.code = code;
        // Only value kinds have a non-nullable form
        this.mayBeNull = mayBeNull || !code.isValueKind;
    }

    /** Like 'equals', but takes a type. */
    public abstract boolean sameType(LQType other);

    /** A copy of this type with the mayBeNull bit set to the specified value.
     * Reference kinds ignore a false value. */
    public abstract LQType withMayBeNull(boolean mayBeNull);

    public boolean sameNullability(LQType other) {
        return this.mayBeNull == other.mayBeNull;
    }

    public static boolean sameTypes(List<LQType> left, List<LQType> right) {
        if (left.size() != right.size())
            return false;
        for (int i = 0; i < left.size(); i++)
            if (!left.get(i).sameType(right.get(i)))
                return false;
        return true;
    }

    /** True if values of this type may be null. */
    public boolean isNullableType() {
        return this.mayBeNull;
    }

    /** The nullable form of this type; only value kinds have a distinct one. */
    public LQType makeNullable() {
        return this.withMayBeNull(true);
    }

    @Override
    public boolean sameFields(ILQNode other) {
        LQType type = other.as(LQType.class);
        if (type == null)
            return false;
        return this.sameType(type);
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof LQType))
            return false;
        return this.sameType((LQType) obj);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.code, this.mayBeNull);
    }

    public static boolean fromJsonMayBeNull(JsonNode node) {
        return Utilities.getBooleanProperty(node, "mayBeNull");
    }
}
