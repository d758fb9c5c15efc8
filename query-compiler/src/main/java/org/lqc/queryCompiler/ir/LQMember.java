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

package org.lqc.queryCompiler.ir;

import com.fasterxml.jackson.databind.JsonNode;
import org.lqc.queryCompiler.compiler.backend.JsonDecoder;
import org.lqc.queryCompiler.compiler.visitors.VisitDecision;
import org.lqc.queryCompiler.compiler.visitors.inner.InnerVisitor;
import org.lqc.queryCompiler.ir.type.LQType;
import org.lqc.util.IIndentStream;
import org.lqc.util.Utilities;

import java.util.Objects;

/** Identifies a field or property of a type.
 * Two members are equal when they have the same declaring type and name,
 * regardless of which node instance describes them. */
public final class LQMember extends LQNode {
    public final LQType declaringType;
    public final String name;
    /** Type of the values stored in this member. */
    public final LQType type;

    public LQMember(LQType declaringType, String name, LQType type) {
        Utilities.enforce(!name.isEmpty(), "Empty member name");
        this.declaringType = declaringType;
        this.name = name;
        this.type = type;
    }

    public String getName() {
        return this.name;
    }

    @Override
    public boolean sameFields(ILQNode other) {
        LQMember o = other.as(LQMember.class);
        if (o == null)
            return false;
        return this.declaringType == o.declaringType &&
                this.name.equals(o.name) &&
                this.type == o.type;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || this.getClass() != o.getClass()) return false;
        LQMember that = (LQMember) o;
        return this.name.equals(that.name) && this.declaringType.sameType(that.declaringType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.name, this.declaringType.hashCode());
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.property("declaringType");
        this.declaringType.accept(visitor);
        visitor.property("type");
        this.type.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.declaringType)
                .append(".")
                .append(this.name);
    }

    @SuppressWarnings("unused")
    public static LQMember fromJson(JsonNode node, JsonDecoder decoder) {
        LQType declaringType = fromJsonInner(node, "declaringType", decoder, LQType.class);
        String name = Utilities.getStringProperty(node, "name");
        LQType type = fromJsonInner(node, "type", decoder, LQType.class);
        return new LQMember(declaringType, name, type);
    }
}
