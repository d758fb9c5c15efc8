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
import org.lqc.util.IIndentStream;
import org.lqc.util.Utilities;

import java.util.Objects;

/** Identifies a method by the name of its declaring class and its own name. */
public final class LQMethod extends LQNode {
    public final String declaringClass;
    public final String name;

    /** The accessor method {@code EF.Property(entity, "Name")}, which reads
     * a property given by name. */
    public static final LQMethod PROPERTY = new LQMethod("EF", "Property");

    public LQMethod(String declaringClass, String name) {
        Utilities.enforce(!name.isEmpty(), "Empty method name");
        this.declaringClass = declaringClass;
        this.name = name;
    }

    @Override
    public boolean sameFields(ILQNode other) {
        LQMethod o = other.as(LQMethod.class);
        if (o == null)
            return false;
        return this.equals(o);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || this.getClass() != o.getClass()) return false;
        LQMethod that = (LQMethod) o;
        return this.declaringClass.equals(that.declaringClass) && this.name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.declaringClass, this.name);
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
        if (!this.declaringClass.isEmpty())
            builder.append(this.declaringClass).append(".");
        return builder.append(this.name);
    }

    @SuppressWarnings("unused")
    public static LQMethod fromJson(JsonNode node, JsonDecoder decoder) {
        String declaringClass = Utilities.getStringProperty(node, "declaringClass");
        String name = Utilities.getStringProperty(node, "name");
        return new LQMethod(declaringClass, name);
    }
}
