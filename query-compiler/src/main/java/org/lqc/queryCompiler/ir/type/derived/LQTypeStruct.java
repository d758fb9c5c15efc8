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
import org.lqc.queryCompiler.compiler.errors.CompilationError;
import org.lqc.queryCompiler.compiler.visitors.VisitDecision;
import org.lqc.queryCompiler.compiler.visitors.inner.InnerVisitor;
import org.lqc.queryCompiler.ir.ILQNode;
import org.lqc.queryCompiler.ir.LQNode;
import org.lqc.queryCompiler.ir.type.LQType;
import org.lqc.queryCompiler.ir.type.LQTypeCode;
import org.lqc.queryCompiler.ir.LQMember;
import org.lqc.util.IIndentStream;
import org.lqc.util.Utilities;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;

/** A named record shape: a DTO class or an anonymous type, with ordered fields. */
public class LQTypeStruct extends LQType {
    public static class Field extends LQNode {
        public final String name;
        public final LQType type;

        public Field(String name, LQType type) {
            this.name = name;
            this.type = type;
        }

        public String getName() {
            return this.name;
        }

        @Override
        public boolean sameFields(ILQNode other) {
            Field o = other.as(Field.class);
            if (o == null)
                return false;
            return this.name.equals(o.name) && this.type == o.type;
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
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || this.getClass() != o.getClass()) return false;
            Field that = (Field) o;
            return this.name.equals(that.name) && this.type.sameType(that.type);
        }

        @Override
        public int hashCode() {
            return Objects.hash(this.name, this.type.hashCode());
        }

        @Override
        public IIndentStream toString(IIndentStream builder) {
            return builder.append(this.type)
                    .append(" ")
                    .append(this.name);
        }

        @SuppressWarnings("unused")
        public static Field fromJson(JsonNode node, JsonDecoder decoder) {
            String name = Utilities.getStringProperty(node, "name");
            LQType type = fromJsonInner(node, "type", decoder, LQType.class);
            return new Field(name, type);
        }
    }

    public final String name;
    public final LinkedHashMap<String, Field> fields;

    public LQTypeStruct(String name, List<Field> fields) {
        super(LQTypeCode.STRUCT, true);
        this.name = name;
        this.fields = new LinkedHashMap<>();
        for (Field f: fields) {
            if (this.fields.containsKey(f.name))
                throw new CompilationError(
                        "Field name " + Utilities.singleQuote(f.name) + " is duplicated in " + name);
            this.fields.put(f.name, f);
        }
    }

    public LQTypeStruct(String name, Field... fields) {
        this(name, List.of(fields));
    }

    @Nullable
    public Field getField(String fieldName) {
        return this.fields.get(fieldName);
    }

    public List<Field> getFields() {
        return Collections.unmodifiableList(new ArrayList<>(this.fields.values()));
    }

    /** The member of this type with the specified name. */
    public LQMember member(String fieldName) {
        Field field = this.getField(fieldName);
        if (field == null)
            throw new CompilationError(
                    "Type " + this.name + " has no member " + Utilities.singleQuote(fieldName));
        return new LQMember(this, field.name, field.type);
    }

    /** The members of this type in declaration order. */
    public List<LQMember> members() {
        List<LQMember> result = new ArrayList<>();
        for (Field field: this.fields.values())
            result.add(new LQMember(this, field.name, field.type));
        return result;
    }

    @Override
    public boolean sameType(LQType other) {
        LQTypeStruct type = other.as(LQTypeStruct.class);
        if (type == null)
            return false;
        return this.name.equals(type.name) &&
                this.getFields().equals(type.getFields());
    }

    @Override
    public LQType withMayBeNull(boolean mayBeNull) {
        return this;
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), this.name);
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.startArrayProperty("fields");
        int index = 0;
        for (Field f: this.fields.values()) {
            visitor.propertyIndex(index++);
            f.accept(visitor);
        }
        visitor.endArrayProperty("fields");
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.name);
    }

    @SuppressWarnings("unused")
    public static LQTypeStruct fromJson(JsonNode node, JsonDecoder decoder) {
        String name = Utilities.getStringProperty(node, "name");
        List<Field> fields = fromJsonInnerList(node, "fields", decoder, Field.class);
        return new LQTypeStruct(name, fields);
    }
}
