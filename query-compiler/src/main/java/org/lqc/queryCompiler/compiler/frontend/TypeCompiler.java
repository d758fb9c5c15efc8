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

package org.lqc.queryCompiler.compiler.frontend;

import org.apache.calcite.linq4j.tree.Primitive;
import org.lqc.queryCompiler.compiler.ICompilerComponent;
import org.lqc.queryCompiler.compiler.QueryCompiler;
import org.lqc.queryCompiler.compiler.errors.UnimplementedException;
import org.lqc.queryCompiler.ir.LQMember;
import org.lqc.queryCompiler.ir.type.LQType;
import org.lqc.queryCompiler.ir.type.LQTypeCode;
import org.lqc.queryCompiler.ir.type.derived.LQTypeStruct;
import org.lqc.queryCompiler.ir.type.primitive.LQTypeAny;
import org.lqc.queryCompiler.ir.type.primitive.LQTypeBaseType;
import org.lqc.util.IWritesLogs;
import org.lqc.util.Logger;
import org.lqc.util.Utilities;

import javax.annotation.Nullable;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Converts Java classes into IR types.
 * Records and plain classes become structs with one field for each
 * record component or instance field, in declaration order. */
public class TypeCompiler implements ICompilerComponent, IWritesLogs {
    final QueryCompiler compiler;
    /** Structs already produced, so that a class always maps to the same struct. */
    final Map<Class<?>, LQTypeStruct> structs;
    /** Classes whose conversion is in progress. */
    final Set<Class<?>> converting;

    public TypeCompiler(QueryCompiler compiler) {
        this.compiler = compiler;
        this.structs = new HashMap<>();
        this.converting = new HashSet<>();
    }

    @Override
    public QueryCompiler compiler() {
        return this.compiler;
    }

    @Nullable
    static LQTypeCode primitiveCode(Primitive primitive) {
        switch (primitive) {
            case BOOLEAN:
                return LQTypeCode.BOOL;
            case BYTE:
            case SHORT:
            case INT:
                return LQTypeCode.INT32;
            case LONG:
                return LQTypeCode.INT64;
            case FLOAT:
            case DOUBLE:
                return LQTypeCode.DOUBLE;
            default:
                return null;
        }
    }

    /** Convert the type of a value.  Primitive types are not nullable,
     * while boxed types are the nullable form of the same type. */
    public LQType convertType(Class<?> clazz) {
        Primitive primitive = Primitive.of(clazz);
        boolean mayBeNull = false;
        if (primitive == null) {
            primitive = Primitive.ofBox(clazz);
            mayBeNull = true;
        }
        if (primitive != null) {
            LQTypeCode code = primitiveCode(primitive);
            if (code == null)
                throw new UnimplementedException("Values of type " + clazz.getName() + " are not supported");
            return LQTypeBaseType.create(code, mayBeNull);
        }
        if (clazz == String.class)
            return LQTypeBaseType.STRING;
        if (clazz == BigDecimal.class)
            return LQTypeBaseType.create(LQTypeCode.DECIMAL, true);
        if (clazz == LocalDate.class)
            return LQTypeBaseType.create(LQTypeCode.DATE, true);
        if (clazz == LocalDateTime.class || clazz == Timestamp.class)
            return LQTypeBaseType.create(LQTypeCode.TIMESTAMP, true);
        if (clazz == Object.class)
            return LQTypeAny.INSTANCE;
        return this.convertClass(clazz);
    }

    /** Convert a class describing an object with members into a struct. */
    public LQTypeStruct convertClass(Class<?> clazz) {
        LQTypeStruct result = this.structs.get(clazz);
        if (result != null)
            return result;
        if (clazz.isArray() || clazz.isInterface() || clazz.isEnum() ||
                clazz.getName().startsWith("java."))
            throw new UnimplementedException("Cannot convert " + clazz.getName() + " to a struct");
        if (!this.converting.add(clazz))
            throw new UnimplementedException("Recursive type " + clazz.getName() + " cannot be converted");

        List<LQTypeStruct.Field> fields = new ArrayList<>();
        try {
            if (clazz.isRecord()) {
                for (RecordComponent component: clazz.getRecordComponents())
                    fields.add(new LQTypeStruct.Field(component.getName(), this.convertType(component.getType())));
            } else {
                for (Field field: clazz.getDeclaredFields()) {
                    if (Modifier.isStatic(field.getModifiers()) || field.isSynthetic())
                        continue;
                    fields.add(new LQTypeStruct.Field(field.getName(), this.convertType(field.getType())));
                }
            }
        } finally {
            this.converting.remove(clazz);
        }
        result = new LQTypeStruct(clazz.getSimpleName(), fields);
        Logger.INSTANCE.belowLevel(this, 2)
                .append("Converted ")
                .append(clazz.getName())
                .append(" to ")
                .append(result.getFields().toString())
                .newline();
        Utilities.putNew(this.structs, clazz, result);
        return result;
    }

    /** The member with the specified name of the struct describing a class. */
    public LQMember member(Class<?> clazz, String name) {
        return this.convertClass(clazz).member(name);
    }
}
