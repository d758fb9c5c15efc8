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

package org.lqc.util;

import org.lqc.queryCompiler.compiler.errors.InternalCompilerError;

import javax.annotation.Nullable;

/** Checked downcasts for class hierarchies. */
public interface ICastable {
    /** @return this cast to the class, or null if it is not an instance. */
    @Nullable
    default <T> T as(Class<T> clazz) {
        return clazz.isInstance(this) ? clazz.cast(this) : null;
    }

    /** Cast to the class; throws {@link InternalCompilerError} with the message if that fails. */
    default <T> T to(Class<T> clazz, String error) {
        if (!clazz.isInstance(this))
            throw new InternalCompilerError(error);
        return clazz.cast(this);
    }

    default <T> T to(Class<T> clazz) {
        return this.to(clazz, this + " is not an instance of " + clazz.getSimpleName());
    }

    default <T> boolean is(Class<T> clazz) {
        return clazz.isInstance(this);
    }
}
