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

import java.io.IOException;
import java.io.UncheckedIOException;

/** Writes indented text to an {@link Appendable}. */
public class IndentStream implements IIndentStream {
    private Appendable stream;
    /** Spaces per indentation level. */
    final int amount;
    int level = 0;
    /** True after a newline, until the indentation of the line is written. */
    boolean pendingIndent = false;

    public IndentStream(Appendable appendable, int amount) {
        Utilities.enforce(amount >= 0);
        this.stream = appendable;
        this.amount = amount;
    }

    public IndentStream(Appendable appendable) {
        this(appendable, 2);
    }

    /** An indent stream which accumulates its output in memory;
     * the output is retrieved with {@link #toString()}. */
    public static IndentStream inMemory() {
        return new IndentStream(new StringBuilder());
    }

    /** Set the output stream.
     * @return The previous output stream. */
    public Appendable setOutputStream(Appendable appendable) {
        Appendable result = this.stream;
        this.stream = appendable;
        return result;
    }

    void write(CharSequence text) {
        try {
            this.stream.append(text);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    @Override
    public IIndentStream appendFast(String string) {
        if (string.isEmpty())
            return this;
        if (this.pendingIndent) {
            this.pendingIndent = false;
            this.write(" ".repeat(this.level * this.amount));
        }
        this.write(string);
        return this;
    }

    @Override
    public IIndentStream newline() {
        this.write("\n");
        this.pendingIndent = true;
        return this;
    }

    @Override
    public IIndentStream increase() {
        this.level++;
        return this.newline();
    }

    @Override
    public IIndentStream decrease() {
        Utilities.enforce(this.level > 0, "Negative indentation");
        this.level--;
        return this;
    }

    @Override
    public String toString() {
        return this.stream.toString();
    }
}
