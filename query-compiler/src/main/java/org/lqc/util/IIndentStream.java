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

import java.util.function.Supplier;

/** A text sink that keeps track of indentation. */
@SuppressWarnings("UnusedReturnValue")
public interface IIndentStream {
    /** Append a string that does not contain a newline. */
    IIndentStream appendFast(String string);

    IIndentStream newline();

    /** Increase indentation and start a new line. */
    IIndentStream increase();

    IIndentStream decrease();

    default IIndentStream append(String string) {
        int start = 0;
        for (int nl = string.indexOf('\n'); nl >= 0; nl = string.indexOf('\n', start)) {
            this.appendFast(string.substring(start, nl)).newline();
            start = nl + 1;
        }
        return this.appendFast(string.substring(start));
    }

    default IIndentStream append(ToIndentableString value) {
        return value.toString(this);
    }

    default IIndentStream append(boolean b) {
        return this.appendFast(Boolean.toString(b));
    }

    default IIndentStream append(long value) {
        return this.appendFast(Long.toString(value));
    }

    /** The supplier is only invoked if the output is kept. */
    default IIndentStream appendSupplier(Supplier<String> supplier) {
        return this.append(supplier.get());
    }

    default IIndentStream appendJsonLabelAndColon(String label) {
        return this.append("\"").append(Utilities.escapeDoubleQuotes(label)).append("\": ");
    }
}
