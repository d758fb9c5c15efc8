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

import org.lqc.queryCompiler.compiler.errors.CompilationError;

import java.util.HashMap;
import java.util.Map;

/** Logger which writes indented text.
 * Every class that logs has its own level; a message is written
 * only when the class level is at least the message level. */
public class Logger {
    private final Map<Class<?>, Integer> loggingLevel = new HashMap<>();
    private final IndentStream debugStream;
    private final IIndentStream noStream;

    /** Single instance for the whole program. */
    public static final Logger INSTANCE = new Logger();

    private Logger() {
        this.debugStream = new IndentStream(System.err);
        this.noStream = new NullIndentStream();
    }

    /** Stream for messages of the given level.
     * @param clazz   Class which does the logging.
     * @param level   Level of the message.
     * @return        A stream which discards the message if the level is disabled. */
    public IIndentStream belowLevel(Class<?> clazz, int level) {
        int debugLevel = this.getLoggingLevel(clazz);
        if (debugLevel >= level)
            return this.debugStream;
        return this.noStream;
    }

    public IIndentStream belowLevel(IWritesLogs module, int level) {
        return this.belowLevel(module.getClass(), level);
    }

    /** Set the logging level of a class and of all its subclasses.
     * @return The previous logging level for this class. */
    public int setLoggingLevel(Class<?> clazz, int level) {
        int previous = this.loggingLevel.getOrDefault(clazz, 0);
        this.loggingLevel.put(clazz, level);
        return previous;
    }

    static final String root = "org.lqc.queryCompiler.compiler";

    /* Packages searched for classes named on the command line, relative to root. */
    static final String[] packages = new String[] {
            "",
            "visitors.inner",
            "backend",
            "frontend",
    };

    Class<?> locateClass(String className) {
        for (String pack: packages) {
            String path = pack.isEmpty() ? root : root + "." + pack;
            try {
                return Class.forName(path + "." + className);
            } catch (ClassNotFoundException e) {
                // try the next package
            }
        }
        throw new CompilationError("Class " + Utilities.singleQuote(className) +
                " not found for setting up logging");
    }

    /** Set the logging level of a class given by its simple name. */
    @SuppressWarnings("UnusedReturnValue")
    public int setLoggingLevel(String className, int level) {
        Class<?> clazz = this.locateClass(className);
        return this.setLoggingLevel(clazz, level);
    }

    public <T> int getLoggingLevel(Class<T> clazz) {
        if (this.loggingLevel.isEmpty())
            return 0;
        for (var e: this.loggingLevel.entrySet()) {
            if (e.getKey().isAssignableFrom(clazz))
                return e.getValue();
        }
        return 0;
    }

    /** Forget all logging levels. */
    public void reset() {
        this.loggingLevel.clear();
    }

    /** Redirect the log.  Indentation is not reset.
     * @return The previous destination. */
    public Appendable setDebugStream(Appendable writer) {
        return this.debugStream.setOutputStream(writer);
    }
}
