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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.lqc.queryCompiler.compiler.errors.InternalCompilerError;
import org.jetbrains.annotations.Contract;

import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public class Utilities {
    private Utilities() {}

    public static String getCurrentStackTrace() {
        StackTraceElement[] stackTrace = Thread.currentThread().getStackTrace();
        StringBuilder builder = new StringBuilder();
        for (int i = 3; i < stackTrace.length; i++)
            builder.append(stackTrace[i].toString()).append("\n");
        return builder.toString();
    }

    /** Like assert, but never compiled out.
     * @param expression  When false, throws {@link InternalCompilerError}. */
    @Contract("false -> fail")
    public static void enforce(boolean expression) {
        if (!expression)
            throw new InternalCompilerError(
                    "Assertion failed" + System.lineSeparator() + getCurrentStackTrace());
    }

    @Contract("false, _ -> fail")
    public static void enforce(boolean expression, String message) {
        if (!expression)
            throw new InternalCompilerError(message + System.lineSeparator() + getCurrentStackTrace());
    }

    /** Escape special characters in a string. */
    public static String escape(String value) {
        StringBuilder builder = new StringBuilder();
        final int length = value.length();
        for (int offset = 0; offset < length; ) {
            final int c = value.codePointAt(offset);
            if (c == '\\')
                builder.append("\\\\");
            else if (c == '\"')
                builder.append("\\\"");
            else if (c == '\r')
                builder.append("\\r");
            else if (c == '\n')
                builder.append("\\n");
            else if (c == '\t')
                builder.append("\\t");
            else if (c < 32)
                builder.append(String.format("\\u%04x", c));
            else
                builder.appendCodePoint(c);
            offset += Character.charCount(c);
        }
        return builder.toString();
    }

    public static String escapeDoubleQuotes(String value) {
        return value.replace("\"", "\\\"");
    }

    public static ObjectMapper deterministicObjectMapper() {
        return JsonMapper
                .builder()
                .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
                .configure(DeserializationFeature.FAIL_ON_READING_DUP_TREE_KEY, true)
                .build();
    }

    /** Add double quotes around a string and escape the symbols that need it. */
    public static String doubleQuote(String value) {
        return "\"" + escape(value) + "\"";
    }

    /** Add single quotes around a string.  No escaping is performed. */
    public static String singleQuote(@Nullable String other) {
        return "'" + other + "'";
    }

    /** Insert a key that must not be already present in the map.
     * @return The inserted value. */
    @SuppressWarnings("UnusedReturnValue")
    public static <K, V, VE extends V> VE putNew(Map<K, V> map, K key, VE value) {
        V previous = map.put(Objects.requireNonNull(key), Objects.requireNonNull(value));
        if (previous != null)
            throw new InternalCompilerError("Key " + key + " already mapped to " + previous + " when adding " + value);
        return value;
    }

    public static String readFile(Path filename) throws IOException {
        return Files.readString(filename);
    }

    public static <T> T removeLast(List<T> data) {
        enforce(!data.isEmpty());
        return data.remove(data.size() - 1);
    }

    public static <T> void removeLast(List<T> data, T expected) {
        T removed = removeLast(data);
        enforce(removed == expected, "Unexpected node popped " + removed + " expected " + expected);
    }

    public static <T> T last(List<T> data) {
        enforce(!data.isEmpty(), "Last of empty list");
        return data.get(data.size() - 1);
    }

    static void toDepth(JsonNode node, int depth, IIndentStream stream) {
        if (node.isObject()) {
            stream.append("{").increase();
            var it = node.fields();
            boolean first = true;
            while (it.hasNext()) {
                var field = it.next();
                if (!first)
                    stream.append(",").newline();
                first = false;
                stream.appendJsonLabelAndColon(field.getKey());
                if (depth > 0)
                    toDepth(field.getValue(), depth - 1, stream);
                else
                    stream.append("...");
            }
            stream.newline().decrease().append("}");
        } else if (node.isArray()) {
            stream.append("[");
            if (depth > 0) {
                boolean first = true;
                for (JsonNode element: node) {
                    if (!first)
                        stream.append(", ");
                    first = false;
                    toDepth(element, depth - 1, stream);
                }
            } else {
                stream.append("...");
            }
            stream.append("]");
        } else {
            stream.append(node.toString());
        }
    }

    /** Serialize a JSON tree as a string, down to the specified depth. */
    public static String toDepth(JsonNode node, int depth) {
        IndentStream builder = IndentStream.inMemory();
        toDepth(node, depth, builder);
        return builder.toString();
    }

    public static JsonNode getProperty(JsonNode node, String property) {
        JsonNode prop = node.get(property);
        enforce(prop != null,
                "Node does not have property " + singleQuote(property) + " " + toDepth(node, 1));
        return prop;
    }

    public static boolean getBooleanProperty(JsonNode node, String property) {
        return getProperty(node, property).asBoolean();
    }

    public static String getStringProperty(JsonNode node, String property) {
        return getProperty(node, property).asText();
    }

    public static long getLongProperty(JsonNode node, String property) {
        return getProperty(node, property).asLong();
    }
}
