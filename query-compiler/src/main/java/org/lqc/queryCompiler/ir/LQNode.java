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
import org.lqc.util.IndentStream;
import org.lqc.util.Utilities;

import java.util.ArrayList;
import java.util.List;

/** Base class for all IR nodes. */
public abstract class LQNode implements ILQNode {
    static long crtId = 0;
    public final long id;

    protected LQNode() {
        this.id = crtId++;
    }

    @Override
    public long getId() {
        return this.id;
    }

    @Override
    public String toString() {
        IndentStream stream = IndentStream.inMemory();
        this.toString(stream);
        return stream.toString();
    }

    public static <T extends ILQNode> T fromJsonInner(
            JsonNode node, String property, JsonDecoder decoder, Class<T> clazz) {
        JsonNode prop = Utilities.getProperty(node, property);
        return decoder.decodeInner(prop, clazz);
    }

    public static <T extends ILQNode> List<T> fromJsonInnerList(
            JsonNode node, JsonDecoder decoder, Class<T> clazz) {
        Utilities.enforce(node.isArray(), "Node is not an array " + Utilities.toDepth(node, 1));
        List<T> result = new ArrayList<>();
        for (JsonNode element: node)
            result.add(decoder.decodeInner(element, clazz));
        return result;
    }

    public static <T extends ILQNode> List<T> fromJsonInnerList(
            JsonNode node, String property, JsonDecoder decoder, Class<T> clazz) {
        JsonNode prop = Utilities.getProperty(node, property);
        return fromJsonInnerList(prop, decoder, clazz);
    }
}
