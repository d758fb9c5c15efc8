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

package org.lqc.queryCompiler.compiler.visitors.inner;

import org.lqc.queryCompiler.compiler.ICompilerComponent;
import org.lqc.queryCompiler.compiler.QueryCompiler;
import org.lqc.queryCompiler.compiler.errors.InternalCompilerError;
import org.lqc.queryCompiler.compiler.visitors.VisitDecision;
import org.lqc.queryCompiler.ir.ILQNode;
import org.lqc.queryCompiler.ir.LQMember;
import org.lqc.queryCompiler.ir.LQMethod;
import org.lqc.queryCompiler.ir.expression.LQBinaryExpression;
import org.lqc.queryCompiler.ir.expression.LQConditionalExpression;
import org.lqc.queryCompiler.ir.expression.LQConstantExpression;
import org.lqc.queryCompiler.ir.expression.LQConvertExpression;
import org.lqc.queryCompiler.ir.expression.LQExpression;
import org.lqc.queryCompiler.ir.expression.LQGroupByShaperExpression;
import org.lqc.queryCompiler.ir.expression.LQInvocationExpression;
import org.lqc.queryCompiler.ir.expression.LQLambdaExpression;
import org.lqc.queryCompiler.ir.expression.LQMemberAssignment;
import org.lqc.queryCompiler.ir.expression.LQMemberExpression;
import org.lqc.queryCompiler.ir.expression.LQMemberInitExpression;
import org.lqc.queryCompiler.ir.expression.LQMethodCallExpression;
import org.lqc.queryCompiler.ir.expression.LQNewExpression;
import org.lqc.queryCompiler.ir.expression.LQParameterExpression;
import org.lqc.queryCompiler.ir.type.LQType;
import org.lqc.queryCompiler.ir.type.derived.LQTypeFunction;
import org.lqc.queryCompiler.ir.type.derived.LQTypeGrouping;
import org.lqc.queryCompiler.ir.type.derived.LQTypeStruct;
import org.lqc.queryCompiler.ir.type.primitive.LQTypeAny;
import org.lqc.queryCompiler.ir.type.primitive.LQTypeBaseType;
import org.lqc.util.IHasId;
import org.lqc.util.IWritesLogs;
import org.lqc.util.Logger;
import org.lqc.util.Utilities;

import java.util.ArrayList;
import java.util.List;

/** Depth-first traversal of an IR tree.
 * Each node calls the preorder method for its class; if that returns
 * {@link VisitDecision#CONTINUE} the node visits its children, and then calls postorder.
 * The default preorder and postorder methods delegate to the method for the superclass. */
@SuppressWarnings({"SameReturnValue", "unused"})
public abstract class InnerVisitor implements IRTransform, IWritesLogs, IHasId, ICompilerComponent {
    final long id;
    static long crtId = 0;
    public final QueryCompiler compiler;
    protected final List<ILQNode> context;

    public InnerVisitor(QueryCompiler compiler) {
        this.id = crtId++;
        this.compiler = compiler;
        this.context = new ArrayList<>();
    }

    @Override
    public QueryCompiler compiler() {
        return this.compiler;
    }

    @Override
    public long getId() {
        return this.id;
    }

    public void push(ILQNode node) {
        this.context.add(node);
    }

    public void pop(ILQNode node) {
        ILQNode last = Utilities.removeLast(this.context);
        if (node != last)
            throw new InternalCompilerError("Corrupted visitor context: popping " + node
                    + " instead of " + last, node);
    }

    /** Called before visiting the child stored in the named property of the current node. */
    public void property(String name) {}

    /** Called before visiting the children stored in a list property. */
    public void startArrayProperty(String name) {}

    public void endArrayProperty(String name) {}

    /** Called before visiting each element of a list property. */
    public void propertyIndex(int index) {}

    /** Override to initialize before visiting any node. */
    public void startVisit(ILQNode node) {
        Logger.INSTANCE.belowLevel(this, 4)
                .append("Starting ")
                .appendSupplier(this::toString)
                .append(" at ")
                .append(node)
                .newline();
    }

    /** Override to finish after visiting all nodes. */
    public void endVisit() {}

    /************************* PREORDER *****************************/

    public VisitDecision preorder(ILQNode ignored) {
        return VisitDecision.CONTINUE;
    }

    public VisitDecision preorder(LQExpression node) {
        return this.preorder((ILQNode) node);
    }

    public VisitDecision preorder(LQType node) {
        return this.preorder((ILQNode) node);
    }

    public VisitDecision preorder(LQMember node) {
        return this.preorder((ILQNode) node);
    }

    public VisitDecision preorder(LQMethod node) {
        return this.preorder((ILQNode) node);
    }

    public VisitDecision preorder(LQMemberAssignment node) {
        return this.preorder((ILQNode) node);
    }

    public VisitDecision preorder(LQTypeStruct.Field node) {
        return this.preorder((ILQNode) node);
    }

    public VisitDecision preorder(LQTypeBaseType node) {
        return this.preorder((LQType) node);
    }

    public VisitDecision preorder(LQTypeAny node) {
        return this.preorder((LQType) node);
    }

    public VisitDecision preorder(LQTypeStruct node) {
        return this.preorder((LQType) node);
    }

    public VisitDecision preorder(LQTypeGrouping node) {
        return this.preorder((LQType) node);
    }

    public VisitDecision preorder(LQTypeFunction node) {
        return this.preorder((LQType) node);
    }

    public VisitDecision preorder(LQConstantExpression node) {
        return this.preorder((LQExpression) node);
    }

    public VisitDecision preorder(LQParameterExpression node) {
        return this.preorder((LQExpression) node);
    }

    public VisitDecision preorder(LQMemberExpression node) {
        return this.preorder((LQExpression) node);
    }

    public VisitDecision preorder(LQConditionalExpression node) {
        return this.preorder((LQExpression) node);
    }

    public VisitDecision preorder(LQNewExpression node) {
        return this.preorder((LQExpression) node);
    }

    public VisitDecision preorder(LQMemberInitExpression node) {
        return this.preorder((LQExpression) node);
    }

    public VisitDecision preorder(LQGroupByShaperExpression node) {
        return this.preorder((LQExpression) node);
    }

    public VisitDecision preorder(LQMethodCallExpression node) {
        return this.preorder((LQExpression) node);
    }

    public VisitDecision preorder(LQConvertExpression node) {
        return this.preorder((LQExpression) node);
    }

    public VisitDecision preorder(LQBinaryExpression node) {
        return this.preorder((LQExpression) node);
    }

    public VisitDecision preorder(LQLambdaExpression node) {
        return this.preorder((LQExpression) node);
    }

    public VisitDecision preorder(LQInvocationExpression node) {
        return this.preorder((LQExpression) node);
    }

    /************************* POSTORDER *****************************/

    public void postorder(ILQNode ignored) {}

    public void postorder(LQExpression node) {
        this.postorder((ILQNode) node);
    }

    public void postorder(LQType node) {
        this.postorder((ILQNode) node);
    }

    public void postorder(LQMember node) {
        this.postorder((ILQNode) node);
    }

    public void postorder(LQMethod node) {
        this.postorder((ILQNode) node);
    }

    public void postorder(LQMemberAssignment node) {
        this.postorder((ILQNode) node);
    }

    public void postorder(LQTypeStruct.Field node) {
        this.postorder((ILQNode) node);
    }

    public void postorder(LQTypeBaseType node) {
        this.postorder((LQType) node);
    }

    public void postorder(LQTypeAny node) {
        this.postorder((LQType) node);
    }

    public void postorder(LQTypeStruct node) {
        this.postorder((LQType) node);
    }

    public void postorder(LQTypeGrouping node) {
        this.postorder((LQType) node);
    }

    public void postorder(LQTypeFunction node) {
        this.postorder((LQType) node);
    }

    public void postorder(LQConstantExpression node) {
        this.postorder((LQExpression) node);
    }

    public void postorder(LQParameterExpression node) {
        this.postorder((LQExpression) node);
    }

    public void postorder(LQMemberExpression node) {
        this.postorder((LQExpression) node);
    }

    public void postorder(LQConditionalExpression node) {
        this.postorder((LQExpression) node);
    }

    public void postorder(LQNewExpression node) {
        this.postorder((LQExpression) node);
    }

    public void postorder(LQMemberInitExpression node) {
        this.postorder((LQExpression) node);
    }

    public void postorder(LQGroupByShaperExpression node) {
        this.postorder((LQExpression) node);
    }

    public void postorder(LQMethodCallExpression node) {
        this.postorder((LQExpression) node);
    }

    public void postorder(LQConvertExpression node) {
        this.postorder((LQExpression) node);
    }

    public void postorder(LQBinaryExpression node) {
        this.postorder((LQExpression) node);
    }

    public void postorder(LQLambdaExpression node) {
        this.postorder((LQExpression) node);
    }

    public void postorder(LQInvocationExpression node) {
        this.postorder((LQExpression) node);
    }

    @Override
    public String toString() {
        return this.id + " " + this.getClass().getSimpleName();
    }

    @Override
    public ILQNode apply(ILQNode node) {
        this.startVisit(node);
        node.accept(this);
        this.endVisit();
        return node;
    }
}
