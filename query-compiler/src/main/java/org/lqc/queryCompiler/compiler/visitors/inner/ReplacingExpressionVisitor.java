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

import org.lqc.queryCompiler.compiler.QueryCompiler;
import org.lqc.queryCompiler.compiler.visitors.VisitDecision;
import org.lqc.queryCompiler.ir.ILQNode;
import org.lqc.queryCompiler.ir.LQMember;
import org.lqc.queryCompiler.ir.expression.LQConditionalExpression;
import org.lqc.queryCompiler.ir.expression.LQConstantExpression;
import org.lqc.queryCompiler.ir.expression.LQExpression;
import org.lqc.queryCompiler.ir.expression.LQGroupByShaperExpression;
import org.lqc.queryCompiler.ir.expression.LQMemberAssignment;
import org.lqc.queryCompiler.ir.expression.LQMemberExpression;
import org.lqc.queryCompiler.ir.expression.LQMemberInitExpression;
import org.lqc.queryCompiler.ir.expression.LQMethodCallExpression;
import org.lqc.queryCompiler.ir.expression.LQNewExpression;
import org.lqc.queryCompiler.ir.type.LQType;
import org.lqc.util.Logger;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/** Replaces every expression structurally equivalent with one of the originals
 * by the corresponding replacement.  Originals are checked in order, and the
 * first match wins.  A matched expression is not visited, and neither is its replacement.
 *
 * <p>Member accesses whose source is (after rewriting) a construction of the object
 * accessed are simplified to the value stored in the member.  The same holds for
 * the accessor call {@code EF.Property(entity, "Name")}. */
public class ReplacingExpressionVisitor extends InnerRewriteVisitor {
    final List<LQExpression> originals;
    final List<LQExpression> replacements;

    public ReplacingExpressionVisitor(QueryCompiler compiler,
                                      List<? extends LQExpression> originals,
                                      List<? extends LQExpression> replacements) {
        super(compiler);
        Objects.requireNonNull(originals, "originals");
        Objects.requireNonNull(replacements, "replacements");
        if (originals.size() != replacements.size())
            throw new IllegalArgumentException("Got " + originals.size() + " originals but " +
                    replacements.size() + " replacements");
        this.originals = List.copyOf(originals);
        this.replacements = List.copyOf(replacements);
    }

    /** Replace a single expression in a tree. */
    public static LQExpression replace(
            QueryCompiler compiler, LQExpression original, LQExpression replacement, LQExpression tree) {
        Objects.requireNonNull(compiler, "compiler");
        Objects.requireNonNull(original, "original");
        Objects.requireNonNull(replacement, "replacement");
        Objects.requireNonNull(tree, "tree");
        ReplacingExpressionVisitor visitor = new ReplacingExpressionVisitor(
                compiler, List.of(original), List.of(replacement));
        return visitor.apply(tree).to(LQExpression.class);
    }

    public static LQExpression replace(LQExpression original, LQExpression replacement, LQExpression tree) {
        return replace(new QueryCompiler(), original, replacement, tree);
    }

    /** Rewrite a tree; a null tree produces a null result. */
    @Nullable
    public LQExpression visit(@Nullable LQExpression tree) {
        if (tree == null)
            return null;
        return this.apply(tree).to(LQExpression.class);
    }

    @Override
    protected LQExpression transform(LQExpression expression) {
        for (int i = 0; i < this.originals.size(); i++) {
            if (EquivalenceContext.equiv(this.originals.get(i), expression)) {
                LQExpression replacement = this.replacements.get(i);
                Logger.INSTANCE.belowLevel(this, 2)
                        .append("Replacing ")
                        .appendSupplier(expression::toString)
                        .append(" with ")
                        .appendSupplier(replacement::toString)
                        .newline();
                this.lastResult = replacement;
                return replacement;
            }
        }
        return super.transform(expression);
    }

    /** The member or property with the specified name stored by a construction expression.
     * @param source   Expression producing the object whose member is read.
     * @param member   Member read; null when only the name is known.
     * @param name     Name of the member read.
     * @return         The expression stored in the member, or null if it is not known. */
    @Nullable
    static LQExpression valueStoredIn(LQExpression source, @Nullable LQMember member, String name) {
        LQNewExpression newExpression = source.as(LQNewExpression.class);
        if (newExpression != null) {
            int index = member != null ?
                    newExpression.indexOfMember(member) :
                    newExpression.indexOfMember(name);
            if (index >= 0)
                return newExpression.arguments.get(index);
        }

        LQExpression unwrapped = source.unwrapTypeConversion().expression();
        LQMemberInitExpression init = unwrapped.as(LQMemberInitExpression.class);
        if (init != null) {
            LQMemberAssignment binding = member != null ?
                    init.getBinding(member) :
                    init.getBinding(name);
            if (binding != null)
                return binding.expression;
        }
        return null;
    }

    /** Read a member of a value which is either null or built by a member initialization.
     * The member read moves into the branch holding the initialization, and the
     * null branch becomes a null of the nullable form of the member type.
     * @return The rewritten expression, or null if the conditional does not have this shape. */
    @Nullable
    LQExpression pushIntoConditional(LQMemberExpression expression, LQConditionalExpression conditional) {
        boolean liveIsTrue;
        if (conditional.ifFalse.isNullConstant() && conditional.ifTrue.is(LQMemberInitExpression.class))
            liveIsTrue = true;
        else if (conditional.ifTrue.isNullConstant() && conditional.ifFalse.is(LQMemberInitExpression.class))
            liveIsTrue = false;
        else
            return null;

        LQExpression live = liveIsTrue ? conditional.ifTrue : conditional.ifFalse;
        LQMemberExpression access = expression.update(live);
        LQType type = access.getType();
        // Reference kinds are always nullable
        LQType nullableType = type.isNullableType() ? type : type.makeNullable();

        LQExpression converted = access.convert(nullableType);
        LQExpression nullValue = LQConstantExpression.nullOf(nullableType);
        LQConditionalExpression result = new LQConditionalExpression(
                conditional.test,
                liveIsTrue ? converted : nullValue,
                liveIsTrue ? nullValue : converted,
                nullableType);
        if (!type.sameType(result.getType()))
            return result.convert(type);
        return result;
    }

    @Override
    public VisitDecision preorder(LQMemberExpression expression) {
        this.push(expression);
        LQExpression source = this.transform(expression.expression);
        this.pop(expression);

        LQMember member = expression.member;
        LQGroupByShaperExpression shaper = source.as(LQGroupByShaperExpression.class);
        if (shaper != null && member.name.equals(LQGroupByShaperExpression.KEY)) {
            this.map(expression, shaper.keySelector);
            return VisitDecision.STOP;
        }

        LQExpression stored = valueStoredIn(source, member, member.name);
        if (stored != null) {
            this.map(expression, stored);
            return VisitDecision.STOP;
        }

        LQConditionalExpression conditional = source.as(LQConditionalExpression.class);
        if (conditional != null && !this.options().languageOptions.noConditionalMemberPushdown) {
            LQExpression pushed = this.pushIntoConditional(expression, conditional);
            if (pushed != null) {
                this.map(expression, pushed);
                return VisitDecision.STOP;
            }
        }

        this.map(expression, expression.update(source));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(LQMethodCallExpression expression) {
        LQMethodCallExpression.PropertyArguments arguments = expression.tryGetPropertyArguments();
        if (arguments == null)
            return super.preorder(expression);

        this.push(expression);
        LQExpression entity = this.transform(arguments.entity());
        this.pop(expression);

        LQExpression stored = valueStoredIn(entity, null, arguments.propertyName());
        if (stored != null) {
            this.map(expression, stored);
            return VisitDecision.STOP;
        }

        LQExpression result = new LQMethodCallExpression(null, expression.method,
                List.of(entity, expression.arguments.get(1)), expression.getType());
        this.map(expression, result);
        return VisitDecision.STOP;
    }

    @Override
    public ILQNode apply(ILQNode node) {
        Objects.requireNonNull(node, "tree");
        return super.apply(node);
    }
}
