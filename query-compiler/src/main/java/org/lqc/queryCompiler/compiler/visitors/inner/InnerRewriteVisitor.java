package org.lqc.queryCompiler.compiler.visitors.inner;

import org.lqc.queryCompiler.compiler.QueryCompiler;
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
import org.lqc.util.IWritesLogs;
import org.lqc.util.Linq;
import org.lqc.util.Logger;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/** Base class for visitors which rewrite expressions.
 * This class recurses over the structure of expressions and if any children
 * have changed builds a new version of the node.  Classes that extend this
 * should override the preorder methods and ignore the postorder methods.
 * Types, members, and methods are never rewritten. */
public abstract class InnerRewriteVisitor
        extends InnerVisitor
        implements IWritesLogs {
    protected InnerRewriteVisitor(QueryCompiler compiler) {
        super(compiler);
    }

    /** Result produced by the last preorder invocation. */
    @Nullable
    protected ILQNode lastResult;

    protected ILQNode getResult() {
        return Objects.requireNonNull(this.lastResult);
    }

    @Override
    public ILQNode apply(ILQNode node) {
        this.startVisit(node);
        if (node.is(LQExpression.class))
            this.transform(node.to(LQExpression.class));
        else
            node.accept(this);
        this.endVisit();
        return this.getResult();
    }

    /** Replace the 'old' IR node with the 'newOp' IR node if
     * any of its fields differs. */
    protected void map(ILQNode old, ILQNode newOp) {
        if (old == newOp || old.sameFields(newOp)) {
            this.lastResult = old;
            return;
        }
        Logger.INSTANCE.belowLevel(this, 1)
                .appendSupplier(this::toString)
                .append(":")
                .appendSupplier(old::toString)
                .append(" -> ")
                .appendSupplier(newOp::toString)
                .newline();
        this.lastResult = newOp;
    }

    @Override
    public VisitDecision preorder(ILQNode node) {
        this.map(node, node);
        return VisitDecision.STOP;
    }

    protected LQExpression getResultExpression() {
        return this.getResult().to(LQExpression.class);
    }

    /** Every expression child is rewritten through this method. */
    protected LQExpression transform(LQExpression expression) {
        expression.accept(this);
        return this.getResultExpression();
    }

    @Nullable
    protected LQExpression transformN(@Nullable LQExpression expression) {
        if (expression == null)
            return null;
        return this.transform(expression);
    }

    protected List<LQExpression> transform(List<? extends LQExpression> expressions) {
        return Linq.map(expressions, this::transform);
    }

    protected LQMemberAssignment transform(LQMemberAssignment binding) {
        binding.accept(this);
        return this.getResult().to(LQMemberAssignment.class);
    }

    /////////////////////// Leaves ////////////////////////////////

    @Override
    public VisitDecision preorder(LQType type) {
        this.map(type, type);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(LQMember member) {
        this.map(member, member);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(LQMethod method) {
        this.map(method, method);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(LQConstantExpression expression) {
        this.map(expression, expression);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(LQParameterExpression expression) {
        this.map(expression, expression);
        return VisitDecision.STOP;
    }

    /////////////////////// Expressions ////////////////////////////////

    @Override
    public VisitDecision preorder(LQMemberAssignment binding) {
        this.push(binding);
        LQExpression expression = this.transform(binding.expression);
        this.pop(binding);
        this.map(binding, binding.update(expression));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(LQMemberExpression expression) {
        this.push(expression);
        LQExpression source = this.transform(expression.expression);
        this.pop(expression);
        this.map(expression, expression.update(source));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(LQConditionalExpression expression) {
        this.push(expression);
        LQExpression test = this.transform(expression.test);
        LQExpression ifTrue = this.transform(expression.ifTrue);
        LQExpression ifFalse = this.transform(expression.ifFalse);
        this.pop(expression);
        LQExpression result = new LQConditionalExpression(test, ifTrue, ifFalse, expression.getType());
        this.map(expression, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(LQNewExpression expression) {
        this.push(expression);
        List<LQExpression> arguments = this.transform(expression.arguments);
        this.pop(expression);
        LQExpression result = new LQNewExpression(expression.getStructType(), arguments, expression.members);
        this.map(expression, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(LQMemberInitExpression expression) {
        this.push(expression);
        LQNewExpression newExpression = this.transform(expression.newExpression).to(LQNewExpression.class,
                "Construction in " + expression + " was rewritten into an expression of another kind");
        List<LQMemberAssignment> bindings = Linq.map(expression.bindings, this::transform);
        this.pop(expression);
        LQExpression result = new LQMemberInitExpression(newExpression, bindings);
        this.map(expression, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(LQGroupByShaperExpression expression) {
        this.push(expression);
        LQExpression keySelector = this.transform(expression.keySelector);
        LQExpression elementSelector = this.transform(expression.elementSelector);
        this.pop(expression);
        LQExpression result = new LQGroupByShaperExpression(keySelector, elementSelector);
        this.map(expression, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(LQMethodCallExpression expression) {
        this.push(expression);
        LQExpression instance = this.transformN(expression.instance);
        List<LQExpression> arguments = this.transform(expression.arguments);
        this.pop(expression);
        LQExpression result = new LQMethodCallExpression(instance, expression.method, arguments, expression.getType());
        this.map(expression, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(LQConvertExpression expression) {
        this.push(expression);
        LQExpression source = this.transform(expression.source);
        this.pop(expression);
        LQExpression result = new LQConvertExpression(source, expression.getType());
        this.map(expression, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(LQBinaryExpression expression) {
        this.push(expression);
        LQExpression left = this.transform(expression.left);
        LQExpression right = this.transform(expression.right);
        this.pop(expression);
        LQExpression result = new LQBinaryExpression(expression.opcode, left, right, expression.getType());
        this.map(expression, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(LQLambdaExpression expression) {
        this.push(expression);
        LQExpression body = this.transform(expression.body);
        this.pop(expression);
        LQExpression result = new LQLambdaExpression(body, expression.parameters);
        this.map(expression, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(LQInvocationExpression expression) {
        this.push(expression);
        LQExpression function = this.transform(expression.function);
        List<LQExpression> arguments = this.transform(expression.arguments);
        this.pop(expression);
        LQExpression result = new LQInvocationExpression(function, arguments);
        this.map(expression, result);
        return VisitDecision.STOP;
    }
}
