package org.lqc.queryCompiler.compiler.visitors.inner;

import org.lqc.queryCompiler.ir.expression.LQExpression;
import org.lqc.queryCompiler.ir.expression.LQParameterExpression;

import javax.annotation.Nullable;
import java.util.List;

/** Structural equivalence of expressions.
 * The parameters of lambdas that enclose the compared expressions are matched by
 * position; free parameters are equivalent when they have the same name and type. */
public class EquivalenceContext {
    /** Maps the parameters of enclosing lambdas on the left to the ones on the right. */
    final Substitution<LQParameterExpression, LQParameterExpression> leftToRight;
    /** Inverse of leftToRight. */
    final Substitution<LQParameterExpression, LQParameterExpression> rightToLeft;

    EquivalenceContext(Substitution<LQParameterExpression, LQParameterExpression> leftToRight,
                       Substitution<LQParameterExpression, LQParameterExpression> rightToLeft) {
        this.leftToRight = leftToRight;
        this.rightToLeft = rightToLeft;
    }

    public EquivalenceContext() {
        this(new Substitution<>(), new Substitution<>());
    }

    public static boolean equiv(@Nullable LQExpression left, @Nullable LQExpression right) {
        return new EquivalenceContext().equivalent(left, right);
    }

    public boolean equivalent(@Nullable LQExpression left, @Nullable LQExpression right) {
        if (left == null)
            return right == null;
        if (right == null)
            return false;
        if (left == right && this.leftToRight.isEmpty())
            return true;
        return left.equivalent(this, right);
    }

    public <T extends LQExpression> boolean equivalent(List<T> left, List<T> right) {
        if (left.size() != right.size())
            return false;
        for (int i = 0; i < left.size(); i++)
            if (!this.equivalent(left.get(i), right.get(i)))
                return false;
        return true;
    }

    /** Declare that two lambda parameters stand for the same value. */
    public void bind(LQParameterExpression left, LQParameterExpression right) {
        this.leftToRight.substitute(left, right);
        this.rightToLeft.substitute(right, left);
    }

    public boolean equivalentParameters(LQParameterExpression left, LQParameterExpression right) {
        LQParameterExpression boundLeft = this.leftToRight.get(left);
        LQParameterExpression boundRight = this.rightToLeft.get(right);
        if (boundLeft != null || boundRight != null)
            return boundLeft == right && boundRight == left;
        return left.name.equals(right.name) && left.getType().sameType(right.getType());
    }

    @SuppressWarnings("MethodDoesntCallSuperMethod")
    @Override
    public EquivalenceContext clone() {
        return new EquivalenceContext(this.leftToRight.clone(), this.rightToLeft.clone());
    }

    @Override
    public String toString() {
        return "EquivalenceContext{" +
                "leftToRight=" + this.leftToRight +
                "\n}";
    }
}
