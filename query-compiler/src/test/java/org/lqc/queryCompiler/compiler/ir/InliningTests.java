package org.lqc.queryCompiler.compiler.ir;

import org.lqc.queryCompiler.compiler.QueryCompiler;
import org.lqc.queryCompiler.compiler.errors.InternalCompilerError;
import org.lqc.queryCompiler.compiler.visitors.inner.BetaReduction;
import org.lqc.queryCompiler.ir.expression.LQConstantExpression;
import org.lqc.queryCompiler.ir.expression.LQExpression;
import org.lqc.queryCompiler.ir.expression.LQInvocationExpression;
import org.lqc.queryCompiler.ir.expression.LQLambdaExpression;
import org.lqc.queryCompiler.ir.expression.LQMemberInitExpression;
import org.lqc.queryCompiler.ir.expression.LQOpcode;
import org.lqc.queryCompiler.ir.expression.LQParameterExpression;
import org.lqc.queryCompiler.ir.type.derived.LQTypeFunction;
import org.lqc.queryCompiler.ir.type.primitive.LQTypeBaseType;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;

public class InliningTests extends BaseRewriteTests {
    @Test
    public void testInlining() {
        QueryCompiler compiler = this.testCompiler();
        LQParameterExpression d = dto("d");
        // (d) => d.Prop + 1
        LQLambdaExpression lambda = new LQLambdaExpression(
                d.member(PROP).binary(LQOpcode.ADD, new LQConstantExpression(1)), d);
        LQExpression inlined = lambda.inline(compiler, dtoInit5());
        Assert.assertEquals("(5 + 1)", inlined.toString());

        LQParameterExpression e = dto("e");
        inlined = lambda.inline(compiler, e);
        Assert.assertEquals("(e.Prop + 1)", inlined.toString());
    }

    @Test
    public void testHigherOrder() {
        QueryCompiler compiler = this.testCompiler();
        LQParameterExpression d = dto("d");
        // g = (d) => d.Prop
        LQLambdaExpression g = new LQLambdaExpression(d.member(PROP), d);
        // (f) => f(new Dto { Prop = 5 })
        LQParameterExpression f = new LQParameterExpression("f",
                new LQTypeFunction(LQTypeBaseType.INT32, List.of(DTO)));
        LQMemberInitExpression init = dtoInit5();
        LQLambdaExpression apply = new LQLambdaExpression(
                new LQInvocationExpression(f, List.of(init)), f);
        LQExpression result = apply.inline(compiler, g);
        Assert.assertSame(init.bindings.get(0).expression, result);
    }

    @Test
    public void testInvocationsInsideTree() {
        QueryCompiler compiler = this.testCompiler();
        LQParameterExpression d = dto("d");
        LQLambdaExpression lambda = new LQLambdaExpression(d.member(PROP), d);
        LQParameterExpression e = dto("e");
        // ((d) => d.Prop)(e) * 2
        LQExpression tree = lambda.call(e).binary(LQOpcode.MUL, new LQConstantExpression(2));
        BetaReduction reduction = new BetaReduction(compiler);
        LQExpression result = reduction.apply(tree).to(LQExpression.class);
        Assert.assertEquals("(e.Prop * 2)", result.toString());
    }

    @Test
    public void testUnknownFunction() {
        LQParameterExpression f = new LQParameterExpression("f",
                new LQTypeFunction(LQTypeBaseType.INT32, List.of(DTO)));
        LQExpression tree = new LQInvocationExpression(f, List.of(dto("d")));
        BetaReduction reduction = new BetaReduction(this.testCompiler());
        Assert.assertSame(tree, reduction.apply(tree));
        Assert.assertEquals("Invoke(f, d)", tree.toString());
    }

    @Test
    public void testArityMismatch() {
        LQParameterExpression d = dto("d");
        LQLambdaExpression lambda = new LQLambdaExpression(d.member(PROP), d);
        Assert.assertThrows(InternalCompilerError.class, () -> lambda.call());
        Assert.assertThrows(InternalCompilerError.class,
                () -> new LQInvocationExpression(lambda, List.of(d, d)));
    }
}
