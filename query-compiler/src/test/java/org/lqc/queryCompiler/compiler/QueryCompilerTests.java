package org.lqc.queryCompiler.compiler;

import org.lqc.queryCompiler.compiler.errors.InternalCompilerError;
import org.lqc.queryCompiler.compiler.ir.BaseRewriteTests;
import org.lqc.queryCompiler.ir.expression.LQConditionalExpression;
import org.lqc.queryCompiler.ir.expression.LQExpression;
import org.lqc.queryCompiler.ir.expression.LQLambdaExpression;
import org.lqc.queryCompiler.ir.expression.LQOpcode;
import org.lqc.queryCompiler.ir.expression.LQParameterExpression;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;

public class QueryCompilerTests extends BaseRewriteTests {
    static QueryCompiler lenientCompiler() {
        return new QueryCompiler(new CompilerOptions());
    }

    @Test
    public void testRewrite() {
        QueryCompiler compiler = lenientCompiler();
        LQParameterExpression d = dto("d");
        LQExpression result = compiler.rewrite(d.member(PROP), List.of(d), List.of(dtoInit5()));
        Assert.assertNotNull(result);
        Assert.assertEquals("5", result.toString());
        Assert.assertFalse(compiler.hasErrors());
    }

    @Test
    public void testRewriteWithInlining() {
        LQParameterExpression x = dto("x");
        LQParameterExpression p = dto("p");
        LQExpression tree = new LQLambdaExpression(x.member(PROP), x).call(p);

        QueryCompiler compiler = lenientCompiler();
        LQExpression result = compiler.rewrite(tree, List.of(p), List.of(dtoInit5()));
        Assert.assertNotNull(result);
        Assert.assertEquals("Invoke((x) => x.Prop, new Dto { Prop = 5 })", result.toString());

        compiler = lenientCompiler();
        compiler.options.languageOptions.inlineLambdas = true;
        result = compiler.rewrite(tree, List.of(p), List.of(dtoInit5()));
        Assert.assertNotNull(result);
        Assert.assertEquals("5", result.toString());
    }

    @Test
    public void testErrorIsReported() {
        // Replacing the test of a conditional with an integer produces an ill-typed tree
        LQParameterExpression c = bool("c");
        LQParameterExpression i = i32("i");
        LQExpression tree = new LQConditionalExpression(c, i, i.binary(LQOpcode.ADD, i));

        QueryCompiler compiler = lenientCompiler();
        LQExpression result = compiler.rewrite(tree, List.of(c), List.of(i));
        Assert.assertNull(result);
        Assert.assertTrue(compiler.hasErrors());
        Assert.assertEquals(1, compiler.messages.errorCount());
        Assert.assertEquals(1, compiler.messages.exitCode);
    }

    @Test
    public void testErrorIsThrown() {
        LQParameterExpression c = bool("c");
        LQParameterExpression i = i32("i");
        LQExpression tree = new LQConditionalExpression(c, i, i);
        QueryCompiler compiler = this.testCompiler();
        Assert.assertThrows(InternalCompilerError.class,
                () -> compiler.rewrite(tree, List.of(c), List.of(i)));
    }

    @Test
    public void testDefaultOptions() {
        QueryCompiler compiler = new QueryCompiler();
        Assert.assertFalse(compiler.options.languageOptions.throwOnError);
        Assert.assertFalse(compiler.options.languageOptions.inlineLambdas);
        Assert.assertFalse(compiler.options.languageOptions.noConditionalMemberPushdown);
        Assert.assertTrue(compiler.options.validate(compiler));
    }
}
