package org.lqc.queryCompiler.compiler.ir;

import org.lqc.queryCompiler.compiler.visitors.inner.EquivalenceContext;
import org.lqc.queryCompiler.ir.LQMember;
import org.lqc.queryCompiler.ir.expression.LQConstantExpression;
import org.lqc.queryCompiler.ir.expression.LQExpression;
import org.lqc.queryCompiler.ir.expression.LQLambdaExpression;
import org.lqc.queryCompiler.ir.expression.LQMethodCallExpression;
import org.lqc.queryCompiler.ir.expression.LQNewExpression;
import org.lqc.queryCompiler.ir.expression.LQOpcode;
import org.lqc.queryCompiler.ir.expression.LQParameterExpression;
import org.lqc.queryCompiler.ir.type.LQType;
import org.lqc.queryCompiler.ir.type.derived.LQTypeStruct;
import org.lqc.queryCompiler.ir.type.primitive.LQTypeBaseType;
import org.junit.Assert;
import org.junit.Test;

/** Unit tests for expression equivalence */
public class EquivalenceTests extends BaseRewriteTests {
    @Test
    public void testStructuralEquality() {
        LQExpression left = dto("d").member(PROP).binary(LQOpcode.ADD, new LQConstantExpression(1));
        LQExpression right = dto("d").member(DTO.member("Prop")).binary(LQOpcode.ADD, new LQConstantExpression(1));
        Assert.assertNotSame(left, right);
        Assert.assertTrue(left.equivalent(right));
        Assert.assertTrue(right.equivalent(left));

        LQExpression other = dto("d").member(PROP).binary(LQOpcode.ADD, new LQConstantExpression(2));
        Assert.assertFalse(left.equivalent(other));
        other = dto("e").member(PROP).binary(LQOpcode.ADD, new LQConstantExpression(1));
        Assert.assertFalse(left.equivalent(other));
        other = dto("d").member(PROP).binary(LQOpcode.SUB, new LQConstantExpression(1));
        Assert.assertFalse(left.equivalent(other));
    }

    @Test
    public void testConstants() {
        Assert.assertTrue(new LQConstantExpression(1).equivalent(new LQConstantExpression(1)));
        Assert.assertFalse(new LQConstantExpression(1).equivalent(new LQConstantExpression(1L)));
        Assert.assertFalse(new LQConstantExpression("1").equivalent(new LQConstantExpression(1)));
        LQType nullableInt = LQTypeBaseType.INT32.makeNullable();
        Assert.assertTrue(LQConstantExpression.nullOf(nullableInt).equivalent(LQConstantExpression.nullOf(nullableInt)));
        Assert.assertFalse(LQConstantExpression.nullOf(nullableInt).equivalent(LQConstantExpression.nullOf(DTO)));
    }

    @Test
    public void testParameterTypes() {
        LQParameterExpression x = i32("x");
        LQParameterExpression xl = new LQParameterExpression("x", LQTypeBaseType.INT64);
        Assert.assertFalse(x.equivalent(xl));
        Assert.assertTrue(x.equivalent(i32("x")));
    }

    @Test
    public void testMembers() {
        // Members are compared by declaring type and name
        LQTypeStruct other = new LQTypeStruct("Other", new LQTypeStruct.Field("Prop", LQTypeBaseType.INT32));
        LQMember otherProp = other.member("Prop");
        Assert.assertNotEquals(PROP, otherProp);
        Assert.assertEquals(PROP, DTO.member("Prop"));
        Assert.assertEquals(PROP.hashCode(), DTO.member("Prop").hashCode());
        LQParameterExpression d = dto("d");
        Assert.assertFalse(d.member(PROP).equivalent(d.member(otherProp)));
    }

    @Test
    public void testConstructions() {
        LQExpression x = i32("x");
        LQExpression y = new LQConstantExpression("y");
        LQNewExpression anon = LQNewExpression.anonymous(ANON, x, y);
        Assert.assertTrue(anon.equivalent(LQNewExpression.anonymous(ANON, i32("x"), new LQConstantExpression("y"))));
        Assert.assertFalse(anon.equivalent(LQNewExpression.anonymous(ANON, i32("z"), y)));
        Assert.assertTrue(dtoInit5().equivalent(dtoInit5()));
        Assert.assertFalse(dtoInit5().equivalent(dtoInit(new LQConstantExpression(5), y)));
    }

    @Test
    public void testAccessorCalls() {
        LQParameterExpression d = dto("d");
        LQExpression call = LQMethodCallExpression.property(d, "Prop", LQTypeBaseType.INT32);
        Assert.assertTrue(call.equivalent(LQMethodCallExpression.property(dto("d"), "Prop", LQTypeBaseType.INT32)));
        Assert.assertFalse(call.equivalent(LQMethodCallExpression.property(d, "Name", LQTypeBaseType.INT32)));
        Assert.assertFalse(call.equivalent(d.member(PROP)));
    }

    @Test
    public void testLambdas() {
        // (a) => a.Prop + 1 is the same as (b) => b.Prop + 1
        LQParameterExpression a = dto("a");
        LQParameterExpression b = dto("b");
        LQLambdaExpression left = new LQLambdaExpression(
                a.member(PROP).binary(LQOpcode.ADD, new LQConstantExpression(1)), a);
        LQLambdaExpression right = new LQLambdaExpression(
                b.member(PROP).binary(LQOpcode.ADD, new LQConstantExpression(1)), b);
        Assert.assertTrue(left.equivalent(right));

        // (a, b) => a.Prop - b.Prop is not the same as (b, a) => a.Prop - b.Prop
        LQLambdaExpression ab = new LQLambdaExpression(
                a.member(PROP).binary(LQOpcode.SUB, b.member(PROP)), a, b);
        LQLambdaExpression ba = new LQLambdaExpression(
                a.member(PROP).binary(LQOpcode.SUB, b.member(PROP)), b, a);
        Assert.assertFalse(ab.equivalent(ba));
        Assert.assertTrue(ab.equivalent(new LQLambdaExpression(
                b.member(PROP).binary(LQOpcode.SUB, a.member(PROP)), b, a)));

        // A bound parameter is different from a free one with the same name
        LQLambdaExpression free = new LQLambdaExpression(a.member(PROP), b);
        LQLambdaExpression bound = new LQLambdaExpression(b.member(PROP), b);
        Assert.assertFalse(bound.equivalent(free));
        Assert.assertFalse(free.equivalent(bound));
    }

    @Test
    public void testNulls() {
        EquivalenceContext context = new EquivalenceContext();
        Assert.assertTrue(context.equivalent((LQExpression) null, null));
        Assert.assertFalse(context.equivalent(i32("x"), null));
        Assert.assertFalse(context.equivalent(null, i32("x")));
    }
}
