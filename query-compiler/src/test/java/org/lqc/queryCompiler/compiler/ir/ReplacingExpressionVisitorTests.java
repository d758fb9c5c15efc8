package org.lqc.queryCompiler.compiler.ir;

import org.lqc.queryCompiler.compiler.CompilerOptions;
import org.lqc.queryCompiler.compiler.QueryCompiler;
import org.lqc.queryCompiler.compiler.visitors.inner.EquivalenceContext;
import org.lqc.queryCompiler.compiler.visitors.inner.ReplacingExpressionVisitor;
import org.lqc.queryCompiler.ir.LQMember;
import org.lqc.queryCompiler.ir.LQMethod;
import org.lqc.queryCompiler.ir.expression.LQBinaryExpression;
import org.lqc.queryCompiler.ir.expression.LQConditionalExpression;
import org.lqc.queryCompiler.ir.expression.LQConstantExpression;
import org.lqc.queryCompiler.ir.expression.LQConvertExpression;
import org.lqc.queryCompiler.ir.expression.LQExpression;
import org.lqc.queryCompiler.ir.expression.LQGroupByShaperExpression;
import org.lqc.queryCompiler.ir.expression.LQMemberAssignment;
import org.lqc.queryCompiler.ir.expression.LQMemberExpression;
import org.lqc.queryCompiler.ir.expression.LQMemberInitExpression;
import org.lqc.queryCompiler.ir.expression.LQMethodCallExpression;
import org.lqc.queryCompiler.ir.expression.LQNewExpression;
import org.lqc.queryCompiler.ir.expression.LQOpcode;
import org.lqc.queryCompiler.ir.expression.LQParameterExpression;
import org.lqc.queryCompiler.ir.type.derived.LQTypeStruct;
import org.lqc.queryCompiler.ir.type.primitive.LQTypeAny;
import org.lqc.queryCompiler.ir.type.primitive.LQTypeBaseType;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;

/** Tests for substitution and for the simplification of member reads. */
public class ReplacingExpressionVisitorTests extends BaseRewriteTests {
    LQExpression visit(LQExpression tree) {
        return this.visit(this.testCompiler(), tree);
    }

    /** Visit with no substitutions, so only the simplifications apply. */
    LQExpression visit(QueryCompiler compiler, LQExpression tree) {
        ReplacingExpressionVisitor visitor = new ReplacingExpressionVisitor(compiler, List.of(), List.of());
        LQExpression result = visitor.visit(tree);
        Assert.assertNotNull(result);
        return result;
    }

    LQExpression replace(LQExpression original, LQExpression replacement, LQExpression tree) {
        return ReplacingExpressionVisitor.replace(this.testCompiler(), original, replacement, tree);
    }

    @Test
    public void testNoMatchKeepsTree() {
        LQParameterExpression d = dto("d");
        LQExpression tree = d.member(PROP).binary(LQOpcode.ADD, new LQConstantExpression(1));
        LQExpression result = this.replace(i32("x"), i32("y"), tree);
        Assert.assertSame(tree, result);
    }

    @Test
    public void testSingleReplacement() {
        LQParameterExpression x = i32("x");
        LQParameterExpression y = i32("y");
        LQExpression one = new LQConstantExpression(1);
        LQExpression tree = x.binary(LQOpcode.ADD, one).binary(LQOpcode.MUL, i32("z"));
        LQExpression result = this.replace(x, y, tree);
        Assert.assertEquals("((y + 1) * z)", result.toString());
        LQBinaryExpression product = result.to(LQBinaryExpression.class);
        LQBinaryExpression sum = product.left.to(LQBinaryExpression.class);
        Assert.assertSame(y, sum.left);
        Assert.assertSame(one, sum.right);
        Assert.assertSame(tree.to(LQBinaryExpression.class).right, product.right);
    }

    @Test
    public void testStructuralMatch() {
        // A different object describing the same parameter
        LQExpression tree = i32("x").binary(LQOpcode.ADD, new LQConstantExpression(1));
        LQParameterExpression y = i32("y");
        LQExpression result = this.replace(i32("x"), y, tree);
        Assert.assertSame(y, result.to(LQBinaryExpression.class).left);
    }

    @Test
    public void testReplacementIsNotVisited() {
        LQParameterExpression x = i32("x");
        LQExpression replacement = x.binary(LQOpcode.ADD, new LQConstantExpression(1));
        LQExpression tree = x.binary(LQOpcode.MUL, new LQConstantExpression(2));
        LQExpression result = this.replace(x, replacement, tree);
        Assert.assertEquals("((x + 1) * 2)", result.toString());
        Assert.assertSame(replacement, result.to(LQBinaryExpression.class).left);
    }

    @Test
    public void testMatchedNodeIsNotVisited() {
        LQParameterExpression x = i32("x");
        LQExpression sum = x.binary(LQOpcode.ADD, new LQConstantExpression(1));
        LQParameterExpression a = i32("a");
        LQParameterExpression b = i32("b");
        LQExpression tree = sum.binary(LQOpcode.MUL, x);
        ReplacingExpressionVisitor visitor = new ReplacingExpressionVisitor(
                this.testCompiler(), List.of(sum, x), List.of(a, b));
        LQExpression result = visitor.visit(tree);
        Assert.assertNotNull(result);
        Assert.assertEquals("(a * b)", result.toString());
    }

    @Test
    public void testFirstMatchWins() {
        LQParameterExpression x = i32("x");
        LQParameterExpression a = i32("a");
        LQParameterExpression b = i32("b");
        ReplacingExpressionVisitor visitor = new ReplacingExpressionVisitor(
                this.testCompiler(), List.of(x, i32("x")), List.of(a, b));
        LQExpression result = visitor.visit(x.binary(LQOpcode.SUB, x));
        Assert.assertNotNull(result);
        Assert.assertEquals("(a - a)", result.toString());
    }

    @Test
    public void testMatchAtRoot() {
        LQParameterExpression x = i32("x");
        LQParameterExpression y = i32("y");
        Assert.assertSame(y, this.replace(x, y, x));
    }

    @Test
    public void testNullTree() {
        ReplacingExpressionVisitor visitor = new ReplacingExpressionVisitor(
                this.testCompiler(), List.of(i32("x")), List.of(i32("y")));
        Assert.assertNull(visitor.visit(null));
    }

    @Test
    public void testNullArguments() {
        LQParameterExpression x = i32("x");
        NullPointerException ex = Assert.assertThrows(NullPointerException.class,
                () -> ReplacingExpressionVisitor.replace(null, x, x));
        Assert.assertEquals("original", ex.getMessage());
        ex = Assert.assertThrows(NullPointerException.class,
                () -> ReplacingExpressionVisitor.replace(x, null, x));
        Assert.assertEquals("replacement", ex.getMessage());
        ex = Assert.assertThrows(NullPointerException.class,
                () -> ReplacingExpressionVisitor.replace(x, x, null));
        Assert.assertEquals("tree", ex.getMessage());
        ex = Assert.assertThrows(NullPointerException.class,
                () -> new ReplacingExpressionVisitor(this.testCompiler(), null, List.of()));
        Assert.assertEquals("originals", ex.getMessage());
        ex = Assert.assertThrows(NullPointerException.class,
                () -> new ReplacingExpressionVisitor(this.testCompiler(), List.of(), null));
        Assert.assertEquals("replacements", ex.getMessage());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testLengthMismatch() {
        new ReplacingExpressionVisitor(this.testCompiler(), List.of(i32("x")), List.of());
    }

    @Test
    public void testGroupingKey() {
        LQParameterExpression d = dto("d");
        LQExpression key = d.member(PROP);
        LQGroupByShaperExpression shaper = new LQGroupByShaperExpression(key, d);
        LQParameterExpression g = new LQParameterExpression("g", shaper.getType());
        LQMember keyMember = new LQMember(shaper.getType(), LQGroupByShaperExpression.KEY, LQTypeBaseType.INT32);
        LQExpression result = this.replace(g, shaper, g.member(keyMember));
        Assert.assertSame(key, result);
    }

    @Test
    public void testGroupingOtherMember() {
        LQParameterExpression d = dto("d");
        LQGroupByShaperExpression shaper = new LQGroupByShaperExpression(d.member(PROP), d);
        LQParameterExpression g = new LQParameterExpression("g", shaper.getType());
        LQMember count = new LQMember(shaper.getType(), "Count", LQTypeBaseType.INT32);
        LQExpression result = this.replace(g, shaper, g.member(count));
        LQMemberExpression member = result.to(LQMemberExpression.class);
        Assert.assertSame(shaper, member.expression);
        Assert.assertSame(count, member.member);
    }

    @Test
    public void testAnonymousConstruction() {
        LQParameterExpression x = i32("x");
        LQExpression y = new LQConstantExpression("y");
        LQNewExpression anon = LQNewExpression.anonymous(ANON, x, y);
        LQParameterExpression a = new LQParameterExpression("a", ANON);
        Assert.assertSame(y, this.replace(a, anon, a.member(B)));
        Assert.assertSame(x, this.replace(a, anon, a.member(A)));
        // An equal member described by a different object
        Assert.assertSame(y, this.replace(a, anon, a.member(ANON.member("B"))));
    }

    @Test
    public void testConstructionWithoutMembers() {
        LQNewExpression anon = new LQNewExpression(ANON, List.of(i32("x"), new LQConstantExpression("y")), null);
        LQExpression result = this.visit(anon.member(B));
        Assert.assertSame(anon, result.to(LQMemberExpression.class).expression);
    }

    @Test
    public void testMemberInit() {
        LQParameterExpression d = dto("d");
        LQConstantExpression five = new LQConstantExpression(5);
        LQConstantExpression name = new LQConstantExpression("n");
        LQMemberInitExpression init = dtoInit(five, name);
        Assert.assertSame(five, this.replace(d, init, d.member(PROP)));
        Assert.assertSame(name, this.replace(d, init, d.member(NAME)));
    }

    @Test
    public void testMemberInitUnderConversion() {
        LQParameterExpression d = dto("d");
        LQConstantExpression five = new LQConstantExpression(5);
        LQMemberInitExpression init = dtoInit(five, new LQConstantExpression("n"));
        LQExpression tree = d.convert(LQTypeAny.INSTANCE).convert(DTO).member(PROP);
        Assert.assertSame(five, this.replace(d, init, tree));
    }

    @Test
    public void testMemberInitWithoutBinding() {
        LQParameterExpression d = dto("d");
        LQMemberInitExpression init = dtoInit5();
        LQExpression result = this.replace(d, init, d.member(NAME));
        LQMemberExpression member = result.to(LQMemberExpression.class);
        Assert.assertSame(init, member.expression);
        Assert.assertEquals("new Dto { Prop = 5 }.Name", result.toString());
    }

    @Test
    public void testConditionalNullGuard() {
        LQParameterExpression c = bool("c");
        LQConditionalExpression conditional = new LQConditionalExpression(
                c, dtoInit5(), LQConstantExpression.nullOf(DTO));
        LQExpression result = this.visit(conditional.member(PROP));
        Assert.assertEquals("Convert((c ? Convert(new Dto { Prop = 5 }.Prop, int?) : null), int)",
                result.toString());

        LQConvertExpression back = result.to(LQConvertExpression.class);
        Assert.assertTrue(back.getType().sameType(LQTypeBaseType.INT32));
        LQConditionalExpression pushed = back.source.to(LQConditionalExpression.class);
        Assert.assertSame(c, pushed.test);
        Assert.assertTrue(pushed.getType().sameType(LQTypeBaseType.INT32.makeNullable()));
        Assert.assertTrue(pushed.ifTrue.is(LQConvertExpression.class));
        Assert.assertTrue(pushed.ifFalse.isNullConstant());
        Assert.assertTrue(pushed.ifFalse.getType().sameType(LQTypeBaseType.INT32.makeNullable()));
    }

    @Test
    public void testConditionalNullGuardReversed() {
        LQParameterExpression c = bool("c");
        LQConditionalExpression conditional = new LQConditionalExpression(
                c, LQConstantExpression.nullOf(DTO), dtoInit5());
        LQExpression result = this.visit(conditional.member(PROP));
        Assert.assertEquals("Convert((c ? null : Convert(new Dto { Prop = 5 }.Prop, int?)), int)",
                result.toString());
    }

    @Test
    public void testConditionalWithConvertedNull() {
        LQParameterExpression c = bool("c");
        LQExpression convertedNull = LQConstantExpression.nullOf(LQTypeAny.INSTANCE).convert(DTO);
        Assert.assertTrue(convertedNull.isNullConstant());

        LQParameterExpression d = dto("d");
        LQConditionalExpression conditional = new LQConditionalExpression(c, dtoInit5(), convertedNull);
        LQExpression result = this.replace(d, conditional, d.member(PROP));
        Assert.assertEquals("Convert((c ? Convert(new Dto { Prop = 5 }.Prop, int?) : null), int)",
                result.toString());

        conditional = new LQConditionalExpression(c, convertedNull, dtoInit5());
        Assert.assertTrue(conditional.getType().sameType(DTO));
        result = this.replace(d, conditional, d.member(PROP));
        Assert.assertEquals("Convert((c ? null : Convert(new Dto { Prop = 5 }.Prop, int?)), int)",
                result.toString());
    }

    @Test
    public void testConditionalNullGuardReferenceMember() {
        LQParameterExpression c = bool("c");
        LQConditionalExpression conditional = new LQConditionalExpression(
                c, dtoInit(new LQConstantExpression(5), new LQConstantExpression("n")),
                LQConstantExpression.nullOf(DTO));
        Assert.assertSame(LQTypeBaseType.STRING, LQTypeBaseType.STRING.makeNullable());
        Assert.assertSame(DTO, DTO.makeNullable());
        LQExpression result = this.visit(conditional.member(NAME));
        // Strings already admit null, so there is no conversion back
        LQConditionalExpression pushed = result.to(LQConditionalExpression.class);
        Assert.assertTrue(pushed.getType().sameType(LQTypeBaseType.STRING));
        Assert.assertEquals("(c ? Convert(new Dto { Prop = 5, Name = \"n\" }.Name, string) : null)",
                result.toString());
    }

    @Test
    public void testConditionalNullGuardNullableMember() {
        LQTypeBaseType nullableInt = LQTypeBaseType.create(LQTypeBaseType.INT32.code, true);
        LQMember member = new LQMember(DTO, "Prop", nullableInt);
        LQConditionalExpression conditional = new LQConditionalExpression(
                bool("c"), dtoInit5(), LQConstantExpression.nullOf(DTO));
        LQExpression result = this.visit(conditional.member(member));
        Assert.assertTrue(result.is(LQConditionalExpression.class));
        Assert.assertTrue(result.getType().sameType(nullableInt));
    }

    @Test
    public void testConditionalNullGuardDisabled() {
        CompilerOptions options = new CompilerOptions();
        options.languageOptions.noConditionalMemberPushdown = true;
        QueryCompiler compiler = new QueryCompiler(options);
        LQConditionalExpression conditional = new LQConditionalExpression(
                bool("c"), dtoInit5(), LQConstantExpression.nullOf(DTO));
        LQExpression tree = conditional.member(PROP);
        Assert.assertSame(tree, this.visit(compiler, tree));
    }

    @Test
    public void testConditionalWithoutNullBranch() {
        LQConditionalExpression conditional = new LQConditionalExpression(
                bool("c"), dtoInit5(), dto("d"));
        LQExpression tree = conditional.member(PROP);
        Assert.assertSame(tree, this.visit(tree));
    }

    @Test
    public void testConditionalRewrittenFromSubstitution() {
        LQParameterExpression d = dto("d");
        LQConditionalExpression conditional = new LQConditionalExpression(
                bool("c"), dtoInit5(), LQConstantExpression.nullOf(DTO));
        LQExpression result = this.replace(d, conditional, d.member(PROP).binary(LQOpcode.ADD, i32("x")));
        Assert.assertEquals("(Convert((c ? Convert(new Dto { Prop = 5 }.Prop, int?) : null), int) + x)",
                result.toString());
    }

    @Test
    public void testAccessorCall() {
        LQParameterExpression d = dto("d");
        LQConstantExpression five = new LQConstantExpression(5);
        LQConstantExpression name = new LQConstantExpression("n");
        LQMemberInitExpression init = dtoInit(five, name);
        LQExpression tree = LQMethodCallExpression.property(d, "Name", LQTypeBaseType.STRING);
        Assert.assertSame(name, this.replace(d, init, tree));

        LQExpression x = i32("x");
        LQNewExpression anon = LQNewExpression.anonymous(ANON, x, name);
        LQParameterExpression a = new LQParameterExpression("a", ANON);
        tree = LQMethodCallExpression.property(a, "A", LQTypeBaseType.INT32);
        Assert.assertSame(x, this.replace(a, anon, tree));
    }

    @Test
    public void testAccessorCallUnderConversion() {
        LQParameterExpression d = dto("d");
        LQConstantExpression five = new LQConstantExpression(5);
        LQMemberInitExpression init = dtoInit(five, new LQConstantExpression("n"));
        LQExpression tree = LQMethodCallExpression.property(
                d.convert(LQTypeAny.INSTANCE), "Prop", LQTypeBaseType.INT32);
        Assert.assertSame(five, this.replace(d, init, tree));
    }

    @Test
    public void testAccessorCallRebuilt() {
        LQParameterExpression d = dto("d");
        LQParameterExpression e = dto("e");
        LQMethodCallExpression tree = LQMethodCallExpression.property(d, "Prop", LQTypeBaseType.INT32);
        LQMethodCallExpression result = this.replace(d, e, tree).to(LQMethodCallExpression.class);
        Assert.assertSame(e, result.arguments.get(0));
        Assert.assertSame(tree.arguments.get(1), result.arguments.get(1));
        Assert.assertEquals("EF.Property(e, \"Prop\")", result.toString());

        // The member is not bound by the initialization
        LQMemberInitExpression init = dtoInit5();
        tree = LQMethodCallExpression.property(d, "Name", LQTypeBaseType.STRING);
        result = this.replace(d, init, tree).to(LQMethodCallExpression.class);
        Assert.assertSame(init, result.arguments.get(0));
    }

    @Test
    public void testAccessorCallAmbiguousName() {
        // Two members named X declared by different types
        LQTypeStruct base = new LQTypeStruct("Base", new LQTypeStruct.Field("X", LQTypeBaseType.INT32));
        LQTypeStruct derived = new LQTypeStruct("Derived", new LQTypeStruct.Field("X", LQTypeBaseType.INT32));
        LQMember baseX = new LQMember(base, "X", LQTypeBaseType.INT32);
        LQMember derivedX = new LQMember(derived, "X", LQTypeBaseType.INT32);
        LQConstantExpression one = new LQConstantExpression(1);
        LQMemberInitExpression init = new LQMemberInitExpression(new LQNewExpression(DTO),
                new LQMemberAssignment(baseX, one),
                new LQMemberAssignment(derivedX, new LQConstantExpression(2)));

        LQParameterExpression e = dto("e");
        LQMethodCallExpression tree = LQMethodCallExpression.property(e, "X", LQTypeBaseType.INT32);
        LQExpression result = this.replace(e, init, tree);
        LQMethodCallExpression call = result.to(LQMethodCallExpression.class);
        Assert.assertSame(init, call.arguments.get(0));
        Assert.assertSame(tree.arguments.get(1), call.arguments.get(1));

        // A member read names the declaring type, so it is not ambiguous
        Assert.assertSame(one, this.replace(e, init, e.member(baseX)));
    }

    @Test
    public void testOtherCallsVisitAllArguments() {
        LQParameterExpression d = dto("d");
        LQMemberInitExpression init = dtoInit5();
        LQParameterExpression n = new LQParameterExpression("n", LQTypeBaseType.STRING);
        // The property name is not a literal
        LQExpression tree = new LQMethodCallExpression(null, LQMethod.PROPERTY, List.of(d, n), LQTypeBaseType.INT32);
        LQMethodCallExpression result = this.replace(d, init, tree).to(LQMethodCallExpression.class);
        Assert.assertSame(init, result.arguments.get(0));
        Assert.assertSame(n, result.arguments.get(1));

        LQMethod length = new LQMethod("", "Length");
        tree = new LQMethodCallExpression(d.member(NAME), length, List.of(d.member(PROP)), LQTypeBaseType.INT32);
        LQParameterExpression e = dto("e");
        result = this.replace(d, e, tree).to(LQMethodCallExpression.class);
        Assert.assertEquals("e.Name.Length(e.Prop)", result.toString());
    }

    @Test
    public void testAccessorCallAndMemberReadAgree() {
        LQParameterExpression d = dto("d");
        LQMemberInitExpression init = dtoInit(new LQConstantExpression(5), new LQConstantExpression("n"));
        LQExpression viaMember = this.replace(d, init, d.member(PROP));
        LQExpression viaCall = this.replace(d, init,
                LQMethodCallExpression.property(d, "Prop", LQTypeBaseType.INT32));
        Assert.assertTrue(EquivalenceContext.equiv(viaMember, viaCall));

        LQParameterExpression a = new LQParameterExpression("a", ANON);
        LQNewExpression anon = LQNewExpression.anonymous(ANON, i32("x"), new LQConstantExpression("y"));
        viaMember = this.replace(a, anon, a.member(B));
        viaCall = this.replace(a, anon, LQMethodCallExpression.property(a, "B", LQTypeBaseType.STRING));
        Assert.assertTrue(EquivalenceContext.equiv(viaMember, viaCall));
    }

    @Test
    public void testNestedConstructions() {
        // new Dto { Prop = new Anon(A = x, B = "y").A }.Prop
        LQParameterExpression x = i32("x");
        LQNewExpression anon = LQNewExpression.anonymous(ANON, x, new LQConstantExpression("y"));
        LQExpression inner = anon.member(A);
        LQMemberInitExpression init = dtoInit(inner, new LQConstantExpression("n"));
        Assert.assertSame(x, this.visit(init.member(PROP)));

        // A replacement is not simplified
        LQParameterExpression d = dto("d");
        Assert.assertSame(inner, this.replace(d, init, d.member(PROP)));
    }

    @Test
    public void testNoMutation() {
        LQParameterExpression d = dto("d");
        LQConditionalExpression conditional = new LQConditionalExpression(
                bool("c"), dtoInit5(), LQConstantExpression.nullOf(DTO));
        LQExpression tree = d.member(PROP).binary(LQOpcode.ADD, d.member(PROP));
        String before = tree.toString();
        LQExpression copy = d.member(PROP).binary(LQOpcode.ADD, d.member(PROP));
        LQExpression result = this.replace(d, conditional, tree);
        Assert.assertNotSame(tree, result);
        Assert.assertEquals(before, tree.toString());
        Assert.assertTrue(EquivalenceContext.equiv(copy, tree));
        Assert.assertFalse(EquivalenceContext.equiv(tree, result));
    }

    @Test
    public void testDefaultCompiler() {
        LQParameterExpression d = dto("d");
        LQConstantExpression five = new LQConstantExpression(5);
        LQExpression result = ReplacingExpressionVisitor.replace(d, dtoInit(five, new LQConstantExpression("n")),
                d.member(PROP));
        Assert.assertSame(five, result);
    }
}
