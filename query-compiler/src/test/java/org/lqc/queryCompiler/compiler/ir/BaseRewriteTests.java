package org.lqc.queryCompiler.compiler.ir;

import org.lqc.queryCompiler.compiler.CompilerOptions;
import org.lqc.queryCompiler.compiler.QueryCompiler;
import org.lqc.queryCompiler.ir.LQMember;
import org.lqc.queryCompiler.ir.expression.LQConstantExpression;
import org.lqc.queryCompiler.ir.expression.LQExpression;
import org.lqc.queryCompiler.ir.expression.LQMemberAssignment;
import org.lqc.queryCompiler.ir.expression.LQMemberInitExpression;
import org.lqc.queryCompiler.ir.expression.LQNewExpression;
import org.lqc.queryCompiler.ir.expression.LQParameterExpression;
import org.lqc.queryCompiler.ir.type.derived.LQTypeStruct;
import org.lqc.queryCompiler.ir.type.primitive.LQTypeBaseType;

/** Types and expressions shared by the rewriting tests. */
public abstract class BaseRewriteTests {
    /** class Dto { int Prop; string Name; } */
    public static final LQTypeStruct DTO = new LQTypeStruct("Dto",
            new LQTypeStruct.Field("Prop", LQTypeBaseType.INT32),
            new LQTypeStruct.Field("Name", LQTypeBaseType.STRING));
    /** new { int A, string B } */
    public static final LQTypeStruct ANON = new LQTypeStruct("Anon",
            new LQTypeStruct.Field("A", LQTypeBaseType.INT32),
            new LQTypeStruct.Field("B", LQTypeBaseType.STRING));

    public static final LQMember PROP = DTO.member("Prop");
    public static final LQMember NAME = DTO.member("Name");
    public static final LQMember A = ANON.member("A");
    public static final LQMember B = ANON.member("B");

    public QueryCompiler testCompiler() {
        CompilerOptions options = new CompilerOptions();
        options.languageOptions.throwOnError = true;
        return new QueryCompiler(options);
    }

    public static LQParameterExpression dto(String name) {
        return new LQParameterExpression(name, DTO);
    }

    public static LQParameterExpression bool(String name) {
        return new LQParameterExpression(name, LQTypeBaseType.BOOL);
    }

    public static LQParameterExpression i32(String name) {
        return new LQParameterExpression(name, LQTypeBaseType.INT32);
    }

    /** new Dto { Prop = prop, Name = name } */
    public static LQMemberInitExpression dtoInit(LQExpression prop, LQExpression name) {
        return new LQMemberInitExpression(new LQNewExpression(DTO),
                new LQMemberAssignment(PROP, prop),
                new LQMemberAssignment(NAME, name));
    }

    /** new Dto { Prop = 5 } */
    public static LQMemberInitExpression dtoInit5() {
        return new LQMemberInitExpression(new LQNewExpression(DTO),
                new LQMemberAssignment(PROP, new LQConstantExpression(5)));
    }
}
