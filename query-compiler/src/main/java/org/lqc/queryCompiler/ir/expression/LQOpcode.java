package org.lqc.queryCompiler.ir.expression;

public enum LQOpcode {
    EQ("==", true),
    NEQ("!=", true),
    LT("<", true),
    LTE("<=", true),
    GT(">", true),
    GTE(">=", true),
    AND("&&", false),
    OR("||", false),
    ADD("+", false),
    SUB("-", false),
    MUL("*", false),
    DIV("/", false),
    /** Returns the left operand if not null, else the right one. */
    COALESCE("??", false);

    public final String text;
    public final boolean isComparison;

    LQOpcode(String text, boolean isComparison) {
        this.text = text;
        this.isComparison = isComparison;
    }

    @Override
    public String toString() {
        return this.text;
    }
}
