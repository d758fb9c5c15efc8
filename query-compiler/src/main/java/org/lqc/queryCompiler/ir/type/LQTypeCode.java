package org.lqc.queryCompiler.ir.type;

public enum LQTypeCode {
    // Value kinds; these have a distinct nullable form
    BOOL("bool", true),
    INT32("int", true),
    INT64("long", true),
    DOUBLE("double", true),
    DECIMAL("decimal", true),
    DATE("date", true),
    TIMESTAMP("timestamp", true),
    // Reference kinds; these always admit null
    STRING("string", false),
    ANY("object", false),
    STRUCT("struct", false),
    GROUPING("IGrouping", false),
    FUNCTION("Func", false);

    public final String shortName;
    /** True for kinds whose values cannot be null unless the type is made nullable. */
    public final boolean isValueKind;

    LQTypeCode(String shortName, boolean isValueKind) {
        this.shortName = shortName;
        this.isValueKind = isValueKind;
    }

    @Override
    public String toString() {
        return this.shortName;
    }
}
