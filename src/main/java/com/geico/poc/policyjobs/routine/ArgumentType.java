package com.geico.poc.policyjobs.routine;

/**
 * Argument types a routine signature can be declared with.
 */
public enum ArgumentType {
    INTEGER("integer"),
    BIGINT("bigint"),
    TEXT("text"),
    JSONB("jsonb"),
    INTERVAL("interval");

    private final String sqlName;

    ArgumentType(String sqlName) {
        this.sqlName = sqlName;
    }

    public String getSqlName() {
        return sqlName;
    }
}
