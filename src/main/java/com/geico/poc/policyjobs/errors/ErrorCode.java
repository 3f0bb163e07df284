package com.geico.poc.policyjobs.errors;

/**
 * Error classes reported by the job engine.
 * Each code carries the SQLSTATE the database uses for the same condition.
 */
public enum ErrorCode {
    INVALID_PARAMETER("22023"),
    UNDEFINED_OBJECT("42704"),
    INSUFFICIENT_PRIVILEGE("42501"),
    FEATURE_NOT_SUPPORTED("0A000"),
    READ_ONLY_TRANSACTION("25006"),
    INVALID_TRANSACTION_TERMINATION("2D000"),
    INTERNAL("XX000");

    private final String sqlState;

    ErrorCode(String sqlState) {
        this.sqlState = sqlState;
    }

    public String getSqlState() {
        return sqlState;
    }
}
