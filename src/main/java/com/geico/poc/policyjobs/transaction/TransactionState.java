package com.geico.poc.policyjobs.transaction;

/**
 * Transaction state enum
 */
public enum TransactionState {
    NONE,       // No transaction started yet
    ACTIVE,     // Transaction in progress
    COMMITTED,  // Last transaction committed
    ABORTED     // Last transaction rolled back
}
