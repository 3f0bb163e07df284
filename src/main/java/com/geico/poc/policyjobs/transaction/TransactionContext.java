package com.geico.poc.policyjobs.transaction;

import java.time.Instant;

/**
 * Transaction and snapshot state of one session, passed explicitly to
 * everything that runs inside it.
 *
 * A context is confined to one thread at a time.
 */
public interface TransactionContext {

    boolean isTransactionOpen();

    /**
     * Whether the open transaction is an explicit block started by the
     * client, as opposed to one started implicitly for a single command.
     */
    boolean isInTransactionBlock();

    void begin();

    void commit();

    void rollback();

    /**
     * Commit from inside a running procedure: drop the active snapshots,
     * commit the current transaction and immediately start a new one.
     *
     * @throws com.geico.poc.policyjobs.errors.JobException with
     *         INVALID_TRANSACTION_TERMINATION when the context is atomic
     */
    void commitAndChain();

    Instant getTransactionStartTimestamp();

    /**
     * The snapshot of the open transaction.
     */
    Snapshot getTransactionSnapshot();

    boolean hasActiveSnapshot();

    void pushActiveSnapshot(Snapshot snapshot);

    void popActiveSnapshot();

    /**
     * Atomic contexts (functions, explicit transaction blocks) may not commit.
     */
    boolean isAtomic();

    /**
     * @return the previous setting
     */
    boolean setAtomic(boolean atomic);
}
