package com.geico.poc.policyjobs.transaction;

/**
 * Scoped transaction and snapshot acquisition around one job execution.
 *
 * On entry the frame opens a transaction and pushes a snapshot only when the
 * context has none, and remembers which of the two it owns. On close it pops
 * its snapshot only if that snapshot is still active (the callable may have
 * committed, which drops all snapshots), and ends the transaction only if it
 * opened it: commit after {@link #complete()}, rollback otherwise.
 */
public final class ExecutionFrame implements AutoCloseable {

    private final TransactionContext tx;
    private final boolean ownsTransaction;
    private final boolean ownsSnapshot;
    private boolean completed;

    private ExecutionFrame(TransactionContext tx, boolean ownsTransaction, boolean ownsSnapshot) {
        this.tx = tx;
        this.ownsTransaction = ownsTransaction;
        this.ownsSnapshot = ownsSnapshot;
    }

    public static ExecutionFrame enter(TransactionContext tx) {
        boolean startedTransaction = false;
        if (!tx.isTransactionOpen()) {
            tx.begin();
            startedTransaction = true;
        }

        boolean pushedSnapshot = false;
        try {
            if (!tx.hasActiveSnapshot()) {
                tx.pushActiveSnapshot(tx.getTransactionSnapshot());
                pushedSnapshot = true;
            }
        } catch (RuntimeException e) {
            if (startedTransaction) {
                tx.rollback();
            }
            throw e;
        }
        return new ExecutionFrame(tx, startedTransaction, pushedSnapshot);
    }

    /**
     * Mark the framed work as successful so that close commits.
     */
    public void complete() {
        completed = true;
    }

    public boolean ownsTransaction() {
        return ownsTransaction;
    }

    public boolean ownsSnapshot() {
        return ownsSnapshot;
    }

    @Override
    public void close() {
        if (ownsSnapshot && tx.hasActiveSnapshot()) {
            tx.popActiveSnapshot();
        }
        if (ownsTransaction && tx.isTransactionOpen()) {
            if (completed) {
                tx.commit();
            } else {
                tx.rollback();
            }
        }
    }
}
