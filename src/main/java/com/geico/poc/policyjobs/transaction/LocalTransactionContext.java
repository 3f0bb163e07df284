package com.geico.poc.policyjobs.transaction;

import com.geico.poc.policyjobs.errors.ErrorCode;
import com.geico.poc.policyjobs.errors.JobException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process transaction context.
 *
 * Tracks the transaction lifecycle and the stack of active snapshots, and
 * rejects misuse (committing without a transaction, popping a snapshot that
 * is not there) instead of ignoring it.
 */
public class LocalTransactionContext implements TransactionContext {

    private static final Logger log = LoggerFactory.getLogger(LocalTransactionContext.class);
    private static final AtomicLong SNAPSHOT_IDS = new AtomicLong();

    private final Clock clock;
    private final Deque<Snapshot> activeSnapshots = new ArrayDeque<>();

    private TransactionState state = TransactionState.NONE;
    private boolean inBlock;
    private boolean atomic;
    private Instant startTimestamp;
    private Snapshot transactionSnapshot;

    private int transactionCount;
    private int commitCount;
    private int rollbackCount;

    public LocalTransactionContext(Clock clock) {
        this.clock = clock;
    }

    @Override
    public boolean isTransactionOpen() {
        return state == TransactionState.ACTIVE;
    }

    @Override
    public boolean isInTransactionBlock() {
        return isTransactionOpen() && inBlock;
    }

    @Override
    public void begin() {
        if (isTransactionOpen()) {
            throw new IllegalStateException("there is already a transaction in progress");
        }
        state = TransactionState.ACTIVE;
        inBlock = false;
        startTimestamp = clock.instant();
        transactionSnapshot = new Snapshot(SNAPSHOT_IDS.incrementAndGet(), startTimestamp);
        transactionCount++;
    }

    /**
     * Start an explicit transaction block, like BEGIN from a client.
     */
    public void beginBlock() {
        begin();
        inBlock = true;
    }

    @Override
    public void commit() {
        requireOpen("commit");
        if (!activeSnapshots.isEmpty()) {
            log.warn("Snapshot reference leak: {} active snapshot(s) still set at commit", activeSnapshots.size());
            activeSnapshots.clear();
        }
        end(TransactionState.COMMITTED);
        commitCount++;
    }

    @Override
    public void rollback() {
        requireOpen("rollback");
        activeSnapshots.clear();
        end(TransactionState.ABORTED);
        rollbackCount++;
    }

    @Override
    public void commitAndChain() {
        if (atomic || isInTransactionBlock()) {
            throw new JobException(ErrorCode.INVALID_TRANSACTION_TERMINATION, "invalid transaction termination");
        }
        requireOpen("commit");
        activeSnapshots.clear();
        commit();
        begin();
    }

    @Override
    public Instant getTransactionStartTimestamp() {
        requireOpen("read the transaction start time");
        return startTimestamp;
    }

    @Override
    public Snapshot getTransactionSnapshot() {
        requireOpen("take a snapshot");
        return transactionSnapshot;
    }

    @Override
    public boolean hasActiveSnapshot() {
        return !activeSnapshots.isEmpty();
    }

    @Override
    public void pushActiveSnapshot(Snapshot snapshot) {
        requireOpen("push a snapshot");
        activeSnapshots.push(snapshot);
    }

    @Override
    public void popActiveSnapshot() {
        if (activeSnapshots.isEmpty()) {
            throw new IllegalStateException("no active snapshot to pop");
        }
        activeSnapshots.pop();
    }

    @Override
    public boolean isAtomic() {
        return atomic;
    }

    @Override
    public boolean setAtomic(boolean atomic) {
        boolean previous = this.atomic;
        this.atomic = atomic;
        return previous;
    }

    public TransactionState getState() {
        return state;
    }

    public int getTransactionCount() {
        return transactionCount;
    }

    public int getCommitCount() {
        return commitCount;
    }

    public int getRollbackCount() {
        return rollbackCount;
    }

    public int getActiveSnapshotDepth() {
        return activeSnapshots.size();
    }

    private void end(TransactionState endState) {
        state = endState;
        inBlock = false;
        transactionSnapshot = null;
    }

    private void requireOpen(String action) {
        if (!isTransactionOpen()) {
            throw new IllegalStateException("cannot " + action + ": there is no transaction in progress");
        }
    }

    @Override
    public String toString() {
        return "LocalTransactionContext{state=" + state +
               ", block=" + inBlock +
               ", atomic=" + atomic +
               ", snapshots=" + activeSnapshots.size() +
               ", commits=" + commitCount +
               '}';
    }
}
