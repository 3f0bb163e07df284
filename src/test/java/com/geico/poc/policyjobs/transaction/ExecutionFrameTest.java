package com.geico.poc.policyjobs.transaction;

import com.geico.poc.policyjobs.MutableClock;
import com.geico.poc.policyjobs.errors.ErrorCode;
import com.geico.poc.policyjobs.errors.JobException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for transaction framing: a frame releases exactly what it acquired,
 * even when the framed work commits on its own.
 */
public class ExecutionFrameTest {

    private LocalTransactionContext tx;

    @BeforeEach
    public void setup() {
        tx = new LocalTransactionContext(new MutableClock(Instant.parse("2024-01-01T00:00:00Z")));
    }

    // ========================================
    // Ownership
    // ========================================

    @Test
    public void testFrameOpensAndCommitsWhenNothingIsOpen() {
        try (ExecutionFrame frame = ExecutionFrame.enter(tx)) {
            assertTrue(frame.ownsTransaction());
            assertTrue(frame.ownsSnapshot());
            assertTrue(tx.isTransactionOpen());
            assertEquals(1, tx.getActiveSnapshotDepth());
            frame.complete();
        }

        assertEquals(TransactionState.COMMITTED, tx.getState());
        assertEquals(0, tx.getActiveSnapshotDepth());
        assertEquals(1, tx.getCommitCount());
    }

    @Test
    public void testFrameRollsBackWithoutComplete() {
        assertThrows(IllegalArgumentException.class, () -> {
            try (ExecutionFrame frame = ExecutionFrame.enter(tx)) {
                throw new IllegalArgumentException("boom");
            }
        });

        assertEquals(TransactionState.ABORTED, tx.getState());
        assertEquals(0, tx.getCommitCount());
        assertEquals(1, tx.getRollbackCount());
    }

    @Test
    public void testFrameLeavesCallerTransactionAlone() {
        tx.begin();
        tx.pushActiveSnapshot(tx.getTransactionSnapshot());

        try (ExecutionFrame frame = ExecutionFrame.enter(tx)) {
            assertFalse(frame.ownsTransaction());
            assertFalse(frame.ownsSnapshot());
            frame.complete();
        }

        assertTrue(tx.isTransactionOpen());
        assertEquals(1, tx.getActiveSnapshotDepth());
        assertEquals(0, tx.getCommitCount());
    }

    @Test
    public void testFramePushesSnapshotIntoCallerTransaction() {
        tx.begin();

        try (ExecutionFrame frame = ExecutionFrame.enter(tx)) {
            assertFalse(frame.ownsTransaction());
            assertTrue(frame.ownsSnapshot());
            frame.complete();
        }

        assertTrue(tx.isTransactionOpen());
        assertEquals(0, tx.getActiveSnapshotDepth());
    }

    // ========================================
    // Work that commits on its own
    // ========================================

    @Test
    public void testWorkThatCommitsDoesNotCauseDoubleRelease() {
        try (ExecutionFrame frame = ExecutionFrame.enter(tx)) {
            tx.commitAndChain();
            // the snapshot the frame pushed is gone, a new transaction is open
            assertFalse(tx.hasActiveSnapshot());
            assertTrue(tx.isTransactionOpen());
            frame.complete();
        }

        assertEquals(TransactionState.COMMITTED, tx.getState());
        assertEquals(2, tx.getCommitCount());
        assertEquals(2, tx.getTransactionCount());
        assertEquals(0, tx.getRollbackCount());
    }

    @Test
    public void testWorkThatCommitsInCallerTransactionLeavesNewTransactionOpen() {
        tx.begin();

        try (ExecutionFrame frame = ExecutionFrame.enter(tx)) {
            tx.commitAndChain();
            frame.complete();
        }

        assertTrue(tx.isTransactionOpen());
        assertEquals(1, tx.getCommitCount());
        assertEquals(0, tx.getActiveSnapshotDepth());
    }

    // ========================================
    // Context rules
    // ========================================

    @Test
    public void testAtomicContextCannotCommit() {
        tx.begin();
        tx.setAtomic(true);

        JobException e = assertThrows(JobException.class, tx::commitAndChain);
        assertEquals(ErrorCode.INVALID_TRANSACTION_TERMINATION, e.getCode());
        assertTrue(tx.isTransactionOpen());
    }

    @Test
    public void testTransactionBlockCannotCommitFromInside() {
        tx.beginBlock();

        JobException e = assertThrows(JobException.class, tx::commitAndChain);
        assertEquals(ErrorCode.INVALID_TRANSACTION_TERMINATION, e.getCode());
    }

    @Test
    public void testMisuseIsRejected() {
        assertThrows(IllegalStateException.class, tx::commit);
        assertThrows(IllegalStateException.class, tx::popActiveSnapshot);

        tx.begin();
        assertThrows(IllegalStateException.class, tx::begin);
    }
}
