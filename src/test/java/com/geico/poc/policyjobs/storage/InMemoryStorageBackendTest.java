package com.geico.poc.policyjobs.storage;

import com.geico.poc.policyjobs.MutableClock;
import com.geico.poc.policyjobs.errors.ErrorCode;
import com.geico.poc.policyjobs.errors.JobException;
import com.geico.poc.policyjobs.transaction.LocalTransactionContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the in-memory catalog queries and storage actions.
 */
public class InMemoryStorageBackendTest {

    private InMemoryStorageBackend storage;
    private Hypertable metrics;
    private int timeDim;

    @BeforeEach
    public void setup() {
        storage = new InMemoryStorageBackend();
        metrics = storage.createHypertable("public", "metrics", "ts", PartitioningType.BIGINT);
        timeDim = metrics.getTimeDimension().getId();
    }

    // ========================================
    // Slice queries
    // ========================================

    @Test
    public void testNthLatestSlice() {
        storage.createChunk(metrics.getId(), 0, 10);
        storage.createChunk(metrics.getId(), 10, 20);
        storage.createChunk(metrics.getId(), 20, 30);

        assertEquals(20, storage.nthLatestSlice(timeDim, 1).getRangeStart());
        assertEquals(0, storage.nthLatestSlice(timeDim, 3).getRangeStart());
        assertNull(storage.nthLatestSlice(timeDim, 4));
    }

    @Test
    public void testSpaceChunksShareTimeSlices() {
        Hypertable ht = storage.createHypertable("public", "by_device", "ts", PartitioningType.BIGINT);
        storage.addSpaceDimension(ht.getId(), "device");
        int dim = ht.getTimeDimension().getId();

        Chunk a = storage.createChunk(ht.getId(), 0, 10, 0, 100);
        Chunk b = storage.createChunk(ht.getId(), 0, 10, 100, 200);
        storage.createChunk(ht.getId(), 10, 20, 0, 100);

        assertSame(a.getSlice(dim), b.getSlice(dim));
        // two distinct time slices even though there are three chunks
        assertNotNull(storage.nthLatestSlice(dim, 2));
        assertNull(storage.nthLatestSlice(dim, 3));
    }

    @Test
    public void testDroppedChunksDoNotCount() {
        storage.createChunk(metrics.getId(), 0, 10);
        storage.createChunk(metrics.getId(), 10, 20);

        storage.dropChunks(metrics.getRelationName(), 10, PartitioningType.BIGINT);

        assertNull(storage.nthLatestSlice(timeDim, 2));
    }

    @Test
    public void testChunkToCompressTieBreak() {
        Hypertable ht = storage.createHypertable("public", "sensors", "ts", PartitioningType.BIGINT);
        storage.addSpaceDimension(ht.getId(), "sensor");
        int dim = ht.getTimeDimension().getId();

        storage.createChunk(ht.getId(), 10, 20, 0, 100);
        Chunk first = storage.createChunk(ht.getId(), 0, 10, 0, 100);
        Chunk second = storage.createChunk(ht.getId(), 0, 10, 100, 200);

        assertEquals(first.getId(), storage.chunkToCompress(dim, 100).getId());
        storage.enableCompression(ht.getId());
        storage.compressChunk(first);
        assertEquals(second.getId(), storage.chunkToCompress(dim, 100).getId());
        // strictly before: a chunk ending at the boundary does not qualify
        assertNull(storage.chunkToCompress(dim, 10));
    }

    @Test
    public void testOldestChunkForReorderSkipsProcessedChunks() {
        Chunk oldest = storage.createChunk(metrics.getId(), 0, 10);
        Chunk next = storage.createChunk(metrics.getId(), 10, 20);

        assertEquals(oldest.getId(), storage.oldestChunkForReorder(7, timeDim, 20).getId());

        storage.recordJobRun(7, oldest.getId(), Instant.EPOCH);
        assertEquals(next.getId(), storage.oldestChunkForReorder(7, timeDim, 20).getId());
        // other jobs keep their own history
        assertEquals(oldest.getId(), storage.oldestChunkForReorder(8, timeDim, 20).getId());
        assertNull(storage.oldestChunkForReorder(7, timeDim, 10));
    }

    // ========================================
    // Actions
    // ========================================

    @Test
    public void testDropChunksBoundary() {
        storage.createChunk(metrics.getId(), 0, 10);
        storage.createChunk(metrics.getId(), 10, 20);
        storage.createChunk(metrics.getId(), 20, 30);

        List<Chunk> dropped = storage.dropChunks(metrics.getRelationName(), 20, PartitioningType.BIGINT);

        assertEquals(2, dropped.size());
        assertEquals(1, storage.getChunks(metrics.getId()).stream().filter(c -> !c.isDropped()).count());
    }

    @Test
    public void testDropChunksRejectsWrongTypeAndUnknownRelation() {
        JobException e = assertThrows(JobException.class, () ->
            storage.dropChunks(metrics.getRelationName(), 20, PartitioningType.TIMESTAMPTZ));
        assertEquals(ErrorCode.INVALID_PARAMETER, e.getCode());

        e = assertThrows(JobException.class, () ->
            storage.dropChunks(new RelationName("public", "missing"), 20, PartitioningType.BIGINT));
        assertEquals(ErrorCode.UNDEFINED_OBJECT, e.getCode());
    }

    @Test
    public void testDropThroughContinuousAggregateView() {
        ContinuousAggregate cagg = storage.createContinuousAggregate(metrics.getId(), "public", "metrics_hourly");
        Hypertable mat = storage.getHypertableById(cagg.getMatHypertableId());
        storage.createChunk(mat.getId(), 0, 10);

        assertThrows(JobException.class, () ->
            storage.dropChunks(mat.getRelationName(), 100, PartitioningType.BIGINT));

        List<Chunk> dropped = storage.dropChunks(cagg.getUserView(), 100, PartitioningType.BIGINT);
        assertEquals(1, dropped.size());
    }

    @Test
    public void testCompressRequiresCompressionEnabled() {
        Chunk chunk = storage.createChunk(metrics.getId(), 0, 10);

        JobException e = assertThrows(JobException.class, () -> storage.compressChunk(chunk));
        assertEquals(ErrorCode.FEATURE_NOT_SUPPORTED, e.getCode());

        storage.enableCompression(metrics.getId());
        storage.compressChunk(chunk);
        assertTrue(storage.getChunkById(chunk.getId()).isCompressed());
        assertThrows(JobException.class, () -> storage.compressChunk(chunk));
    }

    @Test
    public void testRefreshCommitsBetweenSteps() {
        ContinuousAggregate cagg = storage.createContinuousAggregate(metrics.getId(), "public", "metrics_daily");
        LocalTransactionContext tx = new LocalTransactionContext(new MutableClock(Instant.EPOCH));
        tx.begin();

        RefreshWindow window = RefreshWindow.of(PartitioningType.BIGINT, 0, 100);
        storage.refreshContinuousAggregate(cagg, window, tx);

        assertEquals(1, tx.getCommitCount());
        assertTrue(tx.isTransactionOpen());
        assertEquals(1, storage.getRefreshHistory(cagg.getMatHypertableId()).size());

        tx.setAtomic(true);
        JobException e = assertThrows(JobException.class, () -> storage.refreshContinuousAggregate(cagg, window, tx));
        assertEquals(ErrorCode.INVALID_TRANSACTION_TERMINATION, e.getCode());
    }
}
