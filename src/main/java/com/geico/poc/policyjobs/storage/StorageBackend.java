package com.geico.poc.policyjobs.storage;

import com.geico.poc.policyjobs.transaction.TransactionContext;

import java.util.List;

/**
 * Maintenance actions the policies perform against the storage layer.
 */
public interface StorageBackend {

    /**
     * Drop every chunk of a hypertable, or of the hypertable behind a
     * continuous aggregate view, whose data lies entirely before {@code olderThan}.
     *
     * @return the chunks that were dropped
     */
    List<Chunk> dropChunks(RelationName relation, long olderThan, PartitioningType boundaryType);

    void compressChunk(Chunk chunk);

    /**
     * Rewrite a chunk in the order of an index on its hypertable.
     */
    void reorderChunk(Chunk chunk, IndexMetadata index);

    /**
     * Refresh a continuous aggregate over a window. The refresh commits its
     * own work, so it needs a non-atomic transaction context.
     */
    void refreshContinuousAggregate(ContinuousAggregate cagg, RefreshWindow window, TransactionContext tx);

    /**
     * Get the backend type name for logging
     */
    String getBackendType();
}
