package com.geico.poc.policyjobs.storage;

/**
 * Read access to hypertable, chunk and continuous aggregate metadata.
 *
 * Lookups return null when the object does not exist; callers decide which
 * error to raise.
 */
public interface HypertableCatalog {

    Hypertable getHypertableById(int hypertableId);

    Hypertable getHypertableByName(RelationName name);

    Chunk getChunkById(int chunkId);

    /**
     * Find an index by name within a schema.
     */
    IndexMetadata findIndex(String schemaName, String indexName);

    /**
     * Reverse lookup of the continuous aggregate a materialization hypertable backs.
     */
    ContinuousAggregate findContinuousAggByMatHypertableId(int matHypertableId);

    ContinuousAggregate findContinuousAggByView(RelationName view);

    /**
     * The n-th most recent slice (1-based, ordered by range start) on a
     * dimension, counting only slices used by live chunks, or null if the
     * dimension has fewer than n slices.
     */
    DimensionSlice nthLatestSlice(int dimensionId, int n);

    /**
     * Oldest chunk on a dimension whose slice starts strictly before
     * {@code rangeStartBefore}, that is neither compressed nor dropped and that
     * the given job has never processed. Null if there is none.
     */
    Chunk oldestChunkForReorder(int jobId, int dimensionId, long rangeStartBefore);

    /**
     * A chunk on a dimension whose slice ends strictly before {@code rangeEndBefore}
     * and that is neither compressed nor dropped. Ties resolve to the oldest
     * range start, then the lowest chunk id. Null if there is none.
     */
    Chunk chunkToCompress(int dimensionId, long rangeEndBefore);
}
