package com.geico.poc.policyjobs.storage;

import java.time.Instant;

/**
 * Persistent per (job, chunk) statistics used by policies that must not
 * process the same chunk twice.
 */
public interface ChunkStatsStore {

    void recordJobRun(int jobId, int chunkId, Instant when);

    /**
     * Stats for the pair, or null if the job never processed the chunk.
     */
    ChunkStats find(int jobId, int chunkId);
}
