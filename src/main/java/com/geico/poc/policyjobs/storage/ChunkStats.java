package com.geico.poc.policyjobs.storage;

import java.time.Instant;

/**
 * Per (job, chunk) record of how often a policy job has processed a chunk.
 */
public class ChunkStats {

    private final int jobId;
    private final int chunkId;
    private int numTimesJobRun;
    private Instant lastTimeJobRun;

    public ChunkStats(int jobId, int chunkId) {
        this.jobId = jobId;
        this.chunkId = chunkId;
    }

    public ChunkStats(ChunkStats other) {
        this.jobId = other.jobId;
        this.chunkId = other.chunkId;
        this.numTimesJobRun = other.numTimesJobRun;
        this.lastTimeJobRun = other.lastTimeJobRun;
    }

    public int getJobId() {
        return jobId;
    }

    public int getChunkId() {
        return chunkId;
    }

    public int getNumTimesJobRun() {
        return numTimesJobRun;
    }

    public Instant getLastTimeJobRun() {
        return lastTimeJobRun;
    }

    void recordRun(Instant when) {
        numTimesJobRun++;
        lastTimeJobRun = when;
    }
}
