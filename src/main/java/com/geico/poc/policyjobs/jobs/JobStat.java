package com.geico.poc.policyjobs.jobs;

import com.geico.poc.policyjobs.time.Timestamps;

import java.time.Instant;

/**
 * Execution history and next scheduled start of one job.
 *
 * Unset timestamps hold {@link Timestamps#NOBEGIN}. Every write through the
 * {@link JobStore} increments {@code version}.
 */
public class JobStat {

    private final int jobId;
    private Instant lastStart = Timestamps.NOBEGIN;
    private Instant lastFinish = Timestamps.NOBEGIN;
    private Instant nextStart = Timestamps.NOBEGIN;
    private Instant lastSuccessfulFinish = Timestamps.NOBEGIN;
    private long totalRuns;
    private long totalSuccesses;
    private long totalFailures;
    private long consecutiveFailures;
    private long version;

    public JobStat(int jobId) {
        this.jobId = jobId;
    }

    public JobStat(JobStat other) {
        this.jobId = other.jobId;
        this.lastStart = other.lastStart;
        this.lastFinish = other.lastFinish;
        this.nextStart = other.nextStart;
        this.lastSuccessfulFinish = other.lastSuccessfulFinish;
        this.totalRuns = other.totalRuns;
        this.totalSuccesses = other.totalSuccesses;
        this.totalFailures = other.totalFailures;
        this.consecutiveFailures = other.consecutiveFailures;
        this.version = other.version;
    }

    public int getJobId() {
        return jobId;
    }

    public Instant getLastStart() {
        return lastStart;
    }

    public void setLastStart(Instant lastStart) {
        this.lastStart = lastStart;
    }

    public Instant getLastFinish() {
        return lastFinish;
    }

    public void setLastFinish(Instant lastFinish) {
        this.lastFinish = lastFinish;
    }

    public Instant getNextStart() {
        return nextStart;
    }

    public void setNextStart(Instant nextStart) {
        this.nextStart = nextStart;
    }

    public Instant getLastSuccessfulFinish() {
        return lastSuccessfulFinish;
    }

    public void setLastSuccessfulFinish(Instant lastSuccessfulFinish) {
        this.lastSuccessfulFinish = lastSuccessfulFinish;
    }

    public long getTotalRuns() {
        return totalRuns;
    }

    public void setTotalRuns(long totalRuns) {
        this.totalRuns = totalRuns;
    }

    public long getTotalSuccesses() {
        return totalSuccesses;
    }

    public void setTotalSuccesses(long totalSuccesses) {
        this.totalSuccesses = totalSuccesses;
    }

    public long getTotalFailures() {
        return totalFailures;
    }

    public void setTotalFailures(long totalFailures) {
        this.totalFailures = totalFailures;
    }

    public long getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public void setConsecutiveFailures(long consecutiveFailures) {
        this.consecutiveFailures = consecutiveFailures;
    }

    public long getVersion() {
        return version;
    }

    void incrementVersion() {
        version++;
    }

    @Override
    public String toString() {
        return "JobStat{job=" + jobId +
               ", lastStart=" + Timestamps.format(lastStart) +
               ", lastFinish=" + Timestamps.format(lastFinish) +
               ", nextStart=" + Timestamps.format(nextStart) +
               ", runs=" + totalRuns +
               ", version=" + version +
               '}';
    }
}
