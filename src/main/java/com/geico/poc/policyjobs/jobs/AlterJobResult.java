package com.geico.poc.policyjobs.jobs;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.time.Instant;

/**
 * The row returned by alter: the job's settings after the change and its
 * next start ({@code NOBEGIN} when the job has no stats yet).
 */
public class AlterJobResult {

    private final int jobId;
    private final Duration scheduleInterval;
    private final Duration maxRuntime;
    private final int maxRetries;
    private final Duration retryPeriod;
    private final boolean scheduled;
    private final JsonNode config;
    private final Instant nextStart;

    public AlterJobResult(Job job, Instant nextStart) {
        this.jobId = job.getId();
        this.scheduleInterval = job.getScheduleInterval();
        this.maxRuntime = job.getMaxRuntime();
        this.maxRetries = job.getMaxRetries();
        this.retryPeriod = job.getRetryPeriod();
        this.scheduled = job.isScheduled();
        this.config = job.getConfig() != null ? job.getConfig().deepCopy() : null;
        this.nextStart = nextStart;
    }

    public int getJobId() {
        return jobId;
    }

    public Duration getScheduleInterval() {
        return scheduleInterval;
    }

    public Duration getMaxRuntime() {
        return maxRuntime;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public Duration getRetryPeriod() {
        return retryPeriod;
    }

    public boolean isScheduled() {
        return scheduled;
    }

    public JsonNode getConfig() {
        return config;
    }

    public Instant getNextStart() {
        return nextStart;
    }
}
