package com.geico.poc.policyjobs.jobs;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.time.Instant;

/**
 * Fields to change on a job. Null means "leave unchanged".
 */
public class JobAlteration {

    private Duration scheduleInterval;
    private Duration maxRuntime;
    private Integer maxRetries;
    private Duration retryPeriod;
    private Boolean scheduled;
    private JsonNode config;
    private Instant nextStart;

    public Duration getScheduleInterval() {
        return scheduleInterval;
    }

    public JobAlteration setScheduleInterval(Duration scheduleInterval) {
        this.scheduleInterval = scheduleInterval;
        return this;
    }

    public Duration getMaxRuntime() {
        return maxRuntime;
    }

    public JobAlteration setMaxRuntime(Duration maxRuntime) {
        this.maxRuntime = maxRuntime;
        return this;
    }

    public Integer getMaxRetries() {
        return maxRetries;
    }

    public JobAlteration setMaxRetries(Integer maxRetries) {
        this.maxRetries = maxRetries;
        return this;
    }

    public Duration getRetryPeriod() {
        return retryPeriod;
    }

    public JobAlteration setRetryPeriod(Duration retryPeriod) {
        this.retryPeriod = retryPeriod;
        return this;
    }

    public Boolean getScheduled() {
        return scheduled;
    }

    public JobAlteration setScheduled(Boolean scheduled) {
        this.scheduled = scheduled;
        return this;
    }

    public JsonNode getConfig() {
        return config;
    }

    public JobAlteration setConfig(JsonNode config) {
        this.config = config;
        return this;
    }

    /**
     * Explicit next start; wins over the one derived from a new schedule interval.
     */
    public Instant getNextStart() {
        return nextStart;
    }

    public JobAlteration setNextStart(Instant nextStart) {
        this.nextStart = nextStart;
        return this;
    }

    public boolean isEmpty() {
        return scheduleInterval == null && maxRuntime == null && maxRetries == null && retryPeriod == null
            && scheduled == null && config == null && nextStart == null;
    }
}
