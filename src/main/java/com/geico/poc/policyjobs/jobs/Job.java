package com.geico.poc.policyjobs.jobs;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;

/**
 * A row of the job catalog.
 *
 * Instances handed out by the {@link JobStore} are copies; changing one has
 * no effect until it is written back with {@link JobStore#update(Job)}.
 */
public class Job {

    private int id;
    private String applicationName;
    private Duration scheduleInterval;
    private Duration maxRuntime;
    private int maxRetries;
    private Duration retryPeriod;
    private String procSchema;
    private String procName;
    private String owner;
    private boolean scheduled = true;
    private Integer hypertableId;
    private JsonNode config;

    public Job() {
    }

    public Job(Job other) {
        this.id = other.id;
        this.applicationName = other.applicationName;
        this.scheduleInterval = other.scheduleInterval;
        this.maxRuntime = other.maxRuntime;
        this.maxRetries = other.maxRetries;
        this.retryPeriod = other.retryPeriod;
        this.procSchema = other.procSchema;
        this.procName = other.procName;
        this.owner = other.owner;
        this.scheduled = other.scheduled;
        this.hypertableId = other.hypertableId;
        this.config = other.config != null ? other.config.deepCopy() : null;
    }

    public int getId() {
        return id;
    }

    public void setId(int id) {
        this.id = id;
    }

    public String getApplicationName() {
        return applicationName;
    }

    public void setApplicationName(String applicationName) {
        this.applicationName = applicationName;
    }

    public Duration getScheduleInterval() {
        return scheduleInterval;
    }

    public void setScheduleInterval(Duration scheduleInterval) {
        this.scheduleInterval = scheduleInterval;
    }

    /**
     * Zero means unlimited. Not enforced here.
     */
    public Duration getMaxRuntime() {
        return maxRuntime;
    }

    public void setMaxRuntime(Duration maxRuntime) {
        this.maxRuntime = maxRuntime;
    }

    /**
     * -1 means retry forever.
     */
    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public Duration getRetryPeriod() {
        return retryPeriod;
    }

    public void setRetryPeriod(Duration retryPeriod) {
        this.retryPeriod = retryPeriod;
    }

    public String getProcSchema() {
        return procSchema;
    }

    public void setProcSchema(String procSchema) {
        this.procSchema = procSchema;
    }

    public String getProcName() {
        return procName;
    }

    public void setProcName(String procName) {
        this.procName = procName;
    }

    public String getOwner() {
        return owner;
    }

    public void setOwner(String owner) {
        this.owner = owner;
    }

    public boolean isScheduled() {
        return scheduled;
    }

    public void setScheduled(boolean scheduled) {
        this.scheduled = scheduled;
    }

    /**
     * Hypertable a built-in policy acts on, null for custom jobs.
     */
    public Integer getHypertableId() {
        return hypertableId;
    }

    public void setHypertableId(Integer hypertableId) {
        this.hypertableId = hypertableId;
    }

    public JsonNode getConfig() {
        return config;
    }

    public void setConfig(JsonNode config) {
        this.config = config;
    }

    @Override
    public String toString() {
        return "Job{id=" + id +
               ", application=" + applicationName +
               ", proc=" + procSchema + "." + procName +
               ", interval=" + scheduleInterval +
               ", scheduled=" + scheduled +
               ", owner=" + owner +
               '}';
    }
}
