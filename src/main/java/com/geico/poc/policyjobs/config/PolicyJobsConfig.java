package com.geico.poc.policyjobs.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration for the policy job engine
 */
@Configuration
@ConfigurationProperties(prefix = "policy-jobs")
public class PolicyJobsConfig {

    /**
     * Reject job administration, as a read-only transaction would.
     */
    private boolean readOnly = false;
    private String superuser = "postgres";
    private String internalSchema = "_jobs_internal";
    private JobDefaultsConfig jobDefaults = new JobDefaultsConfig();
    private SchedulerConfig scheduler = new SchedulerConfig();
    private PoliciesConfig policies = new PoliciesConfig();

    public boolean isReadOnly() {
        return readOnly;
    }

    public void setReadOnly(boolean readOnly) {
        this.readOnly = readOnly;
    }

    public String getSuperuser() {
        return superuser;
    }

    public void setSuperuser(String superuser) {
        this.superuser = superuser;
    }

    public String getInternalSchema() {
        return internalSchema;
    }

    public void setInternalSchema(String internalSchema) {
        this.internalSchema = internalSchema;
    }

    public JobDefaultsConfig getJobDefaults() {
        return jobDefaults;
    }

    public void setJobDefaults(JobDefaultsConfig jobDefaults) {
        this.jobDefaults = jobDefaults;
    }

    public SchedulerConfig getScheduler() {
        return scheduler;
    }

    public void setScheduler(SchedulerConfig scheduler) {
        this.scheduler = scheduler;
    }

    public PoliciesConfig getPolicies() {
        return policies;
    }

    public void setPolicies(PoliciesConfig policies) {
        this.policies = policies;
    }

    /**
     * Values given to new jobs
     */
    public static class JobDefaultsConfig {
        private Duration maxRuntime = Duration.ZERO;   // unlimited
        private int maxRetries = -1;                   // unlimited
        private Duration retryPeriod = Duration.ofMinutes(5);
        private int firstJobId = 1000;

        public Duration getMaxRuntime() {
            return maxRuntime;
        }

        public void setMaxRuntime(Duration maxRuntime) {
            this.maxRuntime = maxRuntime;
        }

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

        public int getFirstJobId() {
            return firstJobId;
        }

        public void setFirstJobId(int firstJobId) {
            this.firstJobId = firstJobId;
        }
    }

    /**
     * Local dispatcher that runs due jobs in-process
     */
    public static class SchedulerConfig {
        private boolean enabled = false;
        private long initialDelayMs = 5000;
        private long pollIntervalMs = 1000;
        private int maxWorkers = 4;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getInitialDelayMs() {
            return initialDelayMs;
        }

        public void setInitialDelayMs(long initialDelayMs) {
            this.initialDelayMs = initialDelayMs;
        }

        public long getPollIntervalMs() {
            return pollIntervalMs;
        }

        public void setPollIntervalMs(long pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
        }

        public int getMaxWorkers() {
            return maxWorkers;
        }

        public void setMaxWorkers(int maxWorkers) {
            this.maxWorkers = maxWorkers;
        }
    }

    /**
     * Tuning for the built-in maintenance policies
     */
    public static class PoliciesConfig {
        private int reorderSkipRecentSlices = 3;

        public int getReorderSkipRecentSlices() {
            return reorderSkipRecentSlices;
        }

        public void setReorderSkipRecentSlices(int reorderSkipRecentSlices) {
            this.reorderSkipRecentSlices = reorderSkipRecentSlices;
        }
    }
}
