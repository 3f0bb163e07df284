package com.geico.poc.policyjobs.jobs;

import com.geico.poc.policyjobs.config.PolicyJobsConfig;
import com.geico.poc.policyjobs.time.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Instant;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Minimal in-process dispatcher for scheduled jobs.
 *
 * Polls the job store and hands every due job to a worker, one run per job
 * at a time. A job is due when it is scheduled and has no stats yet or its
 * next_start has passed. After a run, successful or not, next_start moves to
 * {@code last_finish + schedule_interval}, unless the stats were rewritten
 * while the job was running (fast restart, alter) in which case the new
 * next_start is kept.
 *
 * There is no retry, backoff or max_runtime enforcement. Disabled by default.
 */
@Component
public class BackgroundJobScheduler {

    private static final Logger log = LoggerFactory.getLogger(BackgroundJobScheduler.class);

    @Autowired
    private PolicyJobsConfig config;

    @Autowired
    private JobStore jobStore;

    @Autowired
    private JobExecutor jobExecutor;

    @Autowired
    private Clock clock;

    private final Set<Integer> running = ConcurrentHashMap.newKeySet();

    private ScheduledExecutorService poller;
    private ExecutorService workers;

    public BackgroundJobScheduler() {
    }

    public BackgroundJobScheduler(PolicyJobsConfig config, JobStore jobStore, JobExecutor jobExecutor, Clock clock) {
        this.config = config;
        this.jobStore = jobStore;
        this.jobExecutor = jobExecutor;
        this.clock = clock;
    }

    @PostConstruct
    public void start() {
        PolicyJobsConfig.SchedulerConfig schedulerConfig = config.getScheduler();
        if (!schedulerConfig.isEnabled()) {
            log.info("📋 Background job scheduler disabled");
            return;
        }

        AtomicInteger workerIds = new AtomicInteger();
        workers = Executors.newFixedThreadPool(
            schedulerConfig.getMaxWorkers(),
            r -> {
                Thread t = new Thread(r);
                t.setName("job-worker-" + workerIds.incrementAndGet());
                t.setDaemon(true);
                return t;
            }
        );
        poller = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r);
            t.setName("job-scheduler");
            t.setDaemon(true);
            return t;
        });

        poller.scheduleWithFixedDelay(
            this::pollSafely,
            schedulerConfig.getInitialDelayMs(),
            schedulerConfig.getPollIntervalMs(),
            TimeUnit.MILLISECONDS
        );
        log.info("✅ Background job scheduler started (workers: " + schedulerConfig.getMaxWorkers() +
                 ", poll interval: " + schedulerConfig.getPollIntervalMs() + "ms)");
    }

    private void pollSafely() {
        try {
            dispatchDueJobs();
        } catch (RuntimeException e) {
            // keep polling, the next turn sees a fresh catalog
            log.error("❌ Job dispatch failed", e);
        }
    }

    /**
     * Submit every due job that is not already running to the worker pool.
     *
     * @return the number of jobs submitted
     */
    public int dispatchDueJobs() {
        if (workers == null) {
            throw new IllegalStateException("scheduler is not started");
        }
        int dispatched = 0;
        for (Job job : jobStore.findAll()) {
            if (!isDue(job) || !running.add(job.getId())) {
                continue;
            }
            try {
                workers.submit(() -> {
                    try {
                        runJob(job.getId());
                    } finally {
                        running.remove(job.getId());
                    }
                });
                dispatched++;
            } catch (RejectedExecutionException e) {
                running.remove(job.getId());
                log.warn("Worker pool rejected job {}", job.getId());
            }
        }
        return dispatched;
    }

    public boolean isDue(Job job) {
        if (!job.isScheduled()) {
            return false;
        }
        JobStat stat = jobStore.findStat(job.getId());
        return stat == null || !stat.getNextStart().isAfter(clock.instant());
    }

    /**
     * Run one job on the calling thread and record the outcome in its stats.
     *
     * @return true if the job succeeded, false if it failed or no longer exists
     */
    public boolean runJob(int jobId) {
        Job job = jobStore.findById(jobId);
        if (job == null) {
            log.debug("Job {} was deleted before it could run", jobId);
            return false;
        }

        Instant start = clock.instant();
        JobStat started = jobStore.updateStat(jobId, stat -> {
            stat.setLastStart(start);
            stat.setTotalRuns(stat.getTotalRuns() + 1);
        });
        long startedVersion = started.getVersion();

        boolean success;
        try {
            log.info("🔄 Running job " + jobId + " (" + job.getApplicationName() + ")");
            jobExecutor.execute(job);
            success = true;
        } catch (RuntimeException e) {
            log.error("❌ Job " + jobId + " failed: " + e.getMessage(), e);
            success = false;
        }

        Instant finish = clock.instant();
        boolean succeeded = success;
        JobStat finished = jobStore.updateStatIfExists(jobId, stat -> {
            boolean rescheduled = stat.getVersion() != startedVersion;
            stat.setLastFinish(finish);
            if (succeeded) {
                stat.setLastSuccessfulFinish(finish);
                stat.setTotalSuccesses(stat.getTotalSuccesses() + 1);
                stat.setConsecutiveFailures(0);
            } else {
                stat.setTotalFailures(stat.getTotalFailures() + 1);
                stat.setConsecutiveFailures(stat.getConsecutiveFailures() + 1);
            }
            if (!rescheduled) {
                stat.setNextStart(Timestamps.plus(finish, job.getScheduleInterval()));
            }
        });
        if (finished != null) {
            log.info((succeeded ? "✅" : "⚠️") + " Job " + jobId + " finished, next start " +
                     Timestamps.format(finished.getNextStart()));
        }
        return succeeded;
    }

    /**
     * @return true once both the poller and the worker pool have terminated
     */
    public boolean isTerminated() {
        return poller != null && poller.isTerminated() && workers.isTerminated();
    }

    @PreDestroy
    public void stop() {
        if (poller != null) {
            log.info("🛑 Stopping background job scheduler...");
            poller.shutdown();
            try {
                // a poll in flight may still submit to the workers
                if (!poller.awaitTermination(30, TimeUnit.SECONDS)) {
                    poller.shutdownNow();
                }
                workers.shutdown();
                if (!workers.awaitTermination(30, TimeUnit.SECONDS)) {
                    workers.shutdownNow();
                }
            } catch (InterruptedException e) {
                poller.shutdownNow();
                workers.shutdownNow();
                Thread.currentThread().interrupt();
            }
            log.info("✅ Background job scheduler stopped");
        }
    }
}
