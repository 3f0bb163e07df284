package com.geico.poc.policyjobs.jobs;

import com.geico.poc.policyjobs.config.PolicyJobsConfig;
import com.geico.poc.policyjobs.errors.JobException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Job catalog held in memory.
 *
 * Each job id has one {@link ReentrantLock} standing in for the row-exclusive
 * lock on its catalog row. Locks are never removed, so a job id maps to the
 * same lock for the life of the store.
 */
@Component
public class InMemoryJobStore implements JobStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryJobStore.class);

    private final Map<Integer, Job> jobs = new ConcurrentHashMap<>();
    private final Map<Integer, JobStat> stats = new ConcurrentHashMap<>();
    private final Map<Integer, ReentrantLock> rowLocks = new ConcurrentHashMap<>();
    private final AtomicInteger sequence;

    public InMemoryJobStore(PolicyJobsConfig config) {
        this.sequence = new AtomicInteger(config.getJobDefaults().getFirstJobId());
    }

    @Override
    public Job insert(Job job) {
        int id = sequence.getAndIncrement();
        Job stored = new Job(job);
        stored.setId(id);
        jobs.put(id, stored);
        log.debug("Inserted job {}", stored);
        return new Job(stored);
    }

    @Override
    public Job findById(int jobId) {
        Job job = jobs.get(jobId);
        return job != null ? new Job(job) : null;
    }

    @Override
    public List<Job> findAll() {
        List<Job> result = new ArrayList<>();
        for (Job job : jobs.values()) {
            result.add(new Job(job));
        }
        result.sort(Comparator.comparingInt(Job::getId));
        return result;
    }

    @Override
    public boolean delete(int jobId) {
        try (RowLock lock = lockRow(jobId)) {
            stats.remove(jobId);
            return jobs.remove(jobId) != null;
        }
    }

    @Override
    public RowLock lockRow(int jobId) {
        ReentrantLock lock = rowLocks.computeIfAbsent(jobId, k -> new ReentrantLock());
        lock.lock();
        return new HeldLock(jobId, lock);
    }

    @Override
    public void update(Job job) {
        ReentrantLock lock = rowLocks.get(job.getId());
        if (lock == null || !lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("row lock for job " + job.getId() + " is not held");
        }
        if (!jobs.containsKey(job.getId())) {
            throw JobException.undefinedObject(String.format("job %d not found", job.getId()));
        }
        jobs.put(job.getId(), new Job(job));
    }

    @Override
    public JobStat findStat(int jobId) {
        JobStat stat = stats.get(jobId);
        return stat != null ? new JobStat(stat) : null;
    }

    @Override
    public JobStat updateStat(int jobId, Consumer<JobStat> change) {
        try (RowLock lock = lockRow(jobId)) {
            if (!jobs.containsKey(jobId)) {
                throw JobException.undefinedObject(String.format("job %d not found", jobId));
            }
            JobStat stat = stats.computeIfAbsent(jobId, JobStat::new);
            return apply(stat, change);
        }
    }

    @Override
    public JobStat updateStatIfExists(int jobId, Consumer<JobStat> change) {
        try (RowLock lock = lockRow(jobId)) {
            JobStat stat = stats.get(jobId);
            if (stat == null) {
                return null;
            }
            return apply(stat, change);
        }
    }

    private JobStat apply(JobStat stat, Consumer<JobStat> change) {
        // work on a copy so a failing change leaves the stored stats intact
        JobStat working = new JobStat(stat);
        change.accept(working);
        working.incrementVersion();
        stats.put(working.getJobId(), working);
        return new JobStat(working);
    }

    private static final class HeldLock implements RowLock {

        private final int jobId;
        private final ReentrantLock lock;
        private boolean released;

        HeldLock(int jobId, ReentrantLock lock) {
            this.jobId = jobId;
            this.lock = lock;
        }

        @Override
        public int getJobId() {
            return jobId;
        }

        @Override
        public void close() {
            if (!released) {
                released = true;
                lock.unlock();
            }
        }
    }
}
