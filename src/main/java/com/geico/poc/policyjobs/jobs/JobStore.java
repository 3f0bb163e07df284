package com.geico.poc.policyjobs.jobs;

import java.util.List;
import java.util.function.Consumer;

/**
 * Storage for job rows and their stats.
 *
 * A job row is modified only while its row lock is held. Stat writes take the
 * same lock, so all writes to one job are serialized.
 */
public interface JobStore {

    /**
     * Insert a new job, assigning the next id from the job sequence.
     *
     * @return the stored job
     */
    Job insert(Job job);

    /**
     * @return a copy of the job, or null
     */
    Job findById(int jobId);

    List<Job> findAll();

    /**
     * Remove a job and its stats.
     *
     * @return false if the job did not exist
     */
    boolean delete(int jobId);

    /**
     * Block until the job's row-exclusive lock is acquired.
     */
    RowLock lockRow(int jobId);

    /**
     * Overwrite a job row. The caller must hold the row lock.
     */
    void update(Job job);

    /**
     * @return a copy of the stats, or null if the job never had any
     */
    JobStat findStat(int jobId);

    /**
     * Apply a change to the job's stats, creating them first if needed.
     *
     * @return a copy of the stats after the change
     */
    JobStat updateStat(int jobId, Consumer<JobStat> change);

    /**
     * Apply a change only if the job already has stats.
     *
     * @return a copy of the stats after the change, or null
     */
    JobStat updateStatIfExists(int jobId, Consumer<JobStat> change);

    /**
     * A held row lock, released on close.
     */
    interface RowLock extends AutoCloseable {

        int getJobId();

        @Override
        void close();
    }
}
