package com.geico.poc.policyjobs.jobs;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Asks the scheduler to run a job again right away instead of waiting a full
 * schedule interval.
 *
 * With existing stats, next_start goes back to last_start, so the run that
 * just happened does not count for scheduling. An unset last_start is copied
 * as is, which makes the job due. Without stats next_start becomes now. The
 * scheduler may still delay the job for its own reasons.
 */
@Component
public class FastRestart {

    private static final Logger log = LoggerFactory.getLogger(FastRestart.class);

    @Autowired
    private JobStore jobStore;

    @Autowired
    private Clock clock;

    public FastRestart() {
    }

    public FastRestart(JobStore jobStore, Clock clock) {
        this.jobStore = jobStore;
        this.clock = clock;
    }

    public void enable(int jobId, String jobName) {
        JobStat updated = jobStore.updateStatIfExists(jobId, stat -> stat.setNextStart(stat.getLastStart()));
        if (updated == null) {
            Instant now = clock.instant();
            jobStore.updateStat(jobId, stat -> stat.setNextStart(now));
        }
        log.debug(String.format("the %s job is scheduled to run again immediately", jobName));
    }
}
