package com.geico.poc.policyjobs.jobs;

import com.fasterxml.jackson.databind.JsonNode;
import com.geico.poc.policyjobs.config.PolicyJobsConfig;
import com.geico.poc.policyjobs.errors.ErrorCode;
import com.geico.poc.policyjobs.errors.JobException;
import com.geico.poc.policyjobs.jobs.policy.PolicyConfig;
import com.geico.poc.policyjobs.jobs.policy.PolicyConfigParser;
import com.geico.poc.policyjobs.jobs.policy.PolicyKind;
import com.geico.poc.policyjobs.jobs.policy.PolicyRegistry;
import com.geico.poc.policyjobs.routine.Routine;
import com.geico.poc.policyjobs.routine.RoutineCatalog;
import com.geico.poc.policyjobs.routine.RoutineName;
import com.geico.poc.policyjobs.security.Role;
import com.geico.poc.policyjobs.security.RoleCatalog;
import com.geico.poc.policyjobs.time.Timestamps;
import com.geico.poc.policyjobs.transaction.TransactionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Job administration: add, alter, delete and run jobs.
 *
 * Every operation takes the name of the calling role. All validation happens
 * before the catalog is touched, so a failed call leaves no partial change.
 */
@Service
public class JobAdminService {

    private static final Logger log = LoggerFactory.getLogger(JobAdminService.class);

    @Autowired
    private PolicyJobsConfig config;

    @Autowired
    private JobStore jobStore;

    @Autowired
    private RoutineCatalog routineCatalog;

    @Autowired
    private RoleCatalog roleCatalog;

    @Autowired
    private PolicyConfigParser configParser;

    @Autowired
    private PolicyRegistry policyRegistry;

    @Autowired
    private JobExecutor jobExecutor;

    // ========================================
    // Add
    // ========================================

    /**
     * Register a job that calls {@code proc(job_id, config)} every
     * {@code scheduleInterval}.
     *
     * @param proc         routine name, optionally schema-qualified
     * @param config       config document, may be null
     * @param initialStart first start time, may be null
     * @param scheduled    null means true
     * @return the new job id
     */
    public int add(String caller, String proc, Duration scheduleInterval, JsonNode config,
                   Instant initialStart, Boolean scheduled) {
        checkReadOnly("add_job");
        if (proc == null) {
            throw JobException.invalidParameter("function or procedure cannot be NULL");
        }
        if (scheduleInterval == null) {
            throw JobException.invalidParameter("schedule interval cannot be NULL");
        }

        RoutineName name = RoutineName.parse(proc);
        Routine routine = routineCatalog.lookup(name, JobExecutor.JOB_SIGNATURE);
        if (routine == null) {
            throw JobException.undefinedObject(String.format("function or procedure %s(integer, jsonb) not found", name));
        }
        if (!roleCatalog.hasExecutePrivilege(caller, routine)) {
            throw JobException.insufficientPrivilege(
                String.format("permission denied for function \"%s\"", name),
                "Job owner must have EXECUTE privilege on the function.");
        }
        checkCanOwnJob(caller);

        PolicyKind kind = configParser.kindOf(name);
        JsonNode document = normalize(config);
        Integer hypertableId = null;
        if (document != null) {
            PolicyConfig parsed = configParser.parse(kind, document);
            policyRegistry.validate(parsed);
            hypertableId = parsed.getHypertableId();
        }

        PolicyJobsConfig.JobDefaultsConfig defaults = this.config.getJobDefaults();
        Job job = new Job();
        job.setApplicationName(kind.getApplicationName());
        job.setScheduleInterval(scheduleInterval);
        job.setMaxRuntime(defaults.getMaxRuntime());
        job.setMaxRetries(defaults.getMaxRetries());
        job.setRetryPeriod(defaults.getRetryPeriod());
        job.setProcSchema(name.getSchemaName());
        job.setProcName(name.getName());
        job.setOwner(caller);
        job.setScheduled(scheduled == null || scheduled);
        job.setHypertableId(hypertableId);
        job.setConfig(document);
        checkJobInvariants(job);

        Job inserted = jobStore.insert(job);
        if (initialStart != null) {
            jobStore.updateStat(inserted.getId(), stat -> stat.setNextStart(initialStart));
        }
        log.info("✅ Added job {} ({} calling {})", inserted.getId(), inserted.getApplicationName(), name);
        return inserted.getId();
    }

    // ========================================
    // Delete
    // ========================================

    public void delete(String caller, Integer jobId) {
        checkReadOnly("delete_job");
        if (jobId == null) {
            throw JobException.invalidParameter("job ID cannot be NULL");
        }
        Job job = requireJob(jobId);
        if (!roleCatalog.hasPrivilegesOfRole(caller, job.getOwner())) {
            throw JobException.insufficientPrivilege(
                String.format("insufficient permissions to delete job for user \"%s\"", caller),
                ownerHint(job));
        }
        if (!jobStore.delete(jobId)) {
            throw JobException.undefinedObject(String.format("job %d not found", jobId));
        }
        log.info("🗑️ Deleted job {}", jobId);
    }

    // ========================================
    // Alter
    // ========================================

    /**
     * Change a job's settings.
     *
     * A changed schedule interval moves next_start to {@code last_finish + interval}
     * unless an explicit next start is given or the job never finished a run.
     * Resending the current interval leaves next_start alone.
     *
     * @return the updated row, or null if the job is missing and {@code ifExists} is set
     */
    public AlterJobResult alter(String caller, Integer jobId, JobAlteration changes, boolean ifExists) {
        checkReadOnly("alter_job");
        if (jobId == null) {
            throw JobException.invalidParameter("job ID cannot be NULL");
        }

        try (JobStore.RowLock lock = jobStore.lockRow(jobId)) {
            Job current = jobStore.findById(jobId);
            if (current == null) {
                if (ifExists) {
                    log.info(String.format("job %d not found, skipping", jobId));
                    return null;
                }
                throw JobException.undefinedObject(String.format("job %d not found", jobId));
            }
            if (!roleCatalog.hasPrivilegesOfRole(caller, current.getOwner())) {
                throw JobException.insufficientPrivilege(
                    String.format("insufficient permissions to alter job %d", jobId),
                    ownerHint(current));
            }

            Job updated = new Job(current);
            if (changes.getScheduleInterval() != null) {
                updated.setScheduleInterval(changes.getScheduleInterval());
            }
            if (changes.getMaxRuntime() != null) {
                updated.setMaxRuntime(changes.getMaxRuntime());
            }
            if (changes.getMaxRetries() != null) {
                updated.setMaxRetries(changes.getMaxRetries());
            }
            if (changes.getRetryPeriod() != null) {
                updated.setRetryPeriod(changes.getRetryPeriod());
            }
            if (changes.getScheduled() != null) {
                updated.setScheduled(changes.getScheduled());
            }
            JsonNode document = normalize(changes.getConfig());
            if (document != null) {
                RoutineName routine = new RoutineName(current.getProcSchema(), current.getProcName());
                PolicyConfig parsed = configParser.parse(routine, document);
                policyRegistry.validate(parsed);
                updated.setConfig(document);
                if (parsed.getHypertableId() != null) {
                    updated.setHypertableId(parsed.getHypertableId());
                }
            }
            checkJobInvariants(updated);

            // validation done, from here on everything is written
            boolean intervalChanged = changes.getScheduleInterval() != null
                && !changes.getScheduleInterval().equals(current.getScheduleInterval());
            if (intervalChanged && changes.getNextStart() == null) {
                Duration interval = changes.getScheduleInterval();
                jobStore.updateStatIfExists(jobId, stat -> {
                    Instant next = Timestamps.plus(stat.getLastFinish(), interval);
                    if (!Timestamps.NOBEGIN.equals(next)) {
                        stat.setNextStart(next);
                    }
                });
            }
            jobStore.update(updated);
            if (changes.getNextStart() != null) {
                Instant nextStart = changes.getNextStart();
                jobStore.updateStat(jobId, stat -> stat.setNextStart(nextStart));
            }

            JobStat stat = jobStore.findStat(jobId);
            log.info("✏️ Altered job {}", jobId);
            return new AlterJobResult(updated, stat != null ? stat.getNextStart() : Timestamps.NOBEGIN);
        }
    }

    // ========================================
    // Run
    // ========================================

    /**
     * Run a job now, in the caller's transaction context, regardless of its
     * schedule.
     */
    public boolean run(String caller, Integer jobId, TransactionContext tx) {
        if (jobId == null) {
            throw JobException.invalidParameter("job ID cannot be NULL");
        }
        Job job = requireJob(jobId);
        if (!roleCatalog.hasPrivilegesOfRole(caller, job.getOwner())) {
            throw JobException.insufficientPrivilege(
                String.format("insufficient permissions to run job %d", jobId),
                ownerHint(job));
        }
        log.info("🔄 Running job {} manually", jobId);
        return jobExecutor.execute(job, tx);
    }

    // ========================================
    // Read side
    // ========================================

    public Job getJob(int jobId) {
        return requireJob(jobId);
    }

    public List<Job> listJobs() {
        return jobStore.findAll();
    }

    /**
     * @return the job's stats, or null if it has none yet
     */
    public JobStat getJobStat(int jobId) {
        requireJob(jobId);
        return jobStore.findStat(jobId);
    }

    // ========================================
    // Helpers
    // ========================================

    private Job requireJob(int jobId) {
        Job job = jobStore.findById(jobId);
        if (job == null) {
            throw JobException.undefinedObject(String.format("job %d not found", jobId));
        }
        return job;
    }

    private void checkReadOnly(String operation) {
        if (config.isReadOnly()) {
            throw new JobException(ErrorCode.READ_ONLY_TRANSACTION,
                String.format("cannot execute %s() in a read-only transaction", operation));
        }
    }

    private void checkCanOwnJob(String caller) {
        Role role = roleCatalog.findRole(caller);
        if (role == null || !role.canLogin()) {
            throw JobException.insufficientPrivilege(
                String.format("permission denied to start background process as role \"%s\"", caller),
                "Job owner must have LOGIN permission to run background tasks.");
        }
    }

    private static void checkJobInvariants(Job job) {
        if (job.getScheduleInterval().isNegative()
                || (job.isScheduled() && job.getScheduleInterval().isZero())) {
            throw JobException.invalidParameter("schedule interval must be greater than zero",
                "Got " + job.getScheduleInterval() + ".", null);
        }
        if (job.getMaxRetries() < -1) {
            throw JobException.invalidParameter("max_retries must be -1 (unlimited) or greater",
                "Got " + job.getMaxRetries() + ".", null);
        }
        if (job.getMaxRuntime().isNegative()) {
            throw JobException.invalidParameter("max_runtime cannot be negative");
        }
        if (job.getRetryPeriod().isNegative()) {
            throw JobException.invalidParameter("retry_period cannot be negative");
        }
    }

    private static String ownerHint(Job job) {
        return String.format("Must have the privileges of role \"%s\".", job.getOwner());
    }

    private static JsonNode normalize(JsonNode document) {
        return document == null || document.isNull() || document.isMissingNode() ? null : document;
    }
}
