package com.geico.poc.policyjobs;

import com.geico.poc.policyjobs.dto.AddJobRequest;
import com.geico.poc.policyjobs.dto.AlterJobRequest;
import com.geico.poc.policyjobs.dto.JobResponse;
import com.geico.poc.policyjobs.errors.JobException;
import com.geico.poc.policyjobs.jobs.AlterJobResult;
import com.geico.poc.policyjobs.jobs.Job;
import com.geico.poc.policyjobs.jobs.JobAdminService;
import com.geico.poc.policyjobs.jobs.JobAlteration;
import com.geico.poc.policyjobs.jobs.JobStat;
import com.geico.poc.policyjobs.time.Intervals;
import com.geico.poc.policyjobs.time.Timestamps;
import com.geico.poc.policyjobs.transaction.LocalTransactionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/jobs")
public class JobController {

    private static final Logger log = LoggerFactory.getLogger(JobController.class);

    static final String ROLE_HEADER = "X-Role";

    @Autowired
    private JobAdminService jobAdminService;

    @Autowired
    private Clock clock;

    @PostMapping
    public ResponseEntity<JobResponse> addJob(@RequestHeader(ROLE_HEADER) String role,
                                              @RequestBody AddJobRequest request) {
        try {
            int jobId = jobAdminService.add(
                role,
                request.getProc(),
                request.getScheduleInterval() != null ? Intervals.parse(request.getScheduleInterval()) : null,
                request.getConfig(),
                Timestamps.parse(request.getInitialStart()),
                request.getScheduled());
            return ResponseEntity.ok(new JobResponse(Collections.singletonList(jobRow(jobAdminService.getJob(jobId)))));
        } catch (JobException e) {
            return errorResponse(e);
        }
    }

    @GetMapping
    public ResponseEntity<JobResponse> listJobs() {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Job job : jobAdminService.listJobs()) {
            rows.add(jobRow(job));
        }
        return ResponseEntity.ok(new JobResponse(rows));
    }

    @GetMapping("/{id}")
    public ResponseEntity<JobResponse> getJob(@PathVariable("id") int id) {
        try {
            return ResponseEntity.ok(new JobResponse(Collections.singletonList(jobRow(jobAdminService.getJob(id)))));
        } catch (JobException e) {
            return errorResponse(e);
        }
    }

    @PatchMapping("/{id}")
    public ResponseEntity<JobResponse> alterJob(@RequestHeader(ROLE_HEADER) String role,
                                                @PathVariable("id") int id,
                                                @RequestParam(name = "ifExists", defaultValue = "false") boolean ifExists,
                                                @RequestBody AlterJobRequest request) {
        try {
            JobAlteration changes = new JobAlteration()
                .setScheduleInterval(parseInterval(request.getScheduleInterval()))
                .setMaxRuntime(parseInterval(request.getMaxRuntime()))
                .setMaxRetries(request.getMaxRetries())
                .setRetryPeriod(parseInterval(request.getRetryPeriod()))
                .setScheduled(request.getScheduled())
                .setConfig(request.getConfig())
                .setNextStart(Timestamps.parse(request.getNextStart()));

            AlterJobResult result = jobAdminService.alter(role, id, changes, ifExists);
            if (result == null) {
                return ResponseEntity.ok(new JobResponse(Collections.emptyList()));
            }
            return ResponseEntity.ok(new JobResponse(Collections.singletonList(alterRow(result))));
        } catch (JobException e) {
            return errorResponse(e);
        }
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<JobResponse> deleteJob(@RequestHeader(ROLE_HEADER) String role,
                                                 @PathVariable("id") int id) {
        try {
            jobAdminService.delete(role, id);
            return ResponseEntity.ok(new JobResponse(Collections.emptyList()));
        } catch (JobException e) {
            return errorResponse(e);
        }
    }

    @PostMapping("/{id}/run")
    public ResponseEntity<JobResponse> runJob(@RequestHeader(ROLE_HEADER) String role,
                                              @PathVariable("id") int id) {
        try {
            boolean success = jobAdminService.run(role, id, new LocalTransactionContext(clock));
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("job_id", id);
            row.put("success", success);
            return ResponseEntity.ok(new JobResponse(Collections.singletonList(row)));
        } catch (JobException e) {
            return errorResponse(e);
        } catch (RuntimeException e) {
            // user-defined actions can fail with anything
            log.error("❌ Job {} failed", id, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(JobResponse.error(e.getMessage()));
        }
    }

    private Map<String, Object> jobRow(Job job) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("job_id", job.getId());
        row.put("application_name", job.getApplicationName());
        row.put("schedule_interval", Intervals.format(job.getScheduleInterval()));
        row.put("max_runtime", Intervals.format(job.getMaxRuntime()));
        row.put("max_retries", job.getMaxRetries());
        row.put("retry_period", Intervals.format(job.getRetryPeriod()));
        row.put("proc_schema", job.getProcSchema());
        row.put("proc_name", job.getProcName());
        row.put("owner", job.getOwner());
        row.put("scheduled", job.isScheduled());
        row.put("config", job.getConfig());
        row.put("hypertable_id", job.getHypertableId());
        JobStat stat = jobAdminService.getJobStat(job.getId());
        row.put("next_start", stat != null ? Timestamps.format(stat.getNextStart()) : null);
        return row;
    }

    private static Map<String, Object> alterRow(AlterJobResult result) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("job_id", result.getJobId());
        row.put("schedule_interval", Intervals.format(result.getScheduleInterval()));
        row.put("max_runtime", Intervals.format(result.getMaxRuntime()));
        row.put("max_retries", result.getMaxRetries());
        row.put("retry_period", Intervals.format(result.getRetryPeriod()));
        row.put("scheduled", result.isScheduled());
        row.put("config", result.getConfig());
        row.put("next_start", Timestamps.format(result.getNextStart()));
        return row;
    }

    private static Duration parseInterval(String text) {
        return text != null ? Intervals.parse(text) : null;
    }

    private static ResponseEntity<JobResponse> errorResponse(JobException e) {
        HttpStatus status;
        switch (e.getCode()) {
            case INVALID_PARAMETER:
                status = HttpStatus.BAD_REQUEST;
                break;
            case UNDEFINED_OBJECT:
                status = HttpStatus.NOT_FOUND;
                break;
            case INSUFFICIENT_PRIVILEGE:
                status = HttpStatus.FORBIDDEN;
                break;
            case FEATURE_NOT_SUPPORTED:
                status = HttpStatus.NOT_IMPLEMENTED;
                break;
            case READ_ONLY_TRANSACTION:
            case INVALID_TRANSACTION_TERMINATION:
                status = HttpStatus.CONFLICT;
                break;
            default:
                status = HttpStatus.INTERNAL_SERVER_ERROR;
                break;
        }
        if (status.is5xxServerError()) {
            log.error("❌ Job request failed: {}", e, e);
        } else {
            log.debug("Job request rejected: {}", e);
        }
        return ResponseEntity.status(status).body(JobResponse.error(e));
    }
}
