package com.geico.poc.policyjobs;

import com.geico.poc.policyjobs.dto.AddJobRequest;
import com.geico.poc.policyjobs.dto.AlterJobRequest;
import com.geico.poc.policyjobs.dto.JobResponse;
import com.geico.poc.policyjobs.storage.Hypertable;
import com.geico.poc.policyjobs.storage.PartitioningType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the job REST endpoints: row shapes and error status mapping.
 */
public class JobControllerTest extends PolicyJobsTestBase {

    private static final String SUPERUSER = "postgres";

    @Autowired
    private JobController controller;

    private Hypertable ht;

    @BeforeEach
    public void setup() {
        ht = storage.createHypertable("public", uniqueName("api_ht"), "ts", PartitioningType.BIGINT);
        storage.setIntegerNowFunction(ht.getId(), () -> 500L);
    }

    private AddJobRequest retentionRequest(int hypertableId) throws Exception {
        AddJobRequest request = new AddJobRequest();
        request.setProc("_jobs_internal.policy_retention");
        request.setScheduleInterval("1 day");
        request.setConfig(json("{\"hypertable_id\": " + hypertableId + ", \"drop_after\": 100}"));
        return request;
    }

    private int addJob() throws Exception {
        ResponseEntity<JobResponse> response = controller.addJob(SUPERUSER, retentionRequest(ht.getId()));
        assertEquals(HttpStatus.OK, response.getStatusCode());
        return (Integer) response.getBody().getRows().get(0).get("job_id");
    }

    // ========================================
    // Success paths
    // ========================================

    @Test
    public void testAddJobReturnsRow() throws Exception {
        AddJobRequest request = retentionRequest(ht.getId());
        request.setInitialStart("2024-01-16T00:00:00Z");

        ResponseEntity<JobResponse> response = controller.addJob(SUPERUSER, request);

        assertEquals(HttpStatus.OK, response.getStatusCode());
        Map<String, Object> row = response.getBody().getRows().get(0);
        assertEquals("Retention Policy", row.get("application_name"));
        assertEquals("1 day", row.get("schedule_interval"));
        assertEquals("00:05:00", row.get("retry_period"));
        assertEquals("policy_retention", row.get("proc_name"));
        assertEquals(ht.getId(), row.get("hypertable_id"));
        assertEquals("2024-01-16T00:00:00Z", row.get("next_start"));
    }

    @Test
    public void testAlterJobReturnsRow() throws Exception {
        int jobId = addJob();
        AlterJobRequest request = new AlterJobRequest();
        request.setScheduleInterval("2 hours");
        request.setNextStart("infinity");

        ResponseEntity<JobResponse> response = controller.alterJob(SUPERUSER, jobId, false, request);

        assertEquals(HttpStatus.OK, response.getStatusCode());
        Map<String, Object> row = response.getBody().getRows().get(0);
        assertEquals(jobId, row.get("job_id"));
        assertEquals("02:00:00", row.get("schedule_interval"));
        assertEquals("infinity", row.get("next_start"));
    }

    @Test
    public void testAlterMissingJobIfExists() {
        ResponseEntity<JobResponse> response = controller.alterJob(SUPERUSER, 2, true, new AlterJobRequest());

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals(0, response.getBody().getRowCount());
    }

    @Test
    public void testRunAndDelete() throws Exception {
        storage.createChunk(ht.getId(), 0, 100);
        int jobId = addJob();

        ResponseEntity<JobResponse> run = controller.runJob(SUPERUSER, jobId);
        assertEquals(HttpStatus.OK, run.getStatusCode());
        assertEquals(Boolean.TRUE, run.getBody().getRows().get(0).get("success"));
        assertTrue(storage.getChunks(ht.getId()).get(0).isDropped());

        assertEquals(HttpStatus.OK, controller.deleteJob(SUPERUSER, jobId).getStatusCode());
        assertEquals(HttpStatus.NOT_FOUND, controller.getJob(jobId).getStatusCode());
    }

    // ========================================
    // Error mapping
    // ========================================

    @Test
    public void testBadConfigIsBadRequest() throws Exception {
        ResponseEntity<JobResponse> response = controller.addJob(SUPERUSER, retentionRequest(313131));

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals("configuration hypertable id 313131 not found", response.getBody().getError());
        assertEquals("22023", response.getBody().getSqlState());
    }

    @Test
    public void testBadIntervalIsBadRequest() throws Exception {
        AddJobRequest request = retentionRequest(ht.getId());
        request.setScheduleInterval("soon");

        assertEquals(HttpStatus.BAD_REQUEST, controller.addJob(SUPERUSER, request).getStatusCode());
    }

    @Test
    public void testUnknownJobIsNotFound() {
        ResponseEntity<JobResponse> response = controller.getJob(3);

        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
        assertEquals("job 3 not found", response.getBody().getError());
    }

    @Test
    public void testUnknownRoleIsForbidden() throws Exception {
        int jobId = addJob();

        ResponseEntity<JobResponse> response = controller.deleteJob(uniqueName("nobody"), jobId);

        assertEquals(HttpStatus.FORBIDDEN, response.getStatusCode());
        assertEquals("42501", response.getBody().getSqlState());
    }
}
