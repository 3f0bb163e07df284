package com.geico.poc.policyjobs.jobs.policy;

import com.geico.poc.policyjobs.PolicyJobsTestBase;
import com.geico.poc.policyjobs.errors.ErrorCode;
import com.geico.poc.policyjobs.errors.JobException;
import com.geico.poc.policyjobs.storage.ContinuousAggregate;
import com.geico.poc.policyjobs.storage.Hypertable;
import com.geico.poc.policyjobs.storage.PartitioningType;
import com.geico.poc.policyjobs.storage.RefreshWindow;
import com.geico.poc.policyjobs.transaction.LocalTransactionContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the continuous aggregate refresh policy over an integer
 * hypertable whose "now" is 200.
 */
public class ContinuousAggRefreshPolicyTest extends PolicyJobsTestBase {

    @Autowired
    private ContinuousAggRefreshPolicy refreshPolicy;

    @Autowired
    private PolicyConfigParser parser;

    private ContinuousAggregate cagg;

    @BeforeEach
    public void setup() {
        Hypertable raw = storage.createHypertable("public", uniqueName("readings"), "ts", PartitioningType.INTEGER);
        storage.setIntegerNowFunction(raw.getId(), () -> 200L);
        cagg = storage.createContinuousAggregate(raw.getId(), "public", uniqueName("readings_hourly"));
    }

    private PolicyConfig config(String offsets) throws Exception {
        String body = "{\"mat_hypertable_id\": " + cagg.getMatHypertableId()
            + (offsets.isEmpty() ? "" : ", " + offsets) + "}";
        return parser.parse(PolicyKind.CONTINUOUS_AGG_REFRESH, json(body));
    }

    private RefreshWindow window(String offsets) throws Exception {
        return refreshPolicy.readAndValidate(config(offsets).as(ContinuousAggRefreshConfig.class)).getWindow();
    }

    // ========================================
    // Refresh window
    // ========================================

    @Test
    public void testWindowFromOffsets() throws Exception {
        RefreshWindow window = window("\"start_offset\": 150, \"end_offset\": 100");

        assertEquals(50, window.getStart());
        assertEquals(100, window.getEnd());
    }

    @Test
    public void testInvertedWindowIsRejected() throws Exception {
        JobException e = assertThrows(JobException.class,
            () -> window("\"start_offset\": 100, \"end_offset\": 150"));

        assertEquals(ErrorCode.INVALID_PARAMETER, e.getCode());
        assertEquals("invalid refresh window", e.getMessage());
        assertEquals("start_offset: 100, end_offset: 50", e.getDetail());
    }

    @Test
    public void testEmptyWindowIsRejected() throws Exception {
        JobException e = assertThrows(JobException.class,
            () -> window("\"start_offset\": 100, \"end_offset\": 100"));
        assertEquals(ErrorCode.INVALID_PARAMETER, e.getCode());
    }

    @Test
    public void testNullOffsetsAreUnbounded() throws Exception {
        RefreshWindow window = window("\"start_offset\": null, \"end_offset\": null");
        assertEquals(Integer.MIN_VALUE, window.getStart());
        assertEquals(Integer.MAX_VALUE, window.getEnd());

        window = window("");
        assertEquals(Integer.MIN_VALUE, window.getStart());
        assertEquals(Integer.MAX_VALUE, window.getEnd());

        window = window("\"end_offset\": 10");
        assertEquals(Integer.MIN_VALUE, window.getStart());
        assertEquals(190, window.getEnd());
    }

    @Test
    public void testLargeOffsetSaturates() throws Exception {
        RefreshWindow window = window("\"start_offset\": 9000000000, \"end_offset\": 0");

        assertEquals(Integer.MIN_VALUE, window.getStart());
        assertEquals(200, window.getEnd());
    }

    // ========================================
    // Validation and execution
    // ========================================

    @Test
    public void testPlainHypertableIsNotAnAggregate() throws Exception {
        Hypertable plain = storage.createHypertable("public", uniqueName("plain"), "ts", PartitioningType.INTEGER);
        PolicyConfig config = parser.parse(PolicyKind.CONTINUOUS_AGG_REFRESH,
            json("{\"mat_hypertable_id\": " + plain.getId() + "}"));

        JobException e = assertThrows(JobException.class, () -> refreshPolicy.validate(config));
        assertEquals(ErrorCode.INVALID_PARAMETER, e.getCode());
        assertEquals("configuration materialization hypertable id " + plain.getId() + " not found", e.getMessage());
    }

    @Test
    public void testIntervalOffsetOnIntegerAggregate() throws Exception {
        JobException e = assertThrows(JobException.class,
            () -> refreshPolicy.validate(config("\"start_offset\": \"1 day\"")));
        assertEquals("invalid value for \"start_offset\" in config for job", e.getMessage());
    }

    @Test
    public void testExecuteRefreshesAndCommits() throws Exception {
        LocalTransactionContext tx = new LocalTransactionContext(clock);
        tx.begin();
        int commitsBefore = tx.getCommitCount();

        assertTrue(refreshPolicy.execute(insertJob("policy_refresh_continuous_aggregate", null),
            config("\"start_offset\": 150, \"end_offset\": 100"), tx));

        List<RefreshWindow> history = storage.getRefreshHistory(cagg.getMatHypertableId());
        assertEquals(1, history.size());
        assertEquals(50, history.get(0).getStart());
        assertEquals(100, history.get(0).getEnd());
        assertEquals(commitsBefore + 1, tx.getCommitCount());
        assertTrue(tx.isTransactionOpen(), "refresh commits and chains a new transaction");
    }
}
