package com.geico.poc.policyjobs.jobs.policy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.geico.poc.policyjobs.config.PolicyJobsConfig;
import com.geico.poc.policyjobs.errors.ErrorCode;
import com.geico.poc.policyjobs.errors.JobException;
import com.geico.poc.policyjobs.routine.RoutineName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for parsing config documents into typed policy configs.
 */
public class PolicyConfigParserTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final PolicyConfigParser parser = new PolicyConfigParser(new PolicyJobsConfig());

    private JsonNode json(String text) throws Exception {
        return mapper.readTree(text);
    }

    // ========================================
    // Kind resolution
    // ========================================

    @Test
    public void testKindFromRoutineName() {
        assertEquals(PolicyKind.RETENTION, parser.kindOf(new RoutineName("_jobs_internal", "policy_retention")));
        assertEquals(PolicyKind.CONTINUOUS_AGG_REFRESH,
            parser.kindOf(new RoutineName("_jobs_internal", "policy_refresh_continuous_aggregate")));
        // same name outside the internal schema is just a user routine
        assertEquals(PolicyKind.CUSTOM, parser.kindOf(new RoutineName("public", "policy_retention")));
        assertEquals(PolicyKind.CUSTOM, parser.kindOf(new RoutineName("public", "my_job")));
    }

    // ========================================
    // Built-in variants
    // ========================================

    @Test
    public void testParseRetention() throws Exception {
        RetentionConfig config = parser.parse(PolicyKind.RETENTION,
            json("{\"hypertable_id\": 3, \"drop_after\": \"7 days\"}")).as(RetentionConfig.class);

        assertEquals(3, config.getHypertableId());
        assertTrue(config.getDropAfter().isInterval());
        assertEquals(Duration.ofDays(7), config.getDropAfter().getInterval());
    }

    @Test
    public void testParseIntegerOffsets() throws Exception {
        CompressionConfig numeric = parser.parse(PolicyKind.COMPRESSION,
            json("{\"hypertable_id\": 1, \"compress_after\": 100}")).as(CompressionConfig.class);
        assertFalse(numeric.getCompressAfter().isInterval());
        assertEquals(100L, numeric.getCompressAfter().getInteger());

        CompressionConfig text = parser.parse(PolicyKind.COMPRESSION,
            json("{\"hypertable_id\": \"1\", \"compress_after\": \"100\"}")).as(CompressionConfig.class);
        assertEquals(1, text.getHypertableId());
        assertEquals(100L, text.getCompressAfter().getInteger());
    }

    @Test
    public void testParseReorder() throws Exception {
        ReorderConfig config = parser.parse(PolicyKind.REORDER,
            json("{\"hypertable_id\": 2, \"index_name\": \"conditions_time_idx\"}")).as(ReorderConfig.class);
        assertEquals(2, config.getHypertableId());
        assertEquals("conditions_time_idx", config.getIndexName());
    }

    @Test
    public void testParseRefreshWithOpenEnds() throws Exception {
        ContinuousAggRefreshConfig config = parser.parse(PolicyKind.CONTINUOUS_AGG_REFRESH,
            json("{\"mat_hypertable_id\": 5, \"start_offset\": null}")).as(ContinuousAggRefreshConfig.class);

        assertEquals(5, config.getMatHypertableId());
        assertNull(config.getStartOffset());
        assertNull(config.getEndOffset());
    }

    // ========================================
    // Errors
    // ========================================

    @Test
    public void testMissingRequiredField() throws Exception {
        JobException e = assertThrows(JobException.class, () ->
            parser.parse(PolicyKind.RETENTION, json("{\"hypertable_id\": 3}")));
        assertEquals(ErrorCode.INVALID_PARAMETER, e.getCode());
        assertEquals("could not find \"drop_after\" in config for job", e.getMessage());

        e = assertThrows(JobException.class, () ->
            parser.parse(PolicyKind.REORDER, json("{\"index_name\": \"idx\"}")));
        assertEquals("could not find \"hypertable_id\" in config for job", e.getMessage());
    }

    @Test
    public void testInvalidFieldValues() throws Exception {
        JobException e = assertThrows(JobException.class, () ->
            parser.parse(PolicyKind.REORDER, json("{\"hypertable_id\": 1.5, \"index_name\": \"idx\"}")));
        assertEquals("invalid value for \"hypertable_id\" in config for job", e.getMessage());

        e = assertThrows(JobException.class, () ->
            parser.parse(PolicyKind.RETENTION, json("{\"hypertable_id\": 1, \"drop_after\": \"a while\"}")));
        assertEquals(ErrorCode.INVALID_PARAMETER, e.getCode());
    }

    @Test
    public void testBuiltInNeedsObject() throws Exception {
        JobException e = assertThrows(JobException.class, () ->
            parser.parse(PolicyKind.RETENTION, json("[1, 2]")));
        assertEquals(ErrorCode.INVALID_PARAMETER, e.getCode());

        e = assertThrows(JobException.class, () -> parser.parse(PolicyKind.COMPRESSION, null));
        assertEquals("config must not be NULL", e.getMessage());
    }

    @Test
    public void testCustomPassesThrough() throws Exception {
        JsonNode doc = json("{\"anything\": [1, 2, 3]}");
        CustomConfig config = parser.parse(new RoutineName("public", "my_job"), doc).as(CustomConfig.class);

        assertEquals(doc, config.getDocument());
        assertNull(config.getHypertableId());
        assertNull(parser.parse(PolicyKind.CUSTOM, null).as(CustomConfig.class).getDocument());
    }

    @Test
    public void testWrongVariantCast() throws Exception {
        PolicyConfig config = parser.parse(PolicyKind.REORDER, json("{\"hypertable_id\": 1, \"index_name\": \"i\"}"));
        assertThrows(IllegalStateException.class, () -> config.as(RetentionConfig.class));
    }
}
