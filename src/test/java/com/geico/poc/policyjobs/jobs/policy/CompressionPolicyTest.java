package com.geico.poc.policyjobs.jobs.policy;

import com.geico.poc.policyjobs.PolicyJobsTestBase;
import com.geico.poc.policyjobs.errors.ErrorCode;
import com.geico.poc.policyjobs.errors.JobException;
import com.geico.poc.policyjobs.jobs.JobStat;
import com.geico.poc.policyjobs.storage.Chunk;
import com.geico.poc.policyjobs.storage.Hypertable;
import com.geico.poc.policyjobs.storage.PartitioningType;
import com.geico.poc.policyjobs.transaction.LocalTransactionContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the compression policy: one chunk per run, fast restart while
 * more chunks qualify.
 */
public class CompressionPolicyTest extends PolicyJobsTestBase {

    @Autowired
    private CompressionPolicy compressionPolicy;

    @Autowired
    private PolicyConfigParser parser;

    private Hypertable ht;
    private LocalTransactionContext tx;

    @BeforeEach
    public void setup() {
        ht = storage.createHypertable("public", uniqueName("compress"), "ts", PartitioningType.BIGINT);
        storage.setIntegerNowFunction(ht.getId(), () -> 100L);
        storage.enableCompression(ht.getId());
        tx = new LocalTransactionContext(clock);
        tx.begin();
    }

    private PolicyConfig config(String compressAfter) throws Exception {
        return parser.parse(PolicyKind.COMPRESSION,
            json("{\"hypertable_id\": " + ht.getId() + ", \"compress_after\": " + compressAfter + "}"));
    }

    // ========================================
    // Fast restart
    // ========================================

    @Test
    public void testFastRestartWhileChunksRemain() throws Exception {
        Chunk oldest = storage.createChunk(ht.getId(), 0, 10);
        Chunk second = storage.createChunk(ht.getId(), 10, 20);
        storage.createChunk(ht.getId(), 90, 100);

        PolicyConfig config = config("50");
        int jobId = insertJob("policy_compression", null);
        Instant lastStart = clock.instant().minus(Duration.ofMinutes(1));
        Instant scheduled = clock.instant().plus(Duration.ofHours(1));
        jobStore.updateStat(jobId, stat -> {
            stat.setLastStart(lastStart);
            stat.setNextStart(scheduled);
        });

        // first run: one chunk compressed, another still qualifies
        assertTrue(compressionPolicy.execute(jobId, config, tx));
        assertTrue(storage.getChunkById(oldest.getId()).isCompressed());
        assertFalse(storage.getChunkById(second.getId()).isCompressed());
        assertEquals(lastStart, jobStore.findStat(jobId).getNextStart(), "fast restart should reset next_start");

        // second run: last qualifying chunk, no fast restart
        jobStore.updateStat(jobId, stat -> stat.setNextStart(scheduled));
        assertTrue(compressionPolicy.execute(jobId, config, tx));
        assertTrue(storage.getChunkById(second.getId()).isCompressed());
        assertEquals(scheduled, jobStore.findStat(jobId).getNextStart());

        System.out.println("✅ Compression fast restart works");
    }

    @Test
    public void testNoEligibleChunksIsSuccess() throws Exception {
        storage.createChunk(ht.getId(), 60, 70);
        int jobId = insertJob("policy_compression", null);

        assertTrue(compressionPolicy.execute(jobId, config("50"), tx));

        assertNull(jobStore.findStat(jobId), "nothing compressed, no fast restart");
    }

    @Test
    public void testChunkEndingAtBoundaryIsNotCompressed() throws Exception {
        Chunk atBoundary = storage.createChunk(ht.getId(), 40, 50);
        int jobId = insertJob("policy_compression", null);

        compressionPolicy.execute(jobId, config("50"), tx);

        assertFalse(storage.getChunkById(atBoundary.getId()).isCompressed());
    }

    @Test
    public void testTimestampHypertable() throws Exception {
        Hypertable conditions = storage.createHypertable("public", uniqueName("conditions"), "time",
            PartitioningType.TIMESTAMPTZ);
        storage.enableCompression(conditions.getId());
        long now = PartitioningType.TIMESTAMPTZ.fromInstant(clock.instant());
        long day = Duration.ofDays(1).toNanos() / 1000;
        Chunk old = storage.createChunk(conditions.getId(), now - 10 * day, now - 9 * day);
        Chunk recent = storage.createChunk(conditions.getId(), now - day, now);

        PolicyConfig config = parser.parse(PolicyKind.COMPRESSION,
            json("{\"hypertable_id\": " + conditions.getId() + ", \"compress_after\": \"7 days\"}"));
        compressionPolicy.execute(insertJob("policy_compression", null), config, tx);

        assertTrue(storage.getChunkById(old.getId()).isCompressed());
        assertFalse(storage.getChunkById(recent.getId()).isCompressed());
    }

    // ========================================
    // Validation
    // ========================================

    @Test
    public void testValidationErrors() throws Exception {
        Hypertable plain = storage.createHypertable("public", uniqueName("uncompressed"), "ts", PartitioningType.BIGINT);
        JobException e = assertThrows(JobException.class, () -> compressionPolicy.validate(parser.parse(
            PolicyKind.COMPRESSION, json("{\"hypertable_id\": " + plain.getId() + ", \"compress_after\": 5}"))));
        assertEquals(ErrorCode.FEATURE_NOT_SUPPORTED, e.getCode());

        e = assertThrows(JobException.class, () -> compressionPolicy.validate(parser.parse(
            PolicyKind.COMPRESSION, json("{\"hypertable_id\": 999999, \"compress_after\": 5}"))));
        assertEquals(ErrorCode.INVALID_PARAMETER, e.getCode());
        assertEquals("configuration hypertable id 999999 not found", e.getMessage());

        e = assertThrows(JobException.class, () -> compressionPolicy.validate(config("\"7 days\"")));
        assertEquals(ErrorCode.INVALID_PARAMETER, e.getCode());
        assertEquals("invalid value for \"compress_after\" in config for job", e.getMessage());
    }

    @Test
    public void testValidationRequiresIntegerNow() throws Exception {
        Hypertable noNow = storage.createHypertable("public", uniqueName("compress_no_now"), "ts",
            PartitioningType.BIGINT);
        storage.enableCompression(noNow.getId());
        PolicyConfig config = parser.parse(PolicyKind.COMPRESSION,
            json("{\"hypertable_id\": " + noNow.getId() + ", \"compress_after\": 5}"));

        JobException e = assertThrows(JobException.class, () -> compressionPolicy.validate(config));
        assertEquals(ErrorCode.INTERNAL, e.getCode());
    }

    @Test
    public void testValidateHasNoSideEffects() throws Exception {
        Chunk chunk = storage.createChunk(ht.getId(), 0, 10);
        int jobId = insertJob("policy_compression", null);

        compressionPolicy.validate(config("50"));
        compressionPolicy.validate(config("50"));

        assertFalse(storage.getChunkById(chunk.getId()).isCompressed());
        JobStat stat = jobStore.findStat(jobId);
        assertNull(stat);
    }
}
