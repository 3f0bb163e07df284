package com.geico.poc.policyjobs.jobs.policy;

import com.geico.poc.policyjobs.errors.JobException;
import com.geico.poc.policyjobs.jobs.FastRestart;
import com.geico.poc.policyjobs.storage.Chunk;
import com.geico.poc.policyjobs.storage.Dimension;
import com.geico.poc.policyjobs.storage.Hypertable;
import com.geico.poc.policyjobs.storage.HypertableCatalog;
import com.geico.poc.policyjobs.storage.StorageBackend;
import com.geico.poc.policyjobs.transaction.TransactionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Compresses one chunk per run among those whose range ends before
 * {@code now - compress_after}.
 */
@Component
public class CompressionPolicy implements PolicyExecutor {

    private static final Logger log = LoggerFactory.getLogger(CompressionPolicy.class);

    @Autowired
    private HypertableCatalog catalog;

    @Autowired
    private StorageBackend storage;

    @Autowired
    private FastRestart fastRestart;

    @Autowired
    private Clock clock;

    @Override
    public PolicyKind getKind() {
        return PolicyKind.COMPRESSION;
    }

    @Override
    public void validate(PolicyConfig config) {
        readAndValidate(config.as(CompressionConfig.class));
    }

    public Plan readAndValidate(CompressionConfig config) {
        Hypertable ht = PolicyUtils.requireHypertable(catalog, config.getHypertableId());
        if (!ht.isCompressionEnabled()) {
            throw JobException.featureNotSupported(
                String.format("compression not enabled on hypertable \"%s\"", ht));
        }
        Dimension dim = PolicyUtils.requireTimeDimension(ht);
        PolicyUtils.checkOffsetType(dim, config.getCompressAfter(), PolicyConfigParser.COMPRESS_AFTER);
        // fails early when an integer dimension has no integer-now function
        PolicyUtils.now(catalog, dim, clock);
        return new Plan(ht, dim, config.getCompressAfter());
    }

    @Override
    public boolean execute(int jobId, PolicyConfig config, TransactionContext tx) {
        Plan plan = readAndValidate(config.as(CompressionConfig.class));
        long boundary = PolicyUtils.subtractFromNow(catalog, plan.getDimension(), plan.getCompressAfter(),
            PolicyConfigParser.COMPRESS_AFTER, clock);
        int dimensionId = plan.getDimension().getId();

        Chunk chunk = catalog.chunkToCompress(dimensionId, boundary);
        if (chunk == null) {
            log.info(String.format("no chunks for hypertable %s that satisfy compress chunk policy", plan.getHypertable()));
            return true;
        }

        log.debug("Compressing chunk {}", chunk);
        storage.compressChunk(chunk);

        if (catalog.chunkToCompress(dimensionId, boundary) != null) {
            fastRestart.enable(jobId, "compression");
        }
        return true;
    }

    /**
     * Resolved hypertable and offset of a compression run.
     */
    public static class Plan {
        private final Hypertable hypertable;
        private final Dimension dimension;
        private final TimeOffset compressAfter;

        Plan(Hypertable hypertable, Dimension dimension, TimeOffset compressAfter) {
            this.hypertable = hypertable;
            this.dimension = dimension;
            this.compressAfter = compressAfter;
        }

        public Hypertable getHypertable() {
            return hypertable;
        }

        public Dimension getDimension() {
            return dimension;
        }

        public TimeOffset getCompressAfter() {
            return compressAfter;
        }
    }
}
