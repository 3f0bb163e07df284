package com.geico.poc.policyjobs.jobs.policy;

import com.geico.poc.policyjobs.config.PolicyJobsConfig;
import com.geico.poc.policyjobs.errors.JobException;
import com.geico.poc.policyjobs.jobs.FastRestart;
import com.geico.poc.policyjobs.storage.Chunk;
import com.geico.poc.policyjobs.storage.ChunkStatsStore;
import com.geico.poc.policyjobs.storage.Dimension;
import com.geico.poc.policyjobs.storage.DimensionSlice;
import com.geico.poc.policyjobs.storage.Hypertable;
import com.geico.poc.policyjobs.storage.HypertableCatalog;
import com.geico.poc.policyjobs.storage.IndexMetadata;
import com.geico.poc.policyjobs.storage.StorageBackend;
import com.geico.poc.policyjobs.transaction.TransactionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Reorders one chunk per run along a configured index.
 *
 * The newest slices of the time dimension are left alone since they are
 * still being written. Of the older chunks, the oldest one this job has not
 * processed yet is picked. A chunk is reordered at most once per job: the
 * chunk stats only record that a run happened, so "recently reordered" means
 * "ever reordered".
 */
@Component
public class ReorderPolicy implements PolicyExecutor {

    private static final Logger log = LoggerFactory.getLogger(ReorderPolicy.class);

    @Autowired
    private PolicyJobsConfig config;

    @Autowired
    private HypertableCatalog catalog;

    @Autowired
    private StorageBackend storage;

    @Autowired
    private ChunkStatsStore chunkStats;

    @Autowired
    private FastRestart fastRestart;

    @Autowired
    private Clock clock;

    @Override
    public PolicyKind getKind() {
        return PolicyKind.REORDER;
    }

    @Override
    public void validate(PolicyConfig config) {
        readAndValidate(config.as(ReorderConfig.class));
    }

    public Plan readAndValidate(ReorderConfig reorderConfig) {
        Hypertable ht = PolicyUtils.requireHypertable(catalog, reorderConfig.getHypertableId());
        Dimension dim = PolicyUtils.requireTimeDimension(ht);

        IndexMetadata index = catalog.findIndex(ht.getSchemaName(), reorderConfig.getIndexName());
        if (index == null) {
            throw JobException.undefinedObject("reorder index not found",
                String.format("No index \"%s\" in schema \"%s\".", reorderConfig.getIndexName(), ht.getSchemaName()));
        }
        if (index.getHypertableId() != ht.getId()) {
            throw JobException.invalidParameter("invalid reorder index",
                String.format("Index \"%s\" is not an index on hypertable \"%s\".", index, ht), null);
        }
        return new Plan(ht, dim, index);
    }

    @Override
    public boolean execute(int jobId, PolicyConfig policyConfig, TransactionContext tx) {
        Plan plan = readAndValidate(policyConfig.as(ReorderConfig.class));

        Chunk chunk = findChunkToReorder(jobId, plan);
        if (chunk == null) {
            log.info(String.format("no chunks need reordering for hypertable %s", plan.getHypertable()));
            return true;
        }

        log.debug("Reordering chunk {} using index {}", chunk, plan.getIndex());
        storage.reorderChunk(chunk, plan.getIndex());
        chunkStats.recordJobRun(jobId, chunk.getId(), clock.instant());

        if (findChunkToReorder(jobId, plan) != null) {
            fastRestart.enable(jobId, "reorder");
        }
        return true;
    }

    private Chunk findChunkToReorder(int jobId, Plan plan) {
        int skip = config.getPolicies().getReorderSkipRecentSlices();
        int dimensionId = plan.getDimension().getId();
        DimensionSlice nth = catalog.nthLatestSlice(dimensionId, skip);
        if (nth == null) {
            return null;
        }
        return catalog.oldestChunkForReorder(jobId, dimensionId, nth.getRangeStart());
    }

    /**
     * Resolved hypertable and index of a reorder run.
     */
    public static class Plan {
        private final Hypertable hypertable;
        private final Dimension dimension;
        private final IndexMetadata index;

        Plan(Hypertable hypertable, Dimension dimension, IndexMetadata index) {
            this.hypertable = hypertable;
            this.dimension = dimension;
            this.index = index;
        }

        public Hypertable getHypertable() {
            return hypertable;
        }

        public Dimension getDimension() {
            return dimension;
        }

        public IndexMetadata getIndex() {
            return index;
        }
    }
}
