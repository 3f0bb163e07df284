package com.geico.poc.policyjobs.jobs.policy;

import com.geico.poc.policyjobs.storage.ContinuousAggregate;
import com.geico.poc.policyjobs.storage.Dimension;
import com.geico.poc.policyjobs.storage.Hypertable;
import com.geico.poc.policyjobs.storage.HypertableCatalog;
import com.geico.poc.policyjobs.storage.PartitioningType;
import com.geico.poc.policyjobs.storage.RefreshWindow;
import com.geico.poc.policyjobs.storage.StorageBackend;
import com.geico.poc.policyjobs.errors.JobException;
import com.geico.poc.policyjobs.transaction.TransactionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Refreshes a continuous aggregate over {@code [now - start_offset, now - end_offset)}.
 */
@Component
public class ContinuousAggRefreshPolicy implements PolicyExecutor {

    private static final Logger log = LoggerFactory.getLogger(ContinuousAggRefreshPolicy.class);

    @Autowired
    private HypertableCatalog catalog;

    @Autowired
    private StorageBackend storage;

    @Autowired
    private Clock clock;

    @Override
    public PolicyKind getKind() {
        return PolicyKind.CONTINUOUS_AGG_REFRESH;
    }

    @Override
    public void validate(PolicyConfig config) {
        readAndValidate(config.as(ContinuousAggRefreshConfig.class));
    }

    public Plan readAndValidate(ContinuousAggRefreshConfig config) {
        Hypertable mat = PolicyUtils.requireHypertable(catalog, config.getMatHypertableId());
        ContinuousAggregate cagg = catalog.findContinuousAggByMatHypertableId(mat.getId());
        if (cagg == null) {
            throw JobException.invalidParameter(String.format(
                "configuration materialization hypertable id %d not found", config.getMatHypertableId()));
        }
        Dimension dim = PolicyUtils.requireTimeDimension(mat);
        PartitioningType type = dim.getType();

        long start = config.getStartOffset() == null
            ? type.getMinValue()
            : PolicyUtils.subtractFromNow(catalog, dim, config.getStartOffset(), PolicyConfigParser.START_OFFSET, clock);
        long end = config.getEndOffset() == null
            ? type.getMaxValue()
            : PolicyUtils.subtractFromNow(catalog, dim, config.getEndOffset(), PolicyConfigParser.END_OFFSET, clock);

        return new Plan(cagg, RefreshWindow.of(type, start, end));
    }

    @Override
    public boolean execute(int jobId, PolicyConfig config, TransactionContext tx) {
        Plan plan = readAndValidate(config.as(ContinuousAggRefreshConfig.class));
        RefreshWindow window = plan.getWindow();
        log.info(String.format("refresh continuous aggregate range %s , %s",
            window.getType().toDisplayString(window.getStart()),
            window.getType().toDisplayString(window.getEnd())));
        storage.refreshContinuousAggregate(plan.getContinuousAggregate(), window, tx);
        return true;
    }

    /**
     * Resolved aggregate and window of a refresh run.
     */
    public static class Plan {
        private final ContinuousAggregate continuousAggregate;
        private final RefreshWindow window;

        Plan(ContinuousAggregate continuousAggregate, RefreshWindow window) {
            this.continuousAggregate = continuousAggregate;
            this.window = window;
        }

        public ContinuousAggregate getContinuousAggregate() {
            return continuousAggregate;
        }

        public RefreshWindow getWindow() {
            return window;
        }
    }
}
