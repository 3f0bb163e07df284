package com.geico.poc.policyjobs.jobs.policy;

import com.geico.poc.policyjobs.storage.Chunk;
import com.geico.poc.policyjobs.storage.ContinuousAggregate;
import com.geico.poc.policyjobs.storage.Dimension;
import com.geico.poc.policyjobs.storage.Hypertable;
import com.geico.poc.policyjobs.storage.HypertableCatalog;
import com.geico.poc.policyjobs.storage.RelationName;
import com.geico.poc.policyjobs.storage.StorageBackend;
import com.geico.poc.policyjobs.transaction.TransactionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Drops chunks whose data is entirely older than {@code drop_after}.
 *
 * When the hypertable is the materialization of a continuous aggregate the
 * drop goes through the aggregate's view, never the internal table.
 */
@Component
public class RetentionPolicy implements PolicyExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetentionPolicy.class);

    @Autowired
    private HypertableCatalog catalog;

    @Autowired
    private StorageBackend storage;

    @Autowired
    private Clock clock;

    @Override
    public PolicyKind getKind() {
        return PolicyKind.RETENTION;
    }

    @Override
    public void validate(PolicyConfig config) {
        readAndValidate(config.as(RetentionConfig.class));
    }

    public Plan readAndValidate(RetentionConfig config) {
        Hypertable ht = PolicyUtils.requireHypertable(catalog, config.getHypertableId());
        Dimension dim = PolicyUtils.requireTimeDimension(ht);
        long boundary = PolicyUtils.subtractFromNow(catalog, dim, config.getDropAfter(),
            PolicyConfigParser.DROP_AFTER, clock);

        RelationName target = ht.getRelationName();
        ContinuousAggregate cagg = catalog.findContinuousAggByMatHypertableId(ht.getId());
        if (cagg != null) {
            target = cagg.getUserView();
        }
        return new Plan(ht, dim, target, config.getDropAfter(), boundary);
    }

    @Override
    public boolean execute(int jobId, PolicyConfig config, TransactionContext tx) {
        Plan plan = readAndValidate(config.as(RetentionConfig.class));
        long boundary = plan.getBoundary();
        List<Chunk> dropped = storage.dropChunks(plan.getTarget(), boundary, plan.getDimension().getType());
        log.info("Retention job {} dropped {} chunk(s) from {} older than {}", jobId, dropped.size(),
            plan.getTarget(), plan.getDimension().getType().toDisplayString(boundary));
        return true;
    }

    /**
     * Resolved target of a retention run.
     */
    public static class Plan {
        private final Hypertable hypertable;
        private final Dimension dimension;
        private final RelationName target;
        private final TimeOffset dropAfter;
        private final long boundary;

        Plan(Hypertable hypertable, Dimension dimension, RelationName target, TimeOffset dropAfter, long boundary) {
            this.hypertable = hypertable;
            this.dimension = dimension;
            this.target = target;
            this.dropAfter = dropAfter;
            this.boundary = boundary;
        }

        public Hypertable getHypertable() {
            return hypertable;
        }

        public Dimension getDimension() {
            return dimension;
        }

        /**
         * Relation the drop is issued against.
         */
        public RelationName getTarget() {
            return target;
        }

        public TimeOffset getDropAfter() {
            return dropAfter;
        }

        /**
         * {@code now - drop_after} in the dimension's internal form.
         */
        public long getBoundary() {
            return boundary;
        }
    }
}
