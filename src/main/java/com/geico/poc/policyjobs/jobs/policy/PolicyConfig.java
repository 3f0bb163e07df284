package com.geico.poc.policyjobs.jobs.policy;

/**
 * Parsed, typed form of a job's config document. Produced only by
 * {@link PolicyConfigParser}; the subclasses are the complete set.
 */
public abstract class PolicyConfig {

    PolicyConfig() {
    }

    public abstract PolicyKind getKind();

    /**
     * Hypertable the job acts on, null for custom jobs.
     */
    public abstract Integer getHypertableId();

    public <T extends PolicyConfig> T as(Class<T> type) {
        if (!type.isInstance(this)) {
            throw new IllegalStateException("expected " + type.getSimpleName() + " but config is " + getKind());
        }
        return type.cast(this);
    }
}
