package com.geico.poc.policyjobs.jobs.policy;

public final class RetentionConfig extends PolicyConfig {

    private final int hypertableId;
    private final TimeOffset dropAfter;

    RetentionConfig(int hypertableId, TimeOffset dropAfter) {
        this.hypertableId = hypertableId;
        this.dropAfter = dropAfter;
    }

    @Override
    public PolicyKind getKind() {
        return PolicyKind.RETENTION;
    }

    @Override
    public Integer getHypertableId() {
        return hypertableId;
    }

    public TimeOffset getDropAfter() {
        return dropAfter;
    }

    @Override
    public String toString() {
        return "RetentionConfig{hypertable_id=" + hypertableId + ", drop_after=" + dropAfter + '}';
    }
}
