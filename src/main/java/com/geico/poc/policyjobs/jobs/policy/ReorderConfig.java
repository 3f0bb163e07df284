package com.geico.poc.policyjobs.jobs.policy;

public final class ReorderConfig extends PolicyConfig {

    private final int hypertableId;
    private final String indexName;

    ReorderConfig(int hypertableId, String indexName) {
        this.hypertableId = hypertableId;
        this.indexName = indexName;
    }

    @Override
    public PolicyKind getKind() {
        return PolicyKind.REORDER;
    }

    @Override
    public Integer getHypertableId() {
        return hypertableId;
    }

    public String getIndexName() {
        return indexName;
    }

    @Override
    public String toString() {
        return "ReorderConfig{hypertable_id=" + hypertableId + ", index_name=" + indexName + '}';
    }
}
