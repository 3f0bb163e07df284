package com.geico.poc.policyjobs.jobs.policy;

public final class CompressionConfig extends PolicyConfig {

    private final int hypertableId;
    private final TimeOffset compressAfter;

    CompressionConfig(int hypertableId, TimeOffset compressAfter) {
        this.hypertableId = hypertableId;
        this.compressAfter = compressAfter;
    }

    @Override
    public PolicyKind getKind() {
        return PolicyKind.COMPRESSION;
    }

    @Override
    public Integer getHypertableId() {
        return hypertableId;
    }

    public TimeOffset getCompressAfter() {
        return compressAfter;
    }

    @Override
    public String toString() {
        return "CompressionConfig{hypertable_id=" + hypertableId + ", compress_after=" + compressAfter + '}';
    }
}
