package com.geico.poc.policyjobs.jobs.policy;

/**
 * Refresh settings for a continuous aggregate. A missing start offset means
 * the window is open towards the past, a missing end offset that it is open
 * towards the future.
 */
public final class ContinuousAggRefreshConfig extends PolicyConfig {

    private final int matHypertableId;
    private final TimeOffset startOffset;
    private final TimeOffset endOffset;

    ContinuousAggRefreshConfig(int matHypertableId, TimeOffset startOffset, TimeOffset endOffset) {
        this.matHypertableId = matHypertableId;
        this.startOffset = startOffset;
        this.endOffset = endOffset;
    }

    @Override
    public PolicyKind getKind() {
        return PolicyKind.CONTINUOUS_AGG_REFRESH;
    }

    @Override
    public Integer getHypertableId() {
        return matHypertableId;
    }

    public int getMatHypertableId() {
        return matHypertableId;
    }

    /**
     * @return the offset, or null if unbounded
     */
    public TimeOffset getStartOffset() {
        return startOffset;
    }

    /**
     * @return the offset, or null if unbounded
     */
    public TimeOffset getEndOffset() {
        return endOffset;
    }

    @Override
    public String toString() {
        return "ContinuousAggRefreshConfig{mat_hypertable_id=" + matHypertableId +
               ", start_offset=" + startOffset + ", end_offset=" + endOffset + '}';
    }
}
