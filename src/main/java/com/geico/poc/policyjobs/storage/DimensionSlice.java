package com.geico.poc.policyjobs.storage;

/**
 * A range [rangeStart, rangeEnd) on one dimension. Chunks that share a range
 * on a dimension share the slice.
 */
public class DimensionSlice {

    private final int id;
    private final int dimensionId;
    private final long rangeStart;
    private final long rangeEnd;

    public DimensionSlice(int id, int dimensionId, long rangeStart, long rangeEnd) {
        if (rangeStart >= rangeEnd) {
            throw new IllegalArgumentException("slice range start must be before its end: [" +
                rangeStart + ", " + rangeEnd + ")");
        }
        this.id = id;
        this.dimensionId = dimensionId;
        this.rangeStart = rangeStart;
        this.rangeEnd = rangeEnd;
    }

    public int getId() {
        return id;
    }

    public int getDimensionId() {
        return dimensionId;
    }

    public long getRangeStart() {
        return rangeStart;
    }

    public long getRangeEnd() {
        return rangeEnd;
    }

    @Override
    public String toString() {
        return "DimensionSlice{id=" + id + ", dimension=" + dimensionId + ", range=[" + rangeStart + ", " + rangeEnd + ")}";
    }
}
