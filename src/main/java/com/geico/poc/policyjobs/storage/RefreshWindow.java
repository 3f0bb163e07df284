package com.geico.poc.policyjobs.storage;

import com.geico.poc.policyjobs.errors.JobException;

/**
 * A half-open refresh window [start, end) in the internal time form of a
 * dimension type.
 */
public final class RefreshWindow {

    private final PartitioningType type;
    private final long start;
    private final long end;

    private RefreshWindow(PartitioningType type, long start, long end) {
        this.type = type;
        this.start = start;
        this.end = end;
    }

    /**
     * Builds a window, rejecting one whose start is not before its end.
     */
    public static RefreshWindow of(PartitioningType type, long start, long end) {
        if (start >= end) {
            throw JobException.invalidParameter(
                "invalid refresh window",
                "start_offset: " + type.toDisplayString(start) + ", end_offset: " + type.toDisplayString(end),
                "The start of the window must be before the end.");
        }
        return new RefreshWindow(type, start, end);
    }

    public PartitioningType getType() {
        return type;
    }

    public long getStart() {
        return start;
    }

    public long getEnd() {
        return end;
    }

    @Override
    public String toString() {
        return "[" + type.toDisplayString(start) + ", " + type.toDisplayString(end) + ")";
    }
}
