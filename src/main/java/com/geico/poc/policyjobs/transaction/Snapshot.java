package com.geico.poc.policyjobs.transaction;

import java.time.Instant;

/**
 * A read view taken at a point in time.
 */
public final class Snapshot {

    private final long id;
    private final Instant takenAt;

    public Snapshot(long id, Instant takenAt) {
        this.id = id;
        this.takenAt = takenAt;
    }

    public long getId() {
        return id;
    }

    public Instant getTakenAt() {
        return takenAt;
    }

    @Override
    public String toString() {
        return "Snapshot{id=" + id + ", takenAt=" + takenAt + '}';
    }
}
