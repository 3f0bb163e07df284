package com.geico.poc.policyjobs.jobs.policy;

import com.geico.poc.policyjobs.time.Intervals;

import java.time.Duration;
import java.util.Objects;

/**
 * Distance back from "now": an interval for timestamp dimensions, a plain
 * number for integer dimensions.
 */
public final class TimeOffset {

    private final Duration interval;
    private final Long integer;

    private TimeOffset(Duration interval, Long integer) {
        this.interval = interval;
        this.integer = integer;
    }

    public static TimeOffset ofInterval(Duration interval) {
        return new TimeOffset(Objects.requireNonNull(interval, "interval"), null);
    }

    public static TimeOffset ofInteger(long value) {
        return new TimeOffset(null, value);
    }

    /**
     * Integer text becomes an integer offset, anything else must be an interval.
     */
    public static TimeOffset parse(String text) {
        String trimmed = text.trim();
        try {
            return ofInteger(Long.parseLong(trimmed));
        } catch (NumberFormatException e) {
            return ofInterval(Intervals.parse(trimmed));
        }
    }

    public boolean isInterval() {
        return interval != null;
    }

    public Duration getInterval() {
        if (interval == null) {
            throw new IllegalStateException("integer offset has no interval: " + integer);
        }
        return interval;
    }

    public long getInteger() {
        if (integer == null) {
            throw new IllegalStateException("interval offset has no integer value: " + interval);
        }
        return integer;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TimeOffset)) {
            return false;
        }
        TimeOffset other = (TimeOffset) o;
        return Objects.equals(interval, other.interval) && Objects.equals(integer, other.integer);
    }

    @Override
    public int hashCode() {
        return Objects.hash(interval, integer);
    }

    @Override
    public String toString() {
        return interval != null ? Intervals.format(interval) : integer.toString();
    }
}
