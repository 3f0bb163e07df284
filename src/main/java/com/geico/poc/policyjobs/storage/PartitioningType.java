package com.geico.poc.policyjobs.storage;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;

/**
 * Column types a hypertable can be partitioned on.
 *
 * Time values are handled in an internal int64 form: the integer value itself
 * for integer types, microseconds since the Unix epoch for temporal types.
 */
public enum PartitioningType {
    SMALLINT(true, Short.MIN_VALUE, Short.MAX_VALUE),
    INTEGER(true, Integer.MIN_VALUE, Integer.MAX_VALUE),
    BIGINT(true, Long.MIN_VALUE, Long.MAX_VALUE),
    DATE(false, Long.MIN_VALUE, Long.MAX_VALUE),
    TIMESTAMP(false, Long.MIN_VALUE, Long.MAX_VALUE),
    TIMESTAMPTZ(false, Long.MIN_VALUE, Long.MAX_VALUE);

    private static final long MICROS_PER_DAY = 86_400_000_000L;

    private final boolean integer;
    private final long minValue;
    private final long maxValue;

    PartitioningType(boolean integer, long minValue, long maxValue) {
        this.integer = integer;
        this.minValue = minValue;
        this.maxValue = maxValue;
    }

    public boolean isInteger() {
        return integer;
    }

    /**
     * Smallest internal value; for temporal types this is -infinity.
     */
    public long getMinValue() {
        return minValue;
    }

    /**
     * Largest internal value; for temporal types this is +infinity.
     */
    public long getMaxValue() {
        return maxValue;
    }

    /**
     * Clamps an integer result to the range of this type.
     */
    public long clamp(long value) {
        return Math.max(minValue, Math.min(maxValue, value));
    }

    public long fromInstant(Instant instant) {
        if (integer) {
            throw new IllegalStateException("cannot convert a timestamp to integer type " + this);
        }
        long micros = ChronoUnit.MICROS.between(Instant.EPOCH, instant);
        if (this == DATE) {
            return Math.floorDiv(micros, MICROS_PER_DAY) * MICROS_PER_DAY;
        }
        return micros;
    }

    public Instant toInstant(long internal) {
        if (integer) {
            throw new IllegalStateException("cannot convert integer type " + this + " to a timestamp");
        }
        return Instant.EPOCH.plus(internal, ChronoUnit.MICROS);
    }

    /**
     * Renders an internal value for log lines and error details.
     */
    public String toDisplayString(long internal) {
        if (integer) {
            return Long.toString(internal);
        }
        if (internal == Long.MIN_VALUE) {
            return "-infinity";
        }
        if (internal == Long.MAX_VALUE) {
            return "infinity";
        }
        if (this == DATE) {
            return LocalDate.ofInstant(toInstant(internal), ZoneOffset.UTC).toString();
        }
        return toInstant(internal).toString();
    }
}
