package com.geico.poc.policyjobs.jobs.policy;

import com.geico.poc.policyjobs.errors.JobException;
import com.geico.poc.policyjobs.storage.ContinuousAggregate;
import com.geico.poc.policyjobs.storage.Dimension;
import com.geico.poc.policyjobs.storage.Hypertable;
import com.geico.poc.policyjobs.storage.HypertableCatalog;
import com.geico.poc.policyjobs.storage.PartitioningType;

import java.time.Clock;
import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * Lookups and time arithmetic shared by the policies.
 */
final class PolicyUtils {

    private PolicyUtils() {
    }

    static Hypertable requireHypertable(HypertableCatalog catalog, int hypertableId) {
        Hypertable ht = catalog.getHypertableById(hypertableId);
        if (ht == null) {
            throw JobException.invalidParameter(String.format("configuration hypertable id %d not found", hypertableId));
        }
        return ht;
    }

    static Dimension requireTimeDimension(Hypertable ht) {
        Dimension dim = ht.getTimeDimension();
        if (dim == null) {
            throw JobException.internal(String.format("hypertable \"%s\" has no open dimension", ht));
        }
        return dim;
    }

    /**
     * Check that an offset fits the dimension: intervals for timestamp
     * columns, integers for integer columns.
     */
    static void checkOffsetType(Dimension dim, TimeOffset offset, String field) {
        if (dim.getType().isInteger() == offset.isInterval()) {
            throw JobException.invalidParameter(
                String.format("invalid value for \"%s\" in config for job", field),
                String.format("Time column \"%s\" has type %s but %s is %s.", dim.getColumnName(),
                    dim.getType().name().toLowerCase(), field, offset.isInterval() ? "an interval" : "an integer"),
                dim.getType().isInteger()
                    ? "Use an integer offset for integer time columns."
                    : "Use an interval offset for timestamp time columns.");
        }
    }

    /**
     * Current time in the dimension's internal form. Integer dimensions ask
     * their integer-now function; a materialization hypertable uses the one
     * of the raw hypertable its continuous aggregate reads from.
     */
    static long now(HypertableCatalog catalog, Dimension dim, Clock clock) {
        PartitioningType type = dim.getType();
        if (!type.isInteger()) {
            return type.fromInstant(clock.instant());
        }

        LongSupplier integerNow = dim.getIntegerNowFunction();
        if (integerNow == null) {
            ContinuousAggregate cagg = catalog.findContinuousAggByMatHypertableId(dim.getHypertableId());
            if (cagg != null) {
                Hypertable raw = catalog.getHypertableById(cagg.getRawHypertableId());
                if (raw != null && raw.getTimeDimension() != null) {
                    integerNow = raw.getTimeDimension().getIntegerNowFunction();
                }
            }
        }
        if (integerNow == null) {
            Hypertable ht = catalog.getHypertableById(dim.getHypertableId());
            throw JobException.internal(String.format("missing integer_now function for hypertable \"%s\"", ht));
        }
        return type.clamp(integerNow.getAsLong());
    }

    /**
     * {@code now - offset} in the dimension's internal form, saturating at
     * the type's limits.
     */
    static long subtractFromNow(HypertableCatalog catalog, Dimension dim, TimeOffset offset,
                                String field, Clock clock) {
        checkOffsetType(dim, offset, field);
        long now = now(catalog, dim, clock);
        long amount = offset.isInterval() ? toMicros(offset.getInterval()) : offset.getInteger();
        long result;
        try {
            result = Math.subtractExact(now, amount);
        } catch (ArithmeticException e) {
            result = amount > 0 ? Long.MIN_VALUE : Long.MAX_VALUE;
        }
        return dim.getType().clamp(result);
    }

    private static long toMicros(Duration interval) {
        try {
            return Math.addExact(Math.multiplyExact(interval.getSeconds(), 1_000_000L), interval.getNano() / 1_000L);
        } catch (ArithmeticException e) {
            return interval.isNegative() ? Long.MIN_VALUE : Long.MAX_VALUE;
        }
    }
}
