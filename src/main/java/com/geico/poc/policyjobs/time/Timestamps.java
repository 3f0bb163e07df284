package com.geico.poc.policyjobs.time;

import com.geico.poc.policyjobs.errors.JobException;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;

/**
 * Timestamp helpers with the "unset" sentinels used by the job catalog.
 *
 * NOBEGIN stands for -infinity and marks a timestamp that was never set;
 * NOEND stands for +infinity. Arithmetic never moves a value off a sentinel.
 */
public final class Timestamps {

    public static final Instant NOBEGIN = Instant.MIN;
    public static final Instant NOEND = Instant.MAX;

    private Timestamps() {
    }

    public static boolean isUnset(Instant ts) {
        return ts == null || NOBEGIN.equals(ts);
    }

    public static boolean isInfinite(Instant ts) {
        return NOBEGIN.equals(ts) || NOEND.equals(ts);
    }

    /**
     * Adds an interval, saturating at the sentinels instead of overflowing.
     */
    public static Instant plus(Instant ts, Duration interval) {
        if (isInfinite(ts)) {
            return ts;
        }
        try {
            return ts.plus(interval);
        } catch (ArithmeticException | DateTimeException e) {
            return interval.isNegative() ? NOBEGIN : NOEND;
        }
    }

    /**
     * Parses an ISO-8601 instant or one of the literals "-infinity" and "infinity".
     */
    public static Instant parse(String text) {
        if (text == null) {
            return null;
        }
        String trimmed = text.trim();
        if ("-infinity".equalsIgnoreCase(trimmed)) {
            return NOBEGIN;
        }
        if ("infinity".equalsIgnoreCase(trimmed)) {
            return NOEND;
        }
        try {
            return Instant.parse(trimmed);
        } catch (DateTimeException e) {
            throw JobException.invalidParameter(
                "invalid input syntax for type timestamp with time zone: \"" + text + "\"");
        }
    }

    public static String format(Instant ts) {
        if (ts == null) {
            return null;
        }
        if (NOBEGIN.equals(ts)) {
            return "-infinity";
        }
        if (NOEND.equals(ts)) {
            return "infinity";
        }
        return ts.toString();
    }
}
