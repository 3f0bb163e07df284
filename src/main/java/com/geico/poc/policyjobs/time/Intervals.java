package com.geico.poc.policyjobs.time;

import com.geico.poc.policyjobs.errors.JobException;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses interval literals.
 *
 * Accepts ISO-8601 durations ("PT1H", "P7D") and the database's verbose form,
 * a sequence of quantity/unit pairs such as "7 days", "1 hour 30 minutes" or
 * "-2 weeks". Month and year units have no fixed length and are rejected.
 */
public final class Intervals {

    private static final Pattern PART = Pattern.compile("\\s*([+-]?\\d+(?:\\.\\d+)?)\\s*([a-zA-Z]+)\\s*");

    private Intervals() {
    }

    public static Duration parse(String text) {
        if (text == null) {
            throw JobException.invalidParameter("interval cannot be NULL");
        }
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            throw JobException.invalidParameter("invalid input syntax for type interval: \"" + text + "\"");
        }

        String upper = trimmed.toUpperCase(Locale.ROOT);
        if (upper.startsWith("P") || upper.startsWith("-P")) {
            try {
                return Duration.parse(upper);
            } catch (DateTimeParseException e) {
                throw JobException.invalidParameter("invalid input syntax for type interval: \"" + text + "\"");
            }
        }

        Matcher m = PART.matcher(trimmed);
        Duration total = Duration.ZERO;
        int pos = 0;
        while (pos < trimmed.length()) {
            if (!m.find(pos) || m.start() != pos) {
                throw JobException.invalidParameter("invalid input syntax for type interval: \"" + text + "\"");
            }
            total = total.plus(toDuration(m.group(1), m.group(2), text));
            pos = m.end();
        }
        return total;
    }

    private static Duration toDuration(String quantity, String unit, String original) {
        double amount = Double.parseDouble(quantity);
        long micros;
        switch (unit.toLowerCase(Locale.ROOT)) {
            case "us":
            case "usec":
            case "usecs":
            case "microsecond":
            case "microseconds":
                micros = 1L;
                break;
            case "ms":
            case "msec":
            case "msecs":
            case "millisecond":
            case "milliseconds":
                micros = 1_000L;
                break;
            case "s":
            case "sec":
            case "secs":
            case "second":
            case "seconds":
                micros = 1_000_000L;
                break;
            case "m":
            case "min":
            case "mins":
            case "minute":
            case "minutes":
                micros = 60_000_000L;
                break;
            case "h":
            case "hr":
            case "hrs":
            case "hour":
            case "hours":
                micros = 3_600_000_000L;
                break;
            case "d":
            case "day":
            case "days":
                micros = 86_400_000_000L;
                break;
            case "w":
            case "week":
            case "weeks":
                micros = 7 * 86_400_000_000L;
                break;
            case "mon":
            case "mons":
            case "month":
            case "months":
            case "y":
            case "year":
            case "years":
                throw JobException.invalidParameter(
                    "interval \"" + original + "\" uses a unit without a fixed length",
                    "Month and year units are not supported for job intervals.",
                    "Express the interval in days or weeks.");
            default:
                throw JobException.invalidParameter("invalid input syntax for type interval: \"" + original + "\"");
        }
        return Duration.of(Math.round(amount * micros), ChronoUnit.MICROS);
    }

    /**
     * Formats an interval the way the catalog reports it, e.g. "1 day 02:30:00".
     */
    public static String format(Duration interval) {
        if (interval == null) {
            return null;
        }
        boolean negative = interval.isNegative();
        Duration abs = interval.abs();
        long days = abs.toDays();
        Duration rest = abs.minusDays(days);
        long hours = rest.toHours();
        long minutes = rest.toMinutesPart();
        long seconds = rest.toSecondsPart();
        long micros = rest.toNanosPart() / 1_000;

        StringBuilder sb = new StringBuilder();
        if (negative) {
            sb.append('-');
        }
        if (days > 0) {
            sb.append(days).append(days == 1 ? " day" : " days");
            if (hours == 0 && minutes == 0 && seconds == 0 && micros == 0) {
                return sb.toString();
            }
            sb.append(' ');
        }
        sb.append(String.format(Locale.ROOT, "%02d:%02d:%02d", hours, minutes, seconds));
        if (micros > 0) {
            sb.append(String.format(Locale.ROOT, ".%06d", micros));
        }
        return sb.toString();
    }
}
