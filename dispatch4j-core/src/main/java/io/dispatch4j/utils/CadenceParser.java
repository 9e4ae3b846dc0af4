package io.dispatch4j.utils;

import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.HashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.TimeZone;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the cadence of periodic passes (publishing, reconciliation).
 * <p>
 * Supported formats:
 * <ul>
 *   <li>plain seconds: "60"</li>
 *   <li>compact intervals: "30s", "5m", "2h", "1d"</li>
 *   <li>human-readable intervals: "1 minute", "1 hour 30 minutes"</li>
 *   <li>daily time of day: "AT 09:00"</li>
 *   <li>cron, 5 or 6 fields: "* * * * *", "0 0/5 * * * ?"</li>
 * </ul>
 * Intervals are measured from the end of the previous run; cron and "AT" fire on
 * calendar boundaries in the given zone.
 */
public final class CadenceParser {

    private static final Pattern SECONDS = Pattern.compile("^\\d+$");
    private static final Pattern COMPACT = Pattern.compile("^(\\d+)\\s*([smhdw])$");

    private CadenceParser() {
    }

    /**
     * @return the first firing strictly after {@code from}
     * @throws IllegalArgumentException when the cadence cannot be parsed
     */
    public static Instant nextRunAt(String cadence, ZoneId zone, Instant from) {
        Objects.requireNonNull(from, "from must not be null");
        String s = requireText(cadence);
        ZoneId z = zone == null ? ZoneId.of("UTC") : zone;

        if (s.regionMatches(true, 0, "AT ", 0, 3)) {
            LocalTime time;
            try {
                time = LocalTime.parse(s.substring(3).trim());
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Invalid time of day in cadence: " + cadence, e);
            }
            ZonedDateTime base = ZonedDateTime.ofInstant(from, z);
            ZonedDateTime candidate = base.with(time);
            return candidate.isAfter(base) ? candidate.toInstant() : candidate.plusDays(1).toInstant();
        }

        if (isCron(s)) {
            return nextCronTime(normalizeCron(s), z, from);
        }

        return from.plus(parseInterval(s));
    }

    /**
     * Delay from {@code from} to the next firing.
     */
    public static Duration delayUntilNext(String cadence, ZoneId zone, Instant from) {
        return Duration.between(from, nextRunAt(cadence, zone, from));
    }

    public static boolean isCron(String spec) {
        if (spec == null || spec.isBlank()) {
            return false;
        }
        return CronExpression.isValidExpression(normalizeCron(spec));
    }

    /**
     * Accepts 5-field cron by prepending a seconds field, and puts the Quartz "?" in
     * the day-of-week field when both day fields are "*".
     */
    public static String normalizeCron(String spec) {
        String[] f = requireText(spec).split("\\s+");
        if (f.length == 5) {
            f = new String[]{"0", f[0], f[1], f[2], f[3], f[4]};
        }
        if (f.length != 6) {
            return String.join(" ", f);
        }
        if ("*".equals(f[3]) && "*".equals(f[5])) {
            f[5] = "?";
        }
        return String.join(" ", f);
    }

    /**
     * Parses a fixed interval. Zero-length intervals are rejected.
     */
    public static Duration parseInterval(String spec) {
        String s = requireText(spec).toLowerCase(Locale.ROOT);

        if (SECONDS.matcher(s).matches()) {
            return positive(Duration.ofSeconds(parseLong(s, spec)), spec);
        }

        Matcher compact = COMPACT.matcher(s);
        if (compact.matches()) {
            long n = parseLong(compact.group(1), spec);
            return positive(switch (compact.group(2).charAt(0)) {
                case 's' -> Duration.ofSeconds(n);
                case 'm' -> Duration.ofMinutes(n);
                case 'h' -> Duration.ofHours(n);
                case 'd' -> Duration.ofDays(n);
                default -> Duration.ofDays(7L * n);
            }, spec);
        }

        String[] parts = s.split("\\s+");
        if (parts.length % 2 != 0) {
            throw new IllegalArgumentException("Invalid cadence, expected pairs like '5 minutes': " + spec);
        }
        Duration total = Duration.ZERO;
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < parts.length; i += 2) {
            long n = parseLong(parts[i], spec);
            String unit = parts[i + 1].endsWith("s")
                    ? parts[i + 1].substring(0, parts[i + 1].length() - 1)
                    : parts[i + 1];
            if (!seen.add(unit)) {
                throw new IllegalArgumentException("Duplicate unit in cadence: " + unit);
            }
            total = total.plus(switch (unit) {
                case "week" -> Duration.ofDays(7L * n);
                case "day" -> Duration.ofDays(n);
                case "hour" -> Duration.ofHours(n);
                case "minute" -> Duration.ofMinutes(n);
                case "second" -> Duration.ofSeconds(n);
                default -> throw new IllegalArgumentException("Unsupported cadence unit: " + parts[i + 1]);
            });
        }
        return positive(total, spec);
    }

    private static Instant nextCronTime(String cron, ZoneId zone, Instant from) {
        CronExpression expression;
        try {
            expression = new CronExpression(cron);
        } catch (ParseException e) {
            throw new IllegalArgumentException("Invalid cron expression: " + cron, e);
        }
        expression.setTimeZone(TimeZone.getTimeZone(zone));
        Date next = expression.getNextValidTimeAfter(Date.from(from));
        if (next == null) {
            throw new IllegalArgumentException("Cron expression has no future firing: " + cron);
        }
        return next.toInstant();
    }

    private static String requireText(String spec) {
        if (spec == null || spec.isBlank()) {
            throw new IllegalArgumentException("cadence must not be empty");
        }
        return spec.trim();
    }

    private static long parseLong(String digits, String spec) {
        try {
            long n = Long.parseLong(digits);
            if (n < 0) {
                throw new IllegalArgumentException("Cadence values must be non-negative: " + spec);
            }
            return n;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number in cadence: " + spec, e);
        }
    }

    private static Duration positive(Duration d, String spec) {
        if (d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException("Cadence must be a positive interval: " + spec);
        }
        return d;
    }
}
