package com.vibeblog.scheduler.cron;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.regex.Pattern;

/**
 * Absolute date/time parsing for trigger inputs.
 */
public final class CronParse {

    private CronParse() {
    }

    private static final Pattern ISO_TZ_RE = Pattern.compile("(Z|[+-]\\d{2}:?\\d{2})$", Pattern.CASE_INSENSITIVE);
    private static final Pattern ISO_DATE_RE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern ISO_DATE_TIME_RE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}[T ]");
    private static final Pattern NUMERIC_RE = Pattern.compile("^\\d+$");

    /**
     * Parse an absolute time input and return epoch milliseconds.
     * Accepts:
     * <ul>
     * <li>Numeric strings (interpreted as epoch ms)</li>
     * <li>ISO-8601 date-times with an offset</li>
     * <li>ISO-8601 dates and local date-times, read in {@code zone}</li>
     * </ul>
     *
     * @return epoch milliseconds, or null if parsing fails
     */
    public static Long parseAbsoluteTimeMs(String input, ZoneId zone) {
        if (input == null)
            return null;
        String raw = input.trim();
        if (raw.isEmpty())
            return null;

        if (NUMERIC_RE.matcher(raw).matches()) {
            try {
                long n = Long.parseLong(raw);
                return n > 0 ? n : null;
            } catch (NumberFormatException e) {
                return null;
            }
        }

        try {
            if (ISO_DATE_RE.matcher(raw).matches()) {
                return LocalDate.parse(raw).atStartOfDay(zone).toInstant().toEpochMilli();
            }
            if (!ISO_DATE_TIME_RE.matcher(raw).find()) {
                return null;
            }
            String normalized = raw.replace(' ', 'T');
            if (ISO_TZ_RE.matcher(normalized).find()) {
                if (normalized.endsWith("Z") || normalized.endsWith("z")) {
                    return Instant.parse(normalized.toUpperCase()).toEpochMilli();
                }
                return OffsetDateTime.parse(normalized).toInstant().toEpochMilli();
            }
            return LocalDateTime.parse(normalized).atZone(zone).toInstant().toEpochMilli();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /**
     * Resolve an IANA zone id, or null when it is unknown.
     */
    public static ZoneId parseZone(String tz) {
        if (tz == null || tz.isBlank())
            return null;
        try {
            return ZoneId.of(tz.trim());
        } catch (java.time.DateTimeException e) {
            return null;
        }
    }
}
