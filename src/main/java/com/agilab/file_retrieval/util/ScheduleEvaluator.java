package com.agilab.file_retrieval.util;

import org.apache.commons.lang3.StringUtils;
import org.springframework.scheduling.support.CronExpression;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Cron arithmetic for configurations. Accepts standard 5-field expressions (minute precision)
 * and Spring's 6-field form with a leading seconds field.
 */
public final class ScheduleEvaluator {

    private ScheduleEvaluator() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static CronExpression parse(String cronExpression) {
        if (StringUtils.isBlank(cronExpression)) {
            throw new IllegalArgumentException("Cron expression cannot be empty");
        }
        var fields = StringUtils.split(cronExpression.trim());
        return switch (fields.length) {
            case 5 -> CronExpression.parse("0 " + String.join(" ", fields));
            case 6 -> CronExpression.parse(String.join(" ", fields));
            default -> throw new IllegalArgumentException(
                    "Cron expression must have 5 or 6 fields but has " + fields.length + ": " + cronExpression);
        };
    }

    public static ZoneId zone(String timezone) {
        if (StringUtils.isBlank(timezone)) {
            throw new IllegalArgumentException("Timezone cannot be empty");
        }
        try {
            return ZoneId.of(timezone);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Unknown timezone: " + timezone, e);
        }
    }

    /**
     * The latest occurrence in {@code (now - window, now]}, if any.
     */
    public static Optional<Instant> latestOccurrence(String cronExpression, String timezone, Instant now, Duration window) {
        var cron = parse(cronExpression);
        var zoneId = zone(timezone);
        var cursor = ZonedDateTime.ofInstant(now.minus(window), zoneId);
        var end = ZonedDateTime.ofInstant(now, zoneId);
        ZonedDateTime latest = null;
        for (var next = cron.next(cursor); next != null && !next.isAfter(end); next = cron.next(next)) {
            latest = next;
        }
        return Optional.ofNullable(latest).map(ZonedDateTime::toInstant);
    }

    public static Optional<Instant> next(String cronExpression, String timezone, Instant after) {
        var next = parse(cronExpression).next(ZonedDateTime.ofInstant(after, zone(timezone)));
        return Optional.ofNullable(next).map(ZonedDateTime::toInstant);
    }

    public static Instant truncateToMinute(Instant instant) {
        return instant.truncatedTo(ChronoUnit.MINUTES);
    }
}
