package io.github.drompincen.playdeck.runtime.periodic;

import io.github.drompincen.playdeck.protocol.api.PeriodicTaskType;
import org.springframework.scheduling.support.CronExpression;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * Reads the {@code schedule} string of a periodic task. Schedules are evaluated in UTC.
 */
public final class ScheduleExpressions {

    /** Longest accepted interval: 100 years. */
    static final long MAX_INTERVAL_SECONDS = 100L * 365 * 24 * 60 * 60;

    private ScheduleExpressions() {}

    /**
     * @throws IllegalArgumentException if {@code schedule} is not valid for {@code type}
     */
    public static void validate(PeriodicTaskType type, String schedule) {
        switch (type) {
            case DELTA -> interval(schedule);
            case CRONTAB -> cron(schedule);
        }
    }

    /** First run strictly after {@code from}, or null when the expression never fires again. */
    public static Instant next(PeriodicTaskType type, String schedule, Instant from) {
        return switch (type) {
            case DELTA -> from.plus(interval(schedule));
            case CRONTAB -> {
                ZonedDateTime next = cron(schedule).next(ZonedDateTime.ofInstant(from, ZoneOffset.UTC));
                yield next != null ? next.toInstant() : null;
            }
        };
    }

    static Duration interval(String schedule) {
        long seconds;
        try {
            seconds = Long.parseLong(schedule.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Interval schedule must be a number of seconds: " + schedule);
        }
        if (seconds <= 0) {
            throw new IllegalArgumentException("Interval schedule must be positive: " + schedule);
        }
        if (seconds > MAX_INTERVAL_SECONDS) {
            throw new IllegalArgumentException("Interval schedule must not exceed " + MAX_INTERVAL_SECONDS
                    + " seconds: " + schedule);
        }
        return Duration.ofSeconds(seconds);
    }

    /** Five-field crontab gets a leading seconds field; six-field expressions pass through. */
    static CronExpression cron(String schedule) {
        String expression = schedule.trim();
        if (expression.split("\\s+").length == 5) {
            expression = "0 " + expression;
        }
        try {
            return CronExpression.parse(expression);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid crontab schedule '" + schedule + "': " + e.getMessage(), e);
        }
    }
}
