package io.github.drompincen.playdeck.protocol.api;

/**
 * How the {@code schedule} string of a periodic task is read.
 */
public enum PeriodicTaskType {
    /** Interval in whole seconds between runs. */
    DELTA,
    /** Crontab expression, five fields ({@code m h dom mon dow}) or a six-field cron. */
    CRONTAB
}
