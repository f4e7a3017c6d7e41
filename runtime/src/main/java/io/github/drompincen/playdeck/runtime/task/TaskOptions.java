package io.github.drompincen.playdeck.runtime.task;

import java.time.Duration;

/**
 * Registration metadata of a queued task.
 */
public record TaskOptions(
        int maxRetries,
        Duration retryDelay
) {
    public TaskOptions {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        retryDelay = retryDelay != null ? retryDelay : Duration.ZERO;
    }

    public static TaskOptions defaults() {
        return new TaskOptions(0, Duration.ZERO);
    }
}
