package io.github.drompincen.playdeck.protocol.api;

import java.time.Instant;

public record PeriodicTaskDto(
        String periodicTaskId,
        String playbook,
        String schedule,
        PeriodicTaskType type,
        String inventoryId,
        String projectId,
        Instant nextRunAt,
        Instant lastRunAt,
        Instant createdAt,
        Instant updatedAt
) {}
