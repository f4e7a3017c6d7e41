package io.github.drompincen.playdeck.protocol.api;

public record PeriodicTaskRequest(
        String playbook,
        String schedule,
        PeriodicTaskType type,
        String inventoryId,
        String projectId
) {}
