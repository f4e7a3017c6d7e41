package io.github.drompincen.playdeck.protocol.api;

import java.time.Instant;
import java.util.Map;

public record ProjectDto(
        String projectId,
        String name,
        String repository,
        ProjectStatus status,
        Map<String, String> variables,
        Instant createdAt,
        Instant updatedAt
) {
    public enum ProjectStatus {
        NEW, OK, ERROR
    }
}
