package io.github.drompincen.playdeck.protocol.api;

import java.util.Map;

public record CreateProjectRequest(
        String name,
        String repository,
        Map<String, String> variables
) {}
