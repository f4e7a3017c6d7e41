package io.github.drompincen.playdeck.protocol.api;

import java.util.List;
import java.util.Map;

public record CreateInventoryRequest(
        String name,
        List<String> hosts,
        Map<String, String> variables
) {}
