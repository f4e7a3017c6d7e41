package io.github.drompincen.playdeck.protocol.api;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record InventoryDto(
        String inventoryId,
        String name,
        List<String> hosts,
        Map<String, String> variables,
        Instant createdAt,
        Instant updatedAt
) {}
