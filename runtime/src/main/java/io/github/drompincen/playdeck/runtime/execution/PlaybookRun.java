package io.github.drompincen.playdeck.runtime.execution;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Everything a backend needs to run one playbook against one inventory.
 */
public record PlaybookRun(
        String periodicTaskId,
        String playbook,
        Path projectDirectory,
        List<String> hosts,
        Map<String, String> inventoryVariables,
        Map<String, String> extraVariables
) {
    public PlaybookRun {
        hosts = hosts != null ? List.copyOf(hosts) : List.of();
        inventoryVariables = inventoryVariables != null ? Map.copyOf(inventoryVariables) : Map.of();
        extraVariables = extraVariables != null ? Map.copyOf(extraVariables) : Map.of();
    }
}
