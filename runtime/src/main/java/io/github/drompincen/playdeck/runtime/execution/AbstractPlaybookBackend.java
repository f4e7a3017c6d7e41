package io.github.drompincen.playdeck.runtime.execution;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public abstract class AbstractPlaybookBackend implements PlaybookBackend {

    public static final String DEFAULT_BINARY = "ansible-playbook";

    protected final PlaybookRun run;
    protected final Map<String, String> options;

    protected AbstractPlaybookBackend(PlaybookRun run, Map<String, String> options) {
        this.run = run;
        this.options = options != null ? options : Map.of();
    }

    /** INI inventory: every host in {@code [all]}, inventory variables in {@code [all:vars]}. */
    protected String renderInventory() {
        StringBuilder sb = new StringBuilder("[all]\n");
        for (String host : run.hosts()) {
            sb.append(host).append('\n');
        }
        if (!run.inventoryVariables().isEmpty()) {
            sb.append("\n[all:vars]\n");
            new TreeMap<>(run.inventoryVariables())
                    .forEach((key, value) -> sb.append(key).append('=').append(value).append('\n'));
        }
        return sb.toString();
    }

    protected List<String> command(String inventory) {
        List<String> command = new ArrayList<>();
        command.add(options.getOrDefault("binary", DEFAULT_BINARY));
        command.add("-i");
        command.add(inventory);
        new TreeMap<>(run.extraVariables()).forEach((key, value) -> {
            command.add("-e");
            command.add(key + "=" + value);
        });
        command.add(run.playbook());
        return command;
    }
}
