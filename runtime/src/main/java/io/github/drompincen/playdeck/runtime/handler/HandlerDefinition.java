package io.github.drompincen.playdeck.runtime.handler;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One {@code playdeck.handlers.<type>.<name>} entry.
 */
public class HandlerDefinition {

    private String backend;
    private Map<String, String> options = new LinkedHashMap<>();

    public HandlerDefinition() {}

    public HandlerDefinition(String backend, Map<String, String> options) {
        this.backend = backend;
        this.options = options != null ? options : new LinkedHashMap<>();
    }

    public String getBackend() { return backend; }
    public void setBackend(String backend) { this.backend = backend; }

    public Map<String, String> getOptions() { return options; }
    public void setOptions(Map<String, String> options) { this.options = options; }
}
