package io.github.drompincen.playdeck.runtime.task;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Positional and keyword arguments of a task invocation.
 */
public record TaskArguments(
        List<Object> args,
        Map<String, Object> kwargs
) {
    public TaskArguments {
        args = Collections.unmodifiableList(new ArrayList<>(args != null ? args : List.of()));
        kwargs = Collections.unmodifiableMap(new LinkedHashMap<>(kwargs != null ? kwargs : Map.of()));
    }

    public static TaskArguments empty() {
        return new TaskArguments(List.of(), Map.of());
    }

    public static TaskArguments of(Object... args) {
        return new TaskArguments(Arrays.asList(args), Map.of());
    }

    public TaskArguments withKwarg(String name, Object value) {
        Map<String, Object> merged = new LinkedHashMap<>(kwargs);
        merged.put(name, value);
        return new TaskArguments(args, merged);
    }

    public Object arg(int index) {
        if (index < 0 || index >= args.size()) {
            throw new IllegalArgumentException("Missing positional argument " + index);
        }
        return args.get(index);
    }

    public String stringArg(int index) {
        Object value = arg(index);
        return value != null ? value.toString() : null;
    }

    public Object kwarg(String name) {
        return kwargs.get(name);
    }
}
