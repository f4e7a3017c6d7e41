package io.github.drompincen.playdeck.runtime.handler;

import io.github.drompincen.playdeck.runtime.error.PMException;
import io.github.drompincen.playdeck.runtime.error.UnknownModelHandlerException;
import io.github.drompincen.playdeck.runtime.util.ClassImports;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.core.env.Environment;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Pluggable backends of one handler type, configured as
 *
 * <pre>
 * playdeck.handlers.&lt;type&gt;.&lt;name&gt;.backend = fully.qualified.ClassName
 * playdeck.handlers.&lt;type&gt;.&lt;name&gt;.options.&lt;key&gt; = value
 * </pre>
 *
 * A backend class exposes a public {@code (model, Map<String, String> options)} constructor.
 * Names are matched case-insensitively, with {@code -} and {@code _} interchangeable.
 */
public class ModelHandlers {

    private final String type;
    private final Map<String, HandlerDefinition> handlers;

    public ModelHandlers(String type, Environment environment) {
        this(type, Binder.get(environment)
                .bind("playdeck.handlers." + type.toLowerCase(Locale.ROOT),
                        Bindable.mapOf(String.class, HandlerDefinition.class))
                .orElse(Map.of()));
    }

    public ModelHandlers(String type, Map<String, HandlerDefinition> handlers) {
        this.type = type;
        Map<String, HandlerDefinition> normalized = new LinkedHashMap<>();
        handlers.forEach((name, definition) -> normalized.put(normalize(name), definition));
        this.handlers = Collections.unmodifiableMap(normalized);
    }

    public String getType() {
        return type;
    }

    public Map<String, HandlerDefinition> list() {
        return handlers;
    }

    public Class<?> backend(String name) {
        HandlerDefinition definition = handlers.get(normalize(name));
        if (definition == null) {
            throw new UnknownModelHandlerException(name);
        }
        if (definition.getBackend() == null || definition.getBackend().isBlank()) {
            throw new PMException("Backend is 'None'.");
        }
        try {
            return ClassImports.importClass(definition.getBackend());
        } catch (ClassNotFoundException e) {
            throw new UnknownModelHandlerException(name, e);
        }
    }

    public Map<String, String> opts(String name) {
        HandlerDefinition definition = handlers.get(normalize(name));
        if (definition == null || definition.getOptions() == null) {
            return Map.of();
        }
        return Collections.unmodifiableMap(definition.getOptions());
    }

    public <T> T getObject(String name, Object model, Class<T> expectedType) {
        Class<?> backend = backend(name);
        if (!expectedType.isAssignableFrom(backend)) {
            throw new PMException(backend.getName() + " is not a " + expectedType.getSimpleName());
        }
        Map<String, String> options = opts(name);
        for (Constructor<?> constructor : backend.getConstructors()) {
            Class<?>[] params = constructor.getParameterTypes();
            if (params.length == 2 && params[0].isInstance(model) && params[1].isAssignableFrom(Map.class)) {
                try {
                    return expectedType.cast(constructor.newInstance(model, options));
                } catch (InvocationTargetException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    throw new PMException("Failed to create " + type + " handler '" + name + "': "
                            + cause.getMessage(), cause);
                } catch (ReflectiveOperationException e) {
                    throw new PMException("Failed to create " + type + " handler '" + name + "'", e);
                }
            }
        }
        throw new PMException(backend.getName() + " has no public ("
                + model.getClass().getSimpleName() + ", Map) constructor");
    }

    private static String normalize(String name) {
        return name == null ? null : name.toUpperCase(Locale.ROOT).replace('-', '_');
    }
}
