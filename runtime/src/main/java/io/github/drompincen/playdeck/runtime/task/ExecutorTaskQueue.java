package io.github.drompincen.playdeck.runtime.task;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * {@link TaskQueue} running tasks on an {@link Executor}. A failed attempt is retried up
 * to {@link TaskOptions#maxRetries()} times on the same worker, {@code retryDelay} apart.
 */
public class ExecutorTaskQueue implements TaskQueue {

    private static final Logger log = LoggerFactory.getLogger(ExecutorTaskQueue.class);

    private final Executor executor;
    private final Map<String, Registration> tasks = new ConcurrentHashMap<>();

    public ExecutorTaskQueue(Executor executor) {
        this.executor = executor;
    }

    @Override
    public void register(String name, TaskOptions options, TaskHandler handler) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("task name cannot be blank");
        }
        Registration previous = tasks.put(name, new Registration(options, handler));
        if (previous != null) {
            log.warn("Task {} re-registered, replacing previous handler", name);
        } else {
            log.info("Registered task {}", name);
        }
    }

    @Override
    public CompletableFuture<Object> submit(String name, TaskArguments arguments) {
        Registration registration = tasks.get(name);
        if (registration == null) {
            throw new IllegalArgumentException("No task registered under name: " + name);
        }
        log.debug("Submitting task {} with {}", name, arguments);
        return CompletableFuture.supplyAsync(() -> invoke(name, registration, arguments), executor);
    }

    @Override
    public boolean isRegistered(String name) {
        return tasks.containsKey(name);
    }

    @Override
    public Set<String> registeredNames() {
        return Collections.unmodifiableSet(tasks.keySet());
    }

    private Object invoke(String name, Registration registration, TaskArguments arguments) {
        int attempts = registration.options().maxRetries() + 1;
        for (int attempt = 1; ; attempt++) {
            try {
                Object result = registration.handler().handle(arguments);
                log.debug("Task {} finished (attempt {})", name, attempt);
                return result;
            } catch (Exception e) {
                if (attempt >= attempts) {
                    log.error("Task {} failed after {} attempt(s): {}", name, attempt, e.getMessage(), e);
                    throw new CompletionException(e);
                }
                log.warn("Task {} failed (attempt {}/{}), retrying: {}", name, attempt, attempts, e.getMessage());
                sleep(registration.options());
            }
        }
    }

    private void sleep(TaskOptions options) {
        try {
            Thread.sleep(options.retryDelay().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CompletionException(e);
        }
    }

    private record Registration(TaskOptions options, TaskHandler handler) {}
}
