package io.github.drompincen.playdeck.runtime.task;

import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Registry and dispatcher of named tasks. Workers, retries and back-pressure belong to
 * the implementation.
 */
public interface TaskQueue {

    void register(String name, TaskOptions options, TaskHandler handler);

    /**
     * Queues a registered task.
     *
     * @throws IllegalArgumentException if no task is registered under {@code name}
     */
    CompletableFuture<Object> submit(String name, TaskArguments arguments);

    boolean isRegistered(String name);

    Set<String> registeredNames();
}
