package io.github.drompincen.playdeck.runtime.task;

import java.util.concurrent.CompletableFuture;

/**
 * Handle of a task class registered on a queue.
 */
public class QueuedTask {

    private final String name;
    private final TaskQueue app;
    private final TaskHandler handler;

    QueuedTask(String name, TaskQueue app, TaskHandler handler) {
        this.name = name;
        this.app = app;
        this.handler = handler;
    }

    public String name() {
        return name;
    }

    /** Runs the task in the calling thread. */
    public Object call(TaskArguments arguments) throws Exception {
        return handler.handle(arguments);
    }

    /** Queues the task for a worker. */
    public CompletableFuture<Object> delay(TaskArguments arguments) {
        return app.submit(name, arguments);
    }
}
