package io.github.drompincen.playdeck.runtime.task;

/**
 * A unit of work that can be bound to a {@link TaskQueue} by {@link TaskWrapper}.
 * Subclasses implement {@link #run()}; queue workers call {@link #start()}.
 */
public abstract class BaseTask {

    protected final TaskQueue app;
    protected final TaskArguments arguments;

    protected BaseTask(TaskQueue app, TaskArguments arguments) {
        this.app = app;
        this.arguments = arguments != null ? arguments : TaskArguments.empty();
    }

    public Class<? extends BaseTask> getTaskClass() {
        return getClass();
    }

    public TaskArguments getArguments() {
        return arguments;
    }

    public Object start() throws Exception {
        return run();
    }

    public Object run() throws Exception {
        throw new UnsupportedOperationException(getClass().getName() + ".run() is not implemented");
    }
}
