package io.github.drompincen.playdeck.runtime.task;

/**
 * Registers a {@link BaseTask} class on a {@link TaskQueue}. The queue name is
 * {@code <package>.<SimpleName>} of the class; each invocation builds a fresh task
 * through the factory and calls {@link BaseTask#start()}.
 *
 * <pre>{@code
 * QueuedTask sync = TaskWrapper.bind(queue, SyncProject.class,
 *         (app, args) -> new SyncProject(app, args, projects), TaskOptions.defaults());
 * sync.delay(TaskArguments.of(projectId));
 * }</pre>
 */
public final class TaskWrapper {

    private TaskWrapper() {}

    public static String taskName(Class<?> taskClass) {
        return taskClass.getPackageName() + "." + taskClass.getSimpleName();
    }

    public static <T extends BaseTask> QueuedTask bind(TaskQueue app, Class<T> taskClass,
                                                       TaskFactory<T> factory, TaskOptions options) {
        String name = taskName(taskClass);
        TaskHandler handler = arguments -> factory.create(app, arguments).start();
        app.register(name, options, handler);
        return new QueuedTask(name, app, handler);
    }
}
