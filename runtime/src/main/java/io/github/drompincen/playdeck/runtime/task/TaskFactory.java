package io.github.drompincen.playdeck.runtime.task;

@FunctionalInterface
public interface TaskFactory<T extends BaseTask> {
    T create(TaskQueue app, TaskArguments arguments);
}
