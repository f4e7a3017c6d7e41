package io.github.drompincen.playdeck.runtime.task;

@FunctionalInterface
public interface TaskHandler {
    Object handle(TaskArguments arguments) throws Exception;
}
