package io.github.drompincen.playdeck.protocol.api;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutionResultDto(
        String taskName,
        String periodicTaskId,
        boolean success,
        String output,
        String traceback
) {
    public static ExecutionResultDto queued(String taskName, String periodicTaskId) {
        return new ExecutionResultDto(taskName, periodicTaskId, true, null, null);
    }
}
