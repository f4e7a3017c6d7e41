package io.github.drompincen.playdeck.runtime.execution;

public record ExecutionOutcome(
        boolean success,
        int exitCode,
        String output
) {
    public static ExecutionOutcome ok(String output) {
        return new ExecutionOutcome(true, 0, output);
    }

    public static ExecutionOutcome failed(int exitCode, String output) {
        return new ExecutionOutcome(false, exitCode, output);
    }
}
