package io.github.drompincen.playdeck.runtime.execution;

/**
 * Runs a {@link PlaybookRun}. Implementations are created per run by
 * {@code ModelHandlers("EXECUTION")} through a public {@code (PlaybookRun, Map<String, String>)}
 * constructor.
 */
public interface PlaybookBackend {

    ExecutionOutcome run();
}
