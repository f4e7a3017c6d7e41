package io.github.drompincen.playdeck.runtime.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Reports the command and inventory a real run would use, without running anything.
 */
public class DryRunPlaybookBackend extends AbstractPlaybookBackend {

    private static final Logger log = LoggerFactory.getLogger(DryRunPlaybookBackend.class);

    public DryRunPlaybookBackend(PlaybookRun run, Map<String, String> options) {
        super(run, options);
    }

    @Override
    public ExecutionOutcome run() {
        String command = String.join(" ", command("<inventory>"));
        log.info("Dry run of periodic task {}: {}", run.periodicTaskId(), command);
        return ExecutionOutcome.ok(command + "\n\n" + renderInventory());
    }
}
