package io.github.drompincen.playdeck.runtime.execution;

import io.github.drompincen.playdeck.runtime.error.PMException;
import io.github.drompincen.playdeck.runtime.util.TmpFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Runs {@code ansible-playbook} in the project directory against a temporary inventory file.
 *
 * <p>Options: {@code binary} (default {@value #DEFAULT_BINARY}), {@code timeout-seconds}
 * (default 3600).
 */
public class AnsiblePlaybookBackend extends AbstractPlaybookBackend {

    private static final Logger log = LoggerFactory.getLogger(AnsiblePlaybookBackend.class);
    private static final long DEFAULT_TIMEOUT_SECONDS = 3600;

    public AnsiblePlaybookBackend(PlaybookRun run, Map<String, String> options) {
        super(run, options);
    }

    @Override
    public ExecutionOutcome run() {
        long timeout = Long.parseLong(options.getOrDefault("timeout-seconds", String.valueOf(DEFAULT_TIMEOUT_SECONDS)));
        try (TmpFile inventory = TmpFile.create("inventory-", ".ini")) {
            inventory.write(renderInventory());
            List<String> command = command(inventory.name());
            log.info("Running {} for periodic task {}", String.join(" ", command), run.periodicTaskId());

            Process process = new ProcessBuilder(command)
                    .directory(run.projectDirectory().toFile())
                    .redirectErrorStream(true)
                    .start();

            StringBuilder output = new StringBuilder();
            Thread reader = new Thread(() -> {
                try (var in = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                    String line;
                    while ((line = in.readLine()) != null) {
                        synchronized (output) {
                            output.append(line).append('\n');
                        }
                    }
                } catch (IOException e) {
                    log.debug("Output stream of periodic task {} closed: {}", run.periodicTaskId(), e.getMessage());
                }
            }, "playbook-output-" + run.periodicTaskId());
            reader.setDaemon(true);
            reader.start();

            if (!process.waitFor(timeout, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                reader.join(1000);
                log.warn("Playbook {} timed out after {} seconds", run.playbook(), timeout);
                synchronized (output) {
                    return ExecutionOutcome.failed(-1, output + "Timed out after " + timeout + " seconds\n");
                }
            }
            reader.join(1000);
            int exitCode = process.exitValue();
            synchronized (output) {
                return exitCode == 0
                        ? ExecutionOutcome.ok(output.toString())
                        : ExecutionOutcome.failed(exitCode, output.toString());
            }
        } catch (IOException e) {
            throw new PMException("Failed to run playbook " + run.playbook() + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PMException("Interrupted while running playbook " + run.playbook(), e);
        }
    }
}
