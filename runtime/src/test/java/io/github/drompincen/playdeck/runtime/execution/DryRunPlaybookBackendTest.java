package io.github.drompincen.playdeck.runtime.execution;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DryRunPlaybookBackendTest {

    @Test
    void rendersCommandAndInventory() {
        PlaybookRun run = new PlaybookRun("t-1", "deploy.yml", Path.of("projects", "p-1"),
                List.of("web1.example.com", "web2.example.com"),
                Map.of("ansible_user", "deploy", "ansible_port", "2222"),
                Map.of("version", "1.4", "env", "prod"));

        ExecutionOutcome outcome = new DryRunPlaybookBackend(run, Map.of()).run();

        assertThat(outcome.success()).isTrue();
        assertThat(outcome.exitCode()).isZero();
        assertThat(outcome.output()).isEqualTo(
                "ansible-playbook -i <inventory> -e env=prod -e version=1.4 deploy.yml\n"
                        + "\n"
                        + "[all]\n"
                        + "web1.example.com\n"
                        + "web2.example.com\n"
                        + "\n"
                        + "[all:vars]\n"
                        + "ansible_port=2222\n"
                        + "ansible_user=deploy\n");
    }

    @Test
    void omitsVarsSectionWithoutVariables() {
        PlaybookRun run = new PlaybookRun("t-1", "ping.yml", Path.of("."), List.of("db1"), null, null);

        String output = new DryRunPlaybookBackend(run, null).run().output();

        assertThat(output).endsWith("[all]\ndb1\n").doesNotContain("[all:vars]");
    }
}
