package io.github.drompincen.playdeck.persistence.document;

import io.github.drompincen.playdeck.protocol.api.PeriodicTaskType;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class PeriodicTaskDocumentTest {

    @Test
    void periodicTaskFieldsPreserved() {
        PeriodicTaskDocument doc = new PeriodicTaskDocument();
        Instant now = Instant.now();

        doc.setPeriodicTaskId("pt1");
        doc.setPlaybook("site.yml");
        doc.setSchedule("*/5 * * * *");
        doc.setType(PeriodicTaskType.CRONTAB);
        doc.setInventoryId("inv1");
        doc.setProjectId("p1");
        doc.setCreatedAt(now);

        assertThat(doc.getPeriodicTaskId()).isEqualTo("pt1");
        assertThat(doc.getPlaybook()).isEqualTo("site.yml");
        assertThat(doc.getSchedule()).isEqualTo("*/5 * * * *");
        assertThat(doc.getType()).isEqualTo(PeriodicTaskType.CRONTAB);
        assertThat(doc.getInventoryId()).isEqualTo("inv1");
        assertThat(doc.getProjectId()).isEqualTo("p1");
        assertThat(doc.getLastRunAt()).isNull();
    }
}
