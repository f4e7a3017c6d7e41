package io.github.drompincen.playdeck.persistence.document;

import io.github.drompincen.playdeck.protocol.api.PeriodicTaskType;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * A playbook run bound to a project and an inventory, repeated on a schedule.
 */
@Document(collection = "periodic_tasks")
public class PeriodicTaskDocument {

    public static final int PLAYBOOK_MAX_LENGTH = 256;
    public static final int SCHEDULE_MAX_LENGTH = 4096;

    @Id
    private String periodicTaskId;
    private String playbook;
    private String schedule;
    private PeriodicTaskType type;
    @Indexed
    private String inventoryId;
    @Indexed
    private String projectId;
    private Instant lastRunAt;
    @Indexed
    private Instant createdAt;
    private Instant updatedAt;

    public PeriodicTaskDocument() {}

    public String getPeriodicTaskId() { return periodicTaskId; }
    public void setPeriodicTaskId(String periodicTaskId) { this.periodicTaskId = periodicTaskId; }

    public String getPlaybook() { return playbook; }
    public void setPlaybook(String playbook) { this.playbook = playbook; }

    public String getSchedule() { return schedule; }
    public void setSchedule(String schedule) { this.schedule = schedule; }

    public PeriodicTaskType getType() { return type; }
    public void setType(PeriodicTaskType type) { this.type = type; }

    public String getInventoryId() { return inventoryId; }
    public void setInventoryId(String inventoryId) { this.inventoryId = inventoryId; }

    public String getProjectId() { return projectId; }
    public void setProjectId(String projectId) { this.projectId = projectId; }

    public Instant getLastRunAt() { return lastRunAt; }
    public void setLastRunAt(Instant lastRunAt) { this.lastRunAt = lastRunAt; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
