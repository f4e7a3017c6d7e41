package io.github.drompincen.playdeck.persistence.document;

import io.github.drompincen.playdeck.protocol.api.ProjectDto;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.IndexDirection;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

@Document(collection = "projects")
public class ProjectDocument {

    @Id
    private String projectId;
    @Indexed(unique = true)
    private String name;
    private String repository;
    private ProjectDto.ProjectStatus status;
    private Map<String, String> variables;
    private Instant createdAt;
    @Indexed(direction = IndexDirection.DESCENDING)
    private Instant updatedAt;

    public ProjectDocument() {}

    public String getProjectId() { return projectId; }
    public void setProjectId(String projectId) { this.projectId = projectId; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getRepository() { return repository; }
    public void setRepository(String repository) { this.repository = repository; }

    public ProjectDto.ProjectStatus getStatus() { return status; }
    public void setStatus(ProjectDto.ProjectStatus status) { this.status = status; }

    public Map<String, String> getVariables() { return variables; }
    public void setVariables(Map<String, String> variables) { this.variables = variables; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
