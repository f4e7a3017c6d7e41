package io.github.drompincen.playdeck.gateway.controller;

import io.github.drompincen.playdeck.persistence.document.ProjectDocument;
import io.github.drompincen.playdeck.persistence.repository.ProjectRepository;
import io.github.drompincen.playdeck.protocol.api.CreateProjectRequest;
import io.github.drompincen.playdeck.protocol.api.ProjectDto;
import io.github.drompincen.playdeck.runtime.periodic.PeriodicTaskService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/projects")
public class ProjectController {

    private final ProjectRepository projectRepository;
    private final PeriodicTaskService periodicTaskService;

    public ProjectController(ProjectRepository projectRepository, PeriodicTaskService periodicTaskService) {
        this.projectRepository = projectRepository;
        this.periodicTaskService = periodicTaskService;
    }

    @PostMapping
    public ResponseEntity<ProjectDto> create(@RequestBody CreateProjectRequest req) {
        if (req.name() == null || req.name().isBlank()) {
            throw new IllegalArgumentException("name is required");
        }
        if (projectRepository.findByNameIgnoreCase(req.name()).isPresent()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).build();
        }
        ProjectDocument doc = new ProjectDocument();
        doc.setProjectId(UUID.randomUUID().toString());
        doc.setName(req.name());
        doc.setRepository(req.repository());
        doc.setStatus(ProjectDto.ProjectStatus.NEW);
        doc.setVariables(req.variables() != null ? req.variables() : Map.of());
        doc.setCreatedAt(Instant.now());
        doc.setUpdatedAt(Instant.now());
        projectRepository.save(doc);
        return ResponseEntity.status(HttpStatus.CREATED).body(toDto(doc));
    }

    @GetMapping
    public List<ProjectDto> list() {
        return projectRepository.findAllByOrderByUpdatedAtDesc().stream()
                .map(this::toDto).collect(Collectors.toList());
    }

    @GetMapping("/{id}")
    public ResponseEntity<ProjectDto> get(@PathVariable String id) {
        return projectRepository.findById(id)
                .map(d -> ResponseEntity.ok(toDto(d)))
                .orElse(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        if (projectRepository.existsById(id)) {
            periodicTaskService.deleteByProject(id);
            projectRepository.deleteById(id);
            return ResponseEntity.noContent().build();
        }
        return ResponseEntity.notFound().build();
    }

    private ProjectDto toDto(ProjectDocument doc) {
        return new ProjectDto(doc.getProjectId(), doc.getName(), doc.getRepository(),
                doc.getStatus(), doc.getVariables(), doc.getCreatedAt(), doc.getUpdatedAt());
    }
}
