package io.github.drompincen.playdeck.runtime.periodic;

import io.github.drompincen.playdeck.persistence.document.InventoryDocument;
import io.github.drompincen.playdeck.persistence.document.PeriodicTaskDocument;
import io.github.drompincen.playdeck.persistence.document.ProjectDocument;
import io.github.drompincen.playdeck.persistence.document.TypesPermissionsDocument;
import io.github.drompincen.playdeck.persistence.repository.InventoryRepository;
import io.github.drompincen.playdeck.persistence.repository.PeriodicTaskRepository;
import io.github.drompincen.playdeck.persistence.repository.ProjectRepository;
import io.github.drompincen.playdeck.persistence.repository.TypesPermissionsRepository;
import io.github.drompincen.playdeck.protocol.api.PeriodicTaskRequest;
import io.github.drompincen.playdeck.protocol.api.PeriodicTaskType;
import io.github.drompincen.playdeck.runtime.error.SuppressErrors;
import io.github.drompincen.playdeck.runtime.error.WithTraceback;
import io.github.drompincen.playdeck.runtime.execution.ExecutionOutcome;
import io.github.drompincen.playdeck.runtime.execution.PlaybookBackend;
import io.github.drompincen.playdeck.runtime.execution.PlaybookRun;
import io.github.drompincen.playdeck.runtime.handler.ModelHandlers;
import io.github.drompincen.playdeck.runtime.lock.LockKey;
import io.github.drompincen.playdeck.runtime.lock.ServiceLock;
import io.github.drompincen.playdeck.runtime.util.ProjectPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Service
public class PeriodicTaskService {

    private static final Logger log = LoggerFactory.getLogger(PeriodicTaskService.class);

    private final PeriodicTaskRepository periodicTaskRepository;
    private final ProjectRepository projectRepository;
    private final InventoryRepository inventoryRepository;
    private final TypesPermissionsRepository permissionsRepository;
    private final ModelHandlers executionHandlers;
    private final String executionBackend;
    private final Path projectsDirectory;

    public PeriodicTaskService(PeriodicTaskRepository periodicTaskRepository,
                               ProjectRepository projectRepository,
                               InventoryRepository inventoryRepository,
                               TypesPermissionsRepository permissionsRepository,
                               ModelHandlers executionHandlers,
                               @Value("${playdeck.execution.backend:ANSIBLE}") String executionBackend,
                               @Value("${playdeck.projects-dir:}") String projectsDirectory) {
        this.periodicTaskRepository = periodicTaskRepository;
        this.projectRepository = projectRepository;
        this.inventoryRepository = inventoryRepository;
        this.permissionsRepository = permissionsRepository;
        this.executionHandlers = executionHandlers;
        this.executionBackend = executionBackend;
        this.projectsDirectory = projectsDirectory == null || projectsDirectory.isBlank()
                ? ProjectPaths.projectPath().resolve("projects")
                : Path.of(projectsDirectory);
    }

    // ---- CRUD ----

    public PeriodicTaskDocument create(PeriodicTaskRequest req) {
        validate(req.playbook(), req.schedule(), req.type(), req.projectId(), req.inventoryId());

        PeriodicTaskDocument doc = new PeriodicTaskDocument();
        doc.setPeriodicTaskId(UUID.randomUUID().toString());
        doc.setPlaybook(req.playbook());
        doc.setSchedule(req.schedule());
        doc.setType(req.type());
        doc.setProjectId(req.projectId());
        doc.setInventoryId(req.inventoryId());
        doc.setCreatedAt(Instant.now());
        doc.setUpdatedAt(Instant.now());
        PeriodicTaskDocument saved = periodicTaskRepository.save(doc);
        log.info("Created periodic task {} ({} '{}') for project {}",
                saved.getPeriodicTaskId(), saved.getType(), saved.getSchedule(), saved.getProjectId());
        return saved;
    }

    public Optional<PeriodicTaskDocument> update(String periodicTaskId, PeriodicTaskRequest req) {
        return periodicTaskRepository.findById(periodicTaskId).map(existing -> {
            String playbook = req.playbook() != null ? req.playbook() : existing.getPlaybook();
            String schedule = req.schedule() != null ? req.schedule() : existing.getSchedule();
            PeriodicTaskType type = req.type() != null ? req.type() : existing.getType();
            String projectId = req.projectId() != null ? req.projectId() : existing.getProjectId();
            String inventoryId = req.inventoryId() != null ? req.inventoryId() : existing.getInventoryId();
            validate(playbook, schedule, type, projectId, inventoryId);

            existing.setPlaybook(playbook);
            existing.setSchedule(schedule);
            existing.setType(type);
            existing.setProjectId(projectId);
            existing.setInventoryId(inventoryId);
            existing.setUpdatedAt(Instant.now());
            return periodicTaskRepository.save(existing);
        });
    }

    public Optional<PeriodicTaskDocument> findById(String periodicTaskId) {
        return periodicTaskRepository.findById(periodicTaskId);
    }

    public Page<PeriodicTaskDocument> page(String projectId, Pageable pageable) {
        if (projectId != null) {
            return periodicTaskRepository.findByProjectIdOrderByCreatedAtAsc(projectId, pageable);
        }
        return periodicTaskRepository.findAllByOrderByCreatedAtAsc(pageable);
    }

    public boolean delete(String periodicTaskId) {
        if (!periodicTaskRepository.existsById(periodicTaskId)) {
            return false;
        }
        unlinkPermissions(periodicTaskId);
        periodicTaskRepository.deleteById(periodicTaskId);
        log.info("Deleted periodic task {}", periodicTaskId);
        return true;
    }

    /** Removes every periodic task of a project that is being deleted. */
    public int deleteByProject(String projectId) {
        return deleteAll(periodicTaskRepository.findByProjectId(projectId));
    }

    /** Removes every periodic task of an inventory that is being deleted. */
    public int deleteByInventory(String inventoryId) {
        return deleteAll(periodicTaskRepository.findByInventoryId(inventoryId));
    }

    private int deleteAll(List<PeriodicTaskDocument> tasks) {
        for (PeriodicTaskDocument task : tasks) {
            unlinkPermissions(task.getPeriodicTaskId());
            periodicTaskRepository.delete(task);
        }
        if (!tasks.isEmpty()) {
            log.info("Cascade-deleted {} periodic tasks", tasks.size());
        }
        return tasks.size();
    }

    private void unlinkPermissions(String periodicTaskId) {
        for (TypesPermissionsDocument permissions : permissionsRepository.findByPeriodicTaskIdsContaining(periodicTaskId)) {
            permissions.getPeriodicTaskIds().remove(periodicTaskId);
            permissionsRepository.save(permissions);
        }
    }

    // ---- Scheduling ----

    public Optional<Instant> nextRun(PeriodicTaskDocument task, Instant from) {
        try {
            return Optional.ofNullable(ScheduleExpressions.next(task.getType(), task.getSchedule(), from));
        } catch (IllegalArgumentException | DateTimeException | ArithmeticException e) {
            log.warn("Periodic task {} has an invalid schedule '{}': {}",
                    task.getPeriodicTaskId(), task.getSchedule(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * When the beat will next dispatch the task. Interval tasks that never ran are due at
     * once; crontab tasks that never ran are due at their first firing after creation.
     * Empty when the schedule is unusable or never fires again.
     */
    public Optional<Instant> nextDispatch(PeriodicTaskDocument task, Instant now) {
        if (task.getLastRunAt() == null && task.getType() == PeriodicTaskType.DELTA) {
            return Optional.of(now);
        }
        Instant reference = task.getLastRunAt() != null ? task.getLastRunAt()
                : task.getCreatedAt() != null ? task.getCreatedAt() : Instant.EPOCH;
        return nextRun(task, reference);
    }

    public boolean isDue(PeriodicTaskDocument task, Instant now) {
        return nextDispatch(task, now).map(next -> !next.isAfter(now)).orElse(false);
    }

    @SuppressErrors(verbose = true)
    public void recordLastRun(String periodicTaskId, Instant at) {
        PeriodicTaskDocument task = periodicTaskRepository.findById(periodicTaskId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown periodic task: " + periodicTaskId));
        task.setLastRunAt(at);
        periodicTaskRepository.save(task);
    }

    // ---- Execution ----

    /**
     * Runs the playbook of a periodic task with the configured execution backend. Two runs
     * of the same periodic task never overlap.
     */
    @WithTraceback
    @ServiceLock
    public ExecutionOutcome execute(@LockKey String periodicTaskId) {
        PeriodicTaskDocument task = periodicTaskRepository.findById(periodicTaskId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown periodic task: " + periodicTaskId));
        ProjectDocument project = projectRepository.findById(task.getProjectId())
                .orElseThrow(() -> new IllegalStateException("Project " + task.getProjectId() + " no longer exists"));
        InventoryDocument inventory = inventoryRepository.findById(task.getInventoryId())
                .orElseThrow(() -> new IllegalStateException("Inventory " + task.getInventoryId() + " no longer exists"));

        PlaybookRun run = new PlaybookRun(
                task.getPeriodicTaskId(),
                task.getPlaybook(),
                projectsDirectory.resolve(project.getProjectId()),
                inventory.getHosts(),
                inventory.getVariables(),
                project.getVariables());

        PlaybookBackend backend = executionHandlers.getObject(executionBackend, run, PlaybookBackend.class);
        ExecutionOutcome outcome = backend.run();
        task.setLastRunAt(Instant.now());
        periodicTaskRepository.save(task);
        log.info("Periodic task {} ({}) finished: success={} exitCode={}",
                periodicTaskId, task.getPlaybook(), outcome.success(), outcome.exitCode());
        return outcome;
    }

    public Path getProjectsDirectory() {
        return projectsDirectory;
    }

    // ---- Validation ----

    private void validate(String playbook, String schedule, PeriodicTaskType type,
                          String projectId, String inventoryId) {
        if (playbook == null || playbook.isBlank()) {
            throw new IllegalArgumentException("playbook is required");
        }
        if (playbook.length() > PeriodicTaskDocument.PLAYBOOK_MAX_LENGTH) {
            throw new IllegalArgumentException("playbook is longer than " + PeriodicTaskDocument.PLAYBOOK_MAX_LENGTH);
        }
        if (schedule == null || schedule.isBlank()) {
            throw new IllegalArgumentException("schedule is required");
        }
        if (schedule.length() > PeriodicTaskDocument.SCHEDULE_MAX_LENGTH) {
            throw new IllegalArgumentException("schedule is longer than " + PeriodicTaskDocument.SCHEDULE_MAX_LENGTH);
        }
        if (type == null) {
            throw new IllegalArgumentException("type is required");
        }
        ScheduleExpressions.validate(type, schedule);
        if (projectId == null || !projectRepository.existsById(projectId)) {
            throw new IllegalArgumentException("Unknown project: " + projectId);
        }
        if (inventoryId == null || !inventoryRepository.existsById(inventoryId)) {
            throw new IllegalArgumentException("Unknown inventory: " + inventoryId);
        }
    }
}
