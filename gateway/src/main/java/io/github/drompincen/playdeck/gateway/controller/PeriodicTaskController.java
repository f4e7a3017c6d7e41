package io.github.drompincen.playdeck.gateway.controller;

import io.github.drompincen.playdeck.persistence.document.PeriodicTaskDocument;
import io.github.drompincen.playdeck.protocol.api.ExecutionResultDto;
import io.github.drompincen.playdeck.protocol.api.PeriodicTaskDto;
import io.github.drompincen.playdeck.protocol.api.PeriodicTaskRequest;
import io.github.drompincen.playdeck.runtime.error.PMException;
import io.github.drompincen.playdeck.runtime.execution.ExecutionOutcome;
import io.github.drompincen.playdeck.runtime.periodic.PeriodicTaskService;
import io.github.drompincen.playdeck.runtime.task.QueuedTask;
import io.github.drompincen.playdeck.runtime.task.TaskArguments;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;

@RestController
@RequestMapping("/api/periodic-tasks")
public class PeriodicTaskController {

    private static final Logger log = LoggerFactory.getLogger(PeriodicTaskController.class);

    private final PeriodicTaskService periodicTaskService;
    private final QueuedTask executePeriodicTask;

    public PeriodicTaskController(PeriodicTaskService periodicTaskService, QueuedTask executePeriodicTask) {
        this.periodicTaskService = periodicTaskService;
        this.executePeriodicTask = executePeriodicTask;
    }

    @PostMapping
    public ResponseEntity<PeriodicTaskDto> create(@RequestBody PeriodicTaskRequest req) {
        PeriodicTaskDocument saved = periodicTaskService.create(req);
        return ResponseEntity.status(HttpStatus.CREATED).body(toDto(saved));
    }

    @GetMapping
    public Page<PeriodicTaskDto> list(@RequestParam(required = false) String projectId,
                                      @RequestParam(defaultValue = "0") int page,
                                      @RequestParam(defaultValue = "50") int size) {
        return periodicTaskService.page(projectId, PageRequest.of(page, size)).map(this::toDto);
    }

    @GetMapping("/{id}")
    public ResponseEntity<PeriodicTaskDto> get(@PathVariable String id) {
        return periodicTaskService.findById(id)
                .map(d -> ResponseEntity.ok(toDto(d)))
                .orElse(ResponseEntity.notFound().build());
    }

    @PutMapping("/{id}")
    public ResponseEntity<PeriodicTaskDto> update(@PathVariable String id, @RequestBody PeriodicTaskRequest req) {
        return periodicTaskService.update(id, req)
                .map(d -> ResponseEntity.ok(toDto(d)))
                .orElse(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        if (periodicTaskService.delete(id)) {
            return ResponseEntity.noContent().build();
        }
        return ResponseEntity.notFound().build();
    }

    /**
     * Queues a run of the periodic task; with {@code sync=true} runs it in the request thread
     * and returns the output, or the traceback when the run throws.
     */
    @PostMapping("/{id}/execute")
    public ResponseEntity<ExecutionResultDto> execute(@PathVariable String id,
                                                      @RequestParam(defaultValue = "false") boolean sync) throws Exception {
        if (periodicTaskService.findById(id).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        TaskArguments arguments = TaskArguments.of(id);
        if (sync) {
            ExecutionOutcome outcome;
            try {
                outcome = (ExecutionOutcome) executePeriodicTask.call(arguments);
            } catch (PMException e) {
                if (ApiExceptionHandler.statusOf(e) != HttpStatus.INTERNAL_SERVER_ERROR) {
                    throw e;
                }
                log.error("Periodic task {} failed: {}", id, e.getMessage(), e);
                return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                        .body(new ExecutionResultDto(executePeriodicTask.name(), id,
                                false, e.getMessage(), e.getTraceback()));
            }
            return ResponseEntity.ok(new ExecutionResultDto(executePeriodicTask.name(), id,
                    outcome.success(), outcome.output(), null));
        }
        executePeriodicTask.delay(arguments);
        log.info("Queued periodic task {} on request", id);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(ExecutionResultDto.queued(executePeriodicTask.name(), id));
    }

    private PeriodicTaskDto toDto(PeriodicTaskDocument doc) {
        return new PeriodicTaskDto(doc.getPeriodicTaskId(), doc.getPlaybook(), doc.getSchedule(),
                doc.getType(), doc.getInventoryId(), doc.getProjectId(),
                periodicTaskService.nextDispatch(doc, Instant.now()).orElse(null),
                doc.getLastRunAt(), doc.getCreatedAt(), doc.getUpdatedAt());
    }
}
