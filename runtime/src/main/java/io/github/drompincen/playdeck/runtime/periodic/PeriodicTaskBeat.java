package io.github.drompincen.playdeck.runtime.periodic;

import io.github.drompincen.playdeck.persistence.document.PeriodicTaskDocument;
import io.github.drompincen.playdeck.persistence.repository.PeriodicTaskRepository;
import io.github.drompincen.playdeck.runtime.error.RaiseContext;
import io.github.drompincen.playdeck.runtime.lock.AcquireLockException;
import io.github.drompincen.playdeck.runtime.lock.Lock;
import io.github.drompincen.playdeck.runtime.lock.LockService;
import io.github.drompincen.playdeck.runtime.pagination.PagedItem;
import io.github.drompincen.playdeck.runtime.pagination.Paginator;
import io.github.drompincen.playdeck.runtime.task.QueuedTask;
import io.github.drompincen.playdeck.runtime.task.TaskArguments;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Dispatches due periodic tasks to the queue. Only the node holding {@link Lock#SCHEDULER}
 * dispatches on a given tick.
 */
@Component
public class PeriodicTaskBeat {

    private static final Logger log = LoggerFactory.getLogger(PeriodicTaskBeat.class);

    private final LockService lockService;
    private final PeriodicTaskRepository periodicTaskRepository;
    private final PeriodicTaskService periodicTaskService;
    private final QueuedTask executePeriodicTask;
    private final int pageLimit;
    private final String instanceId = UUID.randomUUID().toString().substring(0, 8);

    public PeriodicTaskBeat(LockService lockService,
                            PeriodicTaskRepository periodicTaskRepository,
                            PeriodicTaskService periodicTaskService,
                            QueuedTask executePeriodicTask,
                            @Value("${playdeck.page-limit:" + Paginator.DEFAULT_CHUNK_SIZE + "}") int pageLimit) {
        this.lockService = lockService;
        this.periodicTaskRepository = periodicTaskRepository;
        this.periodicTaskService = periodicTaskService;
        this.executePeriodicTask = executePeriodicTask;
        this.pageLimit = pageLimit;
    }

    @Scheduled(fixedDelayString = "${playdeck.beat.interval-ms:10000}")
    public void tick() {
        Lock lock;
        try {
            lock = lockService.acquire(Lock.SCHEDULER, instanceId, Duration.ZERO, "Beat is running on another node.");
        } catch (AcquireLockException e) {
            log.debug("Skipping beat on {}: {}", instanceId, e.getMessage());
            return;
        }
        try (lock) {
            int dispatched = dispatchDue(Instant.now());
            if (dispatched > 0) {
                log.info("Beat {} dispatched {} periodic tasks", instanceId, dispatched);
            }
        }
    }

    /**
     * Queues every periodic task due at {@code now}. A task whose schedule cannot be
     * evaluated or that fails to queue is logged and skipped.
     */
    public int dispatchDue(Instant now) {
        Paginator<PeriodicTaskDocument> paginator =
                new Paginator<>(periodicTaskRepository::findAllByOrderByCreatedAtAsc, pageLimit);
        RaiseContext guard = RaiseContext.of().verbose();
        AtomicInteger dispatched = new AtomicInteger();

        paginator.items()
                .map(PagedItem::item)
                .forEach(task -> guard.execute(() -> {
                    if (!periodicTaskService.isDue(task, now)) {
                        return false;
                    }
                    periodicTaskService.recordLastRun(task.getPeriodicTaskId(), now);
                    executePeriodicTask.delay(TaskArguments.of(task.getPeriodicTaskId()));
                    return true;
                }).filter(Boolean::booleanValue).ifPresent(queued -> {
                    dispatched.incrementAndGet();
                    log.debug("Queued periodic task {}", task.getPeriodicTaskId());
                }));
        return dispatched.get();
    }
}
