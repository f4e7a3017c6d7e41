package io.github.drompincen.playdeck.runtime.periodic;

import io.github.drompincen.playdeck.runtime.execution.ExecutionOutcome;
import io.github.drompincen.playdeck.runtime.task.BaseTask;
import io.github.drompincen.playdeck.runtime.task.QueuedTask;
import io.github.drompincen.playdeck.runtime.task.TaskArguments;
import io.github.drompincen.playdeck.runtime.task.TaskOptions;
import io.github.drompincen.playdeck.runtime.task.TaskQueue;
import io.github.drompincen.playdeck.runtime.task.TaskWrapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Queue task running one periodic task. First positional argument: the periodic task id.
 */
public class ExecutePeriodicTask extends BaseTask {

    private static final Logger log = LoggerFactory.getLogger(ExecutePeriodicTask.class);

    private final PeriodicTaskService periodicTaskService;

    public ExecutePeriodicTask(TaskQueue app, TaskArguments arguments, PeriodicTaskService periodicTaskService) {
        super(app, arguments);
        this.periodicTaskService = periodicTaskService;
    }

    public static QueuedTask bind(TaskQueue app, PeriodicTaskService periodicTaskService, TaskOptions options) {
        return TaskWrapper.bind(app, ExecutePeriodicTask.class,
                (queue, arguments) -> new ExecutePeriodicTask(queue, arguments, periodicTaskService),
                options);
    }

    @Override
    public ExecutionOutcome run() {
        String periodicTaskId = arguments.stringArg(0);
        ExecutionOutcome outcome = periodicTaskService.execute(periodicTaskId);
        if (!outcome.success()) {
            log.warn("Periodic task {} exited with code {}", periodicTaskId, outcome.exitCode());
        }
        return outcome;
    }
}
