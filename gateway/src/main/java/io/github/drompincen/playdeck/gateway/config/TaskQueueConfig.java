package io.github.drompincen.playdeck.gateway.config;

import io.github.drompincen.playdeck.runtime.handler.ModelHandlers;
import io.github.drompincen.playdeck.runtime.periodic.ExecutePeriodicTask;
import io.github.drompincen.playdeck.runtime.periodic.PeriodicTaskService;
import io.github.drompincen.playdeck.runtime.task.ExecutorTaskQueue;
import io.github.drompincen.playdeck.runtime.task.QueuedTask;
import io.github.drompincen.playdeck.runtime.task.TaskOptions;
import io.github.drompincen.playdeck.runtime.task.TaskQueue;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;

@Configuration
public class TaskQueueConfig {

    @Bean
    TaskQueue taskQueue(ThreadPoolTaskExecutor taskQueueExecutor) {
        return new ExecutorTaskQueue(taskQueueExecutor);
    }

    @Bean
    ModelHandlers executionHandlers(Environment environment) {
        return new ModelHandlers("EXECUTION", environment);
    }

    @Bean
    QueuedTask executePeriodicTask(TaskQueue taskQueue, PeriodicTaskService periodicTaskService,
                                   @Value("${playdeck.queue.max-retries:0}") int maxRetries,
                                   @Value("${playdeck.queue.retry-delay-ms:0}") long retryDelayMs) {
        return ExecutePeriodicTask.bind(taskQueue, periodicTaskService,
                new TaskOptions(maxRetries, Duration.ofMillis(retryDelayMs)));
    }
}
