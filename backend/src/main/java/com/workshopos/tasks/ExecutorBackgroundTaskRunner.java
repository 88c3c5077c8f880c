package com.workshopos.tasks;

import io.micronaut.scheduling.TaskExecutors;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/** Runs tasks on the Micronaut IO executor. */
@Singleton
public class ExecutorBackgroundTaskRunner implements BackgroundTaskRunner {

    private static final Logger log = LoggerFactory.getLogger(ExecutorBackgroundTaskRunner.class);

    private final ExecutorService executor;

    public ExecutorBackgroundTaskRunner(@Named(TaskExecutors.IO) ExecutorService executor) {
        this.executor = executor;
    }

    @Override
    public void schedule(String taskName, Runnable task) {
        try {
            executor.execute(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    log.error("Background task {} failed: {}", taskName, e.getMessage(), e);
                }
            });
            log.debug("Scheduled background task {}", taskName);
        } catch (RejectedExecutionException e) {
            log.warn("Background task {} rejected, it will be retried by the sweeper: {}", taskName, e.getMessage());
        }
    }
}
