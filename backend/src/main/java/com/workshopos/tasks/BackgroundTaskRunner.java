package com.workshopos.tasks;

/**
 * Runs work off the calling thread. Delivery is at least once across the
 * whole system: a task lost before it runs is picked up again by
 * {@link SessionDeploymentSweeper}, so every task must be idempotent.
 */
public interface BackgroundTaskRunner {

    void schedule(String taskName, Runnable task);
}
