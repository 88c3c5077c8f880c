package com.workshopos;

import com.workshopos.tasks.BackgroundTaskRunner;

import java.util.ArrayList;
import java.util.List;

/** Collects scheduled tasks instead of running them, so tests decide when deployment happens. */
class RecordingTaskRunner implements BackgroundTaskRunner {

    private final List<String> names = new ArrayList<>();
    private final List<Runnable> tasks = new ArrayList<>();

    @Override
    public synchronized void schedule(String taskName, Runnable task) {
        names.add(taskName);
        tasks.add(task);
    }

    synchronized List<String> names() {
        return List.copyOf(names);
    }

    synchronized void runAll() {
        List<Runnable> pending = new ArrayList<>(tasks);
        tasks.clear();
        pending.forEach(Runnable::run);
    }
}
