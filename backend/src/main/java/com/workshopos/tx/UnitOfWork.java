package com.workshopos.tx;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Handle passed into a transactional block. Work registered with
 * {@link #afterCommit(Runnable)} runs only once the enclosing transaction has
 * committed, and is dropped if it rolls back.
 */
public final class UnitOfWork {

    private static final Logger log = LoggerFactory.getLogger(UnitOfWork.class);

    private final List<Runnable> afterCommit = new ArrayList<>();
    private boolean completed;

    UnitOfWork() {}

    public void afterCommit(Runnable callback) {
        if (completed) {
            throw new IllegalStateException("Transaction already completed");
        }
        afterCommit.add(callback);
    }

    int pendingCallbacks() {
        return afterCommit.size();
    }

    /**
     * Runs the post-commit callbacks in registration order. A failing callback
     * does not stop the others: the data is already committed.
     */
    void committed() {
        completed = true;
        for (Runnable callback : afterCommit) {
            try {
                callback.run();
            } catch (RuntimeException e) {
                log.error("Post-commit callback failed: {}", e.getMessage(), e);
            }
        }
        afterCommit.clear();
    }

    void rolledBack() {
        completed = true;
        if (!afterCommit.isEmpty()) {
            log.debug("Discarding {} post-commit callbacks after rollback", afterCommit.size());
        }
        afterCommit.clear();
    }
}
