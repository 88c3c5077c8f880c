package com.workshopos.k8s;

import com.workshopos.config.OperatorSettings;
import com.workshopos.k8s.crd.TrainingPortalResource;
import io.micronaut.scheduling.TaskExecutors;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs {@link PortalReconciler} attempts until one succeeds, fails terminally,
 * or the reconcile timeout runs out.
 *
 * There is at most one attempt chain per portal name. The chain holds an
 * entry in {@code deadlines} from submission until it ends; a submission
 * while the entry exists is dropped.
 */
@Singleton
public class PortalReconcileDriver {

    private static final Logger log = LoggerFactory.getLogger(PortalReconcileDriver.class);

    private final TrainingPortalResources portals;
    private final PortalReconciler reconciler;
    private final OperatorSettings operator;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;

    private final ConcurrentMap<String, Instant> deadlines = new ConcurrentHashMap<>();

    public PortalReconcileDriver(TrainingPortalResources portals,
                                 PortalReconciler reconciler,
                                 OperatorSettings operator,
                                 @Named(TaskExecutors.SCHEDULED) ScheduledExecutorService scheduler,
                                 Clock clock) {
        this.portals = portals;
        this.reconciler = reconciler;
        this.operator = operator;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    /**
     * Starts an attempt chain for the portal.
     *
     * @return false when a chain for this portal is already running
     */
    public boolean submit(String name) {
        Instant deadline = clock.instant().plus(operator.getReconcileTimeout());
        if (deadlines.putIfAbsent(name, deadline) != null) {
            log.debug("Reconciliation of portal {} already in progress", name);
            return false;
        }
        log.info("Reconciling training portal {}", name);
        scheduler.execute(() -> attempt(name));
        return true;
    }

    public boolean isInProgress(String name) {
        return deadlines.containsKey(name);
    }

    void attempt(String name) {
        Optional<Duration> retryAfter;
        try {
            retryAfter = reconcileOnce(name);
        } catch (RuntimeException e) {
            log.error("Reconciliation of portal {} failed: {}", name, e.getMessage(), e);
            retryAfter = Optional.of(operator.getRetryDelay());
        }

        if (retryAfter.isEmpty()) {
            deadlines.remove(name);
            return;
        }

        Duration delay = retryAfter.get();
        Instant deadline = deadlines.get(name);
        if (deadline == null || clock.instant().plus(delay).isAfter(deadline)) {
            log.error("Giving up on training portal {}: not reconciled within {}",
                name, operator.getReconcileTimeout());
            deadlines.remove(name);
            return;
        }
        scheduler.schedule(() -> attempt(name), delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * One attempt against the latest copy of the resource.
     *
     * @return the delay before the next attempt, empty when the chain is done
     */
    public Optional<Duration> reconcileOnce(String name) {
        Optional<TrainingPortalResource> portal = portals.get(name);
        if (portal.isEmpty()) {
            log.info("Training portal {} no longer exists, stopping reconciliation", name);
            return Optional.empty();
        }

        ReconcileResult result;
        try {
            result = reconciler.reconcile(portal.get());
        } catch (RuntimeException e) {
            log.error("Unexpected error reconciling portal {}: {}", name, e.getMessage(), e);
            return Optional.of(operator.getRetryDelay());
        }

        if (result.status() != null) {
            portals.updateStatus(name, result.status());
        }

        switch (result.outcome()) {
            case SUCCESS:
                log.debug("Portal {} reconciled: {}", name, result.message());
                return Optional.empty();
            case RETRY:
                log.warn("Portal {} will be retried in {}: {}", name, result.delay(), result.message());
                return Optional.of(result.delay() != null ? result.delay() : operator.getRetryDelay());
            default:
                log.error("Portal {} failed permanently: {}", name, result.message());
                return Optional.empty();
        }
    }
}
