package com.workshopos.k8s;

import com.workshopos.domain.PortalPhase;
import com.workshopos.k8s.crd.TrainingPortalStatus;
import jakarta.annotation.Nullable;

import java.time.Duration;

/**
 * Outcome of one reconciliation attempt.
 *
 * @param status status to write back to the resource, or {@code null} to leave it unchanged
 * @param delay  wait before the next attempt; only set for {@link Outcome#RETRY}
 */
public record ReconcileResult(
    Outcome outcome,
    @Nullable TrainingPortalStatus status,
    @Nullable Duration delay,
    String message
) {

    public enum Outcome { SUCCESS, RETRY, TERMINAL }

    public static ReconcileResult success(@Nullable TrainingPortalStatus status, String message) {
        return new ReconcileResult(Outcome.SUCCESS, status, null, message);
    }

    public static ReconcileResult retry(Duration delay, @Nullable PortalPhase phase, String message) {
        return new ReconcileResult(Outcome.RETRY, statusFor(phase, message), delay, message);
    }

    public static ReconcileResult terminal(@Nullable PortalPhase phase, String message) {
        return new ReconcileResult(Outcome.TERMINAL, statusFor(phase, message), null, message);
    }

    public boolean isRetry() {
        return outcome == Outcome.RETRY;
    }

    private static TrainingPortalStatus statusFor(@Nullable PortalPhase phase, String message) {
        return phase != null ? new TrainingPortalStatus(phase.value(), message) : null;
    }
}
