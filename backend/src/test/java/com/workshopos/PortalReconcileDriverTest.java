package com.workshopos;

import com.workshopos.config.OperatorSettings;
import com.workshopos.domain.PortalPhase;
import com.workshopos.k8s.PortalReconcileDriver;
import com.workshopos.k8s.PortalReconciler;
import com.workshopos.k8s.ReconcileResult;
import com.workshopos.k8s.TrainingPortalResources;
import com.workshopos.k8s.crd.TrainingPortalResource;
import com.workshopos.k8s.crd.TrainingPortalStatus;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class PortalReconcileDriverTest {

    private TrainingPortalResources portals;
    private PortalReconciler reconciler;
    private ScheduledExecutorService scheduler;
    private MutableClock clock;
    private PortalReconcileDriver driver;

    private final TrainingPortalResource portal = portal("learning");

    @BeforeEach
    void setup() {
        portals = mock(TrainingPortalResources.class);
        reconciler = mock(PortalReconciler.class);
        scheduler = mock(ScheduledExecutorService.class);
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));

        OperatorSettings operator = new OperatorSettings();
        operator.setRetryDelay(Duration.ofSeconds(30));
        operator.setReconcileTimeout(Duration.ofSeconds(60));

        driver = new PortalReconcileDriver(portals, reconciler, operator, scheduler, clock);
        when(portals.get("learning")).thenReturn(Optional.of(portal));
    }

    @Test
    void submit_whileChainActive_isDropped() {
        assertThat(driver.submit("learning")).isTrue();
        assertThat(driver.submit("learning")).isFalse();

        verify(scheduler, times(1)).execute(any(Runnable.class));
        assertThat(driver.isInProgress("learning")).isTrue();
    }

    @Test
    void success_writesStatusAndEndsChain() {
        TrainingPortalStatus running = new TrainingPortalStatus(PortalPhase.RUNNING.value(), "created");
        when(reconciler.reconcile(portal)).thenReturn(ReconcileResult.success(running, "created"));

        driver.submit("learning");
        runSubmitted();

        verify(portals).updateStatus("learning", running);
        verify(scheduler, never()).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
        assertThat(driver.isInProgress("learning")).isFalse();
        assertThat(driver.submit("learning")).isTrue();
    }

    @Test
    void retry_isRescheduledAfterDelay() {
        when(reconciler.reconcile(portal))
            .thenReturn(ReconcileResult.retry(Duration.ofSeconds(30), PortalPhase.PENDING, "namespace taken"));

        driver.submit("learning");
        runSubmitted();

        ArgumentCaptor<TrainingPortalStatus> status = ArgumentCaptor.forClass(TrainingPortalStatus.class);
        verify(portals).updateStatus(eq("learning"), status.capture());
        assertThat(status.getValue().getPhase()).isEqualTo("Pending");
        verify(scheduler).schedule(any(Runnable.class), eq(30_000L), eq(TimeUnit.MILLISECONDS));
        assertThat(driver.isInProgress("learning")).isTrue();
    }

    @Test
    void retryWithoutStatus_leavesStatusAlone() {
        when(reconciler.reconcile(portal))
            .thenReturn(ReconcileResult.retry(Duration.ofSeconds(30), null, "deleting namespace"));

        driver.submit("learning");
        runSubmitted();

        verify(portals, never()).updateStatus(any(), any());
        verify(scheduler).schedule(any(Runnable.class), eq(30_000L), eq(TimeUnit.MILLISECONDS));
    }

    @Test
    void retriesStopOnceTimeoutWouldBeExceeded() {
        when(reconciler.reconcile(portal))
            .thenReturn(ReconcileResult.retry(Duration.ofSeconds(30), PortalPhase.RETRYING, "failed"));

        driver.submit("learning");
        runSubmitted();

        ArgumentCaptor<Runnable> next = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler).schedule(next.capture(), eq(30_000L), eq(TimeUnit.MILLISECONDS));

        clock.advance(Duration.ofSeconds(45));
        next.getValue().run();

        verify(reconciler, times(2)).reconcile(portal);
        verify(scheduler, times(1)).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
        assertThat(driver.isInProgress("learning")).isFalse();
    }

    @Test
    void terminal_endsChainWithoutRetry() {
        when(reconciler.reconcile(portal))
            .thenReturn(ReconcileResult.terminal(PortalPhase.ERROR, "invalid spec"));

        driver.submit("learning");
        runSubmitted();

        verify(portals).updateStatus(eq("learning"), any(TrainingPortalStatus.class));
        verify(scheduler, never()).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
        assertThat(driver.isInProgress("learning")).isFalse();
    }

    @Test
    void unexpectedException_isRetriedWithoutStatusChange() {
        when(reconciler.reconcile(portal)).thenThrow(new IllegalStateException("boom"));

        Optional<Duration> retryAfter = driver.reconcileOnce("learning");

        assertThat(retryAfter).contains(Duration.ofSeconds(30));
        verify(portals, never()).updateStatus(any(), any());
    }

    @Test
    void deletedPortal_endsChain() {
        when(portals.get("gone")).thenReturn(Optional.empty());

        assertThat(driver.reconcileOnce("gone")).isEmpty();
        verifyNoInteractions(reconciler);
    }

    private void runSubmitted() {
        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler, atLeastOnce()).execute(task.capture());
        task.getValue().run();
    }

    private static TrainingPortalResource portal(String name) {
        TrainingPortalResource portal = new TrainingPortalResource();
        portal.setMetadata(new ObjectMetaBuilder().withName(name).withUid("uid-" + name).build());
        return portal;
    }
}
