package com.workshopos;

import com.workshopos.dto.CreateEnvironmentRequest;
import com.workshopos.dto.CreatePortalRequest;
import com.workshopos.dto.PortalResponse;
import com.workshopos.dto.SessionResponse;
import com.workshopos.repository.OAuthApplicationRepository;
import com.workshopos.repository.WorkshopSessionRepository;
import com.workshopos.service.EnvironmentService;
import com.workshopos.service.PortalService;
import com.workshopos.service.SessionScheduler;
import com.workshopos.service.SessionService;
import com.workshopos.tasks.BackgroundTaskRunner;
import com.workshopos.tx.TransactionRunner;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.exceptions.HttpStatusException;
import io.micronaut.test.annotation.MockBean;
import io.micronaut.test.extensions.junit5.annotation.MicronautTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Answers.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.mock;

@MicronautTest(transactional = false)
class SessionSchedulerTest {

    @Inject PortalService portalService;
    @Inject EnvironmentService environmentService;
    @Inject SessionScheduler scheduler;
    @Inject SessionService sessionService;
    @Inject WorkshopSessionRepository sessionRepository;
    @Inject TransactionRunner transactions;
    @Inject OAuthApplicationRepository applicationRepository;

    @MockBean(KubernetesClient.class)
    KubernetesClient mockK8s() {
        return mock(KubernetesClient.class, RETURNS_DEEP_STUBS);
    }

    @MockBean(BackgroundTaskRunner.class)
    BackgroundTaskRunner taskRunner() {
        return new RecordingTaskRunner();
    }

    @Test
    void reservedPool_isFilledOnRegistration() {
        portal("fill", 0, 0);
        environmentService.register("fill", environment("fill-w01", 5, 3));

        List<SessionResponse> sessions = sessionService.listForEnvironment("fill-w01");
        assertThat(sessions).extracting(SessionResponse::name)
            .containsExactly("fill-w01-s001", "fill-w01-s002", "fill-w01-s003");
        assertThat(sessions).allSatisfy(s -> {
            assertThat(s.owner()).isNull();
            assertThat(s.state()).isEqualTo("STARTING");
        });
        assertThat(environmentService.get("fill-w01").tally()).isEqualTo(3);
    }

    @Test
    void reservedPool_isCappedByPortalMaximum() {
        portal("capped", 2, 0);
        environmentService.register("capped", environment("capped-w01", 5, 4));

        assertThat(sessionService.listForEnvironment("capped-w01")).hasSize(2);
    }

    @Test
    void environmentCapacity_isNeverExceeded() {
        portal("cap", 0, 0);
        environmentService.register("cap", environment("cap-w01", 2, 0));

        assertThat(scheduler.retrieveSessionForUser("cap-w01", "u1", null)).isPresent();
        assertThat(scheduler.retrieveSessionForUser("cap-w01", "u2", null)).isPresent();
        assertThat(scheduler.retrieveSessionForUser("cap-w01", "u3", null)).isEmpty();

        assertThat(sessionService.listForEnvironment("cap-w01")).hasSize(2);
    }

    @Test
    void reservedSession_isPreferredAndReplaced() {
        portal("pref", 0, 0);
        environmentService.register("pref", environment("pref-w01", 3, 1));

        SessionResponse session = scheduler.retrieveSessionForUser("pref-w01", "alice", null).orElseThrow();

        assertThat(session.name()).isEqualTo("pref-w01-s001");
        assertThat(session.owner()).isEqualTo("alice");
        assertThat(session.pending()).isFalse();
        assertThat(session.url()).isEqualTo("https://pref-w01-s001.test.example.com");

        List<SessionResponse> sessions = sessionService.listForEnvironment("pref-w01");
        assertThat(sessions).extracting(SessionResponse::name).containsExactly("pref-w01-s001", "pref-w01-s002");
        assertThat(sessions.get(1).owner()).isNull();
    }

    @Test
    void existingSession_isReturnedAgain() {
        portal("again", 0, 0);
        environmentService.register("again", environment("again-w01", 3, 0));

        SessionResponse first = scheduler.retrieveSessionForUser("again-w01", "bob", null).orElseThrow();
        SessionResponse second = scheduler.retrieveSessionForUser("again-w01", "bob", null).orElseThrow();

        assertThat(second.name()).isEqualTo(first.name());
        assertThat(sessionService.listForEnvironment("again-w01")).hasSize(1);
    }

    @Test
    void pendingSession_isReboundToNewestToken() {
        portal("token", 0, 0);
        environmentService.register("token", environment("token-w01", 3, 0));

        SessionResponse first = scheduler.retrieveSessionForUser("token-w01", "carol", "t1").orElseThrow();
        assertThat(first.pending()).isTrue();

        String secret = clientSecret(first.name());

        SessionResponse second = scheduler.retrieveSessionForUser("token-w01", "carol", "t2").orElseThrow();
        assertThat(second.name()).isEqualTo(first.name());
        assertThat(sessionService.listForEnvironment("token-w01")).hasSize(1);
        assertThat(clientSecret(first.name())).isEqualTo(secret);

        assertThatThrownBy(() -> sessionService.activate(first.name(), "t1"))
            .isInstanceOf(HttpStatusException.class)
            .satisfies(e -> assertThat((Object) ((HttpStatusException) e).getStatus()).isEqualTo(HttpStatus.FORBIDDEN));

        SessionResponse activated = sessionService.activate(first.name(), "t2");
        assertThat(activated.pending()).isFalse();
        assertThat(activated.owner()).isEqualTo("carol");
    }

    @Test
    void userSessionsLimit_isEnforcedAcrossEnvironments() {
        portal("limit", 0, 1);
        environmentService.register("limit", environment("limit-w01", 3, 0));
        environmentService.register("limit", environment("limit-w02", 3, 0));

        assertThat(scheduler.retrieveSessionForUser("limit-w01", "dave", null)).isPresent();
        assertThat(scheduler.retrieveSessionForUser("limit-w02", "dave", null)).isEmpty();
        assertThat(scheduler.retrieveSessionForUser("limit-w02", "erin", null)).isPresent();
    }

    @Test
    void portalMaximum_capsAllocatedSessions() {
        portal("max", 1, 0);
        environmentService.register("max", environment("max-w01", 3, 0));

        assertThat(scheduler.retrieveSessionForUser("max-w01", "u1", null)).isPresent();
        assertThat(scheduler.retrieveSessionForUser("max-w01", "u2", null)).isEmpty();

        PortalResponse portal = portalService.get("max");
        assertThat(portal.allocatedSessions()).isEqualTo(1);
        assertThat(portal.activeSessions()).isEqualTo(1);
    }

    @Test
    void fullPortal_evictsOldestReservedSession() {
        portal("evict", 2, 0);
        environmentService.register("evict", environment("evict-a", 1, 1));
        environmentService.register("evict", environment("evict-b", 1, 1));
        environmentService.register("evict", environment("evict-c", 1, 0));

        OffsetDateTime base = OffsetDateTime.parse("2026-01-01T00:00:00Z");
        setCreated("evict-a-s001", base);
        setCreated("evict-b-s001", base.plusMinutes(5));

        Optional<SessionResponse> session = scheduler.retrieveSessionForUser("evict-c", "frank", null);

        assertThat(session).isPresent();
        assertThat(session.get().name()).isEqualTo("evict-c-s001");
        assertThat(sessionService.listForEnvironment("evict-a"))
            .singleElement()
            .satisfies(s -> assertThat(s.state()).isEqualTo("STOPPING"));
        assertThat(sessionService.listForEnvironment("evict-b"))
            .singleElement()
            .satisfies(s -> assertThat(s.state()).isEqualTo("STARTING"));

        PortalResponse portal = portalService.get("evict");
        assertThat(portal.activeSessions()).isEqualTo(2);
        assertThat(portal.availableSessions()).isEqualTo(1);
    }

    @Test
    void terminatedSession_isReplacedInReservedPool() {
        portal("term", 0, 0);
        environmentService.register("term", environment("term-w01", 2, 1));

        SessionResponse session = scheduler.retrieveSessionForUser("term-w01", "gina", null).orElseThrow();
        SessionResponse stopped = sessionService.terminate(session.name());

        assertThat(stopped.state()).isEqualTo("STOPPING");
        assertThat(stopped.expires()).isNotNull();
        assertThat(environmentService.get("term-w01").availableSessions()).isEqualTo(1);
    }

    @Test
    void unknownEnvironment_isNotFound() {
        assertThatThrownBy(() -> scheduler.retrieveSessionForUser("missing-w01", "u1", null))
            .isInstanceOf(HttpStatusException.class)
            .satisfies(e -> assertThat((Object) ((HttpStatusException) e).getStatus()).isEqualTo(HttpStatus.NOT_FOUND));
    }

    private void portal(String name, int sessionsMaximum, int userSessionsLimit) {
        portalService.register(new CreatePortalRequest(name, null, null, sessionsMaximum, userSessionsLimit));
    }

    private CreateEnvironmentRequest environment(String name, int capacity, int reserved) {
        return new CreateEnvironmentRequest(name, capacity, reserved, null, null, 0, 0, null, null);
    }

    private String clientSecret(String sessionName) {
        return applicationRepository.findByName(sessionName).orElseThrow().getClientSecret();
    }

    private void setCreated(String sessionName, OffsetDateTime created) {
        transactions.inTransaction(unit -> {
            sessionRepository.findByName(sessionName).ifPresent(s -> {
                s.setCreated(created);
                sessionRepository.update(s);
            });
            return null;
        });
    }
}
