package com.workshopos.service;

import com.workshopos.config.OperatorSettings;
import com.workshopos.domain.OAuthApplication;
import com.workshopos.domain.SessionState;
import com.workshopos.domain.TrainingPortal;
import com.workshopos.domain.WorkshopEnvironment;
import com.workshopos.domain.WorkshopSession;
import com.workshopos.dto.SessionResponse;
import com.workshopos.locking.ResourceLock;
import com.workshopos.repository.WorkshopEnvironmentRepository;
import com.workshopos.repository.WorkshopSessionRepository;
import com.workshopos.tasks.BackgroundTaskRunner;
import com.workshopos.tx.TransactionRunner;
import com.workshopos.tx.UnitOfWork;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.exceptions.HttpStatusException;
import jakarta.annotation.Nullable;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Allocates workshop sessions to users and keeps each environment's reserved
 * pool topped up.
 *
 * Every entry point takes the portal lock, then runs in a single transaction.
 * Environment capacity and the portal-wide maximum are therefore checked and
 * updated atomically with respect to every other allocation in the portal.
 * Sessions created here are deployed to the cluster only after the
 * transaction commits.
 *
 * Terms used below: <em>active</em> sessions are STARTING, WAITING or RUNNING;
 * <em>available</em> sessions are active, unowned and not yet RUNNING;
 * <em>allocated</em> sessions are active and owned.
 */
@Singleton
public class SessionScheduler {

    private static final Logger log = LoggerFactory.getLogger(SessionScheduler.class);

    @Inject ResourceLock resourceLock;
    @Inject TransactionRunner transactions;
    @Inject WorkshopEnvironmentRepository environmentRepository;
    @Inject WorkshopSessionRepository sessionRepository;
    @Inject OAuthApplicationService applicationService;
    @Inject AdmissionPolicy admissionPolicy;
    @Inject SessionDeployer deployer;
    @Inject BackgroundTaskRunner taskRunner;
    @Inject OperatorSettings operator;
    @Inject Clock clock;

    /**
     * Returns the session the user holds in the environment, or allocates one.
     *
     * @param token activation token for sessions requested through the API; a
     *              session allocated with a token stays pending until activated
     * @return empty when the user is not permitted another session or there
     *         is no capacity left
     */
    public Optional<SessionResponse> retrieveSessionForUser(String environmentName, String user, @Nullable String token) {
        String portalName = portalNameFor(environmentName);
        return resourceLock.withLock(ResourceLock.portalKey(portalName), () ->
            transactions.inTransaction(unit -> {
                WorkshopEnvironment environment = requireEnvironment(environmentName);
                return retrieve(unit, environment, user, token).map(this::toResponse);
            }));
    }

    /**
     * Creates reserved sessions until the environment's pool is full or a
     * capacity limit is reached.
     *
     * @return number of sessions created
     */
    public int fillReservedPool(String environmentName) {
        String portalName = portalNameFor(environmentName);
        return resourceLock.withLock(ResourceLock.portalKey(portalName), () ->
            transactions.inTransaction(unit -> {
                WorkshopEnvironment environment = requireEnvironment(environmentName);
                int created = 0;
                while (replenishReservedSessions(unit, environment)) {
                    created++;
                }
                if (created > 0) {
                    log.info("Created {} reserved sessions for environment {}", created, environmentName);
                }
                return created;
            }));
    }

    // ── Allocation ─────────────────────────────────────────────────────────

    private Optional<WorkshopSession> retrieve(UnitOfWork unit, WorkshopEnvironment environment,
                                               String user, @Nullable String token) {
        List<WorkshopSession> owned =
            sessionRepository.findOwnedInEnvironment(environment.getId(), user, SessionState.ACTIVE);
        if (!owned.isEmpty()) {
            WorkshopSession session = owned.get(0);
            // Re-bind rather than replace, so an API client retrying with a new
            // token does not leak sessions.
            if (token != null && session.isPending()) {
                session.markAsPending(user, token, OffsetDateTime.now(clock));
            }
            log.debug("User {} already holds session {}", user, session.getName());
            return Optional.of(session);
        }

        TrainingPortal portal = environment.getPortal();
        if (!admissionPolicy.isPermitted(portal, user)) {
            log.info("User {} not permitted a new session in portal {}", user, portal.getName());
            return Optional.empty();
        }

        Optional<WorkshopSession> reserved = allocateFromReserve(unit, environment, user, token);
        if (reserved.isPresent()) {
            return reserved;
        }
        return createForUser(unit, environment, user, token);
    }

    private Optional<WorkshopSession> allocateFromReserve(UnitOfWork unit, WorkshopEnvironment environment,
                                                          String user, @Nullable String token) {
        List<WorkshopSession> available =
            sessionRepository.findUnownedInEnvironment(environment.getId(), SessionState.CLAIMABLE);
        if (available.isEmpty()) {
            return Optional.empty();
        }
        WorkshopSession session = claim(available.get(0), user, token);
        log.info("Allocated reserved session {} to user {}", session.getName(), user);

        replenishReservedSessions(unit, environment);
        return Optional.of(session);
    }

    private Optional<WorkshopSession> createForUser(UnitOfWork unit, WorkshopEnvironment environment,
                                                    String user, @Nullable String token) {
        // Counts active sessions, reserved ones included, though by now the
        // environment has none reserved.
        long active = sessionRepository.countInEnvironment(environment.getId(), SessionState.ACTIVE);
        if (active >= environment.getCapacity()) {
            log.info("Environment {} at capacity ({} sessions)", environment.getName(), active);
            return Optional.empty();
        }

        TrainingPortal portal = environment.getPortal();
        if (!portal.isBounded()) {
            return Optional.of(claim(createNewSession(unit, environment), user, token));
        }

        long allocated = sessionRepository.countOwnedInPortal(portal.getId(), SessionState.ACTIVE);
        if (allocated >= portal.getSessionsMaximum()) {
            log.info("Portal {} at its maximum of {} allocated sessions", portal.getName(), allocated);
            return Optional.empty();
        }

        long portalActive = sessionRepository.countInPortal(portal.getId(), SessionState.ACTIVE);
        if (portalActive < portal.getSessionsMaximum()) {
            return Optional.of(claim(createNewSession(unit, environment), user, token));
        }

        // The portal is full of reserved sessions belonging to other workshops.
        // Activity is not tracked, so the oldest reserved session stands in
        // for the least used one.
        List<WorkshopSession> candidates =
            sessionRepository.findUnownedInPortal(portal.getId(), SessionState.CLAIMABLE);
        if (candidates.isEmpty()) {
            log.warn("Portal {} is full but has no reserved session to evict", portal.getName());
            return Optional.empty();
        }
        WorkshopSession evicted = candidates.get(0);
        evicted.markAsStopping(OffsetDateTime.now(clock));
        log.info("Evicted reserved session {} to make room in environment {}",
            evicted.getName(), environment.getName());

        WorkshopSession session = claim(createNewSession(unit, environment), user, token);
        replenishReservedSessions(unit, evicted.getEnvironment());
        return Optional.of(session);
    }

    private WorkshopSession claim(WorkshopSession session, String user, @Nullable String token) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        if (token != null) {
            session.markAsPending(user, token, now);
        } else {
            session.markAsRunning(user, now);
        }
        return session;
    }

    // ── Reserved pool ──────────────────────────────────────────────────────

    /**
     * Creates one reserved session if the environment is short of its
     * reserve and every capacity limit allows it. Call only after a reserved
     * session has been claimed or removed, or when filling a new environment.
     *
     * @return true if a session was created
     */
    public boolean replenishReservedSessions(UnitOfWork unit, WorkshopEnvironment environment) {
        if (environment.getReserved() <= 0) {
            return false;
        }

        long available = sessionRepository.countUnownedInEnvironment(environment.getId(), SessionState.CLAIMABLE);
        if (available >= environment.getReserved()) {
            return false;
        }

        long active = sessionRepository.countInEnvironment(environment.getId(), SessionState.ACTIVE);
        if (active >= environment.getCapacity()) {
            return false;
        }

        TrainingPortal portal = environment.getPortal();
        if (portal.isBounded()) {
            long total = sessionRepository.countOwnedInPortal(portal.getId(), SessionState.ACTIVE)
                + sessionRepository.countUnownedInPortal(portal.getId(), SessionState.CLAIMABLE);
            if (total >= portal.getSessionsMaximum()) {
                return false;
            }
        }

        WorkshopSession session = createNewSession(unit, environment);
        log.debug("Created reserved session {}", session.getName());
        return true;
    }

    // ── Session creation ───────────────────────────────────────────────────

    /** Saves a new STARTING session and schedules its deployment for after commit. */
    WorkshopSession createNewSession(UnitOfWork unit, WorkshopEnvironment environment) {
        WorkshopSession session = setupWorkshopSession(environment);
        String name = session.getName();
        unit.afterCommit(() -> taskRunner.schedule("deploy-session:" + name, () -> deployer.deploySession(name)));
        return session;
    }

    WorkshopSession setupWorkshopSession(WorkshopEnvironment environment) {
        int tally = environment.nextTally();
        environmentRepository.update(environment);

        String sessionId = String.format("s%03d", tally);
        String sessionName = environment.getName() + "-" + sessionId;

        OAuthApplication application = applicationService.getOrCreate(sessionName, environment.getIngresses());

        WorkshopSession session = new WorkshopSession();
        session.setName(sessionName);
        session.setSessionId(sessionId);
        session.setEnvironment(environment);
        session.setApplication(application);
        session.setCreated(OffsetDateTime.now(clock));
        return sessionRepository.save(session);
    }

    // ── Helpers ────────────────────────────────────────────────────────────

    private String portalNameFor(String environmentName) {
        return environmentRepository.findPortalNameByName(environmentName)
            .orElseThrow(() -> new HttpStatusException(HttpStatus.NOT_FOUND,
                "Environment not found: " + environmentName));
    }

    private WorkshopEnvironment requireEnvironment(String environmentName) {
        return environmentRepository.findByName(environmentName)
            .orElseThrow(() -> new HttpStatusException(HttpStatus.NOT_FOUND,
                "Environment not found: " + environmentName));
    }

    /** Must be called while the session's associations can still be loaded. */
    public SessionResponse toResponse(WorkshopSession s) {
        return new SessionResponse(
            s.getName(),
            s.getSessionId(),
            s.getEnvironment().getName(),
            s.getState().name(),
            s.getOwner(),
            s.isPending(),
            operator.getIngressProtocol() + "://" + s.getName() + "." + operator.getIngressDomain(),
            s.getCreated(),
            s.getStarted(),
            s.getExpires()
        );
    }
}
