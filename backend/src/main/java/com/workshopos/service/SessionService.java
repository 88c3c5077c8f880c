package com.workshopos.service;

import com.workshopos.domain.SessionState;
import com.workshopos.domain.WorkshopEnvironment;
import com.workshopos.domain.WorkshopSession;
import com.workshopos.dto.SessionResponse;
import com.workshopos.locking.ResourceLock;
import com.workshopos.repository.WorkshopEnvironmentRepository;
import com.workshopos.repository.WorkshopSessionRepository;
import com.workshopos.tx.TransactionRunner;
import com.workshopos.tx.UnitOfWork;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.exceptions.HttpStatusException;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import jakarta.transaction.Transactional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.function.BiFunction;

/** Operations on individual sessions once they exist. */
@Singleton
public class SessionService {

    private static final Logger log = LoggerFactory.getLogger(SessionService.class);

    @Inject ResourceLock resourceLock;
    @Inject TransactionRunner transactions;
    @Inject WorkshopSessionRepository sessionRepository;
    @Inject WorkshopEnvironmentRepository environmentRepository;
    @Inject SessionScheduler scheduler;
    @Inject Clock clock;

    /**
     * Completes activation of a session allocated with a token. Activating a
     * session that is no longer pending returns it unchanged.
     */
    public SessionResponse activate(String sessionName, String token) {
        return withSession(sessionName, (unit, session) -> {
            if (session.getState() == SessionState.STOPPING) {
                throw new HttpStatusException(HttpStatus.NOT_FOUND, "Session has been terminated: " + sessionName);
            }
            if (!session.isPending()) {
                log.debug("Session {} already activated", sessionName);
                return scheduler.toResponse(session);
            }
            if (!token.equals(session.getToken())) {
                log.warn("Activation of session {} with wrong token", sessionName);
                throw new HttpStatusException(HttpStatus.FORBIDDEN, "Invalid activation token");
            }
            session.markAsRunning(session.getOwner(), OffsetDateTime.now(clock));
            log.info("Session {} activated by {} ({})", sessionName, session.getOwner(), session.getState());
            return scheduler.toResponse(session);
        });
    }

    /**
     * Marks the session for the reaper and replaces it in the reserved pool
     * if the environment keeps one.
     */
    public SessionResponse terminate(String sessionName) {
        return withSession(sessionName, (unit, session) -> {
            if (session.getState() == SessionState.STOPPING) {
                return scheduler.toResponse(session);
            }
            session.markAsStopping(OffsetDateTime.now(clock));
            log.info("Session {} marked as stopping", sessionName);
            scheduler.replenishReservedSessions(unit, session.getEnvironment());
            return scheduler.toResponse(session);
        });
    }

    @Transactional
    public List<SessionResponse> listForEnvironment(String environmentName) {
        WorkshopEnvironment environment = environmentRepository.findByName(environmentName)
            .orElseThrow(() -> new HttpStatusException(HttpStatus.NOT_FOUND,
                "Environment not found: " + environmentName));
        return sessionRepository.findByEnvironment(environment.getId())
            .stream()
            .map(scheduler::toResponse)
            .toList();
    }

    /** Runs the action on the session under its portal lock, in one transaction. */
    private SessionResponse withSession(String sessionName, BiFunction<UnitOfWork, WorkshopSession, SessionResponse> action) {
        String portalName = sessionRepository.findPortalNameBySessionName(sessionName)
            .orElseThrow(() -> new HttpStatusException(HttpStatus.NOT_FOUND, "Session not found: " + sessionName));

        return resourceLock.withLock(ResourceLock.portalKey(portalName), () ->
            transactions.inTransaction(unit -> {
                WorkshopSession session = sessionRepository.findByName(sessionName)
                    .orElseThrow(() -> new HttpStatusException(HttpStatus.NOT_FOUND,
                        "Session not found: " + sessionName));
                return action.apply(unit, session);
            }));
    }
}
