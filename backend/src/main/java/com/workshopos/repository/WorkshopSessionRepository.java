package com.workshopos.repository;

import com.workshopos.domain.SessionState;
import com.workshopos.domain.WorkshopSession;
import io.micronaut.data.annotation.Query;
import io.micronaut.data.annotation.Repository;
import io.micronaut.data.jpa.repository.JpaRepository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Session queries backing the capacity checks. Callers pass the state sets from
 * {@link SessionState#ACTIVE} and {@link SessionState#CLAIMABLE}. All counts run
 * inside the caller's transaction, so Hibernate flushes pending changes first.
 */
@Repository
public interface WorkshopSessionRepository extends JpaRepository<WorkshopSession, UUID> {

    Optional<WorkshopSession> findByName(String name);

    @Query("SELECT s.environment.portal.name FROM WorkshopSession s WHERE s.name = :name")
    Optional<String> findPortalNameBySessionName(String name);

    @Query("FROM WorkshopSession s WHERE s.environment.id = :environmentId ORDER BY s.created ASC")
    List<WorkshopSession> findByEnvironment(UUID environmentId);

    // ── Environment scope ─────────────────────────────────────────────────

    @Query("SELECT COUNT(s) FROM WorkshopSession s " +
           "WHERE s.environment.id = :environmentId AND s.state IN (:states)")
    long countInEnvironment(UUID environmentId, List<SessionState> states);

    @Query("SELECT COUNT(s) FROM WorkshopSession s " +
           "WHERE s.environment.id = :environmentId AND s.owner IS NULL AND s.state IN (:states)")
    long countUnownedInEnvironment(UUID environmentId, List<SessionState> states);

    @Query("SELECT COUNT(s) FROM WorkshopSession s " +
           "WHERE s.environment.id = :environmentId AND s.owner IS NOT NULL AND s.state IN (:states)")
    long countOwnedInEnvironment(UUID environmentId, List<SessionState> states);

    @Query("FROM WorkshopSession s " +
           "WHERE s.environment.id = :environmentId AND s.owner IS NULL AND s.state IN (:states) " +
           "ORDER BY s.created ASC")
    List<WorkshopSession> findUnownedInEnvironment(UUID environmentId, List<SessionState> states);

    @Query("FROM WorkshopSession s " +
           "WHERE s.environment.id = :environmentId AND s.owner = :owner AND s.state IN (:states) " +
           "ORDER BY s.created ASC")
    List<WorkshopSession> findOwnedInEnvironment(UUID environmentId, String owner, List<SessionState> states);

    // ── Portal scope ──────────────────────────────────────────────────────

    @Query("SELECT COUNT(s) FROM WorkshopSession s " +
           "WHERE s.environment.portal.id = :portalId AND s.state IN (:states)")
    long countInPortal(UUID portalId, List<SessionState> states);

    @Query("SELECT COUNT(s) FROM WorkshopSession s " +
           "WHERE s.environment.portal.id = :portalId AND s.owner IS NOT NULL AND s.state IN (:states)")
    long countOwnedInPortal(UUID portalId, List<SessionState> states);

    @Query("SELECT COUNT(s) FROM WorkshopSession s " +
           "WHERE s.environment.portal.id = :portalId AND s.owner IS NULL AND s.state IN (:states)")
    long countUnownedInPortal(UUID portalId, List<SessionState> states);

    @Query("SELECT COUNT(s) FROM WorkshopSession s " +
           "WHERE s.environment.portal.id = :portalId AND s.owner = :owner AND s.state IN (:states)")
    long countOwnedByUserInPortal(UUID portalId, String owner, List<SessionState> states);

    /** Oldest first: the eviction order. */
    @Query("FROM WorkshopSession s " +
           "WHERE s.environment.portal.id = :portalId AND s.owner IS NULL AND s.state IN (:states) " +
           "ORDER BY s.created ASC")
    List<WorkshopSession> findUnownedInPortal(UUID portalId, List<SessionState> states);

    // ── Deployment sweep ──────────────────────────────────────────────────

    @Query("SELECT s.name FROM WorkshopSession s WHERE s.state = :state AND s.created < :cutoff")
    List<String> findNamesInStateCreatedBefore(SessionState state, OffsetDateTime cutoff);
}
