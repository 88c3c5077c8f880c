package com.workshopos.repository;

import com.workshopos.domain.WorkshopEnvironment;
import io.micronaut.data.annotation.Query;
import io.micronaut.data.annotation.Repository;
import io.micronaut.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface WorkshopEnvironmentRepository extends JpaRepository<WorkshopEnvironment, UUID> {

    Optional<WorkshopEnvironment> findByName(String name);

    boolean existsByName(String name);

    @Query("FROM WorkshopEnvironment e WHERE e.portal.id = :portalId ORDER BY e.name")
    List<WorkshopEnvironment> findByPortal(UUID portalId);

    /**
     * Name of the portal owning an environment. Used to pick the lock key
     * before any transaction is opened.
     */
    @Query("SELECT e.portal.name FROM WorkshopEnvironment e WHERE e.name = :name")
    Optional<String> findPortalNameByName(String name);
}
