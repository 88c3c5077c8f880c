package com.workshopos.repository;

import com.workshopos.domain.TrainingPortal;
import io.micronaut.data.annotation.Repository;
import io.micronaut.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface TrainingPortalRepository extends JpaRepository<TrainingPortal, UUID> {

    Optional<TrainingPortal> findByName(String name);

    boolean existsByName(String name);
}
