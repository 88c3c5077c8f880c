package com.workshopos.repository;

import com.workshopos.domain.OAuthApplication;
import io.micronaut.data.annotation.Repository;
import io.micronaut.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface OAuthApplicationRepository extends JpaRepository<OAuthApplication, UUID> {

    Optional<OAuthApplication> findByName(String name);
}
