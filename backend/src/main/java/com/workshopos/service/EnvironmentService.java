package com.workshopos.service;

import com.workshopos.domain.EnvEntry;
import com.workshopos.domain.SessionState;
import com.workshopos.domain.TrainingPortal;
import com.workshopos.domain.WorkshopEnvironment;
import com.workshopos.dto.CreateEnvironmentRequest;
import com.workshopos.dto.EnvVariable;
import com.workshopos.dto.EnvironmentResponse;
import com.workshopos.locking.ResourceLock;
import com.workshopos.repository.TrainingPortalRepository;
import com.workshopos.repository.WorkshopEnvironmentRepository;
import com.workshopos.repository.WorkshopSessionRepository;
import com.workshopos.tx.TransactionRunner;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.exceptions.HttpStatusException;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import jakarta.transaction.Transactional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

@Singleton
public class EnvironmentService {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentService.class);

    @Inject ResourceLock resourceLock;
    @Inject TransactionRunner transactions;
    @Inject TrainingPortalRepository portalRepository;
    @Inject WorkshopEnvironmentRepository environmentRepository;
    @Inject WorkshopSessionRepository sessionRepository;
    @Inject SessionScheduler scheduler;

    /**
     * Registers the environment, then fills its reserved pool in a second
     * transaction so the pool's deployment tasks run once both have committed.
     */
    public EnvironmentResponse register(String portalName, CreateEnvironmentRequest req) {
        if (req.reserved() > req.capacity()) {
            throw new HttpStatusException(HttpStatus.BAD_REQUEST,
                "reserved (" + req.reserved() + ") cannot exceed capacity (" + req.capacity() + ")");
        }

        resourceLock.withLock(ResourceLock.portalKey(portalName), () ->
            transactions.inTransaction(unit -> {
                TrainingPortal portal = portalRepository.findByName(portalName)
                    .orElseThrow(() -> new HttpStatusException(HttpStatus.NOT_FOUND, "Portal not found: " + portalName));
                if (environmentRepository.existsByName(req.name())) {
                    throw new HttpStatusException(HttpStatus.CONFLICT, "Environment already exists: " + req.name());
                }

                WorkshopEnvironment environment = new WorkshopEnvironment();
                environment.setName(req.name());
                environment.setPortal(portal);
                environment.setCapacity(req.capacity());
                environment.setReserved(req.reserved());
                environment.setResourceName(req.resourceName() != null ? req.resourceName() : req.name());
                environment.setResourceUid(req.resourceUid() != null ? req.resourceUid() : "");
                environment.setDuration(req.duration());
                environment.setInactivity(req.inactivity());
                environment.setEnv(toEntries(req.env()));
                environment.setIngresses(req.ingresses() != null ? new ArrayList<>(req.ingresses()) : new ArrayList<>());
                return environmentRepository.save(environment);
            }));

        log.info("Registered environment {} in portal {} (capacity {}, reserved {})",
            req.name(), portalName, req.capacity(), req.reserved());

        scheduler.fillReservedPool(req.name());
        return get(req.name());
    }

    @Transactional
    public EnvironmentResponse get(String name) {
        return environmentRepository.findByName(name)
            .map(this::toResponse)
            .orElseThrow(() -> new HttpStatusException(HttpStatus.NOT_FOUND, "Environment not found: " + name));
    }

    @Transactional
    public List<EnvironmentResponse> listForPortal(String portalName) {
        TrainingPortal portal = portalRepository.findByName(portalName)
            .orElseThrow(() -> new HttpStatusException(HttpStatus.NOT_FOUND, "Portal not found: " + portalName));
        return environmentRepository.findByPortal(portal.getId())
            .stream()
            .map(this::toResponse)
            .toList();
    }

    private List<EnvEntry> toEntries(List<EnvVariable> variables) {
        List<EnvEntry> entries = new ArrayList<>();
        if (variables != null) {
            for (EnvVariable v : variables) {
                entries.add(new EnvEntry(v.name(), v.value() != null ? v.value() : ""));
            }
        }
        return entries;
    }

    private EnvironmentResponse toResponse(WorkshopEnvironment e) {
        return new EnvironmentResponse(
            e.getId(),
            e.getName(),
            e.getPortal().getName(),
            e.getCapacity(),
            e.getReserved(),
            e.getTally(),
            e.getDuration(),
            e.getInactivity(),
            e.getEnv().stream().map(entry -> new EnvVariable(entry.getName(), entry.getValue())).toList(),
            List.copyOf(e.getIngresses()),
            sessionRepository.countOwnedInEnvironment(e.getId(), SessionState.ACTIVE),
            sessionRepository.countUnownedInEnvironment(e.getId(), SessionState.CLAIMABLE),
            e.getCreatedAt()
        );
    }
}
