package com.workshopos.service;

import com.workshopos.config.OperatorSettings;
import com.workshopos.domain.SessionState;
import com.workshopos.domain.TrainingPortal;
import com.workshopos.dto.CreatePortalRequest;
import com.workshopos.dto.PortalResponse;
import com.workshopos.repository.TrainingPortalRepository;
import com.workshopos.repository.WorkshopSessionRepository;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.exceptions.HttpStatusException;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import jakarta.transaction.Transactional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@Singleton
public class PortalService {

    private static final Logger log = LoggerFactory.getLogger(PortalService.class);

    @Inject TrainingPortalRepository portalRepository;
    @Inject WorkshopSessionRepository sessionRepository;
    @Inject OperatorSettings operator;

    @Transactional
    public PortalResponse register(CreatePortalRequest req) {
        if (portalRepository.existsByName(req.name())) {
            throw new HttpStatusException(HttpStatus.CONFLICT, "Portal already exists: " + req.name());
        }

        String hostname = req.hostname() != null && !req.hostname().isBlank()
            ? req.hostname()
            : req.name() + "-ui." + operator.getIngressDomain();

        TrainingPortal portal = new TrainingPortal(req.name(), hostname);
        portal.setFrameAncestors(req.frameAncestors() != null ? req.frameAncestors() : "");
        portal.setSessionsMaximum(req.sessionsMaximum());
        portal.setUserSessionsLimit(req.userSessionsLimit());

        portal = portalRepository.save(portal);
        log.info("Registered portal {} (sessions maximum {})", portal.getName(), portal.getSessionsMaximum());
        return toResponse(portal);
    }

    @Transactional
    public PortalResponse get(String name) {
        return portalRepository.findByName(name)
            .map(this::toResponse)
            .orElseThrow(() -> new HttpStatusException(HttpStatus.NOT_FOUND, "Portal not found: " + name));
    }

    private PortalResponse toResponse(TrainingPortal p) {
        return new PortalResponse(
            p.getId(),
            p.getName(),
            p.getHostname(),
            p.getFrameAncestors(),
            p.getSessionsMaximum(),
            p.getUserSessionsLimit(),
            sessionRepository.countOwnedInPortal(p.getId(), SessionState.ACTIVE),
            sessionRepository.countUnownedInPortal(p.getId(), SessionState.CLAIMABLE),
            sessionRepository.countInPortal(p.getId(), SessionState.ACTIVE),
            p.getCreatedAt()
        );
    }
}
