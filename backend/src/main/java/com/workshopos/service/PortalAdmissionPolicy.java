package com.workshopos.service;

import com.workshopos.domain.SessionState;
import com.workshopos.domain.TrainingPortal;
import com.workshopos.repository.WorkshopSessionRepository;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Caps the number of sessions one user may hold across a portal at the
 * portal's {@code userSessionsLimit}. A limit of zero means no cap.
 */
@Singleton
public class PortalAdmissionPolicy implements AdmissionPolicy {

    private static final Logger log = LoggerFactory.getLogger(PortalAdmissionPolicy.class);

    @Inject WorkshopSessionRepository sessionRepository;

    @Override
    public boolean isPermitted(TrainingPortal portal, String user) {
        int limit = portal.getUserSessionsLimit();
        if (limit <= 0) {
            return true;
        }
        long held = sessionRepository.countOwnedByUserInPortal(portal.getId(), user, SessionState.ACTIVE);
        if (held >= limit) {
            log.info("User {} already holds {} sessions in portal {} (limit {})", user, held, portal.getName(), limit);
            return false;
        }
        return true;
    }
}
