package com.workshopos.service;

import com.workshopos.config.OperatorSettings;
import com.workshopos.domain.EnvEntry;
import com.workshopos.domain.SessionState;
import com.workshopos.domain.TrainingPortal;
import com.workshopos.domain.WorkshopEnvironment;
import com.workshopos.domain.WorkshopSession;
import com.workshopos.k8s.WorkshopSessionManager;
import com.workshopos.k8s.crd.TrainingPortalResource;
import com.workshopos.k8s.crd.TrainingPortalSpec;
import com.workshopos.k8s.crd.WorkshopSessionResource;
import com.workshopos.k8s.crd.WorkshopSessionSpec;
import com.workshopos.locking.ResourceLock;
import com.workshopos.repository.WorkshopSessionRepository;
import com.workshopos.tx.TransactionRunner;
import io.fabric8.kubernetes.api.model.EnvVar;
import io.fabric8.kubernetes.api.model.EnvVarBuilder;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.fabric8.kubernetes.api.model.OwnerReferenceBuilder;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Deploys a committed session record to the cluster as a WorkshopSession
 * resource. Runs as a background task and may run more than once for the
 * same session; only a session still STARTING is acted on.
 */
@Singleton
public class SessionDeployer {

    private static final Logger log = LoggerFactory.getLogger(SessionDeployer.class);

    @Inject ResourceLock resourceLock;
    @Inject TransactionRunner transactions;
    @Inject WorkshopSessionRepository sessionRepository;
    @Inject WorkshopSessionManager sessionManager;
    @Inject OperatorSettings operator;

    /**
     * @return true if the session was deployed by this call, false if there
     *         was nothing to do
     */
    public boolean deploySession(String sessionName) {
        Optional<String> portalName = sessionRepository.findPortalNameBySessionName(sessionName);
        if (portalName.isEmpty()) {
            log.debug("Session {} no longer exists, skipping deployment", sessionName);
            return false;
        }

        return resourceLock.withLock(ResourceLock.portalKey(portalName.get()), () ->
            transactions.inTransaction(unit -> {
                WorkshopSession session = sessionRepository.findByName(sessionName).orElse(null);
                if (session == null || session.getState() != SessionState.STARTING) {
                    log.debug("Session {} not in STARTING state, skipping deployment", sessionName);
                    return false;
                }

                sessionManager.create(buildResource(session));

                SessionState next;
                if (session.getOwner() != null) {
                    next = session.getToken() != null ? SessionState.WAITING : SessionState.RUNNING;
                } else {
                    next = SessionState.WAITING;
                }
                session.setState(next);
                sessionRepository.update(session);

                log.info("Deployed session {} ({})", sessionName, next);
                return true;
            }));
    }

    WorkshopSessionResource buildResource(WorkshopSession session) {
        WorkshopEnvironment environment = session.getEnvironment();
        TrainingPortal portal = environment.getPortal();

        Map<String, String> labels = new LinkedHashMap<>();
        labels.put("training." + operator.getApiGroup() + "/portal.name", portal.getName());
        labels.put("training." + operator.getApiGroup() + "/environment.name", environment.getName());

        ObjectMetaBuilder metadata = new ObjectMetaBuilder()
            .withName(session.getName())
            .withLabels(labels);

        // The API server rejects an owner reference without a uid.
        String ownerUid = environment.getResourceUid();
        if (ownerUid != null && !ownerUid.isBlank()) {
            metadata.withOwnerReferences(new OwnerReferenceBuilder()
                .withApiVersion(TrainingPortalResource.API_VERSION)
                .withKind("WorkshopEnvironment")
                .withName(environment.getResourceName())
                .withUid(ownerUid)
                .withController(true)
                .withBlockOwnerDeletion(false)
                .build());
        } else {
            log.warn("Environment {} has no resource uid, session {} will not be garbage collected with it",
                environment.getName(), session.getName());
        }

        WorkshopSessionResource resource = new WorkshopSessionResource();
        resource.setMetadata(metadata.build());

        WorkshopSessionSpec spec = new WorkshopSessionSpec();
        spec.getEnvironment().setName(environment.getName());
        spec.getSession().setId(session.getSessionId());
        spec.getSession().getIngress().setDomain(operator.getIngressDomain());
        spec.getSession().getIngress().setSecret(operator.getIngressSecret());
        spec.getSession().setEnv(sessionEnv(session));

        if (operator.getGoogleTrackingId() != null && !operator.getGoogleTrackingId().isBlank()) {
            TrainingPortalSpec.Analytics analytics = new TrainingPortalSpec.Analytics();
            analytics.getGoogle().setTrackingId(operator.getGoogleTrackingId());
            spec.setAnalytics(analytics);
        }
        resource.setSpec(spec);
        return resource;
    }

    /** The environment's own variables followed by the portal integration settings. */
    List<EnvVar> sessionEnv(WorkshopSession session) {
        WorkshopEnvironment environment = session.getEnvironment();
        TrainingPortal portal = environment.getPortal();
        String portalApiUrl = operator.getIngressProtocol() + "://" + portal.getHostname();

        List<EnvVar> env = new ArrayList<>();
        for (EnvEntry entry : environment.getEnv()) {
            env.add(env(entry.getName(), entry.getValue()));
        }
        env.add(env("PORTAL_CLIENT_ID", session.getName()));
        env.add(env("PORTAL_CLIENT_SECRET", session.getApplication().getClientSecret()));
        env.add(env("PORTAL_API_URL", portalApiUrl));
        env.add(env("SESSION_NAME", session.getName()));
        env.add(env("TRAINING_PORTAL", portal.getName()));
        env.add(env("FRAME_ANCESTORS", portal.getFrameAncestors()));

        if (environment.getDuration() > 0) {
            env.add(env("ENABLE_COUNTDOWN", "true"));
        }

        String restartUrl = environment.hasTimeLimit()
            ? portalApiUrl + "/workshops/session/" + session.getName() + "/delete/"
            : portalApiUrl + "/workshops/catalog/";
        env.add(env("RESTART_URL", restartUrl));
        return env;
    }

    private EnvVar env(String name, String value) {
        return new EnvVarBuilder().withName(name).withValue(value != null ? value : "").build();
    }
}
