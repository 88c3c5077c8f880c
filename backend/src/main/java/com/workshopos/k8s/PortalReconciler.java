package com.workshopos.k8s;

import com.workshopos.config.OperatorSettings;
import com.workshopos.domain.PortalPhase;
import com.workshopos.k8s.crd.TrainingPortalResource;
import com.workshopos.k8s.crd.TrainingPortalStatus;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.LimitRange;
import io.fabric8.kubernetes.api.model.Namespace;
import io.fabric8.kubernetes.api.model.ResourceQuota;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.HttpURLConnection;
import java.time.Duration;

/**
 * Provisions the namespace and web interface objects for a TrainingPortal.
 *
 * A single call is one attempt. Failures come back as {@link ReconcileResult}
 * values carrying the phase to record. Scheduling the next attempt is up to
 * {@link PortalReconcileDriver}.
 *
 * A namespace that already exists is never adopted. If it belongs to someone
 * else the portal waits in {@code Pending}. If it belongs to this portal and a
 * previous attempt flagged {@code Retrying}, it is deleted so the next attempt
 * starts clean.
 */
@Singleton
public class PortalReconciler {

    private static final Logger log = LoggerFactory.getLogger(PortalReconciler.class);

    private final KubernetesClient k8s;
    private final OperatorSettings operator;
    private final PortalResourceFactory resources;

    public PortalReconciler(KubernetesClient k8s, OperatorSettings operator, PortalResourceFactory resources) {
        this.k8s = k8s;
        this.operator = operator;
        this.resources = resources;
    }

    public ReconcileResult reconcile(TrainingPortalResource portal) {
        String name = portal.getMetadata().getName();
        String currentPhase = portal.getStatus() != null ? portal.getStatus().getPhase() : null;

        if (PortalPhase.RUNNING.value().equals(currentPhase)) {
            log.debug("Training portal {} already running, nothing to do", name);
            return ReconcileResult.success(null, "Training portal " + name + " already running.");
        }

        PortalSettings settings;
        try {
            settings = PortalSettings.resolve(portal, operator);
        } catch (IllegalArgumentException e) {
            log.error("Training portal {} has an invalid spec: {}", name, e.getMessage());
            return ReconcileResult.terminal(PortalPhase.ERROR, e.getMessage());
        }

        String namespace = settings.namespace();
        Duration delay = operator.getRetryDelay();

        // Existing namespace: decide who owns it.
        Namespace existing;
        try {
            existing = k8s.namespaces().withName(namespace).get();
        } catch (KubernetesClientException e) {
            if (e.getCode() != HttpURLConnection.HTTP_NOT_FOUND) {
                log.error("Unexpected error querying namespace {}: {}", namespace, e.getMessage(), e);
                return ReconcileResult.retry(delay, PortalPhase.ERROR,
                    "Unexpected error querying namespace " + namespace + ".");
            }
            existing = null;
        }

        if (existing != null) {
            if (!ownedBy(existing, settings.portalUid())) {
                log.warn("Namespace {} already exists and is not owned by portal {}", namespace, name);
                return ReconcileResult.retry(delay, PortalPhase.PENDING,
                    "Namespace " + namespace + " already exists.");
            }
            if (PortalPhase.RETRYING.value().equals(currentPhase)) {
                log.info("Deleting namespace {} left by a failed attempt on portal {}", namespace, name);
                try {
                    deleteIgnoringNotFound("Namespace", namespace,
                        () -> k8s.namespaces().withName(namespace).delete());
                } catch (KubernetesClientException e) {
                    log.error("Unexpected error deleting namespace {}: {}", namespace, e.getMessage(), e);
                    return ReconcileResult.retry(delay, null, "Failed to delete namespace " + namespace + ".");
                }
                return ReconcileResult.retry(delay, null, "Deleting " + namespace + " and retrying.");
            }
            log.warn("Training portal {} in unexpected state {} with namespace {} present",
                name, currentPhase, namespace);
            return ReconcileResult.retry(delay, PortalPhase.ERROR,
                "Training portal " + name + " in unexpected state " + currentPhase + ".");
        }

        // Namespace, re-read for the uid its dependents are owned by.
        Namespace created;
        try {
            k8s.namespaces().resource(resources.namespace(settings)).create();
            created = k8s.namespaces().withName(namespace).get();
        } catch (KubernetesClientException e) {
            log.error("Unexpected error creating namespace {}: {}", namespace, e.getMessage(), e);
            return ReconcileResult.retry(delay, PortalPhase.RETRYING,
                "Failed to create namespace " + namespace + ".");
        }
        if (created == null) {
            log.warn("Namespace {} not visible after creation", namespace);
            return ReconcileResult.retry(delay, PortalPhase.RETRYING,
                "Failed to create namespace " + namespace + ".");
        }

        try {
            removeQuotas(namespace);
        } catch (KubernetesClientException e) {
            log.error("Unexpected error clearing quotas in {}: {}", namespace, e.getMessage(), e);
            return ReconcileResult.retry(delay, PortalPhase.RETRYING,
                "Failed to clear resource limits in " + namespace + ".");
        }

        // Deployment goes last so no workload starts unless everything else exists.
        try {
            k8s.serviceAccounts().inNamespace(namespace).resource(resources.serviceAccount(settings)).create();
            k8s.rbac().clusterRoleBindings().resource(resources.clusterRoleBinding(settings, created)).create();
            k8s.persistentVolumeClaims().inNamespace(namespace).resource(resources.persistentVolumeClaim(settings)).create();
            k8s.configMaps().inNamespace(namespace).resource(resources.configMap(settings)).create();
            k8s.services().inNamespace(namespace).resource(resources.service(settings)).create();
            k8s.network().v1().ingresses().inNamespace(namespace).resource(resources.ingress(settings)).create();
            if (resources.usesPodSecurityPolicies()) {
                k8s.rbac().roleBindings().inNamespace(namespace).resource(resources.podSecurityPolicyRoleBinding(settings)).create();
            }
            k8s.apps().deployments().inNamespace(namespace).resource(resources.deployment(settings)).create();
        } catch (KubernetesClientException e) {
            log.error("Unexpected error creating training portal {}: {}", name, e.getMessage(), e);
            return ReconcileResult.retry(delay, PortalPhase.RETRYING,
                "Unexpected error creating training portal " + name + ".");
        }

        TrainingPortalStatus status = new TrainingPortalStatus(PortalPhase.RUNNING.value(),
            "Training portal " + name + " created.");
        status.setNamespace(namespace);
        status.setUrl(settings.url());
        status.setCredentials(settings.credentials());
        status.setClients(settings.clients());

        log.info("Training portal {} running at {}", name, settings.url());
        return ReconcileResult.success(status, status.getMessage());
    }

    /**
     * Limit ranges and quotas stamped onto new namespaces by cluster templates
     * can block the portal pod. They may not exist yet when this runs.
     */
    private void removeQuotas(String namespace) {
        for (LimitRange limitRange : k8s.limitRanges().inNamespace(namespace).list().getItems()) {
            String rangeName = limitRange.getMetadata().getName();
            deleteIgnoringNotFound("LimitRange", rangeName,
                () -> k8s.limitRanges().inNamespace(namespace).withName(rangeName).delete());
        }
        for (ResourceQuota quota : k8s.resourceQuotas().inNamespace(namespace).list().getItems()) {
            String quotaName = quota.getMetadata().getName();
            deleteIgnoringNotFound("ResourceQuota", quotaName,
                () -> k8s.resourceQuotas().inNamespace(namespace).withName(quotaName).delete());
        }
    }

    private void deleteIgnoringNotFound(String kind, String name, Runnable delete) {
        try {
            delete.run();
            log.debug("Deleted {} {}", kind, name);
        } catch (KubernetesClientException e) {
            if (e.getCode() != HttpURLConnection.HTTP_NOT_FOUND) {
                throw e;
            }
            log.debug("{} {} already gone", kind, name);
        }
    }

    static boolean ownedBy(HasMetadata resource, String ownerUid) {
        if (ownerUid == null || resource.getMetadata().getOwnerReferences() == null) {
            return false;
        }
        return resource.getMetadata().getOwnerReferences().stream()
            .anyMatch(ref -> ownerUid.equals(ref.getUid()));
    }
}
