package com.workshopos.k8s;

import com.workshopos.k8s.crd.TrainingPortalResource;
import com.workshopos.k8s.crd.TrainingPortalStatus;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.informers.ResourceEventHandler;
import io.fabric8.kubernetes.client.informers.SharedIndexInformer;
import jakarta.inject.Singleton;

import java.util.Optional;

/** Typed access to TrainingPortal custom resources. */
@Singleton
public class TrainingPortalResources {

    private final KubernetesClient k8s;

    public TrainingPortalResources(KubernetesClient k8s) {
        this.k8s = k8s;
    }

    public Optional<TrainingPortalResource> get(String name) {
        return Optional.ofNullable(k8s.resources(TrainingPortalResource.class).withName(name).get());
    }

    /** Replaces the status subresource, leaving the spec untouched. */
    public void updateStatus(String name, TrainingPortalStatus status) {
        k8s.resources(TrainingPortalResource.class).withName(name).editStatus(portal -> {
            portal.setStatus(status);
            return portal;
        });
    }

    public SharedIndexInformer<TrainingPortalResource> inform(ResourceEventHandler<TrainingPortalResource> handler) {
        return k8s.resources(TrainingPortalResource.class).inform(handler);
    }
}
