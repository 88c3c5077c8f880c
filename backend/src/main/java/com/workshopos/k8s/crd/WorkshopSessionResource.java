package com.workshopos.k8s.crd;

import io.fabric8.kubernetes.api.model.KubernetesResource;
import io.fabric8.kubernetes.client.CustomResource;
import io.fabric8.kubernetes.model.annotation.Group;
import io.fabric8.kubernetes.model.annotation.Kind;
import io.fabric8.kubernetes.model.annotation.Plural;
import io.fabric8.kubernetes.model.annotation.Version;

/**
 * Cluster-scoped {@code WorkshopSession} custom resource. The operator only
 * creates these; a separate controller brings the session workload up.
 */
@Group(TrainingPortalResource.GROUP)
@Version(TrainingPortalResource.VERSION)
@Kind("WorkshopSession")
@Plural("workshopsessions")
public class WorkshopSessionResource extends CustomResource<WorkshopSessionSpec, WorkshopSessionResource.NoStatus> {

    /** Marker: the session controller owns the status, this service never reads it. */
    public static class NoStatus implements KubernetesResource {}
}
