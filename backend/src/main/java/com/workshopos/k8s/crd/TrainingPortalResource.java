package com.workshopos.k8s.crd;

import io.fabric8.kubernetes.client.CustomResource;
import io.fabric8.kubernetes.model.annotation.Group;
import io.fabric8.kubernetes.model.annotation.Kind;
import io.fabric8.kubernetes.model.annotation.Plural;
import io.fabric8.kubernetes.model.annotation.Version;

/** Cluster-scoped {@code TrainingPortal} custom resource. */
@Group(TrainingPortalResource.GROUP)
@Version(TrainingPortalResource.VERSION)
@Kind("TrainingPortal")
@Plural("trainingportals")
public class TrainingPortalResource extends CustomResource<TrainingPortalSpec, TrainingPortalStatus> {

    public static final String GROUP = "training.educates.dev";
    public static final String VERSION = "v1alpha1";
    public static final String API_VERSION = GROUP + "/" + VERSION;
    public static final String KIND = "TrainingPortal";

    @Override
    protected TrainingPortalSpec initSpec() {
        return new TrainingPortalSpec();
    }
}
