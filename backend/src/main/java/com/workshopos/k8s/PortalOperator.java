package com.workshopos.k8s;

import com.workshopos.k8s.crd.TrainingPortalResource;
import io.fabric8.kubernetes.client.informers.ResourceEventHandler;
import io.fabric8.kubernetes.client.informers.SharedIndexInformer;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.runtime.server.event.ServerStartupEvent;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Watches TrainingPortal resources and hands new ones to the reconcile driver.
 *
 * Deletion needs no action: owner references let the cluster garbage collect
 * the portal namespace and everything in it.
 */
@Singleton
@Requires(property = "operator.watch.enabled", notEquals = "false")
public class PortalOperator
    implements ApplicationEventListener<ServerStartupEvent>, ResourceEventHandler<TrainingPortalResource> {

    private static final Logger log = LoggerFactory.getLogger(PortalOperator.class);

    private final TrainingPortalResources portals;
    private final PortalReconcileDriver driver;

    private SharedIndexInformer<TrainingPortalResource> informer;

    public PortalOperator(TrainingPortalResources portals, PortalReconcileDriver driver) {
        this.portals = portals;
        this.driver = driver;
    }

    @Override
    public void onApplicationEvent(ServerStartupEvent event) {
        informer = portals.inform(this);
        log.info("Watching TrainingPortal resources");
    }

    @PreDestroy
    void stop() {
        if (informer != null) {
            informer.stop();
        }
    }

    @Override
    public void onAdd(TrainingPortalResource portal) {
        driver.submit(portal.getMetadata().getName());
    }

    @Override
    public void onUpdate(TrainingPortalResource oldPortal, TrainingPortalResource newPortal) {
        // status writes land here too
    }

    @Override
    public void onDelete(TrainingPortalResource portal, boolean deletedFinalStateUnknown) {
        log.info("Training portal {} deleted", portal.getMetadata().getName());
    }
}
