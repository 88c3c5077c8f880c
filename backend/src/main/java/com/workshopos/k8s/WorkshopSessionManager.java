package com.workshopos.k8s;

import com.workshopos.k8s.crd.WorkshopSessionResource;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.HttpURLConnection;

/** Creates WorkshopSession resources on the cluster. */
@Singleton
public class WorkshopSessionManager {

    private static final Logger log = LoggerFactory.getLogger(WorkshopSessionManager.class);

    private final KubernetesClient k8s;

    public WorkshopSessionManager(KubernetesClient k8s) {
        this.k8s = k8s;
    }

    /**
     * Creates the resource. A resource of the same name that already exists is
     * taken to be from an earlier run of the same deployment task.
     *
     * @return true if created now, false if it already existed
     */
    public boolean create(WorkshopSessionResource session) {
        String name = session.getMetadata().getName();
        try {
            k8s.resources(WorkshopSessionResource.class).resource(session).create();
            log.info("Created WorkshopSession {}", name);
            return true;
        } catch (KubernetesClientException e) {
            if (e.getCode() == HttpURLConnection.HTTP_CONFLICT) {
                log.info("WorkshopSession {} already exists", name);
                return false;
            }
            throw e;
        }
    }
}
