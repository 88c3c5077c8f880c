package com.workshopos.infra;

import io.fabric8.kubernetes.client.ConfigBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import io.micronaut.context.annotation.Bean;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Provides the fabric8 KubernetesClient used by the reconciler and the
 * session deployer. Configuration comes from kubeconfig or the in-cluster
 * service account, whichever fabric8 detects.
 *
 * Tests replace this bean with {@code @MockBean(KubernetesClient.class)} or
 * construct components directly against the fabric8 mock server.
 */
@Factory
public class KubernetesClientFactory {

    private static final Logger log = LoggerFactory.getLogger(KubernetesClientFactory.class);

    @Singleton
    @Bean(preDestroy = "close")
    @Requires(missingBeans = KubernetesClient.class)
    public KubernetesClient kubernetesClient() {
        try {
            KubernetesClient client = new KubernetesClientBuilder().build();
            log.info("KubernetesClient initialized: {}", client.getMasterUrl());
            return client;
        } catch (Exception e) {
            log.warn("Failed to load cluster configuration, falling back to localhost: {}", e.getMessage());
            return new KubernetesClientBuilder()
                .withConfig(new ConfigBuilder()
                    .withMasterUrl("https://localhost:6443")
                    .withTrustCerts(true)
                    .build())
                .build();
        }
    }
}
