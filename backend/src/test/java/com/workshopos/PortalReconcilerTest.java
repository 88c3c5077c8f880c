package com.workshopos;

import com.workshopos.config.OperatorSettings;
import com.workshopos.domain.PortalPhase;
import com.workshopos.k8s.PortalReconciler;
import com.workshopos.k8s.PortalResourceFactory;
import com.workshopos.k8s.ReconcileResult;
import com.workshopos.k8s.crd.TrainingPortalResource;
import com.workshopos.k8s.crd.TrainingPortalSpec;
import com.workshopos.k8s.crd.TrainingPortalStatus;
import io.fabric8.kubernetes.api.model.Namespace;
import io.fabric8.kubernetes.api.model.NamespaceBuilder;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.fabric8.kubernetes.api.model.ServiceAccountBuilder;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.api.model.networking.v1.Ingress;
import io.fabric8.kubernetes.api.model.rbac.ClusterRoleBinding;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Answers.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@EnableKubernetesMockClient(crud = true)
class PortalReconcilerTest {

    static KubernetesClient client;

    private OperatorSettings operator;
    private PortalReconciler reconciler;

    @BeforeEach
    void setup() {
        operator = new OperatorSettings();
        operator.setIngressDomain("test.example.com");
        operator.setAdminPassword("admin-secret");
        reconciler = new PortalReconciler(client, operator, new PortalResourceFactory(operator));
    }

    @Test
    void freshPortal_createsEverythingAndReportsRunning() {
        TrainingPortalResource portal = portal("fresh", null);

        ReconcileResult result = reconciler.reconcile(portal);

        assertThat(result.outcome()).isEqualTo(ReconcileResult.Outcome.SUCCESS);
        TrainingPortalStatus status = result.status();
        assertThat(status).isNotNull();
        assertThat(status.getPhase()).isEqualTo("Running");
        assertThat(status.getNamespace()).isEqualTo("fresh-ui");
        assertThat(status.getUrl()).isEqualTo("http://fresh-ui.test.example.com");
        assertThat(status.getCredentials().getAdmin().getPassword()).isEqualTo("admin-secret");

        Namespace ns = client.namespaces().withName("fresh-ui").get();
        assertThat(ns).isNotNull();
        assertThat(ns.getMetadata().getOwnerReferences())
            .anySatisfy(ref -> assertThat(ref.getUid()).isEqualTo(portal.getMetadata().getUid()));
        assertThat(ns.getMetadata().getLabels())
            .containsEntry("training.educates.dev/portal.name", "fresh");

        assertThat(client.serviceAccounts().inNamespace("fresh-ui").withName("training-portal").get()).isNotNull();
        assertThat(client.persistentVolumeClaims().inNamespace("fresh-ui").withName("training-portal").get()).isNotNull();
        assertThat(client.configMaps().inNamespace("fresh-ui").withName("training-portal").get()).isNotNull();
        assertThat(client.services().inNamespace("fresh-ui").withName("training-portal").get()).isNotNull();

        ClusterRoleBinding binding = client.rbac().clusterRoleBindings()
            .withName("educates-training-portal-fresh-ui").get();
        assertThat(binding).isNotNull();
        assertThat(binding.getMetadata().getOwnerReferences())
            .anySatisfy(ref -> assertThat(ref.getKind()).isEqualTo("Namespace"));

        Ingress ingress = client.network().v1().ingresses().inNamespace("fresh-ui").withName("training-portal").get();
        assertThat(ingress.getSpec().getRules().get(0).getHost()).isEqualTo("fresh-ui.test.example.com");

        Deployment deployment = client.apps().deployments().inNamespace("fresh-ui").withName("training-portal").get();
        assertThat(deployment.getSpec().getTemplate().getSpec().getContainers().get(0).getEnv())
            .anySatisfy(env -> {
                assertThat(env.getName()).isEqualTo("PORTAL_UID");
                assertThat(env.getValue()).isEqualTo(portal.getMetadata().getUid());
            });

        // only created for the psp policy engine
        assertThat(client.rbac().roleBindings().inNamespace("fresh-ui").withName("training-portal-psp").get()).isNull();
    }

    @Test
    void alreadyRunning_isNoOp() {
        ReconcileResult result = reconciler.reconcile(portal("steady", "Running"));

        assertThat(result.outcome()).isEqualTo(ReconcileResult.Outcome.SUCCESS);
        assertThat(result.status()).isNull();
        assertThat(client.namespaces().withName("steady-ui").get()).isNull();
    }

    @Test
    void foreignNamespace_waitsInPendingWithoutDeleting() {
        client.namespaces().resource(new NamespaceBuilder()
            .withNewMetadata().withName("taken-ui").endMetadata()
            .build()).create();

        ReconcileResult result = reconciler.reconcile(portal("taken", null));

        assertThat(result.outcome()).isEqualTo(ReconcileResult.Outcome.RETRY);
        assertThat(result.delay()).isEqualTo(operator.getRetryDelay());
        assertThat(result.status().getPhase()).isEqualTo("Pending");
        assertThat(client.namespaces().withName("taken-ui").get()).isNotNull();
    }

    @Test
    void ownedNamespaceInUnexpectedPhase_reportsError() {
        TrainingPortalResource portal = portal("stale", null);
        client.namespaces().resource(new NamespaceBuilder()
            .withNewMetadata()
                .withName("stale-ui")
                .addNewOwnerReference()
                    .withApiVersion(TrainingPortalResource.API_VERSION)
                    .withKind(TrainingPortalResource.KIND)
                    .withName("stale")
                    .withUid(portal.getMetadata().getUid())
                .endOwnerReference()
            .endMetadata()
            .build()).create();

        ReconcileResult result = reconciler.reconcile(portal);

        assertThat(result.outcome()).isEqualTo(ReconcileResult.Outcome.RETRY);
        assertThat(result.status().getPhase()).isEqualTo("Error");
        assertThat(client.namespaces().withName("stale-ui").get()).isNotNull();
    }

    @Test
    void failedCreation_isRetriedAfterCleanupAndHeals() {
        // A leftover service account makes the first attempt fail part way.
        client.serviceAccounts().inNamespace("heal-ui").resource(new ServiceAccountBuilder()
            .withNewMetadata().withName("training-portal").withNamespace("heal-ui").endMetadata()
            .build()).create();
        TrainingPortalResource portal = portal("heal", null);

        ReconcileResult first = reconciler.reconcile(portal);
        assertThat(first.outcome()).isEqualTo(ReconcileResult.Outcome.RETRY);
        assertThat(first.status().getPhase()).isEqualTo("Retrying");
        assertThat(client.namespaces().withName("heal-ui").get()).isNotNull();

        client.serviceAccounts().inNamespace("heal-ui").withName("training-portal").delete();
        portal.setStatus(first.status());

        ReconcileResult second = reconciler.reconcile(portal);
        assertThat(second.outcome()).isEqualTo(ReconcileResult.Outcome.RETRY);
        assertThat(second.status()).isNull();
        assertThat(client.namespaces().withName("heal-ui").get()).isNull();

        ReconcileResult third = reconciler.reconcile(portal);
        assertThat(third.outcome()).isEqualTo(ReconcileResult.Outcome.SUCCESS);
        assertThat(third.status().getPhase()).isEqualTo("Running");
        assertThat(client.apps().deployments().inNamespace("heal-ui").withName("training-portal").get()).isNotNull();
    }

    @Test
    void cleanupFailure_keepsRetryingStatusAndReportsError() {
        KubernetesClient k8s = mock(KubernetesClient.class, RETURNS_DEEP_STUBS);
        TrainingPortalResource portal = portal("wedged", "Retrying");
        when(k8s.namespaces().withName("wedged-ui").get()).thenReturn(ownedNamespace("wedged-ui", portal));
        when(k8s.namespaces().withName("wedged-ui").delete())
            .thenThrow(new KubernetesClientException("forbidden", 403, null));

        ReconcileResult result = new PortalReconciler(k8s, operator, new PortalResourceFactory(operator))
            .reconcile(portal);

        assertThat(result.outcome()).isEqualTo(ReconcileResult.Outcome.RETRY);
        assertThat(result.status()).isNull();
        assertThat(result.message()).isEqualTo("Failed to delete namespace wedged-ui.");
    }

    @Test
    void cleanupOfVanishedNamespace_isRetriedNormally() {
        KubernetesClient k8s = mock(KubernetesClient.class, RETURNS_DEEP_STUBS);
        TrainingPortalResource portal = portal("vanished", "Retrying");
        when(k8s.namespaces().withName("vanished-ui").get()).thenReturn(ownedNamespace("vanished-ui", portal));
        when(k8s.namespaces().withName("vanished-ui").delete())
            .thenThrow(new KubernetesClientException("not found", 404, null));

        ReconcileResult result = new PortalReconciler(k8s, operator, new PortalResourceFactory(operator))
            .reconcile(portal);

        assertThat(result.outcome()).isEqualTo(ReconcileResult.Outcome.RETRY);
        assertThat(result.message()).isEqualTo("Deleting vanished-ui and retrying.");
    }

    @Test
    void invalidSpec_isTerminal() {
        TrainingPortalResource portal = portal("broken", null);
        portal.getSpec().getPortal().getCatalog().setVisibility("secret");

        ReconcileResult result = reconciler.reconcile(portal);

        assertThat(result.outcome()).isEqualTo(ReconcileResult.Outcome.TERMINAL);
        assertThat(result.status().getPhase()).isEqualTo(PortalPhase.ERROR.value());
        assertThat(client.namespaces().withName("broken-ui").get()).isNull();
    }

    @Test
    void podSecurityPolicyEngine_addsRoleBinding() {
        operator.setSecurityPolicyEngine("psp");

        ReconcileResult result = reconciler.reconcile(portal("guarded", null));

        assertThat(result.outcome()).isEqualTo(ReconcileResult.Outcome.SUCCESS);
        assertThat(client.rbac().roleBindings().inNamespace("guarded-ui").withName("training-portal-psp").get())
            .isNotNull();
    }

    @Test
    void httpsWithSecret_configuresIngressTls() {
        operator.setIngressProtocol("https");
        operator.setIngressSecret("wildcard-tls");

        ReconcileResult result = reconciler.reconcile(portal("secure", null));

        assertThat(result.status().getUrl()).isEqualTo("https://secure-ui.test.example.com");
        Ingress ingress = client.network().v1().ingresses().inNamespace("secure-ui").withName("training-portal").get();
        assertThat(ingress.getSpec().getTls()).hasSize(1);
        assertThat(ingress.getSpec().getTls().get(0).getSecretName()).isEqualTo("wildcard-tls");
        assertThat(ingress.getMetadata().getAnnotations())
            .containsEntry("nginx.ingress.kubernetes.io/force-ssl-redirect", "true");
    }

    private static Namespace ownedNamespace(String name, TrainingPortalResource portal) {
        return new NamespaceBuilder()
            .withNewMetadata()
                .withName(name)
                .addNewOwnerReference()
                    .withApiVersion(TrainingPortalResource.API_VERSION)
                    .withKind(TrainingPortalResource.KIND)
                    .withName(portal.getMetadata().getName())
                    .withUid(portal.getMetadata().getUid())
                .endOwnerReference()
            .endMetadata()
            .build();
    }

    private TrainingPortalResource portal(String name, String phase) {
        TrainingPortalResource portal = new TrainingPortalResource();
        portal.setMetadata(new ObjectMetaBuilder()
            .withName(name)
            .withUid(UUID.randomUUID().toString())
            .build());
        portal.setSpec(new TrainingPortalSpec());
        if (phase != null) {
            portal.setStatus(new TrainingPortalStatus(phase, null));
        }
        return portal;
    }
}
