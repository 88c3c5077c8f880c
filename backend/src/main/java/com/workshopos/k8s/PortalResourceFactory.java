package com.workshopos.k8s;

import com.workshopos.config.OperatorSettings;
import com.workshopos.k8s.crd.TrainingPortalResource;
import io.fabric8.kubernetes.api.model.*;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.api.model.apps.DeploymentBuilder;
import io.fabric8.kubernetes.api.model.networking.v1.Ingress;
import io.fabric8.kubernetes.api.model.networking.v1.IngressBuilder;
import io.fabric8.kubernetes.api.model.networking.v1.IngressTLSBuilder;
import io.fabric8.kubernetes.api.model.rbac.ClusterRoleBinding;
import io.fabric8.kubernetes.api.model.rbac.ClusterRoleBindingBuilder;
import io.fabric8.kubernetes.api.model.rbac.RoleBinding;
import io.fabric8.kubernetes.api.model.rbac.RoleBindingBuilder;
import io.fabric8.kubernetes.api.model.rbac.Subject;
import io.fabric8.kubernetes.api.model.rbac.SubjectBuilder;
import jakarta.inject.Singleton;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the cluster objects that make up a training portal's web interface.
 *
 * Everything lives in the portal namespace {@code <portal>-ui} except the
 * cluster role binding, which is owned by that namespace so deleting the
 * namespace removes it too.
 */
@Singleton
public class PortalResourceFactory {

    static final String PORTAL_OBJECT_NAME = "training-portal";
    static final int PORTAL_PORT = 8080;
    static final String LOGIN_PATH = "/accounts/login/";

    private final OperatorSettings operator;

    public PortalResourceFactory(OperatorSettings operator) {
        this.operator = operator;
    }

    // ── Labels ─────────────────────────────────────────────────────────────

    String componentLabel() {
        return "training." + operator.getApiGroup() + "/component";
    }

    String portalNameLabel() {
        return "training." + operator.getApiGroup() + "/portal.name";
    }

    Map<String, String> portalLabels(String portalName) {
        Map<String, String> labels = new LinkedHashMap<>();
        labels.put(componentLabel(), "portal");
        labels.put(portalNameLabel(), portalName);
        return labels;
    }

    // ── Namespace ──────────────────────────────────────────────────────────

    public Namespace namespace(PortalSettings portal) {
        return new NamespaceBuilder()
            .withNewMetadata()
                .withName(portal.namespace())
                .withLabels(portalLabels(portal.portalName()))
                .withAnnotations(Map.of("secretgen.carvel.dev/excluded-from-wildcard-matching", ""))
                .withOwnerReferences(new OwnerReferenceBuilder()
                    .withApiVersion(TrainingPortalResource.API_VERSION)
                    .withKind(TrainingPortalResource.KIND)
                    .withName(portal.portalName())
                    .withUid(portal.portalUid())
                    .withController(true)
                    .withBlockOwnerDeletion(true)
                    .build())
            .endMetadata()
            .build();
    }

    // ── Access control ─────────────────────────────────────────────────────

    public ServiceAccount serviceAccount(PortalSettings portal) {
        return new ServiceAccountBuilder()
            .withNewMetadata()
                .withName(PORTAL_OBJECT_NAME)
                .withNamespace(portal.namespace())
                .withLabels(portalLabels(portal.portalName()))
            .endMetadata()
            .build();
    }

    public ClusterRoleBinding clusterRoleBinding(PortalSettings portal, Namespace owner) {
        return new ClusterRoleBindingBuilder()
            .withNewMetadata()
                .withName(operator.getNamePrefix() + "-training-portal-" + portal.namespace())
                .withLabels(portalLabels(portal.portalName()))
                .withOwnerReferences(new OwnerReferenceBuilder()
                    .withApiVersion("v1")
                    .withKind("Namespace")
                    .withName(owner.getMetadata().getName())
                    .withUid(owner.getMetadata().getUid())
                    .withController(true)
                    .withBlockOwnerDeletion(true)
                    .build())
            .endMetadata()
            .withNewRoleRef()
                .withApiGroup("rbac.authorization.k8s.io")
                .withKind("ClusterRole")
                .withName(operator.getNamePrefix() + "-training-portal")
            .endRoleRef()
            .withSubjects(portalSubject(portal))
            .build();
    }

    public RoleBinding podSecurityPolicyRoleBinding(PortalSettings portal) {
        return new RoleBindingBuilder()
            .withNewMetadata()
                .withName("training-portal-psp")
                .withNamespace(portal.namespace())
                .withLabels(portalLabels(portal.portalName()))
            .endMetadata()
            .withNewRoleRef()
                .withApiGroup("rbac.authorization.k8s.io")
                .withKind("ClusterRole")
                .withName(operator.getNamePrefix() + "-training-portal-psp")
            .endRoleRef()
            .withSubjects(portalSubject(portal))
            .build();
    }

    public boolean usesPodSecurityPolicies() {
        return "psp".equals(operator.getSecurityPolicyEngine());
    }

    private Subject portalSubject(PortalSettings portal) {
        return new SubjectBuilder()
            .withKind("ServiceAccount")
            .withName(PORTAL_OBJECT_NAME)
            .withNamespace(portal.namespace())
            .build();
    }

    // ── Storage and configuration ──────────────────────────────────────────

    public PersistentVolumeClaim persistentVolumeClaim(PortalSettings portal) {
        PersistentVolumeClaimBuilder builder = new PersistentVolumeClaimBuilder()
            .withNewMetadata()
                .withName(PORTAL_OBJECT_NAME)
                .withNamespace(portal.namespace())
                .withLabels(portalLabels(portal.portalName()))
            .endMetadata()
            .withNewSpec()
                .withAccessModes("ReadWriteOnce")
                .withNewResources()
                    .withRequests(Map.of("storage", new Quantity("1Gi")))
                .endResources()
            .endSpec();

        if (!isBlank(operator.getStorageClass())) {
            builder.editSpec().withStorageClassName(operator.getStorageClass()).endSpec();
        }
        return builder.build();
    }

    public ConfigMap configMap(PortalSettings portal) {
        Map<String, String> data = new LinkedHashMap<>();
        data.put("logo", portal.logo());
        data.put("theme.js", operator.getPortalScript());
        data.put("theme.css", operator.getPortalStyle());

        return new ConfigMapBuilder()
            .withNewMetadata()
                .withName(PORTAL_OBJECT_NAME)
                .withNamespace(portal.namespace())
                .withLabels(portalLabels(portal.portalName()))
            .endMetadata()
            .withData(data)
            .build();
    }

    // ── Networking ─────────────────────────────────────────────────────────

    public Service service(PortalSettings portal) {
        return new ServiceBuilder()
            .withNewMetadata()
                .withName(PORTAL_OBJECT_NAME)
                .withNamespace(portal.namespace())
                .withLabels(portalLabels(portal.portalName()))
            .endMetadata()
            .withNewSpec()
                .withType("ClusterIP")
                .withPorts(new ServicePortBuilder()
                    .withPort(PORTAL_PORT)
                    .withProtocol("TCP")
                    .withTargetPort(new IntOrString(PORTAL_PORT))
                    .build())
                .withSelector(Map.of("deployment", PORTAL_OBJECT_NAME))
            .endSpec()
            .build();
    }

    public Ingress ingress(PortalSettings portal) {
        Map<String, String> annotations = new LinkedHashMap<>();
        if (!isBlank(operator.getIngressClass())) {
            annotations.put("kubernetes.io/ingress.class", operator.getIngressClass());
        }
        if ("https".equals(operator.getIngressProtocol())) {
            annotations.put("ingress.kubernetes.io/force-ssl-redirect", "true");
            annotations.put("nginx.ingress.kubernetes.io/ssl-redirect", "true");
            annotations.put("nginx.ingress.kubernetes.io/force-ssl-redirect", "true");
        }

        IngressBuilder builder = new IngressBuilder()
            .withNewMetadata()
                .withName(PORTAL_OBJECT_NAME)
                .withNamespace(portal.namespace())
                .withLabels(portalLabels(portal.portalName()))
                .withAnnotations(annotations)
            .endMetadata()
            .withNewSpec()
                .addNewRule()
                    .withHost(portal.hostname())
                    .withNewHttp()
                        .addNewPath()
                            .withPath("/")
                            .withPathType("Prefix")
                            .withNewBackend()
                                .withNewService()
                                    .withName(PORTAL_OBJECT_NAME)
                                    .withNewPort()
                                        .withNumber(PORTAL_PORT)
                                    .endPort()
                                .endService()
                            .endBackend()
                        .endPath()
                    .endHttp()
                .endRule()
            .endSpec();

        if (!isBlank(operator.getIngressSecret())) {
            builder.editSpec()
                .withTls(new IngressTLSBuilder()
                    .withHosts(portal.hostname())
                    .withSecretName(operator.getIngressSecret())
                    .build())
                .endSpec();
        }
        return builder.build();
    }

    // ── Workload ───────────────────────────────────────────────────────────

    public Deployment deployment(PortalSettings portal) {
        String image = operator.getPortalImage();
        long storageGroup = parseId(operator.getStorageGroup());

        Map<String, String> labels = portalLabels(portal.portalName());
        labels.put("training." + operator.getApiGroup() + "/portal.services.dashboard", "true");

        Map<String, String> podLabels = new LinkedHashMap<>();
        podLabels.put("deployment", PORTAL_OBJECT_NAME);
        podLabels.putAll(labels);

        Container portalContainer = new ContainerBuilder()
            .withName("portal")
            .withImage(image)
            .withImagePullPolicy(imagePullPolicy(image))
            .withResources(memory("256Mi"))
            .withPorts(new ContainerPortBuilder().withContainerPort(PORTAL_PORT).withProtocol("TCP").build())
            .withReadinessProbe(loginProbe(10))
            .withLivenessProbe(loginProbe(15))
            .withEnv(portalEnv(portal))
            .withVolumeMounts(
                new VolumeMountBuilder().withName("data").withMountPath("/opt/app-root/data").build(),
                new VolumeMountBuilder().withName("config").withMountPath("/opt/app-root/config").build())
            .build();

        DeploymentBuilder builder = new DeploymentBuilder()
            .withNewMetadata()
                .withName(PORTAL_OBJECT_NAME)
                .withNamespace(portal.namespace())
                .withLabels(labels)
            .endMetadata()
            .withNewSpec()
                .withReplicas(1)
                .withNewSelector()
                    .withMatchLabels(Map.of("deployment", PORTAL_OBJECT_NAME))
                .endSelector()
                .withNewStrategy()
                    .withType("Recreate")
                .endStrategy()
                .withNewTemplate()
                    .withNewMetadata()
                        .withLabels(podLabels)
                    .endMetadata()
                    .withNewSpec()
                        .withServiceAccountName(PORTAL_OBJECT_NAME)
                        .withNewSecurityContext()
                            .withRunAsUser(1001L)
                            .withFsGroup(storageGroup)
                            .withSupplementalGroups(storageGroup)
                        .endSecurityContext()
                        .withContainers(portalContainer)
                        .withVolumes(
                            new VolumeBuilder()
                                .withName("data")
                                .withNewPersistentVolumeClaim()
                                    .withClaimName(PORTAL_OBJECT_NAME)
                                .endPersistentVolumeClaim()
                                .build(),
                            new VolumeBuilder()
                                .withName("config")
                                .withNewConfigMap()
                                    .withName(PORTAL_OBJECT_NAME)
                                .endConfigMap()
                                .build())
                    .endSpec()
                .endTemplate()
            .endSpec();

        // Some clusters leave new volumes owned by root; fix ownership before the portal starts.
        if (!isBlank(operator.getStorageUser())) {
            Container init = new ContainerBuilder()
                .withName("storage-permissions-initialization")
                .withImage(image)
                .withImagePullPolicy(imagePullPolicy(image))
                .withNewSecurityContext()
                    .withRunAsUser(0L)
                .endSecurityContext()
                .withCommand("/bin/sh", "-c")
                .withArgs("chown " + operator.getStorageUser() + ":" + operator.getStorageGroup()
                    + " /mnt && chmod og+rwx /mnt")
                .withResources(memory("256Mi"))
                .withVolumeMounts(new VolumeMountBuilder().withName("data").withMountPath("/mnt").build())
                .build();
            builder.editSpec().editTemplate().editSpec().withInitContainers(init).endSpec().endTemplate().endSpec();
        }
        return builder.build();
    }

    List<EnvVar> portalEnv(PortalSettings portal) {
        return List.of(
            env("OPERATOR_API_GROUP", operator.getApiGroup()),
            env("OPERATOR_STATUS_KEY", operator.getNamePrefix()),
            env("OPERATOR_NAME_PREFIX", operator.getNamePrefix()),
            env("TRAINING_PORTAL", portal.portalName()),
            env("PORTAL_UID", portal.portalUid()),
            env("PORTAL_HOSTNAME", portal.hostname()),
            env("PORTAL_TITLE", portal.title()),
            env("PORTAL_PASSWORD", portal.password()),
            env("PORTAL_INDEX", portal.index()),
            env("FRAME_ANCESTORS", portal.frameAncestors()),
            env("ADMIN_USERNAME", portal.adminUsername()),
            env("ADMIN_PASSWORD", portal.adminPassword()),
            env("INGRESS_DOMAIN", operator.getIngressDomain()),
            env("REGISTRATION_TYPE", portal.registrationType()),
            env("ENABLE_REGISTRATION", String.valueOf(portal.registrationEnabled())),
            env("CATALOG_VISIBILITY", portal.catalogVisibility()),
            env("INGRESS_CLASS", operator.getIngressClass()),
            env("INGRESS_PROTOCOL", operator.getIngressProtocol()),
            env("INGRESS_SECRET", operator.getIngressSecret()),
            env("GOOGLE_TRACKING_ID", portal.googleTrackingId()),
            env("ANALYTICS_WEBHOOK_URL", portal.analyticsWebhookUrl())
        );
    }

    // ── Helpers ────────────────────────────────────────────────────────────

    /** Mutable tags are always re-pulled. */
    static String imagePullPolicy(String image) {
        String tail = image.substring(image.lastIndexOf('/') + 1);
        if (tail.contains("@")) {
            return "IfNotPresent";
        }
        int colon = tail.indexOf(':');
        if (colon < 0) {
            return "Always";
        }
        String tag = tail.substring(colon + 1);
        return List.of("latest", "main", "master", "develop").contains(tag) ? "Always" : "IfNotPresent";
    }

    private Probe loginProbe(int initialDelaySeconds) {
        return new ProbeBuilder()
            .withNewHttpGet()
                .withPath(LOGIN_PATH)
                .withPort(new IntOrString(PORTAL_PORT))
            .endHttpGet()
            .withInitialDelaySeconds(initialDelaySeconds)
            .withPeriodSeconds(10)
            .build();
    }

    private ResourceRequirements memory(String amount) {
        return new ResourceRequirementsBuilder()
            .withRequests(Map.of("memory", new Quantity(amount)))
            .withLimits(Map.of("memory", new Quantity(amount)))
            .build();
    }

    private EnvVar env(String name, String value) {
        return new EnvVarBuilder().withName(name).withValue(value != null ? value : "").build();
    }

    private static long parseId(String value) {
        try {
            return isBlank(value) ? 0L : Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Storage group must be numeric: " + value, e);
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
