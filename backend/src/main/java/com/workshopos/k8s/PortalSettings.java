package com.workshopos.k8s;

import com.workshopos.config.OperatorSettings;
import com.workshopos.k8s.crd.TrainingPortalResource;
import com.workshopos.k8s.crd.TrainingPortalSpec;

import java.util.List;
import java.util.Set;

/**
 * Effective settings for one training portal: the portal's own spec layered
 * over the operator defaults.
 */
public record PortalSettings(
    String portalName,
    String portalUid,
    String namespace,
    String hostname,
    String url,
    String adminUsername,
    String adminPassword,
    String robotUsername,
    String robotPassword,
    String robotClientId,
    String robotClientSecret,
    String title,
    String password,
    String index,
    String logo,
    String frameAncestors,
    String registrationType,
    boolean registrationEnabled,
    String catalogVisibility,
    String googleTrackingId,
    String analyticsWebhookUrl
) {

    static final Set<String> REGISTRATION_TYPES = Set.of("one-step", "anonymous");
    static final Set<String> CATALOG_VISIBILITIES = Set.of("private", "public");

    /**
     * @throws IllegalArgumentException when the registration type or catalog
     *         visibility is not one of the accepted values
     */
    public static PortalSettings resolve(TrainingPortalResource resource, OperatorSettings defaults) {
        String name = resource.getMetadata().getName();
        TrainingPortalSpec spec = resource.getSpec() != null ? resource.getSpec() : new TrainingPortalSpec();
        TrainingPortalSpec.Portal portal = spec.getPortal();

        String namespace = name + "-ui";
        String hostname = resolveHostname(name, portal.getIngress().getHostname(), defaults.getIngressDomain());

        String registrationType = or(portal.getRegistration().getType(), "one-step");
        if (!REGISTRATION_TYPES.contains(registrationType)) {
            throw new IllegalArgumentException("Invalid registration type: " + registrationType);
        }
        String catalogVisibility = or(portal.getCatalog().getVisibility(), "private");
        if (!CATALOG_VISIBILITIES.contains(catalogVisibility)) {
            throw new IllegalArgumentException("Invalid catalog visibility: " + catalogVisibility);
        }

        TrainingPortalSpec.Credentials credentials = portal.getCredentials();
        TrainingPortalSpec.ClientCredentials robotClient = portal.getClients().getRobot();
        List<String> ancestors = portal.getTheme().getFrame().getAncestors();

        return new PortalSettings(
            name,
            resource.getMetadata().getUid(),
            namespace,
            hostname,
            defaults.getIngressProtocol() + "://" + hostname,
            or(credentials.getAdmin().getUsername(), defaults.getAdminUsername()),
            or(credentials.getAdmin().getPassword(), defaults.getAdminPassword()),
            or(credentials.getRobot().getUsername(), defaults.getRobotUsername()),
            or(credentials.getRobot().getPassword(), defaults.getRobotPassword()),
            or(robotClient.getId(), defaults.getRobotClientId()),
            or(robotClient.getSecret(), defaults.getRobotClientSecret()),
            or(portal.getTitle(), "Workshops"),
            or(portal.getPassword(), ""),
            or(portal.getIndex(), ""),
            or(portal.getLogo(), ""),
            String.join(",", ancestors),
            registrationType,
            !Boolean.FALSE.equals(portal.getRegistration().getEnabled()),
            catalogVisibility,
            or(spec.getAnalytics().getGoogle().getTrackingId(), defaults.getGoogleTrackingId()),
            or(spec.getAnalytics().getWebhook().getUrl(), defaults.getAnalyticsWebhookUrl())
        );
    }

    /**
     * No override gives {@code <name>-ui.<domain>}, a single label is placed
     * under the ingress domain, and a dotted name is used as given.
     */
    static String resolveHostname(String portalName, String override, String ingressDomain) {
        if (override == null || override.isEmpty()) {
            return portalName + "-ui." + ingressDomain;
        }
        if (!override.contains(".")) {
            return override + "." + ingressDomain;
        }
        return override;
    }

    public TrainingPortalSpec.Credentials credentials() {
        return new TrainingPortalSpec.Credentials(
            new TrainingPortalSpec.UserCredentials(adminUsername, adminPassword),
            new TrainingPortalSpec.UserCredentials(robotUsername, robotPassword));
    }

    public TrainingPortalSpec.Clients clients() {
        return new TrainingPortalSpec.Clients(
            new TrainingPortalSpec.ClientCredentials(robotClientId, robotClientSecret));
    }

    private static String or(String value, String fallback) {
        return value != null ? value : fallback;
    }
}
