package com.workshopos.config;

import io.micronaut.context.annotation.ConfigurationProperties;
import jakarta.annotation.PostConstruct;
import org.apache.commons.lang3.RandomStringUtils;

import java.time.Duration;

/**
 * Process-wide operator defaults, bound from the {@code operator.*} keys.
 *
 * Per-portal values from the TrainingPortal resource are layered on top of
 * these by {@link com.workshopos.k8s.PortalSettings#resolve}.
 */
@ConfigurationProperties("operator")
public class OperatorSettings {

    private String apiGroup = "educates.dev";
    private String namePrefix = "educates";

    private String ingressDomain = "127.0.0.1.nip.io";
    private String ingressProtocol = "http";
    private String ingressSecret = "";
    private String ingressClass = "";

    private String storageClass = "";
    private String storageUser = "";
    private String storageGroup = "0";

    private String securityPolicyEngine = "";

    private String googleTrackingId = "";
    private String analyticsWebhookUrl = "";

    private String portalScript = "";
    private String portalStyle = "";
    private String portalImage = "ghcr.io/vmware-tanzu-labs/educates-training-portal:latest";

    private String adminUsername = "educates";
    private String adminPassword = "";
    private String robotUsername = "robot@educates";
    private String robotPassword = "";
    private String robotClientId = "";
    private String robotClientSecret = "";

    private Duration retryDelay = Duration.ofSeconds(30);
    private Duration reconcileTimeout = Duration.ofSeconds(900);

    /** Fills in credentials left blank in configuration with random values. */
    @PostConstruct
    void generateMissingCredentials() {
        if (isBlank(adminPassword)) adminPassword = RandomStringUtils.secure().nextAlphanumeric(32);
        if (isBlank(robotPassword)) robotPassword = RandomStringUtils.secure().nextAlphanumeric(32);
        if (isBlank(robotClientId)) robotClientId = RandomStringUtils.secure().nextAlphanumeric(32);
        if (isBlank(robotClientSecret)) robotClientSecret = RandomStringUtils.secure().nextAlphanumeric(32);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    public String getApiGroup() { return apiGroup; }
    public void setApiGroup(String apiGroup) { this.apiGroup = apiGroup; }

    public String getNamePrefix() { return namePrefix; }
    public void setNamePrefix(String namePrefix) { this.namePrefix = namePrefix; }

    public String getIngressDomain() { return ingressDomain; }
    public void setIngressDomain(String ingressDomain) { this.ingressDomain = ingressDomain; }

    public String getIngressProtocol() { return ingressProtocol; }
    public void setIngressProtocol(String ingressProtocol) { this.ingressProtocol = ingressProtocol; }

    public String getIngressSecret() { return ingressSecret; }
    public void setIngressSecret(String ingressSecret) { this.ingressSecret = ingressSecret; }

    public String getIngressClass() { return ingressClass; }
    public void setIngressClass(String ingressClass) { this.ingressClass = ingressClass; }

    public String getStorageClass() { return storageClass; }
    public void setStorageClass(String storageClass) { this.storageClass = storageClass; }

    public String getStorageUser() { return storageUser; }
    public void setStorageUser(String storageUser) { this.storageUser = storageUser; }

    public String getStorageGroup() { return storageGroup; }
    public void setStorageGroup(String storageGroup) { this.storageGroup = storageGroup; }

    public String getSecurityPolicyEngine() { return securityPolicyEngine; }
    public void setSecurityPolicyEngine(String securityPolicyEngine) { this.securityPolicyEngine = securityPolicyEngine; }

    public String getGoogleTrackingId() { return googleTrackingId; }
    public void setGoogleTrackingId(String googleTrackingId) { this.googleTrackingId = googleTrackingId; }

    public String getAnalyticsWebhookUrl() { return analyticsWebhookUrl; }
    public void setAnalyticsWebhookUrl(String analyticsWebhookUrl) { this.analyticsWebhookUrl = analyticsWebhookUrl; }

    public String getPortalScript() { return portalScript; }
    public void setPortalScript(String portalScript) { this.portalScript = portalScript; }

    public String getPortalStyle() { return portalStyle; }
    public void setPortalStyle(String portalStyle) { this.portalStyle = portalStyle; }

    public String getPortalImage() { return portalImage; }
    public void setPortalImage(String portalImage) { this.portalImage = portalImage; }

    public String getAdminUsername() { return adminUsername; }
    public void setAdminUsername(String adminUsername) { this.adminUsername = adminUsername; }

    public String getAdminPassword() { return adminPassword; }
    public void setAdminPassword(String adminPassword) { this.adminPassword = adminPassword; }

    public String getRobotUsername() { return robotUsername; }
    public void setRobotUsername(String robotUsername) { this.robotUsername = robotUsername; }

    public String getRobotPassword() { return robotPassword; }
    public void setRobotPassword(String robotPassword) { this.robotPassword = robotPassword; }

    public String getRobotClientId() { return robotClientId; }
    public void setRobotClientId(String robotClientId) { this.robotClientId = robotClientId; }

    public String getRobotClientSecret() { return robotClientSecret; }
    public void setRobotClientSecret(String robotClientSecret) { this.robotClientSecret = robotClientSecret; }

    public Duration getRetryDelay() { return retryDelay; }
    public void setRetryDelay(Duration retryDelay) { this.retryDelay = retryDelay; }

    public Duration getReconcileTimeout() { return reconcileTimeout; }
    public void setReconcileTimeout(Duration reconcileTimeout) { this.reconcileTimeout = reconcileTimeout; }
}
