package com.workshopos.k8s.crd;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;

/**
 * Spec of a {@link TrainingPortalResource}. Nested sections are created on
 * demand so callers can navigate without null checks. Leaf values left
 * {@code null} fall back to operator defaults.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TrainingPortalSpec {

    private Portal portal = new Portal();
    private Analytics analytics = new Analytics();

    public Portal getPortal() { return portal; }
    public void setPortal(Portal portal) { this.portal = portal != null ? portal : new Portal(); }

    public Analytics getAnalytics() { return analytics; }
    public void setAnalytics(Analytics analytics) { this.analytics = analytics != null ? analytics : new Analytics(); }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Portal {
        private Ingress ingress = new Ingress();
        private Credentials credentials = new Credentials();
        private Clients clients = new Clients();
        private String title = "Workshops";
        private String password = "";
        private String index = "";
        private String logo = "";
        private Theme theme = new Theme();
        private Registration registration = new Registration();
        private Catalog catalog = new Catalog();

        public Ingress getIngress() { return ingress; }
        public void setIngress(Ingress ingress) { this.ingress = ingress != null ? ingress : new Ingress(); }

        public Credentials getCredentials() { return credentials; }
        public void setCredentials(Credentials credentials) { this.credentials = credentials != null ? credentials : new Credentials(); }

        public Clients getClients() { return clients; }
        public void setClients(Clients clients) { this.clients = clients != null ? clients : new Clients(); }

        public String getTitle() { return title; }
        public void setTitle(String title) { this.title = title; }

        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }

        public String getIndex() { return index; }
        public void setIndex(String index) { this.index = index; }

        public String getLogo() { return logo; }
        public void setLogo(String logo) { this.logo = logo; }

        public Theme getTheme() { return theme; }
        public void setTheme(Theme theme) { this.theme = theme != null ? theme : new Theme(); }

        public Registration getRegistration() { return registration; }
        public void setRegistration(Registration registration) { this.registration = registration != null ? registration : new Registration(); }

        public Catalog getCatalog() { return catalog; }
        public void setCatalog(Catalog catalog) { this.catalog = catalog != null ? catalog : new Catalog(); }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Ingress {
        private String hostname;

        public String getHostname() { return hostname; }
        public void setHostname(String hostname) { this.hostname = hostname; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Credentials {
        private UserCredentials admin = new UserCredentials();
        private UserCredentials robot = new UserCredentials();

        public Credentials() {}

        public Credentials(UserCredentials admin, UserCredentials robot) {
            this.admin = admin;
            this.robot = robot;
        }

        public UserCredentials getAdmin() { return admin; }
        public void setAdmin(UserCredentials admin) { this.admin = admin != null ? admin : new UserCredentials(); }

        public UserCredentials getRobot() { return robot; }
        public void setRobot(UserCredentials robot) { this.robot = robot != null ? robot : new UserCredentials(); }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class UserCredentials {
        private String username;
        private String password;

        public UserCredentials() {}

        public UserCredentials(String username, String password) {
            this.username = username;
            this.password = password;
        }

        public String getUsername() { return username; }
        public void setUsername(String username) { this.username = username; }

        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Clients {
        private ClientCredentials robot = new ClientCredentials();

        public Clients() {}

        public Clients(ClientCredentials robot) {
            this.robot = robot;
        }

        public ClientCredentials getRobot() { return robot; }
        public void setRobot(ClientCredentials robot) { this.robot = robot != null ? robot : new ClientCredentials(); }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ClientCredentials {
        private String id;
        private String secret;

        public ClientCredentials() {}

        public ClientCredentials(String id, String secret) {
            this.id = id;
            this.secret = secret;
        }

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public String getSecret() { return secret; }
        public void setSecret(String secret) { this.secret = secret; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Theme {
        private Frame frame = new Frame();

        public Frame getFrame() { return frame; }
        public void setFrame(Frame frame) { this.frame = frame != null ? frame : new Frame(); }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Frame {
        private List<String> ancestors = new ArrayList<>();

        public List<String> getAncestors() { return ancestors; }
        public void setAncestors(List<String> ancestors) { this.ancestors = ancestors != null ? ancestors : new ArrayList<>(); }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Registration {
        private String type = "one-step";
        private Boolean enabled = Boolean.TRUE;

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }

        public Boolean getEnabled() { return enabled; }
        public void setEnabled(Boolean enabled) { this.enabled = enabled; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Catalog {
        private String visibility = "private";

        public String getVisibility() { return visibility; }
        public void setVisibility(String visibility) { this.visibility = visibility; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Analytics {
        private Google google = new Google();
        private Webhook webhook = new Webhook();

        public Google getGoogle() { return google; }
        public void setGoogle(Google google) { this.google = google != null ? google : new Google(); }

        public Webhook getWebhook() { return webhook; }
        public void setWebhook(Webhook webhook) { this.webhook = webhook != null ? webhook : new Webhook(); }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Google {
        private String trackingId;

        public String getTrackingId() { return trackingId; }
        public void setTrackingId(String trackingId) { this.trackingId = trackingId; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Webhook {
        private String url;

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }
    }
}
