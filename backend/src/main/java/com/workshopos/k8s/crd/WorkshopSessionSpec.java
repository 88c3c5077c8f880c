package com.workshopos.k8s.crd;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.fabric8.kubernetes.api.model.EnvVar;

import java.util.ArrayList;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WorkshopSessionSpec {

    private Environment environment = new Environment();
    private Session session = new Session();
    private TrainingPortalSpec.Analytics analytics;

    public Environment getEnvironment() { return environment; }
    public void setEnvironment(Environment environment) { this.environment = environment; }

    public Session getSession() { return session; }
    public void setSession(Session session) { this.session = session; }

    public TrainingPortalSpec.Analytics getAnalytics() { return analytics; }
    public void setAnalytics(TrainingPortalSpec.Analytics analytics) { this.analytics = analytics; }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Environment {
        private String name;

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Session {
        private String id;
        private String username = "";
        private String password = "";
        private Ingress ingress = new Ingress();
        private List<EnvVar> env = new ArrayList<>();

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public String getUsername() { return username; }
        public void setUsername(String username) { this.username = username; }

        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }

        public Ingress getIngress() { return ingress; }
        public void setIngress(Ingress ingress) { this.ingress = ingress; }

        public List<EnvVar> getEnv() { return env; }
        public void setEnv(List<EnvVar> env) { this.env = env; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Ingress {
        private String domain;
        private String secret;

        public String getDomain() { return domain; }
        public void setDomain(String domain) { this.domain = domain; }

        public String getSecret() { return secret; }
        public void setSecret(String secret) { this.secret = secret; }
    }
}
