package com.workshopos.k8s.crd;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Status written back to a {@link TrainingPortalResource}. {@code phase} holds
 * one of the {@link com.workshopos.domain.PortalPhase} values.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TrainingPortalStatus {

    private String phase;
    private String namespace;
    private String url;
    private TrainingPortalSpec.Credentials credentials;
    private TrainingPortalSpec.Clients clients;
    private String message;

    public TrainingPortalStatus() {}

    public TrainingPortalStatus(String phase, String message) {
        this.phase = phase;
        this.message = message;
    }

    public String getPhase() { return phase; }
    public void setPhase(String phase) { this.phase = phase; }

    public String getNamespace() { return namespace; }
    public void setNamespace(String namespace) { this.namespace = namespace; }

    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }

    public TrainingPortalSpec.Credentials getCredentials() { return credentials; }
    public void setCredentials(TrainingPortalSpec.Credentials credentials) { this.credentials = credentials; }

    public TrainingPortalSpec.Clients getClients() { return clients; }
    public void setClients(TrainingPortalSpec.Clients clients) { this.clients = clients; }

    public String getMessage() { return message; }
    public void setMessage(String message) { this.message = message; }
}
