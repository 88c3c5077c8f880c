package com.workshopos.domain;

import io.micronaut.serde.annotation.Serdeable;
import jakarta.persistence.*;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Scheduling view of a training portal. Cluster-side state (phase, namespace,
 * credentials) lives in the TrainingPortal resource status.
 */
@Entity
@Table(name = "training_portals")
@Serdeable
public class TrainingPortal {

    @Id
    @GeneratedValue(strategy = GenerationType.AUTO)
    private UUID id;

    @Column(nullable = false, unique = true)
    private String name;

    @Column(nullable = false)
    private String hostname;

    @Column(name = "frame_ancestors", nullable = false)
    private String frameAncestors = "";

    // 0 means no portal-wide cap
    @Column(name = "sessions_maximum", nullable = false)
    private int sessionsMaximum = 0;

    @Column(name = "user_sessions_limit", nullable = false)
    private int userSessionsLimit = 0;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    public TrainingPortal() {}

    public TrainingPortal(String name, String hostname) {
        this.name = name;
        this.hostname = hostname;
    }

    public UUID getId() { return id; }
    public String getName() { return name; }
    public String getHostname() { return hostname; }
    public String getFrameAncestors() { return frameAncestors; }
    public int getSessionsMaximum() { return sessionsMaximum; }
    public int getUserSessionsLimit() { return userSessionsLimit; }
    public OffsetDateTime getCreatedAt() { return createdAt; }

    public void setId(UUID id) { this.id = id; }
    public void setName(String name) { this.name = name; }
    public void setHostname(String hostname) { this.hostname = hostname; }
    public void setFrameAncestors(String frameAncestors) { this.frameAncestors = frameAncestors; }
    public void setSessionsMaximum(int sessionsMaximum) { this.sessionsMaximum = sessionsMaximum; }
    public void setUserSessionsLimit(int userSessionsLimit) { this.userSessionsLimit = userSessionsLimit; }
    public void setCreatedAt(OffsetDateTime t) { this.createdAt = t; }

    public boolean isBounded() {
        return sessionsMaximum != 0;
    }
}
