package com.workshopos.domain;

import jakarta.annotation.Nullable;
import jakarta.persistence.*;

import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "workshop_sessions")
public class WorkshopSession {

    @Id
    @GeneratedValue(strategy = GenerationType.AUTO)
    private UUID id;

    @Column(nullable = false, unique = true)
    private String name;

    @Column(name = "session_id", nullable = false)
    private String sessionId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private SessionState state = SessionState.STARTING;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "environment_id", nullable = false)
    private WorkshopEnvironment environment;

    @OneToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "application_id", nullable = false)
    private OAuthApplication application;

    @Nullable
    @Column
    private String owner;

    @Nullable
    @Column
    private String token;

    @Column(nullable = false)
    private OffsetDateTime created;

    @Nullable
    @Column
    private OffsetDateTime started;

    @Nullable
    @Column
    private OffsetDateTime expires;

    // ── Getters and setters ────────────────────────────────────────────────

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getSessionId() { return sessionId; }
    public void setSessionId(String sessionId) { this.sessionId = sessionId; }

    public SessionState getState() { return state; }
    public void setState(SessionState state) { this.state = state; }

    public WorkshopEnvironment getEnvironment() { return environment; }
    public void setEnvironment(WorkshopEnvironment environment) { this.environment = environment; }

    public OAuthApplication getApplication() { return application; }
    public void setApplication(OAuthApplication application) { this.application = application; }

    @Nullable
    public String getOwner() { return owner; }
    public void setOwner(@Nullable String owner) { this.owner = owner; }

    @Nullable
    public String getToken() { return token; }
    public void setToken(@Nullable String token) { this.token = token; }

    public OffsetDateTime getCreated() { return created; }
    public void setCreated(OffsetDateTime created) { this.created = created; }

    @Nullable
    public OffsetDateTime getStarted() { return started; }
    public void setStarted(@Nullable OffsetDateTime started) { this.started = started; }

    @Nullable
    public OffsetDateTime getExpires() { return expires; }
    public void setExpires(@Nullable OffsetDateTime expires) { this.expires = expires; }

    // ── Lifecycle ──────────────────────────────────────────────────────────

    /** Allocated but waiting for the holder of the token to activate it. */
    public boolean isPending() {
        return token != null && (state == SessionState.STARTING || state == SessionState.WAITING);
    }

    public boolean isAvailable() {
        return owner == null && SessionState.CLAIMABLE.contains(state);
    }

    public void markAsPending(String user, String token, OffsetDateTime now) {
        this.owner = user;
        this.token = token;
        this.started = now;
    }

    public void markAsRunning(String user, OffsetDateTime now) {
        this.owner = user;
        this.token = null;
        if (started == null) {
            this.started = now;
        }
        if (state == SessionState.WAITING) {
            this.state = SessionState.RUNNING;
        }
    }

    public void markAsStopping(OffsetDateTime now) {
        this.state = SessionState.STOPPING;
        this.expires = now;
    }
}
