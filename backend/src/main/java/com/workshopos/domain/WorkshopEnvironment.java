package com.workshopos.domain;

import jakarta.persistence.*;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "workshop_environments")
public class WorkshopEnvironment {

    @Id
    @GeneratedValue(strategy = GenerationType.AUTO)
    private UUID id;

    @Column(nullable = false, unique = true)
    private String name;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "portal_id", nullable = false)
    private TrainingPortal portal;

    @Column(nullable = false)
    private int capacity;

    @Column(nullable = false)
    private int reserved;

    // Only ever incremented; session names are derived from it.
    @Column(nullable = false)
    private int tally = 0;

    @Column(name = "resource_name", nullable = false)
    private String resourceName;

    @Column(name = "resource_uid", nullable = false)
    private String resourceUid;

    @Column(nullable = false)
    private long duration = 0L;

    @Column(nullable = false)
    private long inactivity = 0L;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "workshop_environment_env", joinColumns = @JoinColumn(name = "environment_id"))
    @OrderColumn(name = "position")
    private List<EnvEntry> env = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "workshop_environment_ingresses", joinColumns = @JoinColumn(name = "environment_id"))
    @OrderColumn(name = "position")
    @Column(name = "ingress_name", nullable = false)
    private List<String> ingresses = new ArrayList<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    // ── Getters and setters ────────────────────────────────────────────────

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public TrainingPortal getPortal() { return portal; }
    public void setPortal(TrainingPortal portal) { this.portal = portal; }

    public int getCapacity() { return capacity; }
    public void setCapacity(int capacity) { this.capacity = capacity; }

    public int getReserved() { return reserved; }
    public void setReserved(int reserved) { this.reserved = reserved; }

    public int getTally() { return tally; }
    public void setTally(int tally) { this.tally = tally; }

    public String getResourceName() { return resourceName; }
    public void setResourceName(String resourceName) { this.resourceName = resourceName; }

    public String getResourceUid() { return resourceUid; }
    public void setResourceUid(String resourceUid) { this.resourceUid = resourceUid; }

    public long getDuration() { return duration; }
    public void setDuration(long duration) { this.duration = duration; }

    public long getInactivity() { return inactivity; }
    public void setInactivity(long inactivity) { this.inactivity = inactivity; }

    public List<EnvEntry> getEnv() { return env; }
    public void setEnv(List<EnvEntry> env) { this.env = env; }

    public List<String> getIngresses() { return ingresses; }
    public void setIngresses(List<String> ingresses) { this.ingresses = ingresses; }

    public OffsetDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(OffsetDateTime createdAt) { this.createdAt = createdAt; }

    /** Advances the session tally and returns the new value. */
    public int nextTally() {
        tally = tally + 1;
        return tally;
    }

    public boolean hasTimeLimit() {
        return duration > 0 || inactivity > 0;
    }
}
