package com.workshopos.dto;

import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.OffsetDateTime;
import java.util.UUID;

@Serdeable
@Schema(description = "Training portal with current session counts")
public record PortalResponse(
    UUID id,
    String name,
    String hostname,
    String frameAncestors,
    int sessionsMaximum,
    int userSessionsLimit,
    long allocatedSessions,
    long availableSessions,
    long activeSessions,
    OffsetDateTime createdAt
) {}
