package com.workshopos.dto;

import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

@Serdeable
@Schema(description = "Workshop environment with current session counts")
public record EnvironmentResponse(
    UUID id,
    String name,
    String portal,
    int capacity,
    int reserved,
    int tally,
    long duration,
    long inactivity,
    List<EnvVariable> env,
    List<String> ingresses,
    long allocatedSessions,
    long availableSessions,
    OffsetDateTime createdAt
) {}
