package com.workshopos.dto;

import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.annotation.Nullable;

import java.time.OffsetDateTime;

@Serdeable
@Schema(description = "Workshop session")
public record SessionResponse(
    String name,
    String sessionId,
    String environment,
    @Schema(allowableValues = {"STARTING", "WAITING", "RUNNING", "STOPPING"})
    String state,
    @Nullable String owner,
    boolean pending,
    String url,
    OffsetDateTime created,
    @Nullable OffsetDateTime started,
    @Nullable OffsetDateTime expires
) {}
