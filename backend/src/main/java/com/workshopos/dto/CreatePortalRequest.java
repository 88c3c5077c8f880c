package com.workshopos.dto;

import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.annotation.Nullable;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

@Serdeable
@Schema(description = "Request to register a training portal for session scheduling")
public record CreatePortalRequest(
    @NotBlank
    @Pattern(regexp = "[a-z0-9]([-a-z0-9]*[a-z0-9])?",
             message = "name must be a lowercase DNS label")
    @Schema(description = "Portal name, matching the TrainingPortal resource", example = "learning")
    String name,

    @Nullable
    @Schema(description = "Portal hostname; defaults to <name>-ui.<ingress domain>")
    String hostname,

    @Nullable
    @Schema(description = "Origins allowed to embed workshop sessions, comma separated")
    String frameAncestors,

    @Min(0)
    @Schema(description = "Maximum sessions across the portal, 0 for no limit")
    int sessionsMaximum,

    @Min(0)
    @Schema(description = "Maximum sessions per user across the portal, 0 for no limit")
    int userSessionsLimit
) {}
