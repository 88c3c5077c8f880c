package com.workshopos.dto;

import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.annotation.Nullable;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

import java.util.List;

@Serdeable
@Schema(description = "Request to register a workshop environment under a portal")
public record CreateEnvironmentRequest(
    @NotBlank
    @Pattern(regexp = "[a-z0-9]([-a-z0-9]*[a-z0-9])?",
             message = "name must be a lowercase DNS label")
    @Schema(description = "Environment name; session names are derived from it", example = "learning-w01")
    String name,

    @Min(1)
    @Schema(description = "Maximum active sessions in this environment")
    int capacity,

    @Min(0)
    @Schema(description = "Number of unallocated sessions to keep warm")
    int reserved,

    @Nullable
    @Schema(description = "Name of the WorkshopEnvironment resource; defaults to the environment name")
    String resourceName,

    @Nullable
    @Schema(description = "UID of the WorkshopEnvironment resource, owner of created sessions")
    String resourceUid,

    @Min(0)
    @Schema(description = "Session duration in seconds, 0 for none")
    long duration,

    @Min(0)
    @Schema(description = "Inactivity timeout in seconds, 0 for none")
    long inactivity,

    @Nullable
    @Valid
    List<EnvVariable> env,

    @Nullable
    @Schema(description = "Names of extra session ingresses needing OAuth callbacks")
    List<String> ingresses
) {}
