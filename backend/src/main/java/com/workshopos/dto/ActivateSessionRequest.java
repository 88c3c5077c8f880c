package com.workshopos.dto;

import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

@Serdeable
@Schema(description = "Activation of a pending session")
public record ActivateSessionRequest(
    @NotBlank String token
) {}
