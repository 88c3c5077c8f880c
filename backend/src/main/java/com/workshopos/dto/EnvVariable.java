package com.workshopos.dto;

import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

@Serdeable
@Schema(description = "Environment variable passed to every session of an environment")
public record EnvVariable(
    @NotBlank String name,
    String value
) {}
