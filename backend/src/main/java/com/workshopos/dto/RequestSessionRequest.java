package com.workshopos.dto;

import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.annotation.Nullable;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

@Serdeable
@Schema(description = "Request for a workshop session on behalf of a user")
public record RequestSessionRequest(
    @NotBlank
    @Schema(description = "User the session is allocated to")
    String user,

    @Nullable
    @Pattern(regexp = ".*\\S.*", message = "token must not be blank")
    @Schema(description = "Activation token; the session stays pending until activated with it")
    String token
) {}
