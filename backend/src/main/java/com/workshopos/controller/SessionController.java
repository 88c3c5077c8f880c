package com.workshopos.controller;

import com.workshopos.dto.ActivateSessionRequest;
import com.workshopos.dto.SessionResponse;
import com.workshopos.service.SessionService;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.annotation.*;
import io.micronaut.validation.Validated;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.inject.Inject;
import jakarta.validation.Valid;

@Controller("/api/v1/sessions/{name}")
@Validated
@Tag(name = "sessions")
public class SessionController {

    @Inject
    SessionService sessionService;

    @Post("/activate")
    @Operation(summary = "Activate a pending session with its token")
    public HttpResponse<SessionResponse> activate(String name, @Valid @Body ActivateSessionRequest req) {
        return HttpResponse.ok(sessionService.activate(name, req.token()));
    }

    @Post("/terminate")
    @Operation(summary = "Terminate a session")
    public HttpResponse<SessionResponse> terminate(String name) {
        return HttpResponse.ok(sessionService.terminate(name));
    }
}
