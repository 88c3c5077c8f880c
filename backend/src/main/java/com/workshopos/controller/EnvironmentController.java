package com.workshopos.controller;

import com.workshopos.dto.ErrorResponse;
import com.workshopos.dto.RequestSessionRequest;
import com.workshopos.dto.SessionResponse;
import com.workshopos.service.SessionScheduler;
import com.workshopos.service.SessionService;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.annotation.*;
import io.micronaut.validation.Validated;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.inject.Inject;
import jakarta.validation.Valid;

import java.util.List;

@Controller("/api/v1/environments/{name}/sessions")
@Validated
@Tag(name = "sessions")
public class EnvironmentController {

    @Inject
    SessionScheduler sessionScheduler;

    @Inject
    SessionService sessionService;

    /** 503 when the user is refused a session or no capacity is left. */
    @Post
    @Operation(summary = "Get or allocate a workshop session for a user")
    public HttpResponse<?> request(String name, @Valid @Body RequestSessionRequest req) {
        return sessionScheduler.retrieveSessionForUser(name, req.user(), req.token())
            .<HttpResponse<?>>map(HttpResponse::ok)
            .orElseGet(() -> HttpResponse.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ErrorResponse("No workshop session available", "SESSION_UNAVAILABLE")));
    }

    @Get
    @Operation(summary = "List sessions of a workshop environment")
    public HttpResponse<List<SessionResponse>> list(String name) {
        return HttpResponse.ok(sessionService.listForEnvironment(name));
    }
}
