package com.workshopos.controller;

import com.workshopos.dto.CreateEnvironmentRequest;
import com.workshopos.dto.CreatePortalRequest;
import com.workshopos.dto.EnvironmentResponse;
import com.workshopos.dto.PortalResponse;
import com.workshopos.service.EnvironmentService;
import com.workshopos.service.PortalService;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.annotation.*;
import io.micronaut.validation.Validated;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.inject.Inject;
import jakarta.validation.Valid;

import java.util.List;

@Controller("/api/v1/portals")
@Validated
@Tag(name = "portals")
public class PortalController {

    @Inject
    PortalService portalService;

    @Inject
    EnvironmentService environmentService;

    @Post
    @Operation(summary = "Register a training portal")
    public HttpResponse<PortalResponse> register(@Valid @Body CreatePortalRequest req) {
        return HttpResponse.status(HttpStatus.CREATED).body(portalService.register(req));
    }

    @Get("/{name}")
    @Operation(summary = "Get a portal with its session counts")
    public HttpResponse<PortalResponse> get(String name) {
        return HttpResponse.ok(portalService.get(name));
    }

    @Post("/{name}/environments")
    @Operation(summary = "Register a workshop environment and fill its reserved pool")
    public HttpResponse<EnvironmentResponse> registerEnvironment(String name, @Valid @Body CreateEnvironmentRequest req) {
        return HttpResponse.status(HttpStatus.CREATED).body(environmentService.register(name, req));
    }

    @Get("/{name}/environments")
    @Operation(summary = "List the portal's workshop environments")
    public HttpResponse<List<EnvironmentResponse>> listEnvironments(String name) {
        return HttpResponse.ok(environmentService.listForPortal(name));
    }
}
