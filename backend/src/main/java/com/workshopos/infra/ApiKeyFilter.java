package com.workshopos.infra;

import io.micronaut.context.annotation.Value;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.MutableHttpResponse;
import io.micronaut.http.annotation.Filter;
import io.micronaut.http.filter.HttpServerFilter;
import io.micronaut.http.filter.ServerFilterChain;
import org.reactivestreams.Publisher;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Shared-key authentication for the portal API.
 *
 * Header: X-Portal-API-Key: {app.api-key}. A blank key turns the check off.
 */
@Filter("/api/v1/**")
public class ApiKeyFilter implements HttpServerFilter {

    static final String HEADER = "X-Portal-API-Key";

    @Value("${app.api-key:}")
    String configuredKey;

    @Override
    public Publisher<MutableHttpResponse<?>> doFilter(HttpRequest<?> request,
                                                       ServerFilterChain chain) {
        if (configuredKey == null || configuredKey.isBlank()) {
            return chain.proceed(request);
        }

        String provided = request.getHeaders().get(HEADER);
        if (configuredKey.equals(provided)) {
            return chain.proceed(request);
        }

        return Mono.just(HttpResponse.unauthorized()
            .body(Map.of("message", "Missing or invalid " + HEADER + " header")));
    }
}
