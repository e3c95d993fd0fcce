package com.example.annotation.security.filter;

import com.example.annotation.common.util.StringSanitizer;
import com.example.annotation.config.AnnotationProperties;
import com.example.annotation.security.context.CallerContext;
import com.example.annotation.security.context.CallerContextHolder;
import com.example.annotation.security.exception.AuthenticationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Reads the caller identity resolved by the upstream identity provider and
 * binds it to the reactive context. Credentials are never checked here.
 *
 * <p>Registered inside the Spring Security chain by {@code SecurityConfig}.
 */
@Slf4j
public class CallerIdentityFilter implements WebFilter {

    private final AnnotationProperties.Identity identity;

    public CallerIdentityFilter(AnnotationProperties properties) {
        this.identity = properties.getIdentity();
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        ServerHttpRequest request = exchange.getRequest();
        String path = request.getPath().pathWithinApplication().value();

        if (isPublicPath(path)) {
            return chain.filter(exchange);
        }

        String callerId = StringSanitizer.headerValue(
                request.getHeaders().getFirst(identity.getCallerIdHeader()));

        if (callerId == null || callerId.isBlank()) {
            return Mono.error(new AuthenticationException(
                    "Missing required header: " + identity.getCallerIdHeader()));
        }
        if (!StringSanitizer.isSafeId(callerId)) {
            return Mono.error(new AuthenticationException(
                    "Malformed caller identity in header: " + identity.getCallerIdHeader()));
        }

        String correlationId = StringSanitizer.headerValue(
                request.getHeaders().getFirst(identity.getCorrelationIdHeader()), 64);
        if (correlationId == null || correlationId.isBlank()) {
            correlationId = UUID.randomUUID().toString();
        }

        CallerContext callerContext = new CallerContext(callerId, correlationId);
        log.debug("Caller resolved: callerId={}, correlationId={}, path={}",
                callerId, correlationId, StringSanitizer.forLog(path, 200));

        return chain.filter(exchange)
                .contextWrite(CallerContextHolder.withContext(callerContext));
    }

    private boolean isPublicPath(String path) {
        return identity.getPublicPaths().stream().anyMatch(path::startsWith);
    }
}
