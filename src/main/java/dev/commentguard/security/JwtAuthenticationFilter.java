package dev.commentguard.security;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.ReactiveSecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Set;

/**
 * Authenticates requests carrying a bearer token. The principal is a
 * {@link CommentUser} built from the claims; no account lookup is made.
 * Invalid tokens are ignored on public comment reads and refused elsewhere.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JwtAuthenticationFilter implements WebFilter {

    private static final Set<String> ALLOWED_ROLES = Set.of("USER", "MODERATOR", "ADMIN");

    private final JwtTokenProvider tokenProvider;

    private String getJwtFromRequest(ServerWebExchange exchange) {
        String bearerToken = exchange.getRequest().getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        if (StringUtils.hasText(bearerToken) && bearerToken.startsWith("Bearer ")) {
            return bearerToken.substring(7);
        }
        return null;
    }

    private boolean isPublicRead(ServerWebExchange exchange) {
        return "GET".equals(exchange.getRequest().getMethod().name())
                && exchange.getRequest().getPath().value().startsWith("/api/v1/comments");
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String jwt = getJwtFromRequest(exchange);
        if (!StringUtils.hasText(jwt)) {
            return chain.filter(exchange);
        }

        var validation = tokenProvider.validateAndParseClaims(jwt);
        if (!validation.valid()) {
            if (isPublicRead(exchange)) {
                return chain.filter(exchange);
            }
            log.warn("Access denied: {} for path: {}", validation.error(), exchange.getRequest().getPath());
            return unauthorizedResponse(exchange, validation.error());
        }

        CommentUser user = tokenProvider.toUser(validation.claims());
        if (!StringUtils.hasText(user.userId()) || user.role() == null || !ALLOWED_ROLES.contains(user.role())) {
            log.warn("Access denied: invalid subject or role '{}'", user.role());
            return unauthorizedResponse(exchange, "Invalid token");
        }

        var auth = new UsernamePasswordAuthenticationToken(
                user, null, Collections.singleton(new SimpleGrantedAuthority("ROLE_" + user.role())));
        return chain.filter(exchange)
                .contextWrite(ReactiveSecurityContextHolder.withAuthentication(auth));
    }

    private Mono<Void> unauthorizedResponse(ServerWebExchange exchange, String message) {
        exchange.getResponse().setStatusCode(HttpStatus.UNAUTHORIZED);
        exchange.getResponse().getHeaders().setContentType(MediaType.APPLICATION_JSON);
        String safeMessage = message.replace("\\", "\\\\").replace("\"", "\\\"");
        String body = "{\"error\":\"Unauthorized\",\"message\":\"" + safeMessage + "\"}";
        DataBuffer buffer = exchange.getResponse().bufferFactory()
                .wrap(body.getBytes(StandardCharsets.UTF_8));
        return exchange.getResponse().writeWith(Mono.just(buffer));
    }
}
