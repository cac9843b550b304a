package dev.commentguard.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.MalformedJwtException;
import io.jsonwebtoken.UnsupportedJwtException;
import io.jsonwebtoken.security.Keys;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;

/**
 * Issues and validates HS512 bearer tokens carrying a {@link CommentUser}.
 * Tokens are minted by the account service that shares {@code jwt.secret};
 * {@link #generateToken(CommentUser)} exists for that service and for tests.
 */
@Component
@Slf4j
public class JwtTokenProvider {

    static final String ISSUER = "comment-guard";
    static final String AUDIENCE = "comment-guard-api";

    private static final String CLAIM_EMAIL = "email";
    private static final String CLAIM_NAME = "name";
    private static final String CLAIM_AVATAR = "avatar";
    private static final String CLAIM_ROLE = "role";

    /**
     * Minimum required secret length for HS512 (64 bytes = 512 bits)
     */
    private static final int MIN_SECRET_LENGTH = 64;

    @Value("${jwt.secret}")
    private String secret;

    @Value("${jwt.expiration}")
    private long expiration;

    private SecretKey key;
    private JwtParser jwtParser;

    @PostConstruct
    public void init() {
        if (secret == null || secret.length() < MIN_SECRET_LENGTH) {
            throw new IllegalStateException(String.format(
                    "JWT secret must be at least %d characters for HS512. Current length: %d.",
                    MIN_SECRET_LENGTH, secret == null ? 0 : secret.length()));
        }
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.jwtParser = Jwts.parser()
                .verifyWith(key)
                .requireIssuer(ISSUER)
                .requireAudience(AUDIENCE)
                .build();
        log.info("JWT token provider initialized with HS512 algorithm");
    }

    public String generateToken(CommentUser user) {
        var now = Instant.now();
        return Jwts.builder()
                .id(UUID.randomUUID().toString())
                .subject(user.userId())
                .claim(CLAIM_EMAIL, user.email())
                .claim(CLAIM_NAME, user.displayName())
                .claim(CLAIM_AVATAR, user.avatarUrl())
                .claim(CLAIM_ROLE, user.role())
                .issuer(ISSUER)
                .audience().add(AUDIENCE).and()
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plusMillis(expiration)))
                .signWith(key, Jwts.SIG.HS512)
                .compact();
    }

    /**
     * Outcome of token validation; expired tokens are reported apart from forged or malformed ones.
     */
    public record TokenValidationResult(boolean valid, boolean expired, Claims claims, String error) {
        public static TokenValidationResult success(Claims claims) {
            return new TokenValidationResult(true, false, claims, null);
        }
        public static TokenValidationResult expired(String message) {
            return new TokenValidationResult(false, true, null, message);
        }
        public static TokenValidationResult invalid(String message) {
            return new TokenValidationResult(false, false, null, message);
        }
    }

    public TokenValidationResult validateAndParseClaims(String token) {
        try {
            Claims claims = jwtParser.parseSignedClaims(token).getPayload();
            return TokenValidationResult.success(claims);
        } catch (ExpiredJwtException e) {
            log.debug("JWT token expired: {}", e.getMessage());
            return TokenValidationResult.expired("Token expired");
        } catch (MalformedJwtException e) {
            log.warn("JWT token malformed: {}", e.getMessage());
            return TokenValidationResult.invalid("Malformed token");
        } catch (UnsupportedJwtException e) {
            log.warn("JWT token uses unsupported features: {}", e.getMessage());
            return TokenValidationResult.invalid("Unsupported token format");
        } catch (JwtException e) {
            log.warn("JWT validation failed: {}", e.getMessage());
            return TokenValidationResult.invalid("Invalid token");
        } catch (IllegalArgumentException e) {
            log.warn("JWT token is null or empty: {}", e.getMessage());
            return TokenValidationResult.invalid("Empty or null token");
        }
    }

    public CommentUser toUser(Claims claims) {
        return new CommentUser(
                claims.getSubject(),
                claims.get(CLAIM_EMAIL, String.class),
                claims.get(CLAIM_NAME, String.class),
                claims.get(CLAIM_AVATAR, String.class),
                claims.get(CLAIM_ROLE, String.class));
    }
}
