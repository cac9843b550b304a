package dev.commentguard.security;

import dev.commentguard.security.JwtTokenProvider.TokenValidationResult;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Date;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JwtTokenProviderTest {

    private JwtTokenProvider tokenProvider;
    private static final String SECRET = "this-is-a-very-long-secret-key-that-is-at-least-512-bits-long-for-hs512-signing";
    private static final long EXPIRATION = 86400000L; // 24 hours

    private static final CommentUser USER =
            new CommentUser("user-42", "test@example.com", "Test User", "https://cdn/avatar.png", "USER");

    @BeforeEach
    void setUp() {
        tokenProvider = new JwtTokenProvider();
        ReflectionTestUtils.setField(tokenProvider, "secret", SECRET);
        ReflectionTestUtils.setField(tokenProvider, "expiration", EXPIRATION);
        tokenProvider.init();
    }

    @Test
    @DisplayName("Should generate a three-part JWT")
    void generateToken_ShouldCreateValidToken() {
        String token = tokenProvider.generateToken(USER);

        assertThat(token).isNotEmpty();
        assertThat(token.split("\\.")).hasSize(3);
    }

    @Test
    @DisplayName("Should round-trip the commenter identity through the claims")
    void validate_ShouldReturnUser() {
        String token = tokenProvider.generateToken(USER);

        TokenValidationResult result = tokenProvider.validateAndParseClaims(token);

        assertThat(result.valid()).isTrue();
        assertThat(tokenProvider.toUser(result.claims())).isEqualTo(USER);
    }

    @Test
    @DisplayName("Should report expired tokens separately")
    void validate_ShouldReportExpired() {
        ReflectionTestUtils.setField(tokenProvider, "expiration", -1000L);
        String token = tokenProvider.generateToken(USER);

        TokenValidationResult result = tokenProvider.validateAndParseClaims(token);

        assertThat(result.valid()).isFalse();
        assertThat(result.expired()).isTrue();
        assertThat(result.error()).isEqualTo("Token expired");
    }

    @Test
    @DisplayName("Should reject tokens signed with another key")
    void validate_ShouldRejectForeignSignature() {
        SecretKey otherKey = Keys.hmacShaKeyFor(
                "another-secret-key-that-is-also-long-enough-for-hs512-signatures-to-work".getBytes(StandardCharsets.UTF_8));
        String forged = Jwts.builder()
                .subject("user-42")
                .issuer("comment-guard")
                .audience().add("comment-guard-api").and()
                .expiration(new Date(System.currentTimeMillis() + 60000))
                .signWith(otherKey, Jwts.SIG.HS512)
                .compact();

        TokenValidationResult result = tokenProvider.validateAndParseClaims(forged);

        assertThat(result.valid()).isFalse();
        assertThat(result.expired()).isFalse();
    }

    @Test
    @DisplayName("Should reject tokens for another audience")
    void validate_ShouldRejectWrongAudience() {
        SecretKey key = Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8));
        String token = Jwts.builder()
                .subject("user-42")
                .issuer("comment-guard")
                .audience().add("someone-else").and()
                .expiration(new Date(System.currentTimeMillis() + 60000))
                .signWith(key, Jwts.SIG.HS512)
                .compact();

        assertThat(tokenProvider.validateAndParseClaims(token).valid()).isFalse();
    }

    @Test
    @DisplayName("Should reject malformed and empty tokens")
    void validate_ShouldRejectGarbage() {
        assertThat(tokenProvider.validateAndParseClaims("not-a-jwt").valid()).isFalse();
        assertThat(tokenProvider.validateAndParseClaims("").error()).isEqualTo("Empty or null token");
    }

    @Test
    @DisplayName("Should refuse short secrets at startup")
    void init_ShouldRejectShortSecret() {
        JwtTokenProvider provider = new JwtTokenProvider();
        ReflectionTestUtils.setField(provider, "secret", "short");
        ReflectionTestUtils.setField(provider, "expiration", EXPIRATION);

        assertThatThrownBy(provider::init)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("at least 64 characters");
    }
}
