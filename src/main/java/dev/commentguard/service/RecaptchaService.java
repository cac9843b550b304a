package dev.commentguard.service;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.commentguard.config.ResilienceConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Verifies Google reCAPTCHA v3 tokens attached to comment submissions.
 * <p>
 * Unlike the spam classifier this check fails closed: when a token was
 * supplied and cannot be verified, the submission is refused.
 * </p>
 */
@Service
@Slf4j
public class RecaptchaService {

    public static final String COMMENT_ACTION = "submit_comment";

    private static final String VERIFY_URL = "https://www.google.com/recaptcha/api/siteverify";
    private static final String FAILED = "reCAPTCHA verification failed";

    private final WebClient webClient;
    private final String secretKey;
    private final boolean enabled;
    private final double scoreThreshold;
    private final Duration timeout;
    private final CircuitBreaker circuitBreaker;

    public RecaptchaService(
            WebClient.Builder webClientBuilder,
            ResilienceConfig resilience,
            @Value("${recaptcha.secret-key:}") String secretKey,
            @Value("${recaptcha.enabled:false}") boolean enabled,
            @Value("${recaptcha.score-threshold:0.5}") double scoreThreshold) {
        this.webClient = webClientBuilder.baseUrl(VERIFY_URL).build();
        this.secretKey = secretKey == null ? "" : secretKey;
        this.enabled = enabled;
        this.scoreThreshold = scoreThreshold;
        this.timeout = resilience.getClassifierTimeout();

        CircuitBreakerConfig cbConfig = CircuitBreakerConfig.custom()
                .failureRateThreshold(50)
                .waitDurationInOpenState(Duration.ofSeconds(60))
                .slidingWindowSize(5)
                .minimumNumberOfCalls(5)
                .build();
        this.circuitBreaker = CircuitBreaker.of("recaptcha-verify", cbConfig);
        log.info("reCAPTCHA {} (threshold={})", enabled ? "enabled" : "disabled", scoreThreshold);
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Enabled but without a secret key, so no token can ever be verified.
     */
    public boolean isMisconfigured() {
        return enabled && secretKey.isBlank();
    }

    /**
     * Verifies a token for the given action.
     *
     * @return the reCAPTCHA score, or empty when verification is disabled;
     *         errors with {@link RecaptchaException} when the token is missing,
     *         invalid, scored below the threshold, or cannot be checked
     */
    public Mono<Double> verify(String token, String action) {
        if (!enabled) {
            log.debug("reCAPTCHA verification is disabled, skipping");
            return Mono.empty();
        }
        if (token == null || token.isBlank()) {
            log.warn("reCAPTCHA token is missing for action: {}", action);
            return Mono.error(new RecaptchaException(FAILED));
        }

        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("secret", secretKey);
        form.add("response", token);

        return webClient.post()
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(BodyInserters.fromFormData(form))
                .retrieve()
                .bodyToMono(RecaptchaResponse.class)
                .timeout(timeout)
                .transformDeferred(CircuitBreakerOperator.of(circuitBreaker))
                .flatMap(response -> {
                    if (!response.success()) {
                        log.warn("reCAPTCHA verification failed for action '{}': errors={}", action, response.errorCodes());
                        return Mono.<Double>error(new RecaptchaException(FAILED));
                    }
                    // a token minted for another form must not be replayed here
                    if (action != null && response.action() != null && !action.equals(response.action())) {
                        log.warn("reCAPTCHA action mismatch: expected='{}', got='{}'", action, response.action());
                        return Mono.<Double>error(new RecaptchaException(FAILED));
                    }
                    if (response.score() < scoreThreshold) {
                        log.warn("reCAPTCHA score too low for action '{}': score={}, threshold={}",
                                action, response.score(), scoreThreshold);
                        return Mono.<Double>error(new RecaptchaException(FAILED));
                    }
                    log.debug("reCAPTCHA verified for action '{}': score={}", action, response.score());
                    return Mono.just(response.score());
                })
                .onErrorResume(e -> !(e instanceof RecaptchaException), e -> {
                    log.error("reCAPTCHA verification error for action '{}': {}", action, e.getMessage());
                    return Mono.error(new RecaptchaException("reCAPTCHA verification unavailable. Please try again later."));
                });
    }

    private record RecaptchaResponse(boolean success, double score, String action, List<String> errorCodes) {

        @JsonCreator
        RecaptchaResponse(
                @JsonProperty("success") boolean success,
                @JsonProperty("score") double score,
                @JsonProperty("action") String action,
                @JsonProperty("error-codes") List<String> errorCodes) {
            this.success = success;
            this.score = score;
            this.action = action;
            this.errorCodes = errorCodes;
        }
    }

    public static class RecaptchaException extends RuntimeException {
        public RecaptchaException(String message) {
            super(message);
        }
    }
}
