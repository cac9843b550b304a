package dev.commentguard.service;

import dev.commentguard.config.ResilienceConfig;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Akismet client used as the third-party spam classifier.
 * <p>
 * A blank API key means "not configured": no request is made and every
 * comment is treated as ham. Timeouts, transport errors and an open circuit
 * also yield ham with the error recorded, so a degraded Akismet never blocks
 * a submission. Feedback calls ({@code submit-spam}/{@code submit-ham})
 * report success as a boolean and never raise.
 * </p>
 */
@Service
@Slf4j
public class SpamClassifierService {

    static final String PRO_TIP_HEADER = "X-akismet-pro-tip";
    static final String DEBUG_HELP_HEADER = "X-akismet-debug-help";
    public static final String PRO_TIP_DISCARD = "discard";

    private static final String COMMENT_TYPE = "comment";

    private final WebClient webClient;
    private final String apiKey;
    private final String blogUrl;
    private final Duration timeout;
    private final CircuitBreaker circuitBreaker;

    public SpamClassifierService(
            WebClient.Builder webClientBuilder,
            ResilienceConfig resilience,
            @Value("${akismet.api-key:}") String apiKey,
            @Value("${akismet.blog-url:}") String blogUrl,
            @Value("${akismet.base-url:https://rest.akismet.com}") String baseUrl) {
        this.apiKey = apiKey == null ? "" : apiKey.trim();
        this.blogUrl = blogUrl;
        this.timeout = resilience.getClassifierTimeout();
        this.webClient = webClientBuilder.baseUrl(keyedBaseUrl(baseUrl, this.apiKey)).build();

        CircuitBreakerConfig cbConfig = CircuitBreakerConfig.custom()
                .failureRateThreshold(50)
                .waitDurationInOpenState(Duration.ofSeconds(60))
                .slidingWindowSize(10)
                .minimumNumberOfCalls(5)
                .build();
        this.circuitBreaker = CircuitBreaker.of("akismet", cbConfig);

        if (isConfigured()) {
            log.info("Akismet classifier configured (timeout={}ms)", timeout.toMillis());
        } else {
            log.warn("Akismet API key not set; comments will not be classified");
        }
    }

    public enum ClassifierError {
        NOT_CONFIGURED("not_configured"),
        TIMEOUT("timeout"),
        REQUEST_FAILED("request_failed");

        private final String value;

        ClassifierError(String value) {
            this.value = value;
        }

        public String value() {
            return value;
        }
    }

    /**
     * Fields sent to Akismet for a check or a feedback report.
     */
    @Builder
    public record ClassifierRequest(
            String userIp,
            String userAgent,
            String referrer,
            String permalink,
            String authorName,
            String authorEmail,
            String content
    ) {
    }

    public record ClassifierVerdict(boolean configured, boolean spam, String proTip, ClassifierError error) {

        static ClassifierVerdict notConfigured() {
            return new ClassifierVerdict(false, false, null, ClassifierError.NOT_CONFIGURED);
        }

        static ClassifierVerdict failed(ClassifierError error) {
            return new ClassifierVerdict(true, false, null, error);
        }

        public boolean discard() {
            return spam && PRO_TIP_DISCARD.equalsIgnoreCase(proTip);
        }
    }

    public boolean isConfigured() {
        return !apiKey.isEmpty();
    }

    public Mono<ClassifierVerdict> check(ClassifierRequest request) {
        if (!isConfigured()) {
            return Mono.just(ClassifierVerdict.notConfigured());
        }
        return webClient.post()
                .uri("/1.1/comment-check")
                .body(BodyInserters.fromFormData(toForm(request)))
                .exchangeToMono(this::readVerdict)
                .timeout(timeout)
                .transformDeferred(CircuitBreakerOperator.of(circuitBreaker))
                .onErrorResume(e -> {
                    ClassifierError error = e instanceof TimeoutException
                            ? ClassifierError.TIMEOUT
                            : ClassifierError.REQUEST_FAILED;
                    if (e instanceof CallNotPermittedException) {
                        log.warn("Akismet circuit open, skipping classification");
                    } else {
                        log.warn("Akismet check failed ({}): {}", error.value(), e.getMessage());
                    }
                    return Mono.just(ClassifierVerdict.failed(error));
                });
    }

    public Mono<Boolean> reportSpam(ClassifierRequest request) {
        return submitFeedback("/1.1/submit-spam", request);
    }

    public Mono<Boolean> reportHam(ClassifierRequest request) {
        return submitFeedback("/1.1/submit-ham", request);
    }

    private Mono<ClassifierVerdict> readVerdict(ClientResponse response) {
        if (!response.statusCode().is2xxSuccessful()) {
            return response.releaseBody()
                    .then(Mono.<ClassifierVerdict>error(new IllegalStateException(
                            "Akismet returned HTTP " + response.statusCode().value())));
        }
        String proTip = response.headers().asHttpHeaders().getFirst(PRO_TIP_HEADER);
        String debugHelp = response.headers().asHttpHeaders().getFirst(DEBUG_HELP_HEADER);
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .flatMap(body -> switch (body.trim()) {
                    case "true" -> Mono.just(new ClassifierVerdict(true, true, proTip, null));
                    case "false" -> Mono.just(new ClassifierVerdict(true, false, null, null));
                    default -> Mono.<ClassifierVerdict>error(new IllegalStateException(
                            "Unexpected Akismet response: " + (debugHelp != null ? debugHelp : body)));
                });
    }

    private Mono<Boolean> submitFeedback(String path, ClassifierRequest request) {
        if (!isConfigured()) {
            log.debug("Akismet not configured, skipping feedback {}", path);
            return Mono.just(false);
        }
        return webClient.post()
                .uri(path)
                .body(BodyInserters.fromFormData(toForm(request)))
                .exchangeToMono(response -> response.releaseBody()
                        .thenReturn(response.statusCode().is2xxSuccessful()))
                .timeout(timeout)
                .doOnNext(ok -> {
                    if (ok) {
                        log.info("Akismet feedback {} accepted", path);
                    } else {
                        log.warn("Akismet feedback {} rejected", path);
                    }
                })
                .onErrorResume(e -> {
                    log.warn("Akismet feedback {} failed: {}", path, e.getMessage());
                    return Mono.just(false);
                });
    }

    private MultiValueMap<String, String> toForm(ClassifierRequest request) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("blog", blogUrl);
        form.add("user_ip", nullToEmpty(request.userIp()));
        form.add("user_agent", nullToEmpty(request.userAgent()));
        form.add("referrer", nullToEmpty(request.referrer()));
        form.add("permalink", nullToEmpty(request.permalink()));
        form.add("comment_type", COMMENT_TYPE);
        form.add("comment_author", nullToEmpty(request.authorName()));
        form.add("comment_author_email", nullToEmpty(request.authorEmail()));
        form.add("comment_content", nullToEmpty(request.content()));
        return form;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    /**
     * {@code https://rest.akismet.com} becomes {@code https://{key}.rest.akismet.com}.
     */
    static String keyedBaseUrl(String baseUrl, String apiKey) {
        if (apiKey == null || apiKey.isEmpty()) {
            return baseUrl;
        }
        int schemeEnd = baseUrl.indexOf("://");
        if (schemeEnd < 0) {
            return baseUrl;
        }
        return baseUrl.substring(0, schemeEnd + 3) + apiKey + "." + baseUrl.substring(schemeEnd + 3);
    }
}
