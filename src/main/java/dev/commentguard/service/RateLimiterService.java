package dev.commentguard.service;

import dev.commentguard.config.CommentModerationConfig;
import dev.commentguard.config.ResilienceConfig;
import dev.commentguard.entity.CommentTargetType;
import dev.commentguard.entity.RateLimitWindow;
import dev.commentguard.repository.RateLimitRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Per (ip hash, target) submission counter over a fixed window.
 * <p>
 * Check and increment are separate round trips, so two concurrent submissions
 * for the same key may both pass; under-counting is accepted. Storage errors
 * fail open: the submission is allowed and the error logged.
 * </p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RateLimiterService {

    /** Bucket for submissions whose client IP could not be determined. */
    static final String UNKNOWN_KEY = "unknown";

    private final RateLimitRepository rateLimitRepository;
    private final CommentModerationConfig config;
    private final ResilienceConfig resilience;
    private final IdService idService;
    private final Clock clock;

    public record RateLimitStatus(boolean allowed, int remaining, Instant resetTime) {
    }

    public Mono<RateLimitStatus> check(String ipHash, CommentTargetType targetType, String targetId) {
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime since = now.minus(config.getRateLimitWindow());
        int max = config.getMaxPerWindow();

        return rateLimitRepository.findLatestWindow(key(ipHash), targetType.value(), targetId, since)
                .timeout(resilience.getDatabaseTimeout())
                .map(window -> new RateLimitStatus(
                        window.getCount() < max,
                        Math.max(0, max - window.getCount()),
                        toInstant(window.getWindowStart().plus(config.getRateLimitWindow()))))
                .defaultIfEmpty(new RateLimitStatus(true, max, toInstant(now.plus(config.getRateLimitWindow()))))
                .onErrorResume(e -> {
                    log.warn("Rate limit check failed, allowing submission: {}", e.getMessage());
                    return Mono.just(new RateLimitStatus(true, max, toInstant(now.plus(config.getRateLimitWindow()))));
                });
    }

    /**
     * Counts one submission against the current window, opening a new window when none is live.
     */
    public Mono<Void> increment(String ipHash, CommentTargetType targetType, String targetId) {
        LocalDateTime now = LocalDateTime.now(clock);
        String key = key(ipHash);

        return rateLimitRepository.findLatestWindow(key, targetType.value(), targetId, now.minus(config.getRateLimitWindow()))
                .flatMap(window -> rateLimitRepository.incrementCount(window.getId()).thenReturn(window))
                .switchIfEmpty(Mono.defer(() -> rateLimitRepository.save(RateLimitWindow.builder()
                        .id(idService.nextId())
                        .ipHash(key)
                        .targetType(targetType.value())
                        .targetId(targetId)
                        .windowStart(now)
                        .count(1)
                        .build())))
                .timeout(resilience.getDatabaseTimeout())
                .doOnError(e -> log.warn("Rate limit increment failed for {}:{}: {}",
                        targetType.value(), targetId, e.getMessage()))
                .onErrorResume(e -> Mono.empty())
                .then();
    }

    /**
     * Deletes windows older than the sweep cutoff.
     *
     * @return number of rows removed
     */
    public Mono<Integer> sweep() {
        LocalDateTime cutoff = LocalDateTime.now(clock).minus(config.getSweepCutoff());
        return rateLimitRepository.deleteOlderThan(cutoff)
                .defaultIfEmpty(0)
                .doOnNext(removed -> log.info("Rate limit sweep removed {} windows older than {}", removed, cutoff));
    }

    private static String key(String ipHash) {
        return ipHash != null ? ipHash : UNKNOWN_KEY;
    }

    private static Instant toInstant(LocalDateTime dateTime) {
        return dateTime.toInstant(ZoneOffset.UTC);
    }
}
