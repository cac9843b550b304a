package dev.commentguard.scheduler;

import dev.commentguard.service.RateLimiterService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically drops expired rate-limit windows.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RateLimitSweepScheduler {

    private final RateLimiterService rateLimiterService;

    @Scheduled(fixedRateString = "${scheduling.rate-limit-sweep-ms:3600000}", initialDelayString = "${scheduling.initial-delay-ms:30000}")
    public void sweepExpiredWindows() {
        log.debug("Sweeping expired rate limit windows...");
        rateLimiterService.sweep()
                .subscribe(
                        removed -> { },
                        error -> log.error("Rate limit sweep failed: {}", error.getMessage())
                );
    }
}
