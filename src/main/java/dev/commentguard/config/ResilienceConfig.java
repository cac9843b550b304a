package dev.commentguard.config;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralised timeouts for the two kinds of I/O on the submission path.
 *
 * <pre>
 * return rateLimitRepository.findLatestWindow(ipHash, type, id, since)
 *         .timeout(resilience.getDatabaseTimeout());
 * </pre>
 */
@Component
@Getter
@Slf4j
public class ResilienceConfig {

    private final Duration databaseTimeout;
    private final Duration classifierTimeout;

    public ResilienceConfig(
            @Value("${resilience.database.timeout-seconds:10}") int databaseTimeoutSeconds,
            @Value("${resilience.classifier.timeout-seconds:5}") int classifierTimeoutSeconds
    ) {
        this.databaseTimeout = Duration.ofSeconds(databaseTimeoutSeconds);
        this.classifierTimeout = Duration.ofSeconds(classifierTimeoutSeconds);
        log.info("Resilience configuration initialized (database={}s, classifier={}s)",
                databaseTimeoutSeconds, classifierTimeoutSeconds);
    }
}
