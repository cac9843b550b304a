package dev.commentguard.config;

import dev.commentguard.entity.CommentTargetType;
import dev.commentguard.util.DigestUtils;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Tunables of the comment submission pipeline, bound once at startup and
 * passed to every component that needs them.
 */
@Component
@Getter
@Slf4j
public class CommentModerationConfig {

    private final Duration rateLimitWindow;
    private final int maxPerWindow;
    private final int sweepMultiplier;
    private final int maxContentLength;
    private final int maxLinksBeforeModeration;
    private final ModerationMode moderationMode;
    private final boolean honeypotEnabled;
    private final String siteUrl;

    @Getter(lombok.AccessLevel.NONE)
    private final String ipHashSalt;

    public CommentModerationConfig(
            @Value("${comments.rate-limit.window-seconds:60}") int windowSeconds,
            @Value("${comments.rate-limit.max-per-window:3}") int maxPerWindow,
            @Value("${comments.rate-limit.sweep-multiplier:60}") int sweepMultiplier,
            @Value("${comments.max-content-length:4000}") int maxContentLength,
            @Value("${comments.max-links-before-moderation:2}") int maxLinksBeforeModeration,
            @Value("${comments.moderation-mode:auto}") String moderationMode,
            @Value("${comments.honeypot.enabled:true}") boolean honeypotEnabled,
            @Value("${comments.ip-hash-salt:}") String ipHashSalt,
            @Value("${comments.site-url:http://localhost:3000}") String siteUrl
    ) {
        if (windowSeconds <= 0 || maxPerWindow <= 0 || sweepMultiplier <= 0) {
            throw new IllegalStateException("Rate limit window, max and sweep multiplier must be positive");
        }
        this.rateLimitWindow = Duration.ofSeconds(windowSeconds);
        this.maxPerWindow = maxPerWindow;
        this.sweepMultiplier = sweepMultiplier;
        this.maxContentLength = maxContentLength;
        this.maxLinksBeforeModeration = maxLinksBeforeModeration;
        this.moderationMode = ModerationMode.parse(moderationMode);
        this.honeypotEnabled = honeypotEnabled;
        this.ipHashSalt = ipHashSalt == null ? "" : ipHashSalt;
        this.siteUrl = stripTrailingSlash(siteUrl);
        if (this.ipHashSalt.isBlank()) {
            log.warn("comments.ip-hash-salt is empty; IP hashes are unsalted");
        }
        log.info("Comment moderation configured: window={}s, max={}, mode={}, honeypot={}",
                windowSeconds, maxPerWindow, this.moderationMode, honeypotEnabled);
    }

    /**
     * Age beyond which rate-limit windows are deleted by the sweep.
     */
    public Duration getSweepCutoff() {
        return rateLimitWindow.multipliedBy(sweepMultiplier);
    }

    /**
     * Salted one-way hash of a client IP. Returns {@code null} for unknown addresses.
     */
    public String hashIp(String ip) {
        if (ip == null || ip.isBlank() || "unknown".equals(ip)) {
            return null;
        }
        return DigestUtils.sha256Hex(ip + ipHashSalt);
    }

    /**
     * Public URL of the content a comment is attached to, sent to the classifier.
     */
    public String permalinkFor(CommentTargetType targetType, String targetId) {
        return siteUrl + targetType.pathPrefix() + targetId;
    }

    private static String stripTrailingSlash(String url) {
        if (url == null) {
            return "";
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
