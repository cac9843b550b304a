package dev.commentguard.service;

import dev.commentguard.config.CommentModerationConfig;
import dev.commentguard.config.ModerationMode;
import dev.commentguard.entity.CommentDecision;
import dev.commentguard.entity.CommentTargetType;
import dev.commentguard.metrics.CommentMetrics;
import dev.commentguard.repository.CommentRepository;
import dev.commentguard.service.CommentSanitizerService.SanitizeResult;
import dev.commentguard.service.SpamClassifierService.ClassifierError;
import dev.commentguard.service.SpamClassifierService.ClassifierRequest;
import dev.commentguard.service.SpamClassifierService.ClassifierVerdict;
import lombok.Builder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Runs a submission through the fixed check sequence and returns one verdict.
 * <p>
 * Order: honeypot, sanitizer, blacklist, rate limit, CAPTCHA, classifier,
 * local review flags. The first three and the rate limit short-circuit
 * without touching the network. Once the rate-limit check passes the
 * submission is counted against the window, whatever the final verdict.
 * Every verdict, short-circuited or not, is written to the decision log.
 * </p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CommentDecisionEngine {

    static final String REASON_HONEYPOT = "Bot detected (honeypot)";
    static final String REASON_RATE_LIMITED = "Rate limit exceeded";
    static final String REASON_CAPTCHA_FAILED = "reCAPTCHA verification failed";
    static final String REASON_CAPTCHA_MISSING = "reCAPTCHA token missing";
    static final String REASON_CAPTCHA_MISCONFIGURED = "reCAPTCHA misconfigured (missing secret key)";
    static final String REASON_CLASSIFIER_DISCARD = "Flagged by Akismet (high confidence)";
    static final String REASON_CLASSIFIER_SPAM = "Flagged by Akismet";
    static final String REASON_REPETITIVE = "Repetitive content detected";
    static final String REASON_TOO_MANY_LINKS = "Too many links: ";
    static final String REASON_MODERATE_ALL = "All comments require moderation";
    static final String REASON_FIRST_TIME = "First-time commenter";

    private final CommentModerationConfig config;
    private final CommentSanitizerService sanitizer;
    private final BlacklistService blacklistService;
    private final RateLimiterService rateLimiter;
    private final RecaptchaService recaptchaService;
    private final SpamClassifierService classifier;
    private final CommentRepository commentRepository;
    private final CommentMetrics metrics;
    private final DecisionLogService decisionLog;

    /**
     * Everything the pipeline knows about one submission.
     */
    @Builder
    public record Submission(
            CommentTargetType targetType,
            String targetId,
            String content,
            String honeypot,
            String captchaToken,
            String userId,
            String displayName,
            String email,
            String clientIp,
            String userAgent,
            String referrer
    ) {
    }

    /**
     * Verdict plus the values the moderation record is built from.
     */
    @Builder
    public record DecisionResult(
            CommentDecision decision,
            String reason,
            String content,
            int linkCount,
            String ipHash,
            String classifierTip,
            BigDecimal spamScore,
            String permalink
    ) {
    }

    private record CaptchaOutcome(boolean failed, String reviewReason, Double score) {

        static final CaptchaOutcome SKIPPED = new CaptchaOutcome(false, null, null);

        static CaptchaOutcome review(String reason) {
            return new CaptchaOutcome(false, reason, null);
        }
    }

    public Mono<DecisionResult> decide(Submission submission) {
        return Mono.defer(() -> runPipeline(submission))
                .doOnNext(result -> {
                    metrics.recordDecision(result.decision());
                    log.debug("Comment on {}:{} decided {} ({})", submission.targetType().value(),
                            submission.targetId(), result.decision().value(), result.reason());
                })
                .flatMap(result -> decisionLog.record(submission, result).thenReturn(result));
    }

    private Mono<DecisionResult> runPipeline(Submission submission) {
        String ipHash = config.hashIp(submission.clientIp());
        String permalink = config.permalinkFor(submission.targetType(), submission.targetId());
        DecisionResult.DecisionResultBuilder base = DecisionResult.builder()
                .ipHash(ipHash)
                .permalink(permalink);

        if (config.isHoneypotEnabled() && StringUtils.hasText(submission.honeypot())) {
            return Mono.just(base.decision(CommentDecision.REJECT).reason(REASON_HONEYPOT).content("").build());
        }

        SanitizeResult sanitized = sanitizer.sanitize(submission.content(), config.getMaxContentLength());
        if (sanitized.rejected()) {
            return Mono.just(base.decision(CommentDecision.REJECT).reason(sanitized.rejectReason()).content("").build());
        }
        base.content(sanitized.content()).linkCount(sanitized.linkCount());

        return blacklistService.check(submission.email(), submission.clientIp(), ipHash, sanitized.content())
                .flatMap(match -> {
                    if (match.matched()) {
                        log.warn("Comment rejected by blacklist ({}), ipHash={}", match.type(), ipHash);
                        return Mono.just(base.decision(CommentDecision.REJECT).reason(match.reason()).build());
                    }
                    return rateLimiter.check(ipHash, submission.targetType(), submission.targetId())
                            .flatMap(status -> {
                                if (!status.allowed()) {
                                    return Mono.just(base.decision(CommentDecision.RATE_LIMITED)
                                            .reason(REASON_RATE_LIMITED).build());
                                }
                                return rateLimiter.increment(ipHash, submission.targetType(), submission.targetId())
                                        .then(Mono.defer(() -> verifyCaptcha(submission)))
                                        .flatMap(captcha -> classify(submission, sanitized, captcha, base));
                            });
                });
    }

    private Mono<CaptchaOutcome> verifyCaptcha(Submission submission) {
        if (!recaptchaService.isEnabled()) {
            return Mono.just(CaptchaOutcome.SKIPPED);
        }
        if (recaptchaService.isMisconfigured()) {
            return Mono.just(CaptchaOutcome.review(REASON_CAPTCHA_MISCONFIGURED));
        }
        if (!StringUtils.hasText(submission.captchaToken())) {
            return Mono.just(CaptchaOutcome.review(REASON_CAPTCHA_MISSING));
        }
        return recaptchaService.verify(submission.captchaToken(), RecaptchaService.COMMENT_ACTION)
                .map(score -> new CaptchaOutcome(false, null, score))
                .defaultIfEmpty(CaptchaOutcome.SKIPPED)
                .onErrorResume(RecaptchaService.RecaptchaException.class,
                        e -> Mono.just(new CaptchaOutcome(true, null, null)));
    }

    private Mono<DecisionResult> classify(Submission submission, SanitizeResult sanitized,
                                          CaptchaOutcome captcha, DecisionResult.DecisionResultBuilder base) {
        if (captcha.score() != null) {
            base.spamScore(BigDecimal.valueOf(captcha.score()).setScale(2, RoundingMode.HALF_UP));
        }
        if (captcha.failed()) {
            return Mono.just(base.decision(CommentDecision.REJECT).reason(REASON_CAPTCHA_FAILED).build());
        }

        ClassifierRequest request = ClassifierRequest.builder()
                .userIp(submission.clientIp())
                .userAgent(submission.userAgent())
                .referrer(submission.referrer())
                .permalink(config.permalinkFor(submission.targetType(), submission.targetId()))
                .authorName(submission.displayName())
                .authorEmail(submission.email())
                .content(sanitized.content())
                .build();

        return classifier.check(request)
                .flatMap(verdict -> {
                    recordClassifierError(verdict);
                    if (verdict.spam()) {
                        base.classifierTip(verdict.proTip());
                        return Mono.just(verdict.discard()
                                ? base.decision(CommentDecision.REJECT).reason(REASON_CLASSIFIER_DISCARD).build()
                                : base.decision(CommentDecision.SPAM).reason(REASON_CLASSIFIER_SPAM).build());
                    }
                    return reviewReason(submission, sanitized, captcha)
                            .map(reason -> base.decision(CommentDecision.PENDING).reason(reason).build())
                            .switchIfEmpty(Mono.fromSupplier(() -> base.decision(CommentDecision.APPROVED).build()));
                });
    }

    /**
     * First local flag that holds the comment for a moderator, or empty to publish.
     */
    private Mono<String> reviewReason(Submission submission, SanitizeResult sanitized, CaptchaOutcome captcha) {
        if (sanitizer.isRepetitive(sanitized.content())) {
            return Mono.just(REASON_REPETITIVE);
        }
        if (sanitized.linkCount() > config.getMaxLinksBeforeModeration()) {
            return Mono.just(REASON_TOO_MANY_LINKS + sanitized.linkCount());
        }
        if (captcha.reviewReason() != null) {
            return Mono.just(captcha.reviewReason());
        }
        ModerationMode mode = config.getModerationMode();
        if (mode == ModerationMode.ALL) {
            return Mono.just(REASON_MODERATE_ALL);
        }
        if (mode == ModerationMode.FIRST_TIME) {
            return hasApprovedBefore(submission.userId())
                    .flatMap(approvedBefore -> approvedBefore ? Mono.<String>empty() : Mono.just(REASON_FIRST_TIME));
        }
        return Mono.empty();
    }

    private Mono<Boolean> hasApprovedBefore(String userId) {
        if (userId == null) {
            return Mono.just(false);
        }
        return commentRepository.countApprovedByUserId(userId)
                .map(count -> count > 0)
                .defaultIfEmpty(false)
                .onErrorResume(e -> {
                    log.warn("Approved-comment lookup failed, holding for review: {}", e.getMessage());
                    return Mono.just(false);
                });
    }

    private void recordClassifierError(ClassifierVerdict verdict) {
        if (verdict.error() != null && verdict.error() != ClassifierError.NOT_CONFIGURED) {
            metrics.recordClassifierError(verdict.error());
        }
    }
}
