package dev.commentguard.service;

import dev.commentguard.entity.SpamDecisionLog;
import dev.commentguard.repository.SpamDecisionLogRepository;
import dev.commentguard.service.CommentDecisionEngine.DecisionResult;
import dev.commentguard.service.CommentDecisionEngine.Submission;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Writes every verdict of the decision engine to {@code spam_decision_log}, so a
 * rejected or throttled submission still leaves a trace of why it was refused.
 * Writes are best-effort and never fail the submission.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DecisionLogService {

    private final SpamDecisionLogRepository decisionLogRepository;
    private final IdService idService;
    private final Clock clock;

    public Mono<Void> record(Submission submission, DecisionResult result) {
        return Mono.fromCallable(() -> SpamDecisionLog.builder()
                        .id(idService.nextId())
                        .targetType(submission.targetType().value())
                        .targetId(submission.targetId())
                        .decision(result.decision().value())
                        .reason(result.reason())
                        .linkCount(result.linkCount())
                        .akismetTip(result.classifierTip())
                        .recaptchaScore(result.spamScore())
                        .ipHash(result.ipHash())
                        .createdAt(LocalDateTime.now(clock))
                        .build())
                .flatMap(decisionLogRepository::save)
                .doOnError(e -> log.warn("Failed to write decision log for {}:{}: {}",
                        submission.targetType().value(), submission.targetId(), e.getMessage()))
                .onErrorResume(e -> Mono.empty())
                .then();
    }
}
