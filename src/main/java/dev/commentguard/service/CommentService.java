package dev.commentguard.service;

import dev.commentguard.config.CommentModerationConfig;
import dev.commentguard.dto.CommentRequest;
import dev.commentguard.dto.CommentResponse;
import dev.commentguard.dto.CommentSubmissionResponse;
import dev.commentguard.dto.CommentUpdateRequest;
import dev.commentguard.entity.Comment;
import dev.commentguard.entity.CommentTargetType;
import dev.commentguard.exception.ResourceNotFoundException;
import dev.commentguard.repository.CommentLikeRepository;
import dev.commentguard.repository.CommentRepository;
import dev.commentguard.security.CommentUser;
import dev.commentguard.service.CommentDecisionEngine.Submission;
import dev.commentguard.service.CommentSanitizerService.SanitizeResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Public comment operations: reading threads, submitting, and owner edits.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CommentService {

    private final CommentRepository commentRepository;
    private final CommentLikeRepository commentLikeRepository;
    private final CommentDecisionEngine decisionEngine;
    private final CommentModerationStore moderationStore;
    private final CommentSanitizerService sanitizer;
    private final CommentModerationConfig config;
    private final Clock clock;

    /**
     * Visible comments of a target as a reply tree.
     *
     * @param visitorId anonymous visitor id used for "liked by me", may be null
     * @param viewer    signed-in user used for "mine", may be null
     */
    public Mono<List<CommentResponse>> getCommentTree(CommentTargetType targetType, String targetId,
                                                      String visitorId, CommentUser viewer) {
        return commentRepository.findVisibleByTarget(targetType.value(), targetId)
                .map(CommentModerationStore::toPublic)
                .collectList()
                .flatMap(flat -> {
                    List<CommentResponse> tree = CommentTreeBuilder.buildTree(flat);
                    List<Long> ids = CommentTreeBuilder.collectIds(tree);
                    return Mono.zip(likedIds(visitorId, ids), ownedIds(viewer, ids))
                            .map(flags -> {
                                CommentTreeBuilder.attachLikedByMe(tree, flags.getT1());
                                CommentTreeBuilder.attachOwnership(tree, flags.getT2());
                                return tree;
                            });
                });
    }

    public Mono<Long> countVisible(CommentTargetType targetType, String targetId) {
        return commentRepository.countVisibleByTarget(targetType.value(), targetId)
                .defaultIfEmpty(0L);
    }

    /**
     * Runs a submission through the decision pipeline and stores it when the verdict allows.
     * Rejections and throttling are results, not errors; only a failed comment write
     * yields {@link CommentSubmissionResponse#failure()}.
     */
    public Mono<CommentSubmissionResponse> createComment(CommentRequest request, CommentUser user,
                                                        String clientIp, String userAgent, String referrer) {
        CommentTargetType targetType = CommentTargetType.fromValue(request.getTargetType())
                .orElseThrow(() -> new IllegalArgumentException("Unsupported target type: " + request.getTargetType()));

        Submission submission = Submission.builder()
                .targetType(targetType)
                .targetId(request.getTargetId())
                .content(request.getContent())
                .honeypot(request.getHoneypot())
                .captchaToken(request.getRecaptchaToken())
                .userId(user.userId())
                .displayName(sanitizer.cleanDisplayName(user.displayName()))
                .email(user.email())
                .clientIp(clientIp)
                .userAgent(userAgent)
                .referrer(referrer)
                .build();

        return validateParent(request.getParentId(), targetType, request.getTargetId())
                .then(decisionEngine.decide(submission))
                .flatMap(result -> {
                    if (!result.decision().isPersisted()) {
                        return Mono.just(CommentSubmissionResponse.of(result.decision(), null));
                    }
                    return moderationStore.persist(submission, result, user.avatarUrl(), request.getParentId())
                            .map(saved -> {
                                log.info("Comment created: id={}, target={}:{}, decision={}", saved.getId(),
                                        saved.getTargetType(), saved.getTargetId(), result.decision().value());
                                CommentResponse response = CommentModerationStore.toPublic(saved);
                                response.setMine(true);
                                return CommentSubmissionResponse.of(result.decision(), response);
                            })
                            .onErrorResume(e -> Mono.just(CommentSubmissionResponse.failure()));
                });
    }

    public Mono<CommentResponse> updateComment(Long id, CommentUpdateRequest request, CommentUser user) {
        return findOwned(id, user)
                .flatMap(comment -> {
                    SanitizeResult sanitized = sanitizer.sanitize(request.getContent(), config.getMaxContentLength());
                    if (sanitized.rejected()) {
                        log.warn("Edit of comment {} rejected: {}", id, sanitized.rejectReason());
                        return Mono.error(new IllegalArgumentException("Comment content was rejected"));
                    }
                    comment.setContent(sanitized.content());
                    comment.setUpdatedAt(LocalDateTime.now(clock));
                    return commentRepository.save(comment);
                })
                .doOnNext(saved -> log.info("Comment edited by owner: id={}", saved.getId()))
                .map(saved -> {
                    CommentResponse response = CommentModerationStore.toPublic(saved);
                    response.setMine(true);
                    return response;
                });
    }

    /**
     * Deletes an owned comment; replies and the moderation record go with it.
     */
    public Mono<Void> deleteComment(Long id, CommentUser user) {
        return findOwned(id, user)
                .flatMap(comment -> commentRepository.delete(comment)
                        .doOnSuccess(v -> log.info("Comment deleted by owner: id={}", id)));
    }

    private Mono<Comment> findOwned(Long id, CommentUser user) {
        return commentRepository.findById(id)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Comment", id)))
                .flatMap(comment -> {
                    if (user == null || comment.getUserId() == null || !comment.getUserId().equals(user.userId())) {
                        return Mono.error(new AccessDeniedException("Not the author of this comment"));
                    }
                    return Mono.just(comment);
                });
    }

    private Mono<Void> validateParent(Long parentId, CommentTargetType targetType, String targetId) {
        if (parentId == null) {
            return Mono.empty();
        }
        return commentRepository.findById(parentId)
                .filter(parent -> targetType.matches(parent.getTargetType()) && targetId.equals(parent.getTargetId()))
                .switchIfEmpty(Mono.error(new IllegalArgumentException("Parent comment not found on this target")))
                .then();
    }

    private Mono<Set<Long>> likedIds(String visitorId, List<Long> ids) {
        if (visitorId == null || visitorId.isBlank() || ids.isEmpty()) {
            return Mono.just(Set.of());
        }
        return commentLikeRepository.findLikedCommentIds(visitorId, ids)
                .collect(Collectors.toSet());
    }

    private Mono<Set<Long>> ownedIds(CommentUser viewer, List<Long> ids) {
        return moderationStore.findOwnedCommentIds(ids, viewer == null ? null : viewer.userId());
    }
}
