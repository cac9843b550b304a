package dev.commentguard.service;

import dev.commentguard.config.ResilienceConfig;
import dev.commentguard.dto.AdminCommentResponse;
import dev.commentguard.dto.CommentResponse;
import dev.commentguard.entity.Comment;
import dev.commentguard.entity.CommentModeration;
import dev.commentguard.repository.CommentModerationRepository;
import dev.commentguard.repository.CommentRepository;
import dev.commentguard.service.CommentDecisionEngine.DecisionResult;
import dev.commentguard.service.CommentDecisionEngine.Submission;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Writes an accepted comment as two rows: the public-safe {@link Comment}
 * and the privileged {@link CommentModeration} shadow.
 * <p>
 * The two inserts are not transactional. A failed comment
 * insert fails the submission; a failed moderation insert is logged and the
 * comment stays published without its shadow.
 * </p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CommentModerationStore {

    private final CommentRepository commentRepository;
    private final CommentModerationRepository moderationRepository;
    private final ResilienceConfig resilience;
    private final IdService idService;
    private final Clock clock;

    /**
     * Persists a comment whose verdict is one of the persisted decisions.
     *
     * @param avatarUrl submitter avatar, may be null
     * @param parentId  reply target, may be null
     */
    public Mono<Comment> persist(Submission submission, DecisionResult result, String avatarUrl, Long parentId) {
        if (!result.decision().isPersisted()) {
            return Mono.error(new IllegalStateException("Decision " + result.decision().value() + " is not persisted"));
        }
        LocalDateTime now = LocalDateTime.now(clock);
        Comment comment = Comment.builder()
                .id(idService.nextId())
                .targetType(submission.targetType().value())
                .targetId(submission.targetId())
                .parentId(parentId)
                .userId(submission.userId())
                .userDisplayName(submission.displayName())
                .userAvatarUrl(avatarUrl)
                .content(result.content())
                .approved(result.decision().isApproved())
                .spam(result.decision().isSpam())
                .likeCount(0)
                .createdAt(now)
                .updatedAt(now)
                .build();

        return commentRepository.save(comment)
                .timeout(resilience.getDatabaseTimeout())
                .doOnError(e -> log.error("Failed to insert comment on {}:{}: {}",
                        comment.getTargetType(), comment.getTargetId(), e.getMessage()))
                .flatMap(saved -> saveModeration(saved, submission, result, now).thenReturn(saved));
    }

    private Mono<Void> saveModeration(Comment saved, Submission submission, DecisionResult result, LocalDateTime now) {
        CommentModeration record = CommentModeration.builder()
                .id(idService.nextId())
                .commentId(saved.getId())
                .userEmail(submission.email())
                .ipHash(result.ipHash())
                .spamScore(result.spamScore())
                .spamReason(result.reason())
                .linkCount(result.linkCount())
                .userAgent(submission.userAgent())
                .permalink(result.permalink())
                .createdAt(now)
                .build();
        return moderationRepository.save(record)
                .timeout(resilience.getDatabaseTimeout())
                .doOnError(e -> log.error("Comment {} stored without moderation record: {}", saved.getId(), e.getMessage()))
                .onErrorResume(e -> Mono.empty())
                .then();
    }

    /**
     * Subset of {@code commentIds} written by {@code userId}.
     */
    public Mono<Set<Long>> findOwnedCommentIds(Collection<Long> commentIds, String userId) {
        if (userId == null || commentIds.isEmpty()) {
            return Mono.just(Set.of());
        }
        return commentRepository.findIdsOwnedBy(commentIds, userId)
                .collect(Collectors.toSet());
    }

    // ==================== PROJECTIONS ====================

    public static CommentResponse toPublic(Comment comment) {
        return CommentResponse.builder()
                .id(String.valueOf(comment.getId()))
                .targetType(comment.getTargetType())
                .targetId(comment.getTargetId())
                .parentId(comment.getParentId() != null ? String.valueOf(comment.getParentId()) : null)
                .userDisplayName(comment.getUserDisplayName())
                .userAvatarUrl(comment.getUserAvatarUrl())
                .content(comment.getContent())
                .likeCount(comment.getLikeCount())
                .createdAt(comment.getCreatedAt())
                .updatedAt(comment.getUpdatedAt())
                .build();
    }

    /**
     * @param record moderation shadow, may be null when its insert failed
     */
    public static AdminCommentResponse toAdmin(Comment comment, CommentModeration record) {
        AdminCommentResponse.AdminCommentResponseBuilder builder = AdminCommentResponse.builder()
                .id(String.valueOf(comment.getId()))
                .targetType(comment.getTargetType())
                .targetId(comment.getTargetId())
                .parentId(comment.getParentId() != null ? String.valueOf(comment.getParentId()) : null)
                .userId(comment.getUserId())
                .userDisplayName(comment.getUserDisplayName())
                .userAvatarUrl(comment.getUserAvatarUrl())
                .content(comment.getContent())
                .approved(comment.isApproved())
                .spam(comment.isSpam())
                .status(statusOf(comment))
                .likeCount(comment.getLikeCount())
                .createdAt(comment.getCreatedAt())
                .updatedAt(comment.getUpdatedAt());
        if (record != null) {
            builder.userEmail(record.getUserEmail())
                    .ipHash(record.getIpHash())
                    .spamScore(record.getSpamScore())
                    .spamReason(record.getSpamReason())
                    .linkCount(record.getLinkCount())
                    .userAgent(record.getUserAgent())
                    .permalink(record.getPermalink());
        }
        return builder.build();
    }

    static String statusOf(Comment comment) {
        if (comment.isSpam()) return "spam";
        return comment.isApproved() ? "approved" : "pending";
    }
}
