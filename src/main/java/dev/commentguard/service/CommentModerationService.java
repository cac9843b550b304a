package dev.commentguard.service;

import dev.commentguard.dto.AdminCommentResponse;
import dev.commentguard.dto.ModerationActionResponse;
import dev.commentguard.dto.PageResponse;
import dev.commentguard.entity.Comment;
import dev.commentguard.entity.CommentModeration;
import dev.commentguard.exception.ResourceNotFoundException;
import dev.commentguard.repository.CommentModerationRepository;
import dev.commentguard.repository.CommentRepository;
import dev.commentguard.service.SpamClassifierService.ClassifierRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Moderator operations on stored comments.
 * <p>
 * Approving a comment flagged as spam reports it to the classifier as ham;
 * marking a non-spam comment as spam reports it as spam. Feedback is sent
 * in the background and its outcome never affects the moderation result.
 * Bulk transitions are single statements and succeed or fail as a whole.
 * </p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CommentModerationService {

    private final CommentRepository commentRepository;
    private final CommentModerationRepository moderationRepository;
    private final SpamClassifierService classifier;
    private final Clock clock;

    public enum QueueFilter {
        ALL, PENDING, APPROVED, SPAM;

        public static QueueFilter parse(String raw) {
            return raw == null ? ALL : valueOf(raw.trim().toUpperCase(Locale.ROOT));
        }
    }

    public Mono<PageResponse<AdminCommentResponse>> listQueue(QueueFilter filter, int page, int size) {
        int offset = page * size;
        Flux<Comment> comments;
        Mono<Long> total;
        switch (filter) {
            case PENDING -> {
                comments = commentRepository.findPending(size, offset);
                total = commentRepository.countPending();
            }
            case APPROVED -> {
                comments = commentRepository.findApproved(size, offset);
                total = commentRepository.countApproved();
            }
            case SPAM -> {
                comments = commentRepository.findSpam(size, offset);
                total = commentRepository.countSpam();
            }
            default -> {
                comments = commentRepository.findAllPaginated(size, offset);
                total = commentRepository.count();
            }
        }

        return comments.collectList()
                .flatMap(list -> attachModeration(list).zipWith(total.defaultIfEmpty(0L)))
                .map(tuple -> PageResponse.of(tuple.getT1(), page, size, tuple.getT2()));
    }

    public Mono<ModerationActionResponse> approve(Long id) {
        return transition(id, true, false, "approve", "Comment approved");
    }

    public Mono<ModerationActionResponse> markSpam(Long id) {
        return transition(id, false, true, "mark spam", "Comment marked as spam");
    }

    public Mono<ModerationActionResponse> delete(Long id) {
        return commentRepository.findById(id)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Comment", id)))
                .flatMap(comment -> commentRepository.delete(comment))
                .doOnSuccess(v -> log.info("Comment deleted by moderator: id={}", id))
                .thenReturn(ModerationActionResponse.builder().success(true).message("Comment deleted").build())
                .onErrorResume(e -> !(e instanceof ResourceNotFoundException), e -> storageError("delete", e));
    }

    @Transactional
    public Mono<ModerationActionResponse> bulkApprove(List<Long> ids) {
        return bulk("approve", ids, () -> commentRepository.findAllById(ids)
                .filter(Comment::isSpam)
                .map(Comment::getId)
                .collectList()
                .flatMap(wasSpam -> commentRepository.approveAll(ids, LocalDateTime.now(clock))
                        .doOnNext(count -> sendFeedback(wasSpam, false))));
    }

    @Transactional
    public Mono<ModerationActionResponse> bulkMarkSpam(List<Long> ids) {
        return bulk("mark spam", ids, () -> commentRepository.findAllById(ids)
                .filter(comment -> !comment.isSpam())
                .map(Comment::getId)
                .collectList()
                .flatMap(wasHam -> commentRepository.markSpamAll(ids, LocalDateTime.now(clock))
                        .doOnNext(count -> sendFeedback(wasHam, true))));
    }

    @Transactional
    public Mono<ModerationActionResponse> bulkDelete(List<Long> ids) {
        return bulk("delete", ids, () -> commentRepository.deleteAllByIdIn(ids));
    }

    private Mono<ModerationActionResponse> bulk(String action, List<Long> ids, Supplier<Mono<Integer>> update) {
        if (ids == null || ids.isEmpty()) {
            return Mono.just(ModerationActionResponse.error("No comment ids given"));
        }
        return Mono.defer(update)
                .defaultIfEmpty(0)
                .map(count -> {
                    log.info("Bulk {}: {} of {} comments updated", action, count, ids.size());
                    return ModerationActionResponse.ok("Bulk " + action + " completed", count);
                })
                .onErrorResume(e -> storageError("bulk " + action, e));
    }

    private Mono<ModerationActionResponse> transition(Long id, boolean approved, boolean spam,
                                                      String action, String message) {
        return commentRepository.findById(id)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Comment", id)))
                .flatMap(comment -> {
                    boolean contradictsClassifier = comment.isSpam() != spam;
                    comment.setApproved(approved);
                    comment.setSpam(spam);
                    comment.setUpdatedAt(LocalDateTime.now(clock));
                    return commentRepository.save(comment)
                            .doOnNext(saved -> {
                                log.info("{}: id={}", message, id);
                                if (contradictsClassifier) {
                                    sendFeedback(List.of(id), spam);
                                }
                            });
                })
                .flatMap(saved -> moderationRepository.findByCommentId(id)
                        .map(record -> CommentModerationStore.toAdmin(saved, record))
                        .defaultIfEmpty(CommentModerationStore.toAdmin(saved, null)))
                .map(view -> ModerationActionResponse.ok(message, view))
                .onErrorResume(e -> !(e instanceof ResourceNotFoundException), e -> storageError(action, e));
    }

    /**
     * Replays the stored submission to the classifier. The client IP is not kept, so it is sent empty.
     */
    private void sendFeedback(Collection<Long> commentIds, boolean asSpam) {
        if (commentIds.isEmpty() || !classifier.isConfigured()) {
            return;
        }
        Flux.fromIterable(commentIds)
                .concatMap(commentId -> Mono.zip(commentRepository.findById(commentId),
                                moderationRepository.findByCommentId(commentId))
                        .flatMap(pair -> {
                            ClassifierRequest request = feedbackRequest(pair.getT1(), pair.getT2());
                            return asSpam ? classifier.reportSpam(request) : classifier.reportHam(request);
                        }))
                .subscribeOn(Schedulers.boundedElastic())
                .subscribe(
                        ok -> log.debug("Classifier feedback ({}) sent: {}", asSpam ? "spam" : "ham", ok),
                        error -> log.warn("Classifier feedback failed: {}", error.getMessage())
                );
    }

    private static ClassifierRequest feedbackRequest(Comment comment, CommentModeration record) {
        return ClassifierRequest.builder()
                .userIp("")
                .userAgent(record.getUserAgent())
                .permalink(record.getPermalink())
                .authorName(comment.getUserDisplayName())
                .authorEmail(record.getUserEmail())
                .content(comment.getContent())
                .build();
    }

    private Mono<List<AdminCommentResponse>> attachModeration(List<Comment> comments) {
        if (comments.isEmpty()) {
            return Mono.just(List.of());
        }
        List<Long> ids = comments.stream().map(Comment::getId).toList();
        return moderationRepository.findByCommentIdIn(ids)
                .collectMap(CommentModeration::getCommentId, Function.identity())
                .map(byComment -> toAdminViews(comments, byComment));
    }

    private static List<AdminCommentResponse> toAdminViews(List<Comment> comments, Map<Long, CommentModeration> byComment) {
        return comments.stream()
                .map(comment -> CommentModerationStore.toAdmin(comment, byComment.get(comment.getId())))
                .collect(Collectors.toList());
    }

    private Mono<ModerationActionResponse> storageError(String action, Throwable e) {
        log.error("Moderation action '{}' failed: {}", action, e.getMessage());
        return Mono.just(ModerationActionResponse.error("Failed to " + action.toLowerCase(Locale.ROOT)));
    }
}
