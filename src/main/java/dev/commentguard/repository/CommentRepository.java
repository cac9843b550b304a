package dev.commentguard.repository;

import dev.commentguard.entity.Comment;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.Collection;

@Repository
public interface CommentRepository extends ReactiveCrudRepository<Comment, Long> {

    // ==================== PUBLIC READS (approved, not spam) ====================

    @Query("SELECT * FROM comments WHERE target_type = :targetType AND target_id = :targetId AND is_approved = TRUE AND is_spam = FALSE ORDER BY created_at ASC, id ASC")
    Flux<Comment> findVisibleByTarget(String targetType, String targetId);

    @Query("SELECT COUNT(*) FROM comments WHERE target_type = :targetType AND target_id = :targetId AND is_approved = TRUE AND is_spam = FALSE")
    Mono<Long> countVisibleByTarget(String targetType, String targetId);

    @Query("SELECT COUNT(*) FROM comments WHERE user_id = :userId AND is_approved = TRUE AND is_spam = FALSE")
    Mono<Long> countApprovedByUserId(String userId);

    @Query("SELECT id FROM comments WHERE id IN (:ids) AND user_id = :userId")
    Flux<Long> findIdsOwnedBy(Collection<Long> ids, String userId);

    // ==================== MODERATION QUEUE ====================

    @Query("SELECT * FROM comments ORDER BY created_at DESC LIMIT :limit OFFSET :offset")
    Flux<Comment> findAllPaginated(int limit, int offset);

    @Query("SELECT * FROM comments WHERE is_approved = FALSE AND is_spam = FALSE ORDER BY created_at DESC LIMIT :limit OFFSET :offset")
    Flux<Comment> findPending(int limit, int offset);

    @Query("SELECT * FROM comments WHERE is_approved = TRUE AND is_spam = FALSE ORDER BY created_at DESC LIMIT :limit OFFSET :offset")
    Flux<Comment> findApproved(int limit, int offset);

    @Query("SELECT * FROM comments WHERE is_spam = TRUE ORDER BY created_at DESC LIMIT :limit OFFSET :offset")
    Flux<Comment> findSpam(int limit, int offset);

    @Query("SELECT COUNT(*) FROM comments WHERE is_approved = FALSE AND is_spam = FALSE")
    Mono<Long> countPending();

    @Query("SELECT COUNT(*) FROM comments WHERE is_approved = TRUE AND is_spam = FALSE")
    Mono<Long> countApproved();

    @Query("SELECT COUNT(*) FROM comments WHERE is_spam = TRUE")
    Mono<Long> countSpam();

    // ==================== BULK TRANSITIONS ====================

    @Modifying
    @Query("UPDATE comments SET is_approved = TRUE, is_spam = FALSE, updated_at = :now WHERE id IN (:ids)")
    Mono<Integer> approveAll(Collection<Long> ids, LocalDateTime now);

    @Modifying
    @Query("UPDATE comments SET is_approved = FALSE, is_spam = TRUE, updated_at = :now WHERE id IN (:ids)")
    Mono<Integer> markSpamAll(Collection<Long> ids, LocalDateTime now);

    @Modifying
    @Query("DELETE FROM comments WHERE id IN (:ids)")
    Mono<Integer> deleteAllByIdIn(Collection<Long> ids);
}
