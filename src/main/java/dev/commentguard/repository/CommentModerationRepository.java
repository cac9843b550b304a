package dev.commentguard.repository;

import dev.commentguard.entity.CommentModeration;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;

/**
 * Privileged access to {@code comment_moderation}. Only moderation services use this.
 */
@Repository
public interface CommentModerationRepository extends ReactiveCrudRepository<CommentModeration, Long> {

    Mono<CommentModeration> findByCommentId(Long commentId);

    @Query("SELECT * FROM comment_moderation WHERE comment_id IN (:commentIds)")
    Flux<CommentModeration> findByCommentIdIn(Collection<Long> commentIds);
}
