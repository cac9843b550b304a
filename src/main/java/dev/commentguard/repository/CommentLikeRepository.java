package dev.commentguard.repository;

import dev.commentguard.entity.CommentLike;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

import java.util.Collection;

@Repository
public interface CommentLikeRepository extends ReactiveCrudRepository<CommentLike, Long> {

    @Query("SELECT comment_id FROM comment_likes WHERE visitor_id = :visitorId AND comment_id IN (:commentIds)")
    Flux<Long> findLikedCommentIds(String visitorId, Collection<Long> commentIds);
}
