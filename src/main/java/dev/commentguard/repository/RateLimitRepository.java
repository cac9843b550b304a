package dev.commentguard.repository;

import dev.commentguard.entity.RateLimitWindow;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
public interface RateLimitRepository extends ReactiveCrudRepository<RateLimitWindow, Long> {

    @Query("SELECT * FROM comment_rate_limits WHERE ip_hash = :ipHash AND target_type = :targetType AND target_id = :targetId AND window_start > :since ORDER BY window_start DESC LIMIT 1")
    Mono<RateLimitWindow> findLatestWindow(String ipHash, String targetType, String targetId, LocalDateTime since);

    @Modifying
    @Query("UPDATE comment_rate_limits SET count = count + 1 WHERE id = :id")
    Mono<Integer> incrementCount(Long id);

    @Modifying
    @Query("DELETE FROM comment_rate_limits WHERE window_start < :cutoff")
    Mono<Integer> deleteOlderThan(LocalDateTime cutoff);
}
