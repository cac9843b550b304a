package dev.commentguard.repository;

import dev.commentguard.entity.BlacklistEntry;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;

@Repository
public interface BlacklistRepository extends ReactiveCrudRepository<BlacklistEntry, Long> {

    @Query("SELECT * FROM comment_blacklist WHERE type = :type AND entry_value IN (:values) LIMIT 1")
    Mono<BlacklistEntry> findFirstMatch(String type, Collection<String> values);

    @Query("SELECT * FROM comment_blacklist WHERE type = :type ORDER BY created_at DESC")
    Flux<BlacklistEntry> findByType(String type);

    Mono<Boolean> existsByTypeAndValue(String type, String value);

    @Query("SELECT * FROM comment_blacklist ORDER BY created_at DESC LIMIT :limit OFFSET :offset")
    Flux<BlacklistEntry> findAllPaginated(int limit, int offset);
}
