package dev.commentguard.repository;

import dev.commentguard.entity.SpamDecisionLog;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface SpamDecisionLogRepository extends ReactiveCrudRepository<SpamDecisionLog, Long> {
}
