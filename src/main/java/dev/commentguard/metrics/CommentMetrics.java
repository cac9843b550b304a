package dev.commentguard.metrics;

import dev.commentguard.entity.CommentDecision;
import dev.commentguard.repository.CommentRepository;
import dev.commentguard.service.SpamClassifierService.ClassifierError;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

@Component
@RequiredArgsConstructor
@Slf4j
public class CommentMetrics {

    private final MeterRegistry meterRegistry;
    private final CommentRepository commentRepository;

    private final AtomicLong pendingComments = new AtomicLong(0);

    private final Map<CommentDecision, Counter> decisionCounters = new EnumMap<>(CommentDecision.class);
    private final Map<ClassifierError, Counter> classifierErrorCounters = new EnumMap<>(ClassifierError.class);

    @PostConstruct
    public void init() {
        Gauge.builder("comments.moderation.pending", pendingComments, AtomicLong::get)
                .description("Comments waiting for a moderator")
                .register(meterRegistry);

        // Pre-register so every tag shows up at zero
        for (CommentDecision decision : CommentDecision.values()) {
            decisionCounters.put(decision, Counter.builder("comments.decisions")
                    .description("Submission verdicts")
                    .tag("decision", decision.value())
                    .register(meterRegistry));
        }
        for (ClassifierError error : ClassifierError.values()) {
            classifierErrorCounters.put(error, Counter.builder("comments.classifier.errors")
                    .description("Spam classifier calls that fell back to ham")
                    .tag("kind", error.value())
                    .register(meterRegistry));
        }
    }

    public void recordDecision(CommentDecision decision) {
        Counter counter = decisionCounters.get(decision);
        if (counter != null) {
            counter.increment();
        }
    }

    public void recordClassifierError(ClassifierError error) {
        Counter counter = classifierErrorCounters.get(error);
        if (counter != null) {
            counter.increment();
        }
    }

    @Scheduled(fixedRateString = "${scheduling.metrics-update-ms:60000}", initialDelayString = "${scheduling.initial-delay-ms:30000}")
    public void updateMetrics() {
        commentRepository.countPending()
                .subscribe(
                        pendingComments::set,
                        error -> log.error("Failed to update comment metrics: {}", error.getMessage())
                );
    }

    long getPendingComments() {
        return pendingComments.get();
    }
}
