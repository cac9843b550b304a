package dev.commentguard.metrics;

import dev.commentguard.entity.CommentDecision;
import dev.commentguard.repository.CommentRepository;
import dev.commentguard.service.SpamClassifierService.ClassifierError;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("CommentMetrics")
class CommentMetricsTest {

    private SimpleMeterRegistry meterRegistry;

    @Mock
    private CommentRepository commentRepository;

    private CommentMetrics metrics;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        metrics = new CommentMetrics(meterRegistry, commentRepository);
        metrics.init();
    }

    @Test
    @DisplayName("should pre-register a counter per decision")
    void shouldPreRegisterCounters() {
        for (CommentDecision decision : CommentDecision.values()) {
            assertThat(meterRegistry.find("comments.decisions").tag("decision", decision.value()).counter())
                    .isNotNull();
        }
        assertThat(meterRegistry.find("comments.classifier.errors").counters()).hasSize(ClassifierError.values().length);
    }

    @Test
    @DisplayName("should count decisions by tag")
    void shouldCountDecisions() {
        metrics.recordDecision(CommentDecision.SPAM);
        metrics.recordDecision(CommentDecision.SPAM);
        metrics.recordDecision(CommentDecision.APPROVED);

        assertThat(meterRegistry.get("comments.decisions").tag("decision", "spam").counter().count()).isEqualTo(2.0);
        assertThat(meterRegistry.get("comments.decisions").tag("decision", "approved").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should count classifier errors by kind")
    void shouldCountClassifierErrors() {
        metrics.recordClassifierError(ClassifierError.TIMEOUT);

        assertThat(meterRegistry.get("comments.classifier.errors").tag("kind", "timeout").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should refresh the pending gauge")
    void shouldUpdatePendingGauge() {
        when(commentRepository.countPending()).thenReturn(Mono.just(7L));

        metrics.updateMetrics();

        assertThat(metrics.getPendingComments()).isEqualTo(7L);
        Gauge gauge = meterRegistry.get("comments.moderation.pending").gauge();
        assertThat(gauge.value()).isEqualTo(7.0);
    }

    @Test
    @DisplayName("should keep the last value when the refresh fails")
    void shouldSurviveRefreshFailure() {
        when(commentRepository.countPending()).thenReturn(Mono.error(new RuntimeException("db down")));

        metrics.updateMetrics();

        assertThat(metrics.getPendingComments()).isZero();
    }
}
