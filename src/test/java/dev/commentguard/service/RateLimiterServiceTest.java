package dev.commentguard.service;

import dev.commentguard.config.CommentModerationConfig;
import dev.commentguard.config.ResilienceConfig;
import dev.commentguard.entity.CommentTargetType;
import dev.commentguard.entity.RateLimitWindow;
import dev.commentguard.repository.RateLimitRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("RateLimiterService")
class RateLimiterServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final LocalDateTime NOW_LOCAL = LocalDateTime.ofInstant(NOW, ZoneOffset.UTC);

    @Mock
    private RateLimitRepository rateLimitRepository;

    @Mock
    private IdService idService;

    private RateLimiterService rateLimiterService;

    @BeforeEach
    void setUp() {
        CommentModerationConfig config = new CommentModerationConfig(
                60, 3, 60, 4000, 2, "auto", true, "salt", "https://example.com");
        ResilienceConfig resilience = new ResilienceConfig(10, 5);
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        rateLimiterService = new RateLimiterService(rateLimitRepository, config, resilience, idService, clock);
    }

    private RateLimitWindow window(int count, LocalDateTime start) {
        return RateLimitWindow.builder()
                .id(7L).ipHash("hash").targetType("post").targetId("p1")
                .windowStart(start).count(count).newRecord(false)
                .build();
    }

    @Nested
    @DisplayName("check() and increment() in sequence")
    class Sequence {

        private final AtomicReference<RateLimitWindow> stored = new AtomicReference<>();

        @BeforeEach
        void inMemoryWindow() {
            when(idService.nextId()).thenReturn(7L);
            when(rateLimitRepository.findLatestWindow(eq("hash"), eq("post"), eq("p1"), any()))
                    .thenAnswer(invocation -> {
                        LocalDateTime since = invocation.getArgument(3);
                        return Mono.justOrEmpty(stored.get())
                                .filter(window -> window.getWindowStart().isAfter(since));
                    });
            when(rateLimitRepository.save(any(RateLimitWindow.class))).thenAnswer(invocation -> {
                RateLimitWindow window = invocation.getArgument(0);
                window.setNewRecord(false);
                stored.set(window);
                return Mono.just(window);
            });
            when(rateLimitRepository.incrementCount(7L)).thenAnswer(invocation -> {
                RateLimitWindow window = stored.get();
                window.setCount(window.getCount() + 1);
                return Mono.just(1);
            });
        }

        private RateLimiterService.RateLimitStatus submit() {
            RateLimiterService.RateLimitStatus status =
                    rateLimiterService.check("hash", CommentTargetType.POST, "p1").block();
            if (status.allowed()) {
                rateLimiterService.increment("hash", CommentTargetType.POST, "p1").block();
            }
            return status;
        }

        @Test
        @DisplayName("should refuse the fourth submission within one window when the max is three")
        void shouldRefuseFourthSubmission() {
            assertThat(submit().remaining()).isEqualTo(3);
            assertThat(submit().remaining()).isEqualTo(2);
            assertThat(submit().remaining()).isEqualTo(1);

            RateLimiterService.RateLimitStatus fourth = submit();

            assertThat(fourth.allowed()).isFalse();
            assertThat(fourth.remaining()).isZero();
            assertThat(fourth.resetTime()).isEqualTo(NOW.plusSeconds(60));
            assertThat(stored.get().getCount()).isEqualTo(3);
            verify(rateLimitRepository, times(1)).save(any(RateLimitWindow.class));
        }
    }

    @Nested
    @DisplayName("check()")
    class Check {

        @Test
        @DisplayName("should allow a fresh key with the full quota")
        void shouldAllowFreshKey() {
            when(rateLimitRepository.findLatestWindow(eq("hash"), eq("post"), eq("p1"), any()))
                    .thenReturn(Mono.empty());

            StepVerifier.create(rateLimiterService.check("hash", CommentTargetType.POST, "p1"))
                    .assertNext(status -> {
                        assertThat(status.allowed()).isTrue();
                        assertThat(status.remaining()).isEqualTo(3);
                        assertThat(status.resetTime()).isEqualTo(NOW.plusSeconds(60));
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should deny when the live window is full")
        void shouldDenyWhenFull() {
            LocalDateTime start = NOW_LOCAL.minusSeconds(20);
            when(rateLimitRepository.findLatestWindow(eq("hash"), eq("post"), eq("p1"), any()))
                    .thenReturn(Mono.just(window(3, start)));

            StepVerifier.create(rateLimiterService.check("hash", CommentTargetType.POST, "p1"))
                    .assertNext(status -> {
                        assertThat(status.allowed()).isFalse();
                        assertThat(status.remaining()).isZero();
                        assertThat(status.resetTime()).isEqualTo(NOW.plusSeconds(40));
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should report remaining quota for a partly used window")
        void shouldReportRemaining() {
            when(rateLimitRepository.findLatestWindow(anyString(), anyString(), anyString(), any()))
                    .thenReturn(Mono.just(window(1, NOW_LOCAL.minusSeconds(5))));

            StepVerifier.create(rateLimiterService.check("hash", CommentTargetType.POST, "p1"))
                    .assertNext(status -> {
                        assertThat(status.allowed()).isTrue();
                        assertThat(status.remaining()).isEqualTo(2);
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should only look at windows started within the window length")
        void shouldQueryFromWindowStart() {
            when(rateLimitRepository.findLatestWindow(anyString(), anyString(), anyString(), any()))
                    .thenReturn(Mono.empty());

            rateLimiterService.check("hash", CommentTargetType.GALLERY_ITEM, "g1").block();

            verify(rateLimitRepository).findLatestWindow("hash", "gallery_item", "g1", NOW_LOCAL.minusSeconds(60));
        }

        @Test
        @DisplayName("should fail open on storage errors")
        void shouldFailOpen() {
            when(rateLimitRepository.findLatestWindow(anyString(), anyString(), anyString(), any()))
                    .thenReturn(Mono.error(new RuntimeException("db down")));

            StepVerifier.create(rateLimiterService.check("hash", CommentTargetType.POST, "p1"))
                    .assertNext(status -> assertThat(status.allowed()).isTrue())
                    .verifyComplete();
        }

        @Test
        @DisplayName("should bucket unknown clients under a shared key")
        void shouldUseUnknownKey() {
            when(rateLimitRepository.findLatestWindow(eq(RateLimiterService.UNKNOWN_KEY), anyString(), anyString(), any()))
                    .thenReturn(Mono.empty());

            StepVerifier.create(rateLimiterService.check(null, CommentTargetType.POST, "p1"))
                    .expectNextCount(1)
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("increment()")
    class Increment {

        @Test
        @DisplayName("should increment the live window")
        void shouldIncrementExisting() {
            when(rateLimitRepository.findLatestWindow(anyString(), anyString(), anyString(), any()))
                    .thenReturn(Mono.just(window(1, NOW_LOCAL.minusSeconds(10))));
            when(rateLimitRepository.incrementCount(7L)).thenReturn(Mono.just(1));

            StepVerifier.create(rateLimiterService.increment("hash", CommentTargetType.POST, "p1"))
                    .verifyComplete();

            verify(rateLimitRepository).incrementCount(7L);
            verify(rateLimitRepository, never()).save(any());
        }

        @Test
        @DisplayName("should open a new window with count one")
        void shouldOpenNewWindow() {
            when(rateLimitRepository.findLatestWindow(anyString(), anyString(), anyString(), any()))
                    .thenReturn(Mono.empty());
            when(idService.nextId()).thenReturn(42L);
            when(rateLimitRepository.save(any(RateLimitWindow.class)))
                    .thenAnswer(inv -> Mono.just(inv.getArgument(0)));

            StepVerifier.create(rateLimiterService.increment("hash", CommentTargetType.POST, "p1"))
                    .verifyComplete();

            ArgumentCaptor<RateLimitWindow> captor = ArgumentCaptor.forClass(RateLimitWindow.class);
            verify(rateLimitRepository).save(captor.capture());
            RateLimitWindow saved = captor.getValue();
            assertThat(saved.getId()).isEqualTo(42L);
            assertThat(saved.getCount()).isEqualTo(1);
            assertThat(saved.getWindowStart()).isEqualTo(NOW_LOCAL);
            assertThat(saved.getTargetType()).isEqualTo("post");
            verify(rateLimitRepository, never()).incrementCount(anyLong());
        }

        @Test
        @DisplayName("should swallow storage errors")
        void shouldSwallowErrors() {
            when(rateLimitRepository.findLatestWindow(anyString(), anyString(), anyString(), any()))
                    .thenReturn(Mono.error(new RuntimeException("db down")));

            StepVerifier.create(rateLimiterService.increment("hash", CommentTargetType.POST, "p1"))
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("sweep()")
    class Sweep {

        @Test
        @DisplayName("should delete windows older than window times multiplier")
        void shouldDeleteExpired() {
            when(rateLimitRepository.deleteOlderThan(any())).thenReturn(Mono.just(5));

            StepVerifier.create(rateLimiterService.sweep())
                    .expectNext(5)
                    .verifyComplete();

            verify(rateLimitRepository).deleteOlderThan(NOW_LOCAL.minusSeconds(3600));
        }
    }
}
