package dev.commentguard.service;

import dev.commentguard.config.ResilienceConfig;
import dev.commentguard.dto.BlacklistEntryRequest;
import dev.commentguard.entity.BlacklistEntry;
import dev.commentguard.entity.BlacklistType;
import dev.commentguard.exception.ResourceNotFoundException;
import dev.commentguard.repository.BlacklistRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("BlacklistService")
class BlacklistServiceTest {

    @Mock
    private BlacklistRepository blacklistRepository;

    @Mock
    private IdService idService;

    private BlacklistService blacklistService;

    @BeforeEach
    void setUp() {
        blacklistService = new BlacklistService(blacklistRepository, new ResilienceConfig(10, 5), idService,
                Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC));
    }

    private static BlacklistEntry entry(BlacklistType type, String value) {
        return BlacklistEntry.builder().id(1L).type(type.value()).value(value).newRecord(false).build();
    }

    /**
     * Answers exact-match lookups from the given table, keyed by type then value.
     */
    private void givenEntries(Map<BlacklistType, List<String>> table, List<String> keywords) {
        lenient().when(blacklistRepository.findFirstMatch(anyString(), anyCollection())).thenAnswer(inv -> {
            BlacklistType type = BlacklistType.fromValue(inv.getArgument(0)).orElseThrow();
            Collection<String> values = inv.getArgument(1);
            return Flux.fromIterable(table.getOrDefault(type, List.of()))
                    .filter(values::contains)
                    .map(v -> entry(type, v))
                    .next();
        });
        lenient().when(blacklistRepository.findByType(BlacklistType.KEYWORD.value()))
                .thenReturn(Flux.fromIterable(keywords).map(k -> entry(BlacklistType.KEYWORD, k)));
    }

    @Nested
    @DisplayName("check()")
    class Check {

        @Test
        @DisplayName("should match email case-insensitively")
        void shouldMatchEmail() {
            givenEntries(Map.of(BlacklistType.EMAIL, List.of("spammer@example.com")), List.of());

            StepVerifier.create(blacklistService.check("  Spammer@Example.COM ", "1.2.3.4", "hash", "hello"))
                    .assertNext(match -> {
                        assertThat(match.matched()).isTrue();
                        assertThat(match.type()).isEqualTo(BlacklistType.EMAIL);
                        assertThat(match.reason()).isEqualTo("Email blacklisted");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should match the email domain")
        void shouldMatchDomain() {
            givenEntries(Map.of(BlacklistType.DOMAIN, List.of("spam.io")), List.of());

            StepVerifier.create(blacklistService.check("bob@spam.io", null, null, "hello"))
                    .assertNext(match -> assertThat(match.reason()).isEqualTo("Email domain blacklisted: spam.io"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should match either the raw IP or its hash")
        void shouldMatchIp() {
            givenEntries(Map.of(BlacklistType.IP, List.of("abc123")), List.of());

            StepVerifier.create(blacklistService.check(null, "9.9.9.9", "ABC123", "hello"))
                    .assertNext(match -> assertThat(match.reason()).isEqualTo("IP blacklisted"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should match keywords as substrings")
        void shouldMatchKeyword() {
            givenEntries(Map.of(), List.of("casino"));

            StepVerifier.create(blacklistService.check(null, null, null, "Best CASINOS online"))
                    .assertNext(match -> {
                        assertThat(match.type()).isEqualTo(BlacklistType.KEYWORD);
                        assertThat(match.reason()).isEqualTo("Blacklisted keyword: casino");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should prefer the email rule over later rules")
        void shouldPreferEmail() {
            givenEntries(Map.of(
                    BlacklistType.EMAIL, List.of("a@b.com"),
                    BlacklistType.IP, List.of("1.1.1.1")), List.of("spam"));

            StepVerifier.create(blacklistService.check("a@b.com", "1.1.1.1", null, "spam"))
                    .assertNext(match -> assertThat(match.type()).isEqualTo(BlacklistType.EMAIL))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should report no match for clean submissions")
        void shouldNotMatch() {
            givenEntries(Map.of(), List.of("casino"));

            StepVerifier.create(blacklistService.check("ok@fine.org", "1.2.3.4", "hash", "a kind comment"))
                    .assertNext(match -> assertThat(match.matched()).isFalse())
                    .verifyComplete();
        }

        @Test
        @DisplayName("should fail open when the lookup errors")
        void shouldFailOpen() {
            when(blacklistRepository.findFirstMatch(anyString(), anyCollection()))
                    .thenReturn(Mono.error(new RuntimeException("db down")));
            when(blacklistRepository.findByType(anyString())).thenReturn(Flux.empty());

            StepVerifier.create(blacklistService.check("a@b.com", null, null, "hi"))
                    .assertNext(match -> assertThat(match.matched()).isFalse())
                    .verifyComplete();
        }

        @Test
        @DisplayName("should cache keywords between checks")
        void shouldCacheKeywords() {
            givenEntries(Map.of(), List.of("casino"));

            blacklistService.check(null, null, null, "first").block();
            blacklistService.check(null, null, null, "second").block();

            verify(blacklistRepository, times(1)).findByType(BlacklistType.KEYWORD.value());
        }
    }

    @Nested
    @DisplayName("administration")
    class Administration {

        @Test
        @DisplayName("should normalise and store a new entry")
        void shouldCreate() {
            when(blacklistRepository.existsByTypeAndValue("email", "bad@example.com")).thenReturn(Mono.just(false));
            when(idService.nextId()).thenReturn(99L);
            when(blacklistRepository.save(any(BlacklistEntry.class))).thenAnswer(inv -> Mono.just(inv.getArgument(0)));

            BlacklistEntryRequest request = BlacklistEntryRequest.builder()
                    .type("EMAIL").value("  Bad@Example.com ").reason("abuse").build();

            StepVerifier.create(blacklistService.create(request))
                    .assertNext(response -> {
                        assertThat(response.getId()).isEqualTo("99");
                        assertThat(response.getType()).isEqualTo("email");
                        assertThat(response.getValue()).isEqualTo("bad@example.com");
                    })
                    .verifyComplete();

            ArgumentCaptor<BlacklistEntry> captor = ArgumentCaptor.forClass(BlacklistEntry.class);
            verify(blacklistRepository).save(captor.capture());
            assertThat(captor.getValue().getReason()).isEqualTo("abuse");
            assertThat(captor.getValue().getCreatedAt()).isNotNull();
        }

        @Test
        @DisplayName("should refuse duplicates")
        void shouldRefuseDuplicate() {
            when(blacklistRepository.existsByTypeAndValue("keyword", "casino")).thenReturn(Mono.just(true));

            BlacklistEntryRequest request = BlacklistEntryRequest.builder().type("keyword").value("Casino").build();

            StepVerifier.create(blacklistService.create(request))
                    .expectErrorMatches(e -> e instanceof IllegalArgumentException
                            && e.getMessage().equals("Blacklist entry already exists"))
                    .verify();
            verify(blacklistRepository, never()).save(any());
        }

        @Test
        @DisplayName("should drop cached keywords after a write")
        void shouldInvalidateCacheOnCreate() {
            givenEntries(Map.of(), List.of());
            blacklistService.check(null, null, null, "casino night").block();

            when(blacklistRepository.existsByTypeAndValue("keyword", "casino")).thenReturn(Mono.just(false));
            when(idService.nextId()).thenReturn(5L);
            when(blacklistRepository.save(any(BlacklistEntry.class))).thenAnswer(inv -> Mono.just(inv.getArgument(0)));
            blacklistService.create(BlacklistEntryRequest.builder().type("keyword").value("casino").build()).block();

            blacklistService.check(null, null, null, "casino night").block();

            verify(blacklistRepository, times(2)).findByType(BlacklistType.KEYWORD.value());
        }

        @Test
        @DisplayName("should fail with not found when deleting an unknown entry")
        void shouldFailDeleteUnknown() {
            when(blacklistRepository.findById(404L)).thenReturn(Mono.empty());

            StepVerifier.create(blacklistService.delete(404L))
                    .expectError(ResourceNotFoundException.class)
                    .verify();
        }

        @Test
        @DisplayName("should delete an existing entry")
        void shouldDelete() {
            BlacklistEntry existing = entry(BlacklistType.IP, "1.2.3.4");
            when(blacklistRepository.findById(1L)).thenReturn(Mono.just(existing));
            when(blacklistRepository.delete(existing)).thenReturn(Mono.empty());

            StepVerifier.create(blacklistService.delete(1L)).verifyComplete();

            verify(blacklistRepository).delete(existing);
        }

        @Test
        @DisplayName("should page entries")
        void shouldList() {
            when(blacklistRepository.findAllPaginated(10, 10))
                    .thenReturn(Flux.just(entry(BlacklistType.DOMAIN, "spam.io")));
            when(blacklistRepository.count()).thenReturn(Mono.just(11L));

            StepVerifier.create(blacklistService.list(1, 10))
                    .assertNext(page -> {
                        assertThat(page.getContent()).hasSize(1);
                        assertThat(page.getTotalPages()).isEqualTo(2);
                        assertThat(page.isLast()).isTrue();
                    })
                    .verifyComplete();
        }
    }
}
