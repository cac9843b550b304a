package dev.commentguard.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import dev.commentguard.config.ResilienceConfig;
import dev.commentguard.dto.BlacklistEntryRequest;
import dev.commentguard.dto.BlacklistEntryResponse;
import dev.commentguard.dto.PageResponse;
import dev.commentguard.entity.BlacklistEntry;
import dev.commentguard.entity.BlacklistType;
import dev.commentguard.exception.ResourceNotFoundException;
import dev.commentguard.repository.BlacklistRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Admin-curated deny list for comment submitters.
 * <p>
 * Email, domain and IP entries are exact, case-insensitive lookups; keyword
 * entries match by substring against the lower-cased body. Lookup failures
 * fail open. Keywords are cached briefly and the cache is dropped on every
 * admin write.
 * </p>
 */
@Service
@Slf4j
public class BlacklistService {

    private static final String KEYWORDS_KEY = "keywords";

    private final BlacklistRepository blacklistRepository;
    private final ResilienceConfig resilience;
    private final IdService idService;
    private final Clock clock;

    private final Cache<String, List<String>> keywordCache = Caffeine.newBuilder()
            .maximumSize(1)
            .expireAfterWrite(Duration.ofSeconds(60))
            .build();

    public BlacklistService(BlacklistRepository blacklistRepository, ResilienceConfig resilience,
                            IdService idService, Clock clock) {
        this.blacklistRepository = blacklistRepository;
        this.resilience = resilience;
        this.idService = idService;
        this.clock = clock;
    }

    public record BlacklistMatch(boolean matched, BlacklistType type, String reason) {

        static final BlacklistMatch NONE = new BlacklistMatch(false, null, null);

        static BlacklistMatch of(BlacklistType type, String reason) {
            return new BlacklistMatch(true, type, reason);
        }
    }

    /**
     * @param email   submitter email, may be null
     * @param rawIp   client IP as extracted from the request, may be null
     * @param ipHash  salted hash of the client IP, may be null
     * @param content sanitized comment body
     */
    public Mono<BlacklistMatch> check(String email, String rawIp, String ipHash, String content) {
        String normalizedEmail = BlacklistEntry.normalize(email);
        String domain = emailDomain(normalizedEmail);

        List<String> ipValues = new ArrayList<>(2);
        if (rawIp != null && !rawIp.isBlank()) ipValues.add(BlacklistEntry.normalize(rawIp));
        if (ipHash != null) ipValues.add(ipHash.toLowerCase(Locale.ROOT));

        return Flux.concat(
                        lookup(BlacklistType.EMAIL, normalizedEmail == null ? List.of() : List.of(normalizedEmail),
                                "Email blacklisted"),
                        lookup(BlacklistType.DOMAIN, domain == null ? List.of() : List.of(domain),
                                "Email domain blacklisted: " + domain),
                        lookup(BlacklistType.IP, ipValues, "IP blacklisted"),
                        matchKeywords(content))
                .next()
                .defaultIfEmpty(BlacklistMatch.NONE)
                .timeout(resilience.getDatabaseTimeout())
                .onErrorResume(e -> {
                    log.warn("Blacklist lookup failed, treating as no match: {}", e.getMessage());
                    return Mono.just(BlacklistMatch.NONE);
                });
    }

    private Mono<BlacklistMatch> lookup(BlacklistType type, List<String> values, String reason) {
        if (values.isEmpty()) {
            return Mono.empty();
        }
        return blacklistRepository.findFirstMatch(type.value(), values)
                .map(entry -> BlacklistMatch.of(type, reason));
    }

    private Mono<BlacklistMatch> matchKeywords(String content) {
        if (content == null || content.isEmpty()) {
            return Mono.empty();
        }
        String lower = content.toLowerCase(Locale.ROOT);
        return keywords()
                .flatMap(keywords -> Mono.justOrEmpty(keywords.stream()
                        .filter(keyword -> !keyword.isEmpty() && lower.contains(keyword))
                        .findFirst()))
                .map(keyword -> BlacklistMatch.of(BlacklistType.KEYWORD, "Blacklisted keyword: " + keyword));
    }

    private Mono<List<String>> keywords() {
        List<String> cached = keywordCache.getIfPresent(KEYWORDS_KEY);
        if (cached != null) {
            return Mono.just(cached);
        }
        return blacklistRepository.findByType(BlacklistType.KEYWORD.value())
                .map(BlacklistEntry::getValue)
                .collectList()
                .doOnNext(list -> keywordCache.put(KEYWORDS_KEY, List.copyOf(list)));
    }

    // ==================== ADMINISTRATION ====================

    public Mono<PageResponse<BlacklistEntryResponse>> list(int page, int size) {
        return blacklistRepository.findAllPaginated(size, page * size)
                .map(BlacklistEntryResponse::from)
                .collectList()
                .zipWith(blacklistRepository.count())
                .map(tuple -> PageResponse.of(tuple.getT1(), page, size, tuple.getT2()));
    }

    public Mono<BlacklistEntryResponse> create(BlacklistEntryRequest request) {
        BlacklistType type = BlacklistType.fromValue(request.getType())
                .orElseThrow(() -> new IllegalArgumentException("Unknown blacklist type: " + request.getType()));
        String value = BlacklistEntry.normalize(request.getValue());
        if (value == null || value.isEmpty()) {
            return Mono.error(new IllegalArgumentException("Blacklist value must not be empty"));
        }

        return blacklistRepository.existsByTypeAndValue(type.value(), value)
                .flatMap(exists -> {
                    if (exists) {
                        return Mono.error(new IllegalArgumentException("Blacklist entry already exists"));
                    }
                    return blacklistRepository.save(BlacklistEntry.builder()
                            .id(idService.nextId())
                            .type(type.value())
                            .value(value)
                            .reason(request.getReason())
                            .createdAt(LocalDateTime.now(clock))
                            .build());
                })
                .doOnNext(saved -> {
                    keywordCache.invalidateAll();
                    log.info("Blacklist entry added: id={}, type={}", saved.getId(), saved.getType());
                })
                .map(BlacklistEntryResponse::from);
    }

    public Mono<Void> delete(Long id) {
        return blacklistRepository.findById(id)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Blacklist entry", id)))
                .flatMap(entry -> blacklistRepository.delete(entry)
                        .doOnSuccess(v -> {
                            keywordCache.invalidateAll();
                            log.info("Blacklist entry removed: id={}, type={}", id, entry.getType());
                        }));
    }

    private static String emailDomain(String email) {
        if (email == null) {
            return null;
        }
        int at = email.lastIndexOf('@');
        return at >= 0 && at < email.length() - 1 ? email.substring(at + 1) : null;
    }
}
