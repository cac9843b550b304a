package dev.commentguard.controller;

import dev.commentguard.dto.BlacklistEntryRequest;
import dev.commentguard.dto.BlacklistEntryResponse;
import dev.commentguard.dto.PageResponse;
import dev.commentguard.service.BlacklistService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/admin/comments/blacklist")
@RequiredArgsConstructor
@PreAuthorize("hasAnyRole('ADMIN', 'MODERATOR')")
@Validated
@Tag(name = "Comment blacklist", description = "Deny rules for commenters")
@Slf4j
public class AdminBlacklistController {

    private final BlacklistService blacklistService;

    @GetMapping
    @Operation(summary = "List blacklist entries")
    public Mono<PageResponse<BlacklistEntryResponse>> list(
            @RequestParam(defaultValue = "0") @Min(0) int page,
            @RequestParam(defaultValue = "50") @Min(1) @Max(200) int size) {
        return blacklistService.list(page, size);
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary = "Add a blacklist entry")
    public Mono<BlacklistEntryResponse> create(@Valid @RequestBody BlacklistEntryRequest request) {
        log.info("Adding blacklist entry of type {}", request.getType());
        return blacklistService.create(request);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    @Operation(summary = "Remove a blacklist entry")
    public Mono<Void> delete(@PathVariable Long id) {
        log.info("Removing blacklist entry: id={}", id);
        return blacklistService.delete(id);
    }
}
