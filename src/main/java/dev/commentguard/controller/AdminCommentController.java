package dev.commentguard.controller;

import dev.commentguard.dto.AdminCommentResponse;
import dev.commentguard.dto.BulkModerationRequest;
import dev.commentguard.dto.ModerationActionResponse;
import dev.commentguard.dto.PageResponse;
import dev.commentguard.service.CommentModerationService;
import dev.commentguard.service.CommentModerationService.QueueFilter;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/admin/comments")
@RequiredArgsConstructor
@PreAuthorize("hasAnyRole('ADMIN', 'MODERATOR')")
@Validated
@Tag(name = "Comment moderation", description = "Moderation queue and state transitions")
@Slf4j
public class AdminCommentController {

    private final CommentModerationService moderationService;

    @GetMapping
    @Operation(summary = "List comments with moderation data")
    public Mono<PageResponse<AdminCommentResponse>> getQueue(
            @RequestParam(defaultValue = "pending")
            @Pattern(regexp = "^(?i)(all|pending|approved|spam)$", message = "Status must be all, pending, approved or spam")
            String status,
            @RequestParam(defaultValue = "0") @Min(0) int page,
            @RequestParam(defaultValue = "20") @Min(1) @Max(100) int size) {
        log.debug("Fetching moderation queue: status={}, page={}, size={}", status, page, size);
        return moderationService.listQueue(QueueFilter.parse(status), page, size);
    }

    @RequestMapping(value = "/{id}/approve", method = {RequestMethod.PUT, RequestMethod.PATCH})
    public Mono<ResponseEntity<ModerationActionResponse>> approve(@PathVariable Long id) {
        log.info("Approving comment: id={}", id);
        return moderationService.approve(id).map(AdminCommentController::toEntity);
    }

    @RequestMapping(value = "/{id}/spam", method = {RequestMethod.PUT, RequestMethod.PATCH})
    public Mono<ResponseEntity<ModerationActionResponse>> markSpam(@PathVariable Long id) {
        log.info("Marking comment as spam: id={}", id);
        return moderationService.markSpam(id).map(AdminCommentController::toEntity);
    }

    @DeleteMapping("/{id}")
    public Mono<ResponseEntity<ModerationActionResponse>> delete(@PathVariable Long id) {
        log.info("Deleting comment: id={}", id);
        return moderationService.delete(id).map(AdminCommentController::toEntity);
    }

    @PostMapping("/bulk/approve")
    public Mono<ResponseEntity<ModerationActionResponse>> bulkApprove(@Valid @RequestBody BulkModerationRequest request) {
        log.info("Bulk approving {} comments", request.getIds().size());
        return moderationService.bulkApprove(request.getIds()).map(AdminCommentController::toEntity);
    }

    @PostMapping("/bulk/spam")
    public Mono<ResponseEntity<ModerationActionResponse>> bulkMarkSpam(@Valid @RequestBody BulkModerationRequest request) {
        log.info("Bulk marking {} comments as spam", request.getIds().size());
        return moderationService.bulkMarkSpam(request.getIds()).map(AdminCommentController::toEntity);
    }

    @PostMapping("/bulk/delete")
    public Mono<ResponseEntity<ModerationActionResponse>> bulkDelete(@Valid @RequestBody BulkModerationRequest request) {
        log.info("Bulk deleting {} comments", request.getIds().size());
        return moderationService.bulkDelete(request.getIds()).map(AdminCommentController::toEntity);
    }

    static ResponseEntity<ModerationActionResponse> toEntity(ModerationActionResponse response) {
        HttpStatus status = response.isSuccess() ? HttpStatus.OK : HttpStatus.INTERNAL_SERVER_ERROR;
        return ResponseEntity.status(status).body(response);
    }
}
