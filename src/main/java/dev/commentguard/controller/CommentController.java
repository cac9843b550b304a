package dev.commentguard.controller;

import dev.commentguard.dto.CommentRequest;
import dev.commentguard.dto.CommentResponse;
import dev.commentguard.dto.CommentSubmissionResponse;
import dev.commentguard.dto.CommentUpdateRequest;
import dev.commentguard.entity.CommentDecision;
import dev.commentguard.entity.CommentTargetType;
import dev.commentguard.security.CommentUser;
import dev.commentguard.service.CommentService;
import dev.commentguard.util.IpAddressExtractor;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/v1/comments")
@RequiredArgsConstructor
@Validated
@Tag(name = "Comments", description = "Public comment threads and submissions")
@Slf4j
public class CommentController {

    private static final String TARGET_TYPE_REGEX = "^(post|gallery_item)$";

    private final CommentService commentService;

    @GetMapping
    @Operation(summary = "Get the comment thread of a target", description = "Approved, non-spam comments as a reply tree")
    public Mono<List<CommentResponse>> getComments(
            @RequestParam @Pattern(regexp = TARGET_TYPE_REGEX, message = "Invalid target type") String targetType,
            @RequestParam @NotBlank @Size(max = 64) String targetId,
            @RequestHeader(value = "X-Visitor-Id", required = false) @Size(max = 64)
            @Pattern(regexp = "^[a-zA-Z0-9-]*$", message = "Visitor ID must contain only alphanumeric characters and dashes")
            @Parameter(description = "Anonymous visitor id for like flags") String visitorId,
            @AuthenticationPrincipal CommentUser viewer) {
        log.debug("Fetching comments for {}:{}", targetType, targetId);
        return commentService.getCommentTree(target(targetType), targetId, visitorId, viewer);
    }

    @GetMapping("/count")
    @Operation(summary = "Count visible comments of a target")
    public Mono<Long> getCommentCount(
            @RequestParam @Pattern(regexp = TARGET_TYPE_REGEX, message = "Invalid target type") String targetType,
            @RequestParam @NotBlank @Size(max = 64) String targetId) {
        return commentService.countVisible(target(targetType), targetId);
    }

    @PostMapping
    @Operation(summary = "Submit a comment", description = "Runs spam checks and stores the comment when accepted")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Comment stored (approved, pending or spam)"),
            @ApiResponse(responseCode = "400", description = "Comment rejected or invalid request"),
            @ApiResponse(responseCode = "429", description = "Too many comments"),
            @ApiResponse(responseCode = "500", description = "Comment could not be stored")
    })
    public Mono<ResponseEntity<CommentSubmissionResponse>> createComment(
            @Valid @RequestBody CommentRequest request,
            @AuthenticationPrincipal CommentUser user,
            ServerHttpRequest httpRequest) {
        String clientIp = IpAddressExtractor.extractClientIp(httpRequest);
        String userAgent = httpRequest.getHeaders().getFirst(HttpHeaders.USER_AGENT);
        String referrer = httpRequest.getHeaders().getFirst(HttpHeaders.REFERER);
        log.info("Comment submitted on {}:{}", request.getTargetType(), request.getTargetId());
        return commentService.createComment(request, user, clientIp, userAgent, referrer)
                .map(response -> ResponseEntity.status(statusFor(response)).body(response));
    }

    @PatchMapping("/{id}")
    @Operation(summary = "Edit own comment")
    public Mono<CommentResponse> updateComment(
            @PathVariable Long id,
            @Valid @RequestBody CommentUpdateRequest request,
            @AuthenticationPrincipal CommentUser user) {
        return commentService.updateComment(id, request, user);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    @Operation(summary = "Delete own comment")
    public Mono<Void> deleteComment(@PathVariable Long id, @AuthenticationPrincipal CommentUser user) {
        return commentService.deleteComment(id, user);
    }

    static HttpStatus statusFor(CommentSubmissionResponse response) {
        CommentDecision decision = response.getDecision();
        if (decision == null) {
            return HttpStatus.INTERNAL_SERVER_ERROR;
        }
        return switch (decision) {
            case REJECT -> HttpStatus.BAD_REQUEST;
            case RATE_LIMITED -> HttpStatus.TOO_MANY_REQUESTS;
            default -> HttpStatus.CREATED;
        };
    }

    private static CommentTargetType target(String targetType) {
        return CommentTargetType.fromValue(targetType)
                .orElseThrow(() -> new IllegalArgumentException("Invalid target type"));
    }
}
