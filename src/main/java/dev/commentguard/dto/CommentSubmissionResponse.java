package dev.commentguard.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.commentguard.entity.CommentDecision;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Outcome of a comment submission")
public class CommentSubmissionResponse {

    public static final String FAILURE_MESSAGE = "Failed to submit comment. Please try again.";

    private boolean success;

    @Schema(description = "reject, rate_limited, spam, pending or approved; absent when the write failed")
    private CommentDecision decision;

    private String message;

    @Schema(description = "Public projection, present only for persisted outcomes")
    private CommentResponse comment;

    public static CommentSubmissionResponse of(CommentDecision decision, CommentResponse comment) {
        return CommentSubmissionResponse.builder()
                .success(decision.isPersisted())
                .decision(decision)
                .message(decision.message())
                .comment(comment)
                .build();
    }

    public static CommentSubmissionResponse failure() {
        return CommentSubmissionResponse.builder()
                .success(false)
                .message(FAILURE_MESSAGE)
                .build();
    }
}
