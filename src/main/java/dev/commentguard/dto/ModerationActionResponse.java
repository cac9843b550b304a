package dev.commentguard.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ModerationActionResponse {
    private boolean success;
    private String message;
    private String error;
    private Integer count;
    private AdminCommentResponse comment;

    public static ModerationActionResponse ok(String message, AdminCommentResponse comment) {
        return ModerationActionResponse.builder().success(true).message(message).comment(comment).build();
    }

    public static ModerationActionResponse ok(String message, int count) {
        return ModerationActionResponse.builder().success(true).message(message).count(count).build();
    }

    public static ModerationActionResponse error(String error) {
        return ModerationActionResponse.builder().success(false).error(error).build();
    }
}
