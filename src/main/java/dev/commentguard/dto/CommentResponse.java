package dev.commentguard.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Public projection of a comment. Carries no submitter email, IP hash,
 * classifier output, account id or moderation flags.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CommentResponse {
    private String id;
    private String targetType;
    private String targetId;
    private String parentId;
    private String userDisplayName;
    private String userAvatarUrl;
    private String content;
    private int likeCount;
    private boolean likedByMe;
    private boolean mine;
    @Builder.Default
    private List<CommentResponse> replies = new ArrayList<>();
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
