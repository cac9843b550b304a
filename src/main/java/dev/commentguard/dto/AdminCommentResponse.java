package dev.commentguard.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Moderator view of a comment joined with its moderation record.
 * Never returned from a public endpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AdminCommentResponse {
    private String id;
    private String targetType;
    private String targetId;
    private String parentId;
    private String userId;
    private String userDisplayName;
    private String userAvatarUrl;
    private String content;
    private boolean approved;
    private boolean spam;
    private String status;
    private int likeCount;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    // from comment_moderation
    private String userEmail;
    private String ipHash;
    private BigDecimal spamScore;
    private String spamReason;
    private Integer linkCount;
    private String userAgent;
    private String permalink;
}
