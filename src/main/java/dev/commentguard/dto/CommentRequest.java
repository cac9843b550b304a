package dev.commentguard.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "New comment submission")
public class CommentRequest {

    @NotBlank(message = "Target type is required")
    @Pattern(regexp = "^(post|gallery_item)$", message = "Target type must be post or gallery_item")
    private String targetType;

    @NotBlank(message = "Target id is required")
    @Size(max = 64, message = "Target id must be at most 64 characters")
    private String targetId;

    // Length is enforced by the sanitizer, which truncates instead of failing
    @NotBlank(message = "Content is required")
    @Size(max = 20000, message = "Content is too long")
    private String content;

    private Long parentId;

    @Schema(description = "Hidden form field, must be left empty")
    @Size(max = 500)
    private String honeypot;

    private String recaptchaToken;
}
