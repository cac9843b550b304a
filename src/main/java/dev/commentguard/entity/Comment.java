package dev.commentguard.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Transient;
import org.springframework.data.domain.Persistable;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Public-safe comment row. Submitter email, IP hash and classifier output
 * live only in {@link CommentModeration}.
 */
@Table("comments")
@Getter
@Setter
@ToString
@EqualsAndHashCode(of = "id")
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Comment implements Persistable<Long>, NewRecordAware {

    @Id
    private Long id;

    @Transient
    @Builder.Default
    private boolean newRecord = true;

    @Override
    public boolean isNew() {
        return newRecord;
    }

    @Column("target_type")
    private String targetType;

    @Column("target_id")
    private String targetId;

    @Column("parent_id")
    private Long parentId;

    // Opaque account id, only used for ownership checks
    @Column("user_id")
    private String userId;

    @Column("user_display_name")
    private String userDisplayName;

    @Column("user_avatar_url")
    private String userAvatarUrl;

    private String content;

    @Column("is_approved")
    @Builder.Default
    private boolean approved = false;

    @Column("is_spam")
    @Builder.Default
    private boolean spam = false;

    @Column("like_count")
    @Builder.Default
    private int likeCount = 0;

    @Column("created_at")
    private LocalDateTime createdAt;

    @Column("updated_at")
    private LocalDateTime updatedAt;

    public boolean isVisible() {
        return approved && !spam;
    }
}
