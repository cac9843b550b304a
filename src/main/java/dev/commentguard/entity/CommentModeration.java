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

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Privileged shadow of a {@link Comment}: submitter email, salted IP hash and
 * classifier output. Readable by moderators only, never part of a public response.
 */
@Table("comment_moderation")
@Getter
@Setter
@ToString(exclude = {"userEmail", "ipHash"})
@EqualsAndHashCode(of = "id")
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommentModeration implements Persistable<Long>, NewRecordAware {

    @Id
    private Long id;

    @Transient
    @Builder.Default
    private boolean newRecord = true;

    @Override
    public boolean isNew() {
        return newRecord;
    }

    @Column("comment_id")
    private Long commentId;

    @Column("user_email")
    private String userEmail;

    @Column("ip_hash")
    private String ipHash;

    @Column("spam_score")
    private BigDecimal spamScore;

    @Column("spam_reason")
    private String spamReason;

    @Column("link_count")
    private int linkCount;

    @Column("user_agent")
    private String userAgent;

    private String permalink;

    @Column("created_at")
    private LocalDateTime createdAt;
}
