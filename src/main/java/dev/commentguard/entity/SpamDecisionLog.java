package dev.commentguard.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Transient;
import org.springframework.data.domain.Persistable;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * One row per submission verdict, including the ones that were never stored as comments.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("spam_decision_log")
public class SpamDecisionLog implements Persistable<Long>, NewRecordAware {

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

    @Column("decision")
    private String decision;

    @Column("reason")
    private String reason;

    @Column("link_count")
    private int linkCount;

    @Column("akismet_tip")
    private String akismetTip;

    @Column("recaptcha_score")
    private BigDecimal recaptchaScore;

    @Column("ip_hash")
    private String ipHash;

    @Column("created_at")
    private LocalDateTime createdAt;
}
