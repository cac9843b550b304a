package dev.commentguard.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Like written by the reactions feature; read here to flag "liked by me".
 */
@Table("comment_likes")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommentLike {

    @Id
    private Long id;

    @Column("comment_id")
    private Long commentId;

    @Column("visitor_id")
    private String visitorId;

    @Column("created_at")
    private LocalDateTime createdAt;
}
