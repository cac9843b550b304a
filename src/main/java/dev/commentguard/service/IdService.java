package dev.commentguard.service;

import dev.commentguard.util.SnowflakeId;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Hands out Snowflake ids for new rows:
 * <pre>
 * Comment comment = Comment.builder()
 *     .id(idService.nextId())
 *     .content(content)
 *     .build();
 * </pre>
 */
@Service
@RequiredArgsConstructor
public class IdService {

    private final SnowflakeId snowflakeId;

    public long nextId() {
        return snowflakeId.nextId();
    }
}
