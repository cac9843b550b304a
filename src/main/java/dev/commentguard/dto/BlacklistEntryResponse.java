package dev.commentguard.dto;

import dev.commentguard.entity.BlacklistEntry;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BlacklistEntryResponse {
    private String id;
    private String type;
    private String value;
    private String reason;
    private LocalDateTime createdAt;

    public static BlacklistEntryResponse from(BlacklistEntry entry) {
        return BlacklistEntryResponse.builder()
                .id(String.valueOf(entry.getId()))
                .type(entry.getType())
                .value(entry.getValue())
                .reason(entry.getReason())
                .createdAt(entry.getCreatedAt())
                .build();
    }
}
