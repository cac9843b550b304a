package dev.commentguard.dto;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BulkModerationRequest {

    @NotEmpty(message = "At least one comment id is required")
    @Size(max = 200, message = "At most 200 comments per batch")
    private List<@NotNull Long> ids;
}
