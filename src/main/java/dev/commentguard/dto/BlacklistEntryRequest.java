package dev.commentguard.dto;

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
public class BlacklistEntryRequest {

    @NotBlank(message = "Type is required")
    @Pattern(regexp = "^(?i)(email|ip|domain|keyword)$", message = "Type must be email, ip, domain or keyword")
    private String type;

    @NotBlank(message = "Value is required")
    @Size(max = 255, message = "Value must be at most 255 characters")
    private String value;

    @Size(max = 500, message = "Reason must be at most 500 characters")
    private String reason;
}
