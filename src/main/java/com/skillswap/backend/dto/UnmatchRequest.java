package com.skillswap.backend.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Remove a confirmed match")
public class UnmatchRequest {
    @NotBlank(message = "Selected user cannot be blank")
    @Schema(description = "The matched counterpart")
    private String selectedUser;

    @Schema(description = "Acting user; must equal the authenticated user when given")
    private String user;
}
