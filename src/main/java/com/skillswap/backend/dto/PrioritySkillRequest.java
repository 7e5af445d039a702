package com.skillswap.backend.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Set or clear the priority skill of a role")
public class PrioritySkillRequest {
    @NotBlank(message = "User cannot be blank")
    private String user;

    @Schema(description = "Skill name; required when setting a priority")
    private String skill;

    @NotNull(message = "isToLearn is required")
    @Schema(description = "true for the learn priority, false for the teach priority")
    private Boolean isToLearn;
}
