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
@Schema(description = "Add a skill to a user's learn or teach list")
public class AddSkillRequest {
    @NotBlank(message = "Skill cannot be blank")
    @Schema(description = "Skill name", example = "Painting")
    private String skill;

    @NotBlank(message = "Username cannot be blank")
    private String username;

    @NotNull(message = "toLearn is required")
    @Schema(description = "true for the learn list, false for the teach list")
    private Boolean toLearn;
}
