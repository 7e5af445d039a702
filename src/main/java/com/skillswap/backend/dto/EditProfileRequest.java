package com.skillswap.backend.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Profile edit form. Blank optional fields mean "leave unchanged".
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Profile edit form fields")
public class EditProfileRequest {
    @NotBlank(message = "Current username cannot be blank")
    private String currentUsername;

    /**
     * Empty means unchanged; otherwise the registration length rule applies
     */
    @Pattern(regexp = "^$|^.{3,50}$", message = "Username must be between 3 and 50 characters")
    private String newUsername;

    @Size(max = 1000, message = "Description must be at most 1000 characters")
    private String newDescription;

    @Size(max = 40, message = "Platform must be at most 40 characters")
    @Schema(example = "github")
    private String platform;

    @Size(max = 500, message = "Link must be at most 500 characters")
    private String linkToPlatform;
}
