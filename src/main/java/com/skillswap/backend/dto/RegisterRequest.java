package com.skillswap.backend.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Registration request")
public class RegisterRequest {
    @NotBlank(message = "Username cannot be blank")
    @Size(min = 3, max = 50, message = "Username must be between 3 and 50 characters")
    @Schema(description = "Username", example = "alice")
    private String username;

    @NotBlank(message = "Email cannot be blank")
    @Email(message = "Invalid email format")
    @Size(max = 160, message = "Email must be at most 160 characters")
    @Schema(description = "Email address", example = "a@x.com")
    private String email;

    @NotBlank(message = "Password cannot be blank")
    @Size(min = 5, max = 72, message = "Password must be between 5 and 72 characters")
    @Schema(description = "Password", example = "pw123")
    private String password;
}
