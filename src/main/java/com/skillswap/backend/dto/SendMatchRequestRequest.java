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
@Schema(description = "Send a match request from the authenticated user")
public class SendMatchRequestRequest {
    @NotBlank(message = "Receiver cannot be blank")
    private String receiver;
}
