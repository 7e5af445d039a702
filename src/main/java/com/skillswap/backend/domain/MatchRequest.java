package com.skillswap.backend.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Pending, directional match request
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MatchRequest {
    private Long senderId;
    private Long receiverId;
    private LocalDateTime createdAt;
}
