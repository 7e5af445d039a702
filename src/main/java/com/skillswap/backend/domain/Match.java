package com.skillswap.backend.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Confirmed match between two users.
 * Stored once per unordered pair with {@code userId < matchId}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Match {
    private Long userId;
    private Long matchId;
    private LocalDateTime createdAt;

    /**
     * Build the canonical row for an unordered pair of user ids
     */
    public static Match canonical(Long first, Long second) {
        return Match.builder()
                .userId(Math.min(first, second))
                .matchId(Math.max(first, second))
                .build();
    }
}
