package com.skillswap.backend.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * User entity representing a registered member
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class User {
    /**
     * Unique user identifier
     */
    private Long id;

    /**
     * Username (unique)
     */
    private String username;

    /**
     * Email address (unique)
     */
    private String email;

    /**
     * Hashed password (BCrypt), never returned to clients
     */
    private String passwordHash;

    /**
     * Stored filename of the profile picture
     */
    private String profilePicture;

    private String phoneNumber;

    private String description;

    /**
     * Timestamp when user registered
     */
    private LocalDateTime createdAt;
}
