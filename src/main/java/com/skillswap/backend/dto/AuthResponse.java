package com.skillswap.backend.dto;

import com.skillswap.backend.domain.User;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuthResponse {
    private String accessToken;
    private String username;
    private UserResponse user;

    public static AuthResponse of(String accessToken, User user) {
        return AuthResponse.builder()
                .accessToken(accessToken)
                .username(user.getUsername())
                .user(UserResponse.fromUser(user))
                .build();
    }
}
