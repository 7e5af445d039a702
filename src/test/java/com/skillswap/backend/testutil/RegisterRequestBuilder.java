package com.skillswap.backend.testutil;

import com.skillswap.backend.dto.RegisterRequest;

/**
 * Fluent builder for registration requests
 * Email defaults to "&lt;username&gt;@example.com"
 */
public class RegisterRequestBuilder {
    private String username = "alice";
    private String email;
    private String password = "pw123";

    public static RegisterRequestBuilder user(String username) {
        return new RegisterRequestBuilder().username(username);
    }

    public RegisterRequestBuilder username(String username) {
        this.username = username;
        return this;
    }

    public RegisterRequestBuilder email(String email) {
        this.email = email;
        return this;
    }

    public RegisterRequestBuilder password(String password) {
        this.password = password;
        return this;
    }

    public RegisterRequest build() {
        return RegisterRequest.builder()
                .username(username)
                .email(email != null ? email : username + "@example.com")
                .password(password)
                .build();
    }
}
