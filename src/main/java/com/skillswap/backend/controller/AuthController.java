package com.skillswap.backend.controller;

import com.skillswap.backend.domain.User;
import com.skillswap.backend.dto.ApiResponse;
import com.skillswap.backend.dto.AuthResponse;
import com.skillswap.backend.dto.RegisterRequest;
import com.skillswap.backend.dto.SignInRequest;
import com.skillswap.backend.security.JwtService;
import com.skillswap.backend.service.AuthService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

/**
 * Account registration, sign-in and sign-out
 */
@Slf4j
@RestController
@RequestMapping("/api")
@Tag(name = "Authentication", description = "APIs for accounts and bearer tokens")
public class AuthController {

    @Autowired
    private AuthService authService;

    @Autowired
    private JwtService jwtService;

    @PostMapping("/register")
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary = "Register", description = "Create an account and return an access token")
    public ApiResponse<AuthResponse> register(@Valid @RequestBody RegisterRequest request) {
        log.info("Registering user: username={}", request.getUsername());
        User user = authService.register(request);
        String token = jwtService.generateToken(user.getUsername());
        return ApiResponse.created("Welcome to Skill Swap " + user.getUsername(), AuthResponse.of(token, user));
    }

    @PostMapping("/signin")
    @Operation(summary = "Sign in", description = "Verify credentials and return an access token")
    public ApiResponse<AuthResponse> signIn(@Valid @RequestBody SignInRequest request) {
        User user = authService.authenticate(request);
        String token = jwtService.generateToken(user.getUsername());
        return ApiResponse.success("Signed in", AuthResponse.of(token, user));
    }

    /**
     * Tokens are stateless; clients drop theirs
     */
    @PostMapping("/signout")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    @Operation(summary = "Sign out")
    public void signOut() {
        log.debug("Sign out requested");
    }
}
