package com.skillswap.backend.service;

import com.skillswap.backend.domain.User;
import com.skillswap.backend.dto.RegisterRequest;
import com.skillswap.backend.dto.SignInRequest;
import com.skillswap.backend.exception.DuplicateFieldException;
import com.skillswap.backend.exception.InvalidCredentialsException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Credential service: registration and password sign-in
 */
@Service
@Slf4j
public class AuthService {

    static final String USERNAME_EXISTS = "Username already exists";
    static final String EMAIL_EXISTS = "Email already exists";
    static final String INCORRECT_USERNAME = "Incorrect username";
    static final String INCORRECT_PASSWORD = "Incorrect password";

    private final UserService userService;
    private final PasswordEncoder passwordEncoder;
    private final Counter registrations;
    private final Counter signIns;
    private final Counter failedSignIns;

    @Autowired
    public AuthService(UserService userService, PasswordEncoder passwordEncoder, MeterRegistry meterRegistry) {
        this.userService = userService;
        this.passwordEncoder = passwordEncoder;
        this.registrations = Counter.builder("skillswap.auth.registrations")
                .description("Accounts created")
                .register(meterRegistry);
        this.signIns = Counter.builder("skillswap.auth.signins")
                .description("Successful sign-ins")
                .register(meterRegistry);
        this.failedSignIns = Counter.builder("skillswap.auth.signins.failed")
                .description("Rejected sign-ins")
                .register(meterRegistry);
    }

    /**
     * Create an account. Both duplicate username and duplicate email are
     * reported together.
     *
     * @throws DuplicateFieldException when username or email is taken
     */
    public User register(RegisterRequest request) {
        String username = request.getUsername().trim();
        String email = normalizeEmail(request.getEmail());

        Map<String, String> errors = findTakenFields(username, email);
        if (!errors.isEmpty()) {
            throw new DuplicateFieldException(errors);
        }

        String passwordHash = passwordEncoder.encode(request.getPassword());
        User user;
        try {
            user = userService.createUser(username, email, passwordHash);
        } catch (DuplicateKeyException e) {
            // Lost a race with a concurrent registration; the constraint decides
            log.warn("Registration hit unique constraint: username={}", username);
            Map<String, String> raced = findTakenFields(username, email);
            if (raced.isEmpty()) {
                raced.put("username", USERNAME_EXISTS);
            }
            throw new DuplicateFieldException(raced);
        }

        registrations.increment();
        log.info("Registered new user '{}'", user.getUsername());
        return user;
    }

    /**
     * Verify a username/password pair.
     *
     * @throws InvalidCredentialsException with a field error for the username or the password
     */
    public User authenticate(SignInRequest request) {
        Map<String, String> errors = new LinkedHashMap<>();
        User user = userService.findByUsername(request.getUsername().trim());

        if (user == null) {
            errors.put("username", INCORRECT_USERNAME);
        } else if (!passwordEncoder.matches(request.getPassword(), user.getPasswordHash())) {
            errors.put("password", INCORRECT_PASSWORD);
        }

        if (!errors.isEmpty()) {
            failedSignIns.increment();
            throw new InvalidCredentialsException(errors);
        }

        signIns.increment();
        log.info("User signed in: username={}", user.getUsername());
        return user;
    }

    private Map<String, String> findTakenFields(String username, String email) {
        Map<String, String> errors = new LinkedHashMap<>();
        if (userService.usernameTaken(username)) {
            errors.put("username", USERNAME_EXISTS);
        }
        if (userService.emailTaken(email)) {
            errors.put("email", EMAIL_EXISTS);
        }
        return errors;
    }

    private String normalizeEmail(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
