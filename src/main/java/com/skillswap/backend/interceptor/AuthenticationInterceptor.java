package com.skillswap.backend.interceptor;

import com.skillswap.backend.exception.UnauthenticatedException;
import com.skillswap.backend.security.AuthenticatedUser;
import com.skillswap.backend.security.JwtService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.cors.CorsUtils;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Bearer token check for protected routes.
 * Missing token: 401. Invalid or expired token: 403.
 * The verified identity is stored as a request attribute for handlers.
 */
@Component
@Slf4j
public class AuthenticationInterceptor implements HandlerInterceptor {

    public static final String AUTHENTICATED_USER_ATTRIBUTE = AuthenticatedUser.class.getName();

    private static final String BEARER_PREFIX = "Bearer ";

    @Autowired
    private JwtService jwtService;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (CorsUtils.isPreFlightRequest(request)) {
            return true;
        }

        String authHeader = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authHeader == null || !authHeader.startsWith(BEARER_PREFIX)
                || authHeader.substring(BEARER_PREFIX.length()).isBlank()) {
            log.debug("Missing bearer token for: {}", request.getRequestURI());
            throw new UnauthenticatedException("Authentication required");
        }

        String token = authHeader.substring(BEARER_PREFIX.length()).trim();
        AuthenticatedUser user = jwtService.verifyToken(token);
        request.setAttribute(AUTHENTICATED_USER_ATTRIBUTE, user);

        log.debug("Authenticated request: user={}, URI={}", user.username(), request.getRequestURI());
        return true;
    }
}
