package com.skillswap.backend.config;

import com.skillswap.backend.security.JwtProperties;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

/**
 * Password hashing and token settings
 */
@Configuration
@EnableConfigurationProperties(JwtProperties.class)
public class SecurityConfig {

    /**
     * BCrypt, cost factor 12 unless overridden
     */
    @Bean
    public PasswordEncoder passwordEncoder(@Value("${security.bcrypt.strength:12}") int strength) {
        return new BCryptPasswordEncoder(strength);
    }
}
