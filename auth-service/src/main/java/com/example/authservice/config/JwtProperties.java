package com.example.authservice.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.core.io.Resource;

import java.time.Duration;

/**
 * Token settings bound to the {@code jwt} prefix.
 *
 * <p>Key locations accept any Spring resource URL ({@code file:}, {@code classpath:}).
 * Lifetimes default to 15 minutes for access tokens and 7 days for refresh tokens.
 */
@ConfigurationProperties(prefix = "jwt")
@Getter
@Setter
public class JwtProperties {

    private Resource privateKeyLocation;

    private Resource publicKeyLocation;

    private Duration accessTokenExpiration = Duration.ofMinutes(15);

    private Duration refreshTokenExpiration = Duration.ofDays(7);

    private String issuer = "auth-service";
}
