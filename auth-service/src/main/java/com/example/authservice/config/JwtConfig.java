package com.example.authservice.config;

import com.example.authservice.security.RsaKeyLoader;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.KeyPair;

/**
 * Loads the RSA signing key pair once at startup.
 * Startup fails if either key is missing, malformed, not RSA, or the halves do not match.
 */
@Configuration
@EnableConfigurationProperties(JwtProperties.class)
public class JwtConfig {

    @Bean
    public KeyPair signingKeyPair(JwtProperties properties) {
        return RsaKeyLoader.loadKeyPair(
                properties.getPrivateKeyLocation(),
                properties.getPublicKeyLocation());
    }
}
