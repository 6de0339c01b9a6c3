package com.example.authservice.service;

import com.example.authservice.config.JwtProperties;
import com.example.authservice.entity.RefreshToken;
import com.example.authservice.entity.User;
import com.example.authservice.repository.RefreshTokenRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RefreshTokenServiceTest {

    private RefreshTokenRepository repository;
    private RefreshTokenService service;

    @BeforeEach
    void setUp() {
        repository = mock(RefreshTokenRepository.class);
        JwtProperties properties = new JwtProperties();
        properties.setRefreshTokenExpiration(Duration.ofDays(7));
        service = new RefreshTokenService(repository, properties);
    }

    @Test
    void tokenValueIs64LowercaseHexCharacters() {
        assertThat(service.generateTokenValue()).matches("[0-9a-f]{64}");
    }

    @Test
    void tokenValuesDoNotRepeat() {
        Set<String> values = new HashSet<>();
        for (int i = 0; i < 1000; i++) {
            values.add(service.generateTokenValue());
        }
        assertThat(values).hasSize(1000);
    }

    @Test
    void issuedTokenExpiresAfterConfiguredLifetime() {
        User user = new User("jane@example.com", "hash", "Jane");
        LocalDateTime before = LocalDateTime.now();

        RefreshToken token = service.issue(user);

        assertThat(token.getUser()).isSameAs(user);
        assertThat(token.isRevoked()).isFalse();
        assertThat(token.getExpiresAt())
                .isAfterOrEqualTo(before.plusDays(7))
                .isBeforeOrEqualTo(LocalDateTime.now().plusDays(7));
    }

    @Test
    void revokeReportsWhetherThisCallPerformedTheTransition() {
        when(repository.revokeByToken(eq("first"), any())).thenReturn(1);
        when(repository.revokeByToken(eq("second"), any())).thenReturn(0);

        assertThat(service.revoke("first")).isTrue();
        assertThat(service.revoke("second")).isFalse();
    }
}
