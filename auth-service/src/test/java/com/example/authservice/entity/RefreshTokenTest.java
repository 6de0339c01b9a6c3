package com.example.authservice.entity;

import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class RefreshTokenTest {

    private static final LocalDateTime EXPIRES_AT = LocalDateTime.of(2026, 1, 1, 12, 0);

    @Test
    void validBeforeExpiry() {
        RefreshToken token = new RefreshToken(new User(), "abc", EXPIRES_AT);

        assertThat(token.isValidAt(EXPIRES_AT.minusSeconds(1))).isTrue();
    }

    @Test
    void invalidAtAndAfterExpiry() {
        RefreshToken token = new RefreshToken(new User(), "abc", EXPIRES_AT);

        assertThat(token.isValidAt(EXPIRES_AT)).isFalse();
        assertThat(token.isExpiredAt(EXPIRES_AT)).isTrue();
        assertThat(token.isValidAt(EXPIRES_AT.plusDays(1))).isFalse();
    }

    @Test
    void revokedTokenIsNeverValid() {
        RefreshToken token = new RefreshToken(new User(), "abc", EXPIRES_AT);

        // revoked is only ever flipped in storage
        ReflectionTestUtils.setField(token, "revoked", true);

        assertThat(token.isRevoked()).isTrue();
        assertThat(token.isValidAt(EXPIRES_AT.minusDays(1))).isFalse();
    }
}
