package com.example.authservice.service;

import com.example.authservice.config.JwtProperties;
import com.example.authservice.entity.RefreshToken;
import com.example.authservice.entity.User;
import com.example.authservice.repository.RefreshTokenRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;

/**
 * Opaque refresh token store.
 *
 * Refresh Token TTL: jwt.refresh-token-expiration (default 7 days)
 * Format: 32 random bytes, hex encoded (NOT a JWT)
 */
@Service
public class RefreshTokenService {

    static final int TOKEN_BYTES = 32;

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();
    private static final HexFormat HEX = HexFormat.of();

    private final RefreshTokenRepository refreshTokenRepository;
    private final Duration refreshTokenExpiration;

    public RefreshTokenService(RefreshTokenRepository refreshTokenRepository, JwtProperties properties) {
        this.refreshTokenRepository = refreshTokenRepository;
        this.refreshTokenExpiration = properties.getRefreshTokenExpiration();
    }

    /**
     * Generate a new token value: 256 bits from SecureRandom as 64 hex characters.
     */
    public String generateTokenValue() {
        byte[] bytes = new byte[TOKEN_BYTES];
        SECURE_RANDOM.nextBytes(bytes);
        return HEX.formatHex(bytes);
    }

    /**
     * Build (but do not persist) a new refresh token for a user.
     *
     * @param user token owner
     * @return unsaved token expiring after the configured TTL
     */
    public RefreshToken issue(User user) {
        return new RefreshToken(user, generateTokenValue(), LocalDateTime.now().plus(refreshTokenExpiration));
    }

    @Transactional
    public RefreshToken create(RefreshToken refreshToken) {
        return refreshTokenRepository.save(refreshToken);
    }

    /**
     * Issue and persist a new refresh token.
     *
     * @param user Authenticated user
     * @return persisted token
     */
    @Transactional
    public RefreshToken createRefreshToken(User user) {
        return create(issue(user));
    }

    /**
     * Look up a token regardless of its state. Validity is up to the caller.
     */
    @Transactional(readOnly = true)
    public Optional<RefreshToken> findByToken(String token) {
        return refreshTokenRepository.findByToken(token);
    }

    /**
     * Non-revoked tokens of a user.
     */
    @Transactional(readOnly = true)
    public List<RefreshToken> findActiveByUserId(String userId) {
        return refreshTokenRepository.findActiveByUserId(userId);
    }

    /**
     * Revoke a specific refresh token.
     *
     * @param token opaque token string
     * @return true if this call moved the token from active to revoked
     */
    @Transactional
    public boolean revoke(String token) {
        return refreshTokenRepository.revokeByToken(token, LocalDateTime.now()) > 0;
    }

    /**
     * Revoke all refresh tokens for a user.
     *
     * @param userId owning user ID
     * @return number of tokens revoked
     */
    @Transactional
    public int revokeAllByUserId(String userId) {
        return refreshTokenRepository.revokeAllByUserId(userId, LocalDateTime.now());
    }

    /**
     * Delete tokens that are past their expiry. Storage hygiene only.
     *
     * @return number of deleted tokens
     */
    @Transactional
    public int deleteExpired() {
        return refreshTokenRepository.deleteExpiredBefore(LocalDateTime.now());
    }
}
