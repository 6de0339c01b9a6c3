package com.example.authservice.repository;

import com.example.authservice.entity.RefreshToken;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Repository for RefreshToken entity.
 */
@Repository
public interface RefreshTokenRepository extends JpaRepository<RefreshToken, Long> {

    /**
     * Find refresh token by token string.
     * Revoked and expired records are returned too; the caller decides validity.
     *
     * @param token opaque token string
     * @return Optional<RefreshToken>
     */
    Optional<RefreshToken> findByToken(String token);

    /**
     * Find the non-revoked refresh tokens of a user.
     *
     * @param userId owning user ID
     * @return active (possibly expired) tokens
     */
    @Query("SELECT rt FROM RefreshToken rt WHERE rt.user.id = :userId AND rt.revoked = false")
    List<RefreshToken> findActiveByUserId(@Param("userId") String userId);

    /**
     * Revoke a single refresh token if it is not revoked yet.
     * The returned row count lets rotation detect a concurrent redemption.
     *
     * @param token opaque token string
     * @return 1 if this call revoked the token, 0 otherwise
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE RefreshToken rt SET rt.revoked = true, rt.updatedAt = :now " +
            "WHERE rt.token = :token AND rt.revoked = false")
    int revokeByToken(@Param("token") String token, @Param("now") LocalDateTime now);

    /**
     * Revoke all refresh tokens for a user.
     *
     * @param userId owning user ID
     * @return number of updated rows
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE RefreshToken rt SET rt.revoked = true, rt.updatedAt = :now " +
            "WHERE rt.user.id = :userId AND rt.revoked = false")
    int revokeAllByUserId(@Param("userId") String userId, @Param("now") LocalDateTime now);

    /**
     * Delete tokens whose expiry is before the given instant.
     *
     * @param cutoff expiry cutoff
     * @return number of deleted rows
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM RefreshToken rt WHERE rt.expiresAt < :cutoff")
    int deleteExpiredBefore(@Param("cutoff") LocalDateTime cutoff);
}
