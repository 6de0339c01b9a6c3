package com.example.authservice.scheduler;

import com.example.authservice.service.RefreshTokenService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Scheduled job to delete expired refresh tokens.
 *
 * Expired tokens are already unusable; this only keeps the table small.
 * Runs daily at 3 AM by default.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(prefix = "auth.refresh-token", name = "cleanup-enabled", havingValue = "true", matchIfMissing = true)
public class RefreshTokenCleanupScheduler {

    private final RefreshTokenService refreshTokenService;

    @Scheduled(cron = "${auth.refresh-token.cleanup-cron:0 0 3 * * *}")
    public void deleteExpiredTokens() {
        int deleted = refreshTokenService.deleteExpired();

        if (deleted > 0) {
            log.info("Cleanup job: deleted {} expired refresh tokens", deleted);
        } else {
            log.debug("Cleanup job: no expired refresh tokens");
        }
    }
}
