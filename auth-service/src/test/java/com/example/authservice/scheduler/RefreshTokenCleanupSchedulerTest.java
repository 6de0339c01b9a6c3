package com.example.authservice.scheduler;

import com.example.authservice.service.RefreshTokenService;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RefreshTokenCleanupSchedulerTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withBean(RefreshTokenService.class, () -> mock(RefreshTokenService.class))
            .withUserConfiguration(RefreshTokenCleanupScheduler.class);

    @Test
    void deletesExpiredTokens() {
        RefreshTokenService refreshTokenService = mock(RefreshTokenService.class);
        when(refreshTokenService.deleteExpired()).thenReturn(3);

        new RefreshTokenCleanupScheduler(refreshTokenService).deleteExpiredTokens();

        verify(refreshTokenService).deleteExpired();
    }

    @Test
    void enabledWhenPropertyIsMissing() {
        contextRunner.run(context -> assertThat(context).hasSingleBean(RefreshTokenCleanupScheduler.class));
    }

    @Test
    void disabledByProperty() {
        contextRunner
                .withPropertyValues("auth.refresh-token.cleanup-enabled=false")
                .run(context -> assertThat(context).doesNotHaveBean(RefreshTokenCleanupScheduler.class));
    }
}
