package com.example.authservice.security;

import com.example.authservice.exception.UnauthorizedException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Helper class to extract the current account from SecurityContext.
 */
@Component
public class SecurityContextHelper {

    /**
     * Get current authenticated account.
     * @return Optional<AuthenticatedAccount> - empty if not authenticated
     */
    public Optional<AuthenticatedAccount> getCurrentAccount() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

        if (authentication == null || !authentication.isAuthenticated()) {
            return Optional.empty();
        }

        if (authentication.getPrincipal() instanceof AuthenticatedAccount account) {
            return Optional.of(account);
        }

        return Optional.empty();
    }

    /**
     * Get current user ID or fail.
     * @throws UnauthorizedException if no account is authenticated
     */
    public String requireCurrentUserId() {
        return getCurrentAccount()
                .map(AuthenticatedAccount::userId)
                .orElseThrow(UnauthorizedException::new);
    }
}
