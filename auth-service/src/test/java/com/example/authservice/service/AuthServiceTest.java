package com.example.authservice.service;

import com.example.authservice.dto.AuthResponse;
import com.example.authservice.dto.LoginRequest;
import com.example.authservice.dto.RegisterRequest;
import com.example.authservice.dto.UserDto;
import com.example.authservice.entity.RefreshToken;
import com.example.authservice.entity.User;
import com.example.authservice.exception.AccountNotFoundException;
import com.example.authservice.exception.AuthException;
import com.example.authservice.exception.CredentialHashException;
import com.example.authservice.exception.EmailAlreadyExistsException;
import com.example.authservice.exception.InvalidCredentialsException;
import com.example.authservice.exception.TokenExpiredException;
import com.example.authservice.exception.TokenInvalidException;
import com.example.authservice.exception.TokenRevokedException;
import com.example.authservice.repository.RefreshTokenRepository;
import com.example.authservice.repository.UserRepository;
import com.example.authservice.security.AccessTokenClaims;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.LocalDateTime;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;

/**
 * End-to-end tests of the session lifecycle against an in-memory database.
 * Each test registers its own account, so tests share the schema without cleanup.
 */
@SpringBootTest
class AuthServiceTest {

    private static final String PASSWORD = "pw123456";

    @Autowired
    private AuthService authService;

    @Autowired
    private RefreshTokenService refreshTokenService;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private RefreshTokenRepository refreshTokenRepository;

    @Test
    void registerRefreshAndReplayScenario() {
        AuthResponse registered = authService.register(new RegisterRequest("a@x.com", PASSWORD, "A"));

        assertThat(registered.tokenType()).isEqualTo("Bearer");
        assertThat(registered.expiresIn()).isEqualTo(900);
        assertThat(registered.user().email()).isEqualTo("a@x.com");

        AuthResponse rotated = authService.refresh(registered.refreshToken());

        assertThat(rotated.refreshToken()).isNotEqualTo(registered.refreshToken());
        assertThat(rotated.user().id()).isEqualTo(registered.user().id());
        assertThatThrownBy(() -> authService.refresh(registered.refreshToken()))
                .isInstanceOf(TokenRevokedException.class);
    }

    @Test
    void issuedAccessTokenValidatesToTheAccount() {
        AuthResponse registered = register();

        AccessTokenClaims claims = authService.validateAccessToken(registered.accessToken());

        assertThat(claims.userId()).isEqualTo(registered.user().id());
        assertThat(claims.email()).isEqualTo(registered.user().email());
    }

    @Test
    void tamperedAccessTokenIsInvalid() {
        String token = register().accessToken();
        int position = token.lastIndexOf('.') + 10;
        char replacement = token.charAt(position) == 'A' ? 'B' : 'A';
        String tampered = token.substring(0, position) + replacement + token.substring(position + 1);

        assertThatThrownBy(() -> authService.validateAccessToken(tampered))
                .isInstanceOf(TokenInvalidException.class);
        assertThatThrownBy(() -> authService.validateAccessToken("garbage"))
                .isInstanceOf(TokenInvalidException.class);
    }

    @Test
    void registeringTheSameEmailTwiceFails() {
        String email = uniqueEmail();
        authService.register(new RegisterRequest(email, PASSWORD, "First"));
        long accounts = userRepository.count();

        assertThatThrownBy(() -> authService.register(new RegisterRequest(email, "other-password", "Second")))
                .isInstanceOf(EmailAlreadyExistsException.class);
        assertThat(userRepository.count()).isEqualTo(accounts);
        assertThat(userRepository.findByEmail(email))
                .hasValueSatisfying(user -> assertThat(user.getName()).isEqualTo("First"));
    }

    @Test
    void storageFailureOnRegisterIsNotReportedAsDuplicateEmail() {
        String tooLongName = uniqueEmail();
        String nullName = uniqueEmail();

        assertThatThrownBy(() -> authService.register(new RegisterRequest(tooLongName, PASSWORD, "n".repeat(101))))
                .isInstanceOf(DataIntegrityViolationException.class)
                .isNotInstanceOf(EmailAlreadyExistsException.class);
        assertThatThrownBy(() -> authService.register(new RegisterRequest(nullName, PASSWORD, null)))
                .isInstanceOf(DataIntegrityViolationException.class);

        assertThat(userRepository.findByEmail(tooLongName)).isEmpty();
        assertThat(userRepository.findByEmail(nullName)).isEmpty();
    }

    @Test
    void emailOfDeletedAccountHitsUniqueConstraintAndIsReportedAsDuplicate() {
        AuthResponse registered = register();
        userRepository.deleteById(registered.user().id());

        // existsByEmail no longer sees the row, so the insert reaches the unique constraint
        assertThatThrownBy(() -> authService.register(new RegisterRequest(registered.user().email(), PASSWORD, "Again")))
                .isInstanceOf(EmailAlreadyExistsException.class);
    }

    @Test
    void corruptStoredHashIsAnInternalFailure() {
        String email = uniqueEmail();
        userRepository.saveAndFlush(new User(email, "not-a-bcrypt-hash", "Corrupt"));

        assertThatThrownBy(() -> authService.login(new LoginRequest(email, PASSWORD)))
                .isInstanceOf(CredentialHashException.class)
                .isNotInstanceOf(AuthException.class);
    }

    @Test
    void passwordIsStoredOnlyAsBcryptHash() {
        AuthResponse registered = register();

        User stored = userRepository.findById(registered.user().id()).orElseThrow();
        assertThat(stored.getPasswordHash()).startsWith("$2a$10$").doesNotContain(PASSWORD);
    }

    @Test
    void loginWithCorrectPasswordIssuesNewSession() {
        AuthResponse registered = register();

        AuthResponse loggedIn = authService.login(new LoginRequest(registered.user().email(), PASSWORD));

        assertThat(loggedIn.user().id()).isEqualTo(registered.user().id());
        assertThat(loggedIn.refreshToken()).isNotEqualTo(registered.refreshToken());
        assertThat(refreshTokenService.findActiveByUserId(registered.user().id())).hasSize(2);
    }

    @Test
    void wrongPasswordAndUnknownEmailAreIndistinguishable() {
        AuthResponse registered = register();

        Throwable wrongPassword = catchThrowable(
                () -> authService.login(new LoginRequest(registered.user().email(), "not-the-password")));
        Throwable unknownEmail = catchThrowable(
                () -> authService.login(new LoginRequest(uniqueEmail(), PASSWORD)));

        assertThat(wrongPassword).isInstanceOf(InvalidCredentialsException.class);
        assertThat(unknownEmail).isInstanceOf(InvalidCredentialsException.class);
        assertThat(wrongPassword.getMessage()).isEqualTo(unknownEmail.getMessage());
    }

    @Test
    void unknownRefreshTokenIsInvalid() {
        assertThatThrownBy(() -> authService.refresh("no-such-token"))
                .isInstanceOf(TokenInvalidException.class);
    }

    @Test
    void expiredRefreshTokenIsRejected() {
        AuthResponse registered = register();
        User user = userRepository.findById(registered.user().id()).orElseThrow();
        RefreshToken expired = refreshTokenService.create(
                new RefreshToken(user, refreshTokenService.generateTokenValue(), LocalDateTime.now().minusMinutes(1)));

        assertThatThrownBy(() -> authService.refresh(expired.getToken()))
                .isInstanceOf(TokenExpiredException.class);
    }

    @Test
    void logoutRevokesOnlyThePresentedToken() {
        AuthResponse first = register();
        AuthResponse second = authService.login(new LoginRequest(first.user().email(), PASSWORD));

        authService.logout(first.refreshToken());

        assertThatThrownBy(() -> authService.refresh(first.refreshToken()))
                .isInstanceOf(TokenRevokedException.class);
        assertThat(authService.refresh(second.refreshToken()).user().id()).isEqualTo(first.user().id());
    }

    @Test
    void logoutIsIdempotent() {
        AuthResponse registered = register();

        authService.logout(registered.refreshToken());
        authService.logout(registered.refreshToken());
        authService.logout("never-issued");

        assertThat(refreshTokenRepository.findByToken(registered.refreshToken()))
                .hasValueSatisfying(token -> assertThat(token.isRevoked()).isTrue());
    }

    @Test
    void logoutAllRevokesEverySession() {
        AuthResponse first = register();
        String email = first.user().email();
        AuthResponse second = authService.login(new LoginRequest(email, PASSWORD));
        AuthResponse third = authService.login(new LoginRequest(email, PASSWORD));

        authService.logoutAll(first.user().id());

        assertThat(refreshTokenService.findActiveByUserId(first.user().id())).isEmpty();
        for (AuthResponse session : new AuthResponse[] {first, second, third}) {
            assertThatThrownBy(() -> authService.refresh(session.refreshToken()))
                    .isInstanceOf(TokenRevokedException.class);
        }
    }

    @Test
    void logoutAllDoesNotTouchOtherAccounts() {
        AuthResponse mine = register();
        AuthResponse theirs = register();

        authService.logoutAll(mine.user().id());

        assertThat(authService.refresh(theirs.refreshToken()).user().id()).isEqualTo(theirs.user().id());
    }

    @Test
    void profileReturnsTheAccount() {
        AuthResponse registered = register();

        UserDto profile = authService.getProfile(registered.user().id());

        assertThat(profile.email()).isEqualTo(registered.user().email());
        assertThat(profile.name()).isEqualTo("Test User");
    }

    @Test
    void deletedAccountCanNeitherRefreshNorBeFound() {
        AuthResponse registered = register();

        userRepository.deleteById(registered.user().id());

        assertThatThrownBy(() -> authService.refresh(registered.refreshToken()))
                .isInstanceOf(AccountNotFoundException.class);
        assertThatThrownBy(() -> authService.getProfile(registered.user().id()))
                .isInstanceOf(AccountNotFoundException.class);
        // The failed refresh must not have consumed the token
        assertThat(refreshTokenRepository.findByToken(registered.refreshToken()))
                .hasValueSatisfying(token -> assertThat(token.isRevoked()).isFalse());
    }

    private AuthResponse register() {
        return authService.register(new RegisterRequest(uniqueEmail(), PASSWORD, "Test User"));
    }

    private static String uniqueEmail() {
        return "user-" + UUID.randomUUID() + "@example.com";
    }
}
