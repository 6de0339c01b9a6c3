package com.example.authservice.service;

import com.example.authservice.dto.*;
import com.example.authservice.entity.RefreshToken;
import com.example.authservice.entity.User;
import com.example.authservice.exception.AccessTokenValidationException;
import com.example.authservice.exception.AccountNotFoundException;
import com.example.authservice.exception.EmailAlreadyExistsException;
import com.example.authservice.exception.InvalidCredentialsException;
import com.example.authservice.exception.TokenExpiredException;
import com.example.authservice.exception.TokenInvalidException;
import com.example.authservice.exception.TokenRevokedException;
import com.example.authservice.repository.UserRepository;
import com.example.authservice.security.AccessTokenClaims;
import org.hibernate.exception.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.SQLException;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Optional;

/**
 * Authentication service: register, login, refresh, logout and access token validation.
 *
 * Holds no state of its own; combines the credential verifier, the JWT signer
 * and the refresh token store.
 */
@Service
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private static final String UNIQUE_VIOLATION_SQL_STATE = "23505";

    private final UserRepository userRepository;
    private final CredentialVerifier credentialVerifier;
    private final JwtService jwtService;
    private final RefreshTokenService refreshTokenService;

    public AuthService(
            UserRepository userRepository,
            CredentialVerifier credentialVerifier,
            JwtService jwtService,
            RefreshTokenService refreshTokenService) {
        this.userRepository = userRepository;
        this.credentialVerifier = credentialVerifier;
        this.jwtService = jwtService;
        this.refreshTokenService = refreshTokenService;
    }

    /**
     * Register new user and return tokens.
     *
     * Steps:
     * 1. Check email uniqueness
     * 2. Hash password with BCrypt
     * 3. Create user (DB UNIQUE constraint catches concurrent registrations)
     * 4. Issue access token & refresh token
     *
     * @param request RegisterRequest with email, password, name
     * @return AuthResponse with tokens and user info
     * @throws EmailAlreadyExistsException if email already registered (409)
     * @throws DataIntegrityViolationException for any other constraint failure (500)
     */
    @Transactional
    public AuthResponse register(RegisterRequest request) {
        if (userRepository.existsByEmail(request.email())) {
            throw new EmailAlreadyExistsException();
        }

        User user = new User(request.email(), credentialVerifier.hash(request.password()), request.name());

        try {
            user = userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException ex) {
            // Lost a registration race; any other violation is an internal failure
            if (isEmailUniqueViolation(ex)) {
                throw new EmailAlreadyExistsException();
            }
            throw ex;
        }

        log.info("Registered user {}", user.getId());
        return issueTokenPair(user);
    }

    /**
     * Authenticate user and return tokens.
     *
     * Unknown email and wrong password raise the same exception with the same
     * message, and both pay for one BCrypt comparison (anti-enumeration).
     *
     * @param request LoginRequest with email and password
     * @return AuthResponse with tokens
     * @throws InvalidCredentialsException if email not found or password incorrect (401)
     */
    @Transactional
    public AuthResponse login(LoginRequest request) {
        Optional<User> found = userRepository.findByEmail(request.email());
        if (found.isEmpty()) {
            credentialVerifier.verifyAgainstDummy(request.password());
            throw new InvalidCredentialsException();
        }

        User user = found.get();
        if (!credentialVerifier.verify(request.password(), user.getPasswordHash())) {
            throw new InvalidCredentialsException();
        }

        return issueTokenPair(user);
    }

    /**
     * Rotate refresh token and issue a new token pair.
     *
     * The presented token can be redeemed exactly once. Revoking it and persisting
     * its replacement happen in one transaction: if issuing fails, the old token
     * stays active.
     *
     * @param tokenString refresh token string
     * @return AuthResponse with new tokens
     * @throws TokenInvalidException if token not found (401)
     * @throws TokenRevokedException if token was already revoked or redeemed concurrently (401)
     * @throws TokenExpiredException if token expired (401)
     * @throws AccountNotFoundException if the owning account no longer exists
     */
    @Transactional
    public AuthResponse refresh(String tokenString) {
        RefreshToken refreshToken = refreshTokenService.findByToken(tokenString)
                .orElseThrow(TokenInvalidException::new);

        if (refreshToken.isRevoked()) {
            log.warn("Revoked refresh token presented for user {}", refreshToken.getUser().getId());
            throw new TokenRevokedException();
        }

        if (refreshToken.isExpiredAt(LocalDateTime.now())) {
            throw new TokenExpiredException();
        }

        User user = userRepository.findById(refreshToken.getUser().getId())
                .orElseThrow(AccountNotFoundException::new);

        // Conditional update: loses the race if another request redeemed it first
        if (!refreshTokenService.revoke(tokenString)) {
            log.warn("Refresh token for user {} was redeemed concurrently", user.getId());
            throw new TokenRevokedException();
        }

        return issueTokenPair(user);
    }

    /**
     * Revoke a single refresh token.
     * Idempotent: unknown or already revoked tokens are a no-op.
     *
     * @param tokenString refresh token string
     */
    @Transactional
    public void logout(String tokenString) {
        if (!refreshTokenService.revoke(tokenString)) {
            log.debug("Logout with unknown or already revoked refresh token");
        }
    }

    /**
     * Revoke every active refresh token of a user.
     *
     * @param userId user ID
     */
    @Transactional
    public void logoutAll(String userId) {
        int revoked = refreshTokenService.revokeAllByUserId(userId);
        log.info("Revoked {} refresh tokens for user {}", revoked, userId);
    }

    /**
     * Validate an access token.
     *
     * @param token JWT access token
     * @return verified claims
     * @throws TokenInvalidException for any validation failure (401)
     */
    public AccessTokenClaims validateAccessToken(String token) {
        try {
            return jwtService.validateToken(token);
        } catch (AccessTokenValidationException ex) {
            throw new TokenInvalidException();
        }
    }

    /**
     * Get profile of a user.
     *
     * @param userId user ID
     * @return user info
     * @throws AccountNotFoundException if the user does not exist
     */
    @Transactional(readOnly = true)
    public UserDto getProfile(String userId) {
        return userRepository.findById(userId)
                .map(UserDto::fromEntity)
                .orElseThrow(AccountNotFoundException::new);
    }

    private static boolean isEmailUniqueViolation(DataIntegrityViolationException ex) {
        for (Throwable cause = ex; cause != null; cause = cause.getCause()) {
            if (cause instanceof ConstraintViolationException violation
                    && violation.getConstraintName() != null
                    && violation.getConstraintName().toLowerCase(Locale.ROOT).contains(User.EMAIL_UNIQUE_CONSTRAINT)) {
                return true;
            }
            if (cause instanceof SQLException sqlException
                    && UNIQUE_VIOLATION_SQL_STATE.equals(sqlException.getSQLState())
                    && String.valueOf(sqlException.getMessage()).toLowerCase(Locale.ROOT).contains(User.EMAIL_UNIQUE_CONSTRAINT)) {
                return true;
            }
        }
        return false;
    }

    private AuthResponse issueTokenPair(User user) {
        String accessToken = jwtService.generateAccessToken(user);
        RefreshToken refreshToken = refreshTokenService.createRefreshToken(user);

        return AuthResponse.of(
                accessToken,
                refreshToken.getToken(),
                jwtService.getAccessTokenTtlSeconds(),
                UserDto.fromEntity(user));
    }
}
