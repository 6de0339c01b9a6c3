package com.example.authservice.controller;

import com.example.authservice.config.OpenApiConfig;
import com.example.authservice.dto.*;
import com.example.authservice.security.SecurityContextHelper;
import com.example.authservice.service.AuthService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Authentication controller.
 */
@RestController
@RequestMapping("/api/auth")
@Tag(name = "Auth", description = "Registration, login and token lifecycle")
public class AuthController {

    private final AuthService authService;
    private final SecurityContextHelper securityContextHelper;

    public AuthController(AuthService authService, SecurityContextHelper securityContextHelper) {
        this.authService = authService;
        this.securityContextHelper = securityContextHelper;
    }

    /**
     * POST /api/auth/register
     *
     * @return 201 Created with AuthResponse
     * @throws com.example.authservice.exception.EmailAlreadyExistsException 409 Conflict
     */
    @PostMapping("/register")
    @Operation(summary = "Register a new user")
    public ResponseEntity<AuthResponse> register(@Valid @RequestBody RegisterRequest request) {
        AuthResponse response = authService.register(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    /**
     * POST /api/auth/login
     *
     * @return 200 OK with AuthResponse
     * @throws com.example.authservice.exception.InvalidCredentialsException 401 Unauthorized
     */
    @PostMapping("/login")
    @Operation(summary = "Login with email and password")
    public ResponseEntity<AuthResponse> login(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(authService.login(request));
    }

    /**
     * POST /api/auth/refresh
     *
     * @return 200 OK with a new AuthResponse; the presented refresh token is revoked
     */
    @PostMapping("/refresh")
    @Operation(summary = "Exchange a refresh token for a new token pair")
    public ResponseEntity<AuthResponse> refresh(@Valid @RequestBody RefreshTokenRequest request) {
        return ResponseEntity.ok(authService.refresh(request.refreshToken()));
    }

    /**
     * POST /api/auth/logout
     *
     * Idempotent: unknown or already revoked tokens still return 200.
     */
    @PostMapping("/logout")
    @Operation(summary = "Revoke a refresh token")
    public ResponseEntity<MessageResponse> logout(@Valid @RequestBody RefreshTokenRequest request) {
        authService.logout(request.refreshToken());
        return ResponseEntity.ok(MessageResponse.of("successfully logged out"));
    }

    /**
     * POST /api/auth/logout-all
     *
     * Requires valid access token in Authorization header.
     */
    @PostMapping("/logout-all")
    @Operation(summary = "Revoke every refresh token of the current user")
    @SecurityRequirement(name = OpenApiConfig.BEARER_SCHEME)
    public ResponseEntity<MessageResponse> logoutAll() {
        authService.logoutAll(securityContextHelper.requireCurrentUserId());
        return ResponseEntity.ok(MessageResponse.of("successfully logged out from all devices"));
    }

    /**
     * GET /api/auth/profile
     */
    @GetMapping("/profile")
    @Operation(summary = "Get the current user's profile")
    @SecurityRequirement(name = OpenApiConfig.BEARER_SCHEME)
    public ResponseEntity<UserDto> profile() {
        return ResponseEntity.ok(authService.getProfile(securityContextHelper.requireCurrentUserId()));
    }
}
