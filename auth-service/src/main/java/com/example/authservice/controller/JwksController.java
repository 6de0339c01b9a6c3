package com.example.authservice.controller;

import com.example.authservice.service.JwtService;
import io.jsonwebtoken.security.JwkSet;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Publishes the access token verification key.
 */
@RestController
@Tag(name = "Keys")
public class JwksController {

    private final JwtService jwtService;

    public JwksController(JwtService jwtService) {
        this.jwtService = jwtService;
    }

    @GetMapping("/.well-known/jwks.json")
    @Operation(summary = "JSON Web Key Set for access token verification")
    public JwkSet jwks() {
        return jwtService.getJwks();
    }
}
