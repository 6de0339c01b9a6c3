package com.example.authservice.service;

import com.example.authservice.config.JwtProperties;
import com.example.authservice.entity.User;
import com.example.authservice.exception.AccessTokenValidationException;
import com.example.authservice.exception.AccessTokenValidationException.Reason;
import com.example.authservice.security.AccessTokenClaims;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.InvalidClaimException;
import io.jsonwebtoken.JwsHeader;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.LocatorAdapter;
import io.jsonwebtoken.PrematureJwtException;
import io.jsonwebtoken.security.JwkSet;
import io.jsonwebtoken.security.Jwks;
import io.jsonwebtoken.security.RsaPublicJwk;
import io.jsonwebtoken.security.SignatureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.security.Key;
import java.security.KeyPair;
import java.security.PrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Set;

/**
 * JWT Service for access token generation and validation.
 *
 * Algorithm: RS256 (private key signs, public key verifies)
 * Access Token TTL: jwt.access-token-expiration (default 15 minutes)
 *
 * The public key is published as a JWKS so resource servers can verify
 * access tokens without calling this service.
 */
@Service
public class JwtService {

    private static final Logger log = LoggerFactory.getLogger(JwtService.class);

    static final String CLAIM_USER_ID = "user_id";
    static final String CLAIM_EMAIL = "email";

    /** RSASSA-PKCS1-v1_5 family; anything else in the header is rejected before verification. */
    private static final Set<String> ACCEPTED_ALGORITHMS = Set.of("RS256", "RS384", "RS512");

    private final PrivateKey privateKey;
    private final RSAPublicKey publicKey;
    private final Duration accessTokenExpiration;
    private final String issuer;
    private final JwtParser parser;
    private final JwkSet jwks;

    public JwtService(KeyPair signingKeyPair, JwtProperties properties) {
        this.privateKey = signingKeyPair.getPrivate();
        this.publicKey = (RSAPublicKey) signingKeyPair.getPublic();
        this.accessTokenExpiration = properties.getAccessTokenExpiration();
        this.issuer = properties.getIssuer();
        this.parser = Jwts.parser()
                .keyLocator(new RsaKeyLocator())
                .requireIssuer(issuer)
                .build();
        this.jwks = buildJwks(publicKey);
    }

    /**
     * Generate Access Token (JWT) for authenticated user.
     *
     * Claims:
     * - user_id: User ID
     * - email: User email
     * - iss / sub: issuer and User ID
     * - iat / nbf: issued at
     * - exp: issued at + access token TTL
     *
     * @param user Authenticated user
     * @return signed JWT access token string
     */
    public String generateAccessToken(User user) {
        Instant now = Instant.now();
        Instant expiration = now.plus(accessTokenExpiration);

        return Jwts.builder()
                .issuer(issuer)
                .subject(user.getId())
                .claim(CLAIM_USER_ID, user.getId())
                .claim(CLAIM_EMAIL, user.getEmail())
                .issuedAt(Date.from(now))
                .notBefore(Date.from(now))
                .expiration(Date.from(expiration))
                .signWith(privateKey, Jwts.SIG.RS256)
                .compact();
    }

    /**
     * Validate token algorithm, signature, issuer and time window.
     *
     * @param token JWT token
     * @return verified claims
     * @throws AccessTokenValidationException with the failure reason
     */
    public AccessTokenClaims validateToken(String token) {
        try {
            Claims claims = parser.parseSignedClaims(token).getPayload();

            String userId = claims.get(CLAIM_USER_ID, String.class);
            if (userId == null || !userId.equals(claims.getSubject())) {
                throw rejected(Reason.INVALID_CLAIMS, "user_id does not match subject", null);
            }
            if (claims.getIssuedAt() == null || claims.getExpiration() == null) {
                throw rejected(Reason.INVALID_CLAIMS, "missing iat or exp", null);
            }

            return new AccessTokenClaims(
                    userId,
                    claims.get(CLAIM_EMAIL, String.class),
                    claims.getIssuer(),
                    claims.getIssuedAt().toInstant(),
                    claims.getExpiration().toInstant());
        } catch (UnexpectedAlgorithmException ex) {
            throw rejected(Reason.WRONG_ALGORITHM, ex.getMessage(), ex);
        } catch (ExpiredJwtException ex) {
            throw rejected(Reason.EXPIRED, ex.getMessage(), ex);
        } catch (PrematureJwtException ex) {
            throw rejected(Reason.NOT_YET_VALID, ex.getMessage(), ex);
        } catch (SignatureException ex) {
            throw rejected(Reason.BAD_SIGNATURE, ex.getMessage(), ex);
        } catch (InvalidClaimException ex) {
            throw rejected(Reason.INVALID_CLAIMS, ex.getMessage(), ex);
        } catch (JwtException | IllegalArgumentException ex) {
            throw rejected(Reason.MALFORMED, ex.getMessage(), ex);
        }
    }

    /**
     * Public key set in JWKS format. Built once; every call returns the same content.
     */
    public JwkSet getJwks() {
        return jwks;
    }

    /**
     * Access token lifetime in seconds, as reported in expires_in.
     */
    public long getAccessTokenTtlSeconds() {
        return accessTokenExpiration.toSeconds();
    }

    private static AccessTokenValidationException rejected(Reason reason, String detail, Throwable cause) {
        log.debug("Access token rejected: {} ({})", reason, detail);
        return new AccessTokenValidationException(reason, "Access token rejected: " + reason, cause);
    }

    private static JwkSet buildJwks(RSAPublicKey key) {
        RsaPublicJwk jwk = Jwks.builder()
                .key(key)
                .publicKeyUse("sig")
                .algorithm(Jwts.SIG.RS256.getId())
                .build();
        return Jwks.set().add(jwk).build();
    }

    private final class RsaKeyLocator extends LocatorAdapter<Key> {
        @Override
        protected Key locate(JwsHeader header) {
            String algorithm = header.getAlgorithm();
            if (!ACCEPTED_ALGORITHMS.contains(algorithm)) {
                throw new UnexpectedAlgorithmException("Unexpected signing algorithm: " + algorithm);
            }
            return publicKey;
        }
    }

    static final class UnexpectedAlgorithmException extends JwtException {
        UnexpectedAlgorithmException(String message) {
            super(message);
        }
    }
}
