package com.example.authservice.service;

import com.example.authservice.exception.CredentialHashException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.util.regex.Pattern;

/**
 * Password hashing and verification with BCrypt.
 *
 * Hashes are self-describing ($2a$10$ + salt + digest), so verification needs
 * nothing but the stored string. Plaintext passwords are never stored or logged.
 */
@Service
public class CredentialVerifier {

    private static final Pattern BCRYPT_PATTERN = Pattern.compile("\\A\\$2([aby])?\\$\\d\\d\\$[./0-9A-Za-z]{53}");

    private final PasswordEncoder passwordEncoder;
    private final String dummyHash;

    public CredentialVerifier(PasswordEncoder passwordEncoder) {
        this.passwordEncoder = passwordEncoder;
        this.dummyHash = passwordEncoder.encode("timing-equalization-only");
    }

    /**
     * Hash a password with a fresh random salt.
     */
    public String hash(String password) {
        return passwordEncoder.encode(password);
    }

    /**
     * Compare a password against a stored hash (constant-time comparison).
     *
     * @return true if the password matches, false otherwise
     * @throws CredentialHashException if the stored hash is not a BCrypt hash
     */
    public boolean verify(String password, String hash) {
        if (hash == null || !BCRYPT_PATTERN.matcher(hash).matches()) {
            throw new CredentialHashException("Stored password hash is malformed");
        }
        return passwordEncoder.matches(password, hash);
    }

    /**
     * Spend one comparison's worth of work when there is no account to check,
     * so unknown emails cost as much as wrong passwords.
     */
    public void verifyAgainstDummy(String password) {
        passwordEncoder.matches(password, dummyHash);
    }
}
