package com.example.authservice.security;

import com.example.authservice.exception.KeyMaterialException;
import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.asn1.x509.SubjectPublicKeyInfo;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;

/**
 * Reads RSA keys from PEM files.
 *
 * <p>Private keys may be PKCS#1 ({@code RSA PRIVATE KEY}) or PKCS#8 ({@code PRIVATE KEY}).
 * Public keys may be PKCS#1 ({@code RSA PUBLIC KEY}) or X.509 ({@code PUBLIC KEY}).
 */
public final class RsaKeyLoader {

    private static final Logger log = LoggerFactory.getLogger(RsaKeyLoader.class);

    private RsaKeyLoader() {
    }

    /**
     * Load and cross-check a private/public key pair.
     *
     * @throws KeyMaterialException if a key cannot be read or the two keys do not belong together
     */
    public static KeyPair loadKeyPair(Resource privateKeyLocation, Resource publicKeyLocation) {
        RSAPrivateKey privateKey = loadPrivateKey(privateKeyLocation);
        RSAPublicKey publicKey = loadPublicKey(publicKeyLocation);

        if (!privateKey.getModulus().equals(publicKey.getModulus())) {
            throw new KeyMaterialException("Public key does not match private key");
        }

        log.info("Loaded {}-bit RSA signing key pair", publicKey.getModulus().bitLength());
        return new KeyPair(publicKey, privateKey);
    }

    public static RSAPrivateKey loadPrivateKey(Resource location) {
        Object pem = readPemObject(location, "private");
        JcaPEMKeyConverter converter = new JcaPEMKeyConverter();
        PrivateKey key;
        try {
            if (pem instanceof PEMKeyPair keyPair) {
                key = converter.getPrivateKey(keyPair.getPrivateKeyInfo());
            } else if (pem instanceof PrivateKeyInfo keyInfo) {
                key = converter.getPrivateKey(keyInfo);
            } else {
                throw new KeyMaterialException("Unsupported private key format in " + location.getDescription());
            }
        } catch (IOException ex) {
            throw new KeyMaterialException("Failed to convert private key from " + location.getDescription(), ex);
        }

        if (key instanceof RSAPrivateKey rsaKey) {
            return rsaKey;
        }
        throw new KeyMaterialException("Not an RSA private key: " + location.getDescription());
    }

    public static RSAPublicKey loadPublicKey(Resource location) {
        Object pem = readPemObject(location, "public");
        if (!(pem instanceof SubjectPublicKeyInfo keyInfo)) {
            throw new KeyMaterialException("Unsupported public key format in " + location.getDescription());
        }

        PublicKey key;
        try {
            key = new JcaPEMKeyConverter().getPublicKey(keyInfo);
        } catch (IOException ex) {
            throw new KeyMaterialException("Failed to convert public key from " + location.getDescription(), ex);
        }

        if (key instanceof RSAPublicKey rsaKey) {
            return rsaKey;
        }
        throw new KeyMaterialException("Not an RSA public key: " + location.getDescription());
    }

    private static Object readPemObject(Resource location, String kind) {
        if (location == null) {
            throw new KeyMaterialException("No " + kind + " key location configured");
        }
        try (Reader reader = new InputStreamReader(location.getInputStream(), StandardCharsets.US_ASCII);
             PEMParser parser = new PEMParser(reader)) {
            Object pem = parser.readObject();
            if (pem == null) {
                throw new KeyMaterialException("No PEM block found in " + location.getDescription());
            }
            return pem;
        } catch (IOException | IllegalArgumentException ex) {
            throw new KeyMaterialException("Failed to read " + kind + " key from " + location.getDescription(), ex);
        }
    }
}
