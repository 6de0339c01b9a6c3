package com.example.authservice.entity;

import java.security.SecureRandom;

/**
 * Generates account identifiers.
 *
 * <p>Identifiers are 16 characters drawn from an alphabet without the
 * easily confused characters 0, 1, I, O, l and o (about 92 bits of entropy).
 */
public final class AccountIdGenerator {

    static final int ID_LENGTH = 16;

    private static final char[] ALPHABET =
            "23456789ABCDEFGHJKLMNPQRSTUVWXYZabcdefghijkmnpqrstuvwxyz".toCharArray();
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private AccountIdGenerator() {
    }

    public static String generate() {
        char[] id = new char[ID_LENGTH];
        for (int i = 0; i < ID_LENGTH; i++) {
            id[i] = ALPHABET[SECURE_RANDOM.nextInt(ALPHABET.length)];
        }
        return new String(id);
    }
}
