package com.openforge.posgate.common;

import java.security.SecureRandom;

/**
 * Opaque public identifiers: {@code <prefix>_<base36 millis><random>}.
 */
public final class Ids {

    private static final SecureRandom RANDOM   = new SecureRandom();
    private static final char[]       ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz".toCharArray();

    private Ids() {}

    public static String next(String prefix) {
        return prefix + "_" + Long.toString(System.currentTimeMillis(), 36) + random(7);
    }

    public static String random(int length) {
        char[] out = new char[length];
        for (int i = 0; i < length; i++) {
            out[i] = ALPHABET[RANDOM.nextInt(ALPHABET.length)];
        }
        return new String(out);
    }
}
