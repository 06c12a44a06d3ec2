package com.positionalert.common.id;

import java.security.SecureRandom;
import java.time.Instant;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * ULID ids for alert events and state rows: 48-bit millisecond timestamp followed by
 * 80 random bits, written as 26 Crockford Base32 characters so ids sort by creation time.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class UlidGenerator {

    private static final char[] ALPHABET = "0123456789ABCDEFGHJKMNPQRSTVWXYZ".toCharArray();
    private static final int TIME_CHARS = 10;
    private static final int RANDOM_CHARS = 16;
    private static final SecureRandom RANDOM = new SecureRandom();

    public static String generate() {
        return generate(Instant.now());
    }

    public static String generate(Instant at) {
        var random = new byte[10];
        RANDOM.nextBytes(random);
        var out = new StringBuilder(TIME_CHARS + RANDOM_CHARS);
        long millis = at.toEpochMilli();
        for (int i = TIME_CHARS - 1; i >= 0; i--) {
            out.append(ALPHABET[(int) ((millis >>> (i * 5)) & 0x1F)]);
        }
        for (int i = 0; i < RANDOM_CHARS; i++) {
            out.append(ALPHABET[fiveBits(random, i * 5)]);
        }
        return out.toString();
    }

    private static int fiveBits(byte[] bytes, int bitOffset) {
        int value = 0;
        for (int bit = bitOffset; bit < bitOffset + 5; bit++) {
            int b = bytes[bit / 8] & 0xFF;
            value = (value << 1) | ((b >>> (7 - bit % 8)) & 1);
        }
        return value;
    }
}
