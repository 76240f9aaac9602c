package com.birthdayreminder.common.id;

import java.security.SecureRandom;
import java.time.Instant;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * Generates ULIDs used as primary keys for accounts, birthdays and notifications.
 * Layout: 48-bit millisecond timestamp (10 chars) followed by 80 random bits (16 chars),
 * Crockford Base32, 26 chars in total. Ids sort by creation millisecond.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class UlidGenerator {

    public static final int LENGTH = 26;

    private static final char[] ALPHABET = "0123456789ABCDEFGHJKMNPQRSTVWXYZ".toCharArray();
    private static final int TIMESTAMP_CHARS = 10;
    private static final int RANDOM_BYTES = 10;
    private static final long MAX_TIMESTAMP = (1L << 48) - 1;
    private static final SecureRandom RANDOM = new SecureRandom();

    public static String generate() {
        return generate(Instant.now());
    }

    public static String generate(Instant createdAt) {
        var millis = createdAt.toEpochMilli();
        if (millis < 0 || millis > MAX_TIMESTAMP) {
            throw new IllegalArgumentException("ULID timestamp out of range: " + createdAt);
        }
        var randomness = new byte[RANDOM_BYTES];
        RANDOM.nextBytes(randomness);

        var chars = new char[LENGTH];
        for (int i = TIMESTAMP_CHARS - 1; i >= 0; i--) {
            chars[i] = ALPHABET[(int) (millis & 0x1F)];
            millis >>>= 5;
        }
        // 80 bits split into two 40-bit halves, each yields 8 chars
        writeFortyBits(chars, TIMESTAMP_CHARS, randomness, 0);
        writeFortyBits(chars, TIMESTAMP_CHARS + 8, randomness, 5);
        return new String(chars);
    }

    private static void writeFortyBits(char[] chars, int offset, byte[] bytes, int from) {
        long bits = 0;
        for (int i = from; i < from + 5; i++) {
            bits = (bits << 8) | (bytes[i] & 0xFF);
        }
        for (int i = offset + 7; i >= offset; i--) {
            chars[i] = ALPHABET[(int) (bits & 0x1F)];
            bits >>>= 5;
        }
    }
}
