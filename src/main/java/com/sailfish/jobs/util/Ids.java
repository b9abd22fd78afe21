package com.sailfish.jobs.util;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Generates identifiers whose lexical order follows creation time.
 *
 * <p>An id is 20 lowercase base-36 characters: 9 characters of epoch milliseconds,
 * 4 characters of a per-process sequence that keeps ids created within the same
 * millisecond ordered, and 7 random characters to keep ids from different processes
 * apart. Only digits and lowercase letters are used so that every database collation
 * sorts them the same way.
 */
public final class Ids {

    private static final char[] ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz".toCharArray();
    private static final int TIME_LENGTH = 9;
    private static final int SEQUENCE_LENGTH = 4;
    private static final int RANDOM_LENGTH = 7;
    private static final long MAX_SEQUENCE = pow(ALPHABET.length, SEQUENCE_LENGTH);

    private static long lastMillis = -1L;
    private static long sequence = 0L;

    private Ids() {
    }

    public static String newId() {
        long millis;
        long seq;
        synchronized (Ids.class) {
            millis = Math.max(System.currentTimeMillis(), lastMillis);
            if (millis == lastMillis) {
                sequence++;
                if (sequence >= MAX_SEQUENCE) {
                    // sequence exhausted, borrow the next millisecond
                    millis++;
                    sequence = 0L;
                }
            } else {
                sequence = 0L;
            }
            lastMillis = millis;
            seq = sequence;
        }

        char[] id = new char[TIME_LENGTH + SEQUENCE_LENGTH + RANDOM_LENGTH];
        encode(millis, id, 0, TIME_LENGTH);
        encode(seq, id, TIME_LENGTH, SEQUENCE_LENGTH);
        ThreadLocalRandom random = ThreadLocalRandom.current();
        for (int i = TIME_LENGTH + SEQUENCE_LENGTH; i < id.length; i++) {
            id[i] = ALPHABET[random.nextInt(ALPHABET.length)];
        }
        return new String(id);
    }

    private static void encode(long value, char[] target, int offset, int length) {
        long remaining = value;
        for (int i = offset + length - 1; i >= offset; i--) {
            target[i] = ALPHABET[(int) (remaining % ALPHABET.length)];
            remaining /= ALPHABET.length;
        }
    }

    private static long pow(int base, int exponent) {
        long result = 1L;
        for (int i = 0; i < exponent; i++) {
            result *= base;
        }
        return result;
    }
}
