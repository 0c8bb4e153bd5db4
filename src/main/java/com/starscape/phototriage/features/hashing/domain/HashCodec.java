package com.starscape.phototriage.features.hashing.domain;

import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Hex;

/**
 * Hex codec and Hamming distance for {@link PerceptualHash} values.
 *
 * <p>{@link #distance} sits on the O(n²) comparison path: it works word by word on the
 * backing array and allocates nothing.
 */
public final class HashCodec {

    private static final int WORD_BYTES = Long.BYTES;

    private HashCodec() {
    }

    /**
     * Count of differing bits between two hashes of the same width.
     *
     * @throws IllegalArgumentException if the widths differ
     */
    public static int distance(PerceptualHash a, PerceptualHash b) {
        int words = a.wordCount();
        if (words != b.wordCount()) {
            throw new IllegalArgumentException(
                "Cannot compare hashes of different widths: " + a.bitWidth() + " vs " + b.bitWidth());
        }
        int bits = 0;
        for (int i = 0; i < words; i++) {
            bits += Long.bitCount(a.word(i) ^ b.word(i));
        }
        return bits;
    }

    /**
     * Decode a hex string (as produced by common perceptual hashing tools) into a hash.
     * Returns null for a null or blank input: a missing hash is absent evidence, not an error.
     *
     * @throws IllegalArgumentException if the value is not hex or not a whole number of 64-bit words
     */
    public static PerceptualHash decode(String hex) {
        if (hex == null || hex.isBlank()) {
            return null;
        }
        byte[] bytes;
        try {
            bytes = Hex.decodeHex(hex.trim());
        } catch (DecoderException e) {
            throw new IllegalArgumentException("Malformed hash value: " + hex, e);
        }
        if (bytes.length == 0 || bytes.length % WORD_BYTES != 0) {
            throw new IllegalArgumentException(
                "Hash width must be a multiple of 64 bits, got " + (bytes.length * 8) + ": " + hex);
        }
        long[] words = new long[bytes.length / WORD_BYTES];
        for (int w = 0; w < words.length; w++) {
            long value = 0;
            for (int b = 0; b < WORD_BYTES; b++) {
                value = (value << 8) | (bytes[w * WORD_BYTES + b] & 0xFFL);
            }
            words[w] = value;
        }
        return PerceptualHash.ofWords(words);
    }

    /**
     * Lower-case hex form, the inverse of {@link #decode}.
     */
    public static String encode(PerceptualHash hash) {
        byte[] bytes = new byte[hash.wordCount() * WORD_BYTES];
        for (int w = 0; w < hash.wordCount(); w++) {
            long value = hash.word(w);
            for (int b = WORD_BYTES - 1; b >= 0; b--) {
                bytes[w * WORD_BYTES + b] = (byte) (value & 0xFF);
                value >>>= 8;
            }
        }
        return Hex.encodeHexString(bytes);
    }

    /**
     * Canonical stored form of a hex hash: validated and lower-cased.
     */
    public static String normalize(String hex) {
        PerceptualHash hash = decode(hex);
        return hash == null ? null : encode(hash);
    }
}
