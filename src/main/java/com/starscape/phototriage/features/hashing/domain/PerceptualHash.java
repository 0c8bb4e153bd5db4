package com.starscape.phototriage.features.hashing.domain;

import com.starscape.phototriage.common.domain.ValueObject;

import java.util.Arrays;

/**
 * Fixed-width perceptual fingerprint, stored as big-endian 64-bit words.
 * The bit width is always a multiple of 64.
 */
public final class PerceptualHash implements ValueObject {

    private final long[] words;

    private PerceptualHash(long[] words) {
        this.words = words;
    }

    public static PerceptualHash ofWords(long... words) {
        if (words == null || words.length == 0) {
            throw new IllegalArgumentException("Hash must contain at least one 64-bit word");
        }
        return new PerceptualHash(words.clone());
    }

    public int bitWidth() {
        return words.length * Long.SIZE;
    }

    int wordCount() {
        return words.length;
    }

    long word(int index) {
        return words[index];
    }

    /**
     * Bit-difference distance to another hash of the same width.
     */
    public int distanceTo(PerceptualHash other) {
        return HashCodec.distance(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PerceptualHash that)) return false;
        return Arrays.equals(words, that.words);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(words);
    }

    @Override
    public String toString() {
        return HashCodec.encode(this);
    }
}
