package pl.marcinmilkowski.interlingua.vsa;

import java.util.Arrays;

/**
 * Immutable bipolar hypervector, bit-packed into longs.
 *
 * A set bit stands for +1, a clear bit for -1. Bits beyond {@link #dimension()}
 * in the last word are always zero.
 */
public final class HyperVector {

    private final int dimension;
    private final long[] words;

    HyperVector(int dimension, long[] words) {
        this.dimension = dimension;
        this.words = words;
    }

    static int wordCount(int dimension) {
        return (dimension + 63) >>> 6;
    }

    static long lastWordMask(int dimension) {
        int rem = dimension & 63;
        return rem == 0 ? -1L : (1L << rem) - 1;
    }

    public int dimension() {
        return dimension;
    }

    public boolean bit(int index) {
        if (index < 0 || index >= dimension) {
            throw new IndexOutOfBoundsException("bit " + index + " outside dimension " + dimension);
        }
        return (words[index >>> 6] & (1L << (index & 63))) != 0;
    }

    long word(int i) {
        return words[i];
    }

    int words() {
        return words.length;
    }

    /**
     * Number of positions where the two vectors differ. Both must share a dimension.
     */
    int hamming(HyperVector other) {
        int distance = 0;
        for (int i = 0; i < words.length; i++) {
            distance += Long.bitCount(words[i] ^ other.words[i]);
        }
        return distance;
    }

    /**
     * Bipolar float view (+1/-1) for the ANN index.
     */
    public float[] toFloats() {
        float[] out = new float[dimension];
        for (int i = 0; i < dimension; i++) {
            out[i] = bit(i) ? 1.0f : -1.0f;
        }
        return out;
    }

    /**
     * Packed byte view, 8 dimensions per byte, least significant bit first.
     */
    public byte[] toBytes() {
        byte[] out = new byte[(dimension + 7) >>> 3];
        for (int i = 0; i < out.length; i++) {
            out[i] = (byte) (words[i >>> 3] >>> ((i & 7) * 8));
        }
        return out;
    }

    static HyperVector fromBytes(int dimension, byte[] bytes) {
        long[] words = new long[wordCount(dimension)];
        for (int i = 0; i < bytes.length && (i >>> 3) < words.length; i++) {
            words[i >>> 3] |= (bytes[i] & 0xffL) << ((i & 7) * 8);
        }
        words[words.length - 1] &= lastWordMask(dimension);
        return new HyperVector(dimension, words);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HyperVector other)) return false;
        return dimension == other.dimension && Arrays.equals(words, other.words);
    }

    @Override
    public int hashCode() {
        return 31 * dimension + Arrays.hashCode(words);
    }

    @Override
    public String toString() {
        return "HyperVector[dim=" + dimension + ", ones=" + Arrays.stream(words).map(Long::bitCount).sum() + "]";
    }
}
