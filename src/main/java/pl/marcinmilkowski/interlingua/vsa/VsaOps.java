package pl.marcinmilkowski.interlingua.vsa;

import pl.marcinmilkowski.interlingua.error.VsaException;
import pl.marcinmilkowski.interlingua.symbol.SymbolId;

import java.util.List;
import java.util.SplittableRandom;

/**
 * Vector-symbolic algebra over bipolar hypervectors of a fixed dimension.
 *
 * <ul>
 *   <li>{@code bind} is element-wise XOR (its own inverse, so {@code unbind == bind})</li>
 *   <li>{@code bundle} is a per-dimension majority vote; ties go to +1 on even positions</li>
 *   <li>{@code permute} is a cyclic bit rotation</li>
 *   <li>{@code similarity} is {@code 1 - hamming / dimension}</li>
 * </ul>
 */
public class VsaOps {

    private final int dimension;

    public VsaOps(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("Dimension must be positive: " + dimension);
        }
        this.dimension = dimension;
    }

    public int dimension() {
        return dimension;
    }

    /**
     * Deterministic pseudo-random vector for a seed.
     */
    public HyperVector random(long seed) {
        SplittableRandom rng = new SplittableRandom(seed);
        long[] words = new long[HyperVector.wordCount(dimension)];
        for (int i = 0; i < words.length; i++) {
            words[i] = rng.nextLong();
        }
        words[words.length - 1] &= HyperVector.lastWordMask(dimension);
        return new HyperVector(dimension, words);
    }

    public HyperVector encodeSymbol(SymbolId id) {
        return random(id.value());
    }

    /**
     * Hash a free-text label into a vector. Case-insensitive and stable across runs.
     */
    public HyperVector encodeLabel(String label) {
        return encodeSymbol(SymbolId.derived(label));
    }

    public HyperVector bind(HyperVector a, HyperVector b) throws VsaException {
        check(a);
        check(b);
        long[] out = new long[a.words()];
        for (int i = 0; i < out.length; i++) {
            out[i] = a.word(i) ^ b.word(i);
        }
        return new HyperVector(dimension, out);
    }

    public HyperVector unbind(HyperVector bound, HyperVector key) throws VsaException {
        return bind(bound, key);
    }

    public HyperVector bundle(List<HyperVector> vectors) throws VsaException {
        if (vectors.isEmpty()) {
            throw new VsaException("cannot bundle an empty set of vectors");
        }
        if (vectors.size() == 1) {
            check(vectors.get(0));
            return vectors.get(0);
        }
        short[] acc = new short[dimension];
        for (HyperVector v : vectors) {
            check(v);
            for (int i = 0; i < dimension; i++) {
                acc[i] += v.bit(i) ? 1 : -1;
            }
        }
        long[] out = new long[HyperVector.wordCount(dimension)];
        for (int i = 0; i < dimension; i++) {
            boolean one = acc[i] > 0 || (acc[i] == 0 && i % 2 == 0);
            if (one) {
                out[i >>> 6] |= 1L << (i & 63);
            }
        }
        return new HyperVector(dimension, out);
    }

    /**
     * Rotate by {@code shift} positions; negative shifts rotate the other way.
     */
    public HyperVector permute(HyperVector v, int shift) throws VsaException {
        check(v);
        int s = Math.floorMod(shift, dimension);
        if (s == 0) {
            return v;
        }
        long[] out = new long[HyperVector.wordCount(dimension)];
        for (int i = 0; i < dimension; i++) {
            if (v.bit(i)) {
                int j = (i + s) % dimension;
                out[j >>> 6] |= 1L << (j & 63);
            }
        }
        return new HyperVector(dimension, out);
    }

    public double similarity(HyperVector a, HyperVector b) throws VsaException {
        check(a);
        check(b);
        return 1.0 - (double) a.hamming(b) / dimension;
    }

    private void check(HyperVector v) throws VsaException {
        if (v.dimension() != dimension) {
            throw VsaException.dimensionMismatch(dimension, v.dimension());
        }
    }
}
