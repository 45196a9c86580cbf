package pl.marcinmilkowski.interlingua.symbol;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Identity of a symbol in the knowledge graph.
 *
 * Ids are non-zero. Ids with the top bit set are reserved for derived symbols
 * (role vectors, hashed labels) and are never handed out by a symbol table.
 */
public record SymbolId(long value) {

    public static final long RESERVED_BIT = 1L << 63;

    private static final long FNV_OFFSET = 0xcbf29ce484222325L;
    private static final long FNV_PRIME = 0x100000001b3L;

    public SymbolId {
        if (value == 0) {
            throw new IllegalArgumentException("Symbol id must be non-zero");
        }
    }

    public static SymbolId of(long value) {
        return new SymbolId(value);
    }

    /**
     * Derive a reserved-range id from a label. The label is lowercased, so
     * surface variants in case map to the same id.
     */
    public static SymbolId derived(String label) {
        return new SymbolId(fnv1a(label.toLowerCase(Locale.ROOT)) | RESERVED_BIT);
    }

    public boolean isReserved() {
        return (value & RESERVED_BIT) != 0;
    }

    static long fnv1a(String text) {
        long hash = FNV_OFFSET;
        for (byte b : text.getBytes(StandardCharsets.UTF_8)) {
            hash ^= (b & 0xff);
            hash *= FNV_PRIME;
        }
        return hash;
    }

    @Override
    public String toString() {
        return Long.toUnsignedString(value);
    }
}
