package pl.marcinmilkowski.interlingua.lexer;

import pl.marcinmilkowski.interlingua.symbol.SymbolId;

import java.util.Optional;

/**
 * How a token was tied to a symbol.
 *
 * @param symbol resolved symbol, {@code null} for {@link Type#UNRESOLVED}
 * @param similarity match similarity for {@link Type#FUZZY}, 1.0 otherwise
 * @param wordCount number of words merged for {@link Type#COMPOUND}, 1 otherwise
 */
public record Resolution(Type type, SymbolId symbol, double similarity, int wordCount) {

    public enum Type {
        EXACT,
        FUZZY,
        COMPOUND,
        UNRESOLVED
    }

    private static final Resolution UNRESOLVED = new Resolution(Type.UNRESOLVED, null, 0.0, 1);

    public static Resolution exact(SymbolId id) {
        return new Resolution(Type.EXACT, id, 1.0, 1);
    }

    public static Resolution fuzzy(SymbolId id, double similarity) {
        return new Resolution(Type.FUZZY, id, similarity, 1);
    }

    public static Resolution compound(SymbolId id, int wordCount) {
        return new Resolution(Type.COMPOUND, id, 1.0, wordCount);
    }

    public static Resolution unresolved() {
        return UNRESOLVED;
    }

    public boolean isResolved() {
        return type != Type.UNRESOLVED;
    }

    public Optional<SymbolId> symbolId() {
        return Optional.ofNullable(symbol);
    }
}
