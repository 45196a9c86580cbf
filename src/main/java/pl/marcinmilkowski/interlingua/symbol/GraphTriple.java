package pl.marcinmilkowski.interlingua.symbol;

/**
 * A stored (subject, predicate, object) edge with its confidence.
 */
public record GraphTriple(SymbolId subject, SymbolId predicate, SymbolId object, float confidence) {

    public GraphTriple(SymbolId subject, SymbolId predicate, SymbolId object) {
        this(subject, predicate, object, 1.0f);
    }
}
