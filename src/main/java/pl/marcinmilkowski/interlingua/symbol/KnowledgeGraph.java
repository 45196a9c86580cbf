package pl.marcinmilkowski.interlingua.symbol;

import java.util.List;
import java.util.Optional;

/**
 * The triple store this library reads from. Implemented outside this project;
 * {@link InMemoryKnowledgeGraph} is a reference implementation.
 */
public interface KnowledgeGraph extends SymbolTable {

    /**
     * Resolve a label to its symbol, case-insensitively.
     */
    Optional<SymbolId> resolveSymbol(String label);

    /**
     * Label of a symbol, or {@code "sym:<id>"} when it has none.
     */
    String resolveLabel(SymbolId id);

    List<GraphTriple> triplesFrom(SymbolId subject);

    List<GraphTriple> triplesTo(SymbolId object);
}
