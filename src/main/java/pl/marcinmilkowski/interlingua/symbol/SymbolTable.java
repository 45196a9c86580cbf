package pl.marcinmilkowski.interlingua.symbol;

import java.util.Optional;

/**
 * Label registry consulted by the lexer, grounding and renderers.
 * Lookups are case-insensitive.
 */
public interface SymbolTable {

    Optional<SymbolId> lookup(String label);

    Optional<String> get(SymbolId id);
}
