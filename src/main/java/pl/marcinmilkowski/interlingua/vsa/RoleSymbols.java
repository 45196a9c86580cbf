package pl.marcinmilkowski.interlingua.vsa;

import pl.marcinmilkowski.interlingua.symbol.SymbolId;

/**
 * Well-known role identifiers for role-filler binding.
 *
 * Derived by hashing fixed names into the reserved id range, so they are stable
 * across runs and never collide with allocated symbols.
 */
public record RoleSymbols(
    SymbolId subject,
    SymbolId predicate,
    SymbolId object,
    SymbolId entity,
    SymbolId similarTo,
    SymbolId sectionHeading,
    SymbolId document
) {

    private static final RoleSymbols STANDARD = new RoleSymbols(
        SymbolId.derived("role:subject"),
        SymbolId.derived("role:predicate"),
        SymbolId.derived("role:object"),
        SymbolId.derived("role:entity"),
        SymbolId.derived("role:similar-to"),
        SymbolId.derived("role:section-heading"),
        SymbolId.derived("role:document"));

    public static RoleSymbols standard() {
        return STANDARD;
    }
}
