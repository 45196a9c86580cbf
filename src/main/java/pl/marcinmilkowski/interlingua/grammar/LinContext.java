package pl.marcinmilkowski.interlingua.grammar;

import pl.marcinmilkowski.interlingua.lexicon.Language;
import pl.marcinmilkowski.interlingua.symbol.SymbolId;
import pl.marcinmilkowski.interlingua.symbol.SymbolTable;

import java.util.Objects;

/**
 * What a renderer may consult: an optional symbol table for canonical labels
 * and the target language.
 */
public record LinContext(SymbolTable table, Language language) {

    public LinContext {
        Objects.requireNonNull(language, "language");
    }

    public static LinContext empty() {
        return new LinContext(null, Language.ENGLISH);
    }

    public static LinContext of(SymbolTable table) {
        return new LinContext(table, Language.ENGLISH);
    }

    /**
     * Canonical label for a grounded node, or the node's own label when the
     * table is absent or does not know the symbol.
     */
    public String resolveLabel(String label, SymbolId symbol) {
        if (table != null && symbol != null) {
            return table.get(symbol).orElse(label);
        }
        return label;
    }
}
