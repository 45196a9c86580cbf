package pl.marcinmilkowski.interlingua.parser;

import pl.marcinmilkowski.interlingua.lexicon.Language;
import pl.marcinmilkowski.interlingua.lexicon.Lexicon;
import pl.marcinmilkowski.interlingua.symbol.SymbolTable;
import pl.marcinmilkowski.interlingua.vsa.HypervectorIndex;

import java.util.Objects;

/**
 * What a parse may consult: an optional symbol table, an optional vector index
 * for fuzzy token resolution, and the input language.
 */
public record ParseContext(SymbolTable table, HypervectorIndex index, Language language) {

    public ParseContext {
        Objects.requireNonNull(language, "language");
    }

    /**
     * English, without symbol resolution.
     */
    public static ParseContext empty() {
        return new ParseContext(null, null, Language.ENGLISH);
    }

    public static ParseContext of(Language language) {
        return new ParseContext(null, null, language);
    }

    public static ParseContext of(SymbolTable table, HypervectorIndex index) {
        return new ParseContext(table, index, Language.ENGLISH);
    }

    public ParseContext withLanguage(Language newLanguage) {
        return new ParseContext(table, index, newLanguage);
    }

    public Lexicon lexicon() {
        return Lexicon.forLanguage(language);
    }
}
