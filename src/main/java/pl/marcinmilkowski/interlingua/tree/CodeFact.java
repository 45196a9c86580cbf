package pl.marcinmilkowski.interlingua.tree;

import pl.marcinmilkowski.interlingua.symbol.SymbolTable;

import java.util.List;
import java.util.Objects;

/**
 * A single fact about a code item, e.g. ("function", "parse", "parses input").
 */
public record CodeFact(String kind, String name, String detail) implements SemanticTree {

    public CodeFact {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(detail, "detail");
    }

    @Override
    public Category category() {
        return Category.CODE_FACT;
    }

    @Override
    public List<SemanticTree> children() {
        return List.of();
    }

    @Override
    public CodeFact ground(SymbolTable table) {
        return this;
    }
}
