package pl.marcinmilkowski.interlingua.tree;

import pl.marcinmilkowski.interlingua.symbol.SymbolTable;

import java.util.List;
import java.util.Objects;

/**
 * A headed group of statements.
 */
public record Section(String heading, List<SemanticTree> body) implements SemanticTree {

    public Section {
        Objects.requireNonNull(heading, "heading");
        body = body == null ? List.of() : List.copyOf(body);
    }

    @Override
    public Category category() {
        return Category.SECTION;
    }

    @Override
    public List<SemanticTree> children() {
        return body;
    }

    @Override
    public Section ground(SymbolTable table) {
        return new Section(heading, SemanticTree.groundAll(body, table));
    }
}
