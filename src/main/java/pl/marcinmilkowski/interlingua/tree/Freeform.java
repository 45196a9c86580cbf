package pl.marcinmilkowski.interlingua.tree;

import pl.marcinmilkowski.interlingua.symbol.SymbolTable;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Text no structured reading was found for.
 */
public record Freeform(String text) implements SemanticTree {

    public Freeform {
        Objects.requireNonNull(text, "text");
    }

    @Override
    public Category category() {
        return Category.FREEFORM;
    }

    @Override
    public List<SemanticTree> children() {
        return List.of();
    }

    @Override
    public Freeform ground(SymbolTable table) {
        return this;
    }

    @Override
    public Optional<String> nodeLabel() {
        return Optional.of(text);
    }
}
