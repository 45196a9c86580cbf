package pl.marcinmilkowski.interlingua.tree;

import pl.marcinmilkowski.interlingua.symbol.SymbolTable;

import java.util.List;
import java.util.Objects;

/**
 * A symbolic expression and what it simplifies to.
 */
public record Inference(String expression, String simplified) implements SemanticTree {

    public Inference {
        Objects.requireNonNull(expression, "expression");
        Objects.requireNonNull(simplified, "simplified");
    }

    @Override
    public Category category() {
        return Category.INFERENCE;
    }

    @Override
    public List<SemanticTree> children() {
        return List.of();
    }

    @Override
    public Inference ground(SymbolTable table) {
        return this;
    }
}
