package pl.marcinmilkowski.interlingua.tree;

import pl.marcinmilkowski.interlingua.error.TypeMismatchException;
import pl.marcinmilkowski.interlingua.symbol.SymbolTable;

import java.util.List;
import java.util.Objects;

/**
 * Attaches a confidence in [0, 1] to its inner node.
 */
public record WithConfidence(SemanticTree inner, double confidence) implements SemanticTree {

    public WithConfidence {
        Objects.requireNonNull(inner, "inner");
    }

    @Override
    public Category category() {
        return Category.CONFIDENCE;
    }

    @Override
    public List<SemanticTree> children() {
        return List.of(inner);
    }

    @Override
    public WithConfidence ground(SymbolTable table) {
        return new WithConfidence(inner.ground(table), confidence);
    }

    @Override
    public void validate() throws TypeMismatchException {
        if (!(confidence >= 0.0 && confidence <= 1.0)) {
            throw new TypeMismatchException(Category.CONFIDENCE, Category.FREEFORM);
        }
        inner.validate();
    }

    @Override
    public int nodeCount() {
        return inner.nodeCount();
    }
}
