package pl.marcinmilkowski.interlingua.tree;

import pl.marcinmilkowski.interlingua.symbol.SymbolTable;

import java.util.List;
import java.util.Objects;

/**
 * Records where its inner node came from.
 */
public record WithProvenance(SemanticTree inner, ProvenanceTag tag) implements SemanticTree {

    public WithProvenance {
        Objects.requireNonNull(inner, "inner");
        Objects.requireNonNull(tag, "tag");
    }

    @Override
    public Category category() {
        return Category.PROVENANCE;
    }

    @Override
    public List<SemanticTree> children() {
        return List.of(inner);
    }

    @Override
    public WithProvenance ground(SymbolTable table) {
        return new WithProvenance(inner.ground(table), tag);
    }

    @Override
    public int nodeCount() {
        return inner.nodeCount();
    }
}
