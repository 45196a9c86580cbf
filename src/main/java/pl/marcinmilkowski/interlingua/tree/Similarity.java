package pl.marcinmilkowski.interlingua.tree;

import pl.marcinmilkowski.interlingua.symbol.SymbolTable;

import java.util.List;
import java.util.Objects;

/**
 * Two things found similar, with a score in [0, 1].
 */
public record Similarity(SemanticTree entity, SemanticTree similarTo, double score) implements SemanticTree {

    public Similarity {
        Objects.requireNonNull(entity, "entity");
        Objects.requireNonNull(similarTo, "similarTo");
    }

    @Override
    public Category category() {
        return Category.SIMILARITY;
    }

    @Override
    public List<SemanticTree> children() {
        return List.of(entity, similarTo);
    }

    @Override
    public Similarity ground(SymbolTable table) {
        return new Similarity(entity.ground(table), similarTo.ground(table), score);
    }
}
