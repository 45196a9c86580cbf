package pl.marcinmilkowski.interlingua.tree;

import pl.marcinmilkowski.interlingua.symbol.SymbolTable;

import java.util.List;
import java.util.Objects;

/**
 * Point of view and query focus for a response, for renderers that vary person or voice.
 */
public record DiscourseFrame(SemanticTree inner, PointOfView pointOfView, QueryFocus focus)
        implements SemanticTree {

    public DiscourseFrame {
        Objects.requireNonNull(inner, "inner");
        Objects.requireNonNull(pointOfView, "pointOfView");
        Objects.requireNonNull(focus, "focus");
    }

    @Override
    public Category category() {
        return Category.DISCOURSE_FRAME;
    }

    @Override
    public List<SemanticTree> children() {
        return List.of(inner);
    }

    @Override
    public DiscourseFrame ground(SymbolTable table) {
        return new DiscourseFrame(inner.ground(table), pointOfView, focus);
    }

    @Override
    public int nodeCount() {
        return inner.nodeCount();
    }
}
