package pl.marcinmilkowski.interlingua.tree;

import pl.marcinmilkowski.interlingua.symbol.SymbolTable;

import java.util.List;

/**
 * Items joined by "and" ({@code isAnd}) or "or".
 */
public record Conjunction(List<SemanticTree> items, boolean isAnd) implements SemanticTree {

    public Conjunction {
        items = items == null ? List.of() : List.copyOf(items);
    }

    @Override
    public Category category() {
        return Category.CONJUNCTION;
    }

    @Override
    public List<SemanticTree> children() {
        return items;
    }

    @Override
    public Conjunction ground(SymbolTable table) {
        return new Conjunction(SemanticTree.groundAll(items, table), isAnd);
    }
}
