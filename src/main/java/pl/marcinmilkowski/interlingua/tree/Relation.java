package pl.marcinmilkowski.interlingua.tree;

import pl.marcinmilkowski.interlingua.symbol.SymbolId;
import pl.marcinmilkowski.interlingua.symbol.SymbolTable;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Predicate label, optionally resolved to a symbol.
 *
 * @param symbol resolved id, or {@code null} while ungrounded
 */
public record Relation(String label, SymbolId symbol) implements SemanticTree {

    public Relation {
        Objects.requireNonNull(label, "label");
    }

    @Override
    public Category category() {
        return Category.RELATION;
    }

    @Override
    public List<SemanticTree> children() {
        return List.of();
    }

    @Override
    public Relation ground(SymbolTable table) {
        if (symbol != null) {
            return this;
        }
        return table.lookup(label).map(id -> new Relation(label, id)).orElse(this);
    }

    @Override
    public Optional<SymbolId> symbolId() {
        return Optional.ofNullable(symbol);
    }

    @Override
    public Optional<String> nodeLabel() {
        return Optional.of(label);
    }

    @Override
    public int unresolvedCount() {
        return symbol == null ? 1 : 0;
    }

    @Override
    public Optional<String> firstUnresolved() {
        return symbol == null ? Optional.of(label) : Optional.empty();
    }

    @Override
    public void collectLabels(List<String> out) {
        out.add(label);
    }
}
