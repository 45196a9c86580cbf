package pl.marcinmilkowski.interlingua.tree;

import pl.marcinmilkowski.interlingua.symbol.SymbolTable;

import java.util.List;
import java.util.Objects;

/**
 * Something known to be missing about an entity.
 */
public record Gap(SemanticTree entity, String description) implements SemanticTree {

    public Gap {
        Objects.requireNonNull(entity, "entity");
        Objects.requireNonNull(description, "description");
    }

    @Override
    public Category category() {
        return Category.GAP;
    }

    @Override
    public List<SemanticTree> children() {
        return List.of(entity);
    }

    @Override
    public Gap ground(SymbolTable table) {
        return new Gap(entity.ground(table), description);
    }
}
