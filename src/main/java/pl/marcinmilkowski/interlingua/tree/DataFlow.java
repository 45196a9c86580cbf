package pl.marcinmilkowski.interlingua.tree;

import pl.marcinmilkowski.interlingua.symbol.SymbolTable;

import java.util.List;
import java.util.Objects;

/**
 * A chain of processing steps, each optionally annotated with the type passed on.
 */
public record DataFlow(List<Step> steps) implements SemanticTree {

    /**
     * @param viaType type handed to the next step, may be {@code null}
     */
    public record Step(String name, String viaType) {
        public Step {
            Objects.requireNonNull(name, "name");
        }
    }

    public DataFlow {
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    @Override
    public Category category() {
        return Category.DATA_FLOW;
    }

    @Override
    public List<SemanticTree> children() {
        return List.of();
    }

    @Override
    public DataFlow ground(SymbolTable table) {
        return this;
    }
}
