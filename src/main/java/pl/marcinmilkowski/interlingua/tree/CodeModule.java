package pl.marcinmilkowski.interlingua.tree;

import pl.marcinmilkowski.interlingua.symbol.SymbolTable;

import java.util.List;
import java.util.Objects;

/**
 * A module of source code and the items it contains.
 *
 * @param role short statement of what the module is for, may be {@code null}
 * @param importance relevance in [0, 1], may be {@code null}
 * @param docSummary first paragraph of the module documentation, may be {@code null}
 */
public record CodeModule(
    String name,
    String role,
    Double importance,
    String docSummary,
    List<SemanticTree> children
) implements SemanticTree {

    public CodeModule {
        Objects.requireNonNull(name, "name");
        children = children == null ? List.of() : List.copyOf(children);
    }

    public CodeModule(String name, List<SemanticTree> children) {
        this(name, null, null, null, children);
    }

    @Override
    public Category category() {
        return Category.CODE_MODULE;
    }

    @Override
    public CodeModule ground(SymbolTable table) {
        return new CodeModule(name, role, importance, docSummary, SemanticTree.groundAll(children, table));
    }
}
