package pl.marcinmilkowski.interlingua.tree;

import pl.marcinmilkowski.interlingua.symbol.SymbolTable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A complete document: an overview, sections and open knowledge gaps.
 */
public record Document(SemanticTree overview, List<SemanticTree> sections, List<SemanticTree> gaps)
        implements SemanticTree {

    public Document {
        Objects.requireNonNull(overview, "overview");
        sections = sections == null ? List.of() : List.copyOf(sections);
        gaps = gaps == null ? List.of() : List.copyOf(gaps);
    }

    @Override
    public Category category() {
        return Category.DOCUMENT;
    }

    @Override
    public List<SemanticTree> children() {
        List<SemanticTree> all = new ArrayList<>(1 + sections.size() + gaps.size());
        all.add(overview);
        all.addAll(sections);
        all.addAll(gaps);
        return all;
    }

    @Override
    public Document ground(SymbolTable table) {
        return new Document(overview.ground(table),
            SemanticTree.groundAll(sections, table),
            SemanticTree.groundAll(gaps, table));
    }
}
