package pl.marcinmilkowski.interlingua.tree;

import pl.marcinmilkowski.interlingua.error.TypeMismatchException;
import pl.marcinmilkowski.interlingua.symbol.SymbolTable;

import java.util.List;
import java.util.Objects;

/**
 * A subject-predicate-object statement.
 */
public record Triple(SemanticTree subject, SemanticTree predicate, SemanticTree object) implements SemanticTree {

    public Triple {
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(predicate, "predicate");
        Objects.requireNonNull(object, "object");
    }

    @Override
    public Category category() {
        return Category.STATEMENT;
    }

    @Override
    public List<SemanticTree> children() {
        return List.of(subject, predicate, object);
    }

    @Override
    public Triple ground(SymbolTable table) {
        return new Triple(subject.ground(table), predicate.ground(table), object.ground(table));
    }

    @Override
    public void validate() throws TypeMismatchException {
        if (!subject.category().validInStatement()) {
            throw new TypeMismatchException(Category.ENTITY, subject.category());
        }
        Category p = predicate.category();
        if (p != Category.RELATION && p != Category.FREEFORM) {
            throw new TypeMismatchException(Category.RELATION, p);
        }
        if (!object.category().validInStatement()) {
            throw new TypeMismatchException(Category.ENTITY, object.category());
        }
        subject.validate();
        predicate.validate();
        object.validate();
    }
}
