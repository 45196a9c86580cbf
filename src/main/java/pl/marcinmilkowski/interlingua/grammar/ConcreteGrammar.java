package pl.marcinmilkowski.interlingua.grammar;

import pl.marcinmilkowski.interlingua.error.GrammarException;
import pl.marcinmilkowski.interlingua.parser.ParseContext;
import pl.marcinmilkowski.interlingua.tree.Category;
import pl.marcinmilkowski.interlingua.tree.SemanticTree;

import java.util.Set;

/**
 * One surface style for semantic trees, usable in both directions.
 */
public interface ConcreteGrammar {

    String name();

    String description();

    /**
     * Renders a tree as text.
     */
    String linearize(SemanticTree tree, LinContext ctx) throws GrammarException;

    /**
     * Reads text back into a tree.
     *
     * @param expected category the caller hopes for, may be {@code null}
     */
    SemanticTree parse(String input, Category expected, ParseContext ctx) throws GrammarException;

    Set<Category> supportedCategories();
}
