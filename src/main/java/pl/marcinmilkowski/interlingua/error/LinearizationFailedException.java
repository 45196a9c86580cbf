package pl.marcinmilkowski.interlingua.error;

import pl.marcinmilkowski.interlingua.tree.Category;

/**
 * A renderer cannot produce output for a node of the given category.
 */
public class LinearizationFailedException extends GrammarException {

    private final Category category;
    private final String grammar;

    public LinearizationFailedException(Category category, String grammar, String detail) {
        super("grammar \"" + grammar + "\" cannot linearize " + category + ": " + detail);
        this.category = category;
        this.grammar = grammar;
    }

    public Category getCategory() {
        return category;
    }

    public String getGrammar() {
        return grammar;
    }

    @Override
    public Kind kind() {
        return Kind.LINEARIZATION_FAILED;
    }
}
