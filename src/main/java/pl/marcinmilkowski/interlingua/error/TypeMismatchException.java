package pl.marcinmilkowski.interlingua.error;

import pl.marcinmilkowski.interlingua.tree.Category;

/**
 * A tree node sits in a slot its category is not allowed in.
 */
public class TypeMismatchException extends GrammarException {

    private final Category expected;
    private final Category actual;

    public TypeMismatchException(Category expected, Category actual) {
        super("type mismatch: expected " + expected + ", got " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public Category getExpected() {
        return expected;
    }

    public Category getActual() {
        return actual;
    }

    @Override
    public Kind kind() {
        return Kind.TYPE_MISMATCH;
    }
}
