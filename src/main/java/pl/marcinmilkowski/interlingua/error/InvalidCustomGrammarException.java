package pl.marcinmilkowski.interlingua.error;

/**
 * A custom grammar definition could not be loaded.
 */
public class InvalidCustomGrammarException extends GrammarException {

    public InvalidCustomGrammarException(String message) {
        super("invalid custom grammar: " + message);
    }

    public InvalidCustomGrammarException(String message, Throwable cause) {
        super("invalid custom grammar: " + message, cause);
    }

    @Override
    public Kind kind() {
        return Kind.INVALID_CUSTOM_GRAMMAR;
    }
}
