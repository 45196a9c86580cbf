package pl.marcinmilkowski.interlingua.error;

/**
 * Base class for all failures raised while parsing, rendering or grounding
 * interlingua trees.
 *
 * Each subclass corresponds to one {@link Kind}, so callers can either catch
 * the specific type or switch on {@link #kind()}.
 */
public abstract class GrammarException extends Exception {

    /**
     * Error taxonomy shared by parsers, renderers and the vector layer.
     */
    public enum Kind {
        PARSE_FAILED,
        LINEARIZATION_FAILED,
        TYPE_MISMATCH,
        UNRESOLVED_ENTITY,
        UNKNOWN_GRAMMAR,
        INVALID_CUSTOM_GRAMMAR,
        VSA,
        AMBIGUOUS,
        INCOMPLETE,
        GROUNDING_INCOMPLETE,
        UNSUPPORTED_LANGUAGE
    }

    protected GrammarException(String message) {
        super(message);
    }

    protected GrammarException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract Kind kind();
}
