package pl.marcinmilkowski.interlingua.error;

/**
 * Input ended before a complete structure could be read.
 */
public class IncompleteInputException extends GrammarException {

    public IncompleteInputException(String message) {
        super("incomplete input: " + message);
    }

    @Override
    public Kind kind() {
        return Kind.INCOMPLETE;
    }
}
