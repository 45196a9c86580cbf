package pl.marcinmilkowski.interlingua.error;

/**
 * No parsing strategy produced a tree for the given input.
 */
public class ParseFailedException extends GrammarException {

    private final String input;

    public ParseFailedException(String input) {
        super("failed to parse input: \"" + input + "\"");
        this.input = input;
    }

    public ParseFailedException(String input, String detail) {
        super("failed to parse input: \"" + input + "\": " + detail);
        this.input = input;
    }

    public String getInput() {
        return input;
    }

    @Override
    public Kind kind() {
        return Kind.PARSE_FAILED;
    }
}
