package pl.marcinmilkowski.interlingua.error;

/**
 * Several relational patterns matched the same input.
 *
 * The parser resolves ambiguity itself by confidence; this type exists for
 * callers that want strict parsing.
 */
public class AmbiguousParseException extends GrammarException {

    private final int matchCount;

    public AmbiguousParseException(String input, int matchCount) {
        super("ambiguous parse (" + matchCount + " matches): \"" + input + "\"");
        this.matchCount = matchCount;
    }

    public int getMatchCount() {
        return matchCount;
    }

    @Override
    public Kind kind() {
        return Kind.AMBIGUOUS;
    }
}
