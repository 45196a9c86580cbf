package pl.marcinmilkowski.interlingua.error;

/**
 * A renderer was requested by a name that is not registered.
 */
public class UnknownGrammarException extends GrammarException {

    private final String grammarName;

    public UnknownGrammarException(String grammarName) {
        super("unknown grammar: \"" + grammarName + "\"");
        this.grammarName = grammarName;
    }

    public String getGrammarName() {
        return grammarName;
    }

    @Override
    public Kind kind() {
        return Kind.UNKNOWN_GRAMMAR;
    }
}
