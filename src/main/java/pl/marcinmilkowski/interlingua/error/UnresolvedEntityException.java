package pl.marcinmilkowski.interlingua.error;

/**
 * A label could not be resolved to a known symbol.
 */
public class UnresolvedEntityException extends GrammarException {

    private final String label;

    public UnresolvedEntityException(String label) {
        super("unresolved entity: \"" + label + "\"");
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    @Override
    public Kind kind() {
        return Kind.UNRESOLVED_ENTITY;
    }
}
