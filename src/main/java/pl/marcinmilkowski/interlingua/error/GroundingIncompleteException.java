package pl.marcinmilkowski.interlingua.error;

/**
 * Labels remain unresolved after grounding.
 */
public class GroundingIncompleteException extends GrammarException {

    private final int unresolved;
    private final String firstUnresolved;

    public GroundingIncompleteException(int unresolved, String firstUnresolved) {
        super("grounding incomplete: " + unresolved + " unresolved label(s), first: \"" + firstUnresolved + "\"");
        this.unresolved = unresolved;
        this.firstUnresolved = firstUnresolved;
    }

    public int getUnresolved() {
        return unresolved;
    }

    public String getFirstUnresolved() {
        return firstUnresolved;
    }

    @Override
    public Kind kind() {
        return Kind.GROUNDING_INCOMPLETE;
    }
}
