package pl.marcinmilkowski.interlingua.error;

/**
 * Hypervector encoding, search or grounding failure.
 */
public class VsaException extends GrammarException {

    public VsaException(String message) {
        super(message);
    }

    public VsaException(String message, Throwable cause) {
        super(message, cause);
    }

    public static VsaException dimensionMismatch(int expected, int actual) {
        return new VsaException("dimension mismatch: expected " + expected + ", got " + actual);
    }

    @Override
    public Kind kind() {
        return Kind.VSA;
    }
}
