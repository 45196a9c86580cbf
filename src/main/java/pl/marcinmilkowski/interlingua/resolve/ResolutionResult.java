package pl.marcinmilkowski.interlingua.resolve;

/**
 * Outcome of resolving one surface form.
 *
 * @param resolved false when no tier knew the surface and it was passed through
 */
public record ResolutionResult(String canonical, boolean resolved, Tier source) {

    /**
     * Which table produced the canonical form.
     */
    public enum Tier {
        RUNTIME_ALIAS,
        LEARNED,
        STATIC,
        PASS_THROUGH
    }
}
