package pl.marcinmilkowski.interlingua.preprocess;

/**
 * Coarse classification of an extracted claim by its predicate.
 */
public enum ClaimType {
    FACTUAL,
    CAUSAL,
    SPATIAL,
    RELATIONAL,
    STRUCTURAL,
    DEPENDENCY,
    OTHER;

    public static ClaimType forPredicate(String predicate) {
        switch (predicate) {
            case "is-a":
            case "has-a":
            case "contains":
            case "implements":
            case "defines":
                return FACTUAL;
            case "causes":
                return CAUSAL;
            case "located-in":
                return SPATIAL;
            case "similar-to":
                return RELATIONAL;
            case "part-of":
            case "composed-of":
                return STRUCTURAL;
            case "depends-on":
                return DEPENDENCY;
            default:
                return OTHER;
        }
    }
}
