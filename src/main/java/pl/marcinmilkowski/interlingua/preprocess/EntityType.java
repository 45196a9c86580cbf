package pl.marcinmilkowski.interlingua.preprocess;

public enum EntityType {
    PLACE,
    CONCEPT;

    /**
     * Objects of {@code located-in} are places; everything else is a concept.
     */
    public static EntityType infer(String predicate, boolean isSubject) {
        return !isSubject && predicate.equals("located-in") ? PLACE : CONCEPT;
    }
}
