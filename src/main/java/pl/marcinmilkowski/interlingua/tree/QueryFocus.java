package pl.marcinmilkowski.interlingua.tree;

/**
 * What a question is asking about, derived from its question word.
 */
public enum QueryFocus {
    IDENTITY,
    DEFINITION,
    METHOD,
    CAUSE,
    LOCATION,
    TIME,
    CONFIRMATION,
    CAPABILITY,
    GENERAL
}
