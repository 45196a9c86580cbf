package pl.marcinmilkowski.interlingua.tree;

/**
 * Grammatical person a response should be phrased in.
 */
public enum PointOfView {
    FIRST_PERSON,
    SECOND_PERSON,
    THIRD_PERSON
}
