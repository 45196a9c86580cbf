package pl.marcinmilkowski.interlingua.tree;

/**
 * Semantic role of an interlingua node.
 */
public enum Category {
    ENTITY,
    RELATION,
    STATEMENT,
    SIMILARITY,
    GAP,
    INFERENCE,
    CODE_FACT,
    CODE_MODULE,
    CODE_SIGNATURE,
    DATA_FLOW,
    CONJUNCTION,
    SECTION,
    DOCUMENT,
    CONFIDENCE,
    PROVENANCE,
    FREEFORM,
    DISCOURSE_FRAME;

    /**
     * Leaves carry a label and no children.
     */
    public boolean isLeaf() {
        return this == ENTITY || this == RELATION || this == FREEFORM;
    }

    /**
     * Whether a node of this category may fill the subject or object slot of a statement.
     */
    public boolean validInStatement() {
        return this == ENTITY || this == RELATION || this == FREEFORM;
    }
}
