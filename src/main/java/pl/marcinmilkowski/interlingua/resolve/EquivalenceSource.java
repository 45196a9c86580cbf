package pl.marcinmilkowski.interlingua.resolve;

/**
 * How a learned equivalence was discovered.
 */
public enum EquivalenceSource {
    CO_OCCURRENCE("co-occurrence"),
    MANUAL("manual");

    private final String id;

    EquivalenceSource(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static EquivalenceSource fromId(String id) {
        for (EquivalenceSource s : values()) {
            if (s.id.equals(id)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown equivalence source: " + id);
    }
}
