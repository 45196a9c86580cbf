package pl.marcinmilkowski.interlingua.tree;

import java.util.Locale;
import java.util.Objects;

/**
 * Origin of a statement.
 *
 * @param similarity only meaningful for {@link Source#VSA_INFERRED}
 */
public record ProvenanceTag(Source source, double similarity) {

    public enum Source {
        EXTRACTED("extracted"),
        GRAPH_INFERRED("graph-inferred"),
        VSA_INFERRED("vsa-inferred"),
        REASONED("reasoned"),
        AGENT_DERIVED("agent-derived"),
        ENRICHMENT("enrichment"),
        USER_ASSERTED("user-asserted");

        private final String id;

        Source(String id) {
            this.id = id;
        }

        public String id() {
            return id;
        }

        public static Source fromId(String id) {
            for (Source s : values()) {
                if (s.id.equals(id)) {
                    return s;
                }
            }
            throw new IllegalArgumentException("Unknown provenance: " + id);
        }
    }

    public static final ProvenanceTag EXTRACTED = new ProvenanceTag(Source.EXTRACTED, 0.0);
    public static final ProvenanceTag GRAPH_INFERRED = new ProvenanceTag(Source.GRAPH_INFERRED, 0.0);
    public static final ProvenanceTag REASONED = new ProvenanceTag(Source.REASONED, 0.0);
    public static final ProvenanceTag AGENT_DERIVED = new ProvenanceTag(Source.AGENT_DERIVED, 0.0);
    public static final ProvenanceTag ENRICHMENT = new ProvenanceTag(Source.ENRICHMENT, 0.0);
    public static final ProvenanceTag USER_ASSERTED = new ProvenanceTag(Source.USER_ASSERTED, 0.0);

    public ProvenanceTag {
        Objects.requireNonNull(source, "source");
    }

    public static ProvenanceTag vsaInferred(double similarity) {
        return new ProvenanceTag(Source.VSA_INFERRED, similarity);
    }

    /**
     * Display form, e.g. {@code extracted} or {@code vsa-inferred(0.87)}.
     */
    @Override
    public String toString() {
        if (source == Source.VSA_INFERRED) {
            return String.format(Locale.ROOT, "vsa-inferred(%.2f)", similarity);
        }
        return source.id();
    }
}
