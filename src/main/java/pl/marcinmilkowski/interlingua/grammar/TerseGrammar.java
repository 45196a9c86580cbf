package pl.marcinmilkowski.interlingua.grammar;

import pl.marcinmilkowski.interlingua.error.GrammarException;
import pl.marcinmilkowski.interlingua.error.LinearizationFailedException;
import pl.marcinmilkowski.interlingua.parser.ParseContext;
import pl.marcinmilkowski.interlingua.parser.ProseParser;
import pl.marcinmilkowski.interlingua.tree.Category;
import pl.marcinmilkowski.interlingua.tree.CodeFact;
import pl.marcinmilkowski.interlingua.tree.CodeModule;
import pl.marcinmilkowski.interlingua.tree.CodeSignature;
import pl.marcinmilkowski.interlingua.tree.Conjunction;
import pl.marcinmilkowski.interlingua.tree.DataFlow;
import pl.marcinmilkowski.interlingua.tree.DiscourseFrame;
import pl.marcinmilkowski.interlingua.tree.Document;
import pl.marcinmilkowski.interlingua.tree.Entity;
import pl.marcinmilkowski.interlingua.tree.Freeform;
import pl.marcinmilkowski.interlingua.tree.Gap;
import pl.marcinmilkowski.interlingua.tree.Inference;
import pl.marcinmilkowski.interlingua.tree.ProvenanceTag;
import pl.marcinmilkowski.interlingua.tree.Relation;
import pl.marcinmilkowski.interlingua.tree.Section;
import pl.marcinmilkowski.interlingua.tree.SemanticTree;
import pl.marcinmilkowski.interlingua.tree.Similarity;
import pl.marcinmilkowski.interlingua.tree.Triple;
import pl.marcinmilkowski.interlingua.tree.WithConfidence;
import pl.marcinmilkowski.interlingua.tree.WithProvenance;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Dense arrow notation, e.g. {@code Dog → is-a → Mammal [0.95]}.
 *
 * Parsing accepts the same arrow form ({@code →} or {@code ->}) before falling
 * back to prose.
 */
public class TerseGrammar extends AbstractGrammar {

    public static final String NAME = "terse";

    private static final Pattern TRAILING_CONFIDENCE = Pattern.compile("\\[\\s*(\\d+(?:\\.\\d+)?|\\.\\d+)\\s*]$");

    public TerseGrammar() {
        this(new ProseParser());
    }

    public TerseGrammar(ProseParser parser) {
        super(parser);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Minimal, symbol-heavy notation optimized for information density";
    }

    @Override
    public String linearize(SemanticTree tree, LinContext ctx) throws GrammarException {
        if (tree instanceof Entity e) {
            return ctx.resolveLabel(e.label(), e.symbol());
        }
        if (tree instanceof Relation r) {
            return ctx.resolveLabel(r.label(), r.symbol());
        }
        if (tree instanceof Freeform f) {
            return f.text();
        }
        if (tree instanceof Triple t) {
            return linearize(t.subject(), ctx) + " → " + linearize(t.predicate(), ctx)
                + " → " + linearize(t.object(), ctx);
        }
        if (tree instanceof Similarity s) {
            return linearize(s.entity(), ctx) + " ~ " + linearize(s.similarTo(), ctx)
                + " (" + decimal(s.score()) + ")";
        }
        if (tree instanceof Gap g) {
            return "? " + linearize(g.entity(), ctx) + ": " + g.description();
        }
        if (tree instanceof Inference i) {
            return i.expression() + " ⇒ " + i.simplified();
        }
        if (tree instanceof CodeFact c) {
            return c.kind() + ":" + c.name() + " — " + c.detail();
        }
        if (tree instanceof CodeModule m) {
            StringBuilder out = new StringBuilder("mod:").append(m.name());
            if (m.role() != null) {
                out.append(" — ").append(m.role());
            }
            out.append('\n');
            for (SemanticTree child : m.children()) {
                out.append("  ").append(linearize(child, ctx)).append('\n');
            }
            return out.toString();
        }
        if (tree instanceof CodeSignature s) {
            StringBuilder out = new StringBuilder(s.kind().keyword()).append(':').append(s.name());
            if (!s.paramsOrFields().isEmpty()) {
                out.append('(').append(String.join(", ", s.paramsOrFields())).append(')');
            }
            if (s.returnType() != null) {
                out.append(" → ").append(s.returnType());
            }
            return out.toString();
        }
        if (tree instanceof DataFlow d) {
            List<String> parts = new ArrayList<>();
            for (DataFlow.Step step : d.steps()) {
                parts.add(step.viaType() == null ? step.name() : step.name() + ":" + step.viaType());
            }
            return String.join(" → ", parts);
        }
        if (tree instanceof WithConfidence w) {
            return linearize(w.inner(), ctx) + " [" + decimal(w.confidence()) + "]";
        }
        if (tree instanceof WithProvenance w) {
            return linearize(w.inner(), ctx) + " (" + provenance(w.tag()) + ")";
        }
        if (tree instanceof DiscourseFrame f) {
            return linearize(f.inner(), ctx);
        }
        if (tree instanceof Conjunction c) {
            List<String> parts = new ArrayList<>();
            for (SemanticTree item : c.items()) {
                parts.add(linearize(item, ctx));
            }
            return String.join(c.isAnd() ? "; " : " | ", parts);
        }
        if (tree instanceof Section s) {
            StringBuilder out = new StringBuilder("── ").append(s.heading()).append(" ──\n");
            for (SemanticTree item : s.body()) {
                out.append("  ").append(linearize(item, ctx)).append('\n');
            }
            return out.toString();
        }
        if (tree instanceof Document d) {
            StringBuilder out = new StringBuilder(linearize(d.overview(), ctx)).append("\n\n");
            for (SemanticTree section : d.sections()) {
                out.append(linearize(section, ctx)).append('\n');
            }
            if (!d.gaps().isEmpty()) {
                out.append("── Gaps ──\n");
                for (SemanticTree gap : d.gaps()) {
                    out.append("  ").append(linearize(gap, ctx)).append('\n');
                }
            }
            return out.toString();
        }
        throw new LinearizationFailedException(tree.category(), NAME, "unsupported node");
    }

    @Override
    public SemanticTree parse(String input, Category expected, ParseContext ctx) throws GrammarException {
        Optional<SemanticTree> arrow = parseArrow(input);
        if (arrow.isPresent()) {
            return arrow.get();
        }
        return super.parse(input, expected, ctx);
    }

    /**
     * Reads {@code s → p → o} or {@code s -> p -> o}, optionally followed by {@code [0.95]}.
     */
    static Optional<SemanticTree> parseArrow(String input) {
        String trimmed = input == null ? "" : input.trim();
        String[] parts;
        if (trimmed.contains("→")) {
            parts = trimmed.split("→", -1);
        } else if (trimmed.contains("->")) {
            parts = trimmed.split("->", -1);
        } else {
            return Optional.empty();
        }
        if (parts.length != 3) {
            return Optional.empty();
        }
        String object = parts[2].trim();
        Double confidence = null;
        Matcher m = TRAILING_CONFIDENCE.matcher(object);
        if (m.find()) {
            confidence = Double.parseDouble(m.group(1));
            object = object.substring(0, m.start()).trim();
        }
        Triple triple = SemanticTree.triple(
            SemanticTree.entity(parts[0].trim()),
            SemanticTree.relation(parts[1].trim()),
            SemanticTree.entity(object));
        if (confidence != null) {
            return Optional.of(new WithConfidence(triple, confidence));
        }
        return Optional.of(triple);
    }

    private static String provenance(ProvenanceTag tag) {
        switch (tag.source()) {
            case EXTRACTED:
                return "ext";
            case GRAPH_INFERRED:
                return "graph";
            case VSA_INFERRED:
                return "vsa:" + decimal(tag.similarity());
            case REASONED:
                return "reas";
            case AGENT_DERIVED:
                return "agent";
            case ENRICHMENT:
                return "enrich";
            default:
                return "user";
        }
    }
}
