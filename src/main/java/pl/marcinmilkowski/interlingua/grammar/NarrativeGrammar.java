package pl.marcinmilkowski.interlingua.grammar;

import pl.marcinmilkowski.interlingua.error.GrammarException;
import pl.marcinmilkowski.interlingua.error.LinearizationFailedException;
import pl.marcinmilkowski.interlingua.parser.ProseParser;
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
import pl.marcinmilkowski.interlingua.tree.PointOfView;
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
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Flowing prose with varied sentence openers.
 *
 * <p>Rendering is stateful: each statement advances a transition counter, so
 * rendering the same tree twice may produce different openers. Sections reset
 * the counter; {@link #resetTransitions()} does the same explicitly.</p>
 */
public class NarrativeGrammar extends AbstractGrammar {

    public static final String NAME = "narrative";

    private static final List<String> TRANSITIONS = List.of(
        "",
        "Furthermore, ",
        "Notably, ",
        "Interestingly, ",
        "Additionally, ",
        "In turn, ",
        "Building on this, ",
        "Along similar lines, ");

    private static final List<String> GAP_OPENERS = List.of(
        "An open question remains",
        "It remains unclear",
        "Further investigation is needed",
        "A gap in our knowledge exists");

    private static final String SELF_LABEL = "self";

    private final AtomicInteger transitionCounter = new AtomicInteger();

    public NarrativeGrammar() {
        this(new ProseParser());
    }

    public NarrativeGrammar(ProseParser parser) {
        super(parser);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Flowing, story-like prose with varied transitions for interactive sessions";
    }

    public void resetTransitions() {
        transitionCounter.set(0);
    }

    private String nextTransition() {
        return TRANSITIONS.get(Math.floorMod(transitionCounter.getAndIncrement(), TRANSITIONS.size()));
    }

    private String nextGapOpener() {
        return GAP_OPENERS.get(Math.floorMod(transitionCounter.get(), GAP_OPENERS.size()));
    }

    @Override
    public String linearize(SemanticTree tree, LinContext ctx) throws GrammarException {
        if (tree instanceof Entity e) {
            return ctx.resolveLabel(e.label(), e.symbol());
        }
        if (tree instanceof Relation r) {
            return Morphology.humanizePredicate(ctx.resolveLabel(r.label(), r.symbol()));
        }
        if (tree instanceof Freeform f) {
            return f.text();
        }
        if (tree instanceof Triple t) {
            String s = linearize(t.subject(), ctx);
            String p = linearize(t.predicate(), ctx);
            String o = linearize(t.object(), ctx);
            return nextTransition() + s + " " + p + " " + o + ".";
        }
        if (tree instanceof Similarity s) {
            String e = linearize(s.entity(), ctx);
            String other = linearize(s.similarTo(), ctx);
            return nextTransition() + e + " shares " + strength(s.score()) + " to " + other + ".";
        }
        if (tree instanceof Gap g) {
            String e = linearize(g.entity(), ctx);
            return nextGapOpener() + ": regarding " + e + ", " + g.description() + ".";
        }
        if (tree instanceof Inference i) {
            return nextTransition() + "Through symbolic reasoning, `" + i.expression()
                + "` reduces to `" + i.simplified() + "`.";
        }
        if (tree instanceof CodeFact c) {
            return nextTransition() + "The " + c.kind() + " `" + c.name() + "` serves as " + c.detail() + ".";
        }
        if (tree instanceof CodeModule m) {
            return module(m, ctx);
        }
        if (tree instanceof CodeSignature s) {
            return signature(s);
        }
        if (tree instanceof DataFlow d) {
            return dataFlow(d);
        }
        if (tree instanceof WithConfidence w) {
            String text = linearize(w.inner(), ctx);
            String qualifier = qualifier(w.confidence());
            return text.endsWith(".")
                ? text.substring(0, text.length() - 1) + ", " + qualifier + "."
                : text + ", " + qualifier;
        }
        if (tree instanceof WithProvenance w) {
            return beforePeriod(linearize(w.inner(), ctx), " (" + provenance(w.tag()) + ")");
        }
        if (tree instanceof DiscourseFrame f) {
            return linearize(speaker(f.inner(), f.pointOfView()), ctx);
        }
        if (tree instanceof Conjunction c) {
            List<String> parts = new ArrayList<>();
            for (SemanticTree item : c.items()) {
                String text = linearize(item, ctx);
                parts.add(c.isAnd() || !text.endsWith(".") ? text : text.substring(0, text.length() - 1));
            }
            if (c.isAnd()) {
                return String.join(" ", parts);
            }
            return "Either " + Morphology.joinList(parts, "or") + ", depending on the context.";
        }
        if (tree instanceof Section s) {
            StringBuilder out = new StringBuilder("## ").append(s.heading()).append("\n\n");
            resetTransitions();
            for (SemanticTree item : s.body()) {
                FormalGrammar.appendLine(out, linearize(item, ctx));
            }
            return out.toString();
        }
        if (tree instanceof Document d) {
            StringBuilder out = new StringBuilder();
            String overview = linearize(d.overview(), ctx);
            out.append(overview);
            if (!overview.endsWith("\n")) {
                out.append("\n\n");
            }
            for (SemanticTree section : d.sections()) {
                FormalGrammar.appendLine(out, linearize(section, ctx));
            }
            if (!d.gaps().isEmpty()) {
                out.append("\n## Open Questions\n\n");
                for (SemanticTree gap : d.gaps()) {
                    out.append("- ");
                    FormalGrammar.appendLine(out, linearize(gap, ctx));
                }
            }
            return out.toString();
        }
        throw new LinearizationFailedException(tree.category(), NAME, "unsupported node");
    }

    private String module(CodeModule m, LinContext ctx) throws GrammarException {
        StringBuilder out = new StringBuilder(nextTransition()).append("The module `").append(m.name()).append('`');
        if (m.docSummary() != null && !m.docSummary().isBlank()) {
            out.append(' ').append(m.docSummary());
        } else if (m.role() != null) {
            out.append(" is responsible for ").append(m.role());
        } else {
            out.append(" plays a supporting role");
        }
        out.append('.');
        if (!m.children().isEmpty()) {
            out.append(" Inside it we find:\n");
            for (SemanticTree child : m.children()) {
                out.append("- ").append(linearize(child, ctx)).append('\n');
            }
        }
        return out.toString();
    }

    private String signature(CodeSignature s) {
        StringBuilder out = new StringBuilder(nextTransition()).append("The ").append(s.kind().keyword())
            .append(" `").append(s.name()).append('`');
        if (s.docSummary() != null && !s.docSummary().isBlank()) {
            out.append(" exists to ").append(Character.toLowerCase(s.docSummary().charAt(0)))
                .append(s.docSummary().substring(1));
        }
        if (!s.paramsOrFields().isEmpty()) {
            out.append(", working with ").append(Morphology.joinList(s.paramsOrFields(), "and"));
        }
        if (s.returnType() != null) {
            out.append(" and gives back ").append(Morphology.codeQuote(s.returnType()));
        }
        return out.append('.').toString();
    }

    private String dataFlow(DataFlow d) {
        List<String> names = new ArrayList<>();
        for (DataFlow.Step step : d.steps()) {
            names.add(Morphology.codeQuote(step.name()));
        }
        if (names.isEmpty()) {
            return nextTransition() + "No data moves here.";
        }
        return nextTransition() + "Data starts at " + names.get(0)
            + (names.size() > 1 ? " and travels through " + Morphology.joinList(names.subList(1, names.size()), "and") : "")
            + ".";
    }

    /**
     * Rewrites a self-referential subject as {@code I} or {@code You} and
     * conjugates the leading verb to match.
     */
    static SemanticTree speaker(SemanticTree tree, PointOfView pov) {
        if (pov == PointOfView.THIRD_PERSON) {
            return tree;
        }
        if (tree instanceof Triple t && t.subject() instanceof Entity e && isSpeakerLabel(e.label())) {
            String pronoun = pov == PointOfView.FIRST_PERSON ? "I" : "You";
            SemanticTree predicate = t.predicate();
            if (predicate instanceof Relation r) {
                predicate = SemanticTree.relation(conjugate(Morphology.humanizePredicate(r.label()), pov));
            }
            return new Triple(SemanticTree.entity(pronoun), predicate, t.object());
        }
        if (tree instanceof WithConfidence w) {
            return new WithConfidence(speaker(w.inner(), pov), w.confidence());
        }
        if (tree instanceof WithProvenance w) {
            return new WithProvenance(speaker(w.inner(), pov), w.tag());
        }
        if (tree instanceof Conjunction c) {
            List<SemanticTree> items = new ArrayList<>();
            for (SemanticTree item : c.items()) {
                items.add(speaker(item, pov));
            }
            return new Conjunction(items, c.isAnd());
        }
        return tree;
    }

    private static boolean isSpeakerLabel(String label) {
        String lower = label.toLowerCase(Locale.ROOT);
        return lower.equals(SELF_LABEL) || lower.equals("you");
    }

    private static String conjugate(String phrase, PointOfView pov) {
        String[] words = phrase.split(" ", 2);
        String rest = words.length > 1 ? " " + words[1] : "";
        switch (words[0]) {
            case "is":
                return (pov == PointOfView.FIRST_PERSON ? "am" : "are") + rest;
            case "has":
                return "have" + rest;
            case "does":
                return "do" + rest;
            default:
                return phrase;
        }
    }

    private static String strength(double score) {
        if (score > 0.9) {
            return "a striking resemblance";
        } else if (score > 0.7) {
            return "a close resemblance";
        } else if (score > 0.5) {
            return "some similarity";
        }
        return "a faint resemblance";
    }

    private static String qualifier(double confidence) {
        if (confidence > 0.9) {
            return "with high confidence";
        } else if (confidence > 0.7) {
            return "with moderate confidence";
        } else if (confidence > 0.5) {
            return "tentatively";
        }
        return "speculatively";
    }

    private static String provenance(ProvenanceTag tag) {
        switch (tag.source()) {
            case EXTRACTED:
                return "drawn from source material";
            case GRAPH_INFERRED:
                return "inferred from the knowledge graph";
            case VSA_INFERRED:
                return String.format(Locale.ROOT, "suggested by vector similarity at %.0f%%", tag.similarity() * 100);
            case REASONED:
                return "derived through symbolic reasoning";
            case AGENT_DERIVED:
                return "discovered by the agent";
            case ENRICHMENT:
                return "identified through semantic analysis";
            default:
                return "as stated by the user";
        }
    }
}
