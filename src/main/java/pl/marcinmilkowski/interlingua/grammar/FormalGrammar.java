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

/**
 * Precise, academic register with explicit confidence and provenance,
 * e.g. {@code The entity 'Dog' is a 'Mammal' (confidence: 0.95).}
 */
public class FormalGrammar extends AbstractGrammar {

    public static final String NAME = "formal";

    public FormalGrammar() {
        this(new ProseParser());
    }

    public FormalGrammar(ProseParser parser) {
        super(parser);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Precise, structured, academic-style output with explicit confidence and provenance";
    }

    @Override
    public String linearize(SemanticTree tree, LinContext ctx) throws GrammarException {
        if (tree instanceof Entity e) {
            return "'" + ctx.resolveLabel(e.label(), e.symbol()) + "'";
        }
        if (tree instanceof Relation r) {
            return Morphology.humanizePredicate(ctx.resolveLabel(r.label(), r.symbol()));
        }
        if (tree instanceof Freeform f) {
            return f.text();
        }
        if (tree instanceof Triple t) {
            return "The entity " + linearize(t.subject(), ctx) + " " + linearize(t.predicate(), ctx)
                + " " + linearize(t.object(), ctx) + ".";
        }
        if (tree instanceof Similarity s) {
            return linearize(s.entity(), ctx) + " exhibits similarity to " + linearize(s.similarTo(), ctx)
                + " (score: " + decimal(s.score()) + ").";
        }
        if (tree instanceof Gap g) {
            return "Knowledge gap identified for " + linearize(g.entity(), ctx) + ": " + g.description() + ".";
        }
        if (tree instanceof Inference i) {
            return "Reasoning result: the expression `" + i.expression() + "` simplifies to `"
                + i.simplified() + "`.";
        }
        if (tree instanceof CodeFact c) {
            return "Code structure: " + c.kind() + " `" + c.name() + "` — " + c.detail() + ".";
        }
        if (tree instanceof CodeModule m) {
            return module(m, ctx);
        }
        if (tree instanceof CodeSignature s) {
            return signature(s);
        }
        if (tree instanceof DataFlow d) {
            List<String> parts = new ArrayList<>();
            for (DataFlow.Step step : d.steps()) {
                parts.add(step.viaType() == null
                    ? "`" + step.name() + "`"
                    : "`" + step.name() + "` → " + step.viaType());
            }
            return "Data flow: " + String.join(" → ", parts);
        }
        if (tree instanceof WithConfidence w) {
            return beforePeriod(linearize(w.inner(), ctx), " (confidence: " + decimal(w.confidence()) + ")");
        }
        if (tree instanceof WithProvenance w) {
            return beforePeriod(linearize(w.inner(), ctx), " [" + provenance(w.tag()) + "]");
        }
        if (tree instanceof DiscourseFrame f) {
            return linearize(f.inner(), ctx);
        }
        if (tree instanceof Conjunction c) {
            List<String> parts = new ArrayList<>();
            for (SemanticTree item : c.items()) {
                parts.add(linearize(item, ctx));
            }
            return Morphology.joinList(parts, c.isAnd() ? "and" : "or");
        }
        if (tree instanceof Section s) {
            StringBuilder out = new StringBuilder("## ").append(s.heading()).append("\n\n");
            for (SemanticTree item : s.body()) {
                appendLine(out, linearize(item, ctx));
            }
            return out.toString();
        }
        if (tree instanceof Document d) {
            return document(d, ctx);
        }
        throw new LinearizationFailedException(tree.category(), NAME, "unsupported node");
    }

    private String module(CodeModule m, LinContext ctx) throws GrammarException {
        String desc = m.docSummary() != null ? m.docSummary()
            : m.role() != null ? m.role() : "serves an unspecified role";
        StringBuilder out = new StringBuilder("The module `").append(m.name()).append("` ")
            .append(desc).append('.');
        if (isImportant(m.importance())) {
            out.append(" (importance: ").append(decimal(m.importance())).append(')');
        }
        if (!m.children().isEmpty()) {
            out.append("\nContains ").append(m.children().size()).append(" items:\n");
            for (SemanticTree child : m.children()) {
                out.append("- ").append(linearize(child, ctx)).append('\n');
            }
        }
        return out.toString();
    }

    private static String signature(CodeSignature s) {
        StringBuilder out = new StringBuilder();
        if (isImportant(s.importance())) {
            out.append("★ ");
        }
        out.append(s.kind().keyword()).append(" `").append(s.name()).append("` — ")
            .append(s.docSummary() == null || s.docSummary().isBlank() ? "no documentation" : s.docSummary()).append('.');
        if (!s.paramsOrFields().isEmpty()) {
            out.append(" params: (").append(String.join(", ", s.paramsOrFields())).append("),");
        }
        out.append(s.returnType() == null ? "." : " returns `" + s.returnType() + "`.");
        if (!s.traits().isEmpty()) {
            out.append(" [derives: ").append(String.join(", ", s.traits())).append(']');
        }
        return out.toString();
    }

    private String document(Document d, LinContext ctx) throws GrammarException {
        StringBuilder out = new StringBuilder();
        String overview = linearize(d.overview(), ctx);
        out.append(overview);
        if (!overview.endsWith("\n")) {
            out.append("\n\n");
        }
        for (SemanticTree section : d.sections()) {
            appendLine(out, linearize(section, ctx));
        }
        if (!d.gaps().isEmpty()) {
            out.append("\n## Knowledge Gaps\n\n");
            for (SemanticTree gap : d.gaps()) {
                out.append("- ");
                appendLine(out, linearize(gap, ctx));
            }
        }
        return out.toString();
    }

    static boolean isImportant(Double importance) {
        return importance != null && importance > 0.7;
    }

    static void appendLine(StringBuilder out, String line) {
        out.append(line);
        if (!line.endsWith("\n")) {
            out.append('\n');
        }
    }

    private static String provenance(ProvenanceTag tag) {
        switch (tag.source()) {
            case EXTRACTED:
                return "source: extracted";
            case GRAPH_INFERRED:
                return "source: graph inference";
            case VSA_INFERRED:
                return "source: VSA inference (similarity: " + decimal(tag.similarity()) + ")";
            case REASONED:
                return "source: symbolic reasoning";
            case AGENT_DERIVED:
                return "source: agent derivation";
            case ENRICHMENT:
                return "source: semantic enrichment";
            default:
                return "source: user assertion";
        }
    }
}
