package pl.marcinmilkowski.interlingua.grammar;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.interlingua.error.GrammarException;
import pl.marcinmilkowski.interlingua.error.InvalidCustomGrammarException;
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
import pl.marcinmilkowski.interlingua.tree.Relation;
import pl.marcinmilkowski.interlingua.tree.Section;
import pl.marcinmilkowski.interlingua.tree.SemanticTree;
import pl.marcinmilkowski.interlingua.tree.Similarity;
import pl.marcinmilkowski.interlingua.tree.Triple;
import pl.marcinmilkowski.interlingua.tree.WithConfidence;
import pl.marcinmilkowski.interlingua.tree.WithProvenance;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A user-defined voice loaded from a small TOML file:
 *
 * <pre>
 * [grammar]
 * name = "mythic"
 * description = "Ancient chronicle"
 *
 * [linearization]
 * triple = "It is written that {subject} {predicate} {object}."
 * </pre>
 *
 * Template keys: {@code triple}, {@code similarity}, {@code gap}, {@code inference},
 * {@code code_fact}, {@code code_module}, {@code code_signature}, {@code data_flow},
 * {@code freeform}. Nodes without a template use plain default phrasing.
 * Placeholders with no value are left as written.
 */
public class CustomGrammar extends AbstractGrammar {

    private static final Logger logger = LoggerFactory.getLogger(CustomGrammar.class);

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([a-z_]+)}");

    private final String name;
    private final String description;
    private final Map<String, String> templates;

    CustomGrammar(String name, String description, Map<String, String> templates, ProseParser parser) {
        super(parser);
        this.name = name;
        this.description = description;
        this.templates = Collections.unmodifiableMap(new HashMap<>(templates));
    }

    /**
     * Reads a grammar definition from TOML text.
     *
     * @throws InvalidCustomGrammarException if the {@code [grammar]} table has no name
     */
    public static CustomGrammar fromToml(String toml) throws InvalidCustomGrammarException {
        String name = "";
        String description = "";
        Map<String, String> templates = new HashMap<>();
        String section = "";

        for (String line : toml.split("\\R")) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            if (trimmed.startsWith("[") && trimmed.endsWith("]")) {
                section = trimmed.substring(1, trimmed.length() - 1).trim();
                continue;
            }
            int eq = trimmed.indexOf('=');
            if (eq < 0) {
                continue;
            }
            String key = trimmed.substring(0, eq).trim();
            String value = unquote(trimmed.substring(eq + 1).trim());
            if (section.equals("grammar")) {
                if (key.equals("name")) {
                    name = value;
                } else if (key.equals("description")) {
                    description = value;
                }
            } else if (section.equals("linearization")) {
                templates.put(key, value);
            }
        }

        if (name.isEmpty()) {
            throw new InvalidCustomGrammarException("missing [grammar] name field");
        }
        logger.info("Loaded custom grammar '{}' with {} templates", name, templates.size());
        return new CustomGrammar(name, description, templates, new ProseParser());
    }

    /**
     * Reads a grammar definition from a TOML file.
     */
    public static CustomGrammar fromPath(Path path) throws IOException, InvalidCustomGrammarException {
        if (!Files.exists(path)) {
            throw new IOException("Custom grammar file not found: " + path);
        }
        return fromToml(Files.readString(path, StandardCharsets.UTF_8));
    }

    private static String unquote(String value) {
        if (value.length() >= 2
            && ((value.startsWith("\"") && value.endsWith("\"")) || (value.startsWith("'") && value.endsWith("'")))) {
            String inner = value.substring(1, value.length() - 1);
            return value.startsWith("\"") ? inner.replace("\\n", "\n").replace("\\\"", "\"") : inner;
        }
        return value;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String description() {
        return description;
    }

    public Map<String, String> templates() {
        return templates;
    }

    static String apply(String template, Map<String, String> vars) {
        Matcher m = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            String value = vars.get(m.group(1));
            m.appendReplacement(out, Matcher.quoteReplacement(value == null ? m.group() : value));
        }
        m.appendTail(out);
        return out.toString();
    }

    private String render(String key, Map<String, String> vars, String fallback) {
        String template = templates.get(key);
        return template == null ? fallback : apply(template, vars);
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
            return render("freeform", Map.of("text", f.text()), f.text());
        }
        if (tree instanceof Triple t) {
            String s = linearize(t.subject(), ctx);
            String p = linearize(t.predicate(), ctx);
            String o = linearize(t.object(), ctx);
            return render("triple", Map.of("subject", s, "predicate", p, "object", o), s + " " + p + " " + o + ".");
        }
        if (tree instanceof Similarity sim) {
            String e = linearize(sim.entity(), ctx);
            String s = linearize(sim.similarTo(), ctx);
            String score = decimal(sim.score());
            return render("similarity", Map.of("entity", e, "similar_to", s, "score", score),
                e + " is similar to " + s + " (" + score + ").");
        }
        if (tree instanceof Gap g) {
            String e = linearize(g.entity(), ctx);
            return render("gap", Map.of("entity", e, "description", g.description()),
                "Gap for " + e + ": " + g.description() + ".");
        }
        if (tree instanceof Inference i) {
            return render("inference", Map.of("expression", i.expression(), "simplified", i.simplified()),
                "`" + i.expression() + "` simplifies to `" + i.simplified() + "`.");
        }
        if (tree instanceof CodeFact c) {
            return render("code_fact", Map.of("kind", c.kind(), "name", c.name(), "detail", c.detail()),
                c.kind() + " `" + c.name() + "`: " + c.detail() + ".");
        }
        if (tree instanceof CodeModule m) {
            return module(m, ctx);
        }
        if (tree instanceof CodeSignature s) {
            String params = String.join(", ", s.paramsOrFields());
            Map<String, String> vars = new HashMap<>();
            vars.put("kind", s.kind().keyword());
            vars.put("name", s.name());
            vars.put("params", params);
            vars.put("return_type", s.returnType() == null ? "" : s.returnType());
            vars.put("traits", String.join(", ", s.traits()));
            String ret = s.returnType() == null ? "" : " → " + s.returnType();
            return render("code_signature", vars, s.kind().keyword() + " `" + s.name() + "`(" + params + ")" + ret + ".");
        }
        if (tree instanceof DataFlow d) {
            List<String> steps = new ArrayList<>();
            for (DataFlow.Step step : d.steps()) {
                steps.add(step.viaType() == null ? step.name() : step.name() + " → " + step.viaType());
            }
            String flow = String.join(" → ", steps);
            return render("data_flow", Map.of("flow", flow), "Flow: " + flow);
        }
        if (tree instanceof WithConfidence w) {
            return linearize(w.inner(), ctx) + " (confidence: " + decimal(w.confidence()) + ")";
        }
        if (tree instanceof WithProvenance w) {
            return linearize(w.inner(), ctx) + " [" + w.tag() + "]";
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
                FormalGrammar.appendLine(out, linearize(item, ctx));
            }
            return out.toString();
        }
        if (tree instanceof Document d) {
            StringBuilder out = new StringBuilder(linearize(d.overview(), ctx)).append("\n\n");
            for (SemanticTree section : d.sections()) {
                out.append(linearize(section, ctx)).append('\n');
            }
            if (!d.gaps().isEmpty()) {
                out.append("\n## Gaps\n\n");
                for (SemanticTree gap : d.gaps()) {
                    out.append("- ").append(linearize(gap, ctx)).append('\n');
                }
            }
            return out.toString();
        }
        throw new LinearizationFailedException(tree.category(), name, "unsupported node");
    }

    private String module(CodeModule m, LinContext ctx) throws GrammarException {
        List<String> children = new ArrayList<>();
        for (SemanticTree child : m.children()) {
            children.add(linearize(child, ctx));
        }
        String template = templates.get("code_module");
        if (template != null) {
            Map<String, String> vars = new HashMap<>();
            vars.put("name", m.name());
            vars.put("role", m.role() == null ? "" : m.role());
            vars.put("importance", m.importance() == null ? "" : decimal(m.importance()));
            vars.put("doc_summary", m.docSummary() == null ? "" : m.docSummary());
            vars.put("children", String.join("\n", children));
            return apply(template, vars);
        }
        String desc = m.docSummary() != null ? m.docSummary() : m.role() != null ? m.role() : "module";
        StringBuilder out = new StringBuilder("Module `").append(m.name()).append("` (").append(desc).append(").");
        if (!children.isEmpty()) {
            out.append('\n');
            for (String line : children) {
                out.append("- ").append(line).append('\n');
            }
        }
        return out.toString();
    }
}
