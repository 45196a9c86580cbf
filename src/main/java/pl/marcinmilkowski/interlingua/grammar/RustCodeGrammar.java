package pl.marcinmilkowski.interlingua.grammar;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterRust;
import pl.marcinmilkowski.interlingua.error.GrammarException;
import pl.marcinmilkowski.interlingua.error.LinearizationFailedException;
import pl.marcinmilkowski.interlingua.error.ParseFailedException;
import pl.marcinmilkowski.interlingua.parser.ParseContext;
import pl.marcinmilkowski.interlingua.tree.Category;
import pl.marcinmilkowski.interlingua.tree.CodeFact;
import pl.marcinmilkowski.interlingua.tree.CodeModule;
import pl.marcinmilkowski.interlingua.tree.CodeSignature;
import pl.marcinmilkowski.interlingua.tree.Conjunction;
import pl.marcinmilkowski.interlingua.tree.DataFlow;
import pl.marcinmilkowski.interlingua.tree.Document;
import pl.marcinmilkowski.interlingua.tree.Freeform;
import pl.marcinmilkowski.interlingua.tree.Section;
import pl.marcinmilkowski.interlingua.tree.SemanticTree;
import pl.marcinmilkowski.interlingua.tree.SignatureKind;
import pl.marcinmilkowski.interlingua.tree.WithConfidence;
import pl.marcinmilkowski.interlingua.tree.WithProvenance;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Generates Rust source from code nodes and reads Rust source back into them.
 *
 * Parsing uses tree-sitter-rust and recognises top-level and nested
 * {@code fn}, {@code struct}, {@code enum}, {@code trait}, {@code impl} and
 * {@code mod} items together with their {@code ///} doc comments and derive lists.
 */
public class RustCodeGrammar implements ConcreteGrammar {

    private static final Logger logger = LoggerFactory.getLogger(RustCodeGrammar.class);

    public static final String NAME = "rust-gen";

    private static final String INDENT = "    ";
    private static final int INLINE_PIPELINE_WIDTH = 80;
    private static final Pattern DERIVE = Pattern.compile("#\\[\\s*derive\\s*\\((.*)\\)\\s*]", Pattern.DOTALL);

    private static final Set<Category> SUPPORTED = Collections.unmodifiableSet(EnumSet.of(
        Category.CODE_MODULE, Category.CODE_SIGNATURE, Category.DATA_FLOW, Category.CODE_FACT,
        Category.SECTION, Category.DOCUMENT, Category.FREEFORM, Category.CONJUNCTION,
        Category.CONFIDENCE, Category.PROVENANCE));

    private final ThreadLocal<TSParser> parser = ThreadLocal.withInitial(() -> {
        TSParser p = new TSParser();
        if (!p.setLanguage(new TreeSitterRust())) {
            logger.error("Failed to set Rust language on tree-sitter parser");
        }
        return p;
    });

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Rust code generation: renders code nodes as Rust source and parses Rust back";
    }

    @Override
    public Set<Category> supportedCategories() {
        return SUPPORTED;
    }

    @Override
    public String linearize(SemanticTree tree, LinContext ctx) throws GrammarException {
        return render(tree, 0);
    }

    private String render(SemanticTree tree, int depth) throws GrammarException {
        String prefix = INDENT.repeat(depth);
        if (tree instanceof CodeModule m) {
            StringBuilder out = new StringBuilder();
            docLines(out, m.docSummary(), prefix);
            out.append(prefix).append("pub mod ").append(m.name()).append(" {\n");
            for (SemanticTree child : m.children()) {
                out.append(render(child, depth + 1)).append('\n');
            }
            return out.append(prefix).append("}\n").toString();
        }
        if (tree instanceof CodeSignature s) {
            return signature(s, prefix);
        }
        if (tree instanceof DataFlow d) {
            return pipeline(d, prefix);
        }
        if (tree instanceof CodeFact c) {
            return prefix + "// " + c.kind() + ": " + c.name() + " — " + c.detail() + "\n";
        }
        if (tree instanceof Section s) {
            StringBuilder out = new StringBuilder(prefix).append("// === ").append(s.heading()).append(" ===\n\n");
            for (SemanticTree item : s.body()) {
                out.append(render(item, depth)).append('\n');
            }
            return out.toString();
        }
        if (tree instanceof Document d) {
            StringBuilder out = new StringBuilder();
            if (d.overview() instanceof Freeform f) {
                for (String line : f.text().split("\\R")) {
                    out.append("//! ").append(line).append('\n');
                }
                out.append('\n');
            }
            for (SemanticTree section : d.sections()) {
                out.append(render(section, depth)).append('\n');
            }
            return out.toString();
        }
        if (tree instanceof Freeform f) {
            return prefix + "// " + f.text() + "\n";
        }
        if (tree instanceof Conjunction c) {
            StringBuilder out = new StringBuilder();
            for (SemanticTree item : c.items()) {
                out.append(render(item, depth)).append('\n');
            }
            return out.toString();
        }
        if (tree instanceof WithConfidence w) {
            return render(w.inner(), depth);
        }
        if (tree instanceof WithProvenance w) {
            return render(w.inner(), depth);
        }
        throw new LinearizationFailedException(tree.category(), NAME,
            "rust-gen does not handle " + tree.category() + " nodes");
    }

    private static void docLines(StringBuilder out, String doc, String prefix) {
        if (doc == null) {
            return;
        }
        for (String line : doc.split("\\R")) {
            out.append(prefix).append("/// ").append(line).append('\n');
        }
    }

    private static void derives(StringBuilder out, List<String> traits, String prefix) {
        if (!traits.isEmpty()) {
            out.append(prefix).append("#[derive(").append(String.join(", ", traits)).append(")]\n");
        }
    }

    private static String signature(CodeSignature s, String prefix) {
        StringBuilder out = new StringBuilder();
        docLines(out, s.docSummary(), prefix);
        switch (s.kind()) {
            case FN:
                out.append(prefix).append("pub fn ").append(s.name())
                    .append('(').append(String.join(", ", s.paramsOrFields())).append(')');
                if (s.returnType() != null && !s.returnType().isEmpty()) {
                    out.append(" -> ").append(s.returnType());
                }
                out.append(" {\n").append(prefix).append(INDENT).append("todo!()\n")
                    .append(prefix).append("}\n");
                break;
            case STRUCT:
                derives(out, s.traits(), prefix);
                if (s.paramsOrFields().isEmpty()) {
                    out.append(prefix).append("pub struct ").append(s.name()).append(";\n");
                } else {
                    out.append(prefix).append("pub struct ").append(s.name()).append(" {\n");
                    for (String field : s.paramsOrFields()) {
                        out.append(prefix).append(INDENT).append("pub ").append(field)
                            .append(field.contains(":") ? "" : ": ()").append(",\n");
                    }
                    out.append(prefix).append("}\n");
                }
                break;
            case ENUM:
                derives(out, s.traits(), prefix);
                out.append(prefix).append("pub enum ").append(s.name()).append(" {\n");
                for (String variant : s.paramsOrFields()) {
                    out.append(prefix).append(INDENT).append(variant).append(",\n");
                }
                out.append(prefix).append("}\n");
                break;
            case TRAIT:
                out.append(prefix).append("pub trait ").append(s.name()).append(" {\n");
                for (String method : s.paramsOrFields()) {
                    String decl = method.startsWith("fn ") ? method : "fn " + method;
                    out.append(prefix).append(INDENT).append(decl).append(decl.contains("(") ? ";\n" : "(&self);\n");
                }
                out.append(prefix).append("}\n");
                break;
            default:
                if (!s.traits().isEmpty()) {
                    String target = s.returnType() == null ? s.name() : s.returnType();
                    out.append(prefix).append("impl ").append(s.traits().get(0)).append(" for ").append(target).append(" {\n");
                } else {
                    out.append(prefix).append("impl ").append(s.name()).append(" {\n");
                }
                for (String method : s.paramsOrFields()) {
                    out.append(prefix).append(INDENT).append("pub fn ").append(method).append("(&self) {\n")
                        .append(prefix).append(INDENT).append(INDENT).append("todo!()\n")
                        .append(prefix).append(INDENT).append("}\n\n");
                }
                out.append(prefix).append("}\n");
                break;
        }
        return out.toString();
    }

    private static String pipeline(DataFlow d, String prefix) {
        if (d.steps().isEmpty()) {
            return prefix + "// (empty pipeline)\n";
        }
        List<String> chain = new ArrayList<>();
        for (DataFlow.Step step : d.steps()) {
            chain.add(step.viaType() == null
                ? "." + step.name() + "()"
                : "." + step.name() + "() /* " + step.viaType() + " */");
        }
        StringBuilder out = new StringBuilder(prefix).append("// Pipeline:\n");
        String inline = String.join("", chain);
        if (inline.length() < INLINE_PIPELINE_WIDTH) {
            out.append(prefix).append("// input").append(inline).append('\n');
        } else {
            out.append(prefix).append("// input\n");
            for (String step : chain) {
                out.append(prefix).append("//     ").append(step).append('\n');
            }
        }
        return out.toString();
    }

    /**
     * Parses Rust source. One recognised item becomes that node, several become a
     * module named {@code parsed}, none leave the input as freeform text.
     *
     * @throws ParseFailedException if the source has syntax errors
     */
    @Override
    public SemanticTree parse(String input, Category expected, ParseContext ctx) throws GrammarException {
        String src = input == null ? "" : input;
        byte[] bytes = src.getBytes(StandardCharsets.UTF_8);
        TSTree tree = parser.get().parseString(null, src);
        TSNode root = tree.getRootNode();
        if (root.isNull() || root.hasError()) {
            throw new ParseFailedException(src, "Rust source has syntax errors");
        }
        List<SemanticTree> items = items(root, bytes);
        logger.debug("Parsed {} Rust items", items.size());
        if (items.isEmpty()) {
            return SemanticTree.freeform(src);
        }
        if (items.size() == 1) {
            return items.get(0);
        }
        return new CodeModule("parsed", items);
    }

    private static List<SemanticTree> items(TSNode container, byte[] src) {
        List<SemanticTree> out = new ArrayList<>();
        List<String> docs = new ArrayList<>();
        List<String> derives = new ArrayList<>();
        for (TSNode node : namedChildren(container)) {
            String type = node.getType();
            if (type.equals("line_comment")) {
                String text = text(node, src).trim();
                if (text.startsWith("///") && !text.startsWith("////")) {
                    docs.add(text.substring(3).trim());
                }
                continue;
            }
            if (type.equals("attribute_item")) {
                Matcher m = DERIVE.matcher(text(node, src));
                if (m.find()) {
                    for (String d : m.group(1).split(",")) {
                        if (!d.isBlank()) {
                            derives.add(d.trim());
                        }
                    }
                }
                continue;
            }
            SemanticTree item = item(node, src, docs.isEmpty() ? null : String.join("\n", docs), derives);
            if (item != null) {
                out.add(item);
            }
            docs = new ArrayList<>();
            derives = new ArrayList<>();
        }
        return out;
    }

    private static SemanticTree item(TSNode node, byte[] src, String doc, List<String> derives) {
        String name = text(node.getChildByFieldName("name"), src);
        switch (node.getType()) {
            case "function_item": {
                List<String> params = new ArrayList<>();
                TSNode parameters = node.getChildByFieldName("parameters");
                for (TSNode p : namedChildren(parameters)) {
                    if (p.getType().endsWith("parameter")) {
                        params.add(text(p, src));
                    }
                }
                TSNode ret = node.getChildByFieldName("return_type");
                return new CodeSignature(SignatureKind.FN, name, doc, params,
                    ret.isNull() ? null : text(ret, src), List.of(), null);
            }
            case "struct_item":
                return new CodeSignature(SignatureKind.STRUCT, name, doc,
                    fields(node.getChildByFieldName("body"), src), null, derives, null);
            case "enum_item": {
                List<String> variants = new ArrayList<>();
                TSNode body = node.getChildByFieldName("body");
                for (TSNode v : namedChildren(body)) {
                    if (v.getType().equals("enum_variant")) {
                        variants.add(text(v.getChildByFieldName("name"), src));
                    }
                }
                return new CodeSignature(SignatureKind.ENUM, name, doc, variants, null, derives, null);
            }
            case "trait_item": {
                List<String> methods = new ArrayList<>();
                for (String method : functionNames(node.getChildByFieldName("body"), src)) {
                    methods.add("fn " + method);
                }
                return new CodeSignature(SignatureKind.TRAIT, name, doc, methods, null, List.of(), null);
            }
            case "impl_item": {
                String target = text(node.getChildByFieldName("type"), src);
                TSNode trait = node.getChildByFieldName("trait");
                List<String> traits = trait.isNull() ? List.of() : List.of(text(trait, src));
                return new CodeSignature(SignatureKind.IMPL, target, doc,
                    functionNames(node.getChildByFieldName("body"), src), null, traits, null);
            }
            case "mod_item": {
                TSNode body = node.getChildByFieldName("body");
                List<SemanticTree> children = body.isNull() ? List.of() : items(body, src);
                return new CodeModule(name, null, null, doc, children);
            }
            default:
                return null;
        }
    }

    private static List<String> fields(TSNode body, byte[] src) {
        List<String> fields = new ArrayList<>();
        if (body.isNull()) {
            return fields;
        }
        int position = 0;
        for (TSNode f : namedChildren(body)) {
            if (f.getType().equals("field_declaration")) {
                fields.add(text(f.getChildByFieldName("name"), src) + ": " + text(f.getChildByFieldName("type"), src));
            } else if (body.getType().equals("ordered_field_declaration_list")
                && !f.getType().equals("visibility_modifier") && !f.getType().equals("attribute_item")) {
                fields.add("field_" + position++ + ": " + text(f, src));
            }
        }
        return fields;
    }

    private static List<String> functionNames(TSNode body, byte[] src) {
        List<String> names = new ArrayList<>();
        for (TSNode child : namedChildren(body)) {
            if (child.getType().equals("function_item") || child.getType().equals("function_signature_item")) {
                names.add(text(child.getChildByFieldName("name"), src));
            }
        }
        return names;
    }

    /**
     * Named children in source order. Walks every child and filters on
     * {@code isNamed()}: the binding's {@code getNamedChild(i)} repeats a leading
     * comment instead of advancing past it.
     */
    static List<TSNode> namedChildren(TSNode node) {
        List<TSNode> out = new ArrayList<>();
        if (node == null || node.isNull()) {
            return out;
        }
        for (int i = 0; i < node.getChildCount(); i++) {
            TSNode child = node.getChild(i);
            if (!child.isNull() && child.isNamed()) {
                out.add(child);
            }
        }
        return out;
    }

    private static String text(TSNode node, byte[] src) {
        if (node == null || node.isNull()) {
            return "";
        }
        int start = node.getStartByte();
        int end = Math.min(node.getEndByte(), src.length);
        if (start < 0 || start > end) {
            return "";
        }
        return new String(src, start, end - start, StandardCharsets.UTF_8);
    }
}
