package pl.marcinmilkowski.interlingua;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.interlingua.config.InterlinguaConfig;
import pl.marcinmilkowski.interlingua.error.GrammarException;
import pl.marcinmilkowski.interlingua.error.InvalidCustomGrammarException;
import pl.marcinmilkowski.interlingua.grammar.ConcreteGrammar;
import pl.marcinmilkowski.interlingua.grammar.CustomGrammar;
import pl.marcinmilkowski.interlingua.grammar.GrammarRegistry;
import pl.marcinmilkowski.interlingua.grammar.LinContext;
import pl.marcinmilkowski.interlingua.lexicon.Language;
import pl.marcinmilkowski.interlingua.parser.ParseContext;
import pl.marcinmilkowski.interlingua.parser.ParseResult;
import pl.marcinmilkowski.interlingua.parser.ProseParser;
import pl.marcinmilkowski.interlingua.preprocess.DetectionResult;
import pl.marcinmilkowski.interlingua.preprocess.LanguageDetector;
import pl.marcinmilkowski.interlingua.preprocess.PreProcessor;
import pl.marcinmilkowski.interlingua.preprocess.PreProcessorOutput;
import pl.marcinmilkowski.interlingua.preprocess.TextChunk;
import pl.marcinmilkowski.interlingua.resolve.EntityResolver;
import pl.marcinmilkowski.interlingua.resolve.ResolutionResult;
import pl.marcinmilkowski.interlingua.tree.Category;
import pl.marcinmilkowski.interlingua.tree.SemanticTree;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Command-line entry point: parse prose, render trees, detect languages,
 * resolve entities and pre-process corpora.
 */
public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        if (args.length == 0) {
            showUsage();
            return;
        }

        try {
            String command = args[0].toLowerCase(Locale.ROOT);

            switch (command) {
                case "parse":
                    handleParseCommand(args);
                    break;
                case "render":
                    handleRenderCommand(args);
                    break;
                case "detect":
                    handleDetectCommand(args);
                    break;
                case "resolve":
                    handleResolveCommand(args);
                    break;
                case "preprocess":
                    handlePreprocessCommand(args);
                    break;
                case "grammars":
                    handleGrammarsCommand(args);
                    break;
                case "help":
                    showUsage();
                    break;
                default:
                    logger.error("Unknown command: {}", command);
                    showUsage();
            }
        } catch (Exception e) {
            logger.error("Application error", e);
            System.err.println("Error: " + e.getMessage());
            System.err.println("Use 'help' command for usage information.");
        }
    }

    private static InterlinguaConfig loadConfig(String configPath) throws IOException {
        return configPath == null ? InterlinguaConfig.defaults() : InterlinguaConfig.load(Paths.get(configPath));
    }

    private static GrammarRegistry registry(ProseParser parser, String customPath)
            throws IOException, InvalidCustomGrammarException {
        GrammarRegistry registry = GrammarRegistry.withBuiltins(parser);
        if (customPath != null) {
            registry.register(CustomGrammar.fromPath(Paths.get(customPath)));
        }
        return registry;
    }

    private static void handleParseCommand(String[] args) throws Exception {
        String language = null;
        String grammar = null;
        String customPath = null;
        String configPath = null;
        boolean json = false;
        List<String> words = new ArrayList<>();

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--language":
                case "-l":
                    language = args[++i];
                    break;
                case "--grammar":
                case "-g":
                    grammar = args[++i];
                    break;
                case "--custom":
                    customPath = args[++i];
                    break;
                case "--config":
                    configPath = args[++i];
                    break;
                case "--json":
                    json = true;
                    break;
                default:
                    words.add(args[i]);
            }
        }

        if (words.isEmpty()) {
            System.err.println("Error: text to parse is required");
            System.err.println("Usage: java -jar interlingua.jar parse [--language xx] [--grammar name] <text>");
            return;
        }

        String text = String.join(" ", words);
        Language lang = language == null ? LanguageDetector.detect(text).language() : Language.require(language);
        ProseParser parser = new ProseParser(loadConfig(configPath));
        GrammarRegistry registry = registry(parser, customPath);
        ConcreteGrammar renderer = grammar == null ? registry.defaultGrammar() : registry.get(grammar);

        ParseResult result = parser.parseProse(text, ParseContext.of(lang));
        System.out.println("Language: " + lang.displayName());

        if (result instanceof ParseResult.Facts facts) {
            System.out.println("Facts: " + facts.trees().size());
            for (SemanticTree tree : facts.trees()) {
                printTree(tree, renderer, json);
            }
        } else if (result instanceof ParseResult.Query query) {
            System.out.println("Query about '" + query.subject() + "' (" + query.frame().questionWord() + ")");
        } else if (result instanceof ParseResult.CommandRequest request) {
            System.out.println("Command: " + request.command());
        } else if (result instanceof ParseResult.Goal goal) {
            System.out.println("Goal: " + goal.description());
        } else if (result instanceof ParseResult.Freeform freeform) {
            System.out.println("Freeform: " + freeform.text());
            for (SemanticTree tree : freeform.partial()) {
                printTree(tree, renderer, json);
            }
        }
    }

    private static void printTree(SemanticTree tree, ConcreteGrammar renderer, boolean json)
            throws GrammarException {
        if (json) {
            System.out.println(tree.toJson().toJSONString(JSONWriter.Feature.PrettyFormat));
        } else {
            System.out.println("  " + renderer.linearize(tree, LinContext.empty()));
        }
    }

    private static void handleRenderCommand(String[] args) throws Exception {
        String treePath = null;
        String grammar = null;
        String customPath = null;
        String sourcePath = null;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--tree":
                case "-t":
                    treePath = args[++i];
                    break;
                case "--grammar":
                case "-g":
                    grammar = args[++i];
                    break;
                case "--custom":
                    customPath = args[++i];
                    break;
                case "--rust":
                    sourcePath = args[++i];
                    break;
                default:
                    System.err.println("Unknown option: " + args[i]);
            }
        }

        GrammarRegistry registry = GrammarRegistry.withBuiltins();
        if (customPath != null) {
            CustomGrammar custom = CustomGrammar.fromPath(Paths.get(customPath));
            registry.register(custom);
            if (grammar == null) {
                grammar = custom.name();
            }
        }

        SemanticTree tree;
        if (treePath != null) {
            String content = Files.readString(Paths.get(treePath), StandardCharsets.UTF_8);
            tree = SemanticTree.fromJson(JSON.parseObject(content));
        } else if (sourcePath != null) {
            String source = Files.readString(Paths.get(sourcePath), StandardCharsets.UTF_8);
            tree = registry.parse("rust-gen", source, Category.CODE_MODULE);
        } else {
            System.err.println("Error: --tree or --rust is required");
            System.err.println("Usage: java -jar interlingua.jar render --tree <file.json> [--grammar name] [--custom file.toml]");
            return;
        }

        String rendered = grammar == null ? registry.linearizeDefault(tree) : registry.linearize(grammar, tree);
        System.out.println(rendered);
    }

    private static void handleDetectCommand(String[] args) {
        boolean perSentence = false;
        List<String> words = new ArrayList<>();
        for (int i = 1; i < args.length; i++) {
            if ("--sentences".equals(args[i])) {
                perSentence = true;
            } else {
                words.add(args[i]);
            }
        }
        if (words.isEmpty()) {
            System.err.println("Usage: java -jar interlingua.jar detect [--sentences] <text>");
            return;
        }

        String text = String.join(" ", words);
        if (perSentence) {
            for (LanguageDetector.SentenceDetection sd : LanguageDetector.detectPerSentence(text)) {
                System.out.printf(Locale.ROOT, "%-4s %.2f  %s%n",
                    sd.detection().language().code(), sd.detection().confidence(), sd.sentence());
            }
        } else {
            DetectionResult result = LanguageDetector.detect(text);
            System.out.printf(Locale.ROOT, "%s (%s) confidence %.2f%n",
                result.language().displayName(), result.language().code(), result.confidence());
        }
    }

    private static void handleResolveCommand(String[] args) {
        if (args.length < 2) {
            System.err.println("Usage: java -jar interlingua.jar resolve <surface> [<surface> ...]");
            return;
        }
        EntityResolver resolver = new EntityResolver();
        for (int i = 1; i < args.length; i++) {
            ResolutionResult result = resolver.resolveEntity(args[i]);
            System.out.printf("%s -> %s [%s]%n", args[i], result.canonical(),
                result.source().name().toLowerCase(Locale.ROOT));
        }
    }

    private static void handlePreprocessCommand(String[] args) throws Exception {
        String inputPath = null;
        String outputPath = null;
        String configPath = null;
        String learnedPath = null;
        boolean mixed = false;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--input":
                case "-i":
                    inputPath = args[++i];
                    break;
                case "--output":
                case "-o":
                    outputPath = args[++i];
                    break;
                case "--config":
                    configPath = args[++i];
                    break;
                case "--learned":
                    learnedPath = args[++i];
                    break;
                case "--mixed":
                    mixed = true;
                    break;
                default:
                    System.err.println("Unknown option: " + args[i]);
            }
        }

        if (inputPath == null) {
            System.err.println("Error: --input is required");
            System.err.println("Usage: java -jar interlingua.jar preprocess --input <chunks.json|text.txt> [--mixed] [--output <file>] [--learned <file>]");
            return;
        }

        PreProcessor preProcessor = new PreProcessor(loadConfig(configPath));
        Path learnedFile = learnedPath == null ? null : Paths.get(learnedPath);
        if (learnedFile != null && Files.exists(learnedFile)) {
            int imported = preProcessor.resolver().importLearned(
                JSON.parseArray(Files.readString(learnedFile, StandardCharsets.UTF_8)));
            logger.info("Imported {} learned equivalences from {}", imported, learnedFile);
        }

        String content = Files.readString(Paths.get(inputPath), StandardCharsets.UTF_8);
        ParseContext ctx = ParseContext.empty();
        List<PreProcessorOutput> outputs;
        if (mixed) {
            outputs = preProcessor.preprocessMixedCorpus(content, ctx);
        } else {
            JSONArray array = JSON.parseArray(content);
            List<TextChunk> chunks = new ArrayList<>(array.size());
            for (int i = 0; i < array.size(); i++) {
                chunks.add(TextChunk.fromJson(array.getJSONObject(i)));
            }
            PreProcessor.BatchResult batch = preProcessor.preprocessBatchWithLearning(chunks, ctx);
            outputs = batch.outputs();
            System.out.println("Discovered equivalences: " + batch.discovered());
        }

        JSONArray result = new JSONArray();
        int claims = 0;
        for (PreProcessorOutput output : outputs) {
            result.add(output.toJson());
            claims += output.claims().size();
        }
        System.out.println("Processed " + outputs.size() + " chunks, " + claims + " claims");

        String serialized = result.toJSONString(JSONWriter.Feature.PrettyFormat);
        if (outputPath == null) {
            System.out.println(serialized);
        } else {
            Files.writeString(Paths.get(outputPath), serialized, StandardCharsets.UTF_8);
            System.out.println("Wrote " + outputPath);
        }

        if (learnedFile != null) {
            Files.writeString(learnedFile,
                preProcessor.resolver().exportLearned().toJSONString(JSONWriter.Feature.PrettyFormat),
                StandardCharsets.UTF_8);
        }
    }

    private static void handleGrammarsCommand(String[] args) throws Exception {
        String customPath = args.length > 2 && "--custom".equals(args[1]) ? args[2] : null;
        GrammarRegistry registry = registry(new ProseParser(), customPath);
        for (String name : registry.list()) {
            ConcreteGrammar grammar = registry.get(name);
            String marker = name.equals(registry.defaultName()) ? "*" : " ";
            System.out.printf("%s %-10s %s%n", marker, name, grammar.description());
        }
    }

    private static void showUsage() {
        System.out.println("Usage: java -jar interlingua.jar <command> [options]");
        System.out.println();
        System.out.println("Commands:");
        System.out.println("  parse       Parse prose into semantic trees and render them");
        System.out.println("  render      Render a JSON tree (or Rust source) with a grammar");
        System.out.println("  detect      Detect the language of text");
        System.out.println("  resolve     Resolve surface forms to canonical entities");
        System.out.println("  preprocess  Extract entities and claims from a corpus");
        System.out.println("  grammars    List available grammars");
        System.out.println("  help        Show this help message");
        System.out.println();
        System.out.println("Parse options:");
        System.out.println("  --language, -l <code>  Language (en, ru, ar, fr, es); detected when omitted");
        System.out.println("  --grammar, -g <name>   Grammar used to render the result (default: formal)");
        System.out.println("  --custom <file.toml>   Register a custom TOML grammar");
        System.out.println("  --config <file.json>   Configuration file");
        System.out.println("  --json                 Print trees as JSON");
        System.out.println();
        System.out.println("Render options:");
        System.out.println("  --tree, -t <file.json> Tree to render");
        System.out.println("  --rust <file.rs>       Parse Rust source into a tree first");
        System.out.println("  --grammar, -g <name>   Grammar name");
        System.out.println("  --custom <file.toml>   Register and use a custom TOML grammar");
        System.out.println();
        System.out.println("Preprocess options:");
        System.out.println("  --input, -i <file>     JSON array of chunks, or plain text with --mixed");
        System.out.println("  --mixed                Treat input as mixed-language text split by sentence");
        System.out.println("  --output, -o <file>    Write outputs here instead of stdout");
        System.out.println("  --learned <file>       Load and save learned equivalences");
        System.out.println();
        System.out.println("Examples:");
        System.out.println("  java -jar interlingua.jar parse \"Dogs are mammals\" --grammar narrative");
        System.out.println("  java -jar interlingua.jar detect --sentences \"The cat sleeps. Кошка спит.\"");
        System.out.println("  java -jar interlingua.jar resolve Москва Moscou");
    }
}
