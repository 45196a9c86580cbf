package pl.marcinmilkowski.interlingua.grammar;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.interlingua.error.GrammarException;
import pl.marcinmilkowski.interlingua.error.UnknownGrammarException;
import pl.marcinmilkowski.interlingua.parser.ParseContext;
import pl.marcinmilkowski.interlingua.parser.ProseParser;
import pl.marcinmilkowski.interlingua.tree.Category;
import pl.marcinmilkowski.interlingua.tree.SemanticTree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named collection of renderers with a default.
 */
public class GrammarRegistry {

    private static final Logger logger = LoggerFactory.getLogger(GrammarRegistry.class);

    private final Map<String, ConcreteGrammar> grammars = new ConcurrentHashMap<>();
    private volatile String defaultName;

    /**
     * Registry holding formal, terse, narrative and rust-gen, with formal as default.
     */
    public static GrammarRegistry withBuiltins() {
        return withBuiltins(new ProseParser());
    }

    public static GrammarRegistry withBuiltins(ProseParser parser) {
        GrammarRegistry registry = new GrammarRegistry();
        registry.register(new FormalGrammar(parser));
        registry.register(new TerseGrammar(parser));
        registry.register(new NarrativeGrammar(parser));
        registry.register(new RustCodeGrammar());
        registry.defaultName = FormalGrammar.NAME;
        return registry;
    }

    /**
     * Adds a grammar, replacing any grammar of the same name. The first grammar
     * registered becomes the default.
     */
    public void register(ConcreteGrammar grammar) {
        ConcreteGrammar previous = grammars.put(grammar.name(), grammar);
        if (defaultName == null) {
            defaultName = grammar.name();
        }
        logger.info("Registered grammar '{}'{}", grammar.name(), previous != null ? " (replaced)" : "");
    }

    public void setDefault(String name) throws UnknownGrammarException {
        if (!grammars.containsKey(name)) {
            throw new UnknownGrammarException(name);
        }
        defaultName = name;
    }

    public ConcreteGrammar get(String name) throws UnknownGrammarException {
        ConcreteGrammar grammar = grammars.get(name);
        if (grammar == null) {
            throw new UnknownGrammarException(name);
        }
        return grammar;
    }

    public ConcreteGrammar defaultGrammar() throws UnknownGrammarException {
        if (defaultName == null) {
            throw new UnknownGrammarException("(none registered)");
        }
        return get(defaultName);
    }

    public String defaultName() {
        return defaultName;
    }

    /**
     * Registered names in alphabetical order.
     */
    public List<String> list() {
        List<String> names = new ArrayList<>(grammars.keySet());
        Collections.sort(names);
        return names;
    }

    public String linearize(String name, SemanticTree tree) throws GrammarException {
        return linearize(name, tree, LinContext.empty());
    }

    public String linearize(String name, SemanticTree tree, LinContext ctx) throws GrammarException {
        return get(name).linearize(tree, ctx);
    }

    public String linearizeDefault(SemanticTree tree) throws GrammarException {
        return defaultGrammar().linearize(tree, LinContext.empty());
    }

    public SemanticTree parse(String name, String input, Category expected) throws GrammarException {
        return parse(name, input, expected, ParseContext.empty());
    }

    public SemanticTree parse(String name, String input, Category expected, ParseContext ctx) throws GrammarException {
        return get(name).parse(input, expected, ctx);
    }
}
