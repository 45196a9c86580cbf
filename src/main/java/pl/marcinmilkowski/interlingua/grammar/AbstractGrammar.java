package pl.marcinmilkowski.interlingua.grammar;

import pl.marcinmilkowski.interlingua.error.GrammarException;
import pl.marcinmilkowski.interlingua.parser.ParseContext;
import pl.marcinmilkowski.interlingua.parser.ProseParser;
import pl.marcinmilkowski.interlingua.tree.Category;
import pl.marcinmilkowski.interlingua.tree.SemanticTree;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Shared parse direction for the prose grammars. Every input goes through
 * {@link ProseParser#parseUniversal} whatever category the caller expects:
 * competing patterns resolve to the most confident one and unparsed text
 * comes back as a freeform node.
 */
public abstract class AbstractGrammar implements ConcreteGrammar {

    private static final Set<Category> RENDERABLE = Collections.unmodifiableSet(
        EnumSet.complementOf(EnumSet.of(Category.DISCOURSE_FRAME)));

    protected final ProseParser parser;

    protected AbstractGrammar(ProseParser parser) {
        this.parser = parser;
    }

    @Override
    public SemanticTree parse(String input, Category expected, ParseContext ctx) throws GrammarException {
        return parser.parseUniversal(input, ctx);
    }

    @Override
    public Set<Category> supportedCategories() {
        return RENDERABLE;
    }

    protected static String decimal(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }

    /**
     * Inserts a suffix before a trailing period, or appends it.
     */
    protected static String beforePeriod(String text, String suffix) {
        if (text.endsWith(".")) {
            return text.substring(0, text.length() - 1) + suffix + ".";
        }
        return text + suffix;
    }
}
