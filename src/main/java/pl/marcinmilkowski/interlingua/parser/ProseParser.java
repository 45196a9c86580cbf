package pl.marcinmilkowski.interlingua.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.interlingua.config.InterlinguaConfig;
import pl.marcinmilkowski.interlingua.error.AmbiguousParseException;
import pl.marcinmilkowski.interlingua.error.GrammarException;
import pl.marcinmilkowski.interlingua.error.IncompleteInputException;
import pl.marcinmilkowski.interlingua.error.ParseFailedException;
import pl.marcinmilkowski.interlingua.error.VsaException;
import pl.marcinmilkowski.interlingua.lexer.Lexer;
import pl.marcinmilkowski.interlingua.lexer.Token;
import pl.marcinmilkowski.interlingua.lexicon.Command;
import pl.marcinmilkowski.interlingua.lexicon.Language;
import pl.marcinmilkowski.interlingua.lexicon.Lexicon;
import pl.marcinmilkowski.interlingua.lexicon.QuestionFrame;
import pl.marcinmilkowski.interlingua.lexicon.RelationalPattern;
import pl.marcinmilkowski.interlingua.symbol.SymbolId;
import pl.marcinmilkowski.interlingua.tree.Entity;
import pl.marcinmilkowski.interlingua.tree.SemanticTree;
import pl.marcinmilkowski.interlingua.tree.Triple;
import pl.marcinmilkowski.interlingua.tree.WithConfidence;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Prose to semantic trees, by a priority cascade:
 * command, goal, question, compound sentence, single fact, freeform.
 *
 * Pattern matching scans token lists in order, so identical input and index
 * state always give identical output.
 */
public class ProseParser {

    private static final Logger logger = LoggerFactory.getLogger(ProseParser.class);

    private final InterlinguaConfig.ParserSettings settings;
    private final Lexer lexer;

    public ProseParser() {
        this(InterlinguaConfig.defaults());
    }

    public ProseParser(InterlinguaConfig config) {
        this(config.parser(), new Lexer(config.lexer()));
    }

    public ProseParser(InterlinguaConfig.ParserSettings settings, Lexer lexer) {
        this.settings = settings;
        this.lexer = lexer;
    }

    /**
     * Parse one input.
     *
     * @throws VsaException if fuzzy token resolution against the context's index fails
     */
    public ParseResult parseProse(String input, ParseContext ctx) throws VsaException {
        String trimmed = input == null ? "" : input.trim();
        if (trimmed.isEmpty()) {
            return new ParseResult.Freeform("", List.of());
        }
        Lexicon lexicon = ctx.lexicon();

        Optional<Command> command = lexicon.matchCommand(trimmed);
        if (command.isPresent()) {
            return new ParseResult.CommandRequest(command.get());
        }

        Optional<String> goal = lexicon.matchGoal(trimmed);
        if (goal.isPresent()) {
            return new ParseResult.Goal(goal.get());
        }

        if (lexicon.looksLikeQuestion(trimmed)) {
            QuestionFrame frame = lexicon.parseQuestionFrame(trimmed);
            String subject = frame.contentWords().isEmpty() ? stripQuestionMarks(trimmed) : frame.subject();
            return new ParseResult.Query(subject, SemanticTree.entity(subject), frame);
        }

        List<Token> tokens = lexer.tokenize(trimmed, ctx.table(), ctx.index(), lexicon);

        List<SemanticTree> partial = new ArrayList<>();
        Optional<SemanticTree> compound = tryCompound(tokens, lexicon, partial);
        if (compound.isPresent()) {
            return new ParseResult.Facts(List.of(compound.get()));
        }

        Optional<SemanticTree> fact = tryFact(tokens, lexicon);
        if (fact.isPresent()) {
            return new ParseResult.Facts(List.of(fact.get()));
        }

        return new ParseResult.Freeform(trimmed, partial);
    }

    /**
     * Parse into a single tree for renderers without a parser of their own.
     * Several facts become an and-conjunction, a question its subject entity,
     * goals and unparsed text a freeform node.
     *
     * @throws ParseFailedException for commands, which have no tree form
     */
    public SemanticTree parseUniversal(String input, ParseContext ctx) throws GrammarException {
        ParseResult result = parseProse(input, ctx);
        if (result instanceof ParseResult.Facts facts) {
            return facts.trees().size() == 1 ? facts.trees().get(0) : SemanticTree.and(facts.trees());
        }
        if (result instanceof ParseResult.Query query) {
            return SemanticTree.entity(query.subject());
        }
        if (result instanceof ParseResult.CommandRequest cmd) {
            throw new ParseFailedException(input, "command " + cmd.command() + " has no tree form");
        }
        if (result instanceof ParseResult.Goal g) {
            return SemanticTree.freeform(g.description());
        }
        return SemanticTree.freeform(((ParseResult.Freeform) result).text());
    }

    /**
     * Parse exactly one declarative statement, with no freeform fallback.
     *
     * @throws IncompleteInputException if the input ends right after a relational pattern
     * @throws AmbiguousParseException if equally confident patterns yield different predicates
     * @throws ParseFailedException if no pattern matches
     */
    public SemanticTree parseStatement(String input, ParseContext ctx) throws GrammarException {
        String trimmed = input == null ? "" : input.trim();
        Lexicon lexicon = ctx.lexicon();
        List<Token> tokens = lexer.tokenize(trimmed, ctx.table(), ctx.index(), lexicon);
        if (tokens.isEmpty()) {
            throw new IncompleteInputException("empty statement");
        }

        List<Candidate> candidates = candidates(tokens, lexicon);
        if (candidates.isEmpty()) {
            for (RelationalPattern p : lexicon.relationalPatterns()) {
                if (endsWith(tokens, p)) {
                    throw new IncompleteInputException("statement ends after \"" + p.surface() + "\": " + trimmed);
                }
            }
            return tryFact(tokens, lexicon).orElseThrow(() -> new ParseFailedException(trimmed));
        }
        Candidate best = candidates.get(0);
        long rivals = candidates.stream()
            .filter(c -> c.pattern.confidence() == best.pattern.confidence())
            .map(c -> c.pattern.predicate())
            .distinct()
            .count();
        if (rivals > 1) {
            throw new AmbiguousParseException(trimmed, (int) rivals);
        }
        return best.tree;
    }

    /**
     * Classify an input without tokenizing it.
     */
    public Intent classifyIntent(String input, Language language) {
        String trimmed = input == null ? "" : input.trim();
        if (trimmed.isEmpty()) {
            return new Intent(IntentKind.EMPTY, null, null, "");
        }
        Lexicon lexicon = Lexicon.forLanguage(language);
        Optional<Command> command = lexicon.matchCommand(trimmed);
        if (command.isPresent()) {
            return new Intent(IntentKind.COMMAND, null, command.get(), trimmed);
        }
        Optional<String> goal = lexicon.matchGoal(trimmed);
        if (goal.isPresent()) {
            return new Intent(IntentKind.GOAL, null, Command.setGoal(goal.get()), trimmed);
        }
        if (lexicon.looksLikeQuestion(trimmed)) {
            return new Intent(IntentKind.QUESTION, lexicon.parseQuestionFrame(trimmed), null, trimmed);
        }
        return new Intent(IntentKind.STATEMENT, null, null, trimmed);
    }

    private Optional<SemanticTree> tryCompound(List<Token> tokens, Lexicon lexicon, List<SemanticTree> partial) {
        List<Integer> splits = new ArrayList<>();
        boolean isAnd = true;
        for (int i = 0; i < tokens.size(); i++) {
            String word = tokens.get(i).normalized();
            if (lexicon.isAndWord(word)) {
                splits.add(i);
                isAnd = true;
            } else if (lexicon.isOrWord(word)) {
                splits.add(i);
                isAnd = false;
            }
        }
        if (splits.isEmpty()) {
            return Optional.empty();
        }

        List<List<Token>> clauses = new ArrayList<>();
        int start = 0;
        for (int point : splits) {
            if (point > start) {
                clauses.add(tokens.subList(start, point));
            }
            start = point + 1;
        }
        if (start < tokens.size()) {
            clauses.add(tokens.subList(start, tokens.size()));
        }
        if (clauses.size() < 2) {
            return Optional.empty();
        }

        List<SemanticTree> facts = new ArrayList<>();
        for (List<Token> clause : clauses) {
            tryFact(clause, lexicon).ifPresent(facts::add);
        }
        if (facts.size() < settings.minCompoundClauses()) {
            partial.addAll(facts);
            return Optional.empty();
        }
        return Optional.of(isAnd ? SemanticTree.and(facts) : SemanticTree.or(facts));
    }

    /**
     * A single subject-predicate-object statement, from the most confident
     * matching pattern or, failing that, exactly three content words.
     */
    Optional<SemanticTree> tryFact(List<Token> tokens, Lexicon lexicon) {
        if (tokens.isEmpty()) {
            return Optional.empty();
        }
        List<Candidate> candidates = candidates(tokens, lexicon);
        if (!candidates.isEmpty()) {
            if (candidates.size() > 1) {
                logger.debug("{} relational patterns match; using '{}' ({})", candidates.size(),
                    candidates.get(0).pattern.surface(), candidates.get(0).pattern.confidence());
            }
            return Optional.of(candidates.get(0).tree);
        }

        List<Token> content = tokens.stream().filter(t -> !t.isVoid()).toList();
        if (content.size() == 3) {
            Triple triple = SemanticTree.triple(
                tokenToEntity(content.get(0)),
                SemanticTree.relation(content.get(1).normalized()),
                tokenToEntity(content.get(2)));
            return Optional.of(new WithConfidence(triple, settings.fallbackConfidence()));
        }
        return Optional.empty();
    }

    /**
     * Every pattern that splits the tokens into a non-empty subject and object,
     * most confident first. Patterns are tried longest first, so among equally
     * confident matches the longest pattern wins.
     */
    private List<Candidate> candidates(List<Token> tokens, Lexicon lexicon) {
        List<Candidate> out = new ArrayList<>();
        for (RelationalPattern pattern : lexicon.relationalPatterns()) {
            Optional<int[]> split = Lexer.findRelationalPattern(tokens, pattern);
            if (split.isEmpty()) {
                continue;
            }
            Optional<Entity> subject = tokensToEntity(tokens.subList(0, split.get()[0]));
            Optional<Entity> object = tokensToEntity(tokens.subList(split.get()[1], tokens.size()));
            if (subject.isEmpty() || object.isEmpty()) {
                continue;
            }
            Triple triple = SemanticTree.triple(subject.get(), SemanticTree.relation(pattern.predicate()), object.get());
            double confidence = confidence(subject.get(), object.get(), pattern);
            SemanticTree tree = Math.abs(confidence - 1.0) < 1e-6 ? triple : new WithConfidence(triple, confidence);
            out.add(new Candidate(pattern, tree));
        }
        out.sort((a, b) -> Double.compare(b.pattern.confidence(), a.pattern.confidence()));
        return out;
    }

    /**
     * Geometric mean of the pattern confidence and each side's resolution quality.
     */
    private double confidence(Entity subject, Entity object, RelationalPattern pattern) {
        double qs = subject.symbol() != null ? settings.groundedQuality() : settings.ungroundedQuality();
        double qo = object.symbol() != null ? settings.groundedQuality() : settings.ungroundedQuality();
        return Math.min(1.0, Math.cbrt(pattern.confidence() * qs * qo));
    }

    private static Optional<Entity> tokensToEntity(List<Token> tokens) {
        List<Token> content = tokens.stream().filter(t -> !t.isVoid()).toList();
        if (content.isEmpty()) {
            return Optional.empty();
        }
        if (content.size() == 1) {
            return Optional.of(tokenToEntity(content.get(0)));
        }
        String label = String.join(" ", content.stream().map(Token::surface).toList());
        SymbolId id = content.stream()
            .map(t -> t.resolution().symbol())
            .filter(s -> s != null)
            .findFirst()
            .orElse(null);
        return Optional.of(SemanticTree.entity(label, id));
    }

    private static Entity tokenToEntity(Token token) {
        return SemanticTree.entity(token.surface(), token.resolution().symbol());
    }

    private static boolean endsWith(List<Token> tokens, RelationalPattern pattern) {
        int plen = pattern.length();
        if (tokens.size() < plen + 1) {
            return false;
        }
        for (int j = 0; j < plen; j++) {
            if (!tokens.get(tokens.size() - plen + j).normalized().equals(pattern.words().get(j))) {
                return false;
            }
        }
        return true;
    }

    private static String stripQuestionMarks(String input) {
        String s = input.trim();
        while (s.endsWith("?") || s.endsWith("؟")) {
            s = s.substring(0, s.length() - 1).trim();
        }
        return s.startsWith("¿") ? s.substring(1).trim() : s;
    }

    private record Candidate(RelationalPattern pattern, SemanticTree tree) {
    }
}
