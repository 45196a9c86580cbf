package pl.marcinmilkowski.interlingua.lexicon;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable per-language word tables used by the lexer and parser.
 *
 * All lookups are case-insensitive. Relational patterns are kept longest first,
 * so the first pattern that matches is the most specific one.
 */
public final class Lexicon {

    private static final Map<Language, Lexicon> CACHE = Collections.synchronizedMap(new EnumMap<>(Language.class));

    private final Language language;
    private final Set<String> voidWords;
    private final List<RelationalPattern> patterns;
    private final Map<String, QuestionWord> questionWords;
    private final Set<String> goalVerbs;
    private final Map<String, CommandKind> commands;
    private final Set<String> runPrefixes;
    private final Set<String> renderPrefixes;
    private final Set<String> auxiliaries;
    private final Set<String> trailingAuxiliaries;
    private final Set<String> capabilityModals;
    private final Set<String> andWords;
    private final Set<String> orWords;

    Lexicon(
        Language language,
        Set<String> voidWords,
        List<RelationalPattern> patterns,
        Map<String, QuestionWord> questionWords,
        Set<String> goalVerbs,
        Map<String, CommandKind> commands,
        Set<String> runPrefixes,
        Set<String> renderPrefixes,
        Set<String> auxiliaries,
        Set<String> trailingAuxiliaries,
        Set<String> capabilityModals,
        Set<String> andWords,
        Set<String> orWords
    ) {
        this.language = language;
        this.voidWords = Set.copyOf(voidWords);
        List<RelationalPattern> sorted = new ArrayList<>(patterns);
        sorted.sort(Comparator.comparingInt(RelationalPattern::length).reversed());
        this.patterns = List.copyOf(sorted);
        this.questionWords = Map.copyOf(questionWords);
        this.goalVerbs = Set.copyOf(goalVerbs);
        this.commands = Collections.unmodifiableMap(new LinkedHashMap<>(commands));
        this.runPrefixes = Set.copyOf(runPrefixes);
        this.renderPrefixes = Set.copyOf(renderPrefixes);
        this.auxiliaries = Set.copyOf(auxiliaries);
        this.trailingAuxiliaries = Set.copyOf(trailingAuxiliaries);
        this.capabilityModals = Set.copyOf(capabilityModals);
        this.andWords = Set.copyOf(andWords);
        this.orWords = Set.copyOf(orWords);
    }

    /**
     * The bundled lexicon for a language, loaded once and shared.
     *
     * @throws IllegalStateException if the bundled resource is missing or invalid
     */
    public static Lexicon forLanguage(Language language) {
        Lexicon cached = CACHE.get(language);
        if (cached != null) {
            return cached;
        }
        synchronized (CACHE) {
            return CACHE.computeIfAbsent(language, LexiconLoader::loadBundled);
        }
    }

    public static Lexicon english() {
        return forLanguage(Language.ENGLISH);
    }

    public Language language() {
        return language;
    }

    public List<RelationalPattern> relationalPatterns() {
        return patterns;
    }

    public boolean isVoid(String word) {
        return word != null && voidWords.contains(lower(word));
    }

    public boolean isQuestionWord(String word) {
        return word != null && questionWords.containsKey(lower(word));
    }

    public Optional<QuestionWord> questionWordKind(String word) {
        return word == null ? Optional.empty() : Optional.ofNullable(questionWords.get(lower(word)));
    }

    public boolean isAuxiliaryVerb(String word) {
        return word != null && auxiliaries.contains(lower(word));
    }

    public boolean isTrailingAuxiliary(String word) {
        return word != null && trailingAuxiliaries.contains(lower(word));
    }

    public boolean isCapabilityModal(String word) {
        return word != null && capabilityModals.contains(lower(word));
    }

    public boolean isGoalVerb(String word) {
        return word != null && goalVerbs.contains(lower(word));
    }

    public boolean isAndWord(String word) {
        return word != null && andWords.contains(lower(word));
    }

    public boolean isOrWord(String word) {
        return word != null && orWords.contains(lower(word));
    }

    /**
     * Whether input reads as a question: a trailing question mark, a leading
     * inverted question mark, or a leading question word.
     */
    public boolean looksLikeQuestion(String input) {
        String s = input.trim();
        if (s.endsWith("?") || s.endsWith("؟") || s.startsWith("¿")) {
            return true;
        }
        String[] words = s.split("\\s+");
        return leadingQuestionWordLength(words) > 0;
    }

    /**
     * Split a question into question word, auxiliary and content words.
     *
     * Steps: strip question marks; take a leading question word; take an
     * auxiliary right after it; drop one trailing auxiliary and then one leading
     * article while at least two content words remain.
     */
    public QuestionFrame parseQuestionFrame(String input) {
        String s = stripQuestionMarks(input);
        List<String> words = new ArrayList<>();
        for (String w : s.split("\\s+")) {
            if (!w.isEmpty()) {
                words.add(w);
            }
        }

        String questionWord = null;
        QuestionWord kind = null;
        int pos = 0;
        int qLen = leadingQuestionWordLength(words.toArray(new String[0]));
        if (qLen > 0) {
            questionWord = String.join(" ", words.subList(0, qLen));
            kind = questionWords.get(lower(questionWord));
            pos = qLen;
        }

        String auxiliary = null;
        if (questionWord != null && pos < words.size() && isAuxiliaryVerb(words.get(pos))) {
            auxiliary = words.get(pos);
            pos++;
        }

        List<String> content = new ArrayList<>(words.subList(pos, words.size()));
        boolean capability = isCapabilityModal(questionWord) || isCapabilityModal(auxiliary);
        if (content.size() >= 2) {
            for (int i = 0; i < content.size(); i++) {
                if (isCapabilityModal(content.get(i))) {
                    capability = true;
                    content.remove(i);
                    break;
                }
            }
        }
        if (content.size() >= 2 && isTrailingAuxiliary(content.get(content.size() - 1))) {
            content.remove(content.size() - 1);
        }
        if (content.size() >= 2 && isVoid(content.get(0))) {
            content.remove(0);
        }
        return new QuestionFrame(questionWord, kind, auxiliary, content, capability);
    }

    /**
     * Match a command: a literal from the command table (alone or followed by
     * more words), a run prefix with an optional cycle count, or a render prefix
     * followed by an entity.
     */
    public Optional<Command> matchCommand(String input) {
        String trimmed = input.trim();
        String lowered = lower(trimmed);
        for (Map.Entry<String, CommandKind> e : commands.entrySet()) {
            if (lowered.equals(e.getKey()) || lowered.startsWith(e.getKey() + " ")) {
                return Optional.of(simpleCommand(e.getValue()));
            }
        }

        String[] words = trimmed.split("\\s+");
        String first = lower(words[0]);
        if (runPrefixes.contains(first)) {
            return Optional.of(Command.runAgent(firstInteger(words)));
        }
        if (renderPrefixes.contains(first) && words.length > 1) {
            String rest = trimmed.substring(words[0].length()).trim();
            CommandKind literal = commands.get(lower(rest));
            if (literal == CommandKind.SHOW_STATUS) {
                return Optional.of(Command.showStatus());
            }
            return Optional.of(Command.renderHiero(rest.isEmpty() ? null : rest));
        }
        return Optional.empty();
    }

    /**
     * The trimmed input when it starts with a goal verb followed by more words.
     */
    public Optional<String> matchGoal(String input) {
        String trimmed = input.trim();
        String[] words = trimmed.split("\\s+");
        if (words.length > 1 && isGoalVerb(words[0])) {
            return Optional.of(trimmed);
        }
        return Optional.empty();
    }

    private int leadingQuestionWordLength(String[] words) {
        if (words.length == 0) {
            return 0;
        }
        String first = lower(stripLeadingInverted(words[0]));
        if (words.length > 1 && questionWords.containsKey(first + " " + lower(words[1]))) {
            return 2;
        }
        return questionWords.containsKey(first) ? 1 : 0;
    }

    private static String stripQuestionMarks(String input) {
        String s = input.trim();
        while (s.endsWith("?") || s.endsWith("؟")) {
            s = s.substring(0, s.length() - 1).trim();
        }
        return stripLeadingInverted(s).trim();
    }

    private static String stripLeadingInverted(String s) {
        return s.startsWith("¿") ? s.substring(1) : s;
    }

    private static Command simpleCommand(CommandKind kind) {
        return switch (kind) {
            case HELP -> Command.help();
            case SHOW_STATUS -> Command.showStatus();
            case RUN_AGENT -> Command.runAgent(null);
            case RENDER_HIERO -> Command.renderHiero(null);
            case SET_GOAL -> throw new IllegalStateException("set_goal cannot be a literal command");
        };
    }

    private static Integer firstInteger(String[] words) {
        for (String w : words) {
            try {
                int n = Integer.parseInt(w);
                if (n >= 0) {
                    return n;
                }
            } catch (NumberFormatException e) {
                // not a number, keep looking
            }
        }
        return null;
    }

    private static String lower(String word) {
        return word.toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return "Lexicon[" + language.code() + ", " + patterns.size() + " patterns]";
    }
}
