package pl.marcinmilkowski.interlingua.lexicon;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Loads a {@link Lexicon} from JSON.
 *
 * Expected JSON structure:
 * {
 *   "language": "en",
 *   "void_words": ["a", "an", "the"],
 *   "patterns": [ {"words": "is part of", "predicate": "part-of", "confidence": 0.9}, ... ],
 *   "question_words": { "what": "what", "is": "yes_no", ... },
 *   "goal_verbs": ["find", ...],
 *   "commands": { "help": "help", "show status": "show_status", ... },
 *   "run_prefixes": ["run", "cycle"],
 *   "render_prefixes": ["show", "render", "graph"],
 *   "auxiliaries": [...],
 *   "trailing_auxiliaries": [...],
 *   "capability_modals": [...],
 *   "conjunctions": { "and": ["and"], "or": ["or"] }
 * }
 */
public final class LexiconLoader {
    private static final Logger logger = LoggerFactory.getLogger(LexiconLoader.class);

    static final String RESOURCE_PATTERN = "/interlingua/lexicon/%s.json";

    private LexiconLoader() {
    }

    /**
     * Load a lexicon from the specified path.
     *
     * @throws IOException if the file cannot be read
     * @throws IllegalArgumentException if the file is invalid
     */
    public static Lexicon load(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("Lexicon file not found: " + path);
        }
        Lexicon lexicon = parse(Files.readString(path));
        logger.info("Loaded lexicon {} from {}", lexicon, path);
        return lexicon;
    }

    static Lexicon loadBundled(Language language) {
        String resource = String.format(RESOURCE_PATTERN, language.code());
        try (InputStream in = LexiconLoader.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IOException("Resource not found: " + resource);
            }
            Lexicon lexicon = parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
            if (lexicon.language() != language) {
                throw new IllegalArgumentException("Resource " + resource + " declares language "
                    + lexicon.language().code());
            }
            logger.info("Loaded lexicon {} from classpath", lexicon);
            return lexicon;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load bundled lexicon: " + resource, e);
        }
    }

    /**
     * Parse lexicon JSON text.
     *
     * @throws IllegalArgumentException if required fields are missing
     */
    public static Lexicon parse(String content) {
        JSONObject root = JSON.parseObject(content);
        if (root == null) {
            throw new IllegalArgumentException("Empty lexicon");
        }
        String code = root.getString("language");
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Missing 'language' field in lexicon");
        }
        Language language = Language.fromCode(code)
            .orElseThrow(() -> new IllegalArgumentException("Unsupported lexicon language: " + code));

        JSONArray patternsArray = root.getJSONArray("patterns");
        if (patternsArray == null || patternsArray.isEmpty()) {
            throw new IllegalArgumentException("Missing or empty 'patterns' array in lexicon " + code);
        }
        List<RelationalPattern> patterns = new ArrayList<>();
        for (int i = 0; i < patternsArray.size(); i++) {
            JSONObject p = patternsArray.getJSONObject(i);
            if (p == null) {
                throw new IllegalArgumentException("Invalid pattern at index " + i);
            }
            String words = p.getString("words");
            String predicate = p.getString("predicate");
            if (words == null || words.isBlank() || predicate == null || predicate.isBlank()) {
                throw new IllegalArgumentException("Pattern at index " + i + " needs 'words' and 'predicate'");
            }
            Double confidence = p.getDouble("confidence");
            patterns.add(new RelationalPattern(
                Arrays.asList(words.trim().toLowerCase(Locale.ROOT).split("\\s+")),
                predicate,
                confidence != null ? confidence : 0.85));
        }

        Map<String, QuestionWord> questionWords = new HashMap<>();
        JSONObject qw = root.getJSONObject("question_words");
        if (qw != null) {
            for (String key : qw.keySet()) {
                questionWords.put(key.toLowerCase(Locale.ROOT), QuestionWord.fromId(qw.getString(key)));
            }
        }

        Map<String, CommandKind> commands = new LinkedHashMap<>();
        JSONObject cmds = root.getJSONObject("commands");
        if (cmds != null) {
            for (String key : cmds.keySet()) {
                commands.put(key.toLowerCase(Locale.ROOT), CommandKind.fromId(cmds.getString(key)));
            }
        }

        JSONObject conj = root.getJSONObject("conjunctions");
        Set<String> andWords = conj != null ? words(conj.getJSONArray("and")) : Set.of();
        Set<String> orWords = conj != null ? words(conj.getJSONArray("or")) : Set.of();

        return new Lexicon(
            language,
            words(root.getJSONArray("void_words")),
            patterns,
            questionWords,
            words(root.getJSONArray("goal_verbs")),
            commands,
            words(root.getJSONArray("run_prefixes")),
            words(root.getJSONArray("render_prefixes")),
            words(root.getJSONArray("auxiliaries")),
            words(root.getJSONArray("trailing_auxiliaries")),
            words(root.getJSONArray("capability_modals")),
            andWords,
            orWords);
    }

    private static Set<String> words(JSONArray array) {
        Set<String> out = new HashSet<>();
        if (array != null) {
            for (int i = 0; i < array.size(); i++) {
                String w = array.getString(i);
                if (w != null && !w.isBlank()) {
                    out.add(w.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        return out;
    }
}
