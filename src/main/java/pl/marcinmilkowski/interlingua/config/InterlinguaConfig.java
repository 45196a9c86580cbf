package pl.marcinmilkowski.interlingua.config;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Tuned constants for the translation layer, loaded from JSON.
 *
 * Expected JSON structure:
 * {
 *   "version": "1.0",
 *   "vsa": { "dimension": 1000, "ann_max_connections": 16, "ann_beam_width": 100 },
 *   "lexer": { "compound_max_window": 4, "compound_min_window": 2,
 *              "fuzzy_k": 3, "fuzzy_threshold": 0.6, "fuzzy_min_chars": 2 },
 *   "parser": { "grounded_quality": 1.0, "ungrounded_quality": 0.8,
 *               "fallback_confidence": 0.7, "min_compound_clauses": 2 },
 *   "discourse": { "focus_bonus": 10, "deprioritized_penalty": 5, "is_a_bonus": 5,
 *                  "concise_limit": 3, "normal_limit": 8 },
 *   "grounding": { "rounds": 3, "neighbor_weight": 0.3, "min_confidence": 0.5 },
 *   "preprocess": { "default_claim_confidence": 0.9, "batch_workers": 4 }
 * }
 *
 * Sections that are absent fall back to the bundled values.
 */
public class InterlinguaConfig {
    private static final Logger logger = LoggerFactory.getLogger(InterlinguaConfig.class);

    static final String DEFAULT_RESOURCE = "/interlingua/config.json";

    /** Largest dimension the HNSW vector field accepts. */
    public static final int MAX_DIMENSION = 1024;

    private static volatile InterlinguaConfig defaults;

    private final String version;
    private final VsaSettings vsa;
    private final LexerSettings lexer;
    private final ParserSettings parser;
    private final DiscourseSettings discourse;
    private final GroundingSettings grounding;
    private final PreprocessSettings preprocess;

    /**
     * Load configuration from the specified path.
     *
     * @param configPath Path to a config.json file
     * @throws IOException if the file cannot be read
     * @throws IllegalArgumentException if the file is invalid
     */
    public static InterlinguaConfig load(Path configPath) throws IOException {
        if (!Files.exists(configPath)) {
            throw new IOException("Interlingua config file not found: " + configPath);
        }
        InterlinguaConfig config = fromJson(Files.readString(configPath));
        logger.info("Loaded interlingua config version {} from {}", config.version, configPath);
        return config;
    }

    /**
     * The configuration bundled on the classpath.
     */
    public static InterlinguaConfig defaults() {
        InterlinguaConfig result = defaults;
        if (result == null) {
            synchronized (InterlinguaConfig.class) {
                result = defaults;
                if (result == null) {
                    result = loadBundled();
                    defaults = result;
                }
            }
        }
        return result;
    }

    private static InterlinguaConfig loadBundled() {
        try (InputStream in = InterlinguaConfig.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IOException("Resource not found: " + DEFAULT_RESOURCE);
            }
            InterlinguaConfig config = fromJson(new String(in.readAllBytes(), StandardCharsets.UTF_8));
            logger.info("Loaded interlingua config version {} from classpath", config.version);
            return config;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load default interlingua config: " + DEFAULT_RESOURCE, e);
        }
    }

    /**
     * Parse configuration text.
     *
     * @throws IllegalArgumentException if required fields are missing or out of range
     */
    public static InterlinguaConfig fromJson(String content) {
        JSONObject root;
        try {
            root = JSON.parseObject(content);
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Malformed interlingua config: " + e.getMessage(), e);
        }
        if (root == null) {
            throw new IllegalArgumentException("Empty interlingua config");
        }
        return new InterlinguaConfig(root);
    }

    private InterlinguaConfig(JSONObject root) {
        String parsedVersion = root.getString("version");
        if (parsedVersion == null || parsedVersion.isBlank()) {
            throw new IllegalArgumentException("Missing 'version' field in interlingua config");
        }
        this.version = parsedVersion;

        JSONObject v = section(root, "vsa");
        this.vsa = new VsaSettings(
            v.getIntValue("dimension", 1000),
            v.getIntValue("ann_max_connections", 16),
            v.getIntValue("ann_beam_width", 100));
        if (vsa.dimension() < 8 || vsa.dimension() > MAX_DIMENSION) {
            throw new IllegalArgumentException(
                "'vsa.dimension' must be between 8 and " + MAX_DIMENSION + ", got " + vsa.dimension());
        }

        JSONObject l = section(root, "lexer");
        this.lexer = new LexerSettings(
            l.getIntValue("compound_max_window", 4),
            l.getIntValue("compound_min_window", 2),
            l.getIntValue("fuzzy_k", 3),
            decimal(l, "fuzzy_threshold", 0.6),
            l.getIntValue("fuzzy_min_chars", 2));
        if (lexer.compoundMinWindow() < 2 || lexer.compoundMaxWindow() < lexer.compoundMinWindow()) {
            throw new IllegalArgumentException("Invalid lexer compound window: "
                + lexer.compoundMaxWindow() + " → " + lexer.compoundMinWindow());
        }

        JSONObject p = section(root, "parser");
        this.parser = new ParserSettings(
            decimal(p, "grounded_quality", 1.0),
            decimal(p, "ungrounded_quality", 0.8),
            decimal(p, "fallback_confidence", 0.7),
            p.getIntValue("min_compound_clauses", 2));

        JSONObject d = section(root, "discourse");
        this.discourse = new DiscourseSettings(
            d.getIntValue("focus_bonus", 10),
            d.getIntValue("deprioritized_penalty", 5),
            d.getIntValue("is_a_bonus", 5),
            d.getIntValue("concise_limit", 3),
            d.getIntValue("normal_limit", 8));

        JSONObject g = section(root, "grounding");
        this.grounding = new GroundingSettings(
            g.getIntValue("rounds", 3),
            decimal(g, "neighbor_weight", 0.3),
            decimal(g, "min_confidence", 0.5));
        if (grounding.neighborWeight() < 0.0 || grounding.neighborWeight() > 1.0) {
            throw new IllegalArgumentException("'grounding.neighbor_weight' must be in [0, 1]");
        }

        JSONObject pp = section(root, "preprocess");
        this.preprocess = new PreprocessSettings(
            decimal(pp, "default_claim_confidence", 0.9),
            pp.getIntValue("batch_workers", 4));
    }

    private static double decimal(JSONObject obj, String key, double defaultValue) {
        Double value = obj.getDouble(key);
        return value != null ? value : defaultValue;
    }

    private static JSONObject section(JSONObject root, String name) {
        JSONObject obj = root.getJSONObject(name);
        return obj != null ? obj : new JSONObject();
    }

    public String getVersion() {
        return version;
    }

    public VsaSettings vsa() {
        return vsa;
    }

    public LexerSettings lexer() {
        return lexer;
    }

    public ParserSettings parser() {
        return parser;
    }

    public DiscourseSettings discourse() {
        return discourse;
    }

    public GroundingSettings grounding() {
        return grounding;
    }

    public PreprocessSettings preprocess() {
        return preprocess;
    }

    /**
     * Export the loaded config as a JSONObject.
     */
    public JSONObject toJson() {
        JSONObject root = new JSONObject();
        root.put("version", version);

        JSONObject v = new JSONObject();
        v.put("dimension", vsa.dimension());
        v.put("ann_max_connections", vsa.annMaxConnections());
        v.put("ann_beam_width", vsa.annBeamWidth());
        root.put("vsa", v);

        JSONObject l = new JSONObject();
        l.put("compound_max_window", lexer.compoundMaxWindow());
        l.put("compound_min_window", lexer.compoundMinWindow());
        l.put("fuzzy_k", lexer.fuzzyK());
        l.put("fuzzy_threshold", lexer.fuzzyThreshold());
        l.put("fuzzy_min_chars", lexer.fuzzyMinChars());
        root.put("lexer", l);

        JSONObject p = new JSONObject();
        p.put("grounded_quality", parser.groundedQuality());
        p.put("ungrounded_quality", parser.ungroundedQuality());
        p.put("fallback_confidence", parser.fallbackConfidence());
        p.put("min_compound_clauses", parser.minCompoundClauses());
        root.put("parser", p);

        JSONObject d = new JSONObject();
        d.put("focus_bonus", discourse.focusBonus());
        d.put("deprioritized_penalty", discourse.deprioritizedPenalty());
        d.put("is_a_bonus", discourse.isABonus());
        d.put("concise_limit", discourse.conciseLimit());
        d.put("normal_limit", discourse.normalLimit());
        root.put("discourse", d);

        JSONObject g = new JSONObject();
        g.put("rounds", grounding.rounds());
        g.put("neighbor_weight", grounding.neighborWeight());
        g.put("min_confidence", grounding.minConfidence());
        root.put("grounding", g);

        JSONObject pp = new JSONObject();
        pp.put("default_claim_confidence", preprocess.defaultClaimConfidence());
        pp.put("batch_workers", preprocess.batchWorkers());
        root.put("preprocess", pp);
        return root;
    }

    public record VsaSettings(int dimension, int annMaxConnections, int annBeamWidth) {
    }

    public record LexerSettings(
        int compoundMaxWindow,
        int compoundMinWindow,
        int fuzzyK,
        double fuzzyThreshold,
        int fuzzyMinChars
    ) {
    }

    public record ParserSettings(
        double groundedQuality,
        double ungroundedQuality,
        double fallbackConfidence,
        int minCompoundClauses
    ) {
    }

    /**
     * Predicate scoring deltas and response-detail limits.
     */
    public record DiscourseSettings(
        int focusBonus,
        int deprioritizedPenalty,
        int isABonus,
        int conciseLimit,
        int normalLimit
    ) {
    }

    public record GroundingSettings(int rounds, double neighborWeight, double minConfidence) {
    }

    public record PreprocessSettings(double defaultClaimConfidence, int batchWorkers) {
    }
}
