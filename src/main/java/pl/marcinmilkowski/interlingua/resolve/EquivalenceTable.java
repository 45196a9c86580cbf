package pl.marcinmilkowski.interlingua.resolve;

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
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Static cross-lingual equivalences: canonical English labels with their
 * French, Spanish, Arabic and Russian surface forms.
 *
 * Expected JSON structure:
 * {
 *   "version": "1.0",
 *   "equivalences": [ {"canonical": "Moscow", "category": "city", "aliases": ["Москва", "Moscou"]} ]
 * }
 */
public final class EquivalenceTable {
    private static final Logger logger = LoggerFactory.getLogger(EquivalenceTable.class);

    private static final String DEFAULT_RESOURCE = "/interlingua/equivalences.json";
    private static volatile EquivalenceTable defaultTable;

    /**
     * One canonical entity and its surface forms.
     */
    public record Entry(String canonical, String category, List<String> aliases) {
        public Entry {
            aliases = aliases == null ? List.of() : List.copyOf(aliases);
        }
    }

    private final List<Entry> entries;
    private final Map<String, String> exact;
    private final Map<String, String> folded;

    EquivalenceTable(List<Entry> entries) {
        this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
        Map<String, String> exactMap = new HashMap<>();
        Map<String, String> foldedMap = new HashMap<>();
        for (Entry e : entries) {
            exactMap.putIfAbsent(e.canonical(), e.canonical());
            foldedMap.putIfAbsent(fold(e.canonical()), e.canonical());
            for (String alias : e.aliases()) {
                exactMap.putIfAbsent(alias, e.canonical());
                foldedMap.putIfAbsent(fold(alias), e.canonical());
            }
        }
        this.exact = Collections.unmodifiableMap(exactMap);
        this.folded = Collections.unmodifiableMap(foldedMap);
    }

    private static String fold(String s) {
        return s.toLowerCase(Locale.ROOT);
    }

    /**
     * Canonical label for a surface form, matched case-insensitively with an
     * exact-case fallback.
     */
    public Optional<String> lookup(String surface) {
        if (surface == null) {
            return Optional.empty();
        }
        String hit = folded.get(fold(surface.trim()));
        if (hit == null) {
            hit = exact.get(surface.trim());
        }
        return Optional.ofNullable(hit);
    }

    public List<Entry> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    /**
     * The bundled table, loaded once from the classpath.
     */
    public static EquivalenceTable defaults() {
        EquivalenceTable table = defaultTable;
        if (table == null) {
            synchronized (EquivalenceTable.class) {
                table = defaultTable;
                if (table == null) {
                    table = loadBundled();
                    defaultTable = table;
                }
            }
        }
        return table;
    }

    private static EquivalenceTable loadBundled() {
        try (InputStream in = EquivalenceTable.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IOException("Resource not found: " + DEFAULT_RESOURCE);
            }
            EquivalenceTable table = parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
            logger.info("Loaded {} equivalences from classpath", table.size());
            return table;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load bundled equivalences: " + DEFAULT_RESOURCE, e);
        }
    }

    public static EquivalenceTable load(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("Equivalence file not found: " + path);
        }
        EquivalenceTable table = parse(Files.readString(path));
        logger.info("Loaded {} equivalences from {}", table.size(), path);
        return table;
    }

    /**
     * @throws IllegalArgumentException if the document or an entry is malformed
     */
    public static EquivalenceTable parse(String content) {
        JSONObject root = JSON.parseObject(content);
        if (root == null) {
            throw new IllegalArgumentException("Empty equivalence table");
        }
        JSONArray array = root.getJSONArray("equivalences");
        if (array == null) {
            throw new IllegalArgumentException("Missing 'equivalences' array");
        }
        List<Entry> entries = new ArrayList<>();
        for (int i = 0; i < array.size(); i++) {
            JSONObject obj = array.getJSONObject(i);
            String canonical = obj == null ? null : obj.getString("canonical");
            if (canonical == null || canonical.isBlank()) {
                throw new IllegalArgumentException("Missing 'canonical' field in equivalence at index " + i);
            }
            List<String> aliases = new ArrayList<>();
            JSONArray aliasArray = obj.getJSONArray("aliases");
            for (int j = 0; aliasArray != null && j < aliasArray.size(); j++) {
                aliases.add(aliasArray.getString(j));
            }
            entries.add(new Entry(canonical, obj.getString("category"), aliases));
        }
        return new EquivalenceTable(entries);
    }
}
