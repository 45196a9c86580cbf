package pl.marcinmilkowski.interlingua.resolve;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.interlingua.preprocess.ExtractedClaim;
import pl.marcinmilkowski.interlingua.preprocess.ExtractedEntity;
import pl.marcinmilkowski.interlingua.preprocess.PreProcessorOutput;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps surface forms in any supported language to canonical labels.
 *
 * Lookup order: runtime aliases, learned equivalences, the static
 * {@link EquivalenceTable}, then pass-through. All tiers match case-insensitively.
 */
public class EntityResolver {
    private static final Logger logger = LoggerFactory.getLogger(EntityResolver.class);

    static final double CO_OCCURRENCE_CONFIDENCE = 0.7;

    private final EquivalenceTable table;
    private final Map<String, String> aliases = new ConcurrentHashMap<>();
    private final Map<String, LearnedEquivalence> learned = new ConcurrentHashMap<>();

    public EntityResolver() {
        this(EquivalenceTable.defaults());
    }

    public EntityResolver(EquivalenceTable table) {
        this.table = table;
    }

    private static String fold(String s) {
        return s.toLowerCase(Locale.ROOT);
    }

    /**
     * Registers a runtime alias. Ignored when the surface already equals the canonical form.
     */
    public void addAlias(String surface, String canonical) {
        if (!fold(surface).equals(fold(canonical))) {
            aliases.put(fold(surface), canonical);
        }
    }

    /**
     * Records a learned equivalence unless one at least as confident exists for the surface.
     */
    public void addLearned(LearnedEquivalence equivalence) {
        learned.merge(fold(equivalence.surface()), equivalence,
            (old, neu) -> neu.confidence() > old.confidence() ? neu : old);
    }

    public String resolve(String surface) {
        return resolveEntity(surface).canonical();
    }

    public ResolutionResult resolveEntity(String surface) {
        String key = fold(surface);
        String alias = aliases.get(key);
        if (alias != null) {
            return new ResolutionResult(alias, true, ResolutionResult.Tier.RUNTIME_ALIAS);
        }
        LearnedEquivalence eq = learned.get(key);
        if (eq != null) {
            return new ResolutionResult(eq.canonical(), true, ResolutionResult.Tier.LEARNED);
        }
        return table.lookup(surface)
            .map(c -> new ResolutionResult(c, true, ResolutionResult.Tier.STATIC))
            .orElseGet(() -> new ResolutionResult(surface, false, ResolutionResult.Tier.PASS_THROUGH));
    }

    /**
     * Canonicalizes entities and merges those that share a canonical name
     * (case-insensitively), keeping first-seen order, the union of aliases
     * and the highest confidence.
     */
    public List<ExtractedEntity> resolveEntities(List<ExtractedEntity> entities) {
        Map<String, ExtractedEntity> merged = new LinkedHashMap<>();
        for (ExtractedEntity entity : entities) {
            ResolutionResult result = resolveEntity(entity.name());
            ExtractedEntity resolved = result.resolved() ? entity.canonicalized(result.canonical()) : entity;
            merged.merge(fold(resolved.canonicalName()), resolved, ExtractedEntity::mergedWith);
        }
        return new ArrayList<>(merged.values());
    }

    /**
     * Learns equivalences from translations of the same text.
     *
     * Outputs whose chunk ids share a prefix before the last {@code _} form a group.
     * Within a group, claims in different languages with the same predicate are
     * aligned in order; when one side's subject or object resolves and the
     * other's does not, the unresolved surface is learned as an equivalent.
     *
     * @return number of equivalences recorded
     */
    public int learnFromParallelChunks(List<PreProcessorOutput> outputs) {
        if (outputs.size() < 2) {
            return 0;
        }
        Map<String, List<PreProcessorOutput>> groups = new LinkedHashMap<>();
        for (PreProcessorOutput output : outputs) {
            String id = output.chunkId();
            int cut = id == null ? -1 : id.lastIndexOf('_');
            if (cut <= 0) {
                continue;
            }
            groups.computeIfAbsent(id.substring(0, cut), k -> new ArrayList<>()).add(output);
        }

        int discovered = 0;
        for (Map.Entry<String, List<PreProcessorOutput>> group : groups.entrySet()) {
            List<PreProcessorOutput> members = group.getValue();
            if (members.size() < 2) {
                continue;
            }
            PreProcessorOutput reference = members.get(0);
            for (PreProcessorOutput other : members.subList(1, members.size())) {
                if (other.sourceLanguage().equals(reference.sourceLanguage())) {
                    continue;
                }
                discovered += alignClaims(reference, other);
            }
        }
        if (discovered > 0) {
            logger.info("Learned {} equivalences from parallel chunks", discovered);
        }
        return discovered;
    }

    private int alignClaims(PreProcessorOutput reference, PreProcessorOutput other) {
        Map<String, List<ExtractedClaim>> otherByPredicate = new LinkedHashMap<>();
        for (ExtractedClaim claim : other.claims()) {
            otherByPredicate.computeIfAbsent(claim.predicate(), k -> new ArrayList<>()).add(claim);
        }
        Map<String, Integer> used = new LinkedHashMap<>();
        List<ExtractedClaim[]> pairs = new ArrayList<>();
        for (ExtractedClaim ref : reference.claims()) {
            List<ExtractedClaim> candidates = otherByPredicate.get(ref.predicate());
            int next = used.getOrDefault(ref.predicate(), 0);
            if (candidates != null && next < candidates.size()) {
                pairs.add(new ExtractedClaim[] {ref, candidates.get(next)});
                used.put(ref.predicate(), next + 1);
            }
        }
        if (pairs.isEmpty()) {
            return 0;
        }
        int largest = Math.max(reference.claims().size(), other.claims().size());
        double confidence = CO_OCCURRENCE_CONFIDENCE * Math.min(1.0, (double) pairs.size() / largest);

        int discovered = 0;
        for (ExtractedClaim[] pair : pairs) {
            discovered += align(pair[0].subject(), reference.sourceLanguage(),
                pair[1].subject(), other.sourceLanguage(), confidence);
            discovered += align(pair[0].object(), reference.sourceLanguage(),
                pair[1].object(), other.sourceLanguage(), confidence);
        }
        return discovered;
    }

    private int align(String a, String langA, String b, String langB, double confidence) {
        if (fold(a).equals(fold(b))) {
            return 0;
        }
        ResolutionResult ra = resolveEntity(a);
        ResolutionResult rb = resolveEntity(b);
        if (ra.resolved() && !rb.resolved()) {
            addLearned(new LearnedEquivalence(ra.canonical(), b, langB, confidence, EquivalenceSource.CO_OCCURRENCE));
            logger.debug("Learned '{}' ({}) = '{}'", b, langB, ra.canonical());
            return 1;
        }
        if (rb.resolved() && !ra.resolved()) {
            addLearned(new LearnedEquivalence(rb.canonical(), a, langA, confidence, EquivalenceSource.CO_OCCURRENCE));
            logger.debug("Learned '{}' ({}) = '{}'", a, langA, rb.canonical());
            return 1;
        }
        return 0;
    }

    /**
     * Learned equivalences sorted by surface form.
     */
    public List<LearnedEquivalence> learned() {
        List<LearnedEquivalence> out = new ArrayList<>(learned.values());
        out.sort(Comparator.comparing(LearnedEquivalence::surface));
        return out;
    }

    public int aliasCount() {
        return aliases.size();
    }

    public JSONArray exportLearned() {
        JSONArray array = new JSONArray();
        for (LearnedEquivalence eq : learned()) {
            array.add(eq.toJson());
        }
        return array;
    }

    /**
     * @return number of entries read
     */
    public int importLearned(JSONArray array) {
        for (int i = 0; i < array.size(); i++) {
            JSONObject obj = array.getJSONObject(i);
            addLearned(LearnedEquivalence.fromJson(obj));
        }
        logger.info("Imported {} learned equivalences", array.size());
        return array.size();
    }
}
