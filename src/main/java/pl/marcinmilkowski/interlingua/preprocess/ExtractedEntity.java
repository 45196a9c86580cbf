package pl.marcinmilkowski.interlingua.preprocess;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * An entity mentioned by an extracted claim, after canonicalization.
 *
 * @param name surface form as it appeared
 * @param aliases other surface forms merged into this entity
 */
public record ExtractedEntity(
    String name,
    EntityType entityType,
    String canonicalName,
    double confidence,
    List<String> aliases,
    String sourceLanguage
) {

    public ExtractedEntity {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(entityType, "entityType");
        canonicalName = canonicalName == null ? name : canonicalName;
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
    }

    public static ExtractedEntity of(String name, EntityType type, double confidence, String language) {
        return new ExtractedEntity(name, type, name, confidence, List.of(), language);
    }

    /**
     * Applies a canonical name, recording the surface form as an alias when it differs.
     */
    public ExtractedEntity canonicalized(String canonical) {
        List<String> newAliases = new ArrayList<>(aliases);
        if (!canonical.toLowerCase(Locale.ROOT).equals(name.toLowerCase(Locale.ROOT)) && !newAliases.contains(name)) {
            newAliases.add(name);
        }
        return new ExtractedEntity(name, entityType, canonical, confidence, newAliases, sourceLanguage);
    }

    /**
     * Folds another mention of the same canonical entity into this one.
     */
    public ExtractedEntity mergedWith(ExtractedEntity other) {
        List<String> newAliases = new ArrayList<>(aliases);
        for (String alias : other.aliases) {
            if (!newAliases.contains(alias)) {
                newAliases.add(alias);
            }
        }
        return new ExtractedEntity(name, entityType, canonicalName,
            Math.max(confidence, other.confidence), newAliases, sourceLanguage);
    }

    public ExtractedEntity withConfidence(double newConfidence) {
        return new ExtractedEntity(name, entityType, canonicalName, newConfidence, aliases, sourceLanguage);
    }

    public JSONObject toJson() {
        JSONObject json = new JSONObject();
        json.put("name", name);
        json.put("entity_type", entityType.name());
        json.put("canonical_name", canonicalName);
        json.put("confidence", confidence);
        json.put("aliases", new JSONArray(aliases));
        json.put("source_language", sourceLanguage);
        return json;
    }

    public static ExtractedEntity fromJson(JSONObject json) {
        JSONArray aliasArray = json.getJSONArray("aliases");
        List<String> aliases = new ArrayList<>();
        if (aliasArray != null) {
            for (int i = 0; i < aliasArray.size(); i++) {
                aliases.add(aliasArray.getString(i));
            }
        }
        Double confidence = json.getDouble("confidence");
        return new ExtractedEntity(
            json.getString("name"),
            EntityType.valueOf(json.getString("entity_type")),
            json.getString("canonical_name"),
            confidence == null ? 0.0 : confidence,
            aliases,
            json.getString("source_language"));
    }
}
