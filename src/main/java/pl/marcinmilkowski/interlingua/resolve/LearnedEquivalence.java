package pl.marcinmilkowski.interlingua.resolve;

import com.alibaba.fastjson2.JSONObject;

import java.util.Objects;

/**
 * A surface form mapped to a canonical label at runtime.
 */
public record LearnedEquivalence(
    String canonical,
    String surface,
    String sourceLanguage,
    double confidence,
    EquivalenceSource source
) {

    public LearnedEquivalence {
        Objects.requireNonNull(canonical, "canonical");
        Objects.requireNonNull(surface, "surface");
        Objects.requireNonNull(source, "source");
        sourceLanguage = sourceLanguage == null ? "" : sourceLanguage;
    }

    public JSONObject toJson() {
        JSONObject json = new JSONObject();
        json.put("canonical", canonical);
        json.put("surface", surface);
        json.put("source_language", sourceLanguage);
        json.put("confidence", confidence);
        json.put("source", source.id());
        return json;
    }

    public static LearnedEquivalence fromJson(JSONObject json) {
        String canonical = json.getString("canonical");
        String surface = json.getString("surface");
        if (canonical == null || surface == null) {
            throw new IllegalArgumentException("Learned equivalence needs 'canonical' and 'surface'");
        }
        Double confidence = json.getDouble("confidence");
        String source = json.getString("source");
        return new LearnedEquivalence(canonical, surface, json.getString("source_language"),
            confidence == null ? 0.0 : confidence,
            source == null ? EquivalenceSource.MANUAL : EquivalenceSource.fromId(source));
    }
}
