package pl.marcinmilkowski.interlingua.preprocess;

import com.alibaba.fastjson2.JSONObject;

/**
 * A subject-predicate-object claim with the text it came from.
 */
public record ExtractedClaim(
    String claimText,
    ClaimType claimType,
    double confidence,
    String subject,
    String predicate,
    String object,
    String sourceLanguage
) {

    public ExtractedClaim withConfidence(double newConfidence) {
        return new ExtractedClaim(claimText, claimType, newConfidence, subject, predicate, object, sourceLanguage);
    }

    public JSONObject toJson() {
        JSONObject json = new JSONObject();
        json.put("claim_text", claimText);
        json.put("claim_type", claimType.name());
        json.put("confidence", confidence);
        json.put("subject", subject);
        json.put("predicate", predicate);
        json.put("object", object);
        json.put("source_language", sourceLanguage);
        return json;
    }

    public static ExtractedClaim fromJson(JSONObject json) {
        Double confidence = json.getDouble("confidence");
        return new ExtractedClaim(
            json.getString("claim_text"),
            ClaimType.valueOf(json.getString("claim_type")),
            confidence == null ? 0.0 : confidence,
            json.getString("subject"),
            json.getString("predicate"),
            json.getString("object"),
            json.getString("source_language"));
    }
}
