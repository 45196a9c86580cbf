package pl.marcinmilkowski.interlingua.preprocess;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import pl.marcinmilkowski.interlingua.tree.SemanticTree;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Everything extracted from one chunk: language, canonical entities, claims
 * and the trees they were read from.
 */
public record PreProcessorOutput(
    String chunkId,
    String sourceLanguage,
    double detectedLanguageConfidence,
    List<ExtractedEntity> entities,
    List<ExtractedClaim> claims,
    List<SemanticTree> trees
) {

    public PreProcessorOutput {
        Objects.requireNonNull(sourceLanguage, "sourceLanguage");
        entities = entities == null ? List.of() : List.copyOf(entities);
        claims = claims == null ? List.of() : List.copyOf(claims);
        trees = trees == null ? List.of() : List.copyOf(trees);
    }

    public JSONObject toJson() {
        JSONObject json = new JSONObject();
        if (chunkId != null) {
            json.put("chunk_id", chunkId);
        }
        json.put("source_language", sourceLanguage);
        json.put("detected_language_confidence", detectedLanguageConfidence);
        JSONArray entityArray = new JSONArray();
        for (ExtractedEntity e : entities) {
            entityArray.add(e.toJson());
        }
        json.put("entities", entityArray);
        JSONArray claimArray = new JSONArray();
        for (ExtractedClaim c : claims) {
            claimArray.add(c.toJson());
        }
        json.put("claims", claimArray);
        JSONArray treeArray = new JSONArray();
        for (SemanticTree t : trees) {
            treeArray.add(t.toJson());
        }
        json.put("trees", treeArray);
        return json;
    }

    public static PreProcessorOutput fromJson(JSONObject json) {
        List<ExtractedEntity> entities = new ArrayList<>();
        JSONArray entityArray = json.getJSONArray("entities");
        for (int i = 0; entityArray != null && i < entityArray.size(); i++) {
            entities.add(ExtractedEntity.fromJson(entityArray.getJSONObject(i)));
        }
        List<ExtractedClaim> claims = new ArrayList<>();
        JSONArray claimArray = json.getJSONArray("claims");
        for (int i = 0; claimArray != null && i < claimArray.size(); i++) {
            claims.add(ExtractedClaim.fromJson(claimArray.getJSONObject(i)));
        }
        List<SemanticTree> trees = new ArrayList<>();
        JSONArray treeArray = json.getJSONArray("trees");
        for (int i = 0; treeArray != null && i < treeArray.size(); i++) {
            trees.add(SemanticTree.fromJson(treeArray.getJSONObject(i)));
        }
        Double confidence = json.getDouble("detected_language_confidence");
        String language = json.getString("source_language");
        if (language == null) {
            throw new IllegalArgumentException("Missing 'source_language' field in output");
        }
        return new PreProcessorOutput(json.getString("chunk_id"), language,
            confidence == null ? 0.0 : confidence, entities, claims, trees);
    }

    public static PreProcessorOutput fromJson(String text) {
        return fromJson(JSON.parseObject(text));
    }
}
