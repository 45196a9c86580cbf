package pl.marcinmilkowski.interlingua.preprocess;

import com.alibaba.fastjson2.JSONObject;

import java.util.Objects;

/**
 * A unit of input text.
 *
 * @param id optional identifier; chunks named {@code <group>_<suffix>} are treated as
 *           translations of each other when learning equivalences
 * @param language optional language hint (ISO 639-1 code)
 */
public record TextChunk(String id, String text, String language) {

    public TextChunk {
        Objects.requireNonNull(text, "text");
    }

    public static TextChunk of(String text) {
        return new TextChunk(null, text, null);
    }

    public JSONObject toJson() {
        JSONObject json = new JSONObject();
        if (id != null) {
            json.put("id", id);
        }
        json.put("text", text);
        if (language != null) {
            json.put("language", language);
        }
        return json;
    }

    public static TextChunk fromJson(JSONObject json) {
        String text = json.getString("text");
        if (text == null) {
            throw new IllegalArgumentException("Missing 'text' field in chunk");
        }
        return new TextChunk(json.getString("id"), text, json.getString("language"));
    }
}
