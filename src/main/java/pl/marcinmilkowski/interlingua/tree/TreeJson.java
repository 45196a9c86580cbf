package pl.marcinmilkowski.interlingua.tree;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import pl.marcinmilkowski.interlingua.symbol.SymbolId;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON form of semantic trees. Every node is an object tagged by {@code "type"}.
 */
final class TreeJson {

    private TreeJson() {
    }

    static JSONObject toJson(SemanticTree tree) {
        JSONObject obj = new JSONObject();
        if (tree instanceof Entity e) {
            obj.put("type", "entity");
            obj.put("label", e.label());
            if (e.symbol() != null) obj.put("symbol_id", e.symbol().value());
        } else if (tree instanceof Relation r) {
            obj.put("type", "relation");
            obj.put("label", r.label());
            if (r.symbol() != null) obj.put("symbol_id", r.symbol().value());
        } else if (tree instanceof Freeform f) {
            obj.put("type", "freeform");
            obj.put("text", f.text());
        } else if (tree instanceof Triple t) {
            obj.put("type", "triple");
            obj.put("subject", toJson(t.subject()));
            obj.put("predicate", toJson(t.predicate()));
            obj.put("object", toJson(t.object()));
        } else if (tree instanceof Similarity s) {
            obj.put("type", "similarity");
            obj.put("entity", toJson(s.entity()));
            obj.put("similar_to", toJson(s.similarTo()));
            obj.put("score", s.score());
        } else if (tree instanceof Gap g) {
            obj.put("type", "gap");
            obj.put("entity", toJson(g.entity()));
            obj.put("description", g.description());
        } else if (tree instanceof Inference i) {
            obj.put("type", "inference");
            obj.put("expression", i.expression());
            obj.put("simplified", i.simplified());
        } else if (tree instanceof CodeFact c) {
            obj.put("type", "code_fact");
            obj.put("kind", c.kind());
            obj.put("name", c.name());
            obj.put("detail", c.detail());
        } else if (tree instanceof CodeModule m) {
            obj.put("type", "code_module");
            obj.put("name", m.name());
            if (m.role() != null) obj.put("role", m.role());
            if (m.importance() != null) obj.put("importance", m.importance());
            if (m.docSummary() != null) obj.put("doc_summary", m.docSummary());
            obj.put("children", toJsonArray(m.children()));
        } else if (tree instanceof CodeSignature sig) {
            obj.put("type", "code_signature");
            obj.put("kind", sig.kind().keyword());
            obj.put("name", sig.name());
            if (sig.docSummary() != null) obj.put("doc_summary", sig.docSummary());
            obj.put("params_or_fields", new JSONArray(sig.paramsOrFields()));
            if (sig.returnType() != null) obj.put("return_type", sig.returnType());
            obj.put("traits", new JSONArray(sig.traits()));
            if (sig.importance() != null) obj.put("importance", sig.importance());
        } else if (tree instanceof DataFlow d) {
            obj.put("type", "data_flow");
            JSONArray steps = new JSONArray();
            for (DataFlow.Step step : d.steps()) {
                JSONObject s = new JSONObject();
                s.put("name", step.name());
                if (step.viaType() != null) s.put("via_type", step.viaType());
                steps.add(s);
            }
            obj.put("steps", steps);
        } else if (tree instanceof WithConfidence w) {
            obj.put("type", "with_confidence");
            obj.put("inner", toJson(w.inner()));
            obj.put("confidence", w.confidence());
        } else if (tree instanceof WithProvenance w) {
            obj.put("type", "with_provenance");
            obj.put("inner", toJson(w.inner()));
            obj.put("provenance", w.tag().source().id());
            if (w.tag().source() == ProvenanceTag.Source.VSA_INFERRED) {
                obj.put("similarity", w.tag().similarity());
            }
        } else if (tree instanceof DiscourseFrame f) {
            obj.put("type", "discourse_frame");
            obj.put("inner", toJson(f.inner()));
            obj.put("point_of_view", f.pointOfView().name());
            obj.put("focus", f.focus().name());
        } else if (tree instanceof Conjunction c) {
            obj.put("type", "conjunction");
            obj.put("is_and", c.isAnd());
            obj.put("items", toJsonArray(c.items()));
        } else if (tree instanceof Section s) {
            obj.put("type", "section");
            obj.put("heading", s.heading());
            obj.put("body", toJsonArray(s.body()));
        } else if (tree instanceof Document doc) {
            obj.put("type", "document");
            obj.put("overview", toJson(doc.overview()));
            obj.put("sections", toJsonArray(doc.sections()));
            obj.put("gaps", toJsonArray(doc.gaps()));
        } else {
            throw new IllegalArgumentException("Unsupported tree node: " + tree.getClass().getName());
        }
        return obj;
    }

    private static JSONArray toJsonArray(List<SemanticTree> trees) {
        JSONArray arr = new JSONArray();
        for (SemanticTree t : trees) {
            arr.add(toJson(t));
        }
        return arr;
    }

    static SemanticTree fromJson(JSONObject obj) {
        if (obj == null) {
            throw new IllegalArgumentException("Missing tree node");
        }
        String type = obj.getString("type");
        if (type == null) {
            throw new IllegalArgumentException("Missing 'type' field in tree node");
        }
        return switch (type) {
            case "entity" -> new Entity(required(obj, "label"), symbol(obj));
            case "relation" -> new Relation(required(obj, "label"), symbol(obj));
            case "freeform" -> new Freeform(required(obj, "text"));
            case "triple" -> new Triple(
                fromJson(obj.getJSONObject("subject")),
                fromJson(obj.getJSONObject("predicate")),
                fromJson(obj.getJSONObject("object")));
            case "similarity" -> new Similarity(
                fromJson(obj.getJSONObject("entity")),
                fromJson(obj.getJSONObject("similar_to")),
                obj.getDoubleValue("score"));
            case "gap" -> new Gap(fromJson(obj.getJSONObject("entity")), required(obj, "description"));
            case "inference" -> new Inference(required(obj, "expression"), required(obj, "simplified"));
            case "code_fact" -> new CodeFact(required(obj, "kind"), required(obj, "name"), required(obj, "detail"));
            case "code_module" -> new CodeModule(
                required(obj, "name"),
                obj.getString("role"),
                obj.getDouble("importance"),
                obj.getString("doc_summary"),
                fromJsonArray(obj.getJSONArray("children")));
            case "code_signature" -> new CodeSignature(
                SignatureKind.fromKeyword(required(obj, "kind")),
                required(obj, "name"),
                obj.getString("doc_summary"),
                strings(obj.getJSONArray("params_or_fields")),
                obj.getString("return_type"),
                strings(obj.getJSONArray("traits")),
                obj.getDouble("importance"));
            case "data_flow" -> {
                List<DataFlow.Step> steps = new ArrayList<>();
                JSONArray arr = obj.getJSONArray("steps");
                if (arr != null) {
                    for (int i = 0; i < arr.size(); i++) {
                        JSONObject s = arr.getJSONObject(i);
                        steps.add(new DataFlow.Step(required(s, "name"), s.getString("via_type")));
                    }
                }
                yield new DataFlow(steps);
            }
            case "with_confidence" -> new WithConfidence(
                fromJson(obj.getJSONObject("inner")), obj.getDoubleValue("confidence"));
            case "with_provenance" -> new WithProvenance(
                fromJson(obj.getJSONObject("inner")),
                new ProvenanceTag(ProvenanceTag.Source.fromId(required(obj, "provenance")),
                    obj.getDoubleValue("similarity")));
            case "discourse_frame" -> new DiscourseFrame(
                fromJson(obj.getJSONObject("inner")),
                PointOfView.valueOf(required(obj, "point_of_view")),
                QueryFocus.valueOf(required(obj, "focus")));
            case "conjunction" -> new Conjunction(fromJsonArray(obj.getJSONArray("items")),
                !Boolean.FALSE.equals(obj.getBoolean("is_and")));
            case "section" -> new Section(required(obj, "heading"), fromJsonArray(obj.getJSONArray("body")));
            case "document" -> new Document(
                fromJson(obj.getJSONObject("overview")),
                fromJsonArray(obj.getJSONArray("sections")),
                fromJsonArray(obj.getJSONArray("gaps")));
            default -> throw new IllegalArgumentException("Unknown tree node type: " + type);
        };
    }

    private static String required(JSONObject obj, String field) {
        String value = obj.getString(field);
        if (value == null) {
            throw new IllegalArgumentException("Missing '" + field + "' field in " + obj.getString("type") + " node");
        }
        return value;
    }

    private static SymbolId symbol(JSONObject obj) {
        Long id = obj.getLong("symbol_id");
        return id == null ? null : SymbolId.of(id);
    }

    private static List<SemanticTree> fromJsonArray(JSONArray arr) {
        List<SemanticTree> out = new ArrayList<>();
        if (arr != null) {
            for (int i = 0; i < arr.size(); i++) {
                out.add(fromJson(arr.getJSONObject(i)));
            }
        }
        return out;
    }

    private static List<String> strings(JSONArray arr) {
        List<String> out = new ArrayList<>();
        if (arr != null) {
            for (int i = 0; i < arr.size(); i++) {
                out.add(arr.getString(i));
            }
        }
        return out;
    }
}
