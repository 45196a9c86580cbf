package pl.marcinmilkowski.interlingua.grammar;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * English surface helpers shared by the renderers: articles, plurals,
 * predicate humanization and list joining.
 */
public final class Morphology {

    private static final List<String> SILENT_H = List.of("honest", "hour", "heir", "honor");
    private static final List<String> YOU_SOUND = List.of("uni", "use", "user", "util");

    private static final Map<String, String> PREDICATES = Map.ofEntries(
        Map.entry("is-a", "is a"),
        Map.entry("has-a", "has"),
        Map.entry("part-of", "is part of"),
        Map.entry("contains", "contains"),
        Map.entry("located-in", "is located in"),
        Map.entry("causes", "causes"),
        Map.entry("similar-to", "is similar to"),
        Map.entry("composed-of", "is composed of"),
        Map.entry("depends-on", "depends on"),
        Map.entry("implements", "implements"),
        Map.entry("defines-fn", "defines function"),
        Map.entry("defines-struct", "defines struct"),
        Map.entry("defines-enum", "defines enum"),
        Map.entry("defines-type", "defines type"),
        Map.entry("defines-mod", "defines module"),
        Map.entry("contains-mod", "contains module"),
        Map.entry("defined-in", "is defined in"),
        Map.entry("has-method", "has method"),
        Map.entry("has-variant", "has variant"));

    private static final Map<String, String> IRREGULAR_PLURALS = Map.of(
        "child", "children",
        "person", "people",
        "mouse", "mice",
        "datum", "data",
        "index", "indices",
        "vertex", "vertices",
        "matrix", "matrices");

    private Morphology() {
    }

    /**
     * Indefinite article for a word: {@code "an"} before vowel sounds, {@code "a"} otherwise.
     */
    public static String article(String word) {
        String lower = word.toLowerCase(Locale.ROOT);
        for (String prefix : SILENT_H) {
            if (lower.startsWith(prefix)) {
                return "an";
            }
        }
        for (String prefix : YOU_SOUND) {
            if (lower.startsWith(prefix)) {
                return "a";
            }
        }
        if (!lower.isEmpty() && "aeiou".indexOf(lower.charAt(0)) >= 0) {
            return "an";
        }
        return "a";
    }

    /**
     * Turns a predicate label such as {@code is-a} or {@code code:has_method}
     * into a verb phrase. Unknown labels get their separators replaced by spaces.
     */
    public static String humanizePredicate(String predicate) {
        if (predicate.startsWith("code:")) {
            return humanizePredicate(predicate.substring("code:".length()));
        }
        String known = PREDICATES.get(predicate.replace('_', '-'));
        if (known != null) {
            return known;
        }
        return predicate.replace('-', ' ').replace('_', ' ');
    }

    public static String capitalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        int first = text.codePointAt(0);
        return new StringBuilder()
            .appendCodePoint(Character.toUpperCase(first))
            .append(text.substring(Character.charCount(first)))
            .toString();
    }

    /**
     * Simple English plural. Words already ending in a single {@code s} are
     * returned unchanged.
     */
    public static String pluralize(String word) {
        if (word.isEmpty()) {
            return word;
        }
        String lower = word.toLowerCase(Locale.ROOT);
        String irregular = IRREGULAR_PLURALS.get(lower);
        if (irregular != null) {
            return Character.isUpperCase(word.charAt(0)) ? capitalize(irregular) : irregular;
        }
        if (lower.endsWith("s") && !lower.endsWith("ss")) {
            return word;
        }
        if (lower.endsWith("y") && lower.length() > 1 && "aeiou".indexOf(lower.charAt(lower.length() - 2)) < 0) {
            return word.substring(0, word.length() - 1) + "ies";
        }
        if (lower.endsWith("s") || lower.endsWith("x") || lower.endsWith("z")
            || lower.endsWith("ch") || lower.endsWith("sh")) {
            return word + "es";
        }
        return word + "s";
    }

    public static String codeQuote(String text) {
        return "`" + text + "`";
    }

    /**
     * Joins items as {@code A}, {@code A and B} or {@code A, B, and C}.
     */
    public static String joinList(List<String> items, String conjunction) {
        switch (items.size()) {
            case 0:
                return "";
            case 1:
                return items.get(0);
            case 2:
                return items.get(0) + " " + conjunction + " " + items.get(1);
            default:
                String head = String.join(", ", items.subList(0, items.size() - 1));
                return head + ", " + conjunction + " " + items.get(items.size() - 1);
        }
    }
}
