package pl.marcinmilkowski.interlingua.lexicon;

import java.util.List;
import java.util.Objects;

/**
 * A word sequence that signals a canonical predicate, e.g. "is part of" → {@code part-of}.
 *
 * @param words lowercase words of the pattern
 * @param confidence base confidence of a match
 */
public record RelationalPattern(List<String> words, String predicate, double confidence) {

    public RelationalPattern {
        Objects.requireNonNull(predicate, "predicate");
        words = List.copyOf(words);
        if (words.isEmpty()) {
            throw new IllegalArgumentException("Pattern for '" + predicate + "' has no words");
        }
    }

    public int length() {
        return words.size();
    }

    public String surface() {
        return String.join(" ", words);
    }
}
