package pl.marcinmilkowski.interlingua.preprocess;

import pl.marcinmilkowski.interlingua.lexicon.Language;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Rule-based language identification for the five supported languages.
 *
 * <p>Cyrillic and Arabic text is recognised by script. Latin text is scored by
 * common function words, diacritics and Spanish inverted punctuation,
 * normalized by word count.</p>
 */
public final class LanguageDetector {

    private static final double SCRIPT_THRESHOLD = 0.5;

    private static final Set<String> ENGLISH_MARKERS = Set.of(
        "the", "is", "are", "was", "were", "with", "from", "this", "that", "and", "for", "not",
        "but", "have", "has", "had", "will", "would", "can", "could", "should", "it", "they", "we",
        "you", "he", "she");

    private static final Set<String> FRENCH_MARKERS = Set.of(
        "le", "la", "les", "des", "est", "dans", "avec", "une", "sur", "pour", "pas", "qui", "que",
        "sont", "ont", "fait", "plus", "mais", "aussi", "cette", "ces", "nous", "vous", "ils",
        "elles");

    private static final Set<String> SPANISH_MARKERS = Set.of(
        "el", "los", "las", "está", "esta", "tiene", "por", "para", "pero", "también",
        "tambien", "como", "más", "mas", "son", "hay", "ser", "estar", "muy", "todo", "puede",
        "sobre", "nos", "ese", "esa", "estos");

    private static final String FRENCH_DIACRITICS = "éèêëçàùîôœ";
    private static final String SPANISH_DIACRITICS = "ñáíóúü";
    private static final String SENTENCE_ENDS = ".!?؟۔。！？";

    private LanguageDetector() {
    }

    public static DetectionResult detect(String text) {
        String trimmed = text == null ? "" : text.trim();
        if (trimmed.isEmpty()) {
            return new DetectionResult(Language.ENGLISH, 0.0);
        }

        int cyrillic = 0;
        int arabic = 0;
        int latin = 0;
        int letters = 0;
        for (int i = 0; i < trimmed.length(); ) {
            int cp = trimmed.codePointAt(i);
            i += Character.charCount(cp);
            if (!Character.isLetter(cp)) {
                continue;
            }
            letters++;
            Character.UnicodeScript script = Character.UnicodeScript.of(cp);
            if (script == Character.UnicodeScript.CYRILLIC) {
                cyrillic++;
            } else if (script == Character.UnicodeScript.ARABIC) {
                arabic++;
            } else if (script == Character.UnicodeScript.LATIN) {
                latin++;
            }
        }
        if (letters == 0) {
            return new DetectionResult(Language.ENGLISH, 0.1);
        }

        double cyrillicRatio = (double) cyrillic / letters;
        double arabicRatio = (double) arabic / letters;
        if (cyrillicRatio > SCRIPT_THRESHOLD) {
            return new DetectionResult(Language.RUSSIAN, Math.min(0.70 + cyrillicRatio * 0.25, 0.95));
        }
        if (arabicRatio > SCRIPT_THRESHOLD) {
            return new DetectionResult(Language.ARABIC, Math.min(0.70 + arabicRatio * 0.25, 0.95));
        }
        if ((double) latin / letters > SCRIPT_THRESHOLD) {
            return detectLatin(trimmed);
        }
        return new DetectionResult(Language.ENGLISH, 0.3);
    }

    private static DetectionResult detectLatin(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        String[] words = lower.split("\\s+");
        double en = 0;
        double fr = 0;
        double es = 0;
        for (String raw : words) {
            String w = stripNonAlphanumeric(raw);
            if (ENGLISH_MARKERS.contains(w)) {
                en++;
            }
            if (FRENCH_MARKERS.contains(w)) {
                fr++;
            }
            if (SPANISH_MARKERS.contains(w)) {
                es++;
            }
        }
        if (containsAny(lower, FRENCH_DIACRITICS)) {
            fr += 2;
        }
        if (containsAny(lower, SPANISH_DIACRITICS)) {
            es += 2;
        }
        if (text.indexOf('¿') >= 0 || text.indexOf('¡') >= 0) {
            es += 3;
        }

        double count = Math.max(words.length, 1);
        Map<Language, Double> scores = Map.of(
            Language.ENGLISH, en / count,
            Language.FRENCH, fr / count,
            Language.SPANISH, es / count);
        double enNorm = scores.get(Language.ENGLISH);
        double frNorm = scores.get(Language.FRENCH);
        double esNorm = scores.get(Language.SPANISH);
        if (Math.max(enNorm, Math.max(frNorm, esNorm)) < 0.01) {
            return new DetectionResult(Language.ENGLISH, 0.4);
        }

        Language winner;
        double margin;
        if (enNorm >= frNorm && enNorm >= esNorm) {
            winner = Language.ENGLISH;
            margin = enNorm - Math.max(frNorm, esNorm);
        } else if (frNorm >= esNorm) {
            winner = Language.FRENCH;
            margin = frNorm - Math.max(enNorm, esNorm);
        } else {
            winner = Language.SPANISH;
            margin = esNorm - Math.max(enNorm, frNorm);
        }
        return new DetectionResult(winner, Math.min(0.60 + Math.min(margin, 0.20), 0.85));
    }

    private static String stripNonAlphanumeric(String word) {
        int start = 0;
        int end = word.length();
        while (start < end && !Character.isLetterOrDigit(word.charAt(start))) {
            start++;
        }
        while (end > start && !Character.isLetterOrDigit(word.charAt(end - 1))) {
            end--;
        }
        return word.substring(start, end);
    }

    private static boolean containsAny(String text, String chars) {
        for (int i = 0; i < chars.length(); i++) {
            if (text.indexOf(chars.charAt(i)) >= 0) {
                return true;
            }
        }
        return false;
    }

    /**
     * Splits text into sentences and detects each one separately.
     */
    public static List<SentenceDetection> detectPerSentence(String text) {
        List<SentenceDetection> out = new ArrayList<>();
        for (String sentence : splitSentences(text)) {
            out.add(new SentenceDetection(sentence, detect(sentence)));
        }
        return out;
    }

    /**
     * A sentence with the language detected for it.
     */
    public record SentenceDetection(String sentence, DetectionResult detection) {
    }

    static List<String> splitSentences(String text) {
        List<String> sentences = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            current.append(c);
            if (SENTENCE_ENDS.indexOf(c) >= 0) {
                addTrimmed(sentences, current);
            }
        }
        addTrimmed(sentences, current);
        return sentences;
    }

    private static void addTrimmed(List<String> sentences, StringBuilder current) {
        String trimmed = current.toString().trim();
        if (!trimmed.isEmpty()) {
            sentences.add(trimmed);
        }
        current.setLength(0);
    }
}
