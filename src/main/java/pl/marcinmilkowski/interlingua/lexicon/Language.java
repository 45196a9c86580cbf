package pl.marcinmilkowski.interlingua.lexicon;

import pl.marcinmilkowski.interlingua.error.UnsupportedLanguageException;

import java.util.Locale;
import java.util.Optional;

/**
 * Languages with a bundled lexicon.
 */
public enum Language {
    ENGLISH("en", "English"),
    RUSSIAN("ru", "Russian"),
    ARABIC("ar", "Arabic"),
    FRENCH("fr", "French"),
    SPANISH("es", "Spanish");

    private final String code;
    private final String displayName;

    Language(String code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    /**
     * BCP 47 code.
     */
    public String code() {
        return code;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Look up a language by BCP 47 code ("fr", "fr-CA") or English name.
     */
    public static Optional<Language> fromCode(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        String c = code.trim().toLowerCase(Locale.ROOT);
        int dash = c.indexOf('-');
        String primary = dash > 0 ? c.substring(0, dash) : c;
        for (Language lang : values()) {
            if (lang.code.equals(primary) || lang.displayName.toLowerCase(Locale.ROOT).equals(c)) {
                return Optional.of(lang);
            }
        }
        return Optional.empty();
    }

    /**
     * @throws UnsupportedLanguageException if no bundled lexicon covers the code
     */
    public static Language require(String code) throws UnsupportedLanguageException {
        return fromCode(code).orElseThrow(() -> new UnsupportedLanguageException(code));
    }
}
