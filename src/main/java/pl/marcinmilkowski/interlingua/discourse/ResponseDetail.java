package pl.marcinmilkowski.interlingua.discourse;

import java.util.Locale;
import java.util.Optional;

/**
 * How many facts a response about a subject should carry.
 */
public enum ResponseDetail {
    CONCISE,
    NORMAL,
    FULL;

    /**
     * Accepts the usual synonyms ({@code brief}, {@code detailed}, ...).
     */
    public static Optional<ResponseDetail> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        String value = label.trim().toLowerCase(Locale.ROOT);
        int colon = value.lastIndexOf(':');
        if (colon >= 0) {
            value = value.substring(colon + 1);
        }
        switch (value) {
            case "concise":
            case "brief":
            case "short":
                return Optional.of(CONCISE);
            case "normal":
            case "default":
            case "medium":
                return Optional.of(NORMAL);
            case "full":
            case "detailed":
            case "verbose":
                return Optional.of(FULL);
            default:
                return Optional.empty();
        }
    }
}
