package pl.marcinmilkowski.interlingua.lexicon;

import java.util.List;

/**
 * Decomposition of a question into its question word, auxiliary and content words.
 *
 * @param questionWord the leading question word as written, or {@code null}
 * @param questionKind kind of the question word, or {@code null} when there is none
 * @param auxiliary auxiliary verb right after the question word, or {@code null}
 * @param contentWords remaining words after stripping
 * @param capability whether the question word or auxiliary is a capability modal
 */
public record QuestionFrame(
    String questionWord,
    QuestionWord questionKind,
    String auxiliary,
    List<String> contentWords,
    boolean capability
) {

    public QuestionFrame {
        contentWords = List.copyOf(contentWords);
    }

    /**
     * Content words joined with spaces: the subject being asked about.
     */
    public String subject() {
        return String.join(" ", contentWords);
    }
}
