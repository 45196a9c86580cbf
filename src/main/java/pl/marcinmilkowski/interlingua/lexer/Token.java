package pl.marcinmilkowski.interlingua.lexer;

/**
 * One word (or merged compound) of the input.
 *
 * @param normalized lowercase form used for matching
 * @param isVoid whether the word is an article or other semantically empty word
 */
public record Token(String surface, String normalized, Span span, boolean isVoid, Resolution resolution) {

    public Token withResolution(Resolution newResolution) {
        return new Token(surface, normalized, span, isVoid, newResolution);
    }
}
