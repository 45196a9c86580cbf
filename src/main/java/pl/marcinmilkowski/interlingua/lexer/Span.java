package pl.marcinmilkowski.interlingua.lexer;

/**
 * Half-open UTF-8 byte range {@code [start, end)} in the NFC-normalized input.
 */
public record Span(int start, int end) {

    public Span {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
    }

    public int length() {
        return end - start;
    }
}
