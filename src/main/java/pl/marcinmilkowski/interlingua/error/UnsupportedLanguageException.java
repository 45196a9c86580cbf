package pl.marcinmilkowski.interlingua.error;

/**
 * A language code outside the supported set was requested.
 */
public class UnsupportedLanguageException extends GrammarException {

    private final String code;

    public UnsupportedLanguageException(String code) {
        super("unsupported language: \"" + code + "\"");
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    @Override
    public Kind kind() {
        return Kind.UNSUPPORTED_LANGUAGE;
    }
}
