package pl.marcinmilkowski.interlingua.tree;

import java.util.Locale;

/**
 * Kind of a declared code item.
 */
public enum SignatureKind {
    FN("fn"),
    STRUCT("struct"),
    ENUM("enum"),
    TRAIT("trait"),
    IMPL("impl");

    private final String keyword;

    SignatureKind(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    public static SignatureKind fromKeyword(String keyword) {
        String k = keyword.toLowerCase(Locale.ROOT);
        for (SignatureKind kind : values()) {
            if (kind.keyword.equals(k)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown signature kind: " + keyword);
    }
}
