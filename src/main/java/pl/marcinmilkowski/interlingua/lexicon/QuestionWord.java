package pl.marcinmilkowski.interlingua.lexicon;

import java.util.Locale;

/**
 * Kind of question a question word introduces.
 */
public enum QuestionWord {
    WHO,
    WHAT,
    WHERE,
    WHEN,
    HOW,
    WHY,
    WHICH,
    YES_NO;

    public static QuestionWord fromId(String id) {
        return valueOf(id.trim().toUpperCase(Locale.ROOT));
    }
}
