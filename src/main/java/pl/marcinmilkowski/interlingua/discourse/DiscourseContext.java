package pl.marcinmilkowski.interlingua.discourse;

import pl.marcinmilkowski.interlingua.lexicon.QuestionWord;
import pl.marcinmilkowski.interlingua.symbol.SymbolId;
import pl.marcinmilkowski.interlingua.tree.PointOfView;
import pl.marcinmilkowski.interlingua.tree.QueryFocus;

/**
 * Who a question is about and what it asks for.
 *
 * @param resolvedSubject label after following a pronoun link
 * @param originalSubject subject as the user wrote it
 * @param pronounResolved whether a {@code refers-to} link was followed
 * @param questionWord may be {@code null}
 */
public record DiscourseContext(
    String resolvedSubject,
    SymbolId subjectId,
    String originalSubject,
    boolean pronounResolved,
    PointOfView pointOfView,
    QueryFocus focus,
    QuestionWord questionWord,
    String originalInput
) {
}
