package pl.marcinmilkowski.interlingua.parser;

import pl.marcinmilkowski.interlingua.lexicon.Command;
import pl.marcinmilkowski.interlingua.lexicon.QuestionFrame;

/**
 * What an input is trying to do, decided without tokenizing or touching the graph.
 *
 * @param questionFrame set for {@link IntentKind#QUESTION}
 * @param command set for {@link IntentKind#COMMAND} and {@link IntentKind#GOAL}
 */
public record Intent(IntentKind kind, QuestionFrame questionFrame, Command command, String text) {
}
