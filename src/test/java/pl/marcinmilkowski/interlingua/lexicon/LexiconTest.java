package pl.marcinmilkowski.interlingua.lexicon;

import org.junit.jupiter.api.*;
import pl.marcinmilkowski.interlingua.error.UnsupportedLanguageException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LexiconTest {

    @Test
    @DisplayName("Every supported language should have a bundled lexicon")
    void testBundledLexicons() {
        for (Language language : Language.values()) {
            Lexicon lexicon = Lexicon.forLanguage(language);
            assertEquals(language, lexicon.language());
            assertFalse(lexicon.relationalPatterns().isEmpty(), language + " has no patterns");
        }
    }

    @Test
    @DisplayName("Patterns should be ordered longest first")
    void testPatternOrder() {
        List<RelationalPattern> patterns = Lexicon.english().relationalPatterns();
        for (int i = 1; i < patterns.size(); i++) {
            assertTrue(patterns.get(i - 1).length() >= patterns.get(i).length());
        }
    }

    @Test
    @DisplayName("Language codes should accept regions and English names")
    void testLanguageCodes() throws UnsupportedLanguageException {
        assertEquals(Language.FRENCH, Language.fromCode("fr-CA").orElseThrow());
        assertEquals(Language.RUSSIAN, Language.fromCode("Russian").orElseThrow());
        assertTrue(Language.fromCode("de").isEmpty());
        assertEquals(Language.ARABIC, Language.require("ar"));
        assertThrows(UnsupportedLanguageException.class, () -> Language.require("xx"));
    }

    @Test
    @DisplayName("Run prefix with a number should request that many cycles")
    void testRunCommand() {
        Lexicon en = Lexicon.english();
        assertEquals(Command.runAgent(5), en.matchCommand("run 5").orElseThrow());
        assertEquals(Command.runAgent(null), en.matchCommand("run").orElseThrow());
        assertEquals(Command.runAgent(3), Lexicon.forLanguage(Language.RUSSIAN).matchCommand("запуск 3").orElseThrow());
        assertTrue(en.matchCommand("runner beans").isEmpty());
    }

    @Test
    @DisplayName("Literal and render commands should be recognised")
    void testOtherCommands() {
        Lexicon en = Lexicon.english();
        assertEquals(Command.help(), en.matchCommand("help").orElseThrow());
        assertEquals(Command.showStatus(), en.matchCommand("show status").orElseThrow());
        assertEquals(Command.renderHiero("Dog"), en.matchCommand("render Dog").orElseThrow());
        assertEquals(Command.help(), Lexicon.forLanguage(Language.SPANISH).matchCommand("ayuda").orElseThrow());
    }

    @Test
    @DisplayName("Goal verbs followed by more words should form a goal")
    void testGoal() {
        Lexicon en = Lexicon.english();
        assertEquals("find the capital of France", en.matchGoal("find the capital of France").orElseThrow());
        assertTrue(en.matchGoal("find").isEmpty());
    }

    @Test
    @DisplayName("Question frame should split question word, auxiliary and subject")
    void testQuestionFrame() {
        QuestionFrame frame = Lexicon.english().parseQuestionFrame("Who is Alan Turing?");
        assertEquals(QuestionWord.WHO, frame.questionKind());
        assertEquals("is", frame.auxiliary());
        assertEquals("Alan Turing", frame.subject());
        assertFalse(frame.capability());
    }

    @Test
    @DisplayName("'What can you do?' should be a capability question about you")
    void testCapabilityQuestion() {
        QuestionFrame frame = Lexicon.english().parseQuestionFrame("What can you do?");
        assertEquals(QuestionWord.WHAT, frame.questionKind());
        assertEquals("can", frame.auxiliary());
        assertEquals(List.of("you"), frame.contentWords());
        assertTrue(frame.capability());
    }

    @Test
    @DisplayName("Spanish question with inverted mark should be recognised")
    void testSpanishQuestion() {
        Lexicon es = Lexicon.forLanguage(Language.SPANISH);
        assertTrue(es.looksLikeQuestion("¿Dónde está Madrid?"));
        QuestionFrame frame = es.parseQuestionFrame("¿Dónde está Madrid?");
        assertEquals(QuestionWord.WHERE, frame.questionKind());
        assertEquals("Madrid", frame.subject());
    }

    @Test
    @DisplayName("Leading article should be dropped from the subject")
    void testArticleDropped() {
        QuestionFrame frame = Lexicon.english().parseQuestionFrame("What is the speed of light?");
        assertEquals("speed of light", frame.subject());
    }

    @Test
    @DisplayName("Loader should reject a lexicon without patterns")
    void testLoaderValidation() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> LexiconLoader.parse("{\"language\": \"en\", \"patterns\": []}"));
        assertTrue(e.getMessage().contains("patterns"));
        assertThrows(IllegalArgumentException.class, () -> LexiconLoader.parse("{\"patterns\": []}"));
    }
}
