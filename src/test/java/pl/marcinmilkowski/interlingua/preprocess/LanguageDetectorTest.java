package pl.marcinmilkowski.interlingua.preprocess;

import org.junit.jupiter.api.*;
import pl.marcinmilkowski.interlingua.lexicon.Language;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LanguageDetectorTest {

    @Test
    @DisplayName("Scripts should identify Russian and Arabic with high confidence")
    void testScripts() {
        DetectionResult ru = LanguageDetector.detect("Москва находится в России");
        assertEquals(Language.RUSSIAN, ru.language());
        assertEquals(0.95, ru.confidence(), 1e-9);

        DetectionResult ar = LanguageDetector.detect("القاهرة يقع في مصر");
        assertEquals(Language.ARABIC, ar.language());
        assertTrue(ar.confidence() >= 0.9);
    }

    @Test
    @DisplayName("Latin text should be told apart by function words and diacritics")
    void testLatinLanguages() {
        assertEquals(Language.ENGLISH, LanguageDetector.detect("The dog is in the garden").language());
        assertEquals(Language.FRENCH, LanguageDetector.detect("Le chat est dans la maison").language());
        assertEquals(Language.SPANISH, LanguageDetector.detect("¿Dónde está el gato?").language());
        assertEquals(Language.SPANISH, LanguageDetector.detect("El perro tiene hambre").language());
    }

    @Test
    @DisplayName("Confidence should stay within the Latin band")
    void testLatinConfidence() {
        DetectionResult result = LanguageDetector.detect("The dog is in the garden");
        assertTrue(result.confidence() >= 0.6 && result.confidence() <= 0.85);
        assertEquals(0.4, LanguageDetector.detect("Xylophone quartz").confidence(), 1e-9);
    }

    @Test
    @DisplayName("Empty and letterless input should fall back to English")
    void testDegenerateInput() {
        assertEquals(new DetectionResult(Language.ENGLISH, 0.0), LanguageDetector.detect("   "));
        assertEquals(new DetectionResult(Language.ENGLISH, 0.1), LanguageDetector.detect("42 + 17"));
        assertEquals(0.0, LanguageDetector.detect(null).confidence(), 1e-9);
    }

    @Test
    @DisplayName("Mixed text should be detected sentence by sentence")
    void testPerSentence() {
        List<LanguageDetector.SentenceDetection> sentences =
            LanguageDetector.detectPerSentence("The cat is black. Москва находится в России. القاهرة يقع في مصر؟");
        assertEquals(3, sentences.size());
        assertEquals("The cat is black.", sentences.get(0).sentence());
        assertEquals(Language.ENGLISH, sentences.get(0).detection().language());
        assertEquals(Language.RUSSIAN, sentences.get(1).detection().language());
        assertEquals(Language.ARABIC, sentences.get(2).detection().language());
    }

    @Test
    @DisplayName("Trailing text without a terminator should still form a sentence")
    void testSplitSentences() {
        assertEquals(List.of("One.", "Two!", "three"), LanguageDetector.splitSentences("One. Two! three"));
        assertTrue(LanguageDetector.splitSentences("  ").isEmpty());
    }
}
