package pl.marcinmilkowski.interlingua.lexer;

import org.junit.jupiter.api.*;
import pl.marcinmilkowski.interlingua.error.VsaException;
import pl.marcinmilkowski.interlingua.lexicon.Language;
import pl.marcinmilkowski.interlingua.lexicon.Lexicon;
import pl.marcinmilkowski.interlingua.symbol.InMemoryKnowledgeGraph;
import pl.marcinmilkowski.interlingua.symbol.SymbolId;
import pl.marcinmilkowski.interlingua.vsa.HypervectorIndex;
import pl.marcinmilkowski.interlingua.vsa.VsaOps;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LexerTest {

    private final Lexer lexer = new Lexer();

    @Test
    @DisplayName("Tokens should strip punctuation, lowercase and flag articles")
    void testSplit() {
        List<Token> tokens = lexer.tokenize("The Dog is a mammal.", Lexicon.english());
        assertEquals(5, tokens.size());
        assertEquals("Dog", tokens.get(1).surface());
        assertEquals("dog", tokens.get(1).normalized());
        assertTrue(tokens.get(0).isVoid());
        assertTrue(tokens.get(3).isVoid());
        assertEquals("mammal", tokens.get(4).surface());
    }

    @Test
    @DisplayName("Spans should be UTF-8 byte offsets")
    void testByteSpans() {
        List<Token> tokens = lexer.tokenize("Москва находится", Lexicon.forLanguage(Language.RUSSIAN));
        assertEquals(new Span(0, 12), tokens.get(0).span());
        assertEquals(13, tokens.get(1).span().start());
    }

    @Test
    @DisplayName("Words longer than 255 characters should stay a single token")
    void testLongToken() {
        String word = "a".repeat(300);
        List<Token> tokens = lexer.tokenize("see " + word + " now", Lexicon.english());
        assertEquals(3, tokens.size());
        assertEquals(word, tokens.get(1).surface());
        assertEquals(new Span(4, 304), tokens.get(1).span());
    }

    @Test
    @DisplayName("Blank input should give no tokens")
    void testBlank() {
        assertTrue(lexer.tokenize("   ", Lexicon.english()).isEmpty());
    }

    @Test
    @DisplayName("Known words should resolve exactly and multi-word names should merge")
    void testExactAndCompound() throws VsaException {
        InMemoryKnowledgeGraph graph = new InMemoryKnowledgeGraph();
        SymbolId newYork = graph.resolveOrCreate("New York");
        SymbolId city = graph.resolveOrCreate("city");

        List<Token> tokens = lexer.tokenize("New York is a city", graph, null, Lexicon.english());
        assertEquals(4, tokens.size());
        assertEquals("New York", tokens.get(0).surface());
        assertEquals(Resolution.compound(newYork, 2), tokens.get(0).resolution());
        assertEquals(Resolution.exact(city), tokens.get(3).resolution());
        assertFalse(tokens.get(1).resolution().isResolved());
    }

    @Test
    @DisplayName("Unknown words should resolve through nearest-neighbour search")
    void testFuzzy() throws VsaException, IOException {
        InMemoryKnowledgeGraph graph = new InMemoryKnowledgeGraph();
        SymbolId canine = graph.resolveOrCreate("canine");
        try (HypervectorIndex index = new HypervectorIndex(new VsaOps(1000))) {
            index.insert(canine, index.ops().encodeLabel("doggo"));
            List<Token> tokens = lexer.tokenize("doggo barks", graph, index, Lexicon.english());
            Resolution r = tokens.get(0).resolution();
            assertEquals(Resolution.Type.FUZZY, r.type());
            assertEquals(canine, r.symbol());
            assertTrue(r.similarity() > 0.6);
        }
    }

    @Test
    @DisplayName("Relational pattern must have tokens on both sides")
    void testFindRelationalPattern() {
        Lexicon en = Lexicon.english();
        var isA = en.relationalPatterns().stream().filter(p -> p.surface().equals("is a")).findFirst().orElseThrow();
        int[] split = Lexer.findRelationalPattern(lexer.tokenize("Dog is a mammal", en), isA).orElseThrow();
        assertArrayEquals(new int[] {1, 3}, split);
        assertTrue(Lexer.findRelationalPattern(lexer.tokenize("is a mammal", en), isA).isEmpty());
    }
}
