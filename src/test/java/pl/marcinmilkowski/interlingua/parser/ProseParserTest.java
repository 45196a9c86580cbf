package pl.marcinmilkowski.interlingua.parser;

import org.junit.jupiter.api.*;
import pl.marcinmilkowski.interlingua.error.AmbiguousParseException;
import pl.marcinmilkowski.interlingua.error.GrammarException;
import pl.marcinmilkowski.interlingua.error.IncompleteInputException;
import pl.marcinmilkowski.interlingua.error.ParseFailedException;
import pl.marcinmilkowski.interlingua.error.VsaException;
import pl.marcinmilkowski.interlingua.lexicon.Command;
import pl.marcinmilkowski.interlingua.lexicon.Language;
import pl.marcinmilkowski.interlingua.lexicon.QuestionWord;
import pl.marcinmilkowski.interlingua.symbol.InMemoryKnowledgeGraph;
import pl.marcinmilkowski.interlingua.symbol.SymbolId;
import pl.marcinmilkowski.interlingua.tree.Conjunction;
import pl.marcinmilkowski.interlingua.tree.Entity;
import pl.marcinmilkowski.interlingua.tree.SemanticTree;
import pl.marcinmilkowski.interlingua.tree.Triple;
import pl.marcinmilkowski.interlingua.tree.WithConfidence;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProseParserTest {

    private final ProseParser parser = new ProseParser();
    private final ParseContext en = ParseContext.empty();

    private SemanticTree singleFact(String input, ParseContext ctx) throws VsaException {
        ParseResult result = parser.parseProse(input, ctx);
        ParseResult.Facts facts = assertInstanceOf(ParseResult.Facts.class, result);
        assertEquals(1, facts.trees().size());
        return facts.trees().get(0);
    }

    @Test
    @DisplayName("Simple statement should become a triple with pattern confidence")
    void testSimpleStatement() throws VsaException {
        SemanticTree tree = singleFact("Dog is a mammal", en);
        WithConfidence wc = assertInstanceOf(WithConfidence.class, tree);
        assertEquals(List.of("Dog", "is-a", "mammal"), wc.collectLabels());
        assertEquals(Math.cbrt(0.9 * 0.8 * 0.8), wc.confidence(), 1e-9);
    }

    @Test
    @DisplayName("Grounded subject and object should raise the confidence")
    void testGroundedStatement() throws VsaException {
        InMemoryKnowledgeGraph graph = new InMemoryKnowledgeGraph();
        SymbolId paris = graph.resolveOrCreate("Paris");
        SymbolId france = graph.resolveOrCreate("France");
        SemanticTree tree = singleFact("Paris is located in France", ParseContext.of(graph, null));
        WithConfidence wc = assertInstanceOf(WithConfidence.class, tree);
        assertEquals(Math.cbrt(0.9), wc.confidence(), 1e-9);
        Triple t = assertInstanceOf(Triple.class, wc.inner());
        assertEquals(new Entity("Paris", paris), t.subject());
        assertEquals(new Entity("France", france), t.object());
        assertEquals(SemanticTree.relation("located-in"), t.predicate());
    }

    @Test
    @DisplayName("Two clauses joined by 'and' should become a conjunction of two")
    void testCompound() throws VsaException {
        SemanticTree tree = singleFact("Dog is a mammal and Cat is a mammal", en);
        Conjunction c = assertInstanceOf(Conjunction.class, tree);
        assertTrue(c.isAnd());
        assertEquals(2, c.items().size());
        assertEquals(List.of("Dog", "is-a", "mammal", "Cat", "is-a", "mammal"), c.collectLabels());

        Conjunction plural = assertInstanceOf(Conjunction.class, singleFact("Dogs are mammals and cats are mammals", en));
        assertEquals(2, plural.items().size());
    }

    @Test
    @DisplayName("'or' should produce a disjunction")
    void testDisjunction() throws VsaException {
        Conjunction c = assertInstanceOf(Conjunction.class, singleFact("Tea is a drink or Tea is a plant", en));
        assertFalse(c.isAnd());
    }

    @Test
    @DisplayName("Exactly three content words should fall back to a low-confidence triple")
    void testThreeWordFallback() throws VsaException {
        WithConfidence wc = assertInstanceOf(WithConfidence.class, singleFact("Birds eat worms", en));
        assertEquals(0.7, wc.confidence(), 1e-9);
        Triple t = assertInstanceOf(Triple.class, wc.inner());
        assertEquals(List.of("Birds", "eat", "worms"), t.collectLabels());
    }

    @Test
    @DisplayName("Run command should be recognised with its cycle count")
    void testRunCommand() throws VsaException {
        ParseResult result = parser.parseProse("run 5", en);
        ParseResult.CommandRequest cmd = assertInstanceOf(ParseResult.CommandRequest.class, result);
        assertEquals(Command.runAgent(5), cmd.command());
    }

    @Test
    @DisplayName("Goal verb should produce a goal")
    void testGoal() throws VsaException {
        ParseResult.Goal goal = assertInstanceOf(ParseResult.Goal.class,
            parser.parseProse("investigate the origin of language", en));
        assertEquals("investigate the origin of language", goal.description());
    }

    @Test
    @DisplayName("Question should produce a query about its subject")
    void testQuery() throws VsaException {
        ParseResult.Query q = assertInstanceOf(ParseResult.Query.class, parser.parseProse("What can you do?", en));
        assertEquals("you", q.subject());
        assertEquals(QuestionWord.WHAT, q.frame().questionKind());
        assertTrue(q.frame().capability());
        assertEquals(SemanticTree.entity("you"), q.tree());
    }

    @Test
    @DisplayName("Unstructured text should be freeform")
    void testFreeform() throws VsaException {
        ParseResult.Freeform f = assertInstanceOf(ParseResult.Freeform.class,
            parser.parseProse("hello there my good friend", en));
        assertEquals("hello there my good friend", f.text());
        assertTrue(f.partial().isEmpty());
        assertInstanceOf(ParseResult.Freeform.class, parser.parseProse("   ", en));
    }

    @Test
    @DisplayName("Russian, French, Spanish and Arabic statements should parse with their lexicons")
    void testOtherLanguages() throws VsaException {
        assertEquals(List.of("Москва", "located-in", "России"),
            singleFact("Москва находится в России", ParseContext.of(Language.RUSSIAN)).collectLabels());
        assertEquals(List.of("Paris", "located-in", "France"),
            singleFact("Paris est situé en France", ParseContext.of(Language.FRENCH)).collectLabels());
        assertEquals(List.of("Madrid", "located-in", "España"),
            singleFact("Madrid se encuentra en España", ParseContext.of(Language.SPANISH)).collectLabels());
        assertEquals(List.of("القاهرة", "located-in", "مصر"),
            singleFact("القاهرة يقع في مصر", ParseContext.of(Language.ARABIC)).collectLabels());
    }

    @Test
    @DisplayName("parseStatement() should report incomplete, ambiguous and failed input")
    void testParseStatementErrors() {
        assertThrows(IncompleteInputException.class, () -> parser.parseStatement("Dog is a", en));
        assertThrows(IncompleteInputException.class, () -> parser.parseStatement("", en));
        assertThrows(AmbiguousParseException.class, () -> parser.parseStatement("Box has toys contains nothing", en));
        assertThrows(ParseFailedException.class, () -> parser.parseStatement("purple monkey dishwasher banana", en));
    }

    @Test
    @DisplayName("parseUniversal() should reject commands and wrap goals as freeform")
    void testParseUniversal() throws GrammarException {
        assertThrows(ParseFailedException.class, () -> parser.parseUniversal("help", en));
        assertEquals(SemanticTree.freeform("find all cats"), parser.parseUniversal("find all cats", en));
        assertEquals(SemanticTree.entity("Alan Turing"), parser.parseUniversal("Who is Alan Turing?", en));
    }

    @Test
    @DisplayName("classifyIntent() should separate questions, commands, goals and statements")
    void testClassifyIntent() {
        assertEquals(IntentKind.QUESTION, parser.classifyIntent("What is a dog?", Language.ENGLISH).kind());
        assertEquals(IntentKind.COMMAND, parser.classifyIntent("status", Language.ENGLISH).kind());
        assertEquals(IntentKind.GOAL, parser.classifyIntent("explore the graph", Language.ENGLISH).kind());
        assertEquals(IntentKind.STATEMENT, parser.classifyIntent("Dogs bark", Language.ENGLISH).kind());
        assertEquals(IntentKind.EMPTY, parser.classifyIntent("  ", Language.ENGLISH).kind());
    }
}
