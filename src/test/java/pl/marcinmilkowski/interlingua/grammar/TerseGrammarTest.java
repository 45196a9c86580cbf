package pl.marcinmilkowski.interlingua.grammar;

import org.junit.jupiter.api.*;
import pl.marcinmilkowski.interlingua.error.GrammarException;
import pl.marcinmilkowski.interlingua.parser.ParseContext;
import pl.marcinmilkowski.interlingua.tree.Category;
import pl.marcinmilkowski.interlingua.tree.DataFlow;
import pl.marcinmilkowski.interlingua.tree.Gap;
import pl.marcinmilkowski.interlingua.tree.ProvenanceTag;
import pl.marcinmilkowski.interlingua.tree.SemanticTree;
import pl.marcinmilkowski.interlingua.tree.Similarity;
import pl.marcinmilkowski.interlingua.tree.Triple;
import pl.marcinmilkowski.interlingua.tree.WithConfidence;
import pl.marcinmilkowski.interlingua.tree.WithProvenance;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TerseGrammarTest {

    private final TerseGrammar grammar = new TerseGrammar();
    private final LinContext ctx = LinContext.empty();

    @Test
    @DisplayName("Triple should render as arrows with raw predicate labels")
    void testTriple() throws GrammarException {
        SemanticTree tree = SemanticTree.triple(
            SemanticTree.entity("Dog"), SemanticTree.relation("is-a"), SemanticTree.entity("Mammal"), 0.95);
        assertEquals("Dog → is-a → Mammal [0.95]", grammar.linearize(tree, ctx));
    }

    @Test
    @DisplayName("Similarity, gap and provenance should use compact markers")
    void testCompactForms() throws GrammarException {
        assertEquals("Dog ~ Wolf (0.87)",
            grammar.linearize(new Similarity(SemanticTree.entity("Dog"), SemanticTree.entity("Wolf"), 0.87), ctx));
        assertEquals("? Dog: diet",
            grammar.linearize(new Gap(SemanticTree.entity("Dog"), "diet"), ctx));
        assertEquals("Dog (vsa:0.80)",
            grammar.linearize(new WithProvenance(SemanticTree.entity("Dog"), ProvenanceTag.vsaInferred(0.8)), ctx));
    }

    @Test
    @DisplayName("Conjunctions should join with semicolons or bars")
    void testConjunction() throws GrammarException {
        List<SemanticTree> items = List.of(SemanticTree.entity("A"), SemanticTree.entity("B"));
        assertEquals("A; B", grammar.linearize(SemanticTree.and(items), ctx));
        assertEquals("A | B", grammar.linearize(SemanticTree.or(items), ctx));
    }

    @Test
    @DisplayName("Data flow should show typed hops")
    void testDataFlow() throws GrammarException {
        DataFlow flow = new DataFlow(List.of(
            new DataFlow.Step("read", "String"), new DataFlow.Step("parse", "Tree"), new DataFlow.Step("render", null)));
        assertEquals("read:String → parse:Tree → render", grammar.linearize(flow, ctx));
    }

    @Test
    @DisplayName("parseArrow() should read unicode and ASCII arrows with optional confidence")
    void testParseArrow() {
        Optional<SemanticTree> plain = TerseGrammar.parseArrow("Dog → is-a → Mammal");
        assertTrue(plain.isPresent());
        assertInstanceOf(Triple.class, plain.get());
        assertEquals(List.of("Dog", "is-a", "Mammal"), plain.get().collectLabels());

        Optional<SemanticTree> ascii = TerseGrammar.parseArrow("Cat -> has-a -> tail [0.8]");
        assertTrue(ascii.isPresent());
        WithConfidence wc = assertInstanceOf(WithConfidence.class, ascii.get());
        assertEquals(0.8, wc.confidence(), 1e-9);
        assertEquals(List.of("Cat", "has-a", "tail"), wc.collectLabels());

        assertTrue(TerseGrammar.parseArrow("A → B").isEmpty());
        assertTrue(TerseGrammar.parseArrow("no arrows here").isEmpty());
    }

    @Test
    @DisplayName("Rendering then parsing a terse triple should give the same labels")
    void testRoundTrip() throws GrammarException {
        SemanticTree tree = SemanticTree.triple(
            SemanticTree.entity("Paris"), SemanticTree.relation("located-in"), SemanticTree.entity("France"));
        String text = grammar.linearize(tree, ctx);
        SemanticTree back = grammar.parse(text, Category.STATEMENT, ParseContext.empty());
        assertEquals(tree, back);
    }

    @Test
    @DisplayName("parse() should fall back to prose when there are no arrows")
    void testParseFallsBackToProse() throws GrammarException {
        SemanticTree tree = grammar.parse("Paris is located in France", Category.STATEMENT, ParseContext.empty());
        assertEquals(List.of("Paris", "located-in", "France"), tree.collectLabels());
    }
}
