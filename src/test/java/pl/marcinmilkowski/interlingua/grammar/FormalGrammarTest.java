package pl.marcinmilkowski.interlingua.grammar;

import org.junit.jupiter.api.*;
import pl.marcinmilkowski.interlingua.error.GrammarException;
import pl.marcinmilkowski.interlingua.parser.ParseContext;
import pl.marcinmilkowski.interlingua.symbol.InMemoryKnowledgeGraph;
import pl.marcinmilkowski.interlingua.symbol.SymbolId;
import pl.marcinmilkowski.interlingua.tree.Category;
import pl.marcinmilkowski.interlingua.tree.CodeSignature;
import pl.marcinmilkowski.interlingua.tree.Document;
import pl.marcinmilkowski.interlingua.tree.Gap;
import pl.marcinmilkowski.interlingua.tree.ProvenanceTag;
import pl.marcinmilkowski.interlingua.tree.Section;
import pl.marcinmilkowski.interlingua.tree.SemanticTree;
import pl.marcinmilkowski.interlingua.tree.SignatureKind;
import pl.marcinmilkowski.interlingua.tree.Similarity;
import pl.marcinmilkowski.interlingua.tree.Triple;
import pl.marcinmilkowski.interlingua.tree.WithConfidence;
import pl.marcinmilkowski.interlingua.tree.WithProvenance;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FormalGrammarTest {

    private final FormalGrammar grammar = new FormalGrammar();
    private final LinContext ctx = LinContext.empty();

    private static Triple dogIsMammal() {
        return SemanticTree.triple(
            SemanticTree.entity("Dog"), SemanticTree.relation("is-a"), SemanticTree.entity("Mammal"));
    }

    @Test
    @DisplayName("Triple should render as a quoted academic sentence")
    void testTriple() throws GrammarException {
        assertEquals("The entity 'Dog' is a 'Mammal'.", grammar.linearize(dogIsMammal(), ctx));
    }

    @Test
    @DisplayName("Confidence and provenance should be placed before the final period")
    void testModifiers() throws GrammarException {
        SemanticTree tree = new WithProvenance(new WithConfidence(dogIsMammal(), 0.95), ProvenanceTag.EXTRACTED);
        assertEquals("The entity 'Dog' is a 'Mammal' (confidence: 0.95) [source: extracted].",
            grammar.linearize(tree, ctx));

        SemanticTree vsa = new WithProvenance(dogIsMammal(), ProvenanceTag.vsaInferred(0.87));
        assertTrue(grammar.linearize(vsa, ctx).endsWith("[source: VSA inference (similarity: 0.87)]."));
    }

    @Test
    @DisplayName("Similarity and gap should use their fixed phrasings")
    void testSimilarityAndGap() throws GrammarException {
        assertEquals("'Dog' exhibits similarity to 'Wolf' (score: 0.87).",
            grammar.linearize(new Similarity(SemanticTree.entity("Dog"), SemanticTree.entity("Wolf"), 0.87), ctx));
        assertEquals("Knowledge gap identified for 'Dog': no habitat known.",
            grammar.linearize(new Gap(SemanticTree.entity("Dog"), "no habitat known"), ctx));
    }

    @Test
    @DisplayName("Conjunction of three items should use the Oxford comma")
    void testConjunction() throws GrammarException {
        SemanticTree and = SemanticTree.and(List.of(
            SemanticTree.entity("A"), SemanticTree.entity("B"), SemanticTree.entity("C")));
        assertEquals("'A', 'B', and 'C'", grammar.linearize(and, ctx));
        SemanticTree or = SemanticTree.or(List.of(SemanticTree.entity("A"), SemanticTree.entity("B")));
        assertEquals("'A' or 'B'", grammar.linearize(or, ctx));
    }

    @Test
    @DisplayName("Grounded labels should come from the symbol table")
    void testGroundedLabel() throws GrammarException {
        InMemoryKnowledgeGraph graph = new InMemoryKnowledgeGraph();
        SymbolId dog = graph.resolveOrCreate("Canis familiaris");
        SemanticTree tree = SemanticTree.triple(
            SemanticTree.entity("dog", dog), SemanticTree.relation("is-a"), SemanticTree.entity("Mammal"));
        assertEquals("The entity 'Canis familiaris' is a 'Mammal'.", grammar.linearize(tree, LinContext.of(graph)));
    }

    @Test
    @DisplayName("Important signatures should be starred and list params, return type and derives")
    void testSignature() throws GrammarException {
        CodeSignature sig = new CodeSignature(SignatureKind.FN, "parse", "Parses input",
            List.of("input: &str"), "Tree", List.of(), 0.9);
        assertEquals("★ fn `parse` — Parses input. params: (input: &str), returns `Tree`.",
            grammar.linearize(sig, ctx));
    }

    @Test
    @DisplayName("Document should render sections and a knowledge-gap list")
    void testDocument() throws GrammarException {
        Document doc = new Document(
            SemanticTree.freeform("Overview."),
            List.of(new Section("Facts", List.of(dogIsMammal()))),
            List.of(new Gap(SemanticTree.entity("Dog"), "diet unknown")));
        String out = grammar.linearize(doc, ctx);
        assertTrue(out.startsWith("Overview.\n\n## Facts\n\nThe entity 'Dog' is a 'Mammal'.\n"));
        assertTrue(out.contains("## Knowledge Gaps\n\n- Knowledge gap identified for 'Dog': diet unknown.\n"));
    }

    @Test
    @DisplayName("parse() should read a statement back into a triple")
    void testParseStatement() throws GrammarException {
        SemanticTree tree = grammar.parse("Dog is a mammal", Category.STATEMENT, ParseContext.empty());
        assertEquals(List.of("Dog", "is-a", "mammal"), tree.collectLabels());
    }
}
