package pl.marcinmilkowski.interlingua.grammar;

import org.junit.jupiter.api.*;
import pl.marcinmilkowski.interlingua.error.GrammarException;
import pl.marcinmilkowski.interlingua.tree.CodeSignature;
import pl.marcinmilkowski.interlingua.tree.DiscourseFrame;
import pl.marcinmilkowski.interlingua.tree.Gap;
import pl.marcinmilkowski.interlingua.tree.PointOfView;
import pl.marcinmilkowski.interlingua.tree.ProvenanceTag;
import pl.marcinmilkowski.interlingua.tree.QueryFocus;
import pl.marcinmilkowski.interlingua.tree.SemanticTree;
import pl.marcinmilkowski.interlingua.tree.SignatureKind;
import pl.marcinmilkowski.interlingua.tree.Similarity;
import pl.marcinmilkowski.interlingua.tree.WithConfidence;
import pl.marcinmilkowski.interlingua.tree.WithProvenance;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NarrativeGrammarTest {

    private NarrativeGrammar grammar;
    private final LinContext ctx = LinContext.empty();

    @BeforeEach
    void setUp() {
        grammar = new NarrativeGrammar();
    }

    private static SemanticTree fact(String s, String p, String o) {
        return SemanticTree.triple(SemanticTree.entity(s), SemanticTree.relation(p), SemanticTree.entity(o));
    }

    @Test
    @DisplayName("Successive triples should get varied transitions")
    void testTransitions() throws GrammarException {
        assertEquals("Dog is a Mammal.", grammar.linearize(fact("Dog", "is-a", "Mammal"), ctx));
        assertEquals("Furthermore, Cat is a Mammal.", grammar.linearize(fact("Cat", "is-a", "Mammal"), ctx));
        assertEquals("Notably, Whale is a Mammal.", grammar.linearize(fact("Whale", "is-a", "Mammal"), ctx));

        grammar.resetTransitions();
        assertEquals("Dog is a Mammal.", grammar.linearize(fact("Dog", "is-a", "Mammal"), ctx));
    }

    @Test
    @DisplayName("And-conjunction should read as connected sentences")
    void testAndConjunction() throws GrammarException {
        SemanticTree and = SemanticTree.and(List.of(fact("Dog", "is-a", "Mammal"), fact("Dog", "has-a", "tail")));
        assertEquals("Dog is a Mammal. Furthermore, Dog has tail.", grammar.linearize(and, ctx));
    }

    @Test
    @DisplayName("Or-conjunction should become an either/or sentence")
    void testOrConjunction() throws GrammarException {
        SemanticTree or = SemanticTree.or(List.of(SemanticTree.entity("tea"), SemanticTree.entity("coffee")));
        assertEquals("Either tea or coffee, depending on the context.", grammar.linearize(or, ctx));
    }

    @Test
    @DisplayName("Confidence should become a verbal qualifier")
    void testConfidenceQualifier() throws GrammarException {
        SemanticTree high = new WithConfidence(fact("Dog", "is-a", "Mammal"), 0.95);
        assertEquals("Dog is a Mammal, with high confidence.", grammar.linearize(high, ctx));
        grammar.resetTransitions();
        SemanticTree low = new WithConfidence(fact("Dog", "is-a", "Mammal"), 0.3);
        assertEquals("Dog is a Mammal, speculatively.", grammar.linearize(low, ctx));
    }

    @Test
    @DisplayName("VSA provenance should show the similarity as a percentage")
    void testProvenance() throws GrammarException {
        SemanticTree tree = new WithProvenance(fact("Dog", "is-a", "Mammal"), ProvenanceTag.vsaInferred(0.87));
        assertEquals("Dog is a Mammal (suggested by vector similarity at 87%).", grammar.linearize(tree, ctx));
    }

    @Test
    @DisplayName("Similarity strength should depend on the score")
    void testSimilarity() throws GrammarException {
        String out = grammar.linearize(new Similarity(SemanticTree.entity("Dog"), SemanticTree.entity("Wolf"), 0.95), ctx);
        assertEquals("Dog shares a striking resemblance to Wolf.", out);
    }

    @Test
    @DisplayName("Gap should open with a gap phrase")
    void testGap() throws GrammarException {
        String out = grammar.linearize(new Gap(SemanticTree.entity("Dog"), "its diet is unknown"), ctx);
        assertEquals("An open question remains: regarding Dog, its diet is unknown.", out);
    }

    @Test
    @DisplayName("First-person frame should speak as I and conjugate the verb")
    void testFirstPersonFrame() throws GrammarException {
        SemanticTree frame = new DiscourseFrame(fact("self", "is-a", "helper"),
            PointOfView.FIRST_PERSON, QueryFocus.IDENTITY);
        assertEquals("I am a helper.", grammar.linearize(frame, ctx));

        grammar.resetTransitions();
        SemanticTree second = new DiscourseFrame(fact("you", "has-a", "name"),
            PointOfView.SECOND_PERSON, QueryFocus.IDENTITY);
        assertEquals("You have name.", grammar.linearize(second, ctx));
    }

    @Test
    @DisplayName("Third-person frame should leave the subject alone")
    void testThirdPersonFrame() throws GrammarException {
        SemanticTree frame = new DiscourseFrame(fact("Dog", "is-a", "Mammal"),
            PointOfView.THIRD_PERSON, QueryFocus.DEFINITION);
        assertEquals("Dog is a Mammal.", grammar.linearize(frame, ctx));
    }

    @Test
    @DisplayName("Signature with an empty doc summary should render without a purpose clause")
    void testEmptyDocSummary() throws GrammarException {
        CodeSignature fn = new CodeSignature(SignatureKind.FN, "f", "", List.of(), null, List.of(), null);
        assertEquals("The fn `f`.", grammar.linearize(fn, ctx));

        grammar.resetTransitions();
        CodeSignature documented = new CodeSignature(SignatureKind.FN, "parse", "Read tokens",
            List.of("input: &str"), "Tree", List.of(), null);
        assertEquals("The fn `parse` exists to read tokens, working with input: &str and gives back `Tree`.",
            grammar.linearize(documented, ctx));
    }
}
