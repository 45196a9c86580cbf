package pl.marcinmilkowski.interlingua.discourse;

import org.junit.jupiter.api.*;
import pl.marcinmilkowski.interlingua.error.UnresolvedEntityException;
import pl.marcinmilkowski.interlingua.lexicon.Lexicon;
import pl.marcinmilkowski.interlingua.lexicon.QuestionWord;
import pl.marcinmilkowski.interlingua.symbol.GraphTriple;
import pl.marcinmilkowski.interlingua.symbol.InMemoryKnowledgeGraph;
import pl.marcinmilkowski.interlingua.tree.Conjunction;
import pl.marcinmilkowski.interlingua.tree.DiscourseFrame;
import pl.marcinmilkowski.interlingua.tree.Entity;
import pl.marcinmilkowski.interlingua.tree.PointOfView;
import pl.marcinmilkowski.interlingua.tree.QueryFocus;
import pl.marcinmilkowski.interlingua.tree.SemanticTree;
import pl.marcinmilkowski.interlingua.tree.Triple;
import pl.marcinmilkowski.interlingua.tree.WithConfidence;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class DiscourseResolverTest {

    private InMemoryKnowledgeGraph graph;
    private DiscourseResolver resolver;

    @BeforeEach
    void setUp() {
        graph = new InMemoryKnowledgeGraph();
        graph.addTriple("self", "is-a", "assistant");
        graph.addTriple("self", "has-state", "idle");
        graph.addTriple("self", "has-capability", "translation");
        graph.addTriple("self", "powered-by", "Lucene");
        graph.addTriple("self", "desc:summary", "internal note");
        graph.addTriple("you", "refers-to", "self");
        graph.addTriple("Dog", "located-in", "kennel");
        graph.addTriple("Dog", "is-a", "mammal");
        resolver = new DiscourseResolver(graph);
    }

    @Test
    @DisplayName("'you' should follow refers-to to self and speak in first person")
    void testPronounResolution() throws UnresolvedEntityException {
        DiscourseContext ctx = resolver.resolve(
            Lexicon.english().parseQuestionFrame("What are you?"), "What are you?");
        assertEquals("self", ctx.resolvedSubject());
        assertEquals("you", ctx.originalSubject());
        assertTrue(ctx.pronounResolved());
        assertEquals(PointOfView.FIRST_PERSON, ctx.pointOfView());
        assertEquals(QueryFocus.IDENTITY, ctx.focus());
        assertEquals(graph.lookup("self").orElseThrow(), ctx.subjectId());
    }

    @Test
    @DisplayName("Ordinary subject should stay in third person")
    void testThirdPerson() throws UnresolvedEntityException {
        DiscourseContext ctx = resolver.resolve("dog", QuestionWord.WHERE, false, "Where is the dog?");
        assertEquals("Dog", ctx.resolvedSubject());
        assertFalse(ctx.pronounResolved());
        assertEquals(PointOfView.THIRD_PERSON, ctx.pointOfView());
        assertEquals(QueryFocus.LOCATION, ctx.focus());
    }

    @Test
    @DisplayName("Unknown subject should raise UnresolvedEntityException")
    void testUnresolved() {
        assertThrows(UnresolvedEntityException.class,
            () -> resolver.resolve("nobody", QuestionWord.WHO, false, "Who is nobody?"));
    }

    @Test
    @DisplayName("Response should drop state and metadata and order facts by category")
    void testIdentityResponse() throws UnresolvedEntityException {
        DiscourseContext ctx = resolver.resolve("you", QuestionWord.WHAT, false, "What are you?");
        DiscourseFrame frame = assertInstanceOf(DiscourseFrame.class, resolver.buildResponse(ctx).orElseThrow());
        assertEquals(PointOfView.FIRST_PERSON, frame.pointOfView());
        Conjunction items = assertInstanceOf(Conjunction.class, frame.inner());
        assertEquals(List.of(
                "self", "is-a", "assistant",
                "self", "powered-by", "Lucene",
                "self", "has-capability", "translation"),
            items.collectLabels());
    }

    @Test
    @DisplayName("Focused predicate should outrank is-a only when it scores higher")
    void testScores() {
        assertEquals(15, resolver.score("is-a", QueryFocus.IDENTITY));
        assertEquals(5, resolver.score("is-a", QueryFocus.LOCATION));
        assertEquals(10, resolver.score("located-in", QueryFocus.LOCATION));
        assertEquals(-5, resolver.score("has-state", QueryFocus.IDENTITY));
        assertEquals(0, resolver.score("likes", QueryFocus.GENERAL));
        assertEquals(10, resolver.score("has-capability", QueryFocus.METHOD));
    }

    @Test
    @DisplayName("Concise detail should cap the response at three facts")
    void testConciseLimit() throws UnresolvedEntityException {
        graph.addTriple("self", "has-name", "Ada");
        graph.addTriple("self", "can", "search");
        graph.addTriple("self", "serves-as", "guide");
        graph.addTriple("self", DiscourseResolver.RESPONSE_DETAIL, "brief");
        assertEquals(ResponseDetail.CONCISE, resolver.responseDetail(graph.lookup("self").orElseThrow()));

        DiscourseContext ctx = resolver.resolve("self", QuestionWord.WHO, false, "Who are you?");
        DiscourseFrame frame = (DiscourseFrame) resolver.buildResponse(ctx).orElseThrow();
        Conjunction items = assertInstanceOf(Conjunction.class, frame.inner());
        assertEquals(3, items.items().size());
        assertEquals(List.of("self", "is-a", "assistant"), items.items().get(0).collectLabels());
    }

    @Test
    @DisplayName("Concise detail should limit five identity facts to three")
    void testConciseIdentityFacts() throws UnresolvedEntityException {
        for (String kind : List.of("mathematician", "writer", "countess", "analyst", "pioneer")) {
            graph.addTriple("Ada", "is-a", kind);
        }
        graph.addTriple("Ada", DiscourseResolver.RESPONSE_DETAIL, "concise");

        DiscourseContext ctx = resolver.resolve("Ada", QuestionWord.WHO, false, "Who is Ada?");
        assertEquals(QueryFocus.IDENTITY, ctx.focus());
        DiscourseFrame frame = assertInstanceOf(DiscourseFrame.class, resolver.buildResponse(ctx).orElseThrow());
        Conjunction items = assertInstanceOf(Conjunction.class, frame.inner());
        assertEquals(3, items.items().size());
        for (SemanticTree item : items.items()) {
            assertEquals("is-a", item.collectLabels().get(1));
        }
    }

    @Test
    @DisplayName("Subject with nothing presentable should give no response")
    void testEmptyResponse() throws UnresolvedEntityException {
        graph.addTriple("ghost", "has-state", "faded");
        DiscourseContext ctx = resolver.resolve("ghost", null, false, "ghost?");
        assertEquals(QueryFocus.GENERAL, ctx.focus());
        assertEquals(Optional.empty(), resolver.buildResponse(ctx));
    }

    @Test
    @DisplayName("Question words should map to their focus, capability overriding")
    void testClassifyFocus() {
        assertEquals(QueryFocus.IDENTITY, DiscourseResolver.classifyFocus(QuestionWord.WHO, false));
        assertEquals(QueryFocus.CAUSE, DiscourseResolver.classifyFocus(QuestionWord.WHY, false));
        assertEquals(QueryFocus.TIME, DiscourseResolver.classifyFocus(QuestionWord.WHEN, false));
        assertEquals(QueryFocus.METHOD, DiscourseResolver.classifyFocus(QuestionWord.HOW, false));
        assertEquals(QueryFocus.DEFINITION, DiscourseResolver.classifyFocus(QuestionWord.WHICH, false));
        assertEquals(QueryFocus.CONFIRMATION, DiscourseResolver.classifyFocus(QuestionWord.YES_NO, false));
        assertEquals(QueryFocus.CAPABILITY, DiscourseResolver.classifyFocus(QuestionWord.WHAT, true));
    }

    @Test
    @DisplayName("Detail labels should accept synonyms and prefixes")
    void testResponseDetailLabels() {
        assertEquals(Optional.of(ResponseDetail.CONCISE), ResponseDetail.fromLabel("short"));
        assertEquals(Optional.of(ResponseDetail.FULL), ResponseDetail.fromLabel("detail:Verbose"));
        assertEquals(Optional.of(ResponseDetail.NORMAL), ResponseDetail.fromLabel(" default "));
        assertTrue(ResponseDetail.fromLabel("loud").isEmpty());
        assertTrue(ResponseDetail.fromLabel(null).isEmpty());
    }

    @Test
    @DisplayName("Predicates should fall into presentation categories")
    void testPredicateCategory() {
        assertEquals(PredicateCategory.IDENTITY, PredicateCategory.of("instance-of"));
        assertEquals(PredicateCategory.POWER, PredicateCategory.of("runs-on"));
        assertEquals(PredicateCategory.ROLE, PredicateCategory.of("acts-as"));
        assertEquals(PredicateCategory.CAPABILITY, PredicateCategory.of("can-translate"));
        assertEquals(PredicateCategory.STATE, PredicateCategory.of("has-mood"));
        assertEquals(PredicateCategory.OTHER, PredicateCategory.of("likes"));
        assertTrue(PredicateCategory.STATE.compareTo(PredicateCategory.OTHER) > 0);
    }

    @Test
    @DisplayName("Stored triples should become grounded trees")
    void testTripleBridge() {
        GraphTriple certain = graph.triplesFrom(graph.lookup("Dog").orElseThrow()).get(0);
        Triple t = assertInstanceOf(Triple.class, TripleBridge.toTree(certain, graph));
        assertEquals(new Entity("Dog", certain.subject()), t.subject());
        assertTrue(t.isFullyGrounded());

        GraphTriple doubtful = graph.addTriple("Dog", "likes", "bones", 0.5f);
        WithConfidence wc = assertInstanceOf(WithConfidence.class, TripleBridge.toTree(doubtful, graph));
        assertEquals(0.5, wc.confidence(), 1e-9);

        List<SemanticTree> trees = TripleBridge.toTrees(graph.triplesFrom(certain.subject()), graph);
        assertEquals(3, trees.size());
    }
}
