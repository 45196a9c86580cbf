package pl.marcinmilkowski.interlingua.vsa;

import org.junit.jupiter.api.*;
import pl.marcinmilkowski.interlingua.error.VsaException;
import pl.marcinmilkowski.interlingua.symbol.InMemoryKnowledgeGraph;
import pl.marcinmilkowski.interlingua.symbol.SymbolId;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class NeighborhoodGroundingTest {

    private InMemoryKnowledgeGraph graph;
    private HypervectorIndex index;

    @BeforeEach
    void setUp() {
        graph = new InMemoryKnowledgeGraph();
        index = new HypervectorIndex(new VsaOps(1000));
    }

    @AfterEach
    void tearDown() throws IOException {
        index.close();
    }

    @Test
    @DisplayName("Symbols with shared neighbours should drift closer after grounding")
    void testSharedNeighboursConverge() throws VsaException {
        graph.addTriple("Dog", "is-a", "Mammal");
        graph.addTriple("Cat", "is-a", "Mammal");
        graph.addTriple("Dog", "has-a", "Fur");
        graph.addTriple("Cat", "has-a", "Fur");
        SymbolId dog = graph.resolveSymbol("Dog").orElseThrow();
        SymbolId cat = graph.resolveSymbol("Cat").orElseThrow();

        double before = index.ops().similarity(index.getOrCreate(dog), index.getOrCreate(cat));
        NeighborhoodGrounding grounding = new NeighborhoodGrounding(graph, index);
        NeighborhoodGrounding.GroundingResult result = grounding.groundAll(graph.allSymbols());
        double after = index.ops().similarity(index.get(dog).orElseThrow(), index.get(cat).orElseThrow());

        assertTrue(result.symbolsUpdated() > 0);
        assertTrue(after > before, "expected " + after + " > " + before);
    }

    @Test
    @DisplayName("An isolated symbol should keep its vector")
    void testIsolatedSymbolUnchanged() throws VsaException {
        SymbolId lonely = graph.resolveOrCreate("Lonely");
        HyperVector original = index.getOrCreate(lonely);
        NeighborhoodGrounding grounding = new NeighborhoodGrounding(graph, index);
        assertEquals(original, grounding.groundSymbol(lonely));
        assertEquals(0, grounding.groundAll(graph.allSymbols()).symbolsUpdated());
    }

    @Test
    @DisplayName("encodeText() should be similar for texts sharing words")
    void testEncodeText() throws VsaException {
        NeighborhoodGrounding grounding = new NeighborhoodGrounding(graph, index);
        HyperVector a = grounding.encodeText("the quick brown fox");
        HyperVector b = grounding.encodeText("the quick brown dog");
        HyperVector c = grounding.encodeText("gravity bends spacetime");
        assertTrue(index.ops().similarity(a, b) > index.ops().similarity(a, c));
    }
}
