package pl.marcinmilkowski.interlingua.symbol;

import org.junit.jupiter.api.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryKnowledgeGraphTest {

    @Test
    @DisplayName("Labels should resolve case-insensitively and keep the first spelling")
    void testResolveOrCreate() {
        InMemoryKnowledgeGraph graph = new InMemoryKnowledgeGraph();
        SymbolId dog = graph.resolveOrCreate("Dog");
        assertEquals(dog, graph.resolveOrCreate("DOG"));
        assertEquals(dog, graph.lookup("dog").orElseThrow());
        assertEquals("Dog", graph.resolveLabel(dog));
        assertEquals(1, graph.size());
        assertFalse(dog.isReserved());
    }

    @Test
    @DisplayName("Unknown ids should render as sym:<id>")
    void testUnknownLabel() {
        InMemoryKnowledgeGraph graph = new InMemoryKnowledgeGraph();
        assertEquals("sym:42", graph.resolveLabel(SymbolId.of(42)));
        assertTrue(graph.lookup("cat").isEmpty());
        assertTrue(graph.lookup(null).isEmpty());
    }

    @Test
    @DisplayName("Triples should be indexed both ways")
    void testTriples() {
        InMemoryKnowledgeGraph graph = new InMemoryKnowledgeGraph();
        GraphTriple t = graph.addTriple("Dog", "is-a", "mammal", 0.8f);
        graph.addTriple("Cat", "is-a", "mammal");
        SymbolId mammal = graph.lookup("mammal").orElseThrow();
        assertEquals(List.of(t), graph.triplesFrom(t.subject()));
        assertEquals(2, graph.triplesTo(mammal).size());
        assertTrue(graph.triplesFrom(mammal).isEmpty());
        assertEquals(4, graph.allSymbols().size());
    }

    @Test
    @DisplayName("Derived ids should be reserved, case-insensitive and non-zero")
    void testDerivedIds() {
        SymbolId a = SymbolId.derived("Role:Subject");
        assertTrue(a.isReserved());
        assertEquals(a, SymbolId.derived("role:subject"));
        assertNotEquals(a, SymbolId.derived("role:object"));
        assertThrows(IllegalArgumentException.class, () -> SymbolId.of(0));
    }
}
