package pl.marcinmilkowski.interlingua.vsa;

import org.junit.jupiter.api.*;
import pl.marcinmilkowski.interlingua.error.VsaException;
import pl.marcinmilkowski.interlingua.symbol.SymbolId;
import pl.marcinmilkowski.interlingua.tree.SemanticTree;
import pl.marcinmilkowski.interlingua.tree.TreeEncoder;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class HypervectorIndexTest {

    private HypervectorIndex index;

    @BeforeEach
    void setUp() {
        index = new HypervectorIndex(new VsaOps(1000));
    }

    @AfterEach
    void tearDown() throws IOException {
        index.close();
    }

    @Test
    @DisplayName("getOrCreate() should return equal vectors on repeated calls")
    void testGetOrCreateIsIdempotent() throws VsaException {
        SymbolId id = SymbolId.of(17);
        HyperVector first = index.getOrCreate(id);
        assertEquals(first, index.getOrCreate(id));
        assertEquals(1, index.size());
    }

    @Test
    @DisplayName("Search should rank the stored vector itself first")
    void testSearchFindsExactMatch() throws VsaException {
        index.insertBatch(List.of(SymbolId.of(1), SymbolId.of(2), SymbolId.of(3), SymbolId.of(4)));
        HyperVector query = index.getOrCreate(SymbolId.of(3));
        List<SearchResult> hits = index.search(query, 2);
        assertFalse(hits.isEmpty());
        assertEquals(SymbolId.of(3), hits.get(0).symbol());
        assertEquals(1.0, hits.get(0).similarity(), 1e-6);
    }

    @Test
    @DisplayName("Search on an empty index should return nothing")
    void testSearchEmpty() throws VsaException {
        assertTrue(index.search(index.ops().random(1), 5).isEmpty());
    }

    @Test
    @DisplayName("insert() should replace an earlier vector")
    void testInsertReplaces() throws VsaException {
        SymbolId id = SymbolId.of(9);
        index.getOrCreate(id);
        HyperVector replacement = index.ops().random(12345);
        index.insert(id, replacement);
        assertEquals(replacement, index.get(id).orElseThrow());
        assertEquals(id, index.search(replacement, 1).get(0).symbol());
    }

    @Test
    @DisplayName("Concurrent getOrCreate() and insert() should leave map and ANN graph agreeing")
    void testConcurrentWritesAgree() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<Void>> futures = new ArrayList<>();
            for (int t = 0; t < 4; t++) {
                final int thread = t;
                futures.add(pool.submit((Callable<Void>) () -> {
                    for (int round = 0; round < 20; round++) {
                        SymbolId id = SymbolId.of(round % 5 + 1);
                        if ((round + thread) % 2 == 0) {
                            index.getOrCreate(id);
                        } else {
                            index.insert(id, index.ops().random(1000L * thread + round));
                        }
                    }
                    return null;
                }));
            }
            for (Future<Void> f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(5, index.size());
        for (int i = 1; i <= 5; i++) {
            SymbolId id = SymbolId.of(i);
            List<SearchResult> hits = index.search(index.get(id).orElseThrow(), 1);
            assertEquals(id, hits.get(0).symbol());
            assertEquals(1.0, hits.get(0).similarity(), 1e-6);
        }
    }

    @Test
    @DisplayName("Oversized dimensions should be rejected")
    void testMaxDimension() {
        assertThrows(IllegalArgumentException.class, () -> new HypervectorIndex(new VsaOps(4096)));
    }

    @Test
    @DisplayName("Unbinding the subject role should recover the subject")
    void testRoleRecoverability() throws VsaException {
        SymbolId dog = SymbolId.of(100);
        SymbolId isA = SymbolId.of(101);
        SymbolId mammal = SymbolId.of(102);
        SemanticTree triple = SemanticTree.triple(
            SemanticTree.entity("Dog", dog), SemanticTree.relation("is-a", isA), SemanticTree.entity("Mammal", mammal));

        RoleSymbols roles = RoleSymbols.standard();
        HyperVector encoded = triple.toVsa(index, roles);
        TreeEncoder encoder = new TreeEncoder(index, roles);
        HyperVector recovered = index.ops().unbind(encoded, encoder.role(roles.subject()));

        assertTrue(index.ops().similarity(recovered, index.getOrCreate(dog)) > 0.55);
        assertEquals(dog, index.search(recovered, 1).get(0).symbol());
    }

    @Test
    @DisplayName("Triples sharing predicate and object should be closer than unrelated triples")
    void testRelationalSimilarity() throws VsaException {
        RoleSymbols roles = RoleSymbols.standard();
        HyperVector dog = fact("Dog", "is-a", "Mammal").toVsa(index, roles);
        HyperVector cat = fact("Cat", "is-a", "Mammal").toVsa(index, roles);
        HyperVector car = fact("Car", "located-in", "Garage").toVsa(index, roles);
        VsaOps ops = index.ops();
        assertTrue(ops.similarity(dog, cat) > ops.similarity(dog, car));
    }

    private static SemanticTree fact(String s, String p, String o) {
        return SemanticTree.triple(SemanticTree.entity(s), SemanticTree.relation(p), SemanticTree.entity(o));
    }
}
