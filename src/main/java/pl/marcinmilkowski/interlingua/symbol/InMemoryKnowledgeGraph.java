package pl.marcinmilkowski.interlingua.symbol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe in-memory knowledge graph used by the command line tool and tests.
 */
public class InMemoryKnowledgeGraph implements KnowledgeGraph {

    private final AtomicLong nextId = new AtomicLong(1);
    private final Map<String, SymbolId> idsByLabel = new ConcurrentHashMap<>();
    private final Map<SymbolId, String> labelsById = new ConcurrentHashMap<>();
    private final Map<SymbolId, List<GraphTriple>> outgoing = new ConcurrentHashMap<>();
    private final Map<SymbolId, List<GraphTriple>> incoming = new ConcurrentHashMap<>();

    /**
     * Return the symbol for a label, allocating a fresh id the first time it is seen.
     */
    public SymbolId resolveOrCreate(String label) {
        String key = label.toLowerCase(Locale.ROOT);
        return idsByLabel.computeIfAbsent(key, k -> {
            SymbolId id = SymbolId.of(nextId.getAndIncrement());
            labelsById.put(id, label);
            return id;
        });
    }

    public GraphTriple addTriple(String subject, String predicate, String object) {
        return addTriple(subject, predicate, object, 1.0f);
    }

    public GraphTriple addTriple(String subject, String predicate, String object, float confidence) {
        GraphTriple triple = new GraphTriple(
            resolveOrCreate(subject), resolveOrCreate(predicate), resolveOrCreate(object), confidence);
        addTriple(triple);
        return triple;
    }

    public void addTriple(GraphTriple triple) {
        outgoing.computeIfAbsent(triple.subject(), k -> new CopyOnWriteArrayList<>()).add(triple);
        incoming.computeIfAbsent(triple.object(), k -> new CopyOnWriteArrayList<>()).add(triple);
    }

    public List<SymbolId> allSymbols() {
        List<SymbolId> ids = new ArrayList<>(labelsById.keySet());
        ids.sort((a, b) -> Long.compareUnsigned(a.value(), b.value()));
        return ids;
    }

    public int size() {
        return labelsById.size();
    }

    @Override
    public Optional<SymbolId> lookup(String label) {
        if (label == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(idsByLabel.get(label.toLowerCase(Locale.ROOT)));
    }

    @Override
    public Optional<String> get(SymbolId id) {
        return Optional.ofNullable(labelsById.get(id));
    }

    @Override
    public Optional<SymbolId> resolveSymbol(String label) {
        return lookup(label);
    }

    @Override
    public String resolveLabel(SymbolId id) {
        return get(id).orElse("sym:" + id);
    }

    @Override
    public List<GraphTriple> triplesFrom(SymbolId subject) {
        return Collections.unmodifiableList(outgoing.getOrDefault(subject, List.of()));
    }

    @Override
    public List<GraphTriple> triplesTo(SymbolId object) {
        return Collections.unmodifiableList(incoming.getOrDefault(object, List.of()));
    }
}
