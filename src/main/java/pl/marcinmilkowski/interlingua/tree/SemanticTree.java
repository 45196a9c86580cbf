package pl.marcinmilkowski.interlingua.tree;

import com.alibaba.fastjson2.JSONObject;
import pl.marcinmilkowski.interlingua.error.GroundingIncompleteException;
import pl.marcinmilkowski.interlingua.error.TypeMismatchException;
import pl.marcinmilkowski.interlingua.error.VsaException;
import pl.marcinmilkowski.interlingua.symbol.SymbolId;
import pl.marcinmilkowski.interlingua.symbol.SymbolTable;
import pl.marcinmilkowski.interlingua.vsa.HyperVector;
import pl.marcinmilkowski.interlingua.vsa.HypervectorIndex;
import pl.marcinmilkowski.interlingua.vsa.RoleSymbols;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Node of the interlingua: the single representation every parser writes and
 * every renderer reads.
 *
 * Trees are immutable values. Each child belongs to exactly one parent.
 * Modifier nodes ({@link WithConfidence}, {@link WithProvenance},
 * {@link DiscourseFrame}) wrap one node and are transparent to the structural
 * queries below, though renderers see them.
 */
public interface SemanticTree {

    Category category();

    /**
     * Direct children in document order. Leaves return an empty list.
     */
    List<SemanticTree> children();

    /**
     * Copy of this tree with unresolved leaves looked up in {@code table}.
     * Ids already present are kept. The receiver is not modified.
     */
    SemanticTree ground(SymbolTable table);

    /**
     * Check that every child sits in a slot its category allows.
     *
     * @throws TypeMismatchException on the first violation, depth first
     */
    default void validate() throws TypeMismatchException {
        for (SemanticTree child : children()) {
            child.validate();
        }
    }

    /**
     * Symbol id of a grounded leaf.
     */
    default Optional<SymbolId> symbolId() {
        return Optional.empty();
    }

    /**
     * Label of an entity or relation leaf, or the text of a freeform leaf.
     */
    default Optional<String> nodeLabel() {
        return Optional.empty();
    }

    default int unresolvedCount() {
        int count = 0;
        for (SemanticTree child : children()) {
            count += child.unresolvedCount();
        }
        return count;
    }

    default Optional<String> firstUnresolved() {
        for (SemanticTree child : children()) {
            Optional<String> found = child.firstUnresolved();
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    /**
     * Entity and relation labels, depth first.
     */
    default List<String> collectLabels() {
        List<String> out = new ArrayList<>();
        collectLabels(out);
        return out;
    }

    default void collectLabels(List<String> out) {
        for (SemanticTree child : children()) {
            child.collectLabels(out);
        }
    }

    default int nodeCount() {
        int count = 1;
        for (SemanticTree child : children()) {
            count += child.nodeCount();
        }
        return count;
    }

    default boolean isFullyGrounded() {
        return unresolvedCount() == 0;
    }

    /**
     * @throws GroundingIncompleteException if any entity or relation leaf lacks an id
     */
    default void requireGrounded() throws GroundingIncompleteException {
        int unresolved = unresolvedCount();
        if (unresolved > 0) {
            throw new GroundingIncompleteException(unresolved, firstUnresolved().orElse(""));
        }
    }

    /**
     * Encode into a single hypervector by role-filler binding.
     */
    default HyperVector toVsa(HypervectorIndex index, RoleSymbols roles) throws VsaException {
        return new TreeEncoder(index, roles).encode(this);
    }

    default JSONObject toJson() {
        return TreeJson.toJson(this);
    }

    static SemanticTree fromJson(JSONObject json) {
        return TreeJson.fromJson(json);
    }

    // Factories

    static Entity entity(String label) {
        return new Entity(label, null);
    }

    static Entity entity(String label, SymbolId id) {
        return new Entity(label, id);
    }

    static Relation relation(String label) {
        return new Relation(label, null);
    }

    static Relation relation(String label, SymbolId id) {
        return new Relation(label, id);
    }

    static Triple triple(SemanticTree subject, SemanticTree predicate, SemanticTree object) {
        return new Triple(subject, predicate, object);
    }

    /**
     * Triple wrapped with a confidence.
     */
    static WithConfidence triple(SemanticTree subject, SemanticTree predicate, SemanticTree object,
                                 double confidence) {
        return new WithConfidence(new Triple(subject, predicate, object), confidence);
    }

    static Freeform freeform(String text) {
        return new Freeform(text);
    }

    static Conjunction and(List<? extends SemanticTree> items) {
        return new Conjunction(List.copyOf(items), true);
    }

    static Conjunction or(List<? extends SemanticTree> items) {
        return new Conjunction(List.copyOf(items), false);
    }

    static List<SemanticTree> groundAll(List<SemanticTree> trees, SymbolTable table) {
        List<SemanticTree> out = new ArrayList<>(trees.size());
        for (SemanticTree t : trees) {
            out.add(t.ground(table));
        }
        return List.copyOf(out);
    }
}
