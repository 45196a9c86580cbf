package pl.marcinmilkowski.interlingua.tree;

import pl.marcinmilkowski.interlingua.error.VsaException;
import pl.marcinmilkowski.interlingua.symbol.SymbolId;
import pl.marcinmilkowski.interlingua.vsa.HyperVector;
import pl.marcinmilkowski.interlingua.vsa.HypervectorIndex;
import pl.marcinmilkowski.interlingua.vsa.RoleSymbols;
import pl.marcinmilkowski.interlingua.vsa.VsaOps;

import java.util.ArrayList;
import java.util.List;

/**
 * Encodes a tree into one hypervector.
 *
 * Grounded leaves use the vector stored for their symbol; ungrounded leaves and
 * free text are hashed from the label. Composite nodes bind each filler to the
 * vector of its structural role and bundle the results, so unbinding a role
 * from the composite approximately recovers its filler.
 */
public class TreeEncoder {

    private final HypervectorIndex index;
    private final VsaOps ops;
    private final RoleSymbols roles;

    public TreeEncoder(HypervectorIndex index, RoleSymbols roles) {
        this.index = index;
        this.ops = index.ops();
        this.roles = roles;
    }

    /**
     * Vector for a role. Role vectors are never stored in the index, so they
     * cannot turn up as search hits.
     */
    public HyperVector role(SymbolId roleId) {
        return ops.encodeSymbol(roleId);
    }

    public HyperVector encode(SemanticTree tree) throws VsaException {
        if (tree instanceof Entity e) {
            return e.symbol() != null ? index.getOrCreate(e.symbol()) : ops.encodeLabel(e.label());
        }
        if (tree instanceof Relation r) {
            return r.symbol() != null ? index.getOrCreate(r.symbol()) : ops.encodeLabel(r.label());
        }
        if (tree instanceof Freeform f) {
            return ops.encodeLabel(f.text());
        }
        if (tree instanceof Triple t) {
            return ops.bundle(List.of(
                ops.bind(role(roles.subject()), encode(t.subject())),
                ops.bind(role(roles.predicate()), encode(t.predicate())),
                ops.bind(role(roles.object()), encode(t.object()))));
        }
        if (tree instanceof Similarity s) {
            return ops.bundle(List.of(
                ops.bind(role(roles.entity()), encode(s.entity())),
                ops.bind(role(roles.similarTo()), encode(s.similarTo()))));
        }
        if (tree instanceof Gap g) {
            return ops.bundle(List.of(
                ops.bind(role(roles.entity()), encode(g.entity())),
                ops.encodeLabel(g.description())));
        }
        if (tree instanceof Inference i) {
            return ops.bundle(List.of(
                ops.bind(role(roles.subject()), ops.encodeLabel(i.expression())),
                ops.bind(role(roles.object()), ops.encodeLabel(i.simplified()))));
        }
        if (tree instanceof CodeFact c) {
            return ops.bundle(List.of(
                ops.bind(role(roles.subject()), ops.encodeLabel(c.name())),
                ops.bind(role(roles.predicate()), ops.encodeLabel(c.kind())),
                ops.bind(role(roles.object()), ops.encodeLabel(c.detail()))));
        }
        if (tree instanceof CodeSignature sig) {
            return ops.bundle(List.of(
                ops.bind(role(roles.entity()), ops.encodeLabel(sig.name())),
                ops.bind(role(roles.predicate()), ops.encodeLabel(sig.kind().keyword()))));
        }
        if (tree instanceof CodeModule m) {
            List<HyperVector> parts = new ArrayList<>();
            parts.add(ops.bind(role(roles.entity()), ops.encodeLabel(m.name())));
            for (SemanticTree child : m.children()) {
                parts.add(encode(child));
            }
            return ops.bundle(parts);
        }
        if (tree instanceof DataFlow d) {
            if (d.steps().isEmpty()) {
                throw new VsaException("cannot encode an empty data flow");
            }
            List<HyperVector> parts = new ArrayList<>();
            for (int i = 0; i < d.steps().size(); i++) {
                parts.add(ops.permute(ops.encodeLabel(d.steps().get(i).name()), i));
            }
            return ops.bundle(parts);
        }
        if (tree instanceof Conjunction c) {
            if (c.items().isEmpty()) {
                throw new VsaException("cannot encode an empty conjunction");
            }
            return ops.bundle(encodeAll(c.items()));
        }
        if (tree instanceof Section s) {
            List<HyperVector> parts = new ArrayList<>();
            parts.add(ops.bind(role(roles.sectionHeading()), ops.encodeLabel(s.heading())));
            parts.addAll(encodeAll(s.body()));
            return ops.bundle(parts);
        }
        if (tree instanceof Document doc) {
            List<HyperVector> parts = new ArrayList<>();
            parts.add(ops.bind(role(roles.document()), encode(doc.overview())));
            parts.addAll(encodeAll(doc.sections()));
            parts.addAll(encodeAll(doc.gaps()));
            return ops.bundle(parts);
        }
        if (tree instanceof WithConfidence w) {
            return encode(w.inner());
        }
        if (tree instanceof WithProvenance w) {
            return encode(w.inner());
        }
        if (tree instanceof DiscourseFrame f) {
            return encode(f.inner());
        }
        throw new VsaException("no encoding for " + tree.category());
    }

    private List<HyperVector> encodeAll(List<SemanticTree> trees) throws VsaException {
        List<HyperVector> out = new ArrayList<>(trees.size());
        for (SemanticTree t : trees) {
            out.add(encode(t));
        }
        return out;
    }
}
