package pl.marcinmilkowski.interlingua.discourse;

import pl.marcinmilkowski.interlingua.symbol.GraphTriple;
import pl.marcinmilkowski.interlingua.symbol.KnowledgeGraph;
import pl.marcinmilkowski.interlingua.tree.Relation;
import pl.marcinmilkowski.interlingua.tree.SemanticTree;
import pl.marcinmilkowski.interlingua.tree.WithConfidence;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts stored graph triples into grounded statement trees.
 */
public final class TripleBridge {

    private TripleBridge() {
    }

    /**
     * Builds a grounded triple; confidences other than 1 wrap it in a confidence node.
     * Symbols without a label render as {@code sym:<id>}.
     */
    public static SemanticTree toTree(GraphTriple triple, KnowledgeGraph graph) {
        SemanticTree tree = SemanticTree.triple(
            SemanticTree.entity(graph.resolveLabel(triple.subject()), triple.subject()),
            new Relation(graph.resolveLabel(triple.predicate()), triple.predicate()),
            SemanticTree.entity(graph.resolveLabel(triple.object()), triple.object()));
        if (triple.confidence() != 1.0f) {
            return new WithConfidence(tree, triple.confidence());
        }
        return tree;
    }

    public static List<SemanticTree> toTrees(List<GraphTriple> triples, KnowledgeGraph graph) {
        List<SemanticTree> out = new ArrayList<>(triples.size());
        for (GraphTriple t : triples) {
            out.add(toTree(t, graph));
        }
        return out;
    }
}
