package pl.marcinmilkowski.interlingua.vsa;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.interlingua.config.InterlinguaConfig;
import pl.marcinmilkowski.interlingua.error.VsaException;
import pl.marcinmilkowski.interlingua.symbol.GraphTriple;
import pl.marcinmilkowski.interlingua.symbol.KnowledgeGraph;
import pl.marcinmilkowski.interlingua.symbol.SymbolId;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Recomputes symbol vectors from their graph neighbourhoods so that symbols
 * close in the graph end up close in vector space.
 *
 * Each round, a symbol's neighbours (objects of outgoing edges, subjects of
 * incoming edges, plus predicate-bound copies of both) are bundled, rotated by
 * one position and blended bit-wise into the symbol's current vector. After
 * {@code k} rounds, symbols {@code k} hops apart share representation.
 */
public class NeighborhoodGrounding {

    private static final Logger logger = LoggerFactory.getLogger(NeighborhoodGrounding.class);

    private static final long SEED_MULTIPLIER = 0x517cc1b727220a95L;

    private final KnowledgeGraph graph;
    private final HypervectorIndex index;
    private final InterlinguaConfig.GroundingSettings settings;

    public NeighborhoodGrounding(KnowledgeGraph graph, HypervectorIndex index) {
        this(graph, index, InterlinguaConfig.defaults().grounding());
    }

    public NeighborhoodGrounding(KnowledgeGraph graph, HypervectorIndex index,
                                 InterlinguaConfig.GroundingSettings settings) {
        this.graph = graph;
        this.index = index;
        this.settings = settings;
    }

    public record GroundingResult(int symbolsUpdated, int roundsCompleted) {
    }

    /**
     * New vector for one symbol given the current state of the index.
     * A symbol without qualifying edges keeps its vector.
     */
    public HyperVector groundSymbol(SymbolId symbol) throws VsaException {
        VsaOps ops = index.ops();
        HyperVector current = index.getOrCreate(symbol);
        List<HyperVector> neighbours = neighbourhood(symbol);
        if (neighbours.isEmpty()) {
            return current;
        }
        HyperVector shifted = ops.permute(ops.bundle(neighbours), 1);
        return blend(current, shifted, settings.neighborWeight(), symbol);
    }

    /**
     * Run all configured rounds over the given symbols.
     */
    public GroundingResult groundAll(Collection<SymbolId> symbols) throws VsaException {
        List<SymbolId> ids = List.copyOf(symbols);
        index.insertBatch(ids);

        int updated = 0;
        for (int round = 0; round < settings.rounds(); round++) {
            int roundUpdated = 0;
            for (SymbolId id : ids) {
                if (neighbourhood(id).isEmpty()) {
                    continue;
                }
                index.insert(id, groundSymbol(id));
                roundUpdated++;
            }
            updated = Math.max(updated, roundUpdated);
            if (roundUpdated == 0) {
                logger.info("Grounding stopped after round {}: no symbol has neighbours", round + 1);
                return new GroundingResult(0, round + 1);
            }
        }
        logger.info("Grounded {} symbols in {} rounds", updated, settings.rounds());
        return new GroundingResult(updated, settings.rounds());
    }

    /**
     * Bundle of the vectors for each word of a text. Words already known to the
     * graph use their stored vectors; others get a hashed label vector. Words of
     * two characters or fewer are skipped.
     */
    public HyperVector encodeText(String text) throws VsaException {
        List<HyperVector> parts = new ArrayList<>();
        for (String raw : text.split("\\s+")) {
            String word = stripNonAlphanumeric(raw).toLowerCase(Locale.ROOT);
            if (word.codePointCount(0, word.length()) <= 2) {
                continue;
            }
            var known = graph.lookup(word);
            parts.add(known.isPresent() ? index.getOrCreate(known.get()) : index.ops().encodeLabel(word));
        }
        if (parts.isEmpty()) {
            return index.ops().encodeLabel(text);
        }
        return index.ops().bundle(parts);
    }

    private List<HyperVector> neighbourhood(SymbolId symbol) throws VsaException {
        VsaOps ops = index.ops();
        List<HyperVector> out = new ArrayList<>();
        for (GraphTriple t : graph.triplesFrom(symbol)) {
            if (t.confidence() < settings.minConfidence()) {
                continue;
            }
            HyperVector obj = index.getOrCreate(t.object());
            out.add(obj);
            out.add(ops.bind(index.getOrCreate(t.predicate()), obj));
        }
        for (GraphTriple t : graph.triplesTo(symbol)) {
            if (t.confidence() < settings.minConfidence()) {
                continue;
            }
            HyperVector subj = index.getOrCreate(t.subject());
            out.add(subj);
            out.add(ops.bind(index.getOrCreate(t.predicate()), subj));
        }
        return out;
    }

    /**
     * Per bit, take {@code other} with probability {@code weight}, else keep {@code base}.
     * The choice sequence comes from an xorshift64 generator seeded by the symbol, so
     * results are reproducible.
     */
    static HyperVector blend(HyperVector base, HyperVector other, double weight, SymbolId symbol)
            throws VsaException {
        if (base.dimension() != other.dimension()) {
            throw VsaException.dimensionMismatch(base.dimension(), other.dimension());
        }
        byte[] result = base.toBytes();
        byte[] theirs = other.toBytes();
        long state = (symbol.value() * SEED_MULTIPLIER) | 1;
        long threshold = (long) (weight * 256.0);
        for (int i = 0; i < result.length; i++) {
            int mask = 0;
            for (int bit = 0; bit < 8; bit++) {
                state ^= state << 13;
                state ^= state >>> 7;
                state ^= state << 17;
                if ((state & 0xFF) < threshold) {
                    mask |= 1 << bit;
                }
            }
            result[i] = (byte) ((result[i] & ~mask) | (theirs[i] & mask));
        }
        return HyperVector.fromBytes(base.dimension(), result);
    }

    private static String stripNonAlphanumeric(String word) {
        int start = 0;
        int end = word.length();
        while (start < end && !Character.isLetterOrDigit(word.charAt(start))) start++;
        while (end > start && !Character.isLetterOrDigit(word.charAt(end - 1))) end--;
        return word.substring(start, end);
    }
}
