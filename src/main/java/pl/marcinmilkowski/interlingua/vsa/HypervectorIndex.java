package pl.marcinmilkowski.interlingua.vsa;

import org.apache.lucene.codecs.Codec;
import org.apache.lucene.codecs.FilterCodec;
import org.apache.lucene.codecs.KnnVectorsFormat;
import org.apache.lucene.codecs.lucene99.Lucene99HnswVectorsFormat;
import org.apache.lucene.codecs.perfield.PerFieldKnnVectorsFormat;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.KnnFloatVectorField;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.Term;
import org.apache.lucene.index.VectorSimilarityFunction;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.KnnFloatVectorQuery;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.store.Directory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.interlingua.config.InterlinguaConfig;
import pl.marcinmilkowski.interlingua.error.VsaException;
import pl.marcinmilkowski.interlingua.symbol.SymbolId;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Symbol to hypervector store with approximate nearest-neighbour search.
 *
 * Two structures back the index:
 * - an exact {@link ConcurrentHashMap} from symbol to vector
 * - an in-memory Lucene HNSW graph over the bipolar (+1/-1) float view of each vector
 *
 * Lucene scores Euclidean hits as {@code 1 / (1 + d^2)}. For bipolar vectors
 * {@code d^2 = 4 * hamming}, so the score converts back to the same similarity
 * {@link VsaOps#similarity} reports.
 *
 * Locking: inserts and searches share the read lock ({@link IndexWriter} is thread-safe);
 * reader refresh and {@link #close()} take the write lock. Writers to the map and the
 * graph are serialized on {@code mutations} so both always hold the same vector for a symbol.
 */
public class HypervectorIndex implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(HypervectorIndex.class);

    static final String FIELD_VECTOR = "vector";
    static final String FIELD_SYMBOL = "symbol";
    static final String FIELD_SYMBOL_ID = "symbol_id";

    private final VsaOps ops;
    private final Map<SymbolId, HyperVector> vectors = new ConcurrentHashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final AtomicBoolean dirty = new AtomicBoolean(false);
    private final Object mutations = new Object();

    private final Directory directory;
    private final IndexWriter writer;
    private DirectoryReader reader;
    private volatile IndexSearcher searcher;
    private boolean closed;

    public HypervectorIndex(VsaOps ops) {
        this(ops, InterlinguaConfig.defaults().vsa());
    }

    /**
     * Creates an index for vectors of the given algebra's dimension.
     *
     * @throws IllegalArgumentException if the dimension exceeds what the HNSW field accepts
     */
    public HypervectorIndex(VsaOps ops, InterlinguaConfig.VsaSettings settings) {
        if (ops.dimension() > InterlinguaConfig.MAX_DIMENSION) {
            throw new IllegalArgumentException("ANN index supports at most "
                + InterlinguaConfig.MAX_DIMENSION + " dimensions, got " + ops.dimension());
        }
        this.ops = ops;
        this.directory = new ByteBuffersDirectory();

        KnnVectorsFormat hnsw = new Lucene99HnswVectorsFormat(settings.annMaxConnections(), settings.annBeamWidth());
        Codec base = Codec.getDefault();
        IndexWriterConfig config = new IndexWriterConfig();
        config.setCodec(new FilterCodec(base.getName(), base) {
            private final KnnVectorsFormat perField = new PerFieldKnnVectorsFormat() {
                @Override
                public KnnVectorsFormat getKnnVectorsFormatForField(String field) {
                    return hnsw;
                }
            };

            @Override
            public KnnVectorsFormat knnVectorsFormat() {
                return perField;
            }
        });

        try {
            this.writer = new IndexWriter(directory, config);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to open in-memory vector index", e);
        }
        logger.info("Hypervector index initialized (dimension: {}, maxConn: {}, beamWidth: {})",
            ops.dimension(), settings.annMaxConnections(), settings.annBeamWidth());
    }

    public VsaOps ops() {
        return ops;
    }

    public int dimension() {
        return ops.dimension();
    }

    /**
     * Vector for a symbol, created from its id and inserted on first use.
     * Repeated calls return equal vectors.
     */
    public HyperVector getOrCreate(SymbolId symbol) throws VsaException {
        HyperVector existing = vectors.get(symbol);
        if (existing != null) {
            return existing;
        }
        HyperVector created = ops.encodeSymbol(symbol);
        synchronized (mutations) {
            HyperVector raced = vectors.putIfAbsent(symbol, created);
            if (raced != null) {
                return raced;
            }
            indexVector(symbol, created);
            return created;
        }
    }

    /**
     * Store a vector for a symbol, replacing any earlier one in both the map and the ANN graph.
     */
    public void insert(SymbolId symbol, HyperVector vector) throws VsaException {
        if (vector.dimension() != ops.dimension()) {
            throw VsaException.dimensionMismatch(ops.dimension(), vector.dimension());
        }
        synchronized (mutations) {
            vectors.put(symbol, vector);
            indexVector(symbol, vector);
        }
    }

    /**
     * Encode and insert many symbols. Encoding runs in parallel.
     *
     * @return number of symbols newly added
     */
    public int insertBatch(Collection<SymbolId> symbols) throws VsaException {
        List<SymbolId> fresh = symbols.stream().distinct().filter(s -> !vectors.containsKey(s)).toList();
        List<HyperVector> encoded = fresh.parallelStream().map(ops::encodeSymbol).toList();
        int added = 0;
        synchronized (mutations) {
            for (int i = 0; i < fresh.size(); i++) {
                if (vectors.putIfAbsent(fresh.get(i), encoded.get(i)) == null) {
                    indexVector(fresh.get(i), encoded.get(i));
                    added++;
                }
            }
        }
        logger.debug("Batch inserted {} of {} symbols", added, symbols.size());
        return added;
    }

    public Optional<HyperVector> get(SymbolId symbol) {
        return Optional.ofNullable(vectors.get(symbol));
    }

    public boolean contains(SymbolId symbol) {
        return vectors.containsKey(symbol);
    }

    public int size() {
        return vectors.size();
    }

    /**
     * The {@code k} nearest stored symbols, most similar first.
     */
    public List<SearchResult> search(HyperVector query, int k) throws VsaException {
        if (query.dimension() != ops.dimension()) {
            throw VsaException.dimensionMismatch(ops.dimension(), query.dimension());
        }
        if (k <= 0 || vectors.isEmpty()) {
            return List.of();
        }
        refreshIfDirty();

        lock.readLock().lock();
        try {
            ensureOpen();
            IndexSearcher current = searcher;
            if (current == null) {
                return List.of();
            }
            TopDocs top = current.search(new KnnFloatVectorQuery(FIELD_VECTOR, query.toFloats(), k), k);
            StoredFields stored = current.storedFields();
            List<SearchResult> results = new ArrayList<>(top.scoreDocs.length);
            for (ScoreDoc hit : top.scoreDocs) {
                long id = stored.document(hit.doc).getField(FIELD_SYMBOL_ID).numericValue().longValue();
                results.add(new SearchResult(SymbolId.of(id), scoreToSimilarity(hit.score)));
            }
            results.sort((a, b) -> Double.compare(b.similarity(), a.similarity()));
            return results;
        } catch (IOException e) {
            throw new VsaException("ANN search failed: " + e.getMessage(), e);
        } finally {
            lock.readLock().unlock();
        }
    }

    double scoreToSimilarity(float score) {
        if (score <= 0) {
            return 0.0;
        }
        double squaredDistance = 1.0 / score - 1.0;
        double hamming = squaredDistance / 4.0;
        double sim = 1.0 - hamming / ops.dimension();
        return Math.max(0.0, Math.min(1.0, sim));
    }

    private void indexVector(SymbolId symbol, HyperVector vector) throws VsaException {
        Document doc = new Document();
        doc.add(new StringField(FIELD_SYMBOL, symbol.toString(), Field.Store.NO));
        doc.add(new StoredField(FIELD_SYMBOL_ID, symbol.value()));
        doc.add(new KnnFloatVectorField(FIELD_VECTOR, vector.toFloats(), VectorSimilarityFunction.EUCLIDEAN));

        lock.readLock().lock();
        try {
            ensureOpen();
            writer.updateDocument(new Term(FIELD_SYMBOL, symbol.toString()), doc);
            dirty.set(true);
        } catch (IOException e) {
            throw new VsaException("ANN insert failed for symbol " + symbol + ": " + e.getMessage(), e);
        } finally {
            lock.readLock().unlock();
        }
    }

    private void refreshIfDirty() throws VsaException {
        if (!dirty.get()) {
            return;
        }
        lock.writeLock().lock();
        try {
            ensureOpen();
            if (!dirty.getAndSet(false)) {
                return;
            }
            if (reader == null) {
                reader = DirectoryReader.open(writer);
            } else {
                DirectoryReader changed = DirectoryReader.openIfChanged(reader, writer);
                if (changed != null) {
                    reader.close();
                    reader = changed;
                }
            }
            searcher = new IndexSearcher(reader);
        } catch (IOException e) {
            dirty.set(true);
            throw new VsaException("ANN reader refresh failed: " + e.getMessage(), e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void ensureOpen() throws VsaException {
        if (closed) {
            throw new VsaException("hypervector index is closed");
        }
    }

    @Override
    public void close() throws IOException {
        lock.writeLock().lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            searcher = null;
            if (reader != null) {
                reader.close();
            }
            writer.close();
            directory.close();
            logger.info("Hypervector index closed. Total: {} symbols", vectors.size());
        } finally {
            lock.writeLock().unlock();
        }
    }
}
