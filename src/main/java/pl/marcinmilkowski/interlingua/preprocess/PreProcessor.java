package pl.marcinmilkowski.interlingua.preprocess;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.interlingua.config.InterlinguaConfig;
import pl.marcinmilkowski.interlingua.config.InterlinguaConfig.PreprocessSettings;
import pl.marcinmilkowski.interlingua.error.VsaException;
import pl.marcinmilkowski.interlingua.lexicon.Language;
import pl.marcinmilkowski.interlingua.parser.ParseContext;
import pl.marcinmilkowski.interlingua.parser.ParseResult;
import pl.marcinmilkowski.interlingua.parser.ProseParser;
import pl.marcinmilkowski.interlingua.resolve.EntityResolver;
import pl.marcinmilkowski.interlingua.tree.Conjunction;
import pl.marcinmilkowski.interlingua.tree.SemanticTree;
import pl.marcinmilkowski.interlingua.tree.Triple;
import pl.marcinmilkowski.interlingua.tree.WithConfidence;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Turns raw multilingual text into entities, claims and semantic trees
 * for downstream ingestion.
 *
 * <p>Each chunk is language-detected (a chunk's own language hint wins),
 * parsed with that language's lexicon, and every triple found yields two
 * entities and one claim. Entities are then canonicalized through the
 * {@link EntityResolver}.</p>
 */
public class PreProcessor {
    private static final Logger logger = LoggerFactory.getLogger(PreProcessor.class);

    private final ProseParser parser;
    private final EntityResolver resolver;
    private final PreprocessSettings settings;

    public PreProcessor() {
        this(InterlinguaConfig.defaults());
    }

    public PreProcessor(InterlinguaConfig config) {
        this(new ProseParser(config), new EntityResolver(), config.preprocess());
    }

    public PreProcessor(ProseParser parser, EntityResolver resolver, PreprocessSettings settings) {
        this.parser = parser;
        this.resolver = resolver;
        this.settings = settings;
    }

    public EntityResolver resolver() {
        return resolver;
    }

    /**
     * Pre-process a single chunk.
     *
     * @throws VsaException if token resolution against the context's index fails
     */
    public PreProcessorOutput preprocessChunk(TextChunk chunk, ParseContext ctx) throws VsaException {
        DetectionResult detection = LanguageDetector.detect(chunk.text());
        Language language = chunk.language() == null
            ? detection.language()
            : Language.fromCode(chunk.language()).orElse(detection.language());
        String code = language.code();
        ParseContext parseCtx = ctx.withLanguage(language);

        List<ExtractedEntity> entities = new ArrayList<>();
        List<ExtractedClaim> claims = new ArrayList<>();
        List<SemanticTree> trees = new ArrayList<>();

        ParseResult result = parser.parseProse(chunk.text(), parseCtx);
        if (result instanceof ParseResult.Facts facts) {
            for (SemanticTree fact : facts.trees()) {
                extract(fact, chunk.text(), code, entities, claims);
                trees.add(fact);
            }
        } else if (result instanceof ParseResult.Freeform freeform) {
            if (freeform.partial().isEmpty()) {
                logger.debug("No structure in chunk {}, retrying sentence by sentence", chunk.id());
                for (String sentence : freeform.text().split("\\.")) {
                    String trimmed = sentence.trim();
                    if (trimmed.isEmpty()) {
                        continue;
                    }
                    if (parser.parseProse(trimmed, parseCtx) instanceof ParseResult.Facts facts) {
                        for (SemanticTree fact : facts.trees()) {
                            extract(fact, trimmed, code, entities, claims);
                            trees.add(fact);
                        }
                    }
                }
            } else {
                for (SemanticTree tree : freeform.partial()) {
                    extract(tree, chunk.text(), code, entities, claims);
                    trees.add(tree);
                }
            }
            if (trees.isEmpty()) {
                logger.warn("Chunk {} yielded no claims: '{}'", chunk.id(), abbreviate(chunk.text()));
            }
        }

        List<ExtractedEntity> resolved = resolver.resolveEntities(entities);
        return new PreProcessorOutput(chunk.id(), code, detection.confidence(), resolved, claims, trees);
    }

    /**
     * Pre-process chunks on a worker pool. Output order matches input order.
     */
    public List<PreProcessorOutput> preprocessBatch(List<TextChunk> chunks, ParseContext ctx)
            throws VsaException, InterruptedException {
        if (chunks.isEmpty()) {
            return List.of();
        }
        int threads = Math.max(1, Math.min(settings.batchWorkers(), chunks.size()));
        if (threads == 1) {
            List<PreProcessorOutput> outputs = new ArrayList<>(chunks.size());
            for (TextChunk chunk : chunks) {
                outputs.add(preprocessChunk(chunk, ctx));
            }
            return outputs;
        }

        ExecutorService executor = Executors.newFixedThreadPool(threads);
        List<Future<PreProcessorOutput>> futures = new ArrayList<>(chunks.size());
        List<PreProcessorOutput> outputs = new ArrayList<>(chunks.size());
        try {
            for (TextChunk chunk : chunks) {
                futures.add(executor.submit(() -> preprocessChunk(chunk, ctx)));
            }
            for (Future<PreProcessorOutput> future : futures) {
                try {
                    outputs.add(future.get());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw ie;
                } catch (ExecutionException ee) {
                    Throwable cause = ee.getCause();
                    if (cause instanceof VsaException vsa) {
                        throw vsa;
                    }
                    throw new IllegalStateException("Chunk preprocessing failed", cause);
                }
            }
        } finally {
            executor.shutdownNow();
            executor.awaitTermination(1, TimeUnit.MINUTES);
        }
        logger.info("Preprocessed {} chunks with {} workers", outputs.size(), threads);
        return outputs;
    }

    /**
     * Split mixed-language text into sentences and pre-process each with its own detected language.
     */
    public List<PreProcessorOutput> preprocessMixedCorpus(String text, ParseContext ctx) throws VsaException {
        List<PreProcessorOutput> outputs = new ArrayList<>();
        for (LanguageDetector.SentenceDetection sd : LanguageDetector.detectPerSentence(text)) {
            TextChunk chunk = new TextChunk(null, sd.sentence(), sd.detection().language().code());
            outputs.add(preprocessChunk(chunk, ctx));
        }
        return outputs;
    }

    /**
     * Pre-process a batch, then learn cross-lingual equivalences from chunks
     * that share an id prefix.
     */
    public BatchResult preprocessBatchWithLearning(List<TextChunk> chunks, ParseContext ctx)
            throws VsaException, InterruptedException {
        List<PreProcessorOutput> outputs = preprocessBatch(chunks, ctx);
        return new BatchResult(outputs, resolver.learnFromParallelChunks(outputs));
    }

    public record BatchResult(List<PreProcessorOutput> outputs, int discovered) {
    }

    private void extract(SemanticTree tree, String claimText, String language,
                         List<ExtractedEntity> entities, List<ExtractedClaim> claims) {
        if (tree instanceof Triple triple) {
            String subject = triple.subject().nodeLabel().orElse("?");
            String predicate = triple.predicate().nodeLabel().orElse("?");
            String object = triple.object().nodeLabel().orElse("?");
            double confidence = settings.defaultClaimConfidence();

            entities.add(ExtractedEntity.of(subject, EntityType.infer(predicate, true), confidence, language));
            entities.add(ExtractedEntity.of(object, EntityType.infer(predicate, false), confidence, language));
            claims.add(new ExtractedClaim(claimText, ClaimType.forPredicate(predicate), confidence,
                subject, predicate, object, language));
        } else if (tree instanceof WithConfidence wc) {
            int claimsBefore = claims.size();
            extract(wc.inner(), claimText, language, entities, claims);
            if (claims.size() > claimsBefore) {
                int last = claims.size() - 1;
                claims.set(last, claims.get(last).withConfidence(wc.confidence()));
                int n = entities.size();
                entities.set(n - 1, entities.get(n - 1).withConfidence(wc.confidence()));
                entities.set(n - 2, entities.get(n - 2).withConfidence(wc.confidence()));
            }
        } else if (tree instanceof Conjunction conjunction) {
            for (SemanticTree item : conjunction.items()) {
                extract(item, claimText, language, entities, claims);
            }
        }
    }

    private static String abbreviate(String text) {
        return text.length() <= 60 ? text : text.substring(0, 57) + "...";
    }
}
