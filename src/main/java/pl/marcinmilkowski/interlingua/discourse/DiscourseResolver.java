package pl.marcinmilkowski.interlingua.discourse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.interlingua.config.InterlinguaConfig;
import pl.marcinmilkowski.interlingua.error.UnresolvedEntityException;
import pl.marcinmilkowski.interlingua.lexicon.QuestionFrame;
import pl.marcinmilkowski.interlingua.lexicon.QuestionWord;
import pl.marcinmilkowski.interlingua.symbol.GraphTriple;
import pl.marcinmilkowski.interlingua.symbol.KnowledgeGraph;
import pl.marcinmilkowski.interlingua.symbol.SymbolId;
import pl.marcinmilkowski.interlingua.tree.Conjunction;
import pl.marcinmilkowski.interlingua.tree.DiscourseFrame;
import pl.marcinmilkowski.interlingua.tree.PointOfView;
import pl.marcinmilkowski.interlingua.tree.QueryFocus;
import pl.marcinmilkowski.interlingua.tree.SemanticTree;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns a question about a graph subject into a framed answer tree.
 *
 * <p>Resolution follows at most one {@code refers-to} link from the subject
 * (so {@code you} can point at {@code self}), derives the point of view and
 * the query focus, then filters, ranks and truncates the subject's triples.</p>
 */
public class DiscourseResolver {
    private static final Logger logger = LoggerFactory.getLogger(DiscourseResolver.class);

    public static final String REFERS_TO = "refers-to";
    public static final String SELF_LABEL = "self";
    public static final String RESPONSE_DETAIL = "discourse:response-detail";

    private static final Set<String> DEPRIORITIZED = Set.of("has-state", "has-status", "refers-to");

    private static final Set<String> INFRASTRUCTURE = Set.of(
        "asks-about", "is-question-word", "discourse-type", "has-discourse-role");

    private static final List<String> METADATA_PREFIXES = List.of(
        "desc:", "status:", "priority:", "criteria:", "goal:", "agent:", "episode:",
        "summary:", "tag:", "discourse:");

    private static final Map<QueryFocus, Set<String>> FOCUS_PREDICATES = Map.of(
        QueryFocus.IDENTITY, Set.of("is-a", "has-name", "powered-by", "named"),
        QueryFocus.DEFINITION, Set.of("is-a", "defined-as", "means", "has-definition"),
        QueryFocus.LOCATION, Set.of("located-in", "part-of"),
        QueryFocus.CAUSE, Set.of("causes", "caused-by", "has-reason", "because-of"),
        QueryFocus.TIME, Set.of("occurred-at", "has-date", "during", "happened-in"),
        QueryFocus.CAPABILITY, Set.of("has-capability", "can", "capable-of", "can-do"));

    private final KnowledgeGraph graph;
    private final InterlinguaConfig.DiscourseSettings settings;

    public DiscourseResolver(KnowledgeGraph graph) {
        this(graph, InterlinguaConfig.defaults().discourse());
    }

    public DiscourseResolver(KnowledgeGraph graph, InterlinguaConfig.DiscourseSettings settings) {
        this.graph = graph;
        this.settings = settings;
    }

    /**
     * Builds the discourse context for a parsed question.
     */
    public DiscourseContext resolve(QuestionFrame frame, String originalInput) throws UnresolvedEntityException {
        return resolve(frame.subject(), frame.questionKind(), frame.capability(), originalInput);
    }

    /**
     * @param questionWord may be {@code null}
     * @throws UnresolvedEntityException if the subject is not in the graph
     */
    public DiscourseContext resolve(String subject, QuestionWord questionWord, boolean capability,
                                    String originalInput) throws UnresolvedEntityException {
        SymbolId subjectId = graph.resolveSymbol(subject)
            .orElseThrow(() -> new UnresolvedEntityException(subject));

        String resolvedLabel = graph.resolveLabel(subjectId);
        SymbolId resolvedId = subjectId;
        boolean pronounResolved = false;
        Optional<SymbolId> refersTo = graph.resolveSymbol(REFERS_TO);
        if (refersTo.isPresent()) {
            for (GraphTriple t : graph.triplesFrom(subjectId)) {
                if (t.predicate().equals(refersTo.get())) {
                    resolvedId = t.object();
                    resolvedLabel = graph.resolveLabel(t.object());
                    pronounResolved = true;
                    break;
                }
            }
        }

        PointOfView pov = pointOfView(resolvedLabel, pronounResolved);
        QueryFocus focus = classifyFocus(questionWord, capability);
        logger.debug("Discourse for '{}': resolved={}, pov={}, focus={}", subject, resolvedLabel, pov, focus);
        return new DiscourseContext(resolvedLabel, resolvedId, subject, pronounResolved, pov, focus,
            questionWord, originalInput);
    }

    static PointOfView pointOfView(String resolvedLabel, boolean pronounResolved) {
        if (resolvedLabel.toLowerCase(Locale.ROOT).equals(SELF_LABEL)) {
            return PointOfView.FIRST_PERSON;
        }
        return pronounResolved ? PointOfView.SECOND_PERSON : PointOfView.THIRD_PERSON;
    }

    /**
     * Maps a question word to a focus; a capability modal overrides it.
     */
    public static QueryFocus classifyFocus(QuestionWord questionWord, boolean capability) {
        if (capability) {
            return QueryFocus.CAPABILITY;
        }
        if (questionWord == null) {
            return QueryFocus.GENERAL;
        }
        switch (questionWord) {
            case WHO:
            case WHAT:
                return QueryFocus.IDENTITY;
            case HOW:
                return QueryFocus.METHOD;
            case WHY:
                return QueryFocus.CAUSE;
            case WHERE:
                return QueryFocus.LOCATION;
            case WHEN:
                return QueryFocus.TIME;
            case WHICH:
                return QueryFocus.DEFINITION;
            default:
                return QueryFocus.CONFIRMATION;
        }
    }

    /**
     * Relevance of a predicate to a focus. Negative scores are dropped from responses.
     */
    public int score(String predicate, QueryFocus focus) {
        int score = 0;
        if (matchesFocus(predicate, focus)) {
            score += settings.focusBonus();
        } else if (DEPRIORITIZED.contains(predicate)) {
            score -= settings.deprioritizedPenalty();
        }
        if (predicate.equals("is-a")) {
            score += settings.isABonus();
        }
        return score;
    }

    private static boolean matchesFocus(String predicate, QueryFocus focus) {
        if (focus == QueryFocus.METHOD) {
            return predicate.contains("method") || predicate.contains("process") || predicate.equals("has-capability");
        }
        Set<String> allowed = FOCUS_PREDICATES.get(focus);
        return allowed != null && allowed.contains(predicate);
    }

    static boolean isMetadataLabel(String label) {
        for (String prefix : METADATA_PREFIXES) {
            if (label.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isUnresolved(String label) {
        return label.isEmpty() || label.startsWith("sym:");
    }

    /**
     * Detail level asserted on the subject through {@code discourse:response-detail},
     * or {@link ResponseDetail#NORMAL}.
     */
    public ResponseDetail responseDetail(SymbolId subject) {
        for (GraphTriple t : graph.triplesFrom(subject)) {
            if (graph.resolveLabel(t.predicate()).equals(RESPONSE_DETAIL)) {
                Optional<ResponseDetail> detail = ResponseDetail.fromLabel(graph.resolveLabel(t.object()));
                if (detail.isPresent()) {
                    return detail.get();
                }
            }
        }
        return ResponseDetail.NORMAL;
    }

    private int limit(ResponseDetail detail) {
        switch (detail) {
            case CONCISE:
                return settings.conciseLimit();
            case NORMAL:
                return settings.normalLimit();
            default:
                return Integer.MAX_VALUE;
        }
    }

    private record Ranked(GraphTriple triple, String predicate, int score) {
    }

    /**
     * Answers from the subject's own triples.
     */
    public Optional<SemanticTree> buildResponse(DiscourseContext ctx) {
        return buildResponse(graph.triplesFrom(ctx.subjectId()), ctx);
    }

    /**
     * Filters, ranks and truncates candidate triples and wraps them in a
     * {@link DiscourseFrame}. Empty when nothing survives filtering.
     */
    public Optional<SemanticTree> buildResponse(List<GraphTriple> triples, DiscourseContext ctx) {
        Set<List<SymbolId>> seen = new HashSet<>();
        List<Ranked> ranked = new ArrayList<>();
        for (GraphTriple t : triples) {
            if (!seen.add(List.of(t.subject(), t.predicate(), t.object()))) {
                continue;
            }
            String predicate = graph.resolveLabel(t.predicate());
            String subject = graph.resolveLabel(t.subject());
            String object = graph.resolveLabel(t.object());
            if (INFRASTRUCTURE.contains(predicate) || predicate.equals(REFERS_TO)) {
                continue;
            }
            if (isMetadataLabel(predicate) || isMetadataLabel(subject) || isMetadataLabel(object)) {
                continue;
            }
            if (isUnresolved(predicate) || isUnresolved(subject) || isUnresolved(object)) {
                continue;
            }
            int score = score(predicate, ctx.focus());
            if (score < 0) {
                continue;
            }
            ranked.add(new Ranked(t, predicate, score));
        }
        if (ranked.isEmpty()) {
            return Optional.empty();
        }

        ranked.sort(Comparator.comparingInt(Ranked::score).reversed());
        int limit = limit(responseDetail(ctx.subjectId()));
        if (ranked.size() > limit) {
            ranked = new ArrayList<>(ranked.subList(0, limit));
        }
        ranked.sort(Comparator.comparing(r -> PredicateCategory.of(r.predicate())));

        List<SemanticTree> items = new ArrayList<>();
        for (Ranked r : ranked) {
            items.add(TripleBridge.toTree(r.triple(), graph));
        }
        SemanticTree inner = items.size() == 1 ? items.get(0) : new Conjunction(items, true);
        return Optional.of(new DiscourseFrame(inner, ctx.pointOfView(), ctx.focus()));
    }
}
