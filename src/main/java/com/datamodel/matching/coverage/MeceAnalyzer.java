package com.datamodel.matching.coverage;

import com.datamodel.matching.core.model.CollisionFinding;
import com.datamodel.matching.core.model.CoverageGap;
import com.datamodel.matching.core.model.LogicalAttribute;
import com.datamodel.matching.core.model.LogicalEntity;
import com.datamodel.matching.core.model.LogicalModel;
import com.datamodel.matching.core.model.MeceReport;
import com.datamodel.matching.core.model.NamingSuggestion;
import com.datamodel.matching.logging.LogContext;
import com.datamodel.matching.metrics.MetricsService;
import com.datamodel.matching.metrics.NoOpMetricsService;
import com.datamodel.matching.ontology.Ontology;
import com.datamodel.matching.ontology.OntologyEntity;
import com.datamodel.matching.payload.PayloadAdapter;
import com.datamodel.matching.similarity.SimilarityAlgorithm;
import com.datamodel.matching.similarity.TokenSortSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Evaluates whether a drafted model is Mutually Exclusive and Collectively Exhaustive
 * against the reference ontology.
 *
 * <ul>
 *   <li>Mutually exclusive: no near-duplicate attribute names across entities
 *       ({@link #findCollisions})</li>
 *   <li>Collectively exhaustive: every ontology entity and its preferred attributes
 *       are modeled ({@link #uncoveredTerms})</li>
 * </ul>
 *
 * <p>Both are folded into a single linear score by {@link #meceScore(int, int)}.</p>
 */
public class MeceAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(MeceAnalyzer.class);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final Ontology ontology;
    private final SimilarityAlgorithm nameSimilarity;
    private final MeceOptions options;
    private final PayloadAdapter payloadAdapter;
    private final MetricsService metricsService;

    public MeceAnalyzer(Ontology ontology) {
        this(ontology, new TokenSortSimilarity(), MeceOptions.defaults(), new PayloadAdapter(),
                new NoOpMetricsService());
    }

    public MeceAnalyzer(Ontology ontology, SimilarityAlgorithm nameSimilarity, MeceOptions options,
                        PayloadAdapter payloadAdapter, MetricsService metricsService) {
        this.ontology = ontology;
        this.nameSimilarity = nameSimilarity;
        this.options = options;
        this.payloadAdapter = payloadAdapter;
        this.metricsService = metricsService;
    }

    /**
     * Parses a model JSON document and analyzes it.
     *
     * @throws com.datamodel.matching.exception.ModelValidationException if the text
     *         is not a JSON object
     */
    public MeceReport analyze(String modelJson) {
        return analyze(payloadAdapter.toLogicalModel(payloadAdapter.parseObject(modelJson)));
    }

    /**
     * Runs collision, coverage and naming checks and computes the MECE score.
     */
    public MeceReport analyze(LogicalModel model) {
        try (LogContext ignored = LogContext.forAnalysis(LogContext.generateCorrelationId())) {
            List<CollisionFinding> collisions = findCollisions(model);
            List<CoverageGap> uncovered = uncoveredTerms(model);
            List<NamingSuggestion> suggestions = namingSuggestions(model);
            double score = meceScore(collisions.size(), uncovered.size());

            metricsService.recordCollisionCount(collisions.size());
            metricsService.recordMeceScore(score);
            log.info("model.mece entities={} collisions={} gaps={} suggestions={} score={}",
                    model.entities().size(), collisions.size(), uncovered.size(), suggestions.size(), score);

            return new MeceReport(collisions, uncovered, suggestions, score);
        }
    }

    /**
     * Finds near-duplicate attribute names on different entities using the configured threshold.
     */
    public List<CollisionFinding> findCollisions(LogicalModel model) {
        return findCollisions(model, options.collisionThreshold());
    }

    /**
     * Compares every pair of attributes drawn from different entities and reports the
     * pairs whose name similarity reaches {@code threshold}.
     *
     * <p>Findings are grouped by the exact pair of (entity, attribute) references, so
     * a name shared by three entities yields three overlapping findings rather than
     * one cluster. When a model repeats an entity name the same pair is met more than
     * once; its scores accumulate on the finding created first.</p>
     */
    public List<CollisionFinding> findCollisions(LogicalModel model, double threshold) {
        List<AttributeRef> refs = new ArrayList<>();
        for (LogicalEntity entity : model.entities()) {
            for (LogicalAttribute attribute : entity.attributes()) {
                refs.add(new AttributeRef(entity.name(), attribute.name()));
            }
        }

        Map<PairKey, PendingFinding> grouped = new LinkedHashMap<>();
        for (int i = 0; i < refs.size(); i++) {
            AttributeRef a = refs.get(i);
            for (int j = i + 1; j < refs.size(); j++) {
                AttributeRef b = refs.get(j);
                if (a.entity().equals(b.entity())) {
                    continue;
                }
                double similarity = nameSimilarity.compute(a.attribute(), b.attribute());
                if (similarity < threshold) {
                    continue;
                }
                String representative = b.attribute().length() < a.attribute().length()
                        ? b.attribute()
                        : a.attribute();
                grouped.computeIfAbsent(PairKey.of(a, b), k -> new PendingFinding(a.entity(), b.entity(), representative))
                        .scores.put(a.label() + "~" + b.label(), similarity);
            }
        }

        log.debug("Collision scan over {} attributes found {} pairs at threshold {}",
                refs.size(), grouped.size(), threshold);
        return grouped.values().stream().map(PendingFinding::toFinding).toList();
    }

    /**
     * Lists ontology entities the model does not cover, and for covered entities the
     * preferred attributes that appear neither by name nor by synonym.
     */
    public List<CoverageGap> uncoveredTerms(LogicalModel model) {
        Map<String, Set<String>> modeled = new LinkedHashMap<>();
        for (LogicalEntity entity : model.entities()) {
            String canonical = ontology.canonicalEntityName(entity.name());
            Set<String> names = modeled.computeIfAbsent(canonical, k -> new HashSet<>());
            for (LogicalAttribute attribute : entity.attributes()) {
                names.add(normalize(attribute.name()));
            }
        }

        List<CoverageGap> gaps = new ArrayList<>();
        for (OntologyEntity ontologyEntity : ontology.entities()) {
            Set<String> names = modeled.get(ontologyEntity.canonicalName());
            if (names == null) {
                gaps.add(new CoverageGap(ontologyEntity.canonicalName(), ontologyEntity.preferredAttributeNames()));
                continue;
            }

            List<String> missing = new ArrayList<>();
            for (Map.Entry<String, List<String>> preferred : ontologyEntity.preferredAttributes().entrySet()) {
                boolean covered = names.contains(normalize(preferred.getKey()))
                        || preferred.getValue().stream().map(MeceAnalyzer::normalize).anyMatch(names::contains);
                if (!covered) {
                    missing.add(preferred.getKey());
                }
            }
            if (!missing.isEmpty()) {
                gaps.add(new CoverageGap(ontologyEntity.canonicalName(), missing));
            }
        }
        return gaps;
    }

    /**
     * Suggests canonical names for attributes modeled under a known synonym.
     */
    public List<NamingSuggestion> namingSuggestions(LogicalModel model) {
        List<NamingSuggestion> suggestions = new ArrayList<>();
        for (LogicalEntity entity : model.entities()) {
            String canonical = ontology.canonicalEntityName(entity.name());
            for (LogicalAttribute attribute : entity.attributes()) {
                Optional<String> preferred = ontology.suggestPreferredAttribute(canonical, attribute.name());
                if (preferred.isPresent() && !preferred.get().equals(attribute.name().trim())) {
                    suggestions.add(new NamingSuggestion(entity.name(), attribute.name(), preferred.get()));
                }
            }
        }
        return suggestions;
    }

    /**
     * Linear penalty score: {@code 1 - min(1, 0.5*c/s + 0.5*u/s)} with {@code s} the
     * penalty saturation, rounded to 4 decimals.
     */
    public double meceScore(int collisionCount, int uncoveredCount) {
        double saturation = options.penaltySaturation();
        double penalty = 0.5 * (Math.max(collisionCount, 0) / saturation)
                + 0.5 * (Math.max(uncoveredCount, 0) / saturation);
        double score = 1.0 - Math.min(1.0, penalty);
        score = Math.max(0.0, Math.min(1.0, score));
        return Math.round(score * 10_000d) / 10_000d;
    }

    public double meceScore(List<CollisionFinding> collisions, List<CoverageGap> uncovered) {
        return meceScore(collisions.size(), uncovered.size());
    }

    public Ontology getOntology() {
        return ontology;
    }

    private static String normalize(String value) {
        return value == null ? "" : WHITESPACE.matcher(value.toLowerCase(Locale.ROOT)).replaceAll("");
    }

    private record AttributeRef(String entity, String attribute) {
        String label() {
            return entity + "." + attribute;
        }
    }

    /**
     * Unordered pair of attribute references.
     */
    private record PairKey(AttributeRef first, AttributeRef second) {
        static PairKey of(AttributeRef a, AttributeRef b) {
            int order = a.label().compareTo(b.label());
            return order <= 0 ? new PairKey(a, b) : new PairKey(b, a);
        }
    }

    private static final class PendingFinding {
        private final String entityA;
        private final String entityB;
        private final String attribute;
        private final Map<String, Double> scores = new LinkedHashMap<>();

        PendingFinding(String entityA, String entityB, String attribute) {
            this.entityA = entityA;
            this.entityB = entityB;
            this.attribute = attribute;
        }

        CollisionFinding toFinding() {
            return new CollisionFinding(entityA, entityB, attribute, scores);
        }
    }
}
