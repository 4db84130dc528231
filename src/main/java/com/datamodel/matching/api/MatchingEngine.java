package com.datamodel.matching.api;

import com.datamodel.matching.core.model.AttributeMappingPlan;
import com.datamodel.matching.core.model.Cardinality;
import com.datamodel.matching.core.model.ColumnStatistics;
import com.datamodel.matching.core.model.FkEvidence;
import com.datamodel.matching.core.model.LogicalEntity;
import com.datamodel.matching.core.model.LogicalModel;
import com.datamodel.matching.core.model.MeceReport;
import com.datamodel.matching.core.model.PhysicalTable;
import com.datamodel.matching.core.model.RelationshipProposal;
import com.datamodel.matching.coverage.MeceAnalyzer;
import com.datamodel.matching.coverage.MeceOptions;
import com.datamodel.matching.coverage.OntologyCoverageAnalyzer;
import com.datamodel.matching.mapping.InMemoryMappingRepository;
import com.datamodel.matching.mapping.MappingDraftService;
import com.datamodel.matching.mapping.MappingPlanner;
import com.datamodel.matching.mapping.MappingRepository;
import com.datamodel.matching.mapping.PlannerOptions;
import com.datamodel.matching.metrics.MetricsService;
import com.datamodel.matching.metrics.NoOpMetricsService;
import com.datamodel.matching.ontology.Ontology;
import com.datamodel.matching.ontology.OntologyLoader;
import com.datamodel.matching.payload.PayloadAdapter;
import com.datamodel.matching.relationship.CardinalityClassifier;
import com.datamodel.matching.relationship.DomainDirectory;
import com.datamodel.matching.relationship.InMemoryDomainDirectory;
import com.datamodel.matching.relationship.InMemoryRelationshipRepository;
import com.datamodel.matching.relationship.RelationshipEnricher;
import com.datamodel.matching.relationship.RelationshipEvidenceCalculator;
import com.datamodel.matching.relationship.RelationshipInferenceService;
import com.datamodel.matching.relationship.RelationshipRepository;
import com.datamodel.matching.similarity.CandidateConfidenceScorer;
import com.datamodel.matching.similarity.TokenSortSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Main entry point for the matching library.
 * Wires the planner, relationship inference and MECE analysis around one ontology.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * MatchingEngine engine = MatchingEngine.builder()
 *     .plannerOptions(new PlannerOptions(5))
 *     .build();
 *
 * List&lt;AttributeMappingPlan&gt; plans = engine.autoplan(entity, tables);
 * MeceReport report = engine.analyzeMece(modelJson);
 * </pre>
 */
public class MatchingEngine {
    private static final Logger log = LoggerFactory.getLogger(MatchingEngine.class);

    private final Ontology ontology;
    private final MappingPlanner planner;
    private final MappingDraftService mappingDraftService;
    private final RelationshipEvidenceCalculator evidenceCalculator;
    private final CardinalityClassifier cardinalityClassifier;
    private final RelationshipEnricher relationshipEnricher;
    private final RelationshipInferenceService relationshipInferenceService;
    private final MeceAnalyzer meceAnalyzer;
    private final OntologyCoverageAnalyzer coverageAnalyzer;

    private MatchingEngine(Builder builder) {
        MetricsService metrics = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        this.ontology = builder.ontology != null ? builder.ontology : new OntologyLoader().loadDefault();

        this.planner = new MappingPlanner(new CandidateConfidenceScorer(), builder.plannerOptions, metrics);
        MappingRepository mappingRepository = builder.mappingRepository != null
                ? builder.mappingRepository
                : new InMemoryMappingRepository();
        this.mappingDraftService = new MappingDraftService(planner, mappingRepository, metrics);

        this.evidenceCalculator = new RelationshipEvidenceCalculator();
        this.cardinalityClassifier = new CardinalityClassifier();
        this.relationshipEnricher = new RelationshipEnricher();
        DomainDirectory domainDirectory = builder.domainDirectory != null
                ? builder.domainDirectory
                : new InMemoryDomainDirectory();
        RelationshipRepository relationshipRepository = builder.relationshipRepository != null
                ? builder.relationshipRepository
                : new InMemoryRelationshipRepository();
        this.relationshipInferenceService =
                new RelationshipInferenceService(domainDirectory, relationshipRepository, metrics);

        this.meceAnalyzer = new MeceAnalyzer(ontology, new TokenSortSimilarity(), builder.meceOptions,
                new PayloadAdapter(), metrics);
        this.coverageAnalyzer = new OntologyCoverageAnalyzer(ontology, domainDirectory);

        log.info("MatchingEngine initialized with {} ontology entities, maxCandidates={}",
                ontology.entities().size(), builder.plannerOptions.maxCandidates());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Ranks candidate columns for each attribute of {@code entity}.
     */
    public List<AttributeMappingPlan> autoplan(LogicalEntity entity, List<PhysicalTable> tables) {
        return planner.autoplan(entity, tables);
    }

    /**
     * Computes foreign-key coverage and fan-out from child and parent key statistics.
     */
    public FkEvidence evidenceForFk(ColumnStatistics childStats, ColumnStatistics parentStats) {
        return evidenceCalculator.evidenceForFk(childStats, parentStats);
    }

    public Cardinality classifyCardinality(Double childPerParentMean) {
        return cardinalityClassifier.classify(childPerParentMean);
    }

    /**
     * Attaches evidence to proposals and resolves their cardinality.
     */
    public List<RelationshipProposal> enrichRelationships(List<RelationshipProposal> proposals,
                                                          List<LogicalEntity> entities,
                                                          List<PhysicalTable> tables) {
        return relationshipEnricher.enrich(proposals, entities, tables);
    }

    public MeceReport analyzeMece(LogicalModel model) {
        return meceAnalyzer.analyze(model);
    }

    /**
     * Parses and analyzes a model JSON document.
     *
     * @throws com.datamodel.matching.exception.ModelValidationException if the text is not a JSON object
     */
    public MeceReport analyzeMece(String modelJson) {
        return meceAnalyzer.analyze(modelJson);
    }

    public Ontology getOntology() {
        return ontology;
    }

    public MappingPlanner getPlanner() {
        return planner;
    }

    public MappingDraftService getMappingDraftService() {
        return mappingDraftService;
    }

    public RelationshipInferenceService getRelationshipInferenceService() {
        return relationshipInferenceService;
    }

    public MeceAnalyzer getMeceAnalyzer() {
        return meceAnalyzer;
    }

    public OntologyCoverageAnalyzer getCoverageAnalyzer() {
        return coverageAnalyzer;
    }

    public static class Builder {
        private Ontology ontology;
        private PlannerOptions plannerOptions = PlannerOptions.defaults();
        private MeceOptions meceOptions = MeceOptions.defaults();
        private MetricsService metricsService;
        private MappingRepository mappingRepository;
        private RelationshipRepository relationshipRepository;
        private DomainDirectory domainDirectory;

        /**
         * Sets the reference ontology. Defaults to the bundled healthcare payor ontology.
         */
        public Builder ontology(Ontology ontology) {
            this.ontology = ontology;
            return this;
        }

        public Builder plannerOptions(PlannerOptions plannerOptions) {
            this.plannerOptions = plannerOptions;
            return this;
        }

        public Builder meceOptions(MeceOptions meceOptions) {
            this.meceOptions = meceOptions;
            return this;
        }

        /**
         * Sets a custom metrics service.
         * Defaults to {@link NoOpMetricsService} if not set.
         */
        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder mappingRepository(MappingRepository mappingRepository) {
            this.mappingRepository = mappingRepository;
            return this;
        }

        public Builder relationshipRepository(RelationshipRepository relationshipRepository) {
            this.relationshipRepository = relationshipRepository;
            return this;
        }

        /**
         * Sets the lookup used by relationship inference and coverage analysis.
         */
        public Builder domainDirectory(DomainDirectory domainDirectory) {
            this.domainDirectory = domainDirectory;
            return this;
        }

        public MatchingEngine build() {
            if (plannerOptions == null) {
                throw new IllegalStateException("PlannerOptions is required");
            }
            if (meceOptions == null) {
                throw new IllegalStateException("MeceOptions is required");
            }
            return new MatchingEngine(this);
        }
    }
}
