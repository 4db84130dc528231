package com.datamodel.matching.similarity;

import com.datamodel.matching.core.model.ColumnStatistics;
import com.datamodel.matching.core.model.ComponentScores;
import com.datamodel.matching.core.model.LogicalAttribute;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Blends name, datatype, semantic and evidence signals into one confidence value.
 * Formula: confidence = min(1, 0.5*name + 0.2*dtype + 0.2*semantic + 0.1*evidence)
 *
 * <p>The semantic signal reads the attribute's semantic type, or its name when no
 * semantic type was supplied.</p>
 */
public class CandidateConfidenceScorer {
    private static final Logger log = LoggerFactory.getLogger(CandidateConfidenceScorer.class);

    private final SimilarityAlgorithm nameSimilarity;
    private final DatatypeCompatibility datatypeCompatibility;
    private final SemanticHintScorer semanticHintScorer;
    private final ColumnEvidenceScorer columnEvidenceScorer;
    private final SignalWeights weights;

    public CandidateConfidenceScorer() {
        this(new TokenSortSimilarity());
    }

    public CandidateConfidenceScorer(SimilarityAlgorithm nameSimilarity) {
        this.nameSimilarity = nameSimilarity;
        this.datatypeCompatibility = new DatatypeCompatibility();
        this.semanticHintScorer = new SemanticHintScorer();
        this.columnEvidenceScorer = new ColumnEvidenceScorer();
        this.weights = SignalWeights.CONTRACT;
    }

    /**
     * Computes the blended confidence of mapping {@code attribute} onto a column.
     */
    public double confidence(LogicalAttribute attribute, String columnName, String columnType,
                             ColumnStatistics stats) {
        return score(attribute, columnName, columnType, stats).confidence();
    }

    /**
     * Computes the blended confidence together with its per-signal breakdown.
     */
    public CandidateScore score(LogicalAttribute attribute, String columnName, String columnType,
                                ColumnStatistics stats) {
        if (attribute == null || columnName == null) {
            return new CandidateScore(ComponentScores.zero(), 0.0);
        }

        String semanticSource = attribute.semanticType() != null && !attribute.semanticType().isBlank()
                ? attribute.semanticType()
                : attribute.name();

        ComponentScores scores = new ComponentScores(
                nameSimilarity.compute(attribute.name(), columnName),
                datatypeCompatibility.score(attribute.datatype(), columnType),
                semanticHintScorer.score(semanticSource, columnName),
                columnEvidenceScorer.score(columnName, stats)
        );

        double combined = weights.nameWeight() * scores.name()
                + weights.dtypeWeight() * scores.dtype()
                + weights.semanticWeight() * scores.semantic()
                + weights.evidenceWeight() * scores.evidence();
        double confidence = Math.max(0.0, Math.min(combined, 1.0));

        log.debug("Candidate scores for '{}' vs '{}': {}, confidence={}",
                attribute.name(), columnName, scores, confidence);

        return new CandidateScore(scores, confidence);
    }

    public SignalWeights getWeights() {
        return weights;
    }

    public SimilarityAlgorithm getNameSimilarity() {
        return nameSimilarity;
    }

    /**
     * Confidence with the signal breakdown that produced it.
     */
    public record CandidateScore(ComponentScores scores, double confidence) {
    }
}
