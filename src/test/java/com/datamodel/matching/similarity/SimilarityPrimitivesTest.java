package com.datamodel.matching.similarity;

import com.datamodel.matching.core.model.ColumnStatistics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SimilarityPrimitivesTest {

    private static final double EPSILON = 1e-9;

    private TokenSortSimilarity tokenSort;
    private DatatypeCompatibility datatypeCompatibility;
    private SemanticHintScorer semanticHints;
    private ColumnEvidenceScorer evidence;

    @BeforeEach
    void setUp() {
        tokenSort = new TokenSortSimilarity();
        datatypeCompatibility = new DatatypeCompatibility();
        semanticHints = new SemanticHintScorer();
        evidence = new ColumnEvidenceScorer();
    }

    // ============ Token sort ============

    @Test
    @DisplayName("TokenSort: identical strings return 1.0")
    void testTokenSortIdentical() {
        assertEquals(1.0, tokenSort.compute("member_id", "member_id"));
        assertEquals(1.0, tokenSort.compute("Member ID", "member id"));
    }

    @Test
    @DisplayName("TokenSort: word order is ignored")
    void testTokenSortWordOrder() {
        assertEquals(1.0, tokenSort.compute("birth date", "date birth"));
        assertEquals(1.0, tokenSort.compute("  date   of birth", "birth of date "));
    }

    @Test
    @DisplayName("TokenSort: null or blank strings score 0.0")
    void testTokenSortNullBlank() {
        assertEquals(0.0, tokenSort.compute(null, "claim_id"));
        assertEquals(0.0, tokenSort.compute("claim_id", null));
        assertEquals(0.0, tokenSort.compute("", "claim_id"));
        assertEquals(0.0, tokenSort.compute("claim_id", "   "));
    }

    @Test
    @DisplayName("TokenSort: separators other than whitespace are significant")
    void testTokenSortSeparator() {
        // LCS 15 over 32 characters
        assertEquals(0.9375, tokenSort.compute("claim_identifier", "claim identifier"), EPSILON);
    }

    @ParameterizedTest
    @DisplayName("TokenSort: symmetric and bounded")
    @CsvSource({
            "member_id,memberid",
            "dob,date_of_birth",
            "provider name,name provider",
            "abc,xyz",
            "claim_line_id,line_id"
    })
    void testTokenSortSymmetricAndBounded(String a, String b) {
        double ab = tokenSort.compute(a, b);
        double ba = tokenSort.compute(b, a);
        assertEquals(ab, ba, EPSILON);
        assertTrue(ab >= 0.0 && ab <= 1.0, "Score out of range: " + ab);
    }

    @Test
    @DisplayName("TokenSort: completely different strings score 0.0")
    void testTokenSortDisjoint() {
        assertEquals(0.0, tokenSort.compute("abc", "xyz"));
    }

    // ============ Datatype compatibility ============

    @ParameterizedTest
    @DisplayName("Datatype: bucket and weak-pair scores")
    @CsvSource({
            "varchar,text,1.0",
            "integer,bigint,1.0",
            "DECIMAL,float,1.0",
            "timestamp,date,1.0",
            "string,int,0.25",
            "string,numeric,0.25",
            "decimal,smallint,0.25",
            "date,int,0.0",
            "date,varchar,0.0",
            "uuid,uuid,1.0",
            "uuid,guid,0.0",
            "uuid,varchar,0.0"
    })
    void testDatatypeScores(String attributeType, String columnType, double expected) {
        assertEquals(expected, datatypeCompatibility.score(attributeType, columnType), EPSILON);
    }

    @Test
    @DisplayName("Datatype: blank or null types score 0.0")
    void testDatatypeBlank() {
        assertEquals(0.0, datatypeCompatibility.score(null, "int"));
        assertEquals(0.0, datatypeCompatibility.score("int", " "));
    }

    @Test
    @DisplayName("Datatype: names are trimmed and case-insensitive")
    void testDatatypeNormalization() {
        assertEquals(1.0, datatypeCompatibility.score(" VARCHAR ", "Text"));
        assertEquals(1.0, datatypeCompatibility.score("character varying", "nvarchar"));
    }

    @Test
    @DisplayName("DatatypeBucket: resolves aliases")
    void testBucketAliases() {
        assertEquals(DatatypeBucket.INT, DatatypeBucket.fromAlias("Number").orElseThrow());
        assertTrue(DatatypeBucket.fromAlias("blob").isEmpty());
        assertTrue(DatatypeBucket.fromAlias(null).isEmpty());
    }

    // ============ Semantic hints ============

    @ParameterizedTest
    @DisplayName("Semantic: keyword alignment scores")
    @CsvSource({
            "identifier,member_id,1.0",
            "date_of_birth,dob,1.0",
            "birth date,patient_birth_dt,1.0",
            "gender,patient_sex,1.0",
            "npi,provider_code,0.5",
            "amount,paid_amount,0.0"
    })
    void testSemanticScores(String semanticType, String columnName, double expected) {
        assertEquals(expected, semanticHints.score(semanticType, columnName), EPSILON);
    }

    @Test
    @DisplayName("Semantic: missing inputs score 0.0")
    void testSemanticMissing() {
        assertEquals(0.0, semanticHints.score(null, "member_id"));
        assertEquals(0.0, semanticHints.score("identifier", ""));
    }

    @Test
    @DisplayName("Semantic: custom hint tables replace the defaults")
    void testSemanticCustomHints() {
        SemanticHintScorer custom = new SemanticHintScorer(Map.of("mrn", List.of("mrn", "medical record")));
        assertEquals(1.0, custom.score("medical record number", "patient_mrn"));
        assertEquals(0.0, custom.score("identifier", "member_id"));
    }

    // ============ Column evidence ============

    @Test
    @DisplayName("Evidence: complete and unique id column scores 1.0")
    void testEvidenceCompleteUniqueId() {
        ColumnStatistics stats = ColumnStatistics.of(Map.of(
                "null_pct", 0.01, "distinct_count", 1000, "row_count", 1000));
        assertEquals(1.0, evidence.score("member_id", stats), EPSILON);
    }

    @Test
    @DisplayName("Evidence: null ratio derived from null and total counts")
    void testEvidenceDerivedNullRatio() {
        ColumnStatistics stats = ColumnStatistics.of(Map.of("nulls", 10, "total", 100));
        assertEquals(0.4, evidence.score("status", stats), EPSILON);
        assertEquals(0.1, evidence.nullRatio(stats).orElseThrow(), EPSILON);
    }

    @Test
    @DisplayName("Evidence: low-cardinality non-id column gets categorical bonus")
    void testEvidenceCategorical() {
        ColumnStatistics stats = ColumnStatistics.of(Map.of("null_pct", 0.5, "distinct", 5, "count", 100));
        assertEquals(0.2, evidence.score("status", stats), EPSILON);
    }

    @Test
    @DisplayName("Evidence: a zero-valued ratio key counts as present")
    void testEvidenceZeroRatioPresent() {
        ColumnStatistics stats = ColumnStatistics.of(Map.of("null_pct", 0, "null_ratio", 0.9));
        assertEquals(0.6, evidence.score("status", stats), EPSILON);
    }

    @Test
    @DisplayName("Evidence: numeric strings are parsed, other values ignored")
    void testEvidenceParsing() {
        assertEquals(0.6, evidence.score("status", ColumnStatistics.of(Map.of("null_pct", "0.02"))), EPSILON);
        assertEquals(0.0, evidence.score("status", ColumnStatistics.of(Map.of("null_pct", "n/a"))), EPSILON);
    }

    @Test
    @DisplayName("Evidence: no statistics score 0.0")
    void testEvidenceEmpty() {
        assertEquals(0.0, evidence.score("member_id", ColumnStatistics.empty()));
        assertEquals(0.0, evidence.score("member_id", null));
    }
}
