package com.datamodel.matching.similarity;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Scores how well a logical attribute datatype fits a physical column datatype.
 *
 * <ul>
 *   <li>1.0 when both resolve to the same {@link DatatypeBucket}</li>
 *   <li>0.25 for the weakly compatible pairs string/decimal, string/int and decimal/int</li>
 *   <li>unknown type names compare by literal equality</li>
 *   <li>0.0 otherwise, or when either side is blank</li>
 * </ul>
 */
public class DatatypeCompatibility {

    public static final double EXACT = 1.0;
    public static final double WEAK = 0.25;

    private static final Set<Set<DatatypeBucket>> WEAK_PAIRS = Set.of(
            EnumSet.of(DatatypeBucket.STRING, DatatypeBucket.DECIMAL),
            EnumSet.of(DatatypeBucket.STRING, DatatypeBucket.INT),
            EnumSet.of(DatatypeBucket.DECIMAL, DatatypeBucket.INT)
    );

    public double score(String attributeType, String columnType) {
        String attrNorm = normalize(attributeType);
        String colNorm = normalize(columnType);
        if (attrNorm.isEmpty() || colNorm.isEmpty()) {
            return 0.0;
        }

        Optional<DatatypeBucket> attrBucket = DatatypeBucket.fromAlias(attrNorm);
        Optional<DatatypeBucket> colBucket = DatatypeBucket.fromAlias(colNorm);

        if (attrBucket.isEmpty() || colBucket.isEmpty()) {
            // Unknown names only match themselves
            return attrNorm.equals(colNorm) ? EXACT : 0.0;
        }
        if (attrBucket.get() == colBucket.get()) {
            return EXACT;
        }
        if (WEAK_PAIRS.contains(EnumSet.of(attrBucket.get(), colBucket.get()))) {
            return WEAK;
        }
        return 0.0;
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}
