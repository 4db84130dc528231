package com.datamodel.matching.relationship;

import com.datamodel.matching.core.model.Cardinality;

/**
 * Classifies relationship cardinality from the observed child-per-parent mean.
 *
 * <ul>
 *   <li>unknown mean or mean &gt; 1.2: one-to-many</li>
 *   <li>0.8 &lt;= mean &lt;= 1.2: one-to-one</li>
 *   <li>otherwise undetermined; callers keep the proposed type</li>
 * </ul>
 */
public class CardinalityClassifier {

    public static final double ONE_TO_ONE_LOWER = 0.8;
    public static final double ONE_TO_ONE_UPPER = 1.2;

    public Cardinality classify(Double childPerParentMean) {
        if (childPerParentMean == null) {
            return Cardinality.ONE_TO_MANY;
        }
        double mean = childPerParentMean;
        if (mean > ONE_TO_ONE_UPPER) {
            return Cardinality.ONE_TO_MANY;
        }
        if (mean >= ONE_TO_ONE_LOWER) {
            return Cardinality.ONE_TO_ONE;
        }
        return Cardinality.UNDETERMINED;
    }
}
