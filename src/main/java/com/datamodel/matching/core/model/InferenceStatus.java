package com.datamodel.matching.core.model;

import java.util.Locale;

/**
 * Review state of a relationship row with respect to evidence-based inference.
 *
 * <p>Inference re-runs may only move a row as encoded here: user-authored rows
 * without machine evidence are left alone, rejected rows are re-proposed when fresh
 * evidence arrives, and approved rows keep their status.</p>
 */
public enum InferenceStatus {

    /** User-authored. */
    MANUAL {
        @Override
        public boolean acceptsEvidence(boolean hasEvidence) {
            return hasEvidence;
        }

        @Override
        public InferenceStatus afterEvidence() {
            return PENDING;
        }
    },

    /** Machine-proposed, awaiting review. */
    PENDING {
        @Override
        public boolean acceptsEvidence(boolean hasEvidence) {
            return true;
        }

        @Override
        public InferenceStatus afterEvidence() {
            return PENDING;
        }
    },

    APPROVED {
        @Override
        public boolean acceptsEvidence(boolean hasEvidence) {
            return true;
        }

        @Override
        public InferenceStatus afterEvidence() {
            return APPROVED;
        }
    },

    REJECTED {
        @Override
        public boolean acceptsEvidence(boolean hasEvidence) {
            return true;
        }

        @Override
        public InferenceStatus afterEvidence() {
            return PENDING;
        }
    };

    /**
     * Whether an inference run may update a row in this state.
     *
     * @param hasEvidence whether the row already carries machine evidence
     */
    public abstract boolean acceptsEvidence(boolean hasEvidence);

    /**
     * State of the row after inference attaches fresh evidence.
     */
    public abstract InferenceStatus afterEvidence();

    /**
     * Whether a reviewer may approve or reject a row in this state.
     */
    public boolean isReviewable() {
        return this != MANUAL;
    }

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
