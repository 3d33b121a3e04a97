package com.claim.traversal.extract;

/**
 * Options for forcing point extraction.
 * Controls the wording synthesized for placeholder conditionals and the tier given to conflicts.
 */
public class ExtractionOptions {

    private static final String DEFAULT_FALLBACK_QUESTION = "Is this applicable to your situation?";
    private static final int DEFAULT_AFFECTED_LABEL_PREVIEW_LIMIT = 3;
    private static final int DEFAULT_CONFLICT_TIER = 1;

    private final String fallbackConditionalQuestion;
    private final int affectedLabelPreviewLimit;
    private final int conflictTier;

    private ExtractionOptions(Builder builder) {
        this.fallbackConditionalQuestion = builder.fallbackConditionalQuestion;
        this.affectedLabelPreviewLimit = builder.affectedLabelPreviewLimit;
        this.conflictTier = builder.conflictTier;
    }

    public String getFallbackConditionalQuestion() {
        return fallbackConditionalQuestion;
    }

    public int getAffectedLabelPreviewLimit() {
        return affectedLabelPreviewLimit;
    }

    public int getConflictTier() {
        return conflictTier;
    }

    /**
     * Creates default options.
     */
    public static ExtractionOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String fallbackConditionalQuestion = DEFAULT_FALLBACK_QUESTION;
        private int affectedLabelPreviewLimit = DEFAULT_AFFECTED_LABEL_PREVIEW_LIMIT;
        private int conflictTier = DEFAULT_CONFLICT_TIER;

        public Builder fallbackConditionalQuestion(String question) {
            this.fallbackConditionalQuestion = question;
            return this;
        }

        public Builder affectedLabelPreviewLimit(int limit) {
            this.affectedLabelPreviewLimit = limit;
            return this;
        }

        public Builder conflictTier(int tier) {
            this.conflictTier = tier;
            return this;
        }

        public ExtractionOptions build() {
            if (fallbackConditionalQuestion == null || fallbackConditionalQuestion.isBlank()) {
                throw new IllegalArgumentException("fallbackConditionalQuestion must not be blank");
            }
            if (affectedLabelPreviewLimit < 1) {
                throw new IllegalArgumentException("affectedLabelPreviewLimit must be at least 1");
            }
            if (conflictTier < 1) {
                throw new IllegalArgumentException("conflictTier must be at least 1, conditionals own tier 0");
            }
            return new ExtractionOptions(this);
        }
    }

    @Override
    public String toString() {
        return "ExtractionOptions{" +
                "fallbackConditionalQuestion='" + fallbackConditionalQuestion + '\'' +
                ", affectedLabelPreviewLimit=" + affectedLabelPreviewLimit +
                ", conflictTier=" + conflictTier +
                '}';
    }
}
