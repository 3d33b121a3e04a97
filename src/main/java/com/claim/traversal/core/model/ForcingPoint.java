package com.claim.traversal.core.model;

import java.util.List;
import java.util.Objects;

/**
 * One user-facing decision extracted from the decision graph.
 *
 * <p>Conditionals sit on tier 0 and carry {@link #getAffectedClaims()}; conflicts sit on
 * tier 1 or higher and carry {@link #getOptions()} plus, when the upstream graph
 * recorded them, the ids of the gates that must be satisfied first.</p>
 *
 * <p>Forcing points are computed once per traversal and never change afterwards.</p>
 */
public final class ForcingPoint {

    private final String id;
    private final ForcingPointType type;
    private final int tier;
    private final String question;
    private final String condition;
    private final List<String> affectedClaims;
    private final List<ConflictOption> options;
    private final List<String> blockedByGateIds;
    private final List<String> sourceStatementIds;

    private ForcingPoint(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.type = Objects.requireNonNull(builder.type, "type is required");
        this.tier = builder.tier;
        this.question = Objects.requireNonNull(builder.question, "question is required");
        this.condition = Objects.requireNonNull(builder.condition, "condition is required");
        this.affectedClaims = builder.affectedClaims != null ? List.copyOf(builder.affectedClaims) : List.of();
        this.options = builder.options != null ? List.copyOf(builder.options) : List.of();
        this.blockedByGateIds = builder.blockedByGateIds != null ? List.copyOf(builder.blockedByGateIds) : List.of();
        this.sourceStatementIds = builder.sourceStatementIds != null ? List.copyOf(builder.sourceStatementIds) : List.of();
    }

    public String getId() { return id; }
    public ForcingPointType getType() { return type; }
    public int getTier() { return tier; }
    public String getQuestion() { return question; }
    public String getCondition() { return condition; }
    public List<String> getAffectedClaims() { return affectedClaims; }
    public List<ConflictOption> getOptions() { return options; }
    public List<String> getBlockedByGateIds() { return blockedByGateIds; }
    public List<String> getSourceStatementIds() { return sourceStatementIds; }

    public boolean isConditional() {
        return type == ForcingPointType.CONDITIONAL;
    }

    public boolean isConflict() {
        return type == ForcingPointType.CONFLICT;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ForcingPoint that = (ForcingPoint) o;
        return tier == that.tier &&
                id.equals(that.id) &&
                type == that.type &&
                question.equals(that.question) &&
                condition.equals(that.condition) &&
                affectedClaims.equals(that.affectedClaims) &&
                options.equals(that.options) &&
                blockedByGateIds.equals(that.blockedByGateIds) &&
                sourceStatementIds.equals(that.sourceStatementIds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, type, tier, question, condition, affectedClaims, options,
                blockedByGateIds, sourceStatementIds);
    }

    @Override
    public String toString() {
        return "ForcingPoint{" +
                "id='" + id + '\'' +
                ", type=" + type +
                ", tier=" + tier +
                ", condition='" + condition + '\'' +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private ForcingPointType type;
        private int tier;
        private String question;
        private String condition;
        private List<String> affectedClaims;
        private List<ConflictOption> options;
        private List<String> blockedByGateIds;
        private List<String> sourceStatementIds;

        private Builder() {}

        public Builder id(String id) { this.id = id; return this; }
        public Builder type(ForcingPointType type) { this.type = type; return this; }
        public Builder tier(int tier) { this.tier = tier; return this; }
        public Builder question(String question) { this.question = question; return this; }
        public Builder condition(String condition) { this.condition = condition; return this; }
        public Builder affectedClaims(List<String> affectedClaims) { this.affectedClaims = affectedClaims; return this; }
        public Builder options(List<ConflictOption> options) { this.options = options; return this; }
        public Builder blockedByGateIds(List<String> blockedByGateIds) { this.blockedByGateIds = blockedByGateIds; return this; }
        public Builder sourceStatementIds(List<String> sourceStatementIds) { this.sourceStatementIds = sourceStatementIds; return this; }

        public ForcingPoint build() {
            return new ForcingPoint(this);
        }
    }
}
