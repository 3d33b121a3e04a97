package com.claim.traversal.core.model;

import java.util.Objects;

/**
 * A user's answer to one forcing point.
 *
 * <p>Conditional resolutions carry {@link #getSatisfied()} and an optional free-text
 * {@link #getUserInput()}; conflict resolutions carry the selected claim id and label.
 * Fields that do not apply to the resolution type are {@code null}.</p>
 */
public final class Resolution {

    private final String forcingPointId;
    private final ForcingPointType type;
    private final Boolean satisfied;
    private final String userInput;
    private final String selectedClaimId;
    private final String selectedLabel;

    private Resolution(Builder builder) {
        this.forcingPointId = Objects.requireNonNull(builder.forcingPointId, "forcingPointId is required");
        this.type = Objects.requireNonNull(builder.type, "type is required");
        this.satisfied = builder.satisfied;
        this.userInput = builder.userInput;
        this.selectedClaimId = builder.selectedClaimId;
        this.selectedLabel = builder.selectedLabel;
    }

    public static Resolution conditional(String forcingPointId, boolean satisfied, String userInput) {
        return builder()
                .forcingPointId(forcingPointId)
                .type(ForcingPointType.CONDITIONAL)
                .satisfied(satisfied)
                .userInput(userInput)
                .build();
    }

    public static Resolution conflict(String forcingPointId, String selectedClaimId, String selectedLabel) {
        return builder()
                .forcingPointId(forcingPointId)
                .type(ForcingPointType.CONFLICT)
                .selectedClaimId(selectedClaimId)
                .selectedLabel(selectedLabel)
                .build();
    }

    public String getForcingPointId() { return forcingPointId; }
    public ForcingPointType getType() { return type; }
    public Boolean getSatisfied() { return satisfied; }
    public String getUserInput() { return userInput; }
    public String getSelectedClaimId() { return selectedClaimId; }
    public String getSelectedLabel() { return selectedLabel; }

    /**
     * True only for a conditional resolution answered as applicable.
     */
    public boolean isSatisfiedConditional() {
        return type == ForcingPointType.CONDITIONAL && Boolean.TRUE.equals(satisfied);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Resolution that = (Resolution) o;
        return forcingPointId.equals(that.forcingPointId) &&
                type == that.type &&
                Objects.equals(satisfied, that.satisfied) &&
                Objects.equals(userInput, that.userInput) &&
                Objects.equals(selectedClaimId, that.selectedClaimId) &&
                Objects.equals(selectedLabel, that.selectedLabel);
    }

    @Override
    public int hashCode() {
        return Objects.hash(forcingPointId, type, satisfied, userInput, selectedClaimId, selectedLabel);
    }

    @Override
    public String toString() {
        return "Resolution{" +
                "forcingPointId='" + forcingPointId + '\'' +
                ", type=" + type +
                (type == ForcingPointType.CONDITIONAL
                        ? ", satisfied=" + satisfied
                        : ", selectedClaimId='" + selectedClaimId + '\'') +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String forcingPointId;
        private ForcingPointType type;
        private Boolean satisfied;
        private String userInput;
        private String selectedClaimId;
        private String selectedLabel;

        private Builder() {}

        public Builder forcingPointId(String forcingPointId) { this.forcingPointId = forcingPointId; return this; }
        public Builder type(ForcingPointType type) { this.type = type; return this; }
        public Builder satisfied(Boolean satisfied) { this.satisfied = satisfied; return this; }
        public Builder userInput(String userInput) { this.userInput = userInput; return this; }
        public Builder selectedClaimId(String selectedClaimId) { this.selectedClaimId = selectedClaimId; return this; }
        public Builder selectedLabel(String selectedLabel) { this.selectedLabel = selectedLabel; return this; }

        public Resolution build() {
            return new Resolution(this);
        }
    }
}
