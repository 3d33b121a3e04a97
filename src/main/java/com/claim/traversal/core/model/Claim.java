package com.claim.traversal.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A normalized claim: an extracted position with a label, optional elaboration
 * and provenance into source statements. Immutable; identity is {@link #getId()}.
 */
public final class Claim implements Identifiable {

    private final String id;
    private final String label;
    private final String text;
    private final List<String> sourceStatementIds;

    private Claim(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        this.label = builder.label != null && !builder.label.isBlank() ? builder.label : id;
        this.text = builder.text;
        this.sourceStatementIds = builder.sourceStatementIds != null
                ? List.copyOf(builder.sourceStatementIds) : List.of();
    }

    @Override
    public String getId() {
        return id;
    }

    public String getLabel() {
        return label;
    }

    public String getText() {
        return text;
    }

    public List<String> getSourceStatementIds() {
        return sourceStatementIds;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Claim claim = (Claim) o;
        return Objects.equals(id, claim.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Claim{" +
                "id='" + id + '\'' +
                ", label='" + label + '\'' +
                '}';
    }

    public static Claim of(String id, String label) {
        return builder().id(id).label(label).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String label;
        private String text;
        private List<String> sourceStatementIds;

        private Builder() {}

        public Builder id(String id) { this.id = id; return this; }
        public Builder label(String label) { this.label = label; return this; }
        public Builder text(String text) { this.text = text; return this; }
        public Builder sourceStatementIds(List<String> sourceStatementIds) { this.sourceStatementIds = sourceStatementIds; return this; }

        public Claim build() {
            return new Claim(this);
        }
    }
}
