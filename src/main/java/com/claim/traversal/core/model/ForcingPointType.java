package com.claim.traversal.core.model;

import java.util.Optional;

/**
 * Kind of decision a forcing point asks the user to make.
 */
public enum ForcingPointType {
    /** Applicability of a gate; failing it prunes the gated claims. */
    CONDITIONAL("conditional"),

    /** Pairwise choice; the rejected side is pruned. */
    CONFLICT("conflict");

    private final String value;

    ForcingPointType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Optional<ForcingPointType> fromValue(String value) {
        for (ForcingPointType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
