package com.claim.traversal.core.model;

/**
 * Status of a claim during traversal.
 * Transitions only flow from {@link #ACTIVE} to {@link #PRUNED}.
 */
public enum ClaimStatus {
    /** Claim is still in play. */
    ACTIVE("active"),

    /** Claim was ruled out by a resolution. */
    PRUNED("pruned");

    private final String value;

    ClaimStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Reads a serialized status. Anything other than {@code "pruned"} reads as active.
     */
    public static ClaimStatus fromValue(String value) {
        return PRUNED.value.equalsIgnoreCase(value) ? PRUNED : ACTIVE;
    }
}
