package com.claim.traversal.core.model;

/**
 * One side of a conflict forcing point.
 *
 * @param claimId the claim this option stands for
 * @param label   display label of the claim
 * @param text    optional elaboration, may be {@code null}
 */
public record ConflictOption(String claimId, String label, String text) {

    public static ConflictOption of(Claim claim) {
        return new ConflictOption(claim.getId(), claim.getLabel(), claim.getText());
    }
}
