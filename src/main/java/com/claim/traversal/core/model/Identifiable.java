package com.claim.traversal.core.model;

/**
 * Anything that carries a claim id.
 * Used to seed traversal state and to filter claim lists by status.
 */
public interface Identifiable {

    String getId();
}
