package com.claim.traversal.graph;

/**
 * Recognizes placeholder questions emitted upstream when no real question was written.
 *
 * <p>Two rules apply. {@link #isPlaceholder} decides whether the extractor synthesizes
 * wording. {@link #isReal} decides which question a merge keeps; it also passes over
 * generated {@code placeholder_} questions.</p>
 */
public final class ConditionalQuestions {

    static final String PLACEHOLDER_PREFIX = "placeholder_";
    static final String CONDITION_PREFIX = "Condition: ";

    private ConditionalQuestions() {
        // utility class
    }

    /**
     * A question is a placeholder when it is blank, equal to the conditional id,
     * or equal to {@code "Condition: {id}"}.
     *
     * @param question the question text, may be {@code null}
     * @param id       the conditional id, may be {@code null} for unlabeled conditionals
     */
    public static boolean isPlaceholder(String question, String id) {
        if (question == null || question.isBlank()) {
            return true;
        }
        String q = question.trim();
        return id != null && !id.isEmpty() && (q.equals(id) || q.equals(CONDITION_PREFIX + id));
    }

    /**
     * Whether a merge should prefer this question: not a placeholder and not
     * starting with {@code placeholder_}.
     */
    public static boolean isReal(String question, String id) {
        return !isPlaceholder(question, id) && !question.trim().startsWith(PLACEHOLDER_PREFIX);
    }
}
