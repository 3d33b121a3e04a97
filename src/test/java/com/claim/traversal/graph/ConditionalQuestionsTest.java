package com.claim.traversal.graph;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class ConditionalQuestionsTest {

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "g1", "Condition: g1", " Condition: g1 "})
    @DisplayName("Placeholder questions are recognized")
    void recognizesPlaceholders(String question) {
        assertTrue(ConditionalQuestions.isPlaceholder(question, "g1"));
        assertFalse(ConditionalQuestions.isReal(question, "g1"));
    }

    @Test
    @DisplayName("Null question is a placeholder")
    void nullIsPlaceholder() {
        assertTrue(ConditionalQuestions.isPlaceholder(null, "g1"));
        assertFalse(ConditionalQuestions.isReal(null, "g1"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"placeholder_3", "  placeholder_budget"})
    @DisplayName("Generated questions are not placeholders but lose a merge")
    void generatedQuestions(String question) {
        assertFalse(ConditionalQuestions.isPlaceholder(question, "g1"));
        assertFalse(ConditionalQuestions.isReal(question, "g1"));
    }

    @Test
    @DisplayName("Real questions are kept")
    void realQuestions() {
        assertTrue(ConditionalQuestions.isReal("Do you rent?", "g1"));
        assertTrue(ConditionalQuestions.isReal("Condition: g2", "g1"));
        assertTrue(ConditionalQuestions.isReal("g1", null));
        assertFalse(ConditionalQuestions.isPlaceholder("Do you rent?", "g1"));
    }
}
