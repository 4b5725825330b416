package com.lorastudio.evaluation;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TextSimilarityTest {
    @Test
    void shouldTokenizeLowercaseAlphanumericRuns() {
        assertEquals(List.of("refunds", "take", "30", "days", "week"), TextSimilarity.tokens("Refunds take 30 days, a week?"));
    }

    @Test
    void shouldScoreEditRatioAndCosine() {
        assertEquals(1.0 - 3.0 / 7.0, TextSimilarity.editRatio("kitten", "sitting"), 1e-9);
        assertEquals(1.0, TextSimilarity.editRatio("", "  "));
        assertEquals(1.0, TextSimilarity.cosine("Refund window", "refund WINDOW"), 1e-9);
        assertEquals(0.0, TextSimilarity.cosine("refund window", "parking lot"));
        assertEquals(0.5, TextSimilarity.cosine("refund window", "refund policy"), 1e-9);
    }

    @Test
    void shouldDetectRefusalsAndNovelTokens() {
        assertTrue(TextSimilarity.isRefusal("I can't help with that."));
        assertTrue(TextSimilarity.isRefusal("Please ESCALATE to your manager."));
        assertFalse(TextSimilarity.isRefusal("Refunds take 30 days."));
        assertEquals(0.5, TextSimilarity.novelTokenShare("refund window parking lot", "refund window", null));
        assertEquals(0.0, TextSimilarity.novelTokenShare("", "anything"));
    }
}
