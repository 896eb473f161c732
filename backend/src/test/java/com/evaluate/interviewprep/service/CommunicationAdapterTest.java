package com.evaluate.interviewprep.service;

import com.evaluate.interviewprep.model.AdaptedResponse;
import com.evaluate.interviewprep.model.BehaviorType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CommunicationAdapterTest {

    private final CommunicationAdapter adapter = new CommunicationAdapter();

    @Test
    void edgeCaseListsValidAlternatives() {
        AdaptedResponse adapted = adapter.adaptResponse("Questions can't be skipped.", BehaviorType.EDGE_CASE);

        assertEquals(BehaviorType.EDGE_CASE, adapted.getStyle());
        assertTrue(adapted.getContent().contains("Questions can't be skipped."));
        assertTrue(adapted.getContent().contains("Answer the current question"));
        assertTrue(adapted.getContent().contains("Request clarification"));
        assertTrue(adapted.getContent().contains("End the interview early"));
        assertFalse(adapted.getAdjustments().isEmpty());
    }

    @Test
    void efficientKeepsTheFirstThreeLines() {
        AdaptedResponse adapted = adapter.adaptResponse("one\ntwo\nthree\nfour\nfive", BehaviorType.EFFICIENT);
        assertEquals("one\ntwo\nthree", adapted.getContent());
    }

    @Test
    void confusedAddsClarifyingGuidance() {
        AdaptedResponse adapted = adapter.adaptResponse("Describe a hash map.", BehaviorType.CONFUSED);
        assertTrue(adapted.getContent().startsWith("Let me help clarify: Describe a hash map."));
    }

    @Test
    void standardLeavesContentUnchanged() {
        AdaptedResponse adapted = adapter.adaptResponse("Next question.", BehaviorType.STANDARD);
        assertEquals("Next question.", adapted.getContent());
        assertTrue(adapted.getAdjustments().isEmpty());
    }

    @Test
    void acknowledgmentsAndTransitionsDifferByStyle() {
        assertNotEquals(adapter.getAcknowledgment(BehaviorType.CHATTY), adapter.getAcknowledgment(BehaviorType.EFFICIENT));
        assertEquals("Next question:", adapter.getTransition(BehaviorType.EFFICIENT));
        assertEquals("Here's your next question:", adapter.getTransition(BehaviorType.STANDARD));
    }
}
