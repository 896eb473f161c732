package com.evaluate.interviewprep.service;

import com.evaluate.interviewprep.model.AdaptedResponse;
import com.evaluate.interviewprep.model.BehaviorType;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Rewrites interviewer messages to suit the candidate's current communication style.
 */
@Service
public class CommunicationAdapter {

    static final String EDGE_CASE_OPTIONS = "\n\nHere are the valid options:\n"
            + "- Answer the current question\n"
            + "- Request clarification\n"
            + "- End the interview early\n\n"
            + "What would you like to do?";

    public AdaptedResponse adaptResponse(String content, BehaviorType behaviorType) {
        String text = content == null ? "" : content;
        switch (behaviorType) {
            case CONFUSED:
                return new AdaptedResponse(
                        "Let me help clarify: " + text
                                + "\n\nTake your time, and feel free to ask if you need any part explained further.",
                        BehaviorType.CONFUSED,
                        List.of("Added clarifying guidance", "Included step-by-step explanation", "Simplified language"));
            case EFFICIENT:
                String concise = Arrays.stream(text.split("\n"))
                        .filter(line -> !line.isBlank())
                        .limit(3)
                        .collect(Collectors.joining("\n"));
                return new AdaptedResponse(concise, BehaviorType.EFFICIENT,
                        List.of("Removed unnecessary explanations", "Kept response concise", "Direct communication"));
            case CHATTY:
                return new AdaptedResponse(
                        "Thank you for the detailed response. Let's focus on the key points: " + text
                                + "\n\nFor the next question, try to keep your answer focused on the main points.",
                        BehaviorType.CHATTY,
                        List.of("Added focus redirect", "Encouraged conciseness", "Provided structure guidance"));
            case EDGE_CASE:
                return new AdaptedResponse(
                        "I understand what you're trying to do, but that's not possible in this interview format. "
                                + text + EDGE_CASE_OPTIONS,
                        BehaviorType.EDGE_CASE,
                        List.of("Explained system limitations", "Offered valid alternatives",
                                "Redirected to appropriate actions"));
            case STANDARD:
            default:
                return new AdaptedResponse(text, BehaviorType.STANDARD, List.of());
        }
    }

    public String getAcknowledgment(BehaviorType behaviorType) {
        switch (behaviorType) {
            case CONFUSED:
                return "I see you might need some help. Let me guide you through this.";
            case EFFICIENT:
                return "Great, concise answer.";
            case CHATTY:
                return "Thank you for the thorough response.";
            case EDGE_CASE:
                return "Let me help you with what's possible here.";
            case STANDARD:
            default:
                return "Thank you for your response.";
        }
    }

    public String getTransition(BehaviorType behaviorType) {
        switch (behaviorType) {
            case CONFUSED:
                return "When you're ready, here's the next question:";
            case EFFICIENT:
                return "Next question:";
            case CHATTY:
                return "Let's move on to the next question:";
            case EDGE_CASE:
                return "Let's continue with the interview. Here's the next question:";
            case STANDARD:
            default:
                return "Here's your next question:";
        }
    }
}
