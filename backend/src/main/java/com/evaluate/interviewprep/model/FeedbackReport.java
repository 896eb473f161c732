package com.evaluate.interviewprep.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/** Final scored summary of a session. Built once and never modified. */
@Value
@Builder
public class FeedbackReport {
    String sessionId;
    ScoringRubric scores;
    List<String> strengths;
    List<Improvement> improvements;
    AlignmentFeedback resumeAlignment;
    List<QuestionFeedback> questionBreakdown;
    String summary;
    boolean endedEarly;
    int answeredQuestions;
    Instant generatedAt;
}
