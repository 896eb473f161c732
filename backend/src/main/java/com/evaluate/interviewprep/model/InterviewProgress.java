package com.evaluate.interviewprep.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder
public class InterviewProgress {
    int totalQuestions;
    int answeredQuestions;
    int currentQuestionIndex;
    double percentComplete;
    Duration estimatedTimeRemaining;
    Duration expectedDuration;
}
