package com.evaluate.interviewprep.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Progress with durations flattened to minutes for clients. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ProgressDto {
    private int totalQuestions;
    private int answeredQuestions;
    private int currentQuestionIndex;
    private double percentComplete;
    private Double estimatedMinutesRemaining;
    private double expectedDurationMinutes;
}
