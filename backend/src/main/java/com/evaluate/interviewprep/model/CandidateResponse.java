package com.evaluate.interviewprep.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class CandidateResponse {
    String questionId;
    String text;
    Instant timestamp;
    int wordCount;
    long responseTime;

    public static int countWords(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return text.trim().split("\\s+").length;
    }
}
