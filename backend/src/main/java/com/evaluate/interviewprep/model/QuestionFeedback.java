package com.evaluate.interviewprep.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class QuestionFeedback {
    InterviewQuestion question;
    CandidateResponse response;
    ResponseEvaluation evaluation;
    String feedback;
}
