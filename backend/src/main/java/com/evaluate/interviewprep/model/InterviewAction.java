package com.evaluate.interviewprep.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class InterviewAction {
    ActionType type;
    InterviewQuestion question;
    FeedbackReport feedback;
    String message;
}
