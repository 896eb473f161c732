package com.evaluate.interviewprep.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ResponseEvaluation {
    String questionId;
    double depthScore;
    double clarityScore;
    double completenessScore;
    boolean needsFollowUp;
    FollowUpReason followUpReason;
    Double technicalAccuracy;
}
