package com.evaluate.interviewprep.model;

import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor
public class ScoringRubric {
    CommunicationScore communication;
    TechnicalScore technical;
    OverallScore overall;
}
