package com.evaluate.interviewprep.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CommunicationScore {
    double clarity;
    double articulation;
    double structure;
    double professionalism;
    double total;
    Grade grade;
}
