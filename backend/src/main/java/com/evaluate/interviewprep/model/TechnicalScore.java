package com.evaluate.interviewprep.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TechnicalScore {
    double depth;
    double accuracy;
    double relevance;
    double problemSolving;
    double total;
    Grade grade;
}
