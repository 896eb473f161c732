package com.evaluate.interviewprep.model;

import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor
public class OverallScore {
    double score;
    Grade grade;
}
