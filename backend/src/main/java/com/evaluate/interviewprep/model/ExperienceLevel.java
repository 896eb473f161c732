package com.evaluate.interviewprep.model;

import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor
public class ExperienceLevel {
    String level;
    int yearsMin;
    int yearsMax;
    int expectedDepth;
}
