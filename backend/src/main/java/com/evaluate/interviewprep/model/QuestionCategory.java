package com.evaluate.interviewprep.model;

import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor
public class QuestionCategory {
    String name;
    double weight;
    boolean technicalFocus;
}
