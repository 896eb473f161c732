package com.evaluate.interviewprep.model;

import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor
public class Improvement {
    String category;
    Priority priority;
    String observation;
    String suggestion;
}
