package com.evaluate.interviewprep.model;

import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor
public class Gap {
    String skill;
    int importance;
    String suggestion;
}
