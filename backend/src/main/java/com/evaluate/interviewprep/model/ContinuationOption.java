package com.evaluate.interviewprep.model;

import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor
public class ContinuationOption {
    String id;
    String label;
    String description;
    ContinuationOptions continuationOptions;
}
