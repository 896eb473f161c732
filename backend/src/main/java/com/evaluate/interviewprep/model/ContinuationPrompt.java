package com.evaluate.interviewprep.model;

import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;

@Value
@AllArgsConstructor
public class ContinuationPrompt {
    String message;
    List<ContinuationOption> options;
}
