package com.evaluate.interviewprep.model;

import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;

@Value
@AllArgsConstructor
public class Strength {
    String area;
    List<String> evidence;
    double relevance;
}
