package com.evaluate.interviewprep.model;

import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;

@Value
@AllArgsConstructor
public class AdaptedResponse {
    String content;
    BehaviorType style;
    List<String> adjustments;
}
