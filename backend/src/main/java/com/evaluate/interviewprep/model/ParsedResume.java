package com.evaluate.interviewprep.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class ParsedResume {
    String rawText;
    Map<String, String> sections;
    String format;
    Instant parsedAt;
}
