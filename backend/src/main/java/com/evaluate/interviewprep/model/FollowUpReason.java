package com.evaluate.interviewprep.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum FollowUpReason {
    TOO_SHORT("too-short"),
    INSUFFICIENT_DEPTH("insufficient-depth"),
    INCOMPLETE_COVERAGE("incomplete-coverage"),
    UNCLEAR_EXPLANATION("unclear-explanation");

    private final String value;

    FollowUpReason(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static FollowUpReason fromValue(String value) {
        return Arrays.stream(values())
                .filter(item -> item.value.equalsIgnoreCase(value) || item.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown FollowUpReason: " + value));
    }
}
