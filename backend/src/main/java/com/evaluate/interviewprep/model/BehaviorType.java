package com.evaluate.interviewprep.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum BehaviorType {
    CONFUSED("confused"),
    EFFICIENT("efficient"),
    CHATTY("chatty"),
    EDGE_CASE("edge-case"),
    STANDARD("standard");

    private final String value;

    BehaviorType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static BehaviorType fromValue(String value) {
        return Arrays.stream(values())
                .filter(type -> type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown behavior type: " + value));
    }
}
