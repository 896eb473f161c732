package com.evaluate.interviewprep.exception;

import lombok.Getter;

import java.util.List;

@Getter
public class InvalidInputException extends InterviewException {

    private final List<String> validOptions;

    public InvalidInputException(String message, List<String> validOptions) {
        super(message + ". Valid options: " + String.join(", ", validOptions));
        this.validOptions = List.copyOf(validOptions);
    }
}
