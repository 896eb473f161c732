package com.evaluate.interviewprep.exception;

/** Base type for every error the interview engine reports to its callers. */
public class InterviewException extends RuntimeException {

    public InterviewException(String message) {
        super(message);
    }

    public InterviewException(String message, Throwable cause) {
        super(message, cause);
    }
}
