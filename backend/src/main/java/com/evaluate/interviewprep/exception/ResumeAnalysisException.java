package com.evaluate.interviewprep.exception;

/** Raised by resume analyzers. The session layer degrades it into a minimal analysis. */
public class ResumeAnalysisException extends InterviewException {

    public ResumeAnalysisException(String message) {
        super(message);
    }

    public ResumeAnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
