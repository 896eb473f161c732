package com.evaluate.interviewprep.exception;

import com.evaluate.interviewprep.model.SessionAction;
import com.evaluate.interviewprep.model.SessionStatus;
import lombok.Getter;

@Getter
public class InvalidStateTransitionException extends InterviewException {

    private final SessionStatus currentState;
    private final SessionAction attemptedAction;

    public InvalidStateTransitionException(SessionStatus currentState, SessionAction attemptedAction) {
        super("Cannot " + attemptedAction.getDisplayName() + " while session is " + currentState.getValue());
        this.currentState = currentState;
        this.attemptedAction = attemptedAction;
    }
}
