package com.evaluate.interviewprep.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle actions and the states each one may be taken from.
 * A {@code null} target means the action leaves the status unchanged.
 */
public enum SessionAction {
    UPLOAD_RESUME("upload resume", EnumSet.of(SessionStatus.INITIALIZED), null),
    START_INTERVIEW("start interview", EnumSet.of(SessionStatus.INITIALIZED), SessionStatus.IN_PROGRESS),
    SUBMIT_RESPONSE("submit response", EnumSet.of(SessionStatus.IN_PROGRESS), null),
    COMPLETE("complete interview", EnumSet.of(SessionStatus.IN_PROGRESS), SessionStatus.COMPLETED),
    END_EARLY("end interview early", EnumSet.of(SessionStatus.IN_PROGRESS), SessionStatus.ENDED_EARLY),
    GET_CONTINUATION("get continuation options",
            EnumSet.of(SessionStatus.COMPLETED, SessionStatus.ENDED_EARLY), null);

    private final String displayName;
    private final Set<SessionStatus> validFrom;
    private final SessionStatus target;

    SessionAction(String displayName, Set<SessionStatus> validFrom, SessionStatus target) {
        this.displayName = displayName;
        this.validFrom = validFrom;
        this.target = target;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isAllowedFrom(SessionStatus status) {
        return validFrom.contains(status);
    }

    public SessionStatus resultingStatus(SessionStatus current) {
        return target != null ? target : current;
    }
}
