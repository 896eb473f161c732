package com.evaluate.interviewprep.repository;

import com.evaluate.interviewprep.model.InterviewSession;

import java.util.Optional;

/**
 * Keyed storage for live interview sessions.
 */
public interface SessionStore {

    Optional<InterviewSession> findById(String sessionId);

    InterviewSession save(InterviewSession session);

    boolean deleteById(String sessionId);

    boolean existsById(String sessionId);

    int count();
}
