package com.evaluate.interviewprep.repository;

import com.evaluate.interviewprep.model.InterviewSession;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Process-local store. Sessions are lost on restart. */
@Repository
public class InMemorySessionStore implements SessionStore {

    private final Map<String, InterviewSession> sessions = new ConcurrentHashMap<>();

    @Override
    public Optional<InterviewSession> findById(String sessionId) {
        return sessionId == null ? Optional.empty() : Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public InterviewSession save(InterviewSession session) {
        sessions.put(session.getId(), session);
        return session;
    }

    @Override
    public boolean deleteById(String sessionId) {
        return sessionId != null && sessions.remove(sessionId) != null;
    }

    @Override
    public boolean existsById(String sessionId) {
        return sessionId != null && sessions.containsKey(sessionId);
    }

    @Override
    public int count() {
        return sessions.size();
    }
}
