package com.evaluate.interviewprep.service;

import com.evaluate.interviewprep.exception.InvalidInputException;
import com.evaluate.interviewprep.exception.InvalidStateTransitionException;
import com.evaluate.interviewprep.exception.ResumeAnalysisException;
import com.evaluate.interviewprep.exception.SessionNotFoundException;
import com.evaluate.interviewprep.model.AlignmentScore;
import com.evaluate.interviewprep.model.ExperienceLevel;
import com.evaluate.interviewprep.model.Gap;
import com.evaluate.interviewprep.model.InteractionMode;
import com.evaluate.interviewprep.model.InterviewSession;
import com.evaluate.interviewprep.model.JobRole;
import com.evaluate.interviewprep.model.ParsedResume;
import com.evaluate.interviewprep.model.ResumeAnalysis;
import com.evaluate.interviewprep.model.ResumeDocument;
import com.evaluate.interviewprep.model.SessionAction;
import com.evaluate.interviewprep.model.SessionStatus;
import com.evaluate.interviewprep.repository.SessionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Arrays;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Owns session records and their lifecycle. Every status change goes through {@link #transition}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionManager {

    private static final int DEGRADED_GAP_IMPORTANCE = 7;

    private final SessionStore sessionStore;
    private final RoleCatalog roleCatalog;
    private final ResumeAnalyzer resumeAnalyzer;

    public InterviewSession createSession(String roleIdOrName, String level, InteractionMode interactionMode) {
        return createSession(roleIdOrName, level, interactionMode, null);
    }

    /** Creates a session whose question set will focus on {@code drillCategory} when it is non-null. */
    public InterviewSession createSession(String roleIdOrName, String level, InteractionMode interactionMode,
                                         String drillCategory) {
        JobRole role = roleCatalog.resolveRole(roleIdOrName);
        ExperienceLevel experienceLevel = roleCatalog.level(level);

        InterviewSession session = new InterviewSession();
        session.setId(UUID.randomUUID().toString());
        session.setRole(role);
        session.setExperienceLevel(experienceLevel);
        session.setInteractionMode(interactionMode != null ? interactionMode : InteractionMode.TEXT);
        session.setStatus(SessionStatus.INITIALIZED);
        session.setDrillCategory(drillCategory);
        sessionStore.save(session);

        log.info("Created session {} for {} ({}){}", session.getId(), role.getId(), experienceLevel.getLevel(),
                drillCategory != null ? ", drilling " + drillCategory : "");
        return session;
    }

    /** Parses a mode name, falling back to text when none is given. */
    public InteractionMode parseInteractionMode(String mode) {
        if (mode == null || mode.isBlank()) {
            return InteractionMode.TEXT;
        }
        try {
            return InteractionMode.fromValue(mode.trim());
        } catch (IllegalArgumentException e) {
            throw new InvalidInputException("Invalid interaction mode '" + mode + "'",
                    Arrays.stream(InteractionMode.values()).map(InteractionMode::getValue).collect(Collectors.toList()));
        }
    }

    public InterviewSession getSession(String sessionId) {
        return sessionStore.findById(sessionId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    public InterviewSession save(InterviewSession session) {
        return sessionStore.save(session);
    }

    public void requireState(InterviewSession session, SessionAction action) {
        if (!action.isAllowedFrom(session.getStatus())) {
            throw new InvalidStateTransitionException(session.getStatus(), action);
        }
    }

    /** Checks the action against the current status and applies its target status. */
    public InterviewSession transition(InterviewSession session, SessionAction action) {
        requireState(session, action);
        SessionStatus previous = session.getStatus();
        SessionStatus next = action.resultingStatus(previous);
        if (next != previous) {
            session.setStatus(next);
            if (next == SessionStatus.IN_PROGRESS) {
                session.setStartTime(Instant.now());
            } else if (next == SessionStatus.COMPLETED || next == SessionStatus.ENDED_EARLY) {
                session.setEndTime(Instant.now());
            }
            log.info("Session {} moved {} -> {}", session.getId(), previous.getValue(), next.getValue());
        }
        sessionStore.save(session);
        return session;
    }

    /**
     * Analyzes and stores a resume. Analyzer failures never reach the caller: the session gets a
     * minimal analysis with zero alignment and every role skill listed as a gap.
     */
    public ResumeAnalysis uploadResume(String sessionId, ResumeDocument document) {
        InterviewSession session = getSession(sessionId);
        requireState(session, SessionAction.UPLOAD_RESUME);

        ResumeAnalysis analysis;
        try {
            analysis = resumeAnalyzer.analyze(document, session.getRole());
        } catch (ResumeAnalysisException e) {
            log.warn("Resume analysis failed for session {}: {}", sessionId, e.getMessage());
            analysis = degradedAnalysis(document, session.getRole());
        }
        session.setResumeAnalysis(analysis);
        transition(session, SessionAction.UPLOAD_RESUME);
        return analysis;
    }

    ResumeAnalysis degradedAnalysis(ResumeDocument document, JobRole role) {
        ParsedResume parsed = ParsedResume.builder()
                .rawText(document != null && document.getContent() != null ? document.getContent() : "")
                .sections(Map.of())
                .format(document != null ? document.getFormat() : "text")
                .parsedAt(Instant.now())
                .build();
        return ResumeAnalysis.builder()
                .parsedResume(parsed)
                .gaps(role.getTechnicalSkills().stream()
                        .map(skill -> new Gap(skill, DEGRADED_GAP_IMPORTANCE,
                                "Consider adding " + skill + " to your skillset or highlighting relevant experience with it."))
                        .collect(Collectors.toList()))
                .alignmentScore(AlignmentScore.zero())
                .summary("Resume parsing encountered errors. The interview will continue with general questions for the "
                        + role.getName() + " role.")
                .build();
    }

    public void cleanup(String sessionId) {
        if (!sessionStore.deleteById(sessionId)) {
            throw new SessionNotFoundException(sessionId);
        }
        log.info("Removed session {}", sessionId);
    }
}
