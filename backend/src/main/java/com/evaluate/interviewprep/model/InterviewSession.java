package com.evaluate.interviewprep.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * One end-to-end interview attempt.
 *
 * <p>{@code questions} holds primary questions in asking order followed by any follow-ups,
 * which point back at their primary through {@code parentQuestionId}. Responses and
 * evaluations are keyed by question id and only ever hold ids present in {@code questions}.
 */
@Data
@NoArgsConstructor
public class InterviewSession {

    private String id;
    private JobRole role;
    private ExperienceLevel experienceLevel;
    private ResumeAnalysis resumeAnalysis;
    private List<InterviewQuestion> questions = new ArrayList<>();
    private Map<String, CandidateResponse> responses = new LinkedHashMap<>();
    private Map<String, ResponseEvaluation> evaluations = new LinkedHashMap<>();
    private BehaviorType behaviorType = BehaviorType.STANDARD;
    private List<BehaviorType> behaviorHistory = new ArrayList<>();
    private InteractionMode interactionMode = InteractionMode.TEXT;
    private Instant startTime;
    private Instant endTime;
    private SessionStatus status = SessionStatus.INITIALIZED;

    // Turn bookkeeping
    private int currentPrimaryIndex;
    private String currentQuestionId;
    private Instant questionAskedAt;
    private int edgeCaseStreak;

    private String drillCategory;
    private FeedbackReport feedback;

    public Optional<InterviewQuestion> findQuestion(String questionId) {
        return questions.stream()
                .filter(q -> q.getId().equals(questionId))
                .findFirst();
    }

    public List<InterviewQuestion> primaryQuestions() {
        return questions.stream()
                .filter(q -> !q.isFollowUp())
                .collect(Collectors.toList());
    }

    public Optional<InterviewQuestion> currentQuestion() {
        return currentQuestionId == null ? Optional.empty() : findQuestion(currentQuestionId);
    }

    public int answeredPrimaryCount() {
        return (int) primaryQuestions().stream()
                .filter(q -> responses.containsKey(q.getId()))
                .count();
    }

    public void recordAnswer(CandidateResponse response, ResponseEvaluation evaluation) {
        if (findQuestion(response.getQuestionId()).isEmpty()) {
            throw new IllegalArgumentException("Question " + response.getQuestionId()
                    + " does not belong to session " + id);
        }
        responses.put(response.getQuestionId(), response);
        evaluations.put(response.getQuestionId(), evaluation);
    }
}
