package com.evaluate.interviewprep.service;

import com.evaluate.interviewprep.config.InterviewProperties;
import com.evaluate.interviewprep.exception.InvalidInputException;
import com.evaluate.interviewprep.model.ActionType;
import com.evaluate.interviewprep.model.AdaptedResponse;
import com.evaluate.interviewprep.model.BehaviorType;
import com.evaluate.interviewprep.model.CandidateResponse;
import com.evaluate.interviewprep.model.ContinuationOption;
import com.evaluate.interviewprep.model.ContinuationOptions;
import com.evaluate.interviewprep.model.ContinuationPrompt;
import com.evaluate.interviewprep.model.ContinuationType;
import com.evaluate.interviewprep.model.FeedbackReport;
import com.evaluate.interviewprep.model.InteractionMode;
import com.evaluate.interviewprep.model.InterviewAction;
import com.evaluate.interviewprep.model.InterviewProgress;
import com.evaluate.interviewprep.model.InterviewQuestion;
import com.evaluate.interviewprep.model.InterviewSession;
import com.evaluate.interviewprep.model.JobRole;
import com.evaluate.interviewprep.model.ResponseEvaluation;
import com.evaluate.interviewprep.model.ResumeAnalysis;
import com.evaluate.interviewprep.model.ResumeDocument;
import com.evaluate.interviewprep.model.SessionAction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Runs the interview turn by turn: asks questions, evaluates answers, decides on follow-ups
 * and produces the final report.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InterviewService {

    static final String SKIP_NOT_ALLOWED =
            "Questions can't be skipped here, but a partial answer or a request for clarification is always fine.";
    static final String OFF_TOPIC =
            "Your response seems to be off-topic. Please focus on the question asked. Let me repeat it: ";
    static final String END_EARLY_HINT =
            "\n\nIf you'd rather stop, you can end the interview early and still get feedback on what you've answered.";

    private final SessionManager sessionManager;
    private final QuestionGenerator questionGenerator;
    private final ResponseEvaluator responseEvaluator;
    private final BehaviorClassifier behaviorClassifier;
    private final CommunicationAdapter communicationAdapter;
    private final FeedbackGenerator feedbackGenerator;
    private final RoleCatalog roleCatalog;
    private final InterviewProperties properties;

    // ─── Session setup ──────────────────────────────────────────────────

    public InterviewSession createSession(String roleIdOrName, String level, String interactionMode) {
        return sessionManager.createSession(roleIdOrName, level, sessionManager.parseInteractionMode(interactionMode));
    }

    public InterviewSession createSession(String roleIdOrName, String level, InteractionMode interactionMode) {
        return sessionManager.createSession(roleIdOrName, level, interactionMode);
    }

    public InterviewSession getSession(String sessionId) {
        return sessionManager.getSession(sessionId);
    }

    public ResumeAnalysis uploadResume(String sessionId, ResumeDocument document) {
        return sessionManager.uploadResume(sessionId, document);
    }

    public InterviewQuestion startInterview(String sessionId) {
        InterviewSession session = sessionManager.getSession(sessionId);
        sessionManager.requireState(session, SessionAction.START_INTERVIEW);

        List<InterviewQuestion> questions = questionGenerator.generateQuestionSet(session.getRole(),
                session.getExperienceLevel(), session.getResumeAnalysis(), session.getDrillCategory());
        session.setQuestions(new ArrayList<>(questions));
        session.setCurrentPrimaryIndex(0);
        sessionManager.transition(session, SessionAction.START_INTERVIEW);

        InterviewQuestion first = questions.get(0);
        ask(session, first);
        log.info("Session {} started with {} questions", sessionId, questions.size());
        return first;
    }

    // ─── Turns ──────────────────────────────────────────────────────────

    public InterviewAction submitResponse(String sessionId, String answerText) {
        InterviewSession session = sessionManager.getSession(sessionId);
        sessionManager.requireState(session, SessionAction.SUBMIT_RESPONSE);

        InterviewQuestion question = session.currentQuestion()
                .orElseThrow(() -> new IllegalStateException("Session " + sessionId + " has no pending question"));
        String text = answerText == null ? "" : answerText;
        Instant now = Instant.now();
        CandidateResponse response = CandidateResponse.builder()
                .questionId(question.getId())
                .text(text)
                .timestamp(now)
                .wordCount(CandidateResponse.countWords(text))
                .responseTime(session.getQuestionAskedAt() == null
                        ? 0 : Duration.between(session.getQuestionAskedAt(), now).toMillis())
                .build();

        BehaviorType behavior = behaviorClassifier.classify(response);
        session.setBehaviorType(behavior);
        session.getBehaviorHistory().add(behavior);

        if (behavior == BehaviorType.EDGE_CASE) {
            return redirect(session, question);
        }
        session.setEdgeCaseStreak(0);

        if (behaviorClassifier.isOffTopic(text, question.getText())) {
            sessionManager.save(session);
            log.debug("Session {} answer to {} drifted off topic", sessionId, question.getId());
            return InterviewAction.builder()
                    .type(ActionType.REDIRECT)
                    .question(question)
                    .message(OFF_TOPIC + question.getText())
                    .build();
        }

        ResponseEvaluation evaluation = responseEvaluator.evaluate(question, response, session.getRole());
        session.recordAnswer(response, evaluation);
        log.debug("Session {} answer to {}: {} words, behavior {}, follow-up needed {}",
                sessionId, question.getId(), response.getWordCount(), behavior.getValue(), evaluation.isNeedsFollowUp());

        String acknowledgment = communicationAdapter.getAcknowledgment(behavior);

        InterviewQuestion parent = question.isFollowUp()
                ? session.findQuestion(question.getParentQuestionId()).orElse(question)
                : question;
        Optional<InterviewQuestion> followUp =
                questionGenerator.generateFollowUp(parent, question, response, evaluation);
        if (followUp.isPresent()) {
            session.getQuestions().add(followUp.get());
            ask(session, followUp.get());
            return InterviewAction.builder()
                    .type(ActionType.FOLLOW_UP)
                    .question(followUp.get())
                    .message(acknowledgment + " Let's go a little deeper on that.")
                    .build();
        }

        List<InterviewQuestion> primaries = session.primaryQuestions();
        int nextIndex = session.getCurrentPrimaryIndex() + 1;
        if (nextIndex < primaries.size()) {
            session.setCurrentPrimaryIndex(nextIndex);
            InterviewQuestion next = primaries.get(nextIndex);
            ask(session, next);
            return InterviewAction.builder()
                    .type(ActionType.NEXT_QUESTION)
                    .question(next)
                    .message(acknowledgment + " " + communicationAdapter.getTransition(behavior))
                    .build();
        }

        session.setCurrentPrimaryIndex(primaries.size());
        return finish(session, SessionAction.COMPLETE,
                acknowledgment + " That concludes the interview. Here is your feedback.");
    }

    public InterviewAction endInterviewEarly(String sessionId) {
        InterviewSession session = sessionManager.getSession(sessionId);
        sessionManager.requireState(session, SessionAction.END_EARLY);
        int answered = session.getResponses().size();
        return finish(session, SessionAction.END_EARLY,
                "Interview ended early. Here is your feedback on the " + answered + " answer(s) you gave.");
    }

    private InterviewAction redirect(InterviewSession session, InterviewQuestion pending) {
        session.setEdgeCaseStreak(session.getEdgeCaseStreak() + 1);
        String content = SKIP_NOT_ALLOWED;
        if (session.getEdgeCaseStreak() > properties.getBehavior().getEdgeCaseTolerance()) {
            content += END_EARLY_HINT;
        }
        AdaptedResponse adapted = communicationAdapter.adaptResponse(content, BehaviorType.EDGE_CASE);
        sessionManager.save(session);
        log.debug("Session {} redirected on {} (streak {})", session.getId(), pending.getId(), session.getEdgeCaseStreak());
        return InterviewAction.builder()
                .type(ActionType.REDIRECT)
                .question(pending)
                .message(adapted.getContent())
                .build();
    }

    private InterviewAction finish(InterviewSession session, SessionAction action, String message) {
        sessionManager.transition(session, action);
        session.setCurrentQuestionId(null);
        session.setQuestionAskedAt(null);
        FeedbackReport report = feedbackGenerator.generate(session, action == SessionAction.END_EARLY);
        session.setFeedback(report);
        sessionManager.save(session);
        log.info("Session {} finished ({}), overall {}", session.getId(), session.getStatus().getValue(),
                report.getScores().getOverall().getGrade());
        return InterviewAction.builder()
                .type(ActionType.COMPLETE)
                .feedback(report)
                .message(message)
                .build();
    }

    private void ask(InterviewSession session, InterviewQuestion question) {
        session.setCurrentQuestionId(question.getId());
        session.setQuestionAskedAt(Instant.now());
        sessionManager.save(session);
    }

    // ─── Progress ───────────────────────────────────────────────────────

    public InterviewProgress getProgress(String sessionId) {
        InterviewSession session = sessionManager.getSession(sessionId);
        int total = session.primaryQuestions().size();
        int answered = session.answeredPrimaryCount();
        double percent = total > 0 ? Math.round(answered * 1000.0 / total) / 10.0 : 0.0;
        int remaining = total - answered;
        Duration average = properties.getSession().getAverageQuestionTime();

        return InterviewProgress.builder()
                .totalQuestions(total)
                .answeredQuestions(answered)
                .currentQuestionIndex(Math.min(session.getCurrentPrimaryIndex(), total))
                .percentComplete(Math.max(0.0, Math.min(100.0, percent)))
                .estimatedTimeRemaining(answered > 0 && remaining > 0 ? average.multipliedBy(remaining) : null)
                .expectedDuration(average.multipliedBy(total))
                .build();
    }

    public Duration getExpectedDuration(String sessionId) {
        InterviewSession session = sessionManager.getSession(sessionId);
        return properties.getSession().getAverageQuestionTime().multipliedBy(session.primaryQuestions().size());
    }

    // ─── Continuation ───────────────────────────────────────────────────

    public ContinuationPrompt getContinuationOptions(String sessionId) {
        InterviewSession session = sessionManager.getSession(sessionId);
        sessionManager.requireState(session, SessionAction.GET_CONTINUATION);

        String roleId = session.getRole().getId();
        String level = session.getExperienceLevel().getLevel();
        List<ContinuationOption> options = new ArrayList<>();
        options.add(new ContinuationOption("new-round-same", "Start Another Round (Same Role)",
                "Continue practicing for " + session.getRole().getName() + " at " + level + " level",
                ContinuationOptions.builder().type(ContinuationType.NEW_ROUND).roleId(roleId).level(level).build()));
        options.add(new ContinuationOption("new-round-different", "Start Another Round (Different Role)",
                "Practice for a different job role or experience level",
                ContinuationOptions.builder().type(ContinuationType.NEW_ROUND).build()));

        for (String category : weakCategories(session)) {
            options.add(new ContinuationOption(
                    "drill-" + category.toLowerCase(Locale.ROOT).replaceAll("\\s+", "-"),
                    "Drill: " + category,
                    "Focused practice on " + category + " questions",
                    ContinuationOptions.builder()
                            .type(ContinuationType.TOPIC_DRILL)
                            .roleId(roleId)
                            .level(level)
                            .drillCategory(category)
                            .build()));
        }
        return new ContinuationPrompt("Would you like to continue practicing?", options);
    }

    /** Drillable categories averaging below the strength threshold, weakest first. */
    List<String> weakCategories(InterviewSession session) {
        double threshold = properties.getScoring().getStrengthThreshold();
        List<String> drillable = questionGenerator.drillCategories(session.getRole());
        Map<String, Double> averages = feedbackGenerator.categoryAverages(feedbackGenerator.answered(session));
        return averages.entrySet().stream()
                .filter(entry -> drillable.contains(entry.getKey()) && entry.getValue() < threshold)
                .sorted(Map.Entry.comparingByValue())
                .limit(properties.getQuestions().getMaxDrillSuggestions())
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    public InterviewSession continueWithNewSession(ContinuationOptions options) {
        if (options == null || options.getType() == null) {
            throw new InvalidInputException("Continuation type is required", List.of(
                    ContinuationType.NEW_ROUND.getValue(), ContinuationType.TOPIC_DRILL.getValue()));
        }
        if (options.getRoleId() == null || options.getRoleId().isBlank()) {
            throw new InvalidInputException("A role is required to start a new session", roleCatalog.roleIds());
        }
        if (options.getLevel() == null || options.getLevel().isBlank()) {
            throw new InvalidInputException("An experience level is required to start a new session",
                    roleCatalog.levelNames());
        }

        if (options.getType() == ContinuationType.TOPIC_DRILL) {
            JobRole role = roleCatalog.resolveRole(options.getRoleId());
            return sessionManager.createSession(options.getRoleId(), options.getLevel(), InteractionMode.TEXT,
                    drillCategory(role, options.getDrillCategory()));
        }
        return sessionManager.createSession(options.getRoleId(), options.getLevel(), InteractionMode.TEXT);
    }

    /** Canonical spelling of a drillable category, matched case-insensitively. */
    private String drillCategory(JobRole role, String requested) {
        List<String> categories = questionGenerator.drillCategories(role);
        String wanted = requested == null ? "" : requested.trim();
        if (wanted.isEmpty()) {
            throw new InvalidInputException("A drill category is required for a topic drill", categories);
        }
        return categories.stream()
                .filter(category -> category.equalsIgnoreCase(wanted))
                .findFirst()
                .orElseThrow(() -> new InvalidInputException(
                        "Unknown drill category for " + role.getName() + ": " + wanted, categories));
    }

    public void cleanupSession(String sessionId) {
        sessionManager.cleanup(sessionId);
    }

    // ─── Communication ──────────────────────────────────────────────────

    public BehaviorType getCurrentBehaviorType(String sessionId) {
        return sessionManager.getSession(sessionId).getBehaviorType();
    }

    public String getAcknowledgment(String sessionId) {
        return communicationAdapter.getAcknowledgment(getCurrentBehaviorType(sessionId));
    }

    public String getTransition(String sessionId) {
        return communicationAdapter.getTransition(getCurrentBehaviorType(sessionId));
    }

    public AdaptedResponse getAdaptedResponse(String sessionId, String content) {
        return communicationAdapter.adaptResponse(content, getCurrentBehaviorType(sessionId));
    }
}
