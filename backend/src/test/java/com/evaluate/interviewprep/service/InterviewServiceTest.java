package com.evaluate.interviewprep.service;

import com.evaluate.interviewprep.config.InterviewProperties;
import com.evaluate.interviewprep.exception.InvalidInputException;
import com.evaluate.interviewprep.exception.InvalidStateTransitionException;
import com.evaluate.interviewprep.exception.SessionNotFoundException;
import com.evaluate.interviewprep.model.ActionType;
import com.evaluate.interviewprep.model.BehaviorType;
import com.evaluate.interviewprep.model.CandidateResponse;
import com.evaluate.interviewprep.model.ContinuationOption;
import com.evaluate.interviewprep.model.ContinuationOptions;
import com.evaluate.interviewprep.model.ContinuationPrompt;
import com.evaluate.interviewprep.model.ContinuationType;
import com.evaluate.interviewprep.model.ExperienceLevel;
import com.evaluate.interviewprep.model.FeedbackReport;
import com.evaluate.interviewprep.model.Grade;
import com.evaluate.interviewprep.model.InterviewAction;
import com.evaluate.interviewprep.model.InterviewProgress;
import com.evaluate.interviewprep.model.InterviewQuestion;
import com.evaluate.interviewprep.model.InterviewSession;
import com.evaluate.interviewprep.model.JobRole;
import com.evaluate.interviewprep.model.QuestionType;
import com.evaluate.interviewprep.model.ResponseEvaluation;
import com.evaluate.interviewprep.model.ResumeAnalysis;
import com.evaluate.interviewprep.model.ResumeDocument;
import com.evaluate.interviewprep.model.SessionStatus;
import com.evaluate.interviewprep.repository.InMemorySessionStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class InterviewServiceTest {

    private static final String VAGUE = "I worked on a team project.";
    private static final String SOLID = "First, I would design the cache layer because reads dominate, which means "
            + "latency drops for most requests. Then I would implement eviction and analyze the trade-off between "
            + "freshness and speed. For example, we built this in production and the result was a faster service.";

    private InterviewProperties properties;
    private DefaultQuestionGenerator generator;
    private InterviewService service;

    @BeforeEach
    void setUp() {
        properties = new InterviewProperties();
        QuestionBank bank = new QuestionBank(new ObjectMapper(), properties);
        bank.initialize();
        generator = new DefaultQuestionGenerator(bank, properties, new Random(7));
        service = serviceWith(generator);
    }

    private InterviewService serviceWith(QuestionGenerator questionGenerator) {
        RoleCatalog catalog = new RoleCatalog();
        SessionManager manager = new SessionManager(new InMemorySessionStore(), catalog, new KeywordResumeAnalyzer());
        return new InterviewService(manager,
                questionGenerator,
                new ResponseEvaluator(properties),
                new BehaviorClassifier(properties),
                new CommunicationAdapter(),
                new FeedbackGenerator(properties),
                catalog,
                properties);
    }

    /** Same questions, reordered so the interview opens on a technical one. */
    private static QuestionGenerator technicalFirst(QuestionGenerator delegate) {
        return new QuestionGenerator() {
            @Override
            public List<InterviewQuestion> generateQuestionSet(JobRole role, ExperienceLevel level,
                                                               ResumeAnalysis resumeAnalysis, String drillCategory) {
                List<InterviewQuestion> questions =
                        new ArrayList<>(delegate.generateQuestionSet(role, level, resumeAnalysis, drillCategory));
                questions.sort(Comparator.comparing((InterviewQuestion q) -> !q.isTechnical()));
                return questions;
            }

            @Override
            public List<String> drillCategories(JobRole role) {
                return delegate.drillCategories(role);
            }

            @Override
            public Optional<InterviewQuestion> generateFollowUp(InterviewQuestion parent, InterviewQuestion answered,
                                                                CandidateResponse response,
                                                                ResponseEvaluation evaluation) {
                return delegate.generateFollowUp(parent, answered, response, evaluation);
            }
        };
    }

    private String newSession() {
        return service.createSession("software-engineer", "mid", "text").getId();
    }

    @Test
    void startingAsksTheFirstQuestion() {
        String id = newSession();

        InterviewQuestion first = service.startInterview(id);

        InterviewSession session = service.getSession(id);
        assertEquals(SessionStatus.IN_PROGRESS, session.getStatus());
        assertEquals(first.getId(), session.getCurrentQuestionId());
        assertTrue(session.getQuestions().size() >= 5);
        assertThrows(InvalidStateTransitionException.class, () -> service.startInterview(id));
    }

    @Test
    void answeringBeforeStartIsAnInvalidTransition() {
        String id = newSession();

        InvalidStateTransitionException ex = assertThrows(InvalidStateTransitionException.class,
                () -> service.submitResponse(id, SOLID));
        assertEquals(SessionStatus.INITIALIZED, ex.getCurrentState());
    }

    @Test
    void vagueAnswersGetCappedFollowUps() {
        service = serviceWith(technicalFirst(generator));
        String id = newSession();
        InterviewQuestion first = service.startInterview(id);
        assertEquals(QuestionType.TECHNICAL, first.getType());

        InterviewAction one = service.submitResponse(id, VAGUE);
        assertEquals(ActionType.FOLLOW_UP, one.getType());
        assertEquals(first.getId(), one.getQuestion().getParentQuestionId());

        InterviewAction two = service.submitResponse(id, VAGUE);
        assertEquals(ActionType.FOLLOW_UP, two.getType());
        assertEquals(first.getId(), two.getQuestion().getParentQuestionId());

        InterviewAction three = service.submitResponse(id, VAGUE);
        assertEquals(ActionType.NEXT_QUESTION, three.getType());
        assertNull(three.getQuestion().getParentQuestionId());
        assertEquals(2, service.getSession(id).findQuestion(first.getId()).orElseThrow().getFollowUpCount());
    }

    @Test
    void skipRequestsAreRedirectedWithoutRecording() {
        String id = newSession();
        InterviewQuestion first = service.startInterview(id);

        InterviewAction action = service.submitResponse(id, "skip question");

        assertEquals(ActionType.REDIRECT, action.getType());
        assertEquals(first.getId(), action.getQuestion().getId());
        assertTrue(action.getMessage().contains("End the interview early"));
        InterviewSession session = service.getSession(id);
        assertTrue(session.getResponses().isEmpty());
        assertEquals(first.getId(), session.getCurrentQuestionId());
        assertEquals(BehaviorType.EDGE_CASE, service.getCurrentBehaviorType(id));
    }

    @Test
    void shortAnswersMentioningSkipOrHackAreRecorded() {
        String id = newSession();
        service.startInterview(id);

        InterviewAction action = service.submitResponse(id,
                "A skip list keeps keys ordered, so range lookups stay fast.");

        assertNotEquals(ActionType.REDIRECT, action.getType());
        assertEquals(1, service.getSession(id).getResponses().size());
    }

    @Test
    void longOffTopicAnswersAreRedirectedToTheQuestion() {
        String id = newSession();
        InterviewQuestion first = service.startInterview(id);
        String rambling = String.join(" ", Collections.nCopies(14,
                "Gardening tomatoes requires patient watering during summer mornings."));

        InterviewAction action = service.submitResponse(id, rambling);

        assertEquals(ActionType.REDIRECT, action.getType());
        assertEquals(first.getId(), action.getQuestion().getId());
        assertTrue(action.getMessage().startsWith(InterviewService.OFF_TOPIC));
        assertTrue(action.getMessage().endsWith(first.getText()));
        assertTrue(service.getSession(id).getResponses().isEmpty());
        assertEquals(0, service.getSession(id).getEdgeCaseStreak());
    }

    @Test
    void repeatedEdgeCasesSuggestEndingEarly() {
        String id = newSession();
        service.startInterview(id);

        for (int i = 0; i < properties.getBehavior().getEdgeCaseTolerance(); i++) {
            assertFalse(service.submitResponse(id, "skip").getMessage().contains(InterviewService.END_EARLY_HINT));
        }
        assertTrue(service.submitResponse(id, "skip").getMessage().contains(InterviewService.END_EARLY_HINT));

        service.submitResponse(id, SOLID);
        assertEquals(0, service.getSession(id).getEdgeCaseStreak());
    }

    @Test
    void fullInterviewCompletesWithFeedback() {
        String id = newSession();
        service.startInterview(id);

        InterviewAction action = null;
        for (int turn = 0; turn < 100; turn++) {
            action = service.submitResponse(id, SOLID);
            if (action.getType() == ActionType.COMPLETE) {
                break;
            }
        }

        assertNotNull(action);
        assertEquals(ActionType.COMPLETE, action.getType());
        InterviewSession session = service.getSession(id);
        assertEquals(SessionStatus.COMPLETED, session.getStatus());
        assertNotNull(session.getEndTime());
        FeedbackReport report = action.getFeedback();
        assertFalse(report.isEndedEarly());
        assertSame(report, session.getFeedback());
        assertEquals(100.0, service.getProgress(id).getPercentComplete());
        assertThrows(InvalidStateTransitionException.class, () -> service.submitResponse(id, SOLID));
        assertThrows(InvalidStateTransitionException.class, () -> service.endInterviewEarly(id));
    }

    @Test
    void endingEarlyWithoutAnswersGivesAnEmptyReport() {
        String id = newSession();
        service.startInterview(id);

        InterviewAction action = service.endInterviewEarly(id);

        assertEquals(ActionType.COMPLETE, action.getType());
        assertEquals(SessionStatus.ENDED_EARLY, service.getSession(id).getStatus());
        FeedbackReport report = action.getFeedback();
        assertTrue(report.isEndedEarly());
        assertEquals(0, report.getAnsweredQuestions());
        assertEquals(Grade.F, report.getScores().getOverall().getGrade());
        assertTrue(report.getQuestionBreakdown().isEmpty());
    }

    @Test
    void endingEarlyBeforeStartIsRejected() {
        String id = newSession();
        assertThrows(InvalidStateTransitionException.class, () -> service.endInterviewEarly(id));
    }

    @Test
    void progressCountsPrimaryQuestionsOnly() {
        String id = newSession();
        service.startInterview(id);
        int total = service.getSession(id).primaryQuestions().size();

        InterviewProgress before = service.getProgress(id);
        assertEquals(total, before.getTotalQuestions());
        assertEquals(0, before.getAnsweredQuestions());
        assertEquals(0.0, before.getPercentComplete());
        assertNull(before.getEstimatedTimeRemaining());
        assertEquals(Duration.ofMinutes(3L * total), before.getExpectedDuration());
        assertEquals(Duration.ofMinutes(3L * total), service.getExpectedDuration(id));

        service.submitResponse(id, VAGUE);
        InterviewProgress afterFollowUp = service.getProgress(id);
        assertEquals(total, afterFollowUp.getTotalQuestions());
        assertEquals(1, afterFollowUp.getAnsweredQuestions());
        assertTrue(afterFollowUp.getPercentComplete() > 0 && afterFollowUp.getPercentComplete() <= 100);
        assertEquals(Duration.ofMinutes(3L * (total - 1)), afterFollowUp.getEstimatedTimeRemaining());
    }

    @Test
    void resumeSkillsAppearInTheQuestionSet() {
        String id = newSession();
        service.uploadResume(id, new ResumeDocument("Skills: Python, React, AWS", "text", "resume.txt"));

        service.startInterview(id);

        Set<String> referenced = service.getSession(id).getQuestions().stream()
                .filter(q -> q.getResumeContext() != null && "skills".equals(q.getResumeContext().getSection()))
                .map(q -> q.getResumeContext().getContent())
                .collect(Collectors.toSet());
        assertFalse(referenced.isEmpty());
        assertTrue(Set.of("Python", "React", "AWS").containsAll(referenced));
    }

    @Test
    void continuationOffersNewRoundsAndDrills() {
        String id = newSession();
        service.startInterview(id);
        service.submitResponse(id, VAGUE);
        service.endInterviewEarly(id);

        ContinuationPrompt prompt = service.getContinuationOptions(id);

        assertEquals("Would you like to continue practicing?", prompt.getMessage());
        List<String> optionIds = prompt.getOptions().stream().map(ContinuationOption::getId).collect(Collectors.toList());
        assertEquals("new-round-same", optionIds.get(0));
        assertEquals("new-round-different", optionIds.get(1));
        List<ContinuationOption> drills = prompt.getOptions().stream()
                .filter(o -> o.getContinuationOptions().getType() == ContinuationType.TOPIC_DRILL)
                .collect(Collectors.toList());
        assertFalse(drills.isEmpty());
        assertTrue(drills.size() <= 3);
        assertTrue(drills.get(0).getId().startsWith("drill-"));
    }

    @Test
    void continuationRequiresAFinishedSession() {
        String id = newSession();
        service.startInterview(id);
        assertThrows(InvalidStateTransitionException.class, () -> service.getContinuationOptions(id));
    }

    @Test
    void drillContinuationCreatesAFocusedSession() {
        InterviewSession drill = service.continueWithNewSession(ContinuationOptions.builder()
                .type(ContinuationType.TOPIC_DRILL).roleId("software-engineer").level("mid")
                .drillCategory("System Design").build());

        assertEquals(SessionStatus.INITIALIZED, drill.getStatus());
        assertEquals("System Design", drill.getDrillCategory());

        service.startInterview(drill.getId());
        assertTrue(service.getSession(drill.getId()).getQuestions().stream()
                .allMatch(q -> "System Design".equalsIgnoreCase(q.getCategory())));
    }

    @Test
    void drillCategoriesAreMatchedToTheRoleIgnoringCase() {
        InterviewSession drill = service.continueWithNewSession(ContinuationOptions.builder()
                .type(ContinuationType.TOPIC_DRILL).roleId("software-engineer").level("mid")
                .drillCategory("  coding ").build());
        assertEquals("Coding", drill.getDrillCategory());

        InvalidInputException ex = assertThrows(InvalidInputException.class, () -> service.continueWithNewSession(
                ContinuationOptions.builder().type(ContinuationType.TOPIC_DRILL)
                        .roleId("software-engineer").level("mid")
                        .drillCategory("Underwater Basket Weaving").build()));
        assertTrue(ex.getValidOptions().containsAll(List.of("Coding", "System Design", "Behavioral")));
        assertEquals(generator.drillCategories(drill.getRole()), ex.getValidOptions());
    }

    @Test
    void newRoundContinuationValidatesItsInput() {
        InterviewSession next = service.continueWithNewSession(ContinuationOptions.builder()
                .type(ContinuationType.NEW_ROUND).roleId("product-manager").level("senior").build());
        assertEquals("product-manager", next.getRole().getId());
        assertNull(next.getDrillCategory());

        assertThrows(InvalidInputException.class, () -> service.continueWithNewSession(
                ContinuationOptions.builder().type(ContinuationType.NEW_ROUND).build()));
        assertThrows(InvalidInputException.class, () -> service.continueWithNewSession(
                ContinuationOptions.builder().type(ContinuationType.TOPIC_DRILL)
                        .roleId("software-engineer").level("mid").build()));
    }

    @Test
    void sessionsAreIndependent() {
        String a = newSession();
        String b = newSession();
        service.startInterview(a);
        service.startInterview(b);

        service.submitResponse(a, SOLID);
        service.endInterviewEarly(a);

        InterviewSession other = service.getSession(b);
        assertEquals(SessionStatus.IN_PROGRESS, other.getStatus());
        assertTrue(other.getResponses().isEmpty());
        assertEquals(0, service.getProgress(b).getAnsweredQuestions());
    }

    @Test
    void cleanupForgetsTheSession() {
        String id = newSession();
        service.cleanupSession(id);
        assertThrows(SessionNotFoundException.class, () -> service.getSession(id));
    }

    @Test
    void communicationHelpersFollowTheCurrentBehavior() {
        String id = newSession();
        assertEquals("Thank you for your response.", service.getAcknowledgment(id));
        assertEquals("Here's your next question:", service.getTransition(id));
        assertEquals("hello", service.getAdaptedResponse(id, "hello").getContent());
    }
}
