package com.evaluate.interviewprep.controller;

import com.evaluate.interviewprep.dto.AnswerSubmissionDto;
import com.evaluate.interviewprep.dto.CatalogDto;
import com.evaluate.interviewprep.dto.ProgressDto;
import com.evaluate.interviewprep.dto.ResumeUploadDto;
import com.evaluate.interviewprep.dto.SessionCreateDto;
import com.evaluate.interviewprep.dto.SessionResponseDto;
import com.evaluate.interviewprep.model.ContinuationOptions;
import com.evaluate.interviewprep.model.ContinuationPrompt;
import com.evaluate.interviewprep.model.ExperienceLevel;
import com.evaluate.interviewprep.model.InteractionMode;
import com.evaluate.interviewprep.model.InterviewAction;
import com.evaluate.interviewprep.model.InterviewProgress;
import com.evaluate.interviewprep.model.InterviewQuestion;
import com.evaluate.interviewprep.model.InterviewSession;
import com.evaluate.interviewprep.model.JobRole;
import com.evaluate.interviewprep.model.ResumeAnalysis;
import com.evaluate.interviewprep.model.ResumeDocument;
import com.evaluate.interviewprep.service.InterviewService;
import com.evaluate.interviewprep.service.RoleCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/interview")
@RequiredArgsConstructor
@Slf4j
public class InterviewController {

    private final InterviewService interviewService;
    private final RoleCatalog roleCatalog;

    // ─── Catalog ────────────────────────────────────────────────────────

    @GetMapping("/roles")
    public List<JobRole> getRoles() {
        return roleCatalog.availableRoles();
    }

    @GetMapping("/levels")
    public List<ExperienceLevel> getLevels() {
        return roleCatalog.availableLevels();
    }

    @GetMapping("/catalog")
    public CatalogDto getCatalog() {
        List<String> modes = Arrays.stream(InteractionMode.values())
                .map(InteractionMode::getValue)
                .collect(Collectors.toList());
        return new CatalogDto(roleCatalog.roleIds(), roleCatalog.levelNames(), modes);
    }

    // ─── Sessions ───────────────────────────────────────────────────────

    @PostMapping("/sessions")
    @ResponseStatus(HttpStatus.CREATED)
    public SessionResponseDto createSession(@RequestBody SessionCreateDto dto) {
        InterviewSession session = interviewService.createSession(dto.getRole(), dto.getLevel(), dto.getInteractionMode());
        return toResponseDto(session);
    }

    @GetMapping("/sessions/{sessionId}")
    public SessionResponseDto getSession(@PathVariable String sessionId) {
        return toResponseDto(interviewService.getSession(sessionId));
    }

    @PostMapping("/sessions/{sessionId}/resume")
    public ResumeAnalysis uploadResume(@PathVariable String sessionId, @RequestBody ResumeUploadDto dto) {
        ResumeDocument document = new ResumeDocument(dto.getContent(),
                dto.getFormat() != null ? dto.getFormat() : "text", dto.getFilename());
        return interviewService.uploadResume(sessionId, document);
    }

    @DeleteMapping("/sessions/{sessionId}")
    public Map<String, String> deleteSession(@PathVariable String sessionId) {
        interviewService.cleanupSession(sessionId);
        return Map.of("message", "Session deleted");
    }

    // ─── Interview flow ─────────────────────────────────────────────────

    @PostMapping("/sessions/{sessionId}/start")
    public InterviewQuestion startInterview(@PathVariable String sessionId) {
        return interviewService.startInterview(sessionId);
    }

    @PostMapping("/sessions/{sessionId}/responses")
    public InterviewAction submitResponse(@PathVariable String sessionId, @RequestBody AnswerSubmissionDto dto) {
        return interviewService.submitResponse(sessionId, dto.getAnswerText());
    }

    @GetMapping("/sessions/{sessionId}/progress")
    public ProgressDto getProgress(@PathVariable String sessionId) {
        InterviewProgress progress = interviewService.getProgress(sessionId);
        return ProgressDto.builder()
                .totalQuestions(progress.getTotalQuestions())
                .answeredQuestions(progress.getAnsweredQuestions())
                .currentQuestionIndex(progress.getCurrentQuestionIndex())
                .percentComplete(progress.getPercentComplete())
                .estimatedMinutesRemaining(progress.getEstimatedTimeRemaining() != null
                        ? toMinutes(progress.getEstimatedTimeRemaining()) : null)
                .expectedDurationMinutes(toMinutes(progress.getExpectedDuration()))
                .build();
    }

    @PostMapping("/sessions/{sessionId}/end")
    public InterviewAction endInterview(@PathVariable String sessionId) {
        return interviewService.endInterviewEarly(sessionId);
    }

    // ─── Continuation ───────────────────────────────────────────────────

    @GetMapping("/sessions/{sessionId}/continuation")
    public ContinuationPrompt getContinuation(@PathVariable String sessionId) {
        return interviewService.getContinuationOptions(sessionId);
    }

    @PostMapping("/continuations")
    @ResponseStatus(HttpStatus.CREATED)
    public SessionResponseDto continueSession(@RequestBody ContinuationOptions options) {
        InterviewSession session = interviewService.continueWithNewSession(options);
        log.info("Continuation session {} created ({})", session.getId(), options.getType().getValue());
        return toResponseDto(session);
    }

    // ─── Helpers ────────────────────────────────────────────────────────

    private static double toMinutes(Duration duration) {
        return duration.toSeconds() / 60.0;
    }

    private SessionResponseDto toResponseDto(InterviewSession session) {
        return SessionResponseDto.builder()
                .id(session.getId())
                .roleId(session.getRole().getId())
                .roleName(session.getRole().getName())
                .level(session.getExperienceLevel().getLevel())
                .interactionMode(session.getInteractionMode().getValue())
                .status(session.getStatus().getValue())
                .behaviorType(session.getBehaviorType().getValue())
                .drillCategory(session.getDrillCategory())
                .resumeUploaded(session.getResumeAnalysis() != null)
                .totalQuestions(session.primaryQuestions().size())
                .answeredQuestions(session.answeredPrimaryCount())
                .currentQuestion(session.currentQuestion().orElse(null))
                .startTime(session.getStartTime())
                .endTime(session.getEndTime())
                .feedback(session.getFeedback())
                .build();
    }
}
