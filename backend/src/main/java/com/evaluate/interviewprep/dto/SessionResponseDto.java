package com.evaluate.interviewprep.dto;

import com.evaluate.interviewprep.model.FeedbackReport;
import com.evaluate.interviewprep.model.InterviewQuestion;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SessionResponseDto {
    private String id;
    private String roleId;
    private String roleName;
    private String level;
    private String interactionMode;
    private String status;
    private String behaviorType;
    private String drillCategory;
    private boolean resumeUploaded;
    private int totalQuestions;
    private int answeredQuestions;
    private InterviewQuestion currentQuestion;
    private Instant startTime;
    private Instant endTime;
    private FeedbackReport feedback;
}
