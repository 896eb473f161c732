package com.evaluate.interviewprep.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class InterviewQuestion {
    private String id;
    private QuestionType type;
    private String text;
    private String category;
    private int difficulty;
    private ResumeReference resumeContext;
    @Builder.Default
    private List<String> expectedElements = new ArrayList<>();
    private String parentQuestionId;
    private int followUpCount;

    @JsonIgnore
    public boolean isFollowUp() {
        return parentQuestionId != null;
    }

    @JsonIgnore
    public boolean isTechnical() {
        return type == QuestionType.TECHNICAL;
    }
}
