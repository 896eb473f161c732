package com.evaluate.interviewprep.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class AlignmentFeedback {
    int alignmentScore;
    List<String> matchedSkills;
    List<String> missingSkills;
    String summary;
}
