package com.evaluate.interviewprep.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ResumeAnalysis {
    ParsedResume parsedResume;
    @Singular
    List<Skill> technicalSkills;
    @Singular
    List<Skill> matchedSkills;
    @Singular
    List<Strength> strengths;
    @Singular
    List<Gap> gaps;
    AlignmentScore alignmentScore;
    String summary;
}
