package com.evaluate.interviewprep.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class JobRole {
    String id;
    String name;
    @Singular
    List<String> technicalSkills;
    @Singular
    List<String> behavioralCompetencies;
    @Singular("questionCategory")
    List<QuestionCategory> questionCategories;
}
