package com.evaluate.interviewprep.service;

import com.evaluate.interviewprep.model.CandidateResponse;
import com.evaluate.interviewprep.model.ExperienceLevel;
import com.evaluate.interviewprep.model.InterviewQuestion;
import com.evaluate.interviewprep.model.JobRole;
import com.evaluate.interviewprep.model.ResponseEvaluation;
import com.evaluate.interviewprep.model.ResumeAnalysis;

import java.util.List;
import java.util.Optional;

public interface QuestionGenerator {

    /**
     * Builds the ordered primary question set for a session.
     *
     * @param resumeAnalysis may be {@code null} when no resume was uploaded
     * @param drillCategory  may be {@code null}; when set, questions focus on that category
     */
    List<InterviewQuestion> generateQuestionSet(JobRole role, ExperienceLevel level,
                                                ResumeAnalysis resumeAnalysis, String drillCategory);

    /**
     * Categories a topic drill can focus on for the role: its own categories first, then the categories
     * of the templates available to it.
     */
    List<String> drillCategories(JobRole role);

    /**
     * Produces one narrower question for a weak answer and bumps the parent's follow-up count.
     * Returns empty when the answer needs no follow-up or the parent's cap is used up.
     *
     * @param parent   the primary question the follow-up attaches to
     * @param answered the question the candidate just answered; the parent itself or one of its follow-ups
     */
    Optional<InterviewQuestion> generateFollowUp(InterviewQuestion parent, InterviewQuestion answered,
                                                 CandidateResponse response, ResponseEvaluation evaluation);
}
