package com.evaluate.interviewprep.service;

import com.evaluate.interviewprep.exception.ResumeAnalysisException;
import com.evaluate.interviewprep.model.JobRole;
import com.evaluate.interviewprep.model.ResumeAnalysis;
import com.evaluate.interviewprep.model.ResumeDocument;

/**
 * Turns a raw resume into an analysis scored against a role.
 */
public interface ResumeAnalyzer {

    ResumeAnalysis analyze(ResumeDocument document, JobRole role) throws ResumeAnalysisException;
}
