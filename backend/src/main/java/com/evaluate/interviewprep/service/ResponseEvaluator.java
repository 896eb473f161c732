package com.evaluate.interviewprep.service;

import com.evaluate.interviewprep.config.InterviewProperties;
import com.evaluate.interviewprep.model.CandidateResponse;
import com.evaluate.interviewprep.model.FollowUpReason;
import com.evaluate.interviewprep.model.InterviewQuestion;
import com.evaluate.interviewprep.model.JobRole;
import com.evaluate.interviewprep.model.ResponseEvaluation;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Scores a single answer for depth, clarity and completeness, plus technical accuracy for
 * technical questions. Never throws: empty input simply scores zero everywhere.
 */
@Service
@RequiredArgsConstructor
public class ResponseEvaluator {

    private final InterviewProperties properties;

    public ResponseEvaluation evaluate(InterviewQuestion question, CandidateResponse response, JobRole role) {
        String text = response == null || response.getText() == null ? "" : response.getText();
        String lower = TextSignals.lower(text);
        int wordCount = TextSignals.words(text).length;

        if (wordCount == 0) {
            return ResponseEvaluation.builder()
                    .questionId(question.getId())
                    .needsFollowUp(true)
                    .followUpReason(FollowUpReason.TOO_SHORT)
                    .technicalAccuracy(question.isTechnical() ? 0.0 : null)
                    .build();
        }

        double depth = assessDepth(lower, wordCount);
        double clarity = assessClarity(text, lower, wordCount);
        double completeness = assessCompleteness(lower, question.getExpectedElements(), depth, clarity);
        Double accuracy = question.isTechnical() ? assessTechnicalAccuracy(lower, question, role) : null;

        FollowUpReason reason = followUpReason(wordCount, depth, clarity, completeness);
        return ResponseEvaluation.builder()
                .questionId(question.getId())
                .depthScore(depth)
                .clarityScore(clarity)
                .completenessScore(completeness)
                .needsFollowUp(reason != null)
                .followUpReason(reason)
                .technicalAccuracy(accuracy)
                .build();
    }

    double assessDepth(String lower, int wordCount) {
        InterviewProperties.Evaluation config = properties.getEvaluation();
        double lengthPart = 5.0 * Math.min(1.0, (double) wordCount / config.getDepthSaturationWords());
        int reasoning = TextSignals.countTerms(lower, config.getReasoningMarkers());
        int techniques = TextSignals.countTerms(lower, config.getTechniqueKeywords());
        double score = lengthPart + Math.min(3, reasoning) + Math.min(2.0, 0.5 * techniques);
        return round(TextSignals.clamp(score, 0, 10));
    }

    double assessClarity(String text, String lower, int wordCount) {
        InterviewProperties.Evaluation config = properties.getEvaluation();
        double score = 5.0;
        if (wordCount < config.getShortAnswerWords()) {
            score -= 3;
        }
        score += Math.min(3, TextSignals.countTerms(lower, config.getConnectors()));

        long sentences = Math.max(1, TextSignals.sentenceCount(text));
        double averageLength = (double) wordCount / sentences;
        if (averageLength >= 8 && averageLength <= 25) {
            score += 2;
        } else if (averageLength >= 5 && averageLength <= 35) {
            score += 1;
        }
        if (averageLength > config.getRunOnSentenceWords()) {
            score -= 2;
        }
        return round(TextSignals.clamp(score, 0, 10));
    }

    double assessCompleteness(String lower, List<String> expectedElements, double depth, double clarity) {
        if (expectedElements == null || expectedElements.isEmpty()) {
            return round((depth + clarity) / 2.0);
        }
        long covered = expectedElements.stream()
                .filter(element -> lower.contains(element.toLowerCase(Locale.ROOT)))
                .count();
        return round(10.0 * covered / expectedElements.size());
    }

    double assessTechnicalAccuracy(String lower, InterviewQuestion question, JobRole role) {
        Set<String> terms = new LinkedHashSet<>(roleTerms(role));
        String category = question.getCategory() == null ? "" : question.getCategory().toLowerCase(Locale.ROOT);
        terms.addAll(properties.getEvaluation().getCategoryKeywords().getOrDefault(category, List.of()));

        int hits = TextSignals.countTerms(lower, terms);
        double score = 3 + 2.0 * hits;
        if (TextSignals.containsAny(lower, properties.getEvaluation().getExampleMarkers())) {
            score += 1;
        }
        return round(TextSignals.clamp(score, 0, 10));
    }

    /** Skill names plus their slash or ampersand separated parts, e.g. "Python/R" gives "python/r" and "python". */
    private List<String> roleTerms(JobRole role) {
        List<String> terms = new ArrayList<>();
        if (role == null) {
            return terms;
        }
        for (String skill : role.getTechnicalSkills()) {
            String lowerSkill = skill.toLowerCase(Locale.ROOT);
            terms.add(lowerSkill);
            Arrays.stream(lowerSkill.split("[/&]"))
                    .map(String::trim)
                    .filter(part -> part.length() >= 3)
                    .forEach(terms::add);
        }
        return terms;
    }

    private FollowUpReason followUpReason(int wordCount, double depth, double clarity, double completeness) {
        InterviewProperties.Evaluation config = properties.getEvaluation();
        if (wordCount < config.getMinPlausibleWords()) {
            return FollowUpReason.TOO_SHORT;
        }
        double threshold = config.getLowQualityThreshold();
        int lowCount = (depth < threshold ? 1 : 0) + (clarity < threshold ? 1 : 0) + (completeness < threshold ? 1 : 0);
        if (lowCount < 2) {
            return null;
        }
        // Weakest dimension wins; ties go to depth, then completeness
        if (depth <= completeness && depth <= clarity) {
            return FollowUpReason.INSUFFICIENT_DEPTH;
        }
        if (completeness <= clarity) {
            return FollowUpReason.INCOMPLETE_COVERAGE;
        }
        return FollowUpReason.UNCLEAR_EXPLANATION;
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
