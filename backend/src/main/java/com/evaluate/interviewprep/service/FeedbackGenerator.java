package com.evaluate.interviewprep.service;

import com.evaluate.interviewprep.config.InterviewProperties;
import com.evaluate.interviewprep.model.AlignmentFeedback;
import com.evaluate.interviewprep.model.BehaviorType;
import com.evaluate.interviewprep.model.CandidateResponse;
import com.evaluate.interviewprep.model.CommunicationScore;
import com.evaluate.interviewprep.model.FeedbackReport;
import com.evaluate.interviewprep.model.Gap;
import com.evaluate.interviewprep.model.Grade;
import com.evaluate.interviewprep.model.Improvement;
import com.evaluate.interviewprep.model.InterviewQuestion;
import com.evaluate.interviewprep.model.InterviewSession;
import com.evaluate.interviewprep.model.JobRole;
import com.evaluate.interviewprep.model.OverallScore;
import com.evaluate.interviewprep.model.Priority;
import com.evaluate.interviewprep.model.QuestionFeedback;
import com.evaluate.interviewprep.model.ResponseEvaluation;
import com.evaluate.interviewprep.model.ResumeAnalysis;
import com.evaluate.interviewprep.model.ScoringRubric;
import com.evaluate.interviewprep.model.Skill;
import com.evaluate.interviewprep.model.TechnicalScore;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.ToDoubleFunction;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Aggregates a session's evaluations into the final report. Works for any number of answered
 * questions, including none.
 */
@Service
@RequiredArgsConstructor
public class FeedbackGenerator {

    private static final Pattern UPPERCASE = Pattern.compile("[A-Z]");

    private final InterviewProperties properties;

    /** A question paired with its stored answer and evaluation. */
    @Getter
    @AllArgsConstructor
    static class Answered {
        private final InterviewQuestion question;
        private final CandidateResponse response;
        private final ResponseEvaluation evaluation;
    }

    @AllArgsConstructor
    private static class RankedImprovement {
        private final double gap;
        private final Improvement improvement;
    }

    public FeedbackReport generate(InterviewSession session, boolean endedEarly) {
        List<Answered> answered = answered(session);
        List<Answered> technical = answered.stream()
                .filter(a -> a.getQuestion().isTechnical())
                .collect(Collectors.toList());

        CommunicationScore communication = scoreCommunication(answered, session.getBehaviorHistory());
        TechnicalScore technicalScore = scoreTechnical(technical, session.getRole());
        OverallScore overall = overall(communication, technicalScore, !answered.isEmpty(), !technical.isEmpty());
        ScoringRubric rubric = new ScoringRubric(communication, technicalScore, overall);

        List<String> strengths = strengths(answered, rubric, !technical.isEmpty());
        List<Improvement> improvements = improvements(answered, rubric, !technical.isEmpty(), session.getRole());
        List<QuestionFeedback> breakdown = answered.stream()
                .map(a -> QuestionFeedback.builder()
                        .question(a.getQuestion())
                        .response(a.getResponse())
                        .evaluation(a.getEvaluation())
                        .feedback(questionFeedback(a.getEvaluation()))
                        .build())
                .collect(Collectors.toList());

        return FeedbackReport.builder()
                .sessionId(session.getId())
                .scores(rubric)
                .strengths(strengths)
                .improvements(improvements)
                .resumeAlignment(alignment(session.getResumeAnalysis()))
                .questionBreakdown(breakdown)
                .summary(summary(rubric, strengths, improvements, answered.size(),
                        session.primaryQuestions().size(), endedEarly))
                .endedEarly(endedEarly)
                .answeredQuestions(answered.size())
                .generatedAt(Instant.now())
                .build();
    }

    /** Answered questions in the order they were first answered. */
    List<Answered> answered(InterviewSession session) {
        List<Answered> answered = new ArrayList<>();
        for (CandidateResponse response : session.getResponses().values()) {
            ResponseEvaluation evaluation = session.getEvaluations().get(response.getQuestionId());
            session.findQuestion(response.getQuestionId())
                    .filter(q -> evaluation != null)
                    .ifPresent(q -> answered.add(new Answered(q, response, evaluation)));
        }
        return answered;
    }

    // ─── Communication ──────────────────────────────────────────────────

    CommunicationScore scoreCommunication(List<Answered> answered, List<BehaviorType> history) {
        if (answered.isEmpty()) {
            return CommunicationScore.builder().grade(Grade.F).build();
        }
        double clarity = average(answered, a -> a.getEvaluation().getClarityScore());
        double articulation = average(answered, a -> articulation(a.getResponse()));
        double structure = average(answered, a -> structure(a.getResponse()));
        double professionalism = average(answered, a -> professionalism(a.getResponse()));

        InterviewProperties.Scoring scoring = properties.getScoring();
        double disruptiveShare = BehaviorClassifier.share(history, BehaviorType.CHATTY)
                + BehaviorClassifier.share(history, BehaviorType.CONFUSED);
        if (disruptiveShare >= scoring.getPersistentBehaviorShare()) {
            structure = Math.max(0, structure - scoring.getBehaviorPenalty());
            professionalism = Math.max(0, professionalism - scoring.getBehaviorPenalty());
        }

        double total = round(clarity + articulation + structure + professionalism);
        return CommunicationScore.builder()
                .clarity(round(clarity))
                .articulation(round(articulation))
                .structure(round(structure))
                .professionalism(round(professionalism))
                .total(total)
                .grade(grade(total / 40.0 * 100.0))
                .build();
    }

    private double articulation(CandidateResponse response) {
        String lower = TextSignals.lower(response.getText());
        String[] words = TextSignals.words(lower);
        if (words.length == 0) {
            return 0;
        }
        double score = 5;
        double vocabulary = (double) new HashSet<>(Arrays.asList(words)).size() / words.length;
        if (vocabulary > 0.7) {
            score += 2;
        } else if (vocabulary > 0.5) {
            score += 1;
        }
        InterviewProperties.Scoring scoring = properties.getScoring();
        if (scoring.getActionVerbs().stream().anyMatch(lower::contains)) {
            score += 2;
        }
        if (TextSignals.countTerms(lower, scoring.getFillerWords()) > 3) {
            score -= 1;
        }
        return TextSignals.clamp(score, 0, 10);
    }

    private double structure(CandidateResponse response) {
        String lower = TextSignals.lower(response.getText());
        if (lower.isBlank()) {
            return 0;
        }
        double score = 5;
        int connectors = TextSignals.countTerms(lower, properties.getEvaluation().getConnectors());
        score += Math.min(3, connectors);
        long sentences = TextSignals.sentenceCount(lower);
        if (sentences >= 4) {
            score += 2;
        } else if (sentences >= 2) {
            score += 1;
        }
        return TextSignals.clamp(score, 0, 10);
    }

    private double professionalism(CandidateResponse response) {
        String text = response.getText() == null ? "" : response.getText();
        int wordCount = TextSignals.words(text).length;
        if (wordCount == 0) {
            return 0;
        }
        double score = 8;
        score -= TextSignals.countTerms(TextSignals.lower(text), properties.getScoring().getCasualPhrases());
        if (wordCount < 15) {
            score -= 2;
        }
        if (!UPPERCASE.matcher(text).find() && wordCount > 10) {
            score -= 1;
        }
        return TextSignals.clamp(score, 0, 10);
    }

    // ─── Technical ──────────────────────────────────────────────────────

    TechnicalScore scoreTechnical(List<Answered> technical, JobRole role) {
        if (technical.isEmpty()) {
            return TechnicalScore.builder().grade(Grade.F).build();
        }
        double depth = average(technical, a -> a.getEvaluation().getDepthScore());
        double accuracy = average(technical, a -> a.getEvaluation().getTechnicalAccuracy() == null
                ? a.getEvaluation().getDepthScore()
                : a.getEvaluation().getTechnicalAccuracy());
        double relevance = average(technical, a -> relevance(a, role));
        double problemSolving = average(technical, a -> a.getEvaluation().getCompletenessScore());

        double total = round(depth + accuracy + relevance + problemSolving);
        return TechnicalScore.builder()
                .depth(round(depth))
                .accuracy(round(accuracy))
                .relevance(round(relevance))
                .problemSolving(round(problemSolving))
                .total(total)
                .grade(grade(total / 40.0 * 100.0))
                .build();
    }

    private double relevance(Answered answered, JobRole role) {
        String lower = TextSignals.lower(answered.getResponse().getText());
        if (lower.isBlank()) {
            return 0;
        }
        List<String> skillTerms = role.getTechnicalSkills().stream()
                .flatMap(skill -> Stream.concat(Stream.of(skill), Arrays.stream(skill.split("[/&]"))))
                .map(String::trim)
                .filter(term -> term.length() >= 3)
                .collect(Collectors.toList());
        String category = answered.getQuestion().getCategory() == null
                ? "" : answered.getQuestion().getCategory().toLowerCase(Locale.ROOT);
        List<String> categoryTerms = properties.getEvaluation().getCategoryKeywords().getOrDefault(category, List.of());

        double score = 5
                + Math.min(3, TextSignals.countTerms(lower, skillTerms))
                + Math.min(2, TextSignals.countTerms(lower, categoryTerms));
        return TextSignals.clamp(score, 0, 10);
    }

    // ─── Overall ────────────────────────────────────────────────────────

    OverallScore overall(CommunicationScore communication, TechnicalScore technical,
                         boolean anyAnswers, boolean anyTechnical) {
        if (!anyAnswers) {
            return new OverallScore(0, Grade.F);
        }
        InterviewProperties.Scoring scoring = properties.getScoring();
        double communicationPercent = communication.getTotal() / 40.0 * 100.0;
        double technicalPercent = technical.getTotal() / 40.0 * 100.0;

        double score;
        if (anyTechnical || !scoring.isCommunicationOnlyWithoutTechnical()) {
            double weights = scoring.getCommunicationWeight() + scoring.getTechnicalWeight();
            score = (communicationPercent * scoring.getCommunicationWeight()
                    + technicalPercent * scoring.getTechnicalWeight()) / weights;
        } else {
            score = communicationPercent;
        }
        score = round(TextSignals.clamp(score, 0, 100));
        return new OverallScore(score, grade(score));
    }

    /** Letter grade for a percentage; bands are checked from the top so the mapping is monotonic. */
    public Grade grade(double percent) {
        InterviewProperties.Scoring scoring = properties.getScoring();
        if (percent >= scoring.getGradeA()) {
            return Grade.A;
        }
        if (percent >= scoring.getGradeB()) {
            return Grade.B;
        }
        if (percent >= scoring.getGradeC()) {
            return Grade.C;
        }
        if (percent >= scoring.getGradeD()) {
            return Grade.D;
        }
        return Grade.F;
    }

    // ─── Strengths and improvements ─────────────────────────────────────

    /** Average of depth, clarity and completeness per question category, in first-seen order. */
    Map<String, Double> categoryAverages(List<Answered> answered) {
        Map<String, List<Double>> byCategory = new LinkedHashMap<>();
        for (Answered a : answered) {
            ResponseEvaluation e = a.getEvaluation();
            double mean = (e.getDepthScore() + e.getClarityScore() + e.getCompletenessScore()) / 3.0;
            byCategory.computeIfAbsent(a.getQuestion().getCategory(), key -> new ArrayList<>()).add(mean);
        }
        Map<String, Double> averages = new LinkedHashMap<>();
        byCategory.forEach((category, scores) -> averages.put(category, round(TextSignals.average(scores))));
        return averages;
    }

    private List<String> strengths(List<Answered> answered, ScoringRubric rubric, boolean anyTechnical) {
        List<String> strengths = new ArrayList<>();
        if (answered.isEmpty()) {
            return strengths;
        }
        double threshold = properties.getScoring().getStrengthThreshold();
        categoryAverages(answered).forEach((category, average) -> {
            if (average >= threshold) {
                strengths.add("Strong performance on " + category + " questions");
            }
        });

        CommunicationScore c = rubric.getCommunication();
        if (c.getClarity() >= threshold) {
            strengths.add("Clear and direct communication style");
        }
        if (c.getArticulation() >= threshold) {
            strengths.add("Strong articulation and word choice");
        }
        if (c.getStructure() >= threshold) {
            strengths.add("Well-structured and organized responses");
        }
        if (c.getProfessionalism() >= threshold) {
            strengths.add("Professional and appropriate tone throughout");
        }
        if (anyTechnical) {
            TechnicalScore t = rubric.getTechnical();
            if (t.getDepth() >= threshold) {
                strengths.add("Demonstrated deep technical knowledge");
            }
            if (t.getAccuracy() >= threshold) {
                strengths.add("Technically accurate and precise explanations");
            }
            if (t.getRelevance() >= threshold) {
                strengths.add("Highly relevant experience and skills for the role");
            }
            if (t.getProblemSolving() >= threshold) {
                strengths.add("Strong problem-solving and analytical skills");
            }
        }
        long followUps = answered.stream().filter(a -> a.getEvaluation().isNeedsFollowUp()).count();
        if (followUps <= answered.size() * 0.2) {
            strengths.add("Provided complete answers with minimal need for follow-up");
        }
        return strengths;
    }

    private List<Improvement> improvements(List<Answered> answered, ScoringRubric rubric, boolean anyTechnical,
                                           JobRole role) {
        List<RankedImprovement> ranked = new ArrayList<>();
        if (answered.isEmpty()) {
            return List.of();
        }
        double threshold = properties.getScoring().getStrengthThreshold();

        Set<String> technicalCategories = new HashSet<>();
        answered.stream()
                .filter(a -> a.getQuestion().isTechnical())
                .forEach(a -> technicalCategories.add(a.getQuestion().getCategory()));
        categoryAverages(answered).forEach((category, average) -> {
            if (average < threshold) {
                String suggestion = technicalCategories.contains(category)
                        ? "Review core " + category + " concepts and practice explaining them with a concrete example."
                        : "Structure " + category + " stories with the STAR method (Situation, Task, Action, Result).";
                ranked.add(ranked(threshold - average, category,
                        "Answers on " + category + " questions averaged " + average + "/10", suggestion));
            }
        });

        CommunicationScore c = rubric.getCommunication();
        addIfWeak(ranked, threshold, c.getClarity(), "Communication - Clarity",
                "Responses could be clearer and more direct",
                "Structure your answers with clear topic sentences and logical flow. Use transition words to connect ideas.");
        addIfWeak(ranked, threshold, c.getArticulation(), "Communication - Articulation",
                "Word choice and expression could be more precise",
                "Use specific technical terminology where appropriate. Practice explaining complex concepts in simple terms.");
        addIfWeak(ranked, threshold, c.getStructure(), "Communication - Structure",
                "Responses lack consistent organization",
                "Use frameworks like STAR for behavioral questions. For technical questions, state the problem, explain your approach, then discuss the solution.");
        addIfWeak(ranked, threshold, c.getProfessionalism(), "Communication - Professionalism",
                "Tone or language could be more professional",
                "Maintain a professional tone throughout and avoid casual language.");

        if (anyTechnical) {
            TechnicalScore t = rubric.getTechnical();
            addIfWeak(ranked, threshold, t.getDepth(), "Technical - Depth",
                    "Responses lack sufficient technical depth",
                    "Provide more detailed explanations of technical concepts. Discuss trade-offs, alternatives, and implementation details.");
            addIfWeak(ranked, threshold, t.getAccuracy(), "Technical - Accuracy",
                    "Technical accuracy needs improvement",
                    "Review fundamental concepts for your role and use precise technical terminology.");
            addIfWeak(ranked, threshold, t.getRelevance(), "Technical - Relevance",
                    "Responses could be more relevant to the role",
                    "Focus on skills and experiences directly related to " + role.getName()
                            + ". Highlight relevant technologies and methodologies.");
            addIfWeak(ranked, threshold, t.getProblemSolving(), "Technical - Problem Solving",
                    "Problem-solving approach could be more comprehensive",
                    "Walk through your thought process step by step: how you identify problems, evaluate options, and implement solutions.");
        }

        return ranked.stream()
                .sorted(Comparator.comparingDouble((RankedImprovement r) -> r.gap).reversed())
                .map(r -> r.improvement)
                .collect(Collectors.toList());
    }

    private void addIfWeak(List<RankedImprovement> ranked, double threshold, double score, String category,
                           String observation, String suggestion) {
        if (score < threshold) {
            ranked.add(ranked(threshold - score, category, observation, suggestion));
        }
    }

    private RankedImprovement ranked(double gap, String category, String observation, String suggestion) {
        return new RankedImprovement(gap, new Improvement(category, priority(gap), observation, suggestion));
    }

    static Priority priority(double gap) {
        if (gap >= 3) {
            return Priority.HIGH;
        }
        if (gap >= 1.5) {
            return Priority.MEDIUM;
        }
        return Priority.LOW;
    }

    // ─── Resume alignment, breakdown, summary ───────────────────────────

    private AlignmentFeedback alignment(ResumeAnalysis analysis) {
        if (analysis == null) {
            return null;
        }
        return AlignmentFeedback.builder()
                .alignmentScore(analysis.getAlignmentScore() == null ? 0 : analysis.getAlignmentScore().getOverall())
                .matchedSkills(analysis.getMatchedSkills().stream().map(Skill::getName).collect(Collectors.toList()))
                .missingSkills(analysis.getGaps().stream().map(Gap::getSkill).collect(Collectors.toList()))
                .summary(analysis.getSummary())
                .build();
    }

    String questionFeedback(ResponseEvaluation evaluation) {
        List<String> parts = new ArrayList<>();
        double mean = (evaluation.getDepthScore() + evaluation.getClarityScore()
                + evaluation.getCompletenessScore()) / 3.0;
        if (mean >= 8) {
            parts.add("Strong response.");
        } else if (mean >= 6) {
            parts.add("Good response.");
        } else {
            parts.add("Response needs improvement.");
        }
        if (evaluation.getDepthScore() < 6) {
            parts.add("Consider providing more technical depth and detail.");
        }
        if (evaluation.getClarityScore() < 6) {
            parts.add("Work on making your explanation clearer and more structured.");
        }
        if (evaluation.getCompletenessScore() < 6) {
            parts.add("Address all aspects of the question more thoroughly.");
        }
        if (evaluation.getTechnicalAccuracy() != null && evaluation.getTechnicalAccuracy() < 6) {
            parts.add("Review the technical concepts to ensure accuracy.");
        }
        if (evaluation.getDepthScore() >= 8) {
            parts.add("Excellent technical depth demonstrated.");
        }
        if (evaluation.getClarityScore() >= 8) {
            parts.add("Very clear and well-articulated response.");
        }
        return String.join(" ", parts);
    }

    private String summary(ScoringRubric rubric, List<String> strengths, List<Improvement> improvements,
                           int answered, int total, boolean endedEarly) {
        OverallScore overall = rubric.getOverall();
        StringBuilder summary = new StringBuilder("Overall Performance: ")
                .append(overall.getGrade()).append(" (").append(overall.getScore()).append("/100). ");
        if (answered == 0) {
            summary.append("No questions were answered, so there is nothing to score yet.");
        } else {
            summary.append(gradeSentence(overall.getGrade()));
            if (!strengths.isEmpty()) {
                summary.append(" Top strength: ").append(strengths.get(0)).append('.');
            }
            if (!improvements.isEmpty()) {
                summary.append(" Top area to improve: ").append(improvements.get(0).getCategory()).append('.');
            }
        }
        if (endedEarly) {
            summary.append(" The interview ended early after ").append(answered).append(" answer(s) to ")
                    .append(total).append(" planned questions; this report covers answered questions only.");
        }
        return summary.toString();
    }

    private static String gradeSentence(Grade grade) {
        switch (grade) {
            case A:
                return "Excellent interview performance with strong technical knowledge and communication.";
            case B:
                return "Good interview performance with room for some refinement.";
            case C:
                return "Satisfactory interview performance. Focus on the improvement areas below.";
            case D:
                return "Interview performance needs improvement. Review the feedback and practice the suggested areas.";
            default:
                return "Interview performance requires significant improvement. Consider additional preparation.";
        }
    }

    private static double average(List<Answered> answered, ToDoubleFunction<Answered> score) {
        return answered.stream().mapToDouble(score).average().orElse(0.0);
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
