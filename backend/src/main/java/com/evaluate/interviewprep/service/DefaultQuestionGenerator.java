package com.evaluate.interviewprep.service;

import com.evaluate.interviewprep.config.InterviewProperties;
import com.evaluate.interviewprep.model.CandidateResponse;
import com.evaluate.interviewprep.model.ExperienceLevel;
import com.evaluate.interviewprep.model.FollowUpReason;
import com.evaluate.interviewprep.model.InterviewQuestion;
import com.evaluate.interviewprep.model.JobRole;
import com.evaluate.interviewprep.model.QuestionCategory;
import com.evaluate.interviewprep.model.QuestionType;
import com.evaluate.interviewprep.model.ResponseEvaluation;
import com.evaluate.interviewprep.model.ResumeAnalysis;
import com.evaluate.interviewprep.model.ResumeReference;
import com.evaluate.interviewprep.model.Skill;
import com.evaluate.interviewprep.model.Strength;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.ToDoubleFunction;
import java.util.stream.Collectors;

@Service
@Slf4j
public class DefaultQuestionGenerator implements QuestionGenerator {

    private static final String RESUME_TECHNICAL_TEXT =
            "I see you have experience with %1$s. Can you describe a challenging problem you solved using %1$s and your approach?";
    private static final String RESUME_BEHAVIORAL_TEXT =
            "Your resume mentions %s. Can you walk me through that experience and what you learned?";

    private final QuestionBank bank;
    private final InterviewProperties properties;
    private final InterviewProperties.Questions config;
    private final Random random;
    private final AtomicLong idSequence = new AtomicLong();

    public DefaultQuestionGenerator(QuestionBank bank, InterviewProperties properties, Random random) {
        this.bank = bank;
        this.properties = properties;
        this.config = properties.getQuestions();
        this.random = random;
    }

    // ─── Question sets ──────────────────────────────────────────────────

    @Override
    public List<InterviewQuestion> generateQuestionSet(JobRole role, ExperienceLevel level,
                                                       ResumeAnalysis resumeAnalysis, String drillCategory) {
        int count = questionCount(level);
        List<InterviewQuestion> questions;

        if (drillCategory != null && !drillCategory.isBlank()) {
            questions = drillQuestions(role, level, drillCategory.trim(), count);
        } else {
            int technicalCount = technicalCount(role, count);
            questions = new ArrayList<>(technicalQuestions(role, level, technicalCount, resumeAnalysis));
            questions.addAll(behavioralQuestions(role, level, count - technicalCount, resumeAnalysis));
            topUp(questions, role, level, count);
            Collections.shuffle(questions, random);
        }

        List<InterviewQuestion> ordered = avoidConsecutiveCategories(questions);
        log.debug("Generated {} questions for role {} at level {} (drill: {})",
                ordered.size(), role.getId(), level.getLevel(), drillCategory);
        return ordered;
    }

    int questionCount(ExperienceLevel level) {
        int span = config.getMaxQuestions() - config.getMinQuestions();
        int count = config.getMinQuestions() + (int) Math.round((level.getExpectedDepth() - 1) * span / 9.0);
        return Math.max(config.getMinQuestions(), Math.min(config.getMaxQuestions(), count));
    }

    int technicalCount(JobRole role, int count) {
        double total = role.getQuestionCategories().stream().mapToDouble(QuestionCategory::getWeight).sum();
        double technical = role.getQuestionCategories().stream()
                .filter(QuestionCategory::isTechnicalFocus)
                .mapToDouble(QuestionCategory::getWeight)
                .sum();
        double share = total > 0 ? technical / total : 0.5;
        double ratio = TextSignals.clamp(share, config.getMinTechnicalRatio(), config.getMaxTechnicalRatio());
        ratio += (random.nextDouble() * 2 - 1) * config.getRatioJitter();
        ratio = TextSignals.clamp(ratio, config.getMinTechnicalRatio(), config.getMaxTechnicalRatio());
        int technicalCount = (int) Math.round(count * ratio);
        return Math.max(1, Math.min(count - 1, technicalCount));
    }

    private List<InterviewQuestion> technicalQuestions(JobRole role, ExperienceLevel level, int count,
                                                       ResumeAnalysis resume) {
        List<InterviewQuestion> questions = new ArrayList<>();
        List<String> resumeTerms = new ArrayList<>();

        if (resume != null && !resume.getTechnicalSkills().isEmpty()) {
            int resumeCount = Math.min(config.getMaxResumeTechnicalQuestions(), Math.max(1, count / 2));
            List<Skill> skills = preferredSkills(resume);
            for (Skill skill : skills.subList(0, Math.min(resumeCount, skills.size()))) {
                questions.add(resumeTechnicalQuestion(role, level, skill));
            }
            skills.forEach(skill -> resumeTerms.add(skill.getName().toLowerCase(Locale.ROOT)));
        }

        Map<String, Double> weights = role.getQuestionCategories().stream()
                .filter(QuestionCategory::isTechnicalFocus)
                .collect(Collectors.toMap(c -> c.getName().toLowerCase(Locale.ROOT), QuestionCategory::getWeight,
                        Double::sum, HashMap::new));
        double fallbackWeight = weights.values().stream().mapToDouble(Double::doubleValue).min().orElse(0.1);

        ToDoubleFunction<QuestionBank.Template> weight = template -> {
            String category = template.getCategory().toLowerCase(Locale.ROOT);
            double base = weights.getOrDefault(category, fallbackWeight);
            List<String> keywords = properties.getEvaluation().getCategoryKeywords().getOrDefault(category, List.of());
            return keywords.stream().anyMatch(resumeTerms::contains) ? base * 2 : base;
        };

        List<QuestionBank.Template> selected =
                weightedSample(bank.technicalTemplates(role.getId()), count - questions.size(), weight);
        for (QuestionBank.Template template : selected) {
            questions.add(fromTemplate(template, QuestionType.TECHNICAL, level));
        }
        return questions;
    }

    private List<InterviewQuestion> behavioralQuestions(JobRole role, ExperienceLevel level, int count,
                                                        ResumeAnalysis resume) {
        List<InterviewQuestion> questions = new ArrayList<>();
        if (count <= 0) {
            return questions;
        }
        if (resume != null && !resume.getStrengths().isEmpty()) {
            Strength strength = resume.getStrengths().stream()
                    .max(Comparator.comparingDouble(Strength::getRelevance))
                    .orElseThrow();
            questions.add(resumeBehavioralQuestion(level, strength));
        }
        List<QuestionBank.Template> selected =
                weightedSample(behavioralPool(role), count - questions.size(), template -> 1.0);
        for (QuestionBank.Template template : selected) {
            questions.add(fromTemplate(template, QuestionType.BEHAVIORAL, level));
        }
        return questions;
    }

    @Override
    public List<String> drillCategories(JobRole role) {
        Set<String> categories = new LinkedHashSet<>();
        role.getQuestionCategories().forEach(c -> categories.add(c.getName()));
        bank.technicalTemplates(role.getId()).forEach(t -> categories.add(t.getCategory()));
        behavioralPool(role).forEach(t -> categories.add(t.getCategory()));
        return new ArrayList<>(categories);
    }

    /** Common behavioral templates plus one per leading role competency. */
    private List<QuestionBank.Template> behavioralPool(JobRole role) {
        List<QuestionBank.Template> pool = new ArrayList<>(bank.behavioralTemplates());
        QuestionBank.CompetencyTemplate competency = bank.competencyTemplate();
        role.getBehavioralCompetencies().stream()
                .limit(competency.getCount())
                .forEach(name -> {
                    QuestionBank.Template template = new QuestionBank.Template();
                    template.setText(String.format(competency.getText(), name.toLowerCase(Locale.ROOT)));
                    template.setCategory(name);
                    List<String> expected = new ArrayList<>(competency.getExpectedElements());
                    expected.add(name.toLowerCase(Locale.ROOT));
                    template.setExpectedElements(expected);
                    pool.add(template);
                });
        return pool;
    }

    private List<InterviewQuestion> drillQuestions(JobRole role, ExperienceLevel level, String category, int count) {
        List<InterviewQuestion> questions = new ArrayList<>();
        List<QuestionBank.Template> technical = matchingCategory(bank.technicalTemplates(role.getId()), category);
        List<QuestionBank.Template> behavioral = matchingCategory(behavioralPool(role), category);
        Collections.shuffle(technical, random);
        Collections.shuffle(behavioral, random);

        technical.forEach(t -> questions.add(fromTemplate(t, QuestionType.TECHNICAL, level)));
        behavioral.forEach(t -> questions.add(fromTemplate(t, QuestionType.BEHAVIORAL, level)));

        QuestionType drillType = drillType(role, category, !behavioral.isEmpty());
        List<String> expected = properties.getEvaluation().getCategoryKeywords()
                .getOrDefault(category.toLowerCase(Locale.ROOT), List.of());
        for (String text : bank.drillTemplates()) {
            if (questions.size() >= count) {
                break;
            }
            questions.add(InterviewQuestion.builder()
                    .id(nextId())
                    .type(drillType)
                    .text(String.format(text, category))
                    .category(category)
                    .difficulty(level.getExpectedDepth())
                    .expectedElements(new ArrayList<>(expected.subList(0, Math.min(4, expected.size()))))
                    .build());
        }
        return questions.size() > count ? new ArrayList<>(questions.subList(0, count)) : questions;
    }

    private QuestionType drillType(JobRole role, String category, boolean hasBehavioralTemplates) {
        return role.getQuestionCategories().stream()
                .filter(c -> c.getName().equalsIgnoreCase(category))
                .findFirst()
                .map(c -> c.isTechnicalFocus() ? QuestionType.TECHNICAL : QuestionType.BEHAVIORAL)
                .orElse(hasBehavioralTemplates ? QuestionType.BEHAVIORAL : QuestionType.TECHNICAL);
    }

    /** Fills a short set with drill prompts over the role's categories, heaviest first. */
    private void topUp(List<InterviewQuestion> questions, JobRole role, ExperienceLevel level, int count) {
        List<QuestionCategory> categories = role.getQuestionCategories().stream()
                .sorted(Comparator.comparingDouble(QuestionCategory::getWeight).reversed())
                .collect(Collectors.toList());
        for (String text : bank.drillTemplates()) {
            for (QuestionCategory category : categories) {
                if (questions.size() >= count) {
                    return;
                }
                questions.add(InterviewQuestion.builder()
                        .id(nextId())
                        .type(category.isTechnicalFocus() ? QuestionType.TECHNICAL : QuestionType.BEHAVIORAL)
                        .text(String.format(text, category.getName()))
                        .category(category.getName())
                        .difficulty(level.getExpectedDepth())
                        .build());
            }
        }
    }

    // ─── Resume-aware questions ─────────────────────────────────────────

    /** Role-matched skills first, then the rest, without duplicates. */
    private List<Skill> preferredSkills(ResumeAnalysis resume) {
        Map<String, Skill> ordered = new LinkedHashMap<>();
        resume.getMatchedSkills().forEach(s -> ordered.putIfAbsent(s.getName().toLowerCase(Locale.ROOT), s));
        resume.getTechnicalSkills().forEach(s -> ordered.putIfAbsent(s.getName().toLowerCase(Locale.ROOT), s));
        return new ArrayList<>(ordered.values());
    }

    private InterviewQuestion resumeTechnicalQuestion(JobRole role, ExperienceLevel level, Skill skill) {
        return InterviewQuestion.builder()
                .id(nextId())
                .type(QuestionType.TECHNICAL)
                .text(String.format(RESUME_TECHNICAL_TEXT, skill.getName()))
                .category(categoryForSkill(role, skill))
                .difficulty(level.getExpectedDepth())
                .resumeContext(new ResumeReference("skills", skill.getName(),
                        "References candidate's stated experience with " + skill.getName()))
                .expectedElements(new ArrayList<>(List.of("problem", "approach", "solution", "outcome")))
                .build();
    }

    private InterviewQuestion resumeBehavioralQuestion(ExperienceLevel level, Strength strength) {
        String evidence = strength.getEvidence().isEmpty() ? strength.getArea() : strength.getEvidence().get(0);
        return InterviewQuestion.builder()
                .id(nextId())
                .type(QuestionType.BEHAVIORAL)
                .text(String.format(RESUME_BEHAVIORAL_TEXT, evidence))
                .category(strength.getArea())
                .difficulty(level.getExpectedDepth())
                .resumeContext(new ResumeReference("experience", evidence,
                        "References candidate's stated experience in " + strength.getArea()))
                .expectedElements(new ArrayList<>(List.of("context", "action", "challenge", "result", "learn")))
                .build();
    }

    private String categoryForSkill(JobRole role, Skill skill) {
        String name = skill.getName().toLowerCase(Locale.ROOT);
        Map<String, List<String>> keywords = properties.getEvaluation().getCategoryKeywords();
        return role.getQuestionCategories().stream()
                .filter(QuestionCategory::isTechnicalFocus)
                .filter(c -> keywords.getOrDefault(c.getName().toLowerCase(Locale.ROOT), List.of()).contains(name))
                .map(QuestionCategory::getName)
                .findFirst()
                .orElse(skill.getCategory() != null ? skill.getCategory() : "Technical Skills");
    }

    // ─── Follow-ups ─────────────────────────────────────────────────────

    @Override
    public Optional<InterviewQuestion> generateFollowUp(InterviewQuestion parent, InterviewQuestion answered,
                                                        CandidateResponse response, ResponseEvaluation evaluation) {
        if (!evaluation.isNeedsFollowUp() || parent.getFollowUpCount() >= config.getFollowUpCap()) {
            return Optional.empty();
        }
        String lower = TextSignals.lower(response.getText());
        List<String> missed = answered.getExpectedElements().stream()
                .filter(element -> !lower.contains(element.toLowerCase(Locale.ROOT)))
                .collect(Collectors.toList());

        Optional<String> technology = answered.isTechnical()
                ? bank.technologies().stream().filter(t -> TextSignals.containsTerm(lower, t)).findFirst()
                : Optional.empty();

        String text;
        if (technology.isPresent() && !bank.followUps("technology").isEmpty()) {
            text = String.format(pick(bank.followUps("technology")), technology.get());
        } else {
            FollowUpReason reason = Objects.requireNonNullElse(evaluation.getFollowUpReason(), FollowUpReason.TOO_SHORT);
            List<String> phrasings = bank.followUps(reason.getValue());
            if (phrasings.isEmpty()) {
                phrasings = bank.followUps(FollowUpReason.TOO_SHORT.getValue());
            }
            text = phrasings.isEmpty() ? "Can you tell me more about that?" : pick(phrasings);
        }

        parent.setFollowUpCount(parent.getFollowUpCount() + 1);
        InterviewQuestion followUp = InterviewQuestion.builder()
                .id(nextId())
                .type(parent.getType())
                .text(text)
                .category(parent.getCategory())
                .difficulty(Math.max(1, answered.getDifficulty() - 1))
                .expectedElements(missed)
                .parentQuestionId(parent.getId())
                .build();
        log.debug("Follow-up {} generated for {} ({} of {})",
                followUp.getId(), parent.getId(), parent.getFollowUpCount(), config.getFollowUpCap());
        return Optional.of(followUp);
    }

    // ─── Helpers ────────────────────────────────────────────────────────

    /**
     * Greedy reorder that never places two questions of the same category back to back
     * while another category is still available. Picks the category with the most questions left.
     */
    List<InterviewQuestion> avoidConsecutiveCategories(List<InterviewQuestion> questions) {
        List<InterviewQuestion> remaining = new ArrayList<>(questions);
        List<InterviewQuestion> ordered = new ArrayList<>(questions.size());
        String previous = null;
        while (!remaining.isEmpty()) {
            Map<String, Long> left = remaining.stream()
                    .collect(Collectors.groupingBy(q -> categoryKey(q), Collectors.counting()));
            int pick = -1;
            long best = -1;
            for (int i = 0; i < remaining.size(); i++) {
                String key = categoryKey(remaining.get(i));
                if (key.equals(previous)) {
                    continue;
                }
                if (left.get(key) > best) {
                    best = left.get(key);
                    pick = i;
                }
            }
            if (pick < 0) {
                pick = 0;
            }
            InterviewQuestion next = remaining.remove(pick);
            ordered.add(next);
            previous = categoryKey(next);
        }
        return ordered;
    }

    private static String categoryKey(InterviewQuestion question) {
        return question.getCategory() == null ? "" : question.getCategory().toLowerCase(Locale.ROOT);
    }

    private List<QuestionBank.Template> matchingCategory(List<QuestionBank.Template> templates, String category) {
        return templates.stream()
                .filter(t -> t.getCategory().equalsIgnoreCase(category))
                .collect(Collectors.toCollection(ArrayList::new));
    }

    /** Weighted sampling without replacement. */
    private <T> List<T> weightedSample(List<T> items, int count, ToDoubleFunction<T> weight) {
        List<T> pool = new ArrayList<>(items);
        List<T> picked = new ArrayList<>();
        while (picked.size() < count && !pool.isEmpty()) {
            double total = pool.stream().mapToDouble(weight).sum();
            double target = random.nextDouble() * total;
            int index = 0;
            double cumulative = weight.applyAsDouble(pool.get(0));
            while (cumulative < target && index < pool.size() - 1) {
                index++;
                cumulative += weight.applyAsDouble(pool.get(index));
            }
            picked.add(pool.remove(index));
        }
        return picked;
    }

    private InterviewQuestion fromTemplate(QuestionBank.Template template, QuestionType type, ExperienceLevel level) {
        return InterviewQuestion.builder()
                .id(nextId())
                .type(type)
                .text(template.getText())
                .category(template.getCategory())
                .difficulty(template.difficultyFor(level.getExpectedDepth()))
                .expectedElements(new ArrayList<>(template.getExpectedElements()))
                .build();
    }

    private String pick(List<String> options) {
        return options.get(random.nextInt(options.size()));
    }

    private String nextId() {
        return "q-" + idSequence.incrementAndGet();
    }
}
