package com.evaluate.interviewprep.service;

import com.evaluate.interviewprep.config.InterviewProperties;
import com.evaluate.interviewprep.model.BehaviorType;
import com.evaluate.interviewprep.model.CandidateResponse;
import lombok.Value;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Labels the communication style of the latest answer.
 *
 * <p>Rules are checked in table order and the first match wins:
 * edge-case, confused, chatty, efficient, then standard as the fallback.
 */
@Service
public class BehaviorClassifier {

    private final InterviewProperties.Behavior config;
    private final Map<BehaviorType, Predicate<Signals>> rules = new LinkedHashMap<>();

    public BehaviorClassifier(InterviewProperties properties) {
        this.config = properties.getBehavior();
        rules.put(BehaviorType.EDGE_CASE, this::isEdgeCase);
        rules.put(BehaviorType.CONFUSED, this::isConfused);
        rules.put(BehaviorType.CHATTY, this::isChatty);
        rules.put(BehaviorType.EFFICIENT, this::isEfficient);
    }

    public BehaviorType classify(CandidateResponse response) {
        return classify(response == null ? null : response.getText());
    }

    public BehaviorType classify(String text) {
        Signals signals = Signals.of(text, config);
        return rules.entrySet().stream()
                .filter(rule -> rule.getValue().test(signals))
                .map(Map.Entry::getKey)
                .findFirst()
                .orElse(BehaviorType.STANDARD);
    }

    /**
     * True when a long answer echoes too few of the question's keywords.
     * Answers at or under {@code offTopicMinWords} are never flagged.
     */
    public boolean isOffTopic(String answer, String questionText) {
        if (TextSignals.words(answer).length <= config.getOffTopicMinWords()) {
            return false;
        }
        Set<String> questionKeywords = keywords(questionText);
        if (questionKeywords.isEmpty()) {
            return false;
        }
        Set<String> answerKeywords = keywords(answer);
        long echoed = questionKeywords.stream()
                .filter(kw -> answerKeywords.stream().anyMatch(aw -> aw.contains(kw) || kw.contains(aw)))
                .count();
        return (double) echoed / questionKeywords.size() < config.getOffTopicOverlapMin();
    }

    private Set<String> keywords(String text) {
        return Arrays.stream(TextSignals.words(TextSignals.lower(text).replaceAll("[^a-z0-9\\s]", " ")))
                .filter(word -> word.length() >= config.getKeywordMinLength())
                .filter(word -> !config.getStopWords().contains(word))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /** Share of the given history classified as {@code type}; 0 for an empty history. */
    public static double share(Collection<BehaviorType> history, BehaviorType type) {
        if (history == null || history.isEmpty()) {
            return 0.0;
        }
        return (double) history.stream().filter(type::equals).count() / history.size();
    }

    private boolean isEdgeCase(Signals s) {
        if (s.getWordCount() == 0) {
            return true;
        }
        if (s.getWordCount() == 1 && config.getSingleWordCommands().contains(s.getFirstWord())) {
            return true;
        }
        if (s.getWordCount() <= config.getCommandMaxWords()
                && TextSignals.containsAny(s.getLower(), config.getSkipPhrases())) {
            return true;
        }
        return s.getTrimmedLength() < config.getMinMeaningfulLength()
                || TextSignals.longWordShare(s.getText()) < config.getGibberishWordShare();
    }

    private boolean isConfused(Signals s) {
        if (TextSignals.containsAny(s.getLower(), config.getConfusionMarkers())) {
            return true;
        }
        // A short question back about the question itself
        return s.getLower().contains("?")
                && s.getWordCount() <= config.getCommandMaxWords() * 2
                && TextSignals.containsAny(s.getLower(), config.getQuestionReferenceTerms());
    }

    private boolean isChatty(Signals s) {
        if (s.getWordCount() > config.getChattyWordThreshold()) {
            return true;
        }
        int tangents = TextSignals.countTerms(s.getLower(), config.getTangentMarkers());
        return tangents >= config.getTangentMin() && tangents >= s.getTechnicalTerms();
    }

    private boolean isEfficient(Signals s) {
        if (s.getWordCount() >= config.getEfficientWordMax()) {
            return false;
        }
        double density = (double) s.getTechnicalTerms() / s.getWordCount();
        return density >= config.getEfficientDensityMin();
    }

    @Value
    private static class Signals {
        String text;
        String lower;
        int wordCount;
        int trimmedLength;
        String firstWord;
        int technicalTerms;

        static Signals of(String text, InterviewProperties.Behavior config) {
            String safe = text == null ? "" : text;
            String lower = TextSignals.lower(safe);
            String[] words = TextSignals.words(lower);
            String first = words.length == 0 ? "" : words[0].replaceAll("[^a-z]", "");
            int technical = TextSignals.countTerms(lower, config.getTechnicalTerms());
            return new Signals(safe, lower, words.length, safe.trim().length(), first, technical);
        }
    }
}
