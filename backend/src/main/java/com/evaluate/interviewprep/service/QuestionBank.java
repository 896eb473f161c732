package com.evaluate.interviewprep.service;

import com.evaluate.interviewprep.config.InterviewProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Question templates loaded from the classpath at startup.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QuestionBank {

    private final ObjectMapper objectMapper;
    private final InterviewProperties properties;

    private BankData data = new BankData();

    @Data
    @NoArgsConstructor
    public static class Template {
        private String text;
        private String category;
        private int difficultyOffset;
        private Integer maxDifficulty;
        private List<String> expectedElements = new ArrayList<>();

        public int difficultyFor(int expectedDepth) {
            int difficulty = expectedDepth + difficultyOffset;
            if (maxDifficulty != null) {
                difficulty = Math.min(difficulty, maxDifficulty);
            }
            return Math.max(1, Math.min(10, difficulty));
        }
    }

    @Data
    @NoArgsConstructor
    public static class CompetencyTemplate {
        private String text;
        private int count;
        private List<String> expectedElements = new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    public static class BankData {
        private Map<String, List<Template>> technical = new LinkedHashMap<>();
        private List<Template> behavioral = new ArrayList<>();
        private CompetencyTemplate competencyTemplate = new CompetencyTemplate();
        private List<String> drillTemplates = new ArrayList<>();
        private Map<String, List<String>> followUps = new LinkedHashMap<>();
        private List<String> technologies = new ArrayList<>();
    }

    @PostConstruct
    public void initialize() {
        String location = properties.getQuestions().getBankLocation();
        Resource resource = new ClassPathResource(location);
        try (InputStream in = resource.getInputStream()) {
            data = objectMapper.readValue(in, BankData.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not load question bank from " + location, e);
        }
        int technicalCount = data.getTechnical().values().stream().mapToInt(List::size).sum();
        log.info("Loaded question bank: {} technical templates across {} roles, {} behavioral templates",
                technicalCount, data.getTechnical().size(), data.getBehavioral().size());
    }

    public List<Template> technicalTemplates(String roleId) {
        return data.getTechnical().getOrDefault(roleId, List.of());
    }

    public List<Template> behavioralTemplates() {
        return data.getBehavioral();
    }

    public CompetencyTemplate competencyTemplate() {
        return data.getCompetencyTemplate();
    }

    public List<String> drillTemplates() {
        return data.getDrillTemplates();
    }

    /** Follow-up phrasings keyed by follow-up reason value, plus "technology" for technology probes. */
    public List<String> followUps(String key) {
        return data.getFollowUps().getOrDefault(key, List.of());
    }

    public List<String> technologies() {
        return data.getTechnologies();
    }
}
