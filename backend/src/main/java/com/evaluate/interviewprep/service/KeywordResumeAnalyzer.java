package com.evaluate.interviewprep.service;

import com.evaluate.interviewprep.exception.ResumeAnalysisException;
import com.evaluate.interviewprep.model.AlignmentScore;
import com.evaluate.interviewprep.model.Gap;
import com.evaluate.interviewprep.model.JobRole;
import com.evaluate.interviewprep.model.ParsedResume;
import com.evaluate.interviewprep.model.ResumeAnalysis;
import com.evaluate.interviewprep.model.ResumeDocument;
import com.evaluate.interviewprep.model.Skill;
import com.evaluate.interviewprep.model.Strength;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Section and keyword based resume analysis. Good enough to personalize questions;
 * it makes no attempt at real document understanding.
 */
@Service
@Slf4j
public class KeywordResumeAnalyzer implements ResumeAnalyzer {

    private static final int GAP_IMPORTANCE = 7;
    private static final int CULTURAL_BASELINE = 70;
    private static final Pattern DATE_LINE = Pattern.compile("\\d{4}|\\d{1,2}/\\d{4}|present|current",
            Pattern.CASE_INSENSITIVE);

    private static final Map<String, List<String>> SECTION_HEADERS = new LinkedHashMap<>();
    private static final Pattern ROLE_SKILL_SEPARATOR = Pattern.compile("[/&]");
    private static final Map<String, String> SKILL_LEXICON = new LinkedHashMap<>();

    static {
        SECTION_HEADERS.put("summary", List.of("summary", "profile", "objective", "about"));
        SECTION_HEADERS.put("experience", List.of("experience", "work history", "employment"));
        SECTION_HEADERS.put("education", List.of("education", "academic", "qualifications"));
        SECTION_HEADERS.put("skills", List.of("skills", "competencies", "expertise"));
        SECTION_HEADERS.put("projects", List.of("projects", "portfolio", "work samples"));
        SECTION_HEADERS.put("achievements", List.of("achievements", "accomplishments", "awards", "honors"));
        SECTION_HEADERS.put("certifications", List.of("certifications", "certificates", "licenses"));

        addSkills("Programming Languages", "Python", "Java", "JavaScript", "TypeScript", "C++", "C#", "Ruby",
                "Go", "Rust", "PHP", "Swift", "Kotlin");
        addSkills("Frameworks", "React", "Angular", "Vue", "Django", "Flask", "Spring", "Express", "Node.js",
                "Next.js");
        addSkills("Databases", "SQL", "MySQL", "PostgreSQL", "MongoDB", "Redis", "DynamoDB", "Cassandra");
        addSkills("Cloud", "AWS", "Azure", "GCP", "Docker", "Kubernetes", "Terraform");
        addSkills("Tools", "Git", "Jenkins", "Jira", "Webpack", "Gradle", "Maven", "CI/CD");
        addSkills("Data Science", "Machine Learning", "Deep Learning", "TensorFlow", "PyTorch", "Scikit-learn",
                "Pandas", "NumPy", "Statistics");
        addSkills("Practices", "System Design", "Algorithms", "Data Structures", "Testing", "Microservices",
                "Security", "Agile", "Accessibility", "A/B Testing");
    }

    private static void addSkills(String category, String... names) {
        for (String name : names) {
            SKILL_LEXICON.put(name, category);
        }
    }

    @Override
    public ResumeAnalysis analyze(ResumeDocument document, JobRole role) {
        if (document == null || document.getContent() == null || document.getContent().isBlank()) {
            throw new ResumeAnalysisException("Resume content is empty");
        }
        ParsedResume parsed = parse(document);
        List<Skill> skills = extractSkills(parsed);
        List<Skill> matched = skills.stream()
                .filter(skill -> matchesRole(skill, role))
                .collect(Collectors.toList());
        List<String> experience = extractExperience(parsed);

        List<Strength> strengths = identifyStrengths(role, matched, experience, parsed);
        List<Gap> gaps = identifyGaps(role, skills);
        AlignmentScore alignment = alignment(role, matched, experience);

        log.info("Analyzed resume {} for role {}: {} skills, {} matched, alignment {}%",
                document.getFilename(), role.getId(), skills.size(), matched.size(), alignment.getOverall());

        return ResumeAnalysis.builder()
                .parsedResume(parsed)
                .technicalSkills(skills)
                .matchedSkills(matched)
                .strengths(strengths)
                .gaps(gaps)
                .alignmentScore(alignment)
                .summary(summary(strengths, gaps, alignment))
                .build();
    }

    ParsedResume parse(ResumeDocument document) {
        Map<String, String> sections = new LinkedHashMap<>();
        String current = "header";
        List<String> buffer = new ArrayList<>();

        for (String rawLine : document.getContent().split("\\r?\\n")) {
            String line = rawLine.trim();
            String header = sectionHeader(line);
            if (header != null) {
                flush(sections, current, buffer);
                current = header;
                buffer = new ArrayList<>();
                String inline = line.contains(":") ? line.substring(line.indexOf(':') + 1).trim() : "";
                if (!inline.isEmpty()) {
                    buffer.add(inline);
                }
            } else if (!line.isEmpty()) {
                buffer.add(line);
            }
        }
        flush(sections, current, buffer);

        return ParsedResume.builder()
                .rawText(document.getContent())
                .sections(sections)
                .format(document.getFormat())
                .parsedAt(Instant.now())
                .build();
    }

    /** Section key when the line reads like a header: short, and the header word leads it. */
    private String sectionHeader(String line) {
        if (line.isEmpty() || line.length() >= 50) {
            return null;
        }
        String lower = line.toLowerCase(Locale.ROOT);
        String label = lower.contains(":") ? lower.substring(0, lower.indexOf(':')) : lower;
        for (Map.Entry<String, List<String>> entry : SECTION_HEADERS.entrySet()) {
            for (String pattern : entry.getValue()) {
                if (label.contains(pattern) && label.split("\\s+").length <= 4) {
                    return entry.getKey();
                }
            }
        }
        return null;
    }

    private static void flush(Map<String, String> sections, String key, List<String> buffer) {
        if (!buffer.isEmpty()) {
            sections.merge(key, String.join("\n", buffer), (a, b) -> a + "\n" + b);
        }
    }

    List<Skill> extractSkills(ParsedResume parsed) {
        String source = parsed.getSections().getOrDefault("skills", parsed.getRawText());
        String lower = TextSignals.lower(source);
        return SKILL_LEXICON.entrySet().stream()
                .filter(entry -> TextSignals.containsTerm(lower, entry.getKey()))
                .map(entry -> new Skill(entry.getKey(), entry.getValue()))
                .collect(Collectors.toList());
    }

    private List<String> extractExperience(ParsedResume parsed) {
        String section = parsed.getSections().get("experience");
        if (section == null) {
            return List.of();
        }
        return section.lines()
                .filter(line -> DATE_LINE.matcher(line).find() || line.contains(" at "))
                .collect(Collectors.toList());
    }

    private boolean matchesRole(Skill skill, JobRole role) {
        return role.getTechnicalSkills().stream().anyMatch(roleSkill -> covers(roleSkill, skill));
    }

    /**
     * A role skill such as "React/Vue/Angular" is covered when one of its alternatives names the skill
     * exactly or its wording contains the skill's whole category, as "Cloud Platforms" does for "Cloud".
     */
    static boolean covers(String roleSkill, Skill skill) {
        String name = skill.getName().toLowerCase(Locale.ROOT);
        String category = skill.getCategory().toLowerCase(Locale.ROOT);
        String lowerRoleSkill = roleSkill.toLowerCase(Locale.ROOT);
        if (lowerRoleSkill.equals(name) || TextSignals.containsTerm(lowerRoleSkill, category)) {
            return true;
        }
        return ROLE_SKILL_SEPARATOR.splitAsStream(lowerRoleSkill)
                .map(String::trim)
                .anyMatch(alternative -> alternative.equals(name));
    }

    private List<Strength> identifyStrengths(JobRole role, List<Skill> matched, List<String> experience,
                                             ParsedResume parsed) {
        List<Strength> strengths = new ArrayList<>();
        if (!matched.isEmpty()) {
            strengths.add(new Strength("Technical Skills",
                    matched.stream().map(Skill::getName).collect(Collectors.toList()),
                    Math.min(10.0, 10.0 * matched.size() / role.getTechnicalSkills().size())));
        }
        if (!experience.isEmpty()) {
            strengths.add(new Strength("Relevant Experience", experience,
                    Math.min(10.0, 2.5 * experience.size())));
        }
        String projects = parsed.getSections().get("projects");
        if (projects != null) {
            List<String> names = projects.lines().limit(3).collect(Collectors.toList());
            strengths.add(new Strength("Project Experience", names, Math.min(10.0, 3.0 * names.size())));
        }
        return strengths;
    }

    private List<Gap> identifyGaps(JobRole role, List<Skill> skills) {
        List<Gap> gaps = new ArrayList<>();
        for (String roleSkill : role.getTechnicalSkills()) {
            boolean covered = skills.stream().anyMatch(skill -> covers(roleSkill, skill));
            if (!covered) {
                gaps.add(new Gap(roleSkill, GAP_IMPORTANCE, "Consider adding " + roleSkill
                        + " to your skillset or highlighting relevant experience with it."));
            }
        }
        return gaps;
    }

    private AlignmentScore alignment(JobRole role, List<Skill> matched, List<String> experience) {
        int roleSkills = role.getTechnicalSkills().size();
        double technical = roleSkills == 0 ? 0 : Math.min(100.0, 100.0 * matched.size() / roleSkills);
        double experienceScore = Math.min(100.0, experience.size() * 25.0);
        double overall = technical * 0.5 + experienceScore * 0.3 + CULTURAL_BASELINE * 0.2;
        return new AlignmentScore((int) Math.round(overall), (int) Math.round(technical),
                (int) Math.round(experienceScore), CULTURAL_BASELINE);
    }

    private String summary(List<Strength> strengths, List<Gap> gaps, AlignmentScore alignment) {
        StringBuilder summary = new StringBuilder("Overall alignment score: ")
                .append(alignment.getOverall()).append("%. ");
        if (strengths.isEmpty()) {
            summary.append("Limited alignment with role requirements detected. ");
        } else {
            summary.append("Key strengths identified: ")
                    .append(strengths.stream().map(Strength::getArea).collect(Collectors.joining(", ")))
                    .append(". ");
        }
        if (gaps.isEmpty()) {
            summary.append("Strong technical alignment with role requirements.");
        } else {
            summary.append(gaps.size()).append(" skill gap(s) identified for improvement.");
        }
        return summary.toString();
    }
}
