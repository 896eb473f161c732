package com.evaluate.interviewprep.service;

import com.evaluate.interviewprep.exception.ResumeAnalysisException;
import com.evaluate.interviewprep.model.Gap;
import com.evaluate.interviewprep.model.JobRole;
import com.evaluate.interviewprep.model.ResumeAnalysis;
import com.evaluate.interviewprep.model.ResumeDocument;
import com.evaluate.interviewprep.model.Skill;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class KeywordResumeAnalyzerTest {

    private static final String RESUME = String.join("\n",
            "Jordan Lee",
            "Summary",
            "Backend developer focused on reliable services.",
            "Experience",
            "Senior Engineer at Acme Corp, 2019 - Present",
            "Engineer at Initech, 2016 - 2019",
            "Skills: Python, React, AWS, Docker, PostgreSQL",
            "Projects",
            "Order pipeline rewrite",
            "Education",
            "BSc Computer Science");

    private final KeywordResumeAnalyzer analyzer = new KeywordResumeAnalyzer();
    private final JobRole softwareEngineer = new RoleCatalog().roleById("software-engineer");

    @Test
    void splitsSectionsAndExtractsSkills() {
        ResumeAnalysis analysis = analyzer.analyze(new ResumeDocument(RESUME, "text", "resume.txt"), softwareEngineer);

        assertTrue(analysis.getParsedResume().getSections().containsKey("experience"));
        assertTrue(analysis.getParsedResume().getSections().containsKey("skills"));
        List<String> skills = analysis.getTechnicalSkills().stream().map(Skill::getName).collect(Collectors.toList());
        assertTrue(skills.containsAll(List.of("Python", "React", "AWS", "Docker", "PostgreSQL")));
    }

    @Test
    void matchesRoleSkillsAndReportsGaps() {
        ResumeAnalysis analysis = analyzer.analyze(new ResumeDocument(RESUME, "text", "resume.txt"), softwareEngineer);

        assertTrue(analysis.getMatchedSkills().stream().anyMatch(s -> s.getName().equals("Python")));
        assertFalse(analysis.getGaps().isEmpty());
        assertTrue(analysis.getStrengths().stream().anyMatch(s -> s.getArea().equals("Technical Skills")));
        assertTrue(analysis.getStrengths().stream().anyMatch(s -> s.getArea().equals("Relevant Experience")));
    }

    @Test
    void alignmentIsAPercentage() {
        ResumeAnalysis analysis = analyzer.analyze(new ResumeDocument(RESUME, "text", null), softwareEngineer);

        int overall = analysis.getAlignmentScore().getOverall();
        assertTrue(overall > 0 && overall <= 100);
        assertTrue(analysis.getSummary().startsWith("Overall alignment score: " + overall + "%"));
    }

    @Test
    void skillsWithoutHeadersAreReadFromRawText() {
        ResumeAnalysis analysis = analyzer.analyze(
                new ResumeDocument("Built services in Java and Kubernetes.", "text", null), softwareEngineer);

        List<String> skills = analysis.getTechnicalSkills().stream().map(Skill::getName).collect(Collectors.toList());
        assertTrue(skills.contains("Java"));
        assertTrue(skills.contains("Kubernetes"));
        assertFalse(skills.contains("JavaScript"));
    }

    @Test
    void shortSkillNamesDoNotCoverLongerRoleSkills() {
        ResumeAnalysis analysis = analyzer.analyze(new ResumeDocument("Skills: Go", "text", null), softwareEngineer);

        List<String> gaps = analysis.getGaps().stream().map(Gap::getSkill).collect(Collectors.toList());
        assertTrue(gaps.contains("Algorithms"));
        assertFalse(gaps.contains("Programming Languages"));
    }

    @Test
    void javaIsNotJavaScript() {
        JobRole frontend = new RoleCatalog().roleById("frontend-engineer");

        ResumeAnalysis analysis = analyzer.analyze(new ResumeDocument("Skills: Java", "text", null), frontend);

        assertTrue(analysis.getMatchedSkills().isEmpty());
        assertTrue(analysis.getGaps().stream().anyMatch(g -> g.getSkill().equals("JavaScript/TypeScript")));
    }

    @Test
    void slashSeparatedRoleSkillsAcceptAnyAlternative() {
        JobRole frontend = new RoleCatalog().roleById("frontend-engineer");

        ResumeAnalysis analysis = analyzer.analyze(new ResumeDocument("Skills: Vue, TypeScript", "text", null), frontend);

        List<String> gaps = analysis.getGaps().stream().map(Gap::getSkill).collect(Collectors.toList());
        assertFalse(gaps.contains("React/Vue/Angular"));
        assertFalse(gaps.contains("JavaScript/TypeScript"));
        assertTrue(gaps.contains("HTML/CSS"));
    }

    @Test
    void emptyResumeIsRejected() {
        assertThrows(ResumeAnalysisException.class,
                () -> analyzer.analyze(new ResumeDocument("  ", "text", null), softwareEngineer));
        assertThrows(ResumeAnalysisException.class, () -> analyzer.analyze(null, softwareEngineer));
    }
}
