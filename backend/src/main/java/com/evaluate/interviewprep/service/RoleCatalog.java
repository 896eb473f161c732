package com.evaluate.interviewprep.service;

import com.evaluate.interviewprep.exception.InvalidInputException;
import com.evaluate.interviewprep.model.ExperienceLevel;
import com.evaluate.interviewprep.model.JobRole;
import com.evaluate.interviewprep.model.QuestionCategory;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only catalog of job roles and experience levels. Built once and never mutated.
 */
@Service
public class RoleCatalog {

    private final Map<String, JobRole> roles;
    private final Map<String, ExperienceLevel> levels;

    public RoleCatalog() {
        Map<String, JobRole> roleMap = new LinkedHashMap<>();
        for (JobRole role : predefinedRoles()) {
            roleMap.put(role.getId(), role);
        }
        this.roles = Collections.unmodifiableMap(roleMap);

        Map<String, ExperienceLevel> levelMap = new LinkedHashMap<>();
        levelMap.put("entry", new ExperienceLevel("entry", 0, 2, 3));
        levelMap.put("mid", new ExperienceLevel("mid", 2, 5, 6));
        levelMap.put("senior", new ExperienceLevel("senior", 5, 10, 8));
        levelMap.put("lead", new ExperienceLevel("lead", 10, 100, 10));
        this.levels = Collections.unmodifiableMap(levelMap);
    }

    public List<JobRole> availableRoles() {
        return List.copyOf(roles.values());
    }

    public List<ExperienceLevel> availableLevels() {
        return List.copyOf(levels.values());
    }

    public List<String> roleIds() {
        return List.copyOf(roles.keySet());
    }

    public List<String> levelNames() {
        return List.copyOf(levels.keySet());
    }

    public JobRole roleById(String id) {
        return findById(id)
                .orElseThrow(() -> new InvalidInputException("Invalid role id '" + id + "'", roleIds()));
    }

    public JobRole roleByName(String name) {
        return findByName(name)
                .orElseThrow(() -> new InvalidInputException("Invalid role name '" + name + "'", roleIds()));
    }

    /** Accepts either a role id or a display name. */
    public JobRole resolveRole(String idOrName) {
        return findById(idOrName)
                .or(() -> findByName(idOrName))
                .orElseThrow(() -> new InvalidInputException("Invalid role '" + idOrName + "'", roleIds()));
    }

    public ExperienceLevel level(String name) {
        String key = normalize(name);
        ExperienceLevel level = key == null ? null : levels.get(key);
        if (level == null) {
            throw new InvalidInputException("Invalid experience level '" + name + "'", levelNames());
        }
        return level;
    }

    public boolean isValidRoleId(String id) {
        return findById(id).isPresent();
    }

    public boolean isValidRoleName(String name) {
        return findByName(name).isPresent();
    }

    public boolean isValidLevel(String name) {
        String key = normalize(name);
        return key != null && levels.containsKey(key);
    }

    private Optional<JobRole> findById(String id) {
        String key = normalize(id);
        return key == null ? Optional.empty() : Optional.ofNullable(roles.get(key));
    }

    private Optional<JobRole> findByName(String name) {
        String key = normalize(name);
        if (key == null) {
            return Optional.empty();
        }
        return roles.values().stream()
                .filter(role -> role.getName().toLowerCase(Locale.ROOT).equals(key))
                .findFirst();
    }

    private static String normalize(String value) {
        return value == null ? null : value.trim().toLowerCase(Locale.ROOT);
    }

    private static List<JobRole> predefinedRoles() {
        return List.of(
                JobRole.builder()
                        .id("software-engineer").name("Software Engineer")
                        .technicalSkills(List.of("Data Structures", "Algorithms", "System Design",
                                "Programming Languages", "Testing", "Version Control", "Debugging", "Code Review"))
                        .behavioralCompetencies(List.of("Problem Solving", "Collaboration", "Communication",
                                "Adaptability", "Time Management", "Learning Agility"))
                        .questionCategory(new QuestionCategory("Coding", 0.4, true))
                        .questionCategory(new QuestionCategory("System Design", 0.3, true))
                        .questionCategory(new QuestionCategory("Behavioral", 0.2, false))
                        .questionCategory(new QuestionCategory("Problem Solving", 0.1, true))
                        .build(),
                JobRole.builder()
                        .id("product-manager").name("Product Manager")
                        .technicalSkills(List.of("Product Strategy", "Market Analysis", "User Research",
                                "Data Analysis", "Roadmap Planning", "Metrics & KPIs", "A/B Testing", "Technical Literacy"))
                        .behavioralCompetencies(List.of("Leadership", "Stakeholder Management", "Communication",
                                "Decision Making", "Prioritization", "Influence", "Customer Empathy"))
                        .questionCategory(new QuestionCategory("Product Strategy", 0.3, true))
                        .questionCategory(new QuestionCategory("Execution", 0.25, false))
                        .questionCategory(new QuestionCategory("Leadership", 0.25, false))
                        .questionCategory(new QuestionCategory("Analytics", 0.2, true))
                        .build(),
                JobRole.builder()
                        .id("data-scientist").name("Data Scientist")
                        .technicalSkills(List.of("Machine Learning", "Statistics", "Python/R", "SQL",
                                "Data Visualization", "Feature Engineering", "Model Evaluation",
                                "Big Data Technologies", "Deep Learning"))
                        .behavioralCompetencies(List.of("Analytical Thinking", "Communication", "Business Acumen",
                                "Collaboration", "Curiosity", "Problem Solving"))
                        .questionCategory(new QuestionCategory("Machine Learning", 0.35, true))
                        .questionCategory(new QuestionCategory("Statistics", 0.25, true))
                        .questionCategory(new QuestionCategory("Coding", 0.2, true))
                        .questionCategory(new QuestionCategory("Behavioral", 0.2, false))
                        .build(),
                JobRole.builder()
                        .id("frontend-engineer").name("Frontend Engineer")
                        .technicalSkills(List.of("HTML/CSS", "JavaScript/TypeScript", "React/Vue/Angular",
                                "Responsive Design", "Web Performance", "Accessibility", "State Management",
                                "Testing", "Build Tools"))
                        .behavioralCompetencies(List.of("Attention to Detail", "User Empathy", "Collaboration",
                                "Communication", "Problem Solving", "Adaptability"))
                        .questionCategory(new QuestionCategory("UI Development", 0.35, true))
                        .questionCategory(new QuestionCategory("JavaScript", 0.3, true))
                        .questionCategory(new QuestionCategory("Design & UX", 0.2, true))
                        .questionCategory(new QuestionCategory("Behavioral", 0.15, false))
                        .build(),
                JobRole.builder()
                        .id("backend-engineer").name("Backend Engineer")
                        .technicalSkills(List.of("API Design", "Database Design", "System Architecture",
                                "Security", "Performance Optimization", "Microservices", "Cloud Services",
                                "Testing", "DevOps"))
                        .behavioralCompetencies(List.of("Problem Solving", "Collaboration", "Communication",
                                "Reliability", "Scalability Mindset", "Learning Agility"))
                        .questionCategory(new QuestionCategory("System Design", 0.35, true))
                        .questionCategory(new QuestionCategory("API Development", 0.3, true))
                        .questionCategory(new QuestionCategory("Database", 0.2, true))
                        .questionCategory(new QuestionCategory("Behavioral", 0.15, false))
                        .build(),
                JobRole.builder()
                        .id("devops-engineer").name("DevOps Engineer")
                        .technicalSkills(List.of("CI/CD", "Infrastructure as Code", "Cloud Platforms",
                                "Containerization", "Monitoring & Logging", "Scripting", "Security",
                                "Networking", "Automation"))
                        .behavioralCompetencies(List.of("Problem Solving", "Collaboration", "Communication",
                                "Reliability", "Process Improvement", "Incident Management"))
                        .questionCategory(new QuestionCategory("Infrastructure", 0.35, true))
                        .questionCategory(new QuestionCategory("Automation", 0.3, true))
                        .questionCategory(new QuestionCategory("Troubleshooting", 0.2, true))
                        .questionCategory(new QuestionCategory("Behavioral", 0.15, false))
                        .build());
    }
}
