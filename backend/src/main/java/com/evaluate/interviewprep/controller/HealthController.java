package com.evaluate.interviewprep.controller;

import com.evaluate.interviewprep.service.QuestionBank;
import com.evaluate.interviewprep.service.RoleCatalog;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
public class HealthController {

    private final RoleCatalog roleCatalog;
    private final QuestionBank questionBank;

    @GetMapping({"", "/"})
    public Map<String, String> healthCheck() {
        return Map.of(
                "status", "healthy",
                "service", "Interview Prep API",
                "version", "0.1.0"
        );
    }

    @GetMapping("/ready")
    public Map<String, Object> readinessCheck() {
        return Map.of(
                "status", "ready",
                "dependencies", Map.of(
                        "roleCatalog", roleCatalog.roleIds().size() + " roles",
                        "questionBank", questionBank.behavioralTemplates().size() + " behavioral templates"
                )
        );
    }
}
