package com.evaluate.interviewprep;

import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.hasItem;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class InterviewPrepApplicationTests {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void contextLoads() {
    }

    @Test
    void testHealthCheck() throws Exception {
        mockMvc.perform(get("/health/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"));
    }

    @Test
    void testReadinessCheck() throws Exception {
        mockMvc.perform(get("/health/ready"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ready"));
    }

    @Test
    void testRootEndpoint() throws Exception {
        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").exists());
    }

    @Test
    void testGetRolesAndLevels() throws Exception {
        mockMvc.perform(get("/api/interview/roles"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("software-engineer"))
                .andExpect(jsonPath("$[*].id", hasItem("devops-engineer")));

        mockMvc.perform(get("/api/interview/levels"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].level").value("entry"))
                .andExpect(jsonPath("$[3].expectedDepth").value(10));
    }

    @Test
    void testCreateInterviewSession() throws Exception {
        mockMvc.perform(post("/api/interview/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(sessionJson("Software Engineer", "mid")))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.roleId").value("software-engineer"))
                .andExpect(jsonPath("$.level").value("mid"))
                .andExpect(jsonPath("$.status").value("initialized"))
                .andExpect(jsonPath("$.interactionMode").value("text"));
    }

    @Test
    void testInvalidRoleReturnsValidOptions() throws Exception {
        mockMvc.perform(post("/api/interview/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(sessionJson("astronaut", "mid")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.validOptions", hasItem("software-engineer")));
    }

    @Test
    void testUnknownSessionReturnsNotFound() throws Exception {
        mockMvc.perform(get("/api/interview/sessions/does-not-exist"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Session not found: does-not-exist"));
    }

    @Test
    void testAnswerBeforeStartReturnsConflict() throws Exception {
        String sessionId = createSession();

        mockMvc.perform(post("/api/interview/sessions/" + sessionId + "/responses")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"answerText\": \"A hash map.\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.currentState").value("initialized"))
                .andExpect(jsonPath("$.attemptedAction").value("submit response"));
    }

    @Test
    void testInterviewFlow() throws Exception {
        String sessionId = createSession();
        String base = "/api/interview/sessions/" + sessionId;

        mockMvc.perform(post(base + "/resume")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\": \"Skills: Python, React, AWS\", \"format\": \"text\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.technicalSkills[0].name").value("Python"))
                .andExpect(jsonPath("$.alignmentScore.overall").isNumber());

        mockMvc.perform(post(base + "/start"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").exists())
                .andExpect(jsonPath("$.text").exists());

        mockMvc.perform(post(base + "/responses")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"answerText\": \"skip question\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.type").value("redirect"));

        mockMvc.perform(post(base + "/responses")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"answerText\": \"I worked on a team project.\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.type").value("follow-up"))
                .andExpect(jsonPath("$.question.parentQuestionId").exists());

        mockMvc.perform(get(base + "/progress"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.answeredQuestions").value(1))
                .andExpect(jsonPath("$.expectedDurationMinutes").isNumber());

        mockMvc.perform(post(base + "/end"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.type").value("complete"))
                .andExpect(jsonPath("$.feedback.endedEarly").value(true))
                .andExpect(jsonPath("$.feedback.answeredQuestions").value(1))
                .andExpect(jsonPath("$.feedback.scores.overall.grade").exists());

        mockMvc.perform(get(base))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ended-early"));

        mockMvc.perform(get(base + "/continuation"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.options[0].id").value("new-round-same"))
                .andExpect(jsonPath("$.options[0].continuationOptions.type").value("new-round"));

        mockMvc.perform(post("/api/interview/continuations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\": \"topic-drill\", \"roleId\": \"software-engineer\", "
                                + "\"level\": \"mid\", \"drillCategory\": \"Coding\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.drillCategory").value("Coding"))
                .andExpect(jsonPath("$.status").value("initialized"));

        mockMvc.perform(delete(base))
                .andExpect(status().isOk());
        mockMvc.perform(get(base))
                .andExpect(status().isNotFound());
    }

    @Test
    void testUnknownContinuationTypeIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/interview/continuations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\": \"marathon\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void testCatalogListsEveryInteractionMode() throws Exception {
        mockMvc.perform(get("/api/interview/catalog"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.roles", hasItem("backend-engineer")))
                .andExpect(jsonPath("$.interactionModes", hasItem("text")))
                .andExpect(jsonPath("$.interactionModes", hasItem("voice")));
    }

    @Test
    void testUnknownDrillCategoryIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/interview/continuations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\": \"topic-drill\", \"roleId\": \"software-engineer\", "
                                + "\"level\": \"mid\", \"drillCategory\": \"Underwater Basket Weaving\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.validOptions", hasItem("Coding")));
    }

    private String createSession() throws Exception {
        String body = mockMvc.perform(post("/api/interview/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(sessionJson("software-engineer", "mid")))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        return JsonPath.read(body, "$.id");
    }

    private static String sessionJson(String role, String level) {
        return "{\"role\": \"" + role + "\", \"level\": \"" + level + "\", \"interactionMode\": \"text\"}";
    }
}
