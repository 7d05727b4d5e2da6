package com.todoflow.api.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = "todoflow.max-iterations=3")
@AutoConfigureMockMvc
class SessionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void createSession_shouldRunToCompletion() throws Exception {
        mockMvc.perform(post("/api/v1/sessions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\": \"Calculate 2 + 2\"}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.state").value("DONE"))
            .andExpect(jsonPath("$.planSource").value("FALLBACK"))
            .andExpect(jsonPath("$.todos", hasSize(2)))
            .andExpect(jsonPath("$.todos[0].content").value("Calculate Calculate 2 + 2"))
            .andExpect(jsonPath("$.todos[0].status").value("COMPLETED"))
            .andExpect(jsonPath("$.todos[1].content").value("Verify calculation result for Calculate 2 + 2"))
            .andExpect(jsonPath("$.todos[1].status").value("COMPLETED"))
            .andExpect(jsonPath("$.lastResult.terminationReason").value("ALL_DONE"));
    }

    @Test
    void history_shouldCarryCalculatedResult() throws Exception {
        UUID sessionId = create("Calculate 12 * 7", true);

        mockMvc.perform(get("/api/v1/sessions/{id}/history", sessionId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].result.kind").value("MATH"))
            .andExpect(jsonPath("$[0].result.output").value("12 * 7 = 84"));
    }

    @Test
    void createSession_withoutRun_thenContinueAfterExhaustion() throws Exception {
        UUID sessionId = create("Why is the sky blue", false);

        mockMvc.perform(get("/api/v1/sessions/{id}", sessionId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.state").value("CREATED"))
            .andExpect(jsonPath("$.todos", hasSize(4)));

        mockMvc.perform(post("/api/v1/sessions/{id}/run", sessionId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.state").value("EXHAUSTED"))
            .andExpect(jsonPath("$.result.iterations").value(3));

        mockMvc.perform(post("/api/v1/sessions/{id}/continue", sessionId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.state").value("DONE"));

        mockMvc.perform(get("/api/v1/sessions/{id}/history", sessionId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(4)));

        mockMvc.perform(get("/api/v1/sessions/{id}/feedback", sessionId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.summary.interactive").value(false));
    }

    @Test
    void continueSession_whenDone_shouldConflict() throws Exception {
        UUID sessionId = create("Calculate 2 + 2", true);

        mockMvc.perform(post("/api/v1/sessions/{id}/continue", sessionId))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.errorCode").value("INVALID_STATE_TRANSITION"));
    }

    @Test
    void manualFeedback_shouldBeListedForTodo() throws Exception {
        UUID sessionId = create("Calculate 2 + 2", false);
        String todoId = readJson(mockMvc.perform(get("/api/v1/sessions/{id}/todos", sessionId))
            .andReturn().getResponse().getContentAsString()).get(0).get("id").asText();

        mockMvc.perform(post("/api/v1/sessions/{id}/todos/{todoId}/feedback", sessionId, todoId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"message\": \"Show intermediate steps\"}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.type").value("IMPROVEMENT"));

        mockMvc.perform(get("/api/v1/sessions/{id}/todos/{todoId}/feedback", sessionId, todoId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(1)))
            .andExpect(jsonPath("$[0].message").value("Show intermediate steps"));
    }

    @Test
    void discard_shouldRemoveSession() throws Exception {
        UUID sessionId = create("Calculate 2 + 2", false);

        mockMvc.perform(delete("/api/v1/sessions/{id}", sessionId))
            .andExpect(status().isNoContent());

        mockMvc.perform(get("/api/v1/sessions/{id}", sessionId))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.errorCode").value("NOT_FOUND"));
    }

    @Test
    void createSession_blankQuery_shouldBeBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/sessions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\": \"  \"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errorCode").value(ApiExceptionHandler.INVALID_REQUEST));
    }

    @Test
    void unknownTodo_shouldBeNotFound() throws Exception {
        UUID sessionId = create("Calculate 2 + 2", false);

        mockMvc.perform(get("/api/v1/sessions/{id}/todos/{todoId}/feedback", sessionId, "missing"))
            .andExpect(status().isNotFound());
    }

    private UUID create(String query, boolean run) throws Exception {
        String body = objectMapper.writeValueAsString(new SessionController.CreateSessionRequest(query, run));
        String response = mockMvc.perform(post("/api/v1/sessions")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isCreated())
            .andReturn().getResponse().getContentAsString();
        JsonNode snapshot = readJson(response);
        assertThat(snapshot.has("sessionId")).isTrue();
        return UUID.fromString(snapshot.get("sessionId").asText());
    }

    private JsonNode readJson(String content) throws Exception {
        return objectMapper.readTree(content);
    }
}
