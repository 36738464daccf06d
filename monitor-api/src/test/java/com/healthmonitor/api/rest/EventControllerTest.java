package com.healthmonitor.api.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.healthmonitor.engine.service.EventService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@TestPropertySource(properties = "monitor.classifier.enabled=false")
class EventControllerTest {

    private static final String AUTH_FAILURE = """
        {
          "integration": "gusto",
          "eventType": "employee.sync",
          "status": "failure",
          "payload": {"employee_id": "emp_1"},
          "error": {"message": "OAuth token expired", "code": "401"}
        }
        """;

    private static final String SUCCESS = """
        {"integration": "procore", "eventType": "project.sync", "status": "success"}
        """;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private EventService eventService;

    @BeforeEach
    void setUp() {
        eventService.clear();
    }

    @Test
    void createEvent_shouldReturnCreatedEvent() throws Exception {
        mockMvc.perform(post("/api/events").contentType(MediaType.APPLICATION_JSON).content(AUTH_FAILURE))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.event.id").isNotEmpty())
            .andExpect(jsonPath("$.event.integration").value("gusto"))
            .andExpect(jsonPath("$.event.status").value("failure"))
            .andExpect(jsonPath("$.event.error.code").value("401"))
            .andExpect(jsonPath("$.event.resolution.status").value("open"))
            .andExpect(jsonPath("$.event.classification").doesNotExist());
    }

    @Test
    void createEvent_unknownIntegration_shouldBeBadRequest() throws Exception {
        mockMvc.perform(post("/api/events").contentType(MediaType.APPLICATION_JSON)
                .content("{\"integration\": \"sap\", \"eventType\": \"x\", \"status\": \"success\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value(ApiExceptionHandler.BAD_REQUEST));
    }

    @Test
    void createEvent_missingStatus_shouldBeBadRequest() throws Exception {
        mockMvc.perform(post("/api/events").contentType(MediaType.APPLICATION_JSON)
                .content("{\"integration\": \"gusto\", \"eventType\": \"x\"}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void listEvents_shouldFilterAndReportTotal() throws Exception {
        create(AUTH_FAILURE);
        create(SUCCESS);
        create(SUCCESS);

        mockMvc.perform(get("/api/events"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.events", hasSize(3)))
            .andExpect(jsonPath("$.total").value(3));

        mockMvc.perform(get("/api/events").param("integration", "procore"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.events", hasSize(2)))
            .andExpect(jsonPath("$.total").value(2));

        mockMvc.perform(get("/api/events").param("status", "failure").param("search", "oauth"))
            .andExpect(jsonPath("$.events", hasSize(1)))
            .andExpect(jsonPath("$.events[0].integration").value("gusto"));
    }

    @Test
    void listEventsPaginated_shouldReturnPage() throws Exception {
        for (int i = 0; i < 4; i++) {
            create(SUCCESS);
        }

        mockMvc.perform(get("/api/events/paginated").param("offset", "1").param("limit", "2"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.events", hasSize(2)))
            .andExpect(jsonPath("$.total").value(4))
            .andExpect(jsonPath("$.offset").value(1))
            .andExpect(jsonPath("$.limit").value(2))
            .andExpect(jsonPath("$.hasMore").value(true));

        mockMvc.perform(get("/api/events/paginated"))
            .andExpect(jsonPath("$.limit").value(25))
            .andExpect(jsonPath("$.hasMore").value(false));
    }

    @Test
    void listEvents_badSortField_shouldBeBadRequest() throws Exception {
        mockMvc.perform(get("/api/events").param("sortBy", "colour"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void getEvent_unknown_shouldBeNotFound() throws Exception {
        mockMvc.perform(get("/api/events/{id}", UUID.randomUUID()))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.code").value("NOT_FOUND"))
            .andExpect(jsonPath("$.timestamp").isNotEmpty());
    }

    @Test
    void getEvent_malformedId_shouldBeBadRequest() throws Exception {
        mockMvc.perform(get("/api/events/not-a-uuid"))
            .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Classification falls back to rules and is cached on the event")
    void classify_shouldFallBackThenServeCache() throws Exception {
        String id = create(AUTH_FAILURE);

        mockMvc.perform(post("/api/events/{id}/classify", id))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.cached").value(false))
            .andExpect(jsonPath("$.source").value("fallback"))
            .andExpect(jsonPath("$.classification.category").value("auth"))
            .andExpect(jsonPath("$.classification.severity").value("high"))
            .andExpect(jsonPath("$.event.classification.category").value("auth"));

        mockMvc.perform(post("/api/events/{id}/classify", id))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.cached").value(true))
            .andExpect(jsonPath("$.source").value("cache"));
    }

    @Test
    void classify_successEvent_shouldBeBadRequest() throws Exception {
        String id = create(SUCCESS);

        mockMvc.perform(post("/api/events/{id}/classify", id))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("INVALID_EVENT_STATE"));
    }

    @Test
    void triage_shouldWalkTheLifecycle() throws Exception {
        String id = create(AUTH_FAILURE);

        mockMvc.perform(post("/api/events/{id}/acknowledge", id)
                .contentType(MediaType.APPLICATION_JSON).content("{\"by\": \"dana\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.event.resolution.status").value("acknowledged"))
            .andExpect(jsonPath("$.event.resolution.acknowledgedBy").value("dana"));

        mockMvc.perform(post("/api/events/{id}/resolve", id)
                .contentType(MediaType.APPLICATION_JSON).content("{\"by\": \"lee\", \"notes\": \"Reconnected\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.event.resolution.status").value("resolved"))
            .andExpect(jsonPath("$.event.resolution.acknowledgedBy").value("dana"))
            .andExpect(jsonPath("$.event.resolution.resolvedBy").value("lee"))
            .andExpect(jsonPath("$.event.resolution.notes").value("Reconnected"));

        mockMvc.perform(get("/api/events").param("resolutionStatus", "resolved"))
            .andExpect(jsonPath("$.total").value(1));

        mockMvc.perform(post("/api/events/{id}/reopen", id))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.event.resolution.status").value("open"))
            .andExpect(jsonPath("$.event.resolution.acknowledgedBy").doesNotExist());
    }

    @Test
    void acknowledge_withoutBody_shouldUseAnonymousActor() throws Exception {
        String id = create(AUTH_FAILURE);

        mockMvc.perform(post("/api/events/{id}/acknowledge", id))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.event.resolution.acknowledgedBy").value("anonymous"));
    }

    @Test
    void acknowledge_successEvent_shouldBeBadRequest() throws Exception {
        String id = create(SUCCESS);

        mockMvc.perform(post("/api/events/{id}/acknowledge", id))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("INVALID_EVENT_STATE"));
    }

    @Test
    void resolve_unknownEvent_shouldBeNotFound() throws Exception {
        mockMvc.perform(post("/api/events/{id}/resolve", UUID.randomUUID()))
            .andExpect(status().isNotFound());
    }

    private String create(String body) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/events")
                .contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isCreated())
            .andReturn();
        JsonNode json = objectMapper.readTree(result.getResponse().getContentAsString());
        String id = json.path("event").path("id").asText();
        assertThat(id).isNotBlank();
        return id;
    }
}
