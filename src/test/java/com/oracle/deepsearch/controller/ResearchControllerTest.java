package com.oracle.deepsearch.controller;

import com.oracle.deepsearch.core.Session;
import com.oracle.deepsearch.core.SessionState;
import com.oracle.deepsearch.core.TestCollaborators;
import com.oracle.deepsearch.model.ResearchInput;
import com.oracle.deepsearch.model.ResearchRequest;
import com.oracle.deepsearch.model.ResearchResponse;
import com.oracle.deepsearch.model.ResearchSettings;
import com.oracle.deepsearch.model.SessionStatus;
import com.oracle.deepsearch.service.ResearchService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class ResearchControllerTest {

    @Mock
    private ResearchService researchService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new ResearchController(researchService)).build();
    }

    private static Session initializedSession() {
        Session session = new Session(ResearchInput.of("T", ResearchSettings.defaults()),
                TestCollaborators.discovering("u"), TestCollaborators.answering("A"),
                TestCollaborators.deriving(), TestCollaborators.echoing(), Runnable::run);
        session.initialize();
        return session;
    }

    @Test
    @DisplayName("POST runs the research and returns the response")
    void research() throws Exception {
        when(researchService.research(any(ResearchRequest.class))).thenReturn(ResearchResponse.builder()
                .sessionId("s-1").topic("T").state(SessionState.COMPLETED).build());

        mockMvc.perform(post("/api/v1/research")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"topic\": \"T\", \"maxDepth\": 2}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sessionId").value("s-1"))
                .andExpect(jsonPath("$.state").value("COMPLETED"));
    }

    @Test
    @DisplayName("POST with a blank topic is a validation error")
    void blankTopic() throws Exception {
        mockMvc.perform(post("/api/v1/research")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"topic\": \"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.type").value("ValidationError"));

        verifyNoInteractions(researchService);
    }

    @Test
    @DisplayName("POST with an out of range depth is a validation error")
    void depthOutOfRange() throws Exception {
        mockMvc.perform(post("/api/v1/research")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"topic\": \"T\", \"maxDepth\": 11}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("rejected session input maps to 400")
    void rejectedInput() throws Exception {
        when(researchService.research(any(ResearchRequest.class))).thenReturn(ResearchResponse.builder()
                .state(SessionState.ERROR).error("Invalid research settings").build());

        mockMvc.perform(post("/api/v1/research")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"topic\": \"T\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid research settings"));
    }

    @Test
    @DisplayName("background start answers 202 with the session status")
    void startSession() throws Exception {
        when(researchService.startResearch(any(ResearchRequest.class))).thenReturn(SessionStatus.builder()
                .sessionId("s-2").state(SessionState.INITIALIZED).maxDepth(3).build());

        mockMvc.perform(post("/api/v1/research/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"topic\": \"T\"}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.sessionId").value("s-2"))
                .andExpect(jsonPath("$.maxDepth").value(3));
    }

    @Test
    @DisplayName("unknown session is 404")
    void unknownSession() throws Exception {
        when(researchService.getStatus("missing")).thenReturn(Optional.empty());
        when(researchService.getSession("missing")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/research/sessions/missing")).andExpect(status().isNotFound());
        mockMvc.perform(get("/api/v1/research/sessions/missing/results")).andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("results of a session that has not finished are a conflict")
    void resultsWhileRunning() throws Exception {
        Session session = initializedSession();
        when(researchService.getSession(session.getSessionId())).thenReturn(Optional.of(session));
        when(researchService.toResponse(eq(session), anyBoolean(), isNull())).thenReturn(ResearchResponse.builder()
                .sessionId(session.getSessionId()).state(session.getState()).build());

        mockMvc.perform(get("/api/v1/research/sessions/" + session.getSessionId() + "/results"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.state").value("INITIALIZED"));
    }

    @Test
    @DisplayName("results of a finished session are returned")
    void resultsWhenDone() throws Exception {
        Session session = initializedSession();
        session.run();
        when(researchService.getSession(session.getSessionId())).thenReturn(Optional.of(session));
        when(researchService.toResponse(eq(session), eq(true), isNull())).thenReturn(ResearchResponse.builder()
                .sessionId(session.getSessionId()).state(session.getState()).build());

        mockMvc.perform(get("/api/v1/research/sessions/" + session.getSessionId() + "/results?verbose=true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("COMPLETED"));
    }

    @Test
    @DisplayName("health check")
    void health() throws Exception {
        mockMvc.perform(get("/api/v1/research/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"));
    }
}
