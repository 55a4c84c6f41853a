package com.sds.phucth.sessioncontext.controllers;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.sds.phucth.sessioncontext.dto.ClassifiedTurn;
import com.sds.phucth.sessioncontext.dto.HandlingMode;
import com.sds.phucth.sessioncontext.dto.TurnOutcome;
import com.sds.phucth.sessioncontext.exceptions.GlobalExceptionHandler;
import com.sds.phucth.sessioncontext.services.TurnRouter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class TurnControllerTest {

    private MockMvc mockMvc;

    @Mock
    private TurnRouter turnRouter;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        mockMvc = MockMvcBuilders.standaloneSetup(new TurnController(turnRouter))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void handle_returnsOutcome() throws Exception {
        when(turnRouter.handleTurn(eq("s1"), any(ClassifiedTurn.class))).thenReturn(TurnOutcome.builder()
                .sessionId("s1")
                .messageId("m1")
                .intent("send_email")
                .mode(HandlingMode.REQUIRES_APPROVAL)
                .summary("**Approval needed: Send email**")
                .build());

        mockMvc.perform(post("/api/turns/s1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"messageId\":\"m1\",\"intent\":\"send_email\",\"data\":{\"recipient\":\"bob@x.com\"},\"needsApproval\":true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.mode").value("REQUIRES_APPROVAL"));
    }

    @Test
    void handle_missingIntent_returns400() throws Exception {
        mockMvc.perform(post("/api/turns/s1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"messageId\":\"m1\",\"data\":{}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.details.intent").value("intent is required"));

        verify(turnRouter, never()).handleTurn(any(), any());
    }
}
