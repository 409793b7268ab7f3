package com.example.honeypot.controller;

import com.example.honeypot.model.ScamLevel;
import com.example.honeypot.model.TerminationReason;
import com.example.honeypot.model.WebhookRequest;
import com.example.honeypot.service.ConversationOrchestrator;
import com.example.honeypot.service.DispatchResult;
import com.example.honeypot.service.TurnOutcome;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(WebhookController.class)
@TestPropertySource(properties = {
        "honeypot.security.api-key=test-key",
        "honeypot.turn.neutral-reply=Sorry, who is this?"
})
class WebhookControllerTest {

    private static final String PAYLOAD = """
            {
              "sessionId": "s1",
              "message": {"sender": "scammer", "text": "Your KYC is pending", "timestamp": "2026-01-01T10:00:00Z"},
              "conversationHistory": [],
              "metadata": {"channel": "SMS", "language": "English", "locale": "IN"}
            }
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ConversationOrchestrator orchestrator;

    @Test
    void testReturnsReply() throws Exception {
        when(orchestrator.handle(any(WebhookRequest.class))).thenReturn(new TurnOutcome("s1", "Which KYC sir?",
                ScamLevel.SUSPECTED, TerminationReason.NONE, DispatchResult.SKIPPED, true));

        mockMvc.perform(post("/webhook").header("X-API-KEY", "test-key")
                        .contentType(MediaType.APPLICATION_JSON).content(PAYLOAD))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("success"))
                .andExpect(jsonPath("$.reply").value("Which KYC sir?"));

        verify(orchestrator).handle(argThat(request -> "s1".equals(request.getSessionId())
                && "Your KYC is pending".equals(request.getMessage().getText())
                && "English".equals(request.getMetadata().getLanguage())));
    }

    @Test
    void testMissingKeyIsRejected() throws Exception {
        mockMvc.perform(post("/webhook").contentType(MediaType.APPLICATION_JSON).content(PAYLOAD))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.detail").value("Missing API key. Include X-API-KEY header."));

        verifyNoInteractions(orchestrator);
    }

    @Test
    void testWrongKeyIsRejected() throws Exception {
        mockMvc.perform(post("/webhook").header("X-API-KEY", "guess")
                        .contentType(MediaType.APPLICATION_JSON).content(PAYLOAD))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.detail").value("Invalid API key."));

        verifyNoInteractions(orchestrator);
    }

    @Test
    void testMissingSessionIdGetsNeutralReply() throws Exception {
        String payload = """
                {"message": {"sender": "scammer", "text": "hello"}}
                """;

        mockMvc.perform(post("/webhook").header("X-API-KEY", "test-key")
                        .contentType(MediaType.APPLICATION_JSON).content(payload))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("success"))
                .andExpect(jsonPath("$.reply").value("Sorry, who is this?"));

        verifyNoInteractions(orchestrator);
    }

    @Test
    void testMissingMessageGetsNeutralReply() throws Exception {
        mockMvc.perform(post("/webhook").header("X-API-KEY", "test-key")
                        .contentType(MediaType.APPLICATION_JSON).content("{\"sessionId\": \"s1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.reply").value("Sorry, who is this?"));

        verifyNoInteractions(orchestrator);
    }

    @Test
    void testMalformedJsonGetsNeutralReply() throws Exception {
        mockMvc.perform(post("/webhook").header("X-API-KEY", "test-key")
                        .contentType(MediaType.APPLICATION_JSON).content("{\"sessionId\": "))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.reply").value("Sorry, who is this?"));
    }

    @Test
    void testUnexpectedFailureGetsNeutralReply() throws Exception {
        when(orchestrator.handle(any(WebhookRequest.class))).thenThrow(new IllegalStateException("boom"));

        mockMvc.perform(post("/webhook").header("X-API-KEY", "test-key")
                        .contentType(MediaType.APPLICATION_JSON).content(PAYLOAD))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("success"))
                .andExpect(jsonPath("$.reply").value("Sorry, who is this?"));
    }
}
