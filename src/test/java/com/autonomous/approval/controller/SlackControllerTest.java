package com.autonomous.approval.controller;

import com.autonomous.approval.service.SlackRequestVerifier;
import com.autonomous.approval.service.WebhookDispatcherService;
import com.autonomous.approval.support.MutableClock;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(SlackController.class)
@Import(SlackRequestVerifier.class)
@TestPropertySource(properties = "slack.signing-secret=controller-test-secret")
class SlackControllerTest {

    private static final Instant NOW = Instant.ofEpochSecond(1_700_000_000L);

    @TestConfiguration
    static class ClockConfig {
        @Bean
        Clock clock() {
            return new MutableClock(NOW);
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private SlackRequestVerifier verifier;

    @MockBean
    private WebhookDispatcherService dispatcher;

    private MockHttpServletRequestBuilder signed(String path, String body, long timestamp, MediaType type) {
        String ts = String.valueOf(timestamp);
        return post(path)
            .contentType(type)
            .content(body)
            .header(SlackRequestVerifier.TIMESTAMP_HEADER, ts)
            .header(SlackRequestVerifier.SIGNATURE_HEADER, verifier.sign(ts, body));
    }

    @Test
    void shouldHandleSignedSlashCommand() throws Exception {
        when(dispatcher.dispatchCommand(anyMap()))
            .thenReturn(Map.of("response_type", "ephemeral", "text", "No pending approvals for session s1"));

        mockMvc.perform(signed("/slack/commands", "command=%2Fapproval-status&text=s1",
                NOW.getEpochSecond(), MediaType.APPLICATION_FORM_URLENCODED))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.text").value("No pending approvals for session s1"));

        verify(dispatcher).dispatchCommand(Map.of("command", "/approval-status", "text", "s1"));
    }

    @Test
    void shouldRejectTamperedBody() throws Exception {
        String ts = String.valueOf(NOW.getEpochSecond());
        String signature = verifier.sign(ts, "command=%2Fapproval-status&text=s1");

        mockMvc.perform(post("/slack/commands")
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .content("command=%2Fapproval-cleanup&text=s1")
                .header(SlackRequestVerifier.TIMESTAMP_HEADER, ts)
                .header(SlackRequestVerifier.SIGNATURE_HEADER, signature))
            .andExpect(status().isUnauthorized())
            .andExpect(jsonPath("$.status").value(401));

        verifyNoInteractions(dispatcher);
    }

    @Test
    void shouldRejectStaleRequest() throws Exception {
        mockMvc.perform(signed("/slack/commands", "command=%2Fapproval-status",
                NOW.getEpochSecond() - 301, MediaType.APPLICATION_FORM_URLENCODED))
            .andExpect(status().isUnauthorized());

        verifyNoInteractions(dispatcher);
    }

    @Test
    void shouldRejectUnsignedRequest() throws Exception {
        mockMvc.perform(post("/slack/events")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"type\":\"url_verification\",\"challenge\":\"abc\"}"))
            .andExpect(status().isUnauthorized());

        verifyNoInteractions(dispatcher);
    }

    @Test
    void shouldDispatchInteractionPayload() throws Exception {
        String payload = "{\"type\":\"block_actions\",\"actions\":[{\"action_id\":\"approve_command\",\"value\":\"a1\"}]}";
        String body = "payload=" + URLEncoder.encode(payload, StandardCharsets.UTF_8);

        mockMvc.perform(signed("/slack/interactive", body, NOW.getEpochSecond(), MediaType.APPLICATION_FORM_URLENCODED))
            .andExpect(status().isOk());

        verify(dispatcher).dispatchInteraction(payload);
    }

    @Test
    void shouldRejectInteractionWithoutPayload() throws Exception {
        mockMvc.perform(signed("/slack/interactive", "foo=bar", NOW.getEpochSecond(),
                MediaType.APPLICATION_FORM_URLENCODED))
            .andExpect(status().isBadRequest());
    }

    @Test
    void shouldEchoUrlVerificationChallenge() throws Exception {
        String body = "{\"type\":\"url_verification\",\"challenge\":\"abc123\"}";
        when(dispatcher.dispatchEvent(body)).thenReturn(Optional.of("abc123"));

        mockMvc.perform(signed("/slack/events", body, NOW.getEpochSecond(), MediaType.APPLICATION_JSON))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.challenge").value("abc123"));
    }

    @Test
    void shouldAcknowledgeOtherEvents() throws Exception {
        String body = "{\"type\":\"event_callback\",\"event\":{\"type\":\"app_mention\"}}";
        when(dispatcher.dispatchEvent(body)).thenReturn(Optional.empty());

        mockMvc.perform(signed("/slack/events", body, NOW.getEpochSecond(), MediaType.APPLICATION_JSON))
            .andExpect(status().isOk());
    }

    @Test
    void shouldReturnBadRequestForMalformedEvent() throws Exception {
        when(dispatcher.dispatchEvent("{oops")).thenThrow(new IllegalArgumentException("Malformed Slack payload"));

        mockMvc.perform(signed("/slack/events", "{oops", NOW.getEpochSecond(), MediaType.APPLICATION_JSON))
            .andExpect(status().isBadRequest());
    }

    @Test
    void shouldDecodeSlackFormBody() throws Exception {
        Map<String, String> form = SlackController.parseForm(
            "command=%2Fapproval-status&text=session+one&text=ignored&payload=%7B%22type%22%3A%22x%22%7D");

        assertEquals("/approval-status", form.get("command"));
        assertEquals("session one", form.get("text"));
        assertEquals("{\"type\":\"x\"}", form.get("payload"));
        assertTrue(SlackController.parseForm("").isEmpty());
    }
}
