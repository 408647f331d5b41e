package com.autonomous.approval.controller;

import com.autonomous.approval.service.SlackRequestVerifier;
import com.autonomous.approval.service.WebhookDispatcherService;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpInputMessage;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.FormHttpMessageConverter;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StreamUtils;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Slack's inbound callbacks. Each handler reads the raw body itself, because the
 * signature covers the exact bytes Slack sent.
 */
@RestController
@RequestMapping("/slack")
public class SlackController {

    private static final FormHttpMessageConverter FORM_CONVERTER = new FormHttpMessageConverter();
    private static final MediaType FORM_UTF8 =
        new MediaType(MediaType.APPLICATION_FORM_URLENCODED, StandardCharsets.UTF_8);

    @Autowired
    private SlackRequestVerifier verifier;

    @Autowired
    private WebhookDispatcherService dispatcher;

    @PostMapping("/interactive")
    public ResponseEntity<?> handleInteraction(HttpServletRequest request) throws IOException {
        String body = verifiedBody(request);
        String payload = parseForm(body).get("payload");
        if (payload == null) {
            throw new IllegalArgumentException("Missing payload field");
        }
        dispatcher.dispatchInteraction(payload);
        return ResponseEntity.ok().build();
    }

    @PostMapping("/commands")
    public ResponseEntity<?> handleSlashCommand(HttpServletRequest request) throws IOException {
        String body = verifiedBody(request);
        return ResponseEntity.ok(dispatcher.dispatchCommand(parseForm(body)));
    }

    @PostMapping("/events")
    public ResponseEntity<?> handleEvent(HttpServletRequest request) throws IOException {
        String body = verifiedBody(request);
        return dispatcher.dispatchEvent(body)
            .<ResponseEntity<?>>map(challenge -> ResponseEntity.ok(Map.of("challenge", challenge)))
            .orElseGet(() -> ResponseEntity.ok().build());
    }

    private String verifiedBody(HttpServletRequest request) throws IOException {
        String body = StreamUtils.copyToString(request.getInputStream(), StandardCharsets.UTF_8);
        verifier.verify(
            request.getHeader(SlackRequestVerifier.TIMESTAMP_HEADER),
            request.getHeader(SlackRequestVerifier.SIGNATURE_HEADER),
            body);
        return body;
    }

    /** Decodes an {@code application/x-www-form-urlencoded} body; the first value of a repeated key wins. */
    @SuppressWarnings("unchecked")
    static Map<String, String> parseForm(String body) throws IOException {
        byte[] bytes = (body == null ? "" : body).getBytes(StandardCharsets.UTF_8);
        HttpInputMessage message = new HttpInputMessage() {
            @Override
            public InputStream getBody() {
                return new ByteArrayInputStream(bytes);
            }

            @Override
            public HttpHeaders getHeaders() {
                HttpHeaders headers = new HttpHeaders();
                headers.setContentType(FORM_UTF8);
                return headers;
            }
        };
        MultiValueMap<String, String> form = (MultiValueMap<String, String>) FORM_CONVERTER.read(null, message);
        return form.toSingleValueMap();
    }
}
