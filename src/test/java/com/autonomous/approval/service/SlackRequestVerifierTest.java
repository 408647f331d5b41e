package com.autonomous.approval.service;

import com.autonomous.approval.exception.InvalidSignatureException;
import com.autonomous.approval.exception.StaleTimestampException;
import com.autonomous.approval.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class SlackRequestVerifierTest {

    private static final Instant NOW = Instant.ofEpochSecond(1_700_000_000L);
    private static final String BODY = "command=%2Fapproval-status&text=s1";

    private SlackRequestVerifier verifier;

    @BeforeEach
    void setUp() {
        verifier = new SlackRequestVerifier(new MutableClock(NOW));
        verifier.setSigningSecret("8f742231b10e8888abcd99yyyzzz85a5");
    }

    @Test
    void shouldAcceptValidSignature() {
        String ts = String.valueOf(NOW.getEpochSecond());

        assertDoesNotThrow(() -> verifier.verify(ts, verifier.sign(ts, BODY), BODY));
    }

    @Test
    void shouldMatchSlackReferenceSignature() {
        // Example from Slack's request signing documentation.
        String body = "token=xyzz0WbapA4vBCDEFasx0q6G&team_id=T1DC2JH3J&team_domain=testteamnow&channel_id=G8PSS9T3V"
            + "&channel_name=foobar&user_id=U2CERLKJA&user_name=roadrunner&command=%2Fwebhook-collect&text="
            + "&response_url=https%3A%2F%2Fhooks.slack.com%2Fcommands%2FT1DC2JH3J%2F397700885554%2F96rGlfmibIGlgcZRskXaIFfN"
            + "&trigger_id=398738663015.47445629121.803a0bc887a14d10d2c447fce8b6703c";

        assertEquals("v0=a2114d57b48eac39b9ad189dd8316235a7b4a8d21a10bd27519666489c69b503",
            verifier.sign("1531420618", body));
    }

    @Test
    void shouldRejectTamperedBody() {
        String ts = String.valueOf(NOW.getEpochSecond());
        String signature = verifier.sign(ts, BODY);

        assertThrows(InvalidSignatureException.class, () -> verifier.verify(ts, signature, BODY + "&x=1"));
    }

    @Test
    void shouldRejectStaleTimestamp() {
        String ts = String.valueOf(NOW.getEpochSecond() - 301);

        assertThrows(StaleTimestampException.class, () -> verifier.verify(ts, verifier.sign(ts, BODY), BODY));
    }

    @Test
    void shouldRejectFutureTimestamp() {
        String ts = String.valueOf(NOW.getEpochSecond() + 301);

        assertThrows(StaleTimestampException.class, () -> verifier.verify(ts, verifier.sign(ts, BODY), BODY));
    }

    @Test
    void shouldAcceptTimestampAtSkewBoundary() {
        String ts = String.valueOf(NOW.getEpochSecond() - 300);

        assertDoesNotThrow(() -> verifier.verify(ts, verifier.sign(ts, BODY), BODY));
    }

    @Test
    void shouldRejectMissingOrMalformedHeaders() {
        String ts = String.valueOf(NOW.getEpochSecond());
        String signature = verifier.sign(ts, BODY);

        assertThrows(InvalidSignatureException.class, () -> verifier.verify(ts, null, BODY));
        assertThrows(InvalidSignatureException.class, () -> verifier.verify(null, signature, BODY));
        assertThrows(InvalidSignatureException.class, () -> verifier.verify("yesterday", signature, BODY));
    }

    @Test
    void shouldRejectEverythingWithoutSecret() {
        String ts = String.valueOf(NOW.getEpochSecond());
        String signature = verifier.sign(ts, BODY);
        verifier.setSigningSecret("");

        assertThrows(InvalidSignatureException.class, () -> verifier.verify(ts, signature, BODY));
    }
}
