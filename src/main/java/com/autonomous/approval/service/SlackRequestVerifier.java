package com.autonomous.approval.service;

import com.autonomous.approval.exception.InvalidSignatureException;
import com.autonomous.approval.exception.StaleTimestampException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.HexFormat;

/**
 * Verifies Slack's request signature: {@code v0=} followed by the hex HMAC-SHA256
 * of {@code v0:<timestamp>:<raw body>} keyed with the signing secret. The
 * comparison is constant-time.
 */
@Slf4j
@Component
public class SlackRequestVerifier {

    public static final String SIGNATURE_HEADER = "X-Slack-Signature";
    public static final String TIMESTAMP_HEADER = "X-Slack-Request-Timestamp";

    private static final String VERSION = "v0";
    private static final String HMAC_ALGORITHM = "HmacSHA256";

    @Value("${slack.signing-secret:}")
    private String signingSecret;

    @Value("${approval.webhook.max-skew-seconds:300}")
    private long maxSkewSeconds = 300;

    private final Clock clock;

    public SlackRequestVerifier(Clock clock) {
        this.clock = clock;
    }

    public void setSigningSecret(String signingSecret) {
        this.signingSecret = signingSecret;
    }

    public void setMaxSkewSeconds(long maxSkewSeconds) {
        this.maxSkewSeconds = maxSkewSeconds;
    }

    /**
     * @throws InvalidSignatureException when the secret, signature or timestamp is
     *                                   missing, or the signature does not match
     * @throws StaleTimestampException   when the timestamp is outside the allowed skew
     */
    public void verify(String timestampHeader, String signatureHeader, String rawBody) {
        if (signingSecret == null || signingSecret.isBlank()) {
            log.warn("[Webhook] No signing secret configured, rejecting request");
            throw new InvalidSignatureException("Signing secret not configured");
        }
        if (signatureHeader == null || signatureHeader.isBlank()) {
            throw new InvalidSignatureException("Missing " + SIGNATURE_HEADER + " header");
        }
        if (timestampHeader == null || timestampHeader.isBlank()) {
            throw new InvalidSignatureException("Missing " + TIMESTAMP_HEADER + " header");
        }
        long timestamp;
        try {
            timestamp = Long.parseLong(timestampHeader.trim());
        } catch (NumberFormatException e) {
            throw new InvalidSignatureException("Unparseable request timestamp: " + timestampHeader);
        }
        long now = clock.instant().getEpochSecond();
        if (Math.abs(now - timestamp) > maxSkewSeconds) {
            throw new StaleTimestampException(timestamp, now);
        }

        String expected = sign(timestampHeader.trim(), rawBody == null ? "" : rawBody);
        byte[] expectedBytes = expected.getBytes(StandardCharsets.UTF_8);
        byte[] providedBytes = signatureHeader.trim().getBytes(StandardCharsets.UTF_8);
        if (!MessageDigest.isEqual(expectedBytes, providedBytes)) {
            throw new InvalidSignatureException("Signature mismatch");
        }
    }

    /** Computes the {@code v0=...} signature Slack would send for this body. */
    public String sign(String timestamp, String rawBody) {
        String base = VERSION + ":" + timestamp + ":" + rawBody;
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(signingSecret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            return VERSION + "=" + HexFormat.of().formatHex(mac.doFinal(base.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException("Cannot compute " + HMAC_ALGORITHM, e);
        }
    }
}
