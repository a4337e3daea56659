package io.github.drompincen.channelhub.runtime.connector.slack;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;

/**
 * Slack request signing, version {@code v0}: HMAC-SHA256 over {@code v0:<timestamp>:<body>} keyed
 * with the app's signing secret. Requests older than five minutes are refused to stop replays.
 */
public class SlackSignatureVerifier {

    private static final Logger log = LoggerFactory.getLogger(SlackSignatureVerifier.class);
    private static final Duration MAX_SKEW = Duration.ofMinutes(5);

    private final String signingSecret;
    private final Clock clock;

    public SlackSignatureVerifier(String signingSecret, Clock clock) {
        this.signingSecret = signingSecret;
        this.clock = clock;
    }

    public boolean verify(String timestamp, String signature, String body) {
        if (signingSecret == null || timestamp == null || signature == null) {
            return false;
        }
        long sentAt;
        try {
            sentAt = Long.parseLong(timestamp.trim());
        } catch (NumberFormatException e) {
            return false;
        }
        long now = clock.instant().getEpochSecond();
        if (Math.abs(now - sentAt) > MAX_SKEW.getSeconds()) {
            log.warn("Slack request timestamp outside the {}s window", MAX_SKEW.getSeconds());
            return false;
        }
        String expected = sign(timestamp.trim(), body == null ? "" : body);
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8),
                signature.trim().getBytes(StandardCharsets.UTF_8));
    }

    String sign(String timestamp, String body) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(signingSecret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
            byte[] digest = mac.doFinal(("v0:" + timestamp + ":" + body).getBytes(StandardCharsets.UTF_8));
            return "v0=" + HexFormat.of().formatHex(digest);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 unavailable", e);
        }
    }
}
