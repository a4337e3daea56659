package io.github.drompincen.channelhub.runtime.webhook;

import java.util.Map;

/** HTTP answer for a platform callback. {@code body} is serialized as JSON. */
public record WebhookAck(int status, Object body) {

    public static WebhookAck ok() {
        return new WebhookAck(200, Map.of("status", "ok"));
    }

    public static WebhookAck handshake(Object body) {
        return new WebhookAck(200, body);
    }

    public static WebhookAck error(int status, String error) {
        return new WebhookAck(status, Map.of("error", error));
    }
}
