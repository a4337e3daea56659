package io.github.drompincen.channelhub.runtime.channel;

import com.fasterxml.jackson.databind.JsonNode;

public interface WebhookCapable {

    /** Signature or bearer-assertion check. Must not depend on the payload being well-formed. */
    boolean validateIncomingRequest(WebhookRequest request);

    /**
     * Synchronous answer some platforms require instead of a plain ack (Slack's url_verification).
     * Null means none.
     */
    default JsonNode handshakeResponse(JsonNode payload) {
        return null;
    }

    /** Processes one activity. Runs detached from the HTTP request. */
    void handleIncomingActivity(JsonNode payload);
}
