package io.github.drompincen.channelhub.runtime.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.channelhub.persistence.document.ChannelAccountDocument;
import io.github.drompincen.channelhub.persistence.store.ChannelAccountStore;
import io.github.drompincen.channelhub.protocol.api.ChannelType;
import io.github.drompincen.channelhub.runtime.channel.ChannelConnector;
import io.github.drompincen.channelhub.runtime.channel.ChannelManager;
import io.github.drompincen.channelhub.runtime.channel.WebhookCapable;
import io.github.drompincen.channelhub.runtime.channel.WebhookRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Front door for push-style platforms. Authenticates the callback before reading the payload, then
 * hands the activity to {@code channelTaskExecutor} and acknowledges without waiting for it.
 * Activities for the same account are processed one after another in the order they arrived.
 */
@Component
public class WebhookIngestor {

    private static final Logger log = LoggerFactory.getLogger(WebhookIngestor.class);

    private final ChannelAccountStore accountStore;
    private final ChannelManager channelManager;
    private final ObjectMapper objectMapper;
    private final Executor executor;
    private final Map<String, AccountLane> lanes = new ConcurrentHashMap<>();

    public WebhookIngestor(ChannelAccountStore accountStore, ChannelManager channelManager, ObjectMapper objectMapper,
                           @Qualifier("channelTaskExecutor") Executor executor) {
        this.accountStore = accountStore;
        this.channelManager = channelManager;
        this.objectMapper = objectMapper;
        this.executor = executor;
    }

    /** Routes to the first active account of the type. */
    public WebhookAck ingest(ChannelType type, WebhookRequest request) {
        return ingest(type, null, request);
    }

    /**
     * @param accountRecordId the addressed account, or null for the first active account of the type
     */
    public WebhookAck ingest(ChannelType type, String accountRecordId, WebhookRequest request) {
        Optional<ChannelAccountDocument> account = accountStore.findActiveByType(type).stream()
                .filter(a -> accountRecordId == null || accountRecordId.equals(a.getId()))
                .findFirst();
        if (account.isEmpty()) {
            log.warn("Webhook for {} has no active account{}", type.id(),
                    accountRecordId != null ? " " + accountRecordId : "");
            return WebhookAck.error(404, "no_active_account");
        }
        ChannelAccountDocument target = account.get();

        Optional<ChannelConnector> connector = channelManager
                .getConnector(target.getTenantId(), type, target.getChannelId())
                .or(() -> channelManager.findConnectorByType(target.getTenantId(), type));
        if (connector.isEmpty() || !(connector.get() instanceof WebhookCapable webhook)) {
            log.warn("Webhook for {} account {} but no connector is running", type.id(), target.getId());
            return WebhookAck.error(503, "connector_unavailable");
        }

        if (!webhook.validateIncomingRequest(request)) {
            log.warn("Rejected unauthenticated {} webhook for account {}", type.id(), target.getId());
            return WebhookAck.error(401, "unauthorized");
        }

        JsonNode payload;
        try {
            payload = objectMapper.readTree(request.rawBody() == null ? "" : request.rawBody());
        } catch (JsonProcessingException e) {
            log.warn("Malformed {} webhook body: {}", type.id(), e.getOriginalMessage());
            return WebhookAck.error(400, "invalid_activity");
        }
        if (payload == null || !payload.isObject()) {
            return WebhookAck.error(400, "invalid_activity");
        }

        JsonNode handshake = webhook.handshakeResponse(payload);
        if (handshake != null) {
            return WebhookAck.handshake(handshake);
        }

        try {
            lanes.computeIfAbsent(target.getId(), id -> new AccountLane(executor))
                    .submit(() -> process(type, target.getId(), webhook, payload));
        } catch (RejectedExecutionException e) {
            log.error("Webhook executor saturated, asking {} to retry", type.id());
            return WebhookAck.error(503, "busy");
        }
        return WebhookAck.ok();
    }

    private void process(ChannelType type, String accountRecordId, WebhookCapable webhook, JsonNode payload) {
        try {
            webhook.handleIncomingActivity(payload);
        } catch (RuntimeException e) {
            log.error("Processing {} webhook for account {} failed: {}", type.id(), accountRecordId, e.getMessage(), e);
        }
    }
}
