package io.github.drompincen.channelhub.runtime.agent;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.channelhub.protocol.api.ModelSelection;
import io.github.drompincen.channelhub.runtime.channel.ChannelMessage;
import io.github.drompincen.channelhub.runtime.config.ChannelHubProperties;
import io.github.drompincen.channelhub.runtime.error.AgentPipelineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs a turn by POSTing to the agent service at {@code channelhub.agent.endpoint} and reading
 * {@code reply} from the JSON answer.
 */
@Component
public class HttpAgentTurnPipeline implements AgentTurnPipeline {

    private static final Logger log = LoggerFactory.getLogger(HttpAgentTurnPipeline.class);

    private final RestClient rest;
    private final String endpoint;

    @Autowired
    public HttpAgentTurnPipeline(RestClient.Builder builder, ChannelHubProperties properties) {
        this(builder.requestFactory(requestFactory(properties)).build(), properties.agent().endpoint());
    }

    HttpAgentTurnPipeline(RestClient rest, String endpoint) {
        this.rest = rest;
        this.endpoint = endpoint;
    }

    private static SimpleClientHttpRequestFactory requestFactory(ChannelHubProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(10_000);
        requestFactory.setReadTimeout((int) properties.agent().timeout().toMillis());
        return requestFactory;
    }

    @Override
    public String run(String tenantId, String conversationId, ChannelMessage message, ModelSelection model) {
        if (endpoint == null || endpoint.isBlank()) {
            throw new AgentPipelineException("channelhub.agent.endpoint is not configured");
        }

        Map<String, Object> inbound = new LinkedHashMap<>();
        inbound.put("id", message.id());
        inbound.put("content", message.content());
        inbound.put("channelType", message.channelType().id());
        inbound.put("channelId", message.channelId());
        inbound.put("threadId", message.threadId());
        inbound.put("senderId", message.senderId());
        inbound.put("senderName", message.senderName());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("tenantId", tenantId);
        body.put("conversationId", conversationId);
        body.put("message", inbound);
        body.put("provider", model.provider());
        body.put("model", model.model());

        JsonNode response;
        try {
            response = rest.post()
                    .uri(endpoint)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            throw new AgentPipelineException("Agent call failed: " + e.getMessage(), e);
        }
        if (response == null || !response.hasNonNull("reply")) {
            throw new AgentPipelineException("Agent response has no reply");
        }
        log.debug("Agent turn done for conversation {} with {}/{}", conversationId, model.provider(), model.model());
        return response.get("reply").asText();
    }
}
