package io.github.drompincen.channelhub.gateway.controller;

import io.github.drompincen.channelhub.protocol.api.ChannelType;
import io.github.drompincen.channelhub.runtime.channel.WebhookRequest;
import io.github.drompincen.channelhub.runtime.webhook.WebhookAck;
import io.github.drompincen.channelhub.runtime.webhook.WebhookIngestor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/** Platform callbacks. The body is taken raw because signatures cover the exact bytes. */
@RestController
@RequestMapping("/api/channels/webhook")
public class ChannelWebhookController {

    private final WebhookIngestor ingestor;

    public ChannelWebhookController(WebhookIngestor ingestor) {
        this.ingestor = ingestor;
    }

    @PostMapping("/{type}")
    public ResponseEntity<Object> receive(@PathVariable String type, @RequestHeader HttpHeaders headers,
                                          @RequestBody(required = false) String body) {
        return toResponse(ingestor.ingest(ChannelType.fromId(type), toRequest(headers, body)));
    }

    @PostMapping("/{type}/{accountId}")
    public ResponseEntity<Object> receiveForAccount(@PathVariable String type, @PathVariable String accountId,
                                                    @RequestHeader HttpHeaders headers,
                                                    @RequestBody(required = false) String body) {
        return toResponse(ingestor.ingest(ChannelType.fromId(type), accountId, toRequest(headers, body)));
    }

    private static WebhookRequest toRequest(HttpHeaders headers, String body) {
        return new WebhookRequest(headers.toSingleValueMap(), body != null ? body : "");
    }

    private static ResponseEntity<Object> toResponse(WebhookAck ack) {
        return ResponseEntity.status(ack.status()).body(ack.body());
    }
}
