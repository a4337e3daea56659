package io.github.drompincen.channelhub.protocol.ws;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Server-to-browser frame on the webchat socket. Absent fields are omitted from the JSON.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WebChatFrame(
        String type,
        String sessionId,
        String channelId,
        String messageId,
        String content,
        String threadId,
        String replyTo,
        Instant timestamp,
        Sender sender
) {
    public record Sender(String id, String name) {}

    static final Sender ASSISTANT = new Sender("assistant", "AI Assistant");

    public static WebChatFrame connected(String sessionId, String channelId) {
        return new WebChatFrame(WebChatFrameType.CONNECTED.wireName(), sessionId, channelId, null, null, null, null, null, null);
    }

    public static WebChatFrame authSuccess(String sessionId, String channelId) {
        return new WebChatFrame(WebChatFrameType.AUTH_SUCCESS.wireName(), sessionId, channelId, null, null, null, null, null, null);
    }

    public static WebChatFrame start(String messageId) {
        return new WebChatFrame(WebChatFrameType.CHAT_START.wireName(), null, null, messageId, null, null, null, null, null);
    }

    public static WebChatFrame chunk(String messageId, String content) {
        return new WebChatFrame(WebChatFrameType.CHAT_CHUNK.wireName(), null, null, messageId, content, null, null, null, null);
    }

    public static WebChatFrame end(String messageId) {
        return new WebChatFrame(WebChatFrameType.CHAT_END.wireName(), null, null, messageId, null, null, null, null, null);
    }

    public static WebChatFrame legacyMessage(String messageId, String content, String threadId, String replyTo) {
        return new WebChatFrame(WebChatFrameType.MESSAGE.wireName(), null, null, messageId, content,
                threadId, replyTo, Instant.now(), ASSISTANT);
    }

    public static WebChatFrame error(String content) {
        return new WebChatFrame(WebChatFrameType.ERROR.wireName(), null, null, null, content, null, null, null, null);
    }
}
