package io.github.drompincen.channelhub.runtime.channel;

import io.github.drompincen.channelhub.protocol.api.ChannelType;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Inbound message normalized across platforms. {@code id} is the platform's message id and is what
 * inbound de-duplication keys on.
 */
public record ChannelMessage(
        String id,
        ChannelType channelType,
        String channelId,
        String threadId,
        String content,
        ContentType contentType,
        List<ChannelAttachment> attachments,
        String senderId,
        String senderName,
        Instant timestamp,
        String replyToId,
        Map<String, Object> metadata
) {
    public enum ContentType { TEXT, IMAGE, FILE, VOICE }

    public ChannelMessage {
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
        metadata = metadata == null ? Map.of() : metadata;
        if (contentType == null) contentType = ContentType.TEXT;
        if (timestamp == null) timestamp = Instant.now();
    }

    public static ChannelMessage text(String id, ChannelType type, String channelId, String content,
                                      String senderId, String senderName) {
        return new ChannelMessage(id, type, channelId, null, content, ContentType.TEXT, null,
                senderId, senderName, Instant.now(), null, null);
    }
}
