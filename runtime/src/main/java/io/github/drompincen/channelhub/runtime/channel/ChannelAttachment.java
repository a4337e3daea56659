package io.github.drompincen.channelhub.runtime.channel;

public record ChannelAttachment(
        String type,     // image, file, audio, video
        String url,
        String name,
        long size,
        String mimeType
) {}
