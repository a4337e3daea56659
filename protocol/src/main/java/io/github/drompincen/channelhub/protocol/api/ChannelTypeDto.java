package io.github.drompincen.channelhub.protocol.api;

public record ChannelTypeDto(
        String id,
        String displayName,
        boolean supportsOAuth,
        boolean supportsWebhooks,
        boolean supportsThreads
) {
    public static ChannelTypeDto of(ChannelType type) {
        return new ChannelTypeDto(type.id(), type.displayName(), type.supportsOAuth(),
                type.supportsWebhooks(), type.supportsThreads());
    }
}
