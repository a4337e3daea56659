package io.github.drompincen.channelhub.runtime.channel;

import io.github.drompincen.channelhub.protocol.api.ChannelType;

public record ChannelKey(String tenantId, ChannelType channelType, String channelId) {

    public String asString() {
        return tenantId + ":" + channelType.id() + ":" + channelId;
    }

    @Override
    public String toString() {
        return asString();
    }
}
