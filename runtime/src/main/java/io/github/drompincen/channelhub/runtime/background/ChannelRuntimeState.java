package io.github.drompincen.channelhub.runtime.background;

import io.github.drompincen.channelhub.protocol.api.ChannelType;

import java.time.Instant;

/** Immutable snapshot of one account's runtime. Transitions return a new instance. */
public record ChannelRuntimeState(String tenantId, String accountRecordId, ChannelType channelType, String channelId,
                                  boolean running, boolean connected, Instant lastStartAt, Instant lastStopAt,
                                  String lastError, String model, String provider) {

    public static ChannelRuntimeState initial(String tenantId, String accountRecordId, ChannelType type, String channelId) {
        return new ChannelRuntimeState(tenantId, accountRecordId, type, channelId, false, false, null, null, null, null, null);
    }

    public ChannelRuntimeState starting(Instant at) {
        return new ChannelRuntimeState(tenantId, accountRecordId, channelType, channelId, true, false, at, lastStopAt,
                null, model, provider);
    }

    public ChannelRuntimeState connected(String provider, String model) {
        return new ChannelRuntimeState(tenantId, accountRecordId, channelType, channelId, true, true, lastStartAt,
                lastStopAt, null, model, provider);
    }

    public ChannelRuntimeState failed(String error) {
        return new ChannelRuntimeState(tenantId, accountRecordId, channelType, channelId, false, false, lastStartAt,
                lastStopAt, error, model, provider);
    }

    public ChannelRuntimeState stopped(Instant at) {
        return new ChannelRuntimeState(tenantId, accountRecordId, channelType, channelId, false, false, lastStartAt, at,
                lastError, model, provider);
    }
}
