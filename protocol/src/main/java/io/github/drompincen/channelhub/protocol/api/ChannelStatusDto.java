package io.github.drompincen.channelhub.protocol.api;

import java.time.Instant;

public record ChannelStatusDto(
        String accountId,
        String channelType,
        String channelId,
        String displayName,
        boolean running,
        boolean connected,
        Instant lastStartAt,
        Instant lastStopAt,
        String lastError,
        String model,
        String provider
) {}
