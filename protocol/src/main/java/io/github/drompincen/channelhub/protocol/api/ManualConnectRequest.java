package io.github.drompincen.channelhub.protocol.api;

import java.util.Map;

/**
 * Body of a manual (token based) channel connect. Which fields are required depends on the
 * channel type; unused fields are ignored.
 */
public record ManualConnectRequest(
        String channelId,
        String displayName,
        String accessToken,
        String botToken,
        String signingSecret,
        String homeserverUrl,
        String userId,
        String appId,
        String appPassword,
        String phoneNumber,
        String signalCliPath,
        Map<String, Object> config
) {}
