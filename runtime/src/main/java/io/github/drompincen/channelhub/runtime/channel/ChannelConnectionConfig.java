package io.github.drompincen.channelhub.runtime.channel;

import io.github.drompincen.channelhub.protocol.api.ChannelType;

import java.util.Map;

/**
 * Everything a connector needs to open one account, with credentials already decrypted.
 * {@link #toString()} masks the secrets so the record is safe to log.
 */
public record ChannelConnectionConfig(
        String tenantId,
        String accountRecordId,
        ChannelType channelType,
        String channelId,
        String accountId,
        String accessToken,
        String refreshToken,
        Map<String, Object> settings
) {
    public ChannelConnectionConfig {
        settings = settings == null ? Map.of() : settings;
    }

    public String setting(String key) {
        Object value = settings.get(key);
        if (value == null) return null;
        String s = String.valueOf(value).trim();
        return s.isEmpty() ? null : s;
    }

    public String setting(String key, String defaultValue) {
        String value = setting(key);
        return value != null ? value : defaultValue;
    }

    @Override
    public String toString() {
        return "ChannelConnectionConfig[tenantId=" + tenantId + ", account=" + accountRecordId
                + ", type=" + channelType + ", channelId=" + channelId
                + ", accessToken=" + (accessToken != null ? "***" : "null") + "]";
    }
}
