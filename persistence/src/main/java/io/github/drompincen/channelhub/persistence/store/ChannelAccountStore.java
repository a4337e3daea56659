package io.github.drompincen.channelhub.persistence.store;

import io.github.drompincen.channelhub.persistence.document.ChannelAccountDocument;
import io.github.drompincen.channelhub.protocol.api.ChannelType;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistent channel-account records. The (tenant, type, channelId) triple is unique and every
 * write through {@link #upsert} replaces the existing record for that triple instead of adding one.
 */
public interface ChannelAccountStore {

    Optional<ChannelAccountDocument> get(String tenantId, String id);

    List<ChannelAccountDocument> listActive();

    List<ChannelAccountDocument> listByUser(String tenantId);

    List<ChannelAccountDocument> findActiveByType(ChannelType channelType);

    ChannelAccountDocument upsert(String tenantId, ChannelType channelType, String channelId, AccountFields fields);

    /** @return false if no record has that id */
    boolean setActive(String id, boolean active);

    void updateConfig(String id, Map<String, Object> config);

    void updateTokens(String id, String accessToken, String refreshToken, Instant tokenExpiresAt);

    void delete(String id);
}
