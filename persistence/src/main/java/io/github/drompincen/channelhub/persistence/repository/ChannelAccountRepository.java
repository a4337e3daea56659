package io.github.drompincen.channelhub.persistence.repository;

import io.github.drompincen.channelhub.persistence.document.ChannelAccountDocument;
import io.github.drompincen.channelhub.protocol.api.ChannelType;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface ChannelAccountRepository extends MongoRepository<ChannelAccountDocument, String> {
    Optional<ChannelAccountDocument> findByIdAndTenantId(String id, String tenantId);
    Optional<ChannelAccountDocument> findByTenantIdAndChannelTypeAndChannelId(String tenantId, ChannelType channelType, String channelId);
    List<ChannelAccountDocument> findByTenantId(String tenantId);
    List<ChannelAccountDocument> findByActiveTrue();
    List<ChannelAccountDocument> findByChannelTypeAndActiveTrue(ChannelType channelType);
    List<ChannelAccountDocument> findByTenantIdAndChannelTypeAndActiveTrue(String tenantId, ChannelType channelType);
}
