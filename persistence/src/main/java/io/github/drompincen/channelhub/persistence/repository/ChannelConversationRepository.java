package io.github.drompincen.channelhub.persistence.repository;

import io.github.drompincen.channelhub.persistence.document.ChannelConversationDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

public interface ChannelConversationRepository extends MongoRepository<ChannelConversationDocument, String> {
    Optional<ChannelConversationDocument> findByTenantIdAndThreadKey(String tenantId, String threadKey);
}
