package io.github.drompincen.channelhub.persistence.repository;

import io.github.drompincen.channelhub.persistence.document.ChannelMessageDocument;
import io.github.drompincen.channelhub.protocol.api.MessageDirection;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface ChannelMessageRepository extends MongoRepository<ChannelMessageDocument, String> {
    boolean existsByChannelAccountIdAndExternalMessageIdAndDirection(String channelAccountId, String externalMessageId, MessageDirection direction);
    List<ChannelMessageDocument> findByChannelAccountIdOrderByTimestampAsc(String channelAccountId);
    void deleteByChannelAccountId(String channelAccountId);
}
