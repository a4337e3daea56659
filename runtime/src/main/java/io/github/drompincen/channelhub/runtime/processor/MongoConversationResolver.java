package io.github.drompincen.channelhub.runtime.processor;

import io.github.drompincen.channelhub.persistence.document.ChannelConversationDocument;
import io.github.drompincen.channelhub.persistence.repository.ChannelConversationRepository;
import io.github.drompincen.channelhub.runtime.channel.ChannelMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.UUID;

@Component
public class MongoConversationResolver implements ConversationResolver {

    private static final Logger log = LoggerFactory.getLogger(MongoConversationResolver.class);

    private final ChannelConversationRepository repository;

    public MongoConversationResolver(ChannelConversationRepository repository) {
        this.repository = repository;
    }

    @Override
    public String resolve(String tenantId, String accountRecordId, ChannelMessage message) {
        String threadKey = threadKey(message);
        return repository.findByTenantIdAndThreadKey(tenantId, threadKey)
                .map(ChannelConversationDocument::getConversationId)
                .orElseGet(() -> create(tenantId, threadKey, message));
    }

    static String threadKey(ChannelMessage message) {
        String thread = message.threadId() != null && !message.threadId().isBlank() ? message.threadId() : "main";
        return message.channelType().id() + ":" + message.channelId() + ":" + thread;
    }

    private String create(String tenantId, String threadKey, ChannelMessage message) {
        ChannelConversationDocument doc = new ChannelConversationDocument();
        doc.setConversationId(UUID.randomUUID().toString());
        doc.setTenantId(tenantId);
        doc.setThreadKey(threadKey);
        doc.setTitle(message.channelType().displayName() + " - " + (message.senderName() != null ? message.senderName() : "Unknown"));
        doc.setCreatedAt(Instant.now());
        doc.setLastMessageAt(Instant.now());
        try {
            repository.save(doc);
            log.info("Created conversation {} for thread {}", doc.getConversationId(), threadKey);
            return doc.getConversationId();
        } catch (DuplicateKeyException e) {
            // lost a race with a concurrent message on the same thread
            return repository.findByTenantIdAndThreadKey(tenantId, threadKey)
                    .map(ChannelConversationDocument::getConversationId)
                    .orElseThrow(() -> e);
        }
    }
}
