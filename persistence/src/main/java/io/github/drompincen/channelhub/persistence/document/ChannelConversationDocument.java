package io.github.drompincen.channelhub.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Maps a tenant's channel thread ({@code type:channelId:threadId}) onto the agent-side
 * conversation that carries its history.
 */
@Document(collection = "channel_conversations")
@CompoundIndex(name = "tenant_thread", def = "{'tenantId': 1, 'threadKey': 1}", unique = true)
public class ChannelConversationDocument {

    @Id
    private String conversationId;
    private String tenantId;
    private String threadKey;
    private String title;
    private Instant createdAt;
    private Instant lastMessageAt;

    public ChannelConversationDocument() {}

    public String getConversationId() { return conversationId; }
    public void setConversationId(String conversationId) { this.conversationId = conversationId; }

    public String getTenantId() { return tenantId; }
    public void setTenantId(String tenantId) { this.tenantId = tenantId; }

    public String getThreadKey() { return threadKey; }
    public void setThreadKey(String threadKey) { this.threadKey = threadKey; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getLastMessageAt() { return lastMessageAt; }
    public void setLastMessageAt(Instant lastMessageAt) { this.lastMessageAt = lastMessageAt; }
}
