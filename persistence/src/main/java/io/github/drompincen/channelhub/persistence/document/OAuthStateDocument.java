package io.github.drompincen.channelhub.persistence.document;

import io.github.drompincen.channelhub.protocol.api.ChannelType;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Pending OAuth authorization, keyed by the random state token handed to the provider.
 * The TTL index is a backstop; the flow coordinator sweeps expired rows itself.
 */
@Document(collection = "oauth_states")
public class OAuthStateDocument {

    @Id
    private String state;
    private String tenantId;
    private ChannelType channelType;
    private Instant createdAt;

    @Indexed(expireAfterSeconds = 0)
    private Instant expiresAt;

    public OAuthStateDocument() {}

    public String getState() { return state; }
    public void setState(String state) { this.state = state; }

    public String getTenantId() { return tenantId; }
    public void setTenantId(String tenantId) { this.tenantId = tenantId; }

    public ChannelType getChannelType() { return channelType; }
    public void setChannelType(ChannelType channelType) { this.channelType = channelType; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getExpiresAt() { return expiresAt; }
    public void setExpiresAt(Instant expiresAt) { this.expiresAt = expiresAt; }
}
