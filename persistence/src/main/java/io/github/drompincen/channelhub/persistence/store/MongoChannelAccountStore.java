package io.github.drompincen.channelhub.persistence.store;

import io.github.drompincen.channelhub.persistence.document.ChannelAccountDocument;
import io.github.drompincen.channelhub.persistence.repository.ChannelAccountRepository;
import io.github.drompincen.channelhub.protocol.api.ChannelType;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Component
public class MongoChannelAccountStore implements ChannelAccountStore {

    private final ChannelAccountRepository repository;
    private final MongoTemplate mongoTemplate;

    public MongoChannelAccountStore(ChannelAccountRepository repository, MongoTemplate mongoTemplate) {
        this.repository = repository;
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public Optional<ChannelAccountDocument> get(String tenantId, String id) {
        return repository.findByIdAndTenantId(id, tenantId);
    }

    @Override
    public List<ChannelAccountDocument> listActive() {
        return repository.findByActiveTrue();
    }

    @Override
    public List<ChannelAccountDocument> listByUser(String tenantId) {
        return repository.findByTenantId(tenantId);
    }

    @Override
    public List<ChannelAccountDocument> findActiveByType(ChannelType channelType) {
        return repository.findByChannelTypeAndActiveTrue(channelType);
    }

    /** Single atomic findAndModify keyed on the unique triple, so concurrent connects cannot duplicate. */
    @Override
    public ChannelAccountDocument upsert(String tenantId, ChannelType channelType, String channelId, AccountFields fields) {
        Instant now = Instant.now();
        Query query = new Query()
                .addCriteria(Criteria.where("tenantId").is(tenantId))
                .addCriteria(Criteria.where("channelType").is(channelType))
                .addCriteria(Criteria.where("channelId").is(channelId));
        Update update = new Update()
                .setOnInsert("_id", UUID.randomUUID().toString())
                .setOnInsert("createdAt", now)
                .set("accountId", fields.accountId())
                .set("accessToken", fields.accessToken())
                .set("refreshToken", fields.refreshToken())
                .set("tokenExpiresAt", fields.tokenExpiresAt())
                .set("config", fields.config() != null ? fields.config() : Map.of())
                .set("displayName", fields.displayName())
                .set("active", fields.active())
                .set("updatedAt", now);
        return mongoTemplate.findAndModify(query, update,
                FindAndModifyOptions.options().upsert(true).returnNew(true),
                ChannelAccountDocument.class);
    }

    @Override
    public boolean setActive(String id, boolean active) {
        Query query = Query.query(Criteria.where("_id").is(id));
        Update update = new Update().set("active", active).set("updatedAt", Instant.now());
        return mongoTemplate.updateFirst(query, update, ChannelAccountDocument.class).getMatchedCount() > 0;
    }

    @Override
    public void updateConfig(String id, Map<String, Object> config) {
        Query query = Query.query(Criteria.where("_id").is(id));
        Update update = new Update().set("config", config).set("updatedAt", Instant.now());
        mongoTemplate.updateFirst(query, update, ChannelAccountDocument.class);
    }

    @Override
    public void updateTokens(String id, String accessToken, String refreshToken, Instant tokenExpiresAt) {
        Instant now = Instant.now();
        Query query = Query.query(Criteria.where("_id").is(id));
        Update update = new Update()
                .set("accessToken", accessToken)
                .set("refreshToken", refreshToken)
                .set("tokenExpiresAt", tokenExpiresAt)
                .set("lastSyncAt", now)
                .set("updatedAt", now);
        mongoTemplate.updateFirst(query, update, ChannelAccountDocument.class);
    }

    @Override
    public void delete(String id) {
        repository.deleteById(id);
    }
}
