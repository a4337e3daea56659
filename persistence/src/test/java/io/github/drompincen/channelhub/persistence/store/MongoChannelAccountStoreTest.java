package io.github.drompincen.channelhub.persistence.store;

import com.mongodb.client.result.UpdateResult;
import io.github.drompincen.channelhub.persistence.document.ChannelAccountDocument;
import io.github.drompincen.channelhub.persistence.repository.ChannelAccountRepository;
import io.github.drompincen.channelhub.protocol.api.ChannelType;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MongoChannelAccountStoreTest {

    @Mock private ChannelAccountRepository repository;
    @Mock private MongoTemplate mongoTemplate;

    private MongoChannelAccountStore store;

    @BeforeEach
    void setUp() {
        store = new MongoChannelAccountStore(repository, mongoTemplate);
    }

    @Test
    void upsertMatchesOnUniqueTripleAndReplacesCredentials() {
        ChannelAccountDocument saved = new ChannelAccountDocument();
        when(mongoTemplate.findAndModify(any(Query.class), any(Update.class),
                any(FindAndModifyOptions.class), eq(ChannelAccountDocument.class))).thenReturn(saved);

        ChannelAccountDocument result = store.upsert("u1", ChannelType.TELEGRAM, "555",
                new AccountFields("bot", "blob-2", null, null, Map.of("k", "v"), "My bot", true));

        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        ArgumentCaptor<Update> update = ArgumentCaptor.forClass(Update.class);
        ArgumentCaptor<FindAndModifyOptions> options = ArgumentCaptor.forClass(FindAndModifyOptions.class);
        verify(mongoTemplate).findAndModify(query.capture(), update.capture(), options.capture(),
                eq(ChannelAccountDocument.class));

        assertThat(result).isSameAs(saved);
        Document criteria = query.getValue().getQueryObject();
        assertThat(criteria.get("tenantId")).isEqualTo("u1");
        assertThat(criteria.get("channelType")).isEqualTo(ChannelType.TELEGRAM);
        assertThat(criteria.get("channelId")).isEqualTo("555");

        Document set = (Document) update.getValue().getUpdateObject().get("$set");
        assertThat(set.get("accessToken")).isEqualTo("blob-2");
        assertThat(set.containsKey("refreshToken")).isTrue();
        assertThat(set.get("refreshToken")).isNull();
        assertThat(set.get("active")).isEqualTo(true);
        Document onInsert = (Document) update.getValue().getUpdateObject().get("$setOnInsert");
        assertThat(onInsert).containsKeys("_id", "createdAt");

        assertThat(options.getValue().isUpsert()).isTrue();
        assertThat(options.getValue().isReturnNew()).isTrue();
    }

    @Test
    void setActiveReportsWhetherRecordExisted() {
        when(mongoTemplate.updateFirst(any(Query.class), any(Update.class), eq(ChannelAccountDocument.class)))
                .thenReturn(UpdateResult.acknowledged(1, 1L, null))
                .thenReturn(UpdateResult.acknowledged(0, 0L, null));

        assertThat(store.setActive("a1", false)).isTrue();
        assertThat(store.setActive("missing", false)).isFalse();
    }

    @Test
    void getIsScopedToTenant() {
        ChannelAccountDocument doc = new ChannelAccountDocument();
        when(repository.findByIdAndTenantId("a1", "u1")).thenReturn(Optional.of(doc));
        when(repository.findByIdAndTenantId("a1", "u2")).thenReturn(Optional.empty());

        assertThat(store.get("u1", "a1")).contains(doc);
        assertThat(store.get("u2", "a1")).isEmpty();
    }

    @Test
    void listActiveDelegatesToRepository() {
        ChannelAccountDocument doc = new ChannelAccountDocument();
        when(repository.findByActiveTrue()).thenReturn(List.of(doc));

        assertThat(store.listActive()).containsExactly(doc);
    }

    @Test
    void deleteRemovesRecord() {
        store.delete("a1");

        verify(repository).deleteById("a1");
    }
}
