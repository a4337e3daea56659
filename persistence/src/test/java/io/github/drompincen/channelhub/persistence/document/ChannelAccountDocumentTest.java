package io.github.drompincen.channelhub.persistence.document;

import io.github.drompincen.channelhub.protocol.api.ChannelType;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ChannelAccountDocumentTest {

    @Test
    void accountFieldsPreserved() {
        Instant expires = Instant.now().plusSeconds(3600);
        ChannelAccountDocument doc = new ChannelAccountDocument();
        doc.setId("a1");
        doc.setTenantId("u1");
        doc.setChannelType(ChannelType.TELEGRAM);
        doc.setChannelId("555");
        doc.setAccountId("bot");
        doc.setAccessToken("blob");
        doc.setTokenExpiresAt(expires);
        doc.setConfig(Map.of("autoReplyEnabled", true));
        doc.setActive(true);

        assertThat(doc.getId()).isEqualTo("a1");
        assertThat(doc.getTenantId()).isEqualTo("u1");
        assertThat(doc.getChannelType()).isEqualTo(ChannelType.TELEGRAM);
        assertThat(doc.getAccessToken()).isEqualTo("blob");
        assertThat(doc.getTokenExpiresAt()).isEqualTo(expires);
        assertThat(doc.getConfig()).containsEntry("autoReplyEnabled", true);
        assertThat(doc.isActive()).isTrue();
    }

    @Test
    void newAccountIsInactiveByDefault() {
        assertThat(new ChannelAccountDocument().isActive()).isFalse();
    }
}
