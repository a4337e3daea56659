package io.github.drompincen.channelhub.protocol.api;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChannelTypeTest {

    @Test
    void fromIdIsCaseInsensitive() {
        assertThat(ChannelType.fromId("telegram")).isEqualTo(ChannelType.TELEGRAM);
        assertThat(ChannelType.fromId(" Teams ")).isEqualTo(ChannelType.TEAMS);
    }

    @Test
    void fromIdRejectsUnknownType() {
        assertThatThrownBy(() -> ChannelType.fromId("irc"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("irc");
        assertThatThrownBy(() -> ChannelType.fromId(null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void oauthCapableTypes() {
        assertThat(ChannelType.SLACK.supportsOAuth()).isTrue();
        assertThat(ChannelType.DISCORD.supportsOAuth()).isTrue();
        assertThat(ChannelType.TEAMS.supportsOAuth()).isTrue();
        assertThat(ChannelType.TELEGRAM.supportsOAuth()).isFalse();
        assertThat(ChannelType.WEBCHAT.supportsOAuth()).isFalse();
    }

    @Test
    void dtoMirrorsCapabilities() {
        ChannelTypeDto dto = ChannelTypeDto.of(ChannelType.TEAMS);

        assertThat(dto.id()).isEqualTo("teams");
        assertThat(dto.displayName()).isEqualTo("Microsoft Teams");
        assertThat(dto.supportsWebhooks()).isTrue();
    }
}
