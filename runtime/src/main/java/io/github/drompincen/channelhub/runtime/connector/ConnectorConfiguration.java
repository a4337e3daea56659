package io.github.drompincen.channelhub.runtime.connector;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.channelhub.protocol.api.ChannelType;
import io.github.drompincen.channelhub.runtime.channel.ConnectorFactory;
import io.github.drompincen.channelhub.runtime.config.ChannelHubProperties;
import io.github.drompincen.channelhub.runtime.connector.discord.DiscordConnector;
import io.github.drompincen.channelhub.runtime.connector.matrix.MatrixConnector;
import io.github.drompincen.channelhub.runtime.connector.signal.SignalCliLauncher;
import io.github.drompincen.channelhub.runtime.connector.signal.SignalConnector;
import io.github.drompincen.channelhub.runtime.connector.slack.SlackConnector;
import io.github.drompincen.channelhub.runtime.connector.teams.BotFrameworkTokenValidator;
import io.github.drompincen.channelhub.runtime.connector.teams.TeamsConnector;
import io.github.drompincen.channelhub.runtime.connector.telegram.TelegramConnector;
import io.github.drompincen.channelhub.runtime.connector.webchat.WebChatConnector;
import io.github.drompincen.channelhub.runtime.connector.webchat.WebChatSessionRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;

import java.time.Clock;

/**
 * One {@link ConnectorFactory} per implemented channel type. WhatsApp is catalogued but has no
 * factory, so starting such an account fails with a connect error.
 */
@Configuration
public class ConnectorConfiguration {

    private final ChannelHubProperties properties;
    private final RestClient.Builder restClientBuilder;
    private final ObjectMapper objectMapper;
    private final Clock clock = Clock.systemUTC();

    public ConnectorConfiguration(ChannelHubProperties properties, RestClient.Builder restClientBuilder,
                                  ObjectMapper objectMapper) {
        this.properties = properties;
        this.restClientBuilder = restClientBuilder;
        this.objectMapper = objectMapper;
    }

    @Bean
    WebSocketClient channelWebSocketClient() {
        return new StandardWebSocketClient();
    }

    @Bean
    ConnectorFactory telegramConnectorFactory(@Value("${channelhub.telegram.api-base:https://api.telegram.org}") String apiBase) {
        return ConnectorFactory.of(ChannelType.TELEGRAM, () -> new TelegramConnector(
                longPolling(), properties.channels().reconnect(), apiBase));
    }

    @Bean
    ConnectorFactory slackConnectorFactory(@Value("${channelhub.slack.api-base:https://slack.com/api}") String apiBase) {
        return ConnectorFactory.of(ChannelType.SLACK, () -> new SlackConnector(
                restClientBuilder.clone(), properties.slack(), apiBase, clock));
    }

    @Bean
    ConnectorFactory discordConnectorFactory(
            WebSocketClient channelWebSocketClient,
            @Value("${channelhub.discord.api-base:https://discord.com/api/v10}") String apiBase,
            @Value("${channelhub.discord.gateway-url:wss://gateway.discord.gg/?v=10&encoding=json}") String gatewayUrl) {
        return ConnectorFactory.of(ChannelType.DISCORD, () -> new DiscordConnector(
                restClientBuilder.clone(), channelWebSocketClient, objectMapper, properties.discord(),
                properties.channels().reconnect(), apiBase, gatewayUrl, clock));
    }

    @Bean
    ConnectorFactory teamsConnectorFactory(
            @Value("${channelhub.teams.login-base:https://login.microsoftonline.com}") String loginBase) {
        return ConnectorFactory.of(ChannelType.TEAMS, () -> new TeamsConnector(
                restClientBuilder.clone(), properties.teams(), loginBase,
                BotFrameworkTokenValidator::forJwks, clock));
    }

    @Bean
    ConnectorFactory matrixConnectorFactory() {
        return ConnectorFactory.of(ChannelType.MATRIX, () -> new MatrixConnector(
                longPolling(), properties.channels().reconnect()));
    }

    @Bean
    ConnectorFactory signalConnectorFactory() {
        return ConnectorFactory.of(ChannelType.SIGNAL, () -> new SignalConnector(
                SignalCliLauncher.processBuilder(), objectMapper));
    }

    @Bean
    ConnectorFactory webChatConnectorFactory(WebChatSessionRegistry registry) {
        return ConnectorFactory.of(ChannelType.WEBCHAT, () -> new WebChatConnector(registry));
    }

    // Telegram getUpdates and Matrix /sync hold the request open for up to 30s.
    private RestClient.Builder longPolling() {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(10_000);
        factory.setReadTimeout(60_000);
        return restClientBuilder.clone().requestFactory(factory);
    }
}
