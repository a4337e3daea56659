package io.github.drompincen.channelhub.runtime.background;

import io.github.drompincen.channelhub.persistence.document.ChannelAccountDocument;
import io.github.drompincen.channelhub.persistence.repository.ChannelMessageRepository;
import io.github.drompincen.channelhub.persistence.store.ChannelAccountStore;
import io.github.drompincen.channelhub.protocol.api.ChannelType;
import io.github.drompincen.channelhub.runtime.agent.ModelSelector;
import io.github.drompincen.channelhub.runtime.channel.ChannelManager;
import io.github.drompincen.channelhub.runtime.channel.ChannelMessage;
import io.github.drompincen.channelhub.runtime.channel.ConnectorFactory;
import io.github.drompincen.channelhub.runtime.channel.ConnectorRegistry;
import io.github.drompincen.channelhub.runtime.channel.StubConnector;
import io.github.drompincen.channelhub.runtime.config.ChannelHubProperties;
import io.github.drompincen.channelhub.runtime.crypto.AesGcmCredentialVault;
import io.github.drompincen.channelhub.runtime.crypto.CredentialVault;
import io.github.drompincen.channelhub.runtime.error.ChannelNotFoundException;
import io.github.drompincen.channelhub.runtime.error.ConnectorConnectException;
import io.github.drompincen.channelhub.runtime.pairing.PairingStateStore;
import io.github.drompincen.channelhub.runtime.processor.ChannelMessageProcessorFactory;
import io.github.drompincen.channelhub.runtime.ratelimit.SlidingWindowRateLimiter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ChannelBackgroundServiceTest {

    private static final String KEY = "00112233445566778899aabbccddeeff00112233445566778899aabbccddeeff";

    @Mock private ChannelAccountStore accountStore;
    @Mock private ChannelMessageRepository messageRepository;

    private final ChannelHubProperties properties = new ChannelHubProperties(null,
            new ChannelHubProperties.Crypto(KEY), null, null, null, null, null, null, null);
    private final CredentialVault vault = new AesGcmCredentialVault(properties);
    private final List<StubConnector> created = new CopyOnWriteArrayList<>();
    private final List<String> turns = new ArrayList<>();
    private ChannelManager manager;
    private ChannelBackgroundService service;
    private volatile RuntimeException connectFailure;
    private volatile CountDownLatch connectGate;

    @BeforeEach
    void setUp() {
        ConnectorRegistry registry = new ConnectorRegistry(List.of(ConnectorFactory.of(ChannelType.TELEGRAM, () -> {
            StubConnector stub = new StubConnector(ChannelType.TELEGRAM);
            stub.connectFailure = connectFailure;
            stub.connectGate = connectGate;
            created.add(stub);
            return stub;
        })));
        manager = new ChannelManager(registry, accountStore, messageRepository, vault, new PairingStateStore());
        ModelSelector models = new ModelSelector((tenant, provider) -> "anthropic".equals(provider), properties);
        ChannelMessageProcessorFactory processors = new ChannelMessageProcessorFactory(accountStore, manager,
                new SlidingWindowRateLimiter(), (tenant, account, message) -> "conv-1",
                (tenant, conversation, message, model) -> {
                    turns.add(conversation + "|" + model.provider());
                    return "echo: " + message.content();
                },
                models, properties);
        service = new ChannelBackgroundService(accountStore, manager, models, processors, Runnable::run, new TickingClock());
    }

    @Test
    void telegramMessageIsAnsweredEndToEnd() {
        ChannelAccountDocument account = telegram("acc-1", true);
        when(accountStore.get("u1", "acc-1")).thenReturn(Optional.of(account));

        ChannelRuntimeState state = service.startChannel("u1", "acc-1", false);

        assertThat(state.running()).isTrue();
        assertThat(state.connected()).isTrue();
        assertThat(state.provider()).isEqualTo("anthropic");
        StubConnector connector = created.get(0);
        assertThat(connector.connects.get(0).accessToken()).isEqualTo("123:ABC");

        connector.inbound(ChannelMessage.text("42", ChannelType.TELEGRAM, "555", "hello", "9", "Ada"));

        assertThat(turns).containsExactly("conv-1|anthropic");
        assertThat(connector.sent).hasSize(1);
        StubConnector.Sent reply = connector.sent.get(0);
        assertThat(reply.targetId()).isEqualTo("555");
        assertThat(reply.content()).isEqualTo("echo: hello");
        assertThat(reply.options().replyToId()).isEqualTo("42");
    }

    @Test
    void startingARunningChannelIsANoOp() {
        when(accountStore.get("u1", "acc-1")).thenReturn(Optional.of(telegram("acc-1", true)));

        ChannelRuntimeState first = service.startChannel("u1", "acc-1", false);
        ChannelRuntimeState second = service.startChannel("u1", "acc-1", false);

        assertThat(second).isEqualTo(first);
        assertThat(created).hasSize(1);
        assertThat(manager.size()).isEqualTo(1);
    }

    @Test
    void forcedStartRestartsTheConnector() {
        when(accountStore.get("u1", "acc-1")).thenReturn(Optional.of(telegram("acc-1", true)));

        ChannelRuntimeState first = service.startChannel("u1", "acc-1", false);
        ChannelRuntimeState second = service.startChannel("u1", "acc-1", true);

        assertThat(second.lastStartAt()).isAfter(first.lastStartAt());
        assertThat(second.lastStopAt()).isNotNull();
        assertThat(created).hasSize(2);
        assertThat(created.get(0).disconnects.get()).isEqualTo(1);
        assertThat(created.get(0).cancellation.isCancelled()).isTrue();
        assertThat(manager.size()).isEqualTo(1);
    }

    @Test
    void connectFailureIsRecordedNotThrown() {
        connectFailure = new ConnectorConnectException("Telegram rejected the bot credentials: Unauthorized");
        when(accountStore.get("u1", "acc-1")).thenReturn(Optional.of(telegram("acc-1", true)));

        ChannelRuntimeState state = service.startChannel("u1", "acc-1", false);

        assertThat(state.running()).isFalse();
        assertThat(state.connected()).isFalse();
        assertThat(state.lastError()).contains("Unauthorized");
        assertThat(service.getState("u1", "acc-1")).contains(state);
        assertThat(manager.size()).isZero();
    }

    @Test
    void inactiveAccountIsNotStarted() {
        when(accountStore.get("u1", "acc-1")).thenReturn(Optional.of(telegram("acc-1", false)));

        ChannelRuntimeState state = service.startChannel("u1", "acc-1", false);

        assertThat(state.running()).isFalse();
        assertThat(created).isEmpty();
    }

    @Test
    void unknownAccountIsReported() {
        when(accountStore.get("u1", "missing")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.startChannel("u1", "missing", false))
                .isInstanceOf(ChannelNotFoundException.class);
    }

    @Test
    void stopDisconnectsAndKeepsStoppedState() {
        when(accountStore.get("u1", "acc-1")).thenReturn(Optional.of(telegram("acc-1", true)));
        service.startChannel("u1", "acc-1", false);

        ChannelRuntimeState stopped = service.stopChannel("u1", "acc-1");

        assertThat(stopped.running()).isFalse();
        assertThat(stopped.lastStopAt()).isNotNull();
        assertThat(created.get(0).disconnects.get()).isEqualTo(1);
        assertThat(service.getRunningChannels()).isEmpty();
        assertThat(service.getUserChannels("u1")).containsExactly(stopped);
    }

    @Test
    void connectorErrorMarksChannelFailedUntilStopped() {
        when(accountStore.get("u1", "acc-1")).thenReturn(Optional.of(telegram("acc-1", true)));
        service.startChannel("u1", "acc-1", false);

        created.get(0).listener.onError(new ConnectorConnectException("Telegram polling gave up after 5 attempts"));

        ChannelRuntimeState state = service.getState("u1", "acc-1").orElseThrow();
        assertThat(state.running()).isFalse();
        assertThat(state.lastError()).contains("gave up");
    }

    @Test
    void bootStartsEveryActiveAccountOnce() {
        ChannelAccountDocument a = telegram("acc-1", true);
        ChannelAccountDocument b = telegram("acc-2", true);
        b.setTenantId("u2");
        b.setChannelId("777");
        when(accountStore.listActive()).thenReturn(List.of(a, b));
        when(accountStore.get("u1", "acc-1")).thenReturn(Optional.of(a));
        when(accountStore.get("u2", "acc-2")).thenReturn(Optional.of(b));

        assertThat(service.startAllChannels()).isEqualTo(2);
        assertThat(service.startAllChannels()).isZero();
        assertThat(service.isRunning()).isTrue();
        assertThat(service.getRunningChannels()).hasSize(2);
    }

    @Test
    void shutdownStopsEverything() {
        when(accountStore.get("u1", "acc-1")).thenReturn(Optional.of(telegram("acc-1", true)));
        service.startChannel("u1", "acc-1", false);

        service.shutdown();

        assertThat(service.getRunningChannels()).isEmpty();
        assertThat(manager.size()).isZero();
        assertThat(created.get(0).cancellation.isCancelled()).isTrue();
    }

    @Test
    void startUserChannelsSkipsInactiveAccounts() {
        ChannelAccountDocument active = telegram("acc-1", true);
        ChannelAccountDocument inactive = telegram("acc-2", false);
        when(accountStore.listByUser("u1")).thenReturn(List.of(active, inactive));
        when(accountStore.get("u1", "acc-1")).thenReturn(Optional.of(active));

        List<ChannelRuntimeState> states = service.startUserChannels("u1");

        assertThat(states).extracting(ChannelRuntimeState::accountRecordId).containsExactly("acc-1");
    }

    @Test
    void racingStartsShareOneConnect() throws Exception {
        ChannelAccountDocument account = telegram("acc-1", true);
        when(accountStore.get("u1", "acc-1")).thenReturn(Optional.of(account));
        connectGate = new CountDownLatch(1);
        ExecutorService callers = Executors.newFixedThreadPool(2);
        try {
            Future<ChannelRuntimeState> first = callers.submit(() -> service.startChannel("u1", "acc-1", false));
            await().atMost(Duration.ofSeconds(5))
                    .until(() -> created.size() == 1 && created.get(0).connects.size() == 1);
            Future<ChannelRuntimeState> second = callers.submit(() -> service.startChannel("u1", "acc-1", false));
            await().during(Duration.ofMillis(200)).atMost(Duration.ofSeconds(5)).until(() -> !second.isDone());

            connectGate.countDown();

            ChannelRuntimeState winner = first.get(5, TimeUnit.SECONDS);
            assertThat(winner.running()).isTrue();
            assertThat(second.get(5, TimeUnit.SECONDS)).isSameAs(winner);
            assertThat(created).hasSize(1);
            assertThat(manager.size()).isEqualTo(1);
        } finally {
            callers.shutdownNow();
        }
    }

    private ChannelAccountDocument telegram(String id, boolean active) {
        ChannelAccountDocument doc = new ChannelAccountDocument();
        doc.setId(id);
        doc.setTenantId("u1");
        doc.setChannelType(ChannelType.TELEGRAM);
        doc.setChannelId("555");
        doc.setAccountId("bot");
        doc.setAccessToken(vault.encrypt("123:ABC"));
        doc.setConfig(Map.of());
        doc.setActive(active);
        return doc;
    }

    /** Advances one second per reading so consecutive starts get distinct timestamps. */
    private static final class TickingClock extends Clock {

        private Instant now = Instant.parse("2024-05-01T10:00:00Z");

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public synchronized Instant instant() {
            now = now.plusSeconds(1);
            return now;
        }
    }
}
