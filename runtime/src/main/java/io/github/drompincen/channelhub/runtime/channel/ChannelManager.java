package io.github.drompincen.channelhub.runtime.channel;

import io.github.drompincen.channelhub.persistence.document.ChannelAccountDocument;
import io.github.drompincen.channelhub.persistence.document.ChannelMessageDocument;
import io.github.drompincen.channelhub.persistence.repository.ChannelMessageRepository;
import io.github.drompincen.channelhub.persistence.store.ChannelAccountStore;
import io.github.drompincen.channelhub.protocol.api.ChannelType;
import io.github.drompincen.channelhub.protocol.api.MessageDirection;
import io.github.drompincen.channelhub.protocol.api.PairingStateDto;
import io.github.drompincen.channelhub.runtime.crypto.ChannelSecrets;
import io.github.drompincen.channelhub.runtime.crypto.CredentialVault;
import io.github.drompincen.channelhub.runtime.error.ChannelAlreadyConnectedException;
import io.github.drompincen.channelhub.runtime.error.ChannelException;
import io.github.drompincen.channelhub.runtime.error.ChannelNotFoundException;
import io.github.drompincen.channelhub.runtime.error.ConnectorConnectException;
import io.github.drompincen.channelhub.runtime.error.DeliveryException;
import io.github.drompincen.channelhub.runtime.pairing.PairingStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * Registry of the connector instances that currently exist in this process, keyed by
 * (tenant, channel type, channel id). Registry and handler are process-local: a second instance
 * of the service against the same store would open every channel again.
 */
@Service
public class ChannelManager {

    private static final Logger log = LoggerFactory.getLogger(ChannelManager.class);
    private static final Pattern TELEGRAM_CHAT_ID = Pattern.compile("^-?\\d+$");

    private final ConnectorRegistry registry;
    private final ChannelAccountStore accountStore;
    private final ChannelMessageRepository messageRepository;
    private final CredentialVault vault;
    private final PairingStateStore pairingStates;
    private final Map<ChannelKey, ActiveConnector> connectors = new ConcurrentHashMap<>();
    private volatile ChannelMessageHandler messageHandler;

    public ChannelManager(ConnectorRegistry registry, ChannelAccountStore accountStore,
                          ChannelMessageRepository messageRepository, CredentialVault vault,
                          PairingStateStore pairingStates) {
        this.registry = registry;
        this.accountStore = accountStore;
        this.messageRepository = messageRepository;
        this.vault = vault;
        this.pairingStates = pairingStates;
    }

    /** Last write wins, so a restarted processor can be swapped in without recreating connectors. */
    public void setMessageHandler(ChannelMessageHandler handler) {
        this.messageHandler = handler;
        log.debug("Channel message handler updated");
    }

    public ConnectResult connectChannel(String tenantId, ChannelAccountDocument account, boolean force) {
        return connectChannel(tenantId, account, force, new CancellationToken(),
                e -> log.error("Channel error [{}:{}]: {}", tenantId, account.getId(), e.getMessage()));
    }

    /**
     * Creates and connects a connector for the account. The instance is registered before connect so
     * messages that arrive while the platform handshake completes can be routed, and removed again if
     * connect fails.
     *
     * @throws ChannelAlreadyConnectedException if the key is taken and {@code force} is false
     * @throws ConnectorConnectException        if the connector could not be opened
     */
    public ConnectResult connectChannel(String tenantId, ChannelAccountDocument account, boolean force,
                                        CancellationToken cancellation, Consumer<Throwable> errorCallback) {
        ChannelKey key = new ChannelKey(tenantId, account.getChannelType(), account.getChannelId());
        ChannelConnector connector = registry.create(account.getChannelType());
        ChannelConnectionConfig config = toConnectionConfig(tenantId, account);
        ActiveConnector entry = new ActiveConnector(key, account.getId(), connector);

        ActiveConnector existing = connectors.putIfAbsent(key, entry);
        if (existing != null) {
            if (!force) {
                throw new ChannelAlreadyConnectedException("Channel already connected: " + key);
            }
            disconnectQuietly(existing);
            connectors.put(key, entry);
        }
        log.info("Registered channel {}", key);

        ConnectorListener listener = new ConnectorListener() {
            @Override
            public void onMessage(ChannelMessage message) {
                dispatchInbound(tenantId, account, message);
            }

            @Override
            public void onError(Throwable error) {
                errorCallback.accept(error);
            }

            @Override
            public void onPairingUpdate(PairingStateDto state) {
                pairingStates.put(account.getId(), state);
            }
        };

        try {
            ConnectResult result = connector.connect(config, listener, cancellation);
            log.info("Connected channel {}", key);
            return result;
        } catch (ChannelException e) {
            connectors.remove(key, entry);
            throw e;
        } catch (RuntimeException e) {
            connectors.remove(key, entry);
            throw new ConnectorConnectException("Failed to connect " + key.channelType().id() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Removes the registry entry and disconnects it. The entry is gone even if the connector's
     * disconnect throws; the exception still reaches the caller.
     *
     * @return false if nothing was registered under the key
     */
    public boolean disconnectChannel(String tenantId, ChannelType type, String channelId) {
        ActiveConnector entry = connectors.remove(new ChannelKey(tenantId, type, channelId));
        if (entry == null) return false;
        entry.connector().disconnect();
        log.info("Disconnected channel {}", entry.key());
        return true;
    }

    public Optional<ChannelConnector> getConnector(String tenantId, ChannelType type, String channelId) {
        return Optional.ofNullable(connectors.get(new ChannelKey(tenantId, type, channelId)))
                .map(ActiveConnector::connector);
    }

    /** First connector of that type for the tenant; bot platforms address many chats through one account. */
    public Optional<ChannelConnector> findConnectorByType(String tenantId, ChannelType type) {
        return findEntryByType(tenantId, type).map(ActiveConnector::connector);
    }

    public boolean isConnected(String tenantId, ChannelType type, String channelId) {
        return getConnector(tenantId, type, channelId).map(ChannelConnector::isConnected).orElse(false);
    }

    public List<ChannelKey> getConnectedChannels(String tenantId) {
        List<ChannelKey> keys = new ArrayList<>();
        for (ChannelKey key : connectors.keySet()) {
            if (key.tenantId().equals(tenantId)) keys.add(key);
        }
        return keys;
    }

    public int size() {
        return connectors.size();
    }

    /**
     * Sends through the connector registered for the exact key, falling back to any connector of that
     * type for the tenant (the target id is often a chat rather than the account's channel id).
     * The outbound message is recorded against the owning account.
     */
    public String sendMessage(String tenantId, ChannelType type, String channelId, String targetId,
                              String content, SendOptions options) {
        ChannelKey key = new ChannelKey(tenantId, type, channelId);
        ActiveConnector entry = connectors.get(key);
        if (entry == null) {
            entry = findEntryByType(tenantId, type)
                    .orElseThrow(() -> new ChannelNotFoundException("Channel not connected: " + key));
        }

        String messageId;
        try {
            messageId = entry.connector().send(targetId, content, options != null ? options : SendOptions.none());
        } catch (DeliveryException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new DeliveryException("Send via " + type.id() + " failed: " + e.getMessage(), e);
        }
        record(tenantId, entry.accountRecordId(), MessageDirection.OUTBOUND, messageId, content,
                options != null ? options.threadId() : null, null, null);
        return messageId;
    }

    public void disconnectTenant(String tenantId) {
        for (ActiveConnector entry : List.copyOf(connectors.values())) {
            if (entry.key().tenantId().equals(tenantId) && connectors.remove(entry.key(), entry)) {
                disconnectQuietly(entry);
            }
        }
    }

    public void shutdown() {
        for (ActiveConnector entry : List.copyOf(connectors.values())) {
            connectors.remove(entry.key(), entry);
            disconnectQuietly(entry);
        }
        log.info("Channel manager shut down");
    }

    // ---- Inbound ----

    void dispatchInbound(String tenantId, ChannelAccountDocument account, ChannelMessage message) {
        String accountRecordId = account.getId();
        if (isDuplicate(accountRecordId, message)) {
            log.debug("Skipping duplicate message {} for account {}", message.id(), accountRecordId);
            return;
        }
        record(tenantId, accountRecordId, MessageDirection.INBOUND, message.id(), message.content(),
                message.threadId(), message.senderId(), message.senderName());

        if (account.getChannelType() == ChannelType.TELEGRAM) {
            try {
                rememberTelegramChat(tenantId, accountRecordId, message);
            } catch (RuntimeException e) {
                log.warn("Failed to remember Telegram chat for account {}: {}", accountRecordId, e.getMessage());
            }
        }

        ChannelMessageHandler handler = messageHandler;
        if (handler == null) {
            log.warn("No message handler installed; dropping message from {}", account.getChannelType().id());
            return;
        }
        try {
            handler.handle(tenantId, accountRecordId, message);
        } catch (RuntimeException e) {
            log.error("Message handler failed for account {}: {}", accountRecordId, e.getMessage(), e);
        }
    }

    // an unreachable store must not stop the message; it is treated as new
    private boolean isDuplicate(String accountRecordId, ChannelMessage message) {
        if (message.id() == null) return false;
        try {
            return messageRepository.existsByChannelAccountIdAndExternalMessageIdAndDirection(
                    accountRecordId, message.id(), MessageDirection.INBOUND);
        } catch (RuntimeException e) {
            log.warn("Duplicate check failed for account {}: {}", accountRecordId, e.getMessage());
            return false;
        }
    }

    /** Keeps defaultChatId (first chat seen) and the last inbound chat/sender so proactive sends have a target. */
    private void rememberTelegramChat(String tenantId, String accountRecordId, ChannelMessage message) {
        String chatId = message.channelId();
        if (chatId == null || !TELEGRAM_CHAT_ID.matcher(chatId.trim()).matches()) return;

        accountStore.get(tenantId, accountRecordId).ifPresent(current -> {
            Map<String, Object> config = new LinkedHashMap<>(current.getConfig() != null ? current.getConfig() : Map.of());
            Object defaultChatId = config.get("defaultChatId");
            Map<String, Object> next = new LinkedHashMap<>(config);
            next.put("defaultChatId", defaultChatId != null && !String.valueOf(defaultChatId).isBlank()
                    ? String.valueOf(defaultChatId) : chatId);
            next.put("lastInboundChatId", chatId);
            next.put("lastInboundSenderId", message.senderId());

            if (!sameAsString(config, next, "defaultChatId")
                    || !sameAsString(config, next, "lastInboundChatId")
                    || !sameAsString(config, next, "lastInboundSenderId")) {
                accountStore.updateConfig(accountRecordId, next);
                log.debug("Updated Telegram chat ids for account {}", accountRecordId);
            }
        });
    }

    private static boolean sameAsString(Map<String, Object> a, Map<String, Object> b, String key) {
        return Objects.toString(a.get(key), "").equals(Objects.toString(b.get(key), ""));
    }

    private void record(String tenantId, String accountRecordId, MessageDirection direction, String externalId,
                        String content, String threadId, String senderId, String senderName) {
        try {
            ChannelMessageDocument doc = new ChannelMessageDocument();
            doc.setId(UUID.randomUUID().toString());
            doc.setTenantId(tenantId);
            doc.setChannelAccountId(accountRecordId);
            doc.setExternalMessageId(externalId);
            doc.setDirection(direction);
            doc.setContent(content);
            doc.setContentType("text");
            doc.setThreadId(threadId);
            doc.setSenderId(senderId);
            doc.setSenderName(senderName);
            doc.setTimestamp(Instant.now());
            messageRepository.save(doc);
        } catch (RuntimeException e) {
            log.warn("Failed to record {} message for account {}: {}", direction, accountRecordId, e.getMessage());
        }
    }

    // ---- Helpers ----

    private ChannelConnectionConfig toConnectionConfig(String tenantId, ChannelAccountDocument account) {
        Map<String, Object> settings = new LinkedHashMap<>(ChannelSecrets.open(account.getConfig(), vault));
        settings.put("accountRecordId", account.getId());
        return new ChannelConnectionConfig(
                tenantId,
                account.getId(),
                account.getChannelType(),
                account.getChannelId(),
                account.getAccountId(),
                account.getAccessToken() != null ? vault.decrypt(account.getAccessToken()) : null,
                account.getRefreshToken() != null ? vault.decrypt(account.getRefreshToken()) : null,
                settings);
    }

    private Optional<ActiveConnector> findEntryByType(String tenantId, ChannelType type) {
        return connectors.values().stream()
                .filter(e -> e.key().tenantId().equals(tenantId) && e.key().channelType() == type)
                .findFirst();
    }

    private void disconnectQuietly(ActiveConnector entry) {
        try {
            entry.connector().disconnect();
            log.info("Disconnected channel {}", entry.key());
        } catch (RuntimeException e) {
            log.warn("Error disconnecting {}: {}", entry.key(), e.getMessage());
        }
    }

    private record ActiveConnector(ChannelKey key, String accountRecordId, ChannelConnector connector) {}
}
